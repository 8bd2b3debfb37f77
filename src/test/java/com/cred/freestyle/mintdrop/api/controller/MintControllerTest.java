package com.cred.freestyle.mintdrop.api.controller;

import com.cred.freestyle.mintdrop.api.exception.GlobalExceptionHandler;
import com.cred.freestyle.mintdrop.domain.model.Item;
import com.cred.freestyle.mintdrop.domain.model.Item.ItemState;
import com.cred.freestyle.mintdrop.domain.model.MintTransaction;
import com.cred.freestyle.mintdrop.domain.model.Reservation;
import com.cred.freestyle.mintdrop.domain.model.Reservation.ReservationStatus;
import com.cred.freestyle.mintdrop.exception.*;
import com.cred.freestyle.mintdrop.infrastructure.metrics.MintMetricsService;
import com.cred.freestyle.mintdrop.repository.MintInventoryStore.ConfirmedMint;
import com.cred.freestyle.mintdrop.service.MintService;
import com.cred.freestyle.mintdrop.service.ReservationView;
import com.cred.freestyle.mintdrop.testutil.TestDataBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for MintController using MockMvc.
 * Tests HTTP layer in isolation with mocked service dependencies.
 */
@WebMvcTest(MintController.class)
@ContextConfiguration(classes = {MintController.class, GlobalExceptionHandler.class})
@DisplayName("MintController Tests")
class MintControllerTest {

    private static final Instant CREATED = Instant.parse("2026-03-01T13:00:00Z");
    private static final String WALLET = TestDataBuilder.wallet(1);

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private MintService mintService;

    @MockBean
    private MintMetricsService metricsService;

    private Reservation readyReservation() {
        Reservation reservation = TestDataBuilder.pendingReservation("key-00000001", "col-1", WALLET, CREATED);
        reservation.markTransactionReady("dHgtYmxvYg==");
        return reservation;
    }

    private String reserveBody(String key) {
        return """
                {
                    "collectionId": "col-1",
                    "quantity": 1,
                    "wallet": "%s",
                    "idempotencyKey": "%s"
                }
                """.formatted(WALLET, key);
    }

    // ========================================
    // POST /api/v1/mints/reserve Tests
    // ========================================

    @Test
    @DisplayName("POST /reserve - New reservation returns 201 with price breakdown and transaction")
    void reserve_NewReservation_Returns201() throws Exception {
        // Given
        Reservation reservation = readyReservation();
        when(mintService.reserve("col-1", 1, WALLET, "key-00000001", null, null))
                .thenReturn(new ReservationView(reservation, ReservationStatus.TRANSACTION_READY, false));

        // When / Then
        mockMvc.perform(post("/api/v1/mints/reserve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(reserveBody("key-00000001")))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.reservation.idempotencyKey").value("key-00000001"))
                .andExpect(jsonPath("$.reservation.status").value("TRANSACTION_READY"))
                .andExpect(jsonPath("$.reservation.itemIds", hasSize(1)))
                .andExpect(jsonPath("$.priceBreakdown.platformFeeBaseUnits").value(12_500_000))
                .andExpect(jsonPath("$.priceBreakdown.totalBaseUnits").value(512_500_000))
                .andExpect(jsonPath("$.transaction").value("dHgtYmxvYg=="))
                .andExpect(jsonPath("$.replay").value(false));

        verify(metricsService).recordReserveLatency(anyLong());
    }

    @Test
    @DisplayName("POST /reserve - Replayed key returns 200 with the original reservation")
    void reserve_Replay_Returns200() throws Exception {
        // Given
        when(mintService.reserve("col-1", 1, WALLET, "key-00000001", null, null))
                .thenReturn(new ReservationView(readyReservation(), ReservationStatus.TRANSACTION_READY, true));

        // When / Then
        mockMvc.perform(post("/api/v1/mints/reserve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(reserveBody("key-00000001")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.replay").value(true));
    }

    @Test
    @DisplayName("POST /reserve - Phase id and allow-list proof are passed through")
    void reserve_WithProof_PassesThrough() throws Exception {
        // Given
        String requestBody = """
                {
                    "collectionId": "col-1",
                    "quantity": 1,
                    "wallet": "%s",
                    "idempotencyKey": "key-00000002",
                    "phaseId": "phase-og",
                    "allowlistProof": ["0xaa", "0xbb"]
                }
                """.formatted(WALLET);
        when(mintService.reserve("col-1", 1, WALLET, "key-00000002", "phase-og", List.of("0xaa", "0xbb")))
                .thenReturn(new ReservationView(readyReservation(), ReservationStatus.TRANSACTION_READY, false));

        // When / Then
        mockMvc.perform(post("/api/v1/mints/reserve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(requestBody))
                .andExpect(status().isCreated());
    }

    @Test
    @DisplayName("POST /reserve - Missing wallet and bad quantity return 400 with field errors")
    void reserve_InvalidBody_Returns400() throws Exception {
        // Given
        String requestBody = """
                {
                    "collectionId": "col-1",
                    "quantity": 0,
                    "idempotencyKey": "key-00000001"
                }
                """;

        // When / Then
        mockMvc.perform(post("/api/v1/mints/reserve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(requestBody))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.details.fieldErrors.wallet").exists())
                .andExpect(jsonPath("$.details.fieldErrors.quantity").exists());

        verify(mintService, never()).reserve(any(), anyInt(), any(), any(), any(), any());
    }

    @Test
    @DisplayName("POST /reserve - Idempotency key with illegal characters returns 400")
    void reserve_BadIdempotencyKey_Returns400() throws Exception {
        mockMvc.perform(post("/api/v1/mints/reserve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(reserveBody("bad key!")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.fieldErrors.idempotencyKey").exists());
    }

    @Test
    @DisplayName("POST /reserve - Malformed JSON returns 400")
    void reserve_MalformedJson_Returns400() throws Exception {
        mockMvc.perform(post("/api/v1/mints/reserve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{ not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }

    @Test
    @DisplayName("POST /reserve - Insufficient supply returns 409 with quantities")
    void reserve_InsufficientSupply_Returns409() throws Exception {
        // Given
        when(mintService.reserve(anyString(), anyInt(), anyString(), anyString(), any(), any()))
                .thenThrow(new InsufficientSupplyException("col-1", 1, 0));

        // When / Then
        mockMvc.perform(post("/api/v1/mints/reserve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(reserveBody("key-00000001")))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("INSUFFICIENT_SUPPLY"))
                .andExpect(jsonPath("$.details.requestedQuantity").value(1))
                .andExpect(jsonPath("$.details.availableQuantity").value(0));
    }

    @Test
    @DisplayName("POST /reserve - Not allow-listed returns 403")
    void reserve_NotAllowlisted_Returns403() throws Exception {
        // Given
        when(mintService.reserve(anyString(), anyInt(), anyString(), anyString(), any(), any()))
                .thenThrow(new NotAllowlistedException(WALLET, "phase-og"));

        // When / Then
        mockMvc.perform(post("/api/v1/mints/reserve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(reserveBody("key-00000001")))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("NOT_ALLOWLISTED"))
                .andExpect(jsonPath("$.details.phaseId").value("phase-og"));
    }

    @Test
    @DisplayName("POST /reserve - Idempotency conflict returns 409")
    void reserve_IdempotencyConflict_Returns409() throws Exception {
        // Given
        when(mintService.reserve(anyString(), anyInt(), anyString(), anyString(), any(), any()))
                .thenThrow(new IdempotencyConflictException("key-00000001", "different request"));

        // When / Then
        mockMvc.perform(post("/api/v1/mints/reserve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(reserveBody("key-00000001")))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("IDEMPOTENCY_CONFLICT"));
    }

    @Test
    @DisplayName("POST /reserve - Ledger unreachable returns 503 with Retry-After")
    void reserve_UpstreamUnavailable_Returns503() throws Exception {
        // Given
        when(mintService.reserve(anyString(), anyInt(), anyString(), anyString(), any(), any()))
                .thenThrow(new UpstreamUnavailableException("ledger", "connection refused"));

        // When / Then
        mockMvc.perform(post("/api/v1/mints/reserve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(reserveBody("key-00000001")))
                .andExpect(status().isServiceUnavailable())
                .andExpect(header().string("Retry-After", "5"))
                .andExpect(jsonPath("$.retryable").value(true))
                .andExpect(jsonPath("$.details.upstream").value("ledger"));
    }

    // ========================================
    // POST /api/v1/mints/complete Tests
    // ========================================

    @Test
    @DisplayName("POST /complete - Confirmed payment returns 200 with minted items")
    void complete_Success_Returns200() throws Exception {
        // Given
        String requestBody = """
                {
                    "idempotencyKey": "key-00000001",
                    "signature": "sig-0001",
                    "wallet": "%s"
                }
                """.formatted(WALLET);
        Item minted = Item.builder()
                .itemId("col-1-item-0")
                .collectionId("col-1")
                .name("Item #0")
                .itemIndex(0)
                .state(ItemState.MINTED)
                .ownerWallet(WALLET)
                .mintSignature("sig-0001")
                .build();
        MintTransaction transaction = MintTransaction.builder()
                .transactionSignature("sig-0001")
                .idempotencyKey("key-00000001")
                .collectionId("col-1")
                .quantity(1)
                .build();
        when(mintService.complete("key-00000001", "sig-0001", WALLET, null))
                .thenReturn(new ConfirmedMint(transaction, List.of(minted), false));

        // When / Then
        mockMvc.perform(post("/api/v1/mints/complete")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(requestBody))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.transactionSignature").value("sig-0001"))
                .andExpect(jsonPath("$.mintedItems", hasSize(1)))
                .andExpect(jsonPath("$.mintedItems[0].itemId").value("col-1-item-0"))
                .andExpect(jsonPath("$.replay").value(false));

        verify(metricsService).recordCompleteLatency(anyLong());
    }

    @Test
    @DisplayName("POST /complete - Missing signature returns 400")
    void complete_MissingSignature_Returns400() throws Exception {
        // Given
        String requestBody = """
                {
                    "idempotencyKey": "key-00000001",
                    "wallet": "%s"
                }
                """.formatted(WALLET);

        // When / Then
        mockMvc.perform(post("/api/v1/mints/complete")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(requestBody))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.fieldErrors.signature").exists());

        verify(mintService, never()).complete(any(), any(), any(), any());
    }

    @Test
    @DisplayName("POST /complete - Expired reservation returns 410 Gone")
    void complete_Expired_Returns410() throws Exception {
        // Given
        String requestBody = """
                {
                    "idempotencyKey": "key-00000001",
                    "signature": "sig-0001",
                    "wallet": "%s"
                }
                """.formatted(WALLET);
        when(mintService.complete(eq("key-00000001"), eq("sig-0001"), eq(WALLET), any()))
                .thenThrow(new ReservationExpiredException("key-00000001", CREATED.plusSeconds(600)));

        // When / Then
        mockMvc.perform(post("/api/v1/mints/complete")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(requestBody))
                .andExpect(status().isGone())
                .andExpect(jsonPath("$.code").value("RESERVATION_EXPIRED"))
                .andExpect(jsonPath("$.details.idempotencyKey").value("key-00000001"));
    }

    @Test
    @DisplayName("POST /complete - Invariant violation returns 500 without internals")
    void complete_InvariantViolation_Returns500() throws Exception {
        // Given
        String requestBody = """
                {
                    "idempotencyKey": "key-00000001",
                    "signature": "sig-0001",
                    "wallet": "%s"
                }
                """.formatted(WALLET);
        when(mintService.complete(any(), any(), any(), any()))
                .thenThrow(new InvariantViolationException("Reservation key-00000001 holds 0 items"));

        // When / Then
        mockMvc.perform(post("/api/v1/mints/complete")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(requestBody))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("INVARIANT_VIOLATION"))
                .andExpect(jsonPath("$.message", not(containsString("holds"))));
    }

    // ========================================
    // GET /api/v1/mints/status/{key} Tests
    // ========================================

    @Test
    @DisplayName("GET /status - Transaction-ready reservation includes the transaction")
    void getStatus_Ready_IncludesTransaction() throws Exception {
        // Given
        when(mintService.getStatus("key-00000001"))
                .thenReturn(new ReservationView(readyReservation(), ReservationStatus.TRANSACTION_READY, false));

        // When / Then
        mockMvc.perform(get("/api/v1/mints/status/key-00000001"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("TRANSACTION_READY"))
                .andExpect(jsonPath("$.transaction").value("dHgtYmxvYg=="));
    }

    @Test
    @DisplayName("GET /status - Expired reservation omits the transaction")
    void getStatus_Expired_OmitsTransaction() throws Exception {
        // Given
        when(mintService.getStatus("key-00000001"))
                .thenReturn(new ReservationView(readyReservation(), ReservationStatus.EXPIRED, false));

        // When / Then
        mockMvc.perform(get("/api/v1/mints/status/key-00000001"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("EXPIRED"))
                .andExpect(jsonPath("$.transaction").doesNotExist());
    }

    @Test
    @DisplayName("GET /status - Unknown key returns 404")
    void getStatus_Unknown_Returns404() throws Exception {
        // Given
        when(mintService.getStatus("key-missing")).thenThrow(new ReservationNotFoundException("key-missing"));

        // When / Then
        mockMvc.perform(get("/api/v1/mints/status/key-missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }
}
