package com.cred.freestyle.mintdrop.service;

import com.cred.freestyle.mintdrop.domain.model.DropCollection;
import com.cred.freestyle.mintdrop.domain.model.Reservation;
import com.cred.freestyle.mintdrop.exception.MintValidationException;
import com.cred.freestyle.mintdrop.service.TransactionBuilder.InstructionKind;
import com.cred.freestyle.mintdrop.service.TransactionBuilder.TransferInstruction;
import com.cred.freestyle.mintdrop.service.TransactionBuilder.UnsignedTransaction;
import com.cred.freestyle.mintdrop.testutil.TestDataBuilder;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for TransactionBuilder.
 */
@DisplayName("TransactionBuilder Unit Tests")
class TransactionBuilderTest {

    private static final String CHECKPOINT = TestDataBuilder.wallet(77);

    private TransactionBuilder builder;
    private DropCollection collection;
    private Reservation reservation;
    private String buyer;

    @BeforeEach
    void setUp() {
        builder = new TransactionBuilder(new ObjectMapper(), TestDataBuilder.PLATFORM_WALLET);
        collection = TestDataBuilder.activeCollection("col-1", 10);
        buyer = TestDataBuilder.wallet(1);
        reservation = TestDataBuilder.pendingReservation("key-0001", "col-1", buyer,
                Instant.parse("2026-03-01T12:00:00Z"));
        reservation.setQuantity(3);
    }

    @Test
    @DisplayName("build - Fee to the platform, then price x quantity to the creator")
    void build_FeeAndCreatorPayment() {
        // When
        String blob = builder.build(reservation, collection, buyer, 500_000_000L, 12_500_000L, CHECKPOINT);
        UnsignedTransaction transaction = builder.decode(blob);

        // Then
        assertThat(transaction.version()).isEqualTo(TransactionBuilder.FORMAT_VERSION);
        assertThat(transaction.feePayer()).isEqualTo(buyer);
        assertThat(transaction.recentCheckpoint()).isEqualTo(CHECKPOINT);
        assertThat(transaction.memo()).isEqualTo("mint:key-0001");
        assertThat(transaction.instructions()).containsExactly(
                new TransferInstruction(InstructionKind.PLATFORM_FEE, buyer, TestDataBuilder.PLATFORM_WALLET, 12_500_000L),
                new TransferInstruction(InstructionKind.CREATOR_PAYMENT, buyer, TestDataBuilder.CREATOR_WALLET, 1_500_000_000L)
        );
    }

    @Test
    @DisplayName("build - Zero-price phase carries only the platform fee instruction")
    void build_ZeroPriceOnlyPlatformFee() {
        // When
        String blob = builder.build(reservation, collection, buyer, 0L, 12_500_000L, CHECKPOINT);
        UnsignedTransaction transaction = builder.decode(blob);

        // Then
        assertThat(transaction.instructions())
                .extracting(TransferInstruction::kind)
                .containsExactly(InstructionKind.PLATFORM_FEE);
    }

    @Test
    @DisplayName("build - Same inputs give the same blob")
    void build_Deterministic() {
        String first = builder.build(reservation, collection, buyer, 1L, 2L, CHECKPOINT);
        String second = builder.build(reservation, collection, buyer, 1L, 2L, CHECKPOINT);

        assertThat(first).isEqualTo(second);
    }

    @Test
    @DisplayName("build - Invalid creator wallet is rejected")
    void build_InvalidCreatorWallet() {
        // Given
        collection.setCreatorWallet("not-a-wallet");

        // When / Then
        assertThatThrownBy(() -> builder.build(reservation, collection, buyer, 1L, 1L, CHECKPOINT))
                .isInstanceOf(MintValidationException.class);
    }

    @Test
    @DisplayName("build - Missing checkpoint is rejected")
    void build_MissingCheckpoint() {
        assertThatThrownBy(() -> builder.build(reservation, collection, buyer, 1L, 1L, " "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("build - Misconfigured platform wallet fails loudly")
    void build_MisconfiguredPlatformWallet() {
        // Given
        TransactionBuilder misconfigured = new TransactionBuilder(new ObjectMapper(), "nope");

        // When / Then
        assertThatThrownBy(() -> misconfigured.build(reservation, collection, buyer, 1L, 1L, CHECKPOINT))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("decode - Garbage is a validation error")
    void decode_Garbage() {
        assertThatThrownBy(() -> builder.decode("%%%"))
                .isInstanceOf(MintValidationException.class);
    }
}
