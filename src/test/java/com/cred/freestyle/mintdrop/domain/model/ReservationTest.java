package com.cred.freestyle.mintdrop.domain.model;

import com.cred.freestyle.mintdrop.domain.model.Reservation.ReservationStatus;
import com.cred.freestyle.mintdrop.testutil.TestDataBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for Reservation domain model.
 */
@DisplayName("Reservation Domain Model Tests")
class ReservationTest {

    private static final Instant CREATED = Instant.parse("2026-03-01T12:00:00Z");

    private Reservation pending() {
        return TestDataBuilder.pendingReservation("key-0001", "col-1", TestDataBuilder.wallet(1), CREATED);
    }

    @Test
    @DisplayName("Should hold items while pending, transaction-ready or failed")
    void shouldHoldItemsUntilConfirmedOrExpired() {
        // Given
        Reservation reservation = pending();

        // Then
        assertThat(reservation.isHolding()).isTrue();
        reservation.markTransactionReady("blob");
        assertThat(reservation.isHolding()).isTrue();
        reservation.setStatus(ReservationStatus.FAILED);
        assertThat(reservation.isHolding()).isTrue();
        reservation.setStatus(ReservationStatus.CONFIRMED);
        assertThat(reservation.isHolding()).isFalse();
        reservation.setStatus(ReservationStatus.EXPIRED);
        assertThat(reservation.isHolding()).isFalse();
    }

    @Test
    @DisplayName("Should report expired exactly at expiresAt, before the sweep runs")
    void shouldDetectExpiryByClock() {
        // Given
        Reservation reservation = pending();
        Instant expiresAt = reservation.getExpiresAt();

        // Then
        assertThat(reservation.isExpiredAt(expiresAt.minusMillis(1))).isFalse();
        assertThat(reservation.isExpiredAt(expiresAt)).isTrue();
        assertThat(reservation.isExpiredAt(expiresAt.plus(1, ChronoUnit.HOURS))).isTrue();
    }

    @Test
    @DisplayName("Should never report a confirmed reservation as expired")
    void shouldNotExpireConfirmedReservation() {
        // Given
        Reservation reservation = pending();

        // When
        reservation.confirm("sig-1", CREATED.plusSeconds(30));

        // Then
        assertThat(reservation.getStatus()).isEqualTo(ReservationStatus.CONFIRMED);
        assertThat(reservation.getTransactionSignature()).isEqualTo("sig-1");
        assertThat(reservation.getConfirmedAt()).isEqualTo(CREATED.plusSeconds(30));
        assertThat(reservation.isExpiredAt(CREATED.plus(1, ChronoUnit.DAYS))).isFalse();
    }

    @Test
    @DisplayName("Should mark expired with the sweep time")
    void shouldExpireReservation() {
        // Given
        Reservation reservation = pending();
        Instant sweptAt = reservation.getExpiresAt().plusSeconds(5);

        // When
        reservation.expire(sweptAt);

        // Then
        assertThat(reservation.getStatus()).isEqualTo(ReservationStatus.EXPIRED);
        assertThat(reservation.getExpiredAt()).isEqualTo(sweptAt);
        assertThat(reservation.isExpiredAt(CREATED)).isTrue();
    }

    @Test
    @DisplayName("Should record the failure reason when marked failed")
    void shouldMarkFailed() {
        // Given
        Reservation reservation = pending();

        // When
        reservation.markFailed("bad creator wallet");

        // Then
        assertThat(reservation.getStatus()).isEqualTo(ReservationStatus.FAILED);
        assertThat(reservation.getFailureReason()).isEqualTo("bad creator wallet");
    }

    @Test
    @DisplayName("Should match a replay only with the same collection, wallet and quantity")
    void shouldMatchReplayParameters() {
        // Given
        Reservation reservation = pending();
        String wallet = TestDataBuilder.wallet(1);

        // Then
        assertThat(reservation.matchesRequest("col-1", wallet, 1)).isTrue();
        assertThat(reservation.matchesRequest("col-1", wallet, 2)).isFalse();
        assertThat(reservation.matchesRequest("col-2", wallet, 1)).isFalse();
        assertThat(reservation.matchesRequest("col-1", TestDataBuilder.wallet(2), 1)).isFalse();
    }
}
