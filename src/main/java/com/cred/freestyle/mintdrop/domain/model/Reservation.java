package com.cred.freestyle.mintdrop.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Idempotency record for a mint: a claim on specific items pending payment confirmation.
 *
 * Lifecycle:
 * - PENDING: items claimed, transaction not built yet
 * - TRANSACTION_READY: unsigned transaction available for the buyer to sign
 * - CONFIRMED: signature recorded, items minted
 * - FAILED: transaction could not be built; items stay held until the sweep
 * - EXPIRED: never confirmed within the expiry window, items released
 *
 * The idempotency key is unique for the lifetime of the record and is never rewritten.
 *
 * @author Mint Drop Team
 */
@Entity
@Table(name = "reservations", indexes = {
    @Index(name = "idx_reservation_idempotency_key", columnList = "idempotency_key", unique = true),
    @Index(name = "idx_reservation_status_expires", columnList = "status, expires_at"),
    @Index(name = "idx_reservation_wallet_phase", columnList = "wallet, phase_id, status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Reservation {

    @Id
    @Column(name = "reservation_id", nullable = false, length = 36)
    private String reservationId;

    @Column(name = "idempotency_key", nullable = false, unique = true, length = 128)
    private String idempotencyKey;

    @Column(name = "collection_id", nullable = false, length = 36)
    private String collectionId;

    @Column(name = "wallet", nullable = false, length = 64)
    private String wallet;

    @Column(name = "phase_id", nullable = false, length = 36)
    private String phaseId;

    @Column(name = "phase_name", length = 100)
    private String phaseName;

    @Column(name = "quantity", nullable = false)
    private Integer quantity;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ReservationStatus status;

    /**
     * Claimed item ids, in allocation (item index) order.
     */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "reservation_items", joinColumns = @JoinColumn(name = "reservation_id"))
    @OrderColumn(name = "position")
    @Column(name = "item_id", length = 36)
    @Builder.Default
    private List<String> itemIds = new ArrayList<>();

    // Price breakdown, frozen at reservation time

    @Column(name = "unit_price", precision = 30, scale = 9)
    private BigDecimal unitPrice;

    @Column(name = "unit_price_base_units")
    private Long unitPriceBaseUnits;

    @Column(name = "items_total_base_units")
    private Long itemsTotalBaseUnits;

    @Column(name = "platform_fee_fiat", precision = 12, scale = 2)
    private BigDecimal platformFeeFiat;

    @Column(name = "platform_fee_base_units")
    private Long platformFeeBaseUnits;

    @Column(name = "fiat_per_coin", precision = 20, scale = 8)
    private BigDecimal fiatPerCoin;

    @Column(name = "rate_source", length = 20)
    private String rateSource;

    @Column(name = "rate_degraded", nullable = false)
    @Builder.Default
    private boolean rateDegraded = false;

    /**
     * Base64 unsigned transaction blob, set when status becomes TRANSACTION_READY.
     */
    @Column(name = "transaction_payload", columnDefinition = "TEXT")
    private String transactionPayload;

    @Column(name = "recent_checkpoint", length = 100)
    private String recentCheckpoint;

    @Column(name = "transaction_signature", length = 128)
    private String transactionSignature;

    @Column(name = "failure_reason", length = 500)
    private String failureReason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(name = "confirmed_at")
    private Instant confirmedAt;

    @Column(name = "expired_at")
    private Instant expiredAt;

    @PrePersist
    protected void onCreate() {
        if (reservationId == null) {
            reservationId = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (status == null) {
            status = ReservationStatus.PENDING;
        }
    }

    /**
     * Whether the reservation still holds its items (not confirmed, not released).
     */
    public boolean isHolding() {
        return status == ReservationStatus.PENDING
                || status == ReservationStatus.TRANSACTION_READY
                || status == ReservationStatus.FAILED;
    }

    /**
     * Expired either by the sweep or by the clock, before the sweep got to it.
     */
    public boolean isExpiredAt(Instant now) {
        return status == ReservationStatus.EXPIRED
                || (isHolding() && !now.isBefore(expiresAt));
    }

    /**
     * Whether a replayed request carries the same parameters as the original.
     */
    public boolean matchesRequest(String collectionId, String wallet, int quantity) {
        return this.collectionId.equals(collectionId)
                && this.wallet.equals(wallet)
                && this.quantity == quantity;
    }

    public void markTransactionReady(String payload) {
        this.transactionPayload = payload;
        this.status = ReservationStatus.TRANSACTION_READY;
    }

    public void markFailed(String reason) {
        this.failureReason = reason;
        this.status = ReservationStatus.FAILED;
    }

    public void confirm(String signature, Instant now) {
        this.transactionSignature = signature;
        this.confirmedAt = now;
        this.status = ReservationStatus.CONFIRMED;
    }

    public void expire(Instant now) {
        this.expiredAt = now;
        this.status = ReservationStatus.EXPIRED;
    }

    public enum ReservationStatus {
        PENDING,
        TRANSACTION_READY,
        CONFIRMED,
        FAILED,
        EXPIRED
    }
}
