package com.cred.freestyle.mintdrop.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Append-only record of a confirmed mint. At most one row per ledger signature.
 *
 * @author Mint Drop Team
 */
@Entity
@Table(name = "mint_transactions", indexes = {
    @Index(name = "idx_mint_tx_signature", columnList = "transaction_signature", unique = true),
    @Index(name = "idx_mint_tx_idempotency_key", columnList = "idempotency_key"),
    @Index(name = "idx_mint_tx_buyer", columnList = "buyer_wallet")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MintTransaction {

    @Id
    @Column(name = "mint_transaction_id", nullable = false, length = 36)
    private String mintTransactionId;

    @Column(name = "transaction_signature", nullable = false, unique = true, updatable = false, length = 128)
    private String transactionSignature;

    @Column(name = "idempotency_key", nullable = false, updatable = false, length = 128)
    private String idempotencyKey;

    @Column(name = "collection_id", nullable = false, updatable = false, length = 36)
    private String collectionId;

    @Column(name = "phase_id", nullable = false, updatable = false, length = 36)
    private String phaseId;

    @Column(name = "buyer_wallet", nullable = false, updatable = false, length = 64)
    private String buyerWallet;

    @Column(name = "quantity", nullable = false, updatable = false)
    private Integer quantity;

    /**
     * Item price paid to the creator, in base units.
     */
    @Column(name = "amount_paid_base_units", nullable = false, updatable = false)
    private Long amountPaidBaseUnits;

    @Column(name = "platform_fee_base_units", nullable = false, updatable = false)
    private Long platformFeeBaseUnits;

    @Column(name = "platform_fee_fiat", updatable = false, precision = 12, scale = 2)
    private BigDecimal platformFeeFiat;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (mintTransactionId == null) {
            mintTransactionId = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
