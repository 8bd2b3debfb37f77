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
 * A limited-edition drop with a fixed supply of items.
 *
 * total_supply never changes after creation. minted_count is only a cache
 * refreshed periodically from item state; authoritative counts are always
 * derived by counting {@link Item} rows.
 *
 * @author Mint Drop Team
 */
@Entity
@Table(name = "collections", indexes = {
    @Index(name = "idx_collection_address", columnList = "collection_address", unique = true),
    @Index(name = "idx_collection_status", columnList = "status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DropCollection {

    @Id
    @Column(name = "collection_id", nullable = false, length = 36)
    private String collectionId;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    /**
     * Ledger address identifying the collection on-chain.
     */
    @Column(name = "collection_address", nullable = false, unique = true, length = 64)
    private String collectionAddress;

    /**
     * Wallet that receives the item price.
     */
    @Column(name = "creator_wallet", nullable = false, length = 64)
    private String creatorWallet;

    /**
     * Royalty percentage, e.g. 5.00.
     */
    @Column(name = "royalty_percentage", nullable = false, precision = 5, scale = 2)
    @Builder.Default
    private BigDecimal royaltyPercentage = BigDecimal.ZERO;

    @Column(name = "total_supply", nullable = false, updatable = false)
    private Integer totalSupply;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private CollectionStatus status;

    /**
     * Denormalized minted count. Display only, never used for allocation.
     */
    @Column(name = "minted_count", nullable = false)
    @Builder.Default
    private Integer mintedCount = 0;

    @Column(name = "minted_count_refreshed_at")
    private Instant mintedCountRefreshedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (collectionId == null) {
            collectionId = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (status == null) {
            status = CollectionStatus.DRAFT;
        }
    }

    public boolean isActive() {
        return status == CollectionStatus.ACTIVE;
    }

    public enum CollectionStatus {
        DRAFT,
        ACTIVE,
        COMPLETED,
        ARCHIVED
    }
}
