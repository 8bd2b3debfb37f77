package com.cred.freestyle.mintdrop.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * One unit of a collection's finite inventory.
 *
 * State machine:
 * - UNSOLD -> RESERVED (reservation allocator)
 * - RESERVED -> MINTED (fulfillment recorder)
 * - RESERVED -> UNSOLD (expiry sweep)
 *
 * owner_wallet and mint_signature are only ever set on the transition into MINTED.
 *
 * @author Mint Drop Team
 */
@Entity
@Table(name = "items",
    uniqueConstraints = @UniqueConstraint(name = "uk_item_collection_index", columnNames = {"collection_id", "item_index"}),
    indexes = {
        @Index(name = "idx_item_collection_state_index", columnList = "collection_id, state, item_index"),
        @Index(name = "idx_item_reservation_key", columnList = "reservation_key"),
        @Index(name = "idx_item_mint_signature", columnList = "mint_signature")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Item {

    @Id
    @Column(name = "item_id", nullable = false, length = 36)
    private String itemId;

    @Column(name = "collection_id", nullable = false, length = 36)
    private String collectionId;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "image_uri", length = 500)
    private String imageUri;

    /**
     * Ordinal within the collection. Allocation always takes the lowest unsold indexes first.
     */
    @Column(name = "item_index", nullable = false)
    private Integer itemIndex;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 20)
    private ItemState state;

    /**
     * Idempotency key of the reservation holding this item. Kept after minting for audit.
     */
    @Column(name = "reservation_key", length = 128)
    private String reservationKey;

    @Column(name = "owner_wallet", length = 64)
    private String ownerWallet;

    @Column(name = "mint_signature", length = 128)
    private String mintSignature;

    @Column(name = "reserved_at")
    private Instant reservedAt;

    @Column(name = "minted_at")
    private Instant mintedAt;

    @PrePersist
    protected void onCreate() {
        if (itemId == null) {
            itemId = UUID.randomUUID().toString();
        }
        if (state == null) {
            state = ItemState.UNSOLD;
        }
    }

    public enum ItemState {
        UNSOLD,
        RESERVED,
        MINTED
    }
}
