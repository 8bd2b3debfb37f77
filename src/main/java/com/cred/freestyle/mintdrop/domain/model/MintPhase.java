package com.cred.freestyle.mintdrop.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

/**
 * A priced, time-boxed sale window of a collection.
 * Windows are half-open: [start_time, end_time). A null end_time means open-ended.
 *
 * Allow-listed phases keep their eligible wallets and the Merkle root committed over them.
 * Requests prove membership against the root, never against the raw list.
 *
 * @author Mint Drop Team
 */
@Entity
@Table(name = "mint_phases", indexes = {
    @Index(name = "idx_phase_collection_start", columnList = "collection_id, start_time")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MintPhase {

    @Id
    @Column(name = "phase_id", nullable = false, length = 36)
    private String phaseId;

    @Column(name = "collection_id", nullable = false, length = 36)
    private String collectionId;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    /**
     * Unit price in whole coins (may be zero).
     */
    @Column(name = "price", nullable = false, precision = 30, scale = 9)
    private BigDecimal price;

    @Column(name = "start_time", nullable = false)
    private Instant startTime;

    @Column(name = "end_time")
    private Instant endTime;

    @Column(name = "is_allow_list", nullable = false)
    @Builder.Default
    private boolean allowList = false;

    /**
     * Max items one wallet may hold reserved or minted in this phase. Null means unlimited.
     */
    @Column(name = "mint_limit")
    private Integer mintLimit;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "mint_phase_allowlist", joinColumns = @JoinColumn(name = "phase_id"))
    @Column(name = "wallet_address", length = 64)
    @Builder.Default
    private Set<String> allowListWallets = new HashSet<>();

    /**
     * Hex-encoded Merkle root over allowListWallets (0x-prefixed).
     */
    @Column(name = "merkle_root", length = 66)
    private String merkleRoot;

    @PrePersist
    protected void onCreate() {
        if (phaseId == null) {
            phaseId = UUID.randomUUID().toString();
        }
    }

    /**
     * @return true if now falls in [startTime, endTime)
     */
    public boolean isOpenAt(Instant now) {
        if (now.isBefore(startTime)) {
            return false;
        }
        return endTime == null || now.isBefore(endTime);
    }
}
