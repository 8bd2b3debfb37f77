package com.cred.freestyle.mintdrop.api.dto;

import com.cred.freestyle.mintdrop.domain.model.Reservation;
import com.cred.freestyle.mintdrop.domain.model.Reservation.ReservationStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Reservation as returned to clients.
 *
 * @author Mint Drop Team
 */
public class ReservationDto {

    private String idempotencyKey;
    private String collectionId;
    private String wallet;
    private String status;
    private List<String> itemIds;
    private Integer quantity;
    private String phaseId;
    private Instant createdAt;
    private Instant expiresAt;

    public ReservationDto() {
    }

    /**
     * @param reservation stored reservation
     * @param effectiveStatus status to report, EXPIRED if the window has passed before the sweep
     */
    public static ReservationDto fromEntity(Reservation reservation, ReservationStatus effectiveStatus) {
        ReservationDto dto = new ReservationDto();
        dto.setIdempotencyKey(reservation.getIdempotencyKey());
        dto.setCollectionId(reservation.getCollectionId());
        dto.setWallet(reservation.getWallet());
        dto.setStatus(effectiveStatus.name());
        dto.setItemIds(new ArrayList<>(reservation.getItemIds()));
        dto.setQuantity(reservation.getQuantity());
        dto.setPhaseId(reservation.getPhaseId());
        dto.setCreatedAt(reservation.getCreatedAt());
        dto.setExpiresAt(reservation.getExpiresAt());
        return dto;
    }

    // Getters and setters
    public String getIdempotencyKey() {
        return idempotencyKey;
    }

    public void setIdempotencyKey(String idempotencyKey) {
        this.idempotencyKey = idempotencyKey;
    }

    public String getCollectionId() {
        return collectionId;
    }

    public void setCollectionId(String collectionId) {
        this.collectionId = collectionId;
    }

    public String getWallet() {
        return wallet;
    }

    public void setWallet(String wallet) {
        this.wallet = wallet;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public List<String> getItemIds() {
        return itemIds;
    }

    public void setItemIds(List<String> itemIds) {
        this.itemIds = itemIds;
    }

    public Integer getQuantity() {
        return quantity;
    }

    public void setQuantity(Integer quantity) {
        this.quantity = quantity;
    }

    public String getPhaseId() {
        return phaseId;
    }

    public void setPhaseId(String phaseId) {
        this.phaseId = phaseId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public void setExpiresAt(Instant expiresAt) {
        this.expiresAt = expiresAt;
    }
}
