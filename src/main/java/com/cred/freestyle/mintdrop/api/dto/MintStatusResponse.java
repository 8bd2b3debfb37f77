package com.cred.freestyle.mintdrop.api.dto;

import com.cred.freestyle.mintdrop.domain.model.Reservation;
import com.cred.freestyle.mintdrop.domain.model.Reservation.ReservationStatus;
import com.cred.freestyle.mintdrop.service.ReservationView;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Status lookup by idempotency key. The unsigned transaction is included only while it can still be signed.
 *
 * @author Mint Drop Team
 */
public class MintStatusResponse {

    private String idempotencyKey;
    private String status;
    private String transaction;
    private List<String> itemIds;
    private Instant expiresAt;
    private String transactionSignature;
    private String failureReason;

    public MintStatusResponse() {
    }

    public static MintStatusResponse fromView(ReservationView view) {
        Reservation reservation = view.reservation();
        MintStatusResponse response = new MintStatusResponse();
        response.setIdempotencyKey(reservation.getIdempotencyKey());
        response.setStatus(view.effectiveStatus().name());
        if (view.effectiveStatus() == ReservationStatus.TRANSACTION_READY) {
            response.setTransaction(reservation.getTransactionPayload());
        }
        response.setItemIds(new ArrayList<>(reservation.getItemIds()));
        response.setExpiresAt(reservation.getExpiresAt());
        response.setTransactionSignature(reservation.getTransactionSignature());
        response.setFailureReason(reservation.getFailureReason());
        return response;
    }

    // Getters and setters
    public String getIdempotencyKey() {
        return idempotencyKey;
    }

    public void setIdempotencyKey(String idempotencyKey) {
        this.idempotencyKey = idempotencyKey;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getTransaction() {
        return transaction;
    }

    public void setTransaction(String transaction) {
        this.transaction = transaction;
    }

    public List<String> getItemIds() {
        return itemIds;
    }

    public void setItemIds(List<String> itemIds) {
        this.itemIds = itemIds;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public void setExpiresAt(Instant expiresAt) {
        this.expiresAt = expiresAt;
    }

    public String getTransactionSignature() {
        return transactionSignature;
    }

    public void setTransactionSignature(String transactionSignature) {
        this.transactionSignature = transactionSignature;
    }

    public String getFailureReason() {
        return failureReason;
    }

    public void setFailureReason(String failureReason) {
        this.failureReason = failureReason;
    }
}
