package com.cred.freestyle.mintdrop.api.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Request DTO for reserving items of a collection.
 *
 * @author Mint Drop Team
 */
public class MintReserveRequest {

    @NotBlank(message = "Collection ID is required")
    private String collectionId;

    @NotNull(message = "Quantity is required")
    @Min(value = 1, message = "Quantity must be at least 1")
    @Max(value = 20, message = "Quantity must be at most 20")
    private Integer quantity;

    @NotBlank(message = "Wallet is required")
    private String wallet;

    @NotBlank(message = "Idempotency key is required")
    @Size(min = 8, max = 128, message = "Idempotency key must be 8 to 128 characters")
    @Pattern(regexp = "^[A-Za-z0-9:_-]+$", message = "Idempotency key may only contain letters, digits, ':', '_' and '-'")
    private String idempotencyKey;

    private String phaseId;

    private List<String> allowlistProof;

    public MintReserveRequest() {
    }

    public MintReserveRequest(String collectionId, Integer quantity, String wallet, String idempotencyKey) {
        this.collectionId = collectionId;
        this.quantity = quantity;
        this.wallet = wallet;
        this.idempotencyKey = idempotencyKey;
    }

    // Getters and setters
    public String getCollectionId() {
        return collectionId;
    }

    public void setCollectionId(String collectionId) {
        this.collectionId = collectionId;
    }

    public Integer getQuantity() {
        return quantity;
    }

    public void setQuantity(Integer quantity) {
        this.quantity = quantity;
    }

    public String getWallet() {
        return wallet;
    }

    public void setWallet(String wallet) {
        this.wallet = wallet;
    }

    public String getIdempotencyKey() {
        return idempotencyKey;
    }

    public void setIdempotencyKey(String idempotencyKey) {
        this.idempotencyKey = idempotencyKey;
    }

    public String getPhaseId() {
        return phaseId;
    }

    public void setPhaseId(String phaseId) {
        this.phaseId = phaseId;
    }

    public List<String> getAllowlistProof() {
        return allowlistProof;
    }

    public void setAllowlistProof(List<String> allowlistProof) {
        this.allowlistProof = allowlistProof;
    }
}
