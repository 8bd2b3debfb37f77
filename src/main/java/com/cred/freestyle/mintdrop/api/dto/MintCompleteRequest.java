package com.cred.freestyle.mintdrop.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Request DTO for completing a mint with the buyer's confirmed ledger signature.
 * itemIds is optional; when present it must match the reserved items exactly.
 *
 * @author Mint Drop Team
 */
public class MintCompleteRequest {

    @NotBlank(message = "Idempotency key is required")
    private String idempotencyKey;

    @NotBlank(message = "Signature is required")
    @Size(max = 128, message = "Signature must be at most 128 characters")
    private String signature;

    @NotBlank(message = "Wallet is required")
    private String wallet;

    private List<String> itemIds;

    public MintCompleteRequest() {
    }

    public MintCompleteRequest(String idempotencyKey, String signature, String wallet) {
        this.idempotencyKey = idempotencyKey;
        this.signature = signature;
        this.wallet = wallet;
    }

    // Getters and setters
    public String getIdempotencyKey() {
        return idempotencyKey;
    }

    public void setIdempotencyKey(String idempotencyKey) {
        this.idempotencyKey = idempotencyKey;
    }

    public String getSignature() {
        return signature;
    }

    public void setSignature(String signature) {
        this.signature = signature;
    }

    public String getWallet() {
        return wallet;
    }

    public void setWallet(String wallet) {
        this.wallet = wallet;
    }

    public List<String> getItemIds() {
        return itemIds;
    }

    public void setItemIds(List<String> itemIds) {
        this.itemIds = itemIds;
    }
}
