package com.cred.freestyle.mintdrop.infrastructure.messaging.events;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Request for the on-chain issuance of items whose payment has been confirmed.
 * Consumed by a batch minter outside this service.
 *
 * @author Mint Drop Team
 */
public class AssetIssuanceRequest {

    private String collectionId;
    private String collectionAddress;
    private String ownerWallet;
    private String paymentSignature;
    private List<IssuedItem> items;
    private Instant requestedAt;

    public AssetIssuanceRequest() {
    }

    public AssetIssuanceRequest(
            String collectionId,
            String collectionAddress,
            String ownerWallet,
            String paymentSignature,
            List<IssuedItem> items,
            Instant requestedAt
    ) {
        this.collectionId = collectionId;
        this.collectionAddress = collectionAddress;
        this.ownerWallet = ownerWallet;
        this.paymentSignature = paymentSignature;
        this.items = new ArrayList<>(items);
        this.requestedAt = requestedAt;
    }

    public String getCollectionId() {
        return collectionId;
    }

    public void setCollectionId(String collectionId) {
        this.collectionId = collectionId;
    }

    public String getCollectionAddress() {
        return collectionAddress;
    }

    public void setCollectionAddress(String collectionAddress) {
        this.collectionAddress = collectionAddress;
    }

    public String getOwnerWallet() {
        return ownerWallet;
    }

    public void setOwnerWallet(String ownerWallet) {
        this.ownerWallet = ownerWallet;
    }

    public String getPaymentSignature() {
        return paymentSignature;
    }

    public void setPaymentSignature(String paymentSignature) {
        this.paymentSignature = paymentSignature;
    }

    public List<IssuedItem> getItems() {
        return items;
    }

    public void setItems(List<IssuedItem> items) {
        this.items = items;
    }

    public Instant getRequestedAt() {
        return requestedAt;
    }

    public void setRequestedAt(Instant requestedAt) {
        this.requestedAt = requestedAt;
    }

    public record IssuedItem(String itemId, Integer itemIndex, String name, String imageUri) {}
}
