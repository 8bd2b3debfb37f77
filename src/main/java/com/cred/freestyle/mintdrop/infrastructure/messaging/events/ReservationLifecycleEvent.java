package com.cred.freestyle.mintdrop.infrastructure.messaging.events;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Reservation lifecycle event published to Kafka, keyed by collection id.
 *
 * Event Types:
 * - RESERVED: items claimed, unsigned transaction handed to the buyer
 * - CONFIRMED: signature recorded, items minted to the buyer
 * - EXPIRED: reservation swept, items back to unsold
 *
 * @author Mint Drop Team
 */
public class ReservationLifecycleEvent {

    private String idempotencyKey;
    private String collectionId;
    private String wallet;
    private Integer quantity;
    private List<String> itemIds;
    private String transactionSignature;
    private EventType eventType;
    private Instant timestamp;

    /**
     * Default constructor for deserialization.
     */
    public ReservationLifecycleEvent() {
    }

    public ReservationLifecycleEvent(
            String idempotencyKey,
            String collectionId,
            String wallet,
            Integer quantity,
            List<String> itemIds,
            String transactionSignature,
            EventType eventType,
            Instant timestamp
    ) {
        this.idempotencyKey = idempotencyKey;
        this.collectionId = collectionId;
        this.wallet = wallet;
        this.quantity = quantity;
        this.itemIds = itemIds == null ? new ArrayList<>() : new ArrayList<>(itemIds);
        this.transactionSignature = transactionSignature;
        this.eventType = eventType;
        this.timestamp = timestamp;
    }

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

    public Integer getQuantity() {
        return quantity;
    }

    public void setQuantity(Integer quantity) {
        this.quantity = quantity;
    }

    public List<String> getItemIds() {
        return itemIds;
    }

    public void setItemIds(List<String> itemIds) {
        this.itemIds = itemIds;
    }

    public String getTransactionSignature() {
        return transactionSignature;
    }

    public void setTransactionSignature(String transactionSignature) {
        this.transactionSignature = transactionSignature;
    }

    public EventType getEventType() {
        return eventType;
    }

    public void setEventType(EventType eventType) {
        this.eventType = eventType;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public enum EventType {
        RESERVED,
        CONFIRMED,
        EXPIRED
    }
}
