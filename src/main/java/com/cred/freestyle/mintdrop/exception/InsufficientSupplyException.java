package com.cred.freestyle.mintdrop.exception;

/**
 * Exception thrown when fewer unsold items remain than were requested.
 * Nothing is claimed when this is thrown.
 *
 * @author Mint Drop Team
 */
public class InsufficientSupplyException extends MintDropException {

    private final String collectionId;
    private final int requestedQuantity;
    private final int availableQuantity;

    public InsufficientSupplyException(String collectionId, int requestedQuantity, int availableQuantity) {
        super(MintErrorCode.INSUFFICIENT_SUPPLY,
                String.format("Collection %s has insufficient supply. Requested: %d, Available: %d",
                        collectionId, requestedQuantity, availableQuantity));
        this.collectionId = collectionId;
        this.requestedQuantity = requestedQuantity;
        this.availableQuantity = availableQuantity;
    }

    public String getCollectionId() {
        return collectionId;
    }

    public int getRequestedQuantity() {
        return requestedQuantity;
    }

    public int getAvailableQuantity() {
        return availableQuantity;
    }
}
