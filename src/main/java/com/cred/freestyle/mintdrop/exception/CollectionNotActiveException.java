package com.cred.freestyle.mintdrop.exception;

/**
 * Thrown when minting is attempted on a collection whose status is not active.
 *
 * @author Mint Drop Team
 */
public class CollectionNotActiveException extends MintDropException {

    private final String collectionId;
    private final String status;

    public CollectionNotActiveException(String collectionId, String status) {
        super(MintErrorCode.COLLECTION_NOT_ACTIVE,
                String.format("Collection %s is not active (status: %s)", collectionId, status));
        this.collectionId = collectionId;
        this.status = status;
    }

    public String getCollectionId() {
        return collectionId;
    }

    public String getStatus() {
        return status;
    }
}
