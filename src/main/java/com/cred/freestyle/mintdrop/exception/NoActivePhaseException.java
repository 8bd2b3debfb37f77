package com.cred.freestyle.mintdrop.exception;

import java.time.Instant;

/**
 * Thrown when no sale phase of a collection is open at evaluation time.
 *
 * @author Mint Drop Team
 */
public class NoActivePhaseException extends MintDropException {

    private final String collectionId;
    private final Instant evaluatedAt;

    public NoActivePhaseException(String collectionId, Instant evaluatedAt) {
        super(MintErrorCode.NO_ACTIVE_PHASE,
                String.format("No active mint phase for collection %s at %s", collectionId, evaluatedAt));
        this.collectionId = collectionId;
        this.evaluatedAt = evaluatedAt;
    }

    public String getCollectionId() {
        return collectionId;
    }

    public Instant getEvaluatedAt() {
        return evaluatedAt;
    }
}
