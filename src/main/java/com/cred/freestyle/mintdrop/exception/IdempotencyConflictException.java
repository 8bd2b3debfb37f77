package com.cred.freestyle.mintdrop.exception;

/**
 * Thrown when an idempotency key is replayed with different request parameters.
 *
 * @author Mint Drop Team
 */
public class IdempotencyConflictException extends MintDropException {

    private final String idempotencyKey;

    public IdempotencyConflictException(String idempotencyKey, String message) {
        super(MintErrorCode.IDEMPOTENCY_CONFLICT, message);
        this.idempotencyKey = idempotencyKey;
    }

    public String getIdempotencyKey() {
        return idempotencyKey;
    }
}
