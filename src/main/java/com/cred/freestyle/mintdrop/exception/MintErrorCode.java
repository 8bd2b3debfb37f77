package com.cred.freestyle.mintdrop.exception;

import org.springframework.http.HttpStatus;

/**
 * Stable error codes returned to clients alongside a human-readable message.
 *
 * @author Mint Drop Team
 */
public enum MintErrorCode {

    VALIDATION_ERROR(HttpStatus.BAD_REQUEST, false),
    NOT_FOUND(HttpStatus.NOT_FOUND, false),
    COLLECTION_NOT_ACTIVE(HttpStatus.CONFLICT, false),
    NO_ACTIVE_PHASE(HttpStatus.CONFLICT, false),
    NOT_ALLOWLISTED(HttpStatus.FORBIDDEN, false),
    MINT_LIMIT_EXCEEDED(HttpStatus.FORBIDDEN, false),
    INSUFFICIENT_SUPPLY(HttpStatus.CONFLICT, false),
    IDEMPOTENCY_CONFLICT(HttpStatus.CONFLICT, false),
    RESERVATION_EXPIRED(HttpStatus.GONE, false),
    ITEMS_NOT_RESERVED(HttpStatus.CONFLICT, false),
    UPSTREAM_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, true),
    INVARIANT_VIOLATION(HttpStatus.INTERNAL_SERVER_ERROR, false);

    private final HttpStatus httpStatus;
    private final boolean retryable;

    MintErrorCode(HttpStatus httpStatus, boolean retryable) {
        this.httpStatus = httpStatus;
        this.retryable = retryable;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
