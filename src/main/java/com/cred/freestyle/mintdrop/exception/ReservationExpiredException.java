package com.cred.freestyle.mintdrop.exception;

import java.time.Instant;

/**
 * Exception thrown when a reservation is used after its expiry window.
 * The client must start over with a new idempotency key.
 *
 * @author Mint Drop Team
 */
public class ReservationExpiredException extends MintDropException {

    private final String idempotencyKey;
    private final Instant expiresAt;

    public ReservationExpiredException(String idempotencyKey, Instant expiresAt) {
        super(MintErrorCode.RESERVATION_EXPIRED,
                String.format("Reservation %s expired at %s", idempotencyKey, expiresAt));
        this.idempotencyKey = idempotencyKey;
        this.expiresAt = expiresAt;
    }

    public String getIdempotencyKey() {
        return idempotencyKey;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }
}
