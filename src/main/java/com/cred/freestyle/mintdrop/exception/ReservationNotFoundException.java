package com.cred.freestyle.mintdrop.exception;

/**
 * Exception thrown when no reservation exists for an idempotency key.
 *
 * @author Mint Drop Team
 */
public class ReservationNotFoundException extends MintDropException {

    private final String idempotencyKey;

    public ReservationNotFoundException(String idempotencyKey) {
        super(MintErrorCode.NOT_FOUND, String.format("Reservation not found for key: %s", idempotencyKey));
        this.idempotencyKey = idempotencyKey;
    }

    public String getIdempotencyKey() {
        return idempotencyKey;
    }
}
