package com.cred.freestyle.mintdrop.exception;

/**
 * Thrown when a completion names items that are not currently reserved under its key.
 * Signals a stale or tampered request; inventory is left untouched.
 *
 * @author Mint Drop Team
 */
public class ItemsNotReservedException extends MintDropException {

    private final String idempotencyKey;

    public ItemsNotReservedException(String idempotencyKey, String reason) {
        super(MintErrorCode.ITEMS_NOT_RESERVED,
                String.format("Items are not reserved for %s: %s", idempotencyKey, reason));
        this.idempotencyKey = idempotencyKey;
    }

    public String getIdempotencyKey() {
        return idempotencyKey;
    }
}
