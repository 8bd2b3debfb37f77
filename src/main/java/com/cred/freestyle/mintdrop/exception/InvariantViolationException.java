package com.cred.freestyle.mintdrop.exception;

/**
 * Thrown when stored inventory contradicts what the engine guarantees,
 * e.g. the number of reserved items at confirm time does not match the reservation.
 * Fatal: the surrounding transaction is rolled back and the failure is logged for operators.
 *
 * @author Mint Drop Team
 */
public class InvariantViolationException extends MintDropException {

    public InvariantViolationException(String message) {
        super(MintErrorCode.INVARIANT_VIOLATION, message);
    }
}
