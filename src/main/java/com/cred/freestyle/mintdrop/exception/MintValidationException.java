package com.cred.freestyle.mintdrop.exception;

/**
 * Thrown when a request is missing or malformed in a way bean validation cannot express.
 * Not retryable.
 *
 * @author Mint Drop Team
 */
public class MintValidationException extends MintDropException {

    private final String field;

    public MintValidationException(String field, String message) {
        super(MintErrorCode.VALIDATION_ERROR, message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
