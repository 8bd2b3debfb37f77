package com.cred.freestyle.mintdrop.exception;

/**
 * Base class for business failures of the mint engine.
 * Every subclass carries a stable {@link MintErrorCode}.
 *
 * @author Mint Drop Team
 */
public abstract class MintDropException extends RuntimeException {

    private final MintErrorCode errorCode;

    protected MintDropException(MintErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected MintDropException(MintErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public MintErrorCode getErrorCode() {
        return errorCode;
    }
}
