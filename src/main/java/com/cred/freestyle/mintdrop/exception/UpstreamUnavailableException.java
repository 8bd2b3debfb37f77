package com.cred.freestyle.mintdrop.exception;

/**
 * Thrown when the price feed or the ledger network cannot be reached. Retryable.
 *
 * @author Mint Drop Team
 */
public class UpstreamUnavailableException extends MintDropException {

    private final String upstream;

    public UpstreamUnavailableException(String upstream, String message) {
        super(MintErrorCode.UPSTREAM_UNAVAILABLE, message);
        this.upstream = upstream;
    }

    public UpstreamUnavailableException(String upstream, String message, Throwable cause) {
        super(MintErrorCode.UPSTREAM_UNAVAILABLE, message, cause);
        this.upstream = upstream;
    }

    public String getUpstream() {
        return upstream;
    }
}
