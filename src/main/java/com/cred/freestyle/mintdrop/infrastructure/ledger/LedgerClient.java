package com.cred.freestyle.mintdrop.infrastructure.ledger;

/**
 * Narrow view of the ledger network used by the mint engine.
 * The engine never submits transactions itself; buyers sign and submit externally.
 *
 * @author Mint Drop Team
 */
public interface LedgerClient {

    /**
     * A recent network checkpoint (block hash) that makes an unsigned transaction expire if it goes stale.
     *
     * @throws com.cred.freestyle.mintdrop.exception.UpstreamUnavailableException if the network cannot be reached
     */
    String getRecentCheckpoint();

    /**
     * Status of a reported signature on the network.
     *
     * @throws com.cred.freestyle.mintdrop.exception.UpstreamUnavailableException if the network cannot be reached
     */
    SignatureStatus getSignatureStatus(String signature);

    enum SignatureStatus {
        /**
         * Landed and confirmed.
         */
        CONFIRMED,
        /**
         * Seen but not yet confirmed.
         */
        PENDING,
        /**
         * Landed with an execution error.
         */
        FAILED,
        /**
         * Not known to the network (yet).
         */
        UNKNOWN
    }
}
