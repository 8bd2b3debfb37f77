package com.cred.freestyle.mintdrop.exception;

/**
 * Thrown when an allow-list phase applies but the wallet's membership proof is absent or invalid.
 *
 * @author Mint Drop Team
 */
public class NotAllowlistedException extends MintDropException {

    private final String wallet;
    private final String phaseId;

    public NotAllowlistedException(String wallet, String phaseId) {
        super(MintErrorCode.NOT_ALLOWLISTED,
                String.format("Wallet %s is not on the allow list of phase %s", wallet, phaseId));
        this.wallet = wallet;
        this.phaseId = phaseId;
    }

    public String getWallet() {
        return wallet;
    }

    public String getPhaseId() {
        return phaseId;
    }
}
