package com.cred.freestyle.mintdrop.exception;

/**
 * Thrown when a wallet would exceed the per-wallet limit of a phase.
 *
 * @author Mint Drop Team
 */
public class MintLimitExceededException extends MintDropException {

    private final String wallet;
    private final String phaseId;
    private final int mintLimit;
    private final int alreadyHeld;

    public MintLimitExceededException(String wallet, String phaseId, int mintLimit, int alreadyHeld) {
        super(MintErrorCode.MINT_LIMIT_EXCEEDED,
                String.format("Wallet %s already holds %d of %d allowed in phase %s",
                        wallet, alreadyHeld, mintLimit, phaseId));
        this.wallet = wallet;
        this.phaseId = phaseId;
        this.mintLimit = mintLimit;
        this.alreadyHeld = alreadyHeld;
    }

    public String getWallet() {
        return wallet;
    }

    public String getPhaseId() {
        return phaseId;
    }

    public int getMintLimit() {
        return mintLimit;
    }

    public int getAlreadyHeld() {
        return alreadyHeld;
    }
}
