package com.cred.freestyle.mintdrop.service;

import com.cred.freestyle.mintdrop.domain.model.MintPhase;
import com.cred.freestyle.mintdrop.exception.MintValidationException;
import com.cred.freestyle.mintdrop.exception.ResourceNotFoundException;
import com.cred.freestyle.mintdrop.repository.MintInventoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Allow-list administration for a phase: committing the Merkle root and handing out proofs.
 *
 * Proofs are always recomputed from the phase's stored wallets. A proof is only usable once
 * the phase's stored root matches the recomputed one, which is what {@code committed} reports.
 *
 * @author Mint Drop Team
 */
@Service
public class AllowListService {

    private static final Logger logger = LoggerFactory.getLogger(AllowListService.class);

    private final MintInventoryStore store;
    private final AllowListVerifier allowListVerifier;

    public AllowListService(MintInventoryStore store, AllowListVerifier allowListVerifier) {
        this.store = store;
        this.allowListVerifier = allowListVerifier;
    }

    /**
     * Recompute the root from the phase's stored wallets and store it on the phase.
     *
     * @throws ResourceNotFoundException if the phase does not exist
     * @throws MintValidationException if the phase is not an allow-list phase or has no wallets
     */
    public CommittedAllowList commitAllowList(String phaseId) {
        MintPhase phase = allowListPhase(phaseId);
        AllowListCommitment commitment = commitmentOf(phase);
        MintPhase saved = store.saveAllowListRoot(phaseId, commitment.root());
        logger.info("Committed allow-list root {} for phase {} ({} wallets)",
                commitment.root(), phaseId, commitment.size());
        return new CommittedAllowList(saved, commitment);
    }

    /**
     * Membership proof of a wallet.
     *
     * @throws ResourceNotFoundException if the phase does not exist or the wallet is not on its list
     */
    public AllowListProof getProof(String phaseId, String wallet) {
        if (wallet == null || wallet.isBlank()) {
            throw new MintValidationException("wallet", "wallet is required");
        }
        MintPhase phase = allowListPhase(phaseId);
        AllowListCommitment commitment = commitmentOf(phase);
        List<String> proof = commitment.proofFor(wallet)
                .orElseThrow(() -> new ResourceNotFoundException("AllowListEntry", phaseId + "/" + wallet));
        boolean committed = commitment.root().equalsIgnoreCase(phase.getMerkleRoot());
        if (!committed) {
            logger.debug("Phase {} root is not committed for its current wallet list", phaseId);
        }
        return new AllowListProof(phaseId, wallet.trim(), commitment.root(), proof, committed);
    }

    private MintPhase allowListPhase(String phaseId) {
        MintPhase phase = store.findPhase(phaseId)
                .orElseThrow(() -> new ResourceNotFoundException("MintPhase", phaseId));
        if (!phase.isAllowList()) {
            throw new MintValidationException("phaseId", "Phase " + phaseId + " is open to everyone");
        }
        return phase;
    }

    private AllowListCommitment commitmentOf(MintPhase phase) {
        if (phase.getAllowListWallets() == null || phase.getAllowListWallets().isEmpty()) {
            throw new MintValidationException("phaseId", "Phase " + phase.getPhaseId() + " has no allow-listed wallets");
        }
        return allowListVerifier.buildCommitment(phase.getAllowListWallets());
    }

    public record CommittedAllowList(MintPhase phase, AllowListCommitment commitment) {}

    public record AllowListProof(String phaseId, String wallet, String root, List<String> proof, boolean committed) {}
}
