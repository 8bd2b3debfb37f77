package com.cred.freestyle.mintdrop.service;

import com.cred.freestyle.mintdrop.domain.model.MintPhase;
import com.cred.freestyle.mintdrop.exception.NoActivePhaseException;
import com.cred.freestyle.mintdrop.exception.NotAllowlistedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Resolves which sale phase applies to a buyer and at what price.
 *
 * Policy:
 * 1. A requested phase id is honored if it belongs to the collection, whatever the time;
 *    an unknown id is ignored
 * 2. Otherwise the candidates are the phases whose [start, end) window contains now
 * 3. Among candidates, the earliest start wins, skipping allow-list phases the buyer cannot
 *    prove membership of, so a non-member falls through to an overlapping open phase
 * 4. No candidates: NoActivePhase. Candidates but none usable: NotAllowlisted
 *
 * Allow-list membership is always proven against the phase's stored root.
 *
 * @author Mint Drop Team
 */
@Component
public class PhaseResolver {

    private static final Logger logger = LoggerFactory.getLogger(PhaseResolver.class);

    private final AllowListVerifier allowListVerifier;
    private final PriceOracleService priceOracleService;

    public PhaseResolver(AllowListVerifier allowListVerifier, PriceOracleService priceOracleService) {
        this.allowListVerifier = allowListVerifier;
        this.priceOracleService = priceOracleService;
    }

    /**
     * @param collectionId collection the phases belong to
     * @param phases the collection's phases
     * @param requestedPhaseId optional explicit phase
     * @param wallet buyer wallet
     * @param allowListProof optional membership proof (hex sibling hashes)
     * @param now evaluation time
     */
    public ResolvedPhase resolveActivePhase(
            String collectionId,
            List<MintPhase> phases,
            String requestedPhaseId,
            String wallet,
            List<String> allowListProof,
            Instant now
    ) {
        Optional<MintPhase> requested = findRequested(phases, requestedPhaseId);
        if (requested.isPresent()) {
            if (!isEligible(requested.get(), wallet, allowListProof)) {
                throw new NotAllowlistedException(wallet, requestedPhaseId);
            }
            return priced(requested.get());
        }
        if (requestedPhaseId != null && !requestedPhaseId.isBlank()) {
            logger.debug("Phase {} is not a phase of {}, resolving by time", requestedPhaseId, collectionId);
        }

        List<MintPhase> open = openPhases(phases, now);
        if (open.isEmpty()) {
            throw new NoActivePhaseException(collectionId, now);
        }

        Optional<MintPhase> eligible = open.stream()
                .filter(phase -> isEligible(phase, wallet, allowListProof))
                .findFirst();
        if (eligible.isEmpty()) {
            logger.debug("Wallet {} is not eligible for any of {} open phases of {}",
                    wallet, open.size(), collectionId);
            throw new NotAllowlistedException(wallet, open.get(0).getPhaseId());
        }
        return priced(eligible.get());
    }

    /**
     * Phases open at the given time, earliest start first, ignoring eligibility.
     */
    public List<MintPhase> openPhases(List<MintPhase> phases, Instant now) {
        return phases.stream()
                .filter(phase -> phase.isOpenAt(now))
                .sorted(Comparator.comparing(MintPhase::getStartTime))
                .collect(Collectors.toList());
    }

    private static Optional<MintPhase> findRequested(List<MintPhase> phases, String requestedPhaseId) {
        if (requestedPhaseId == null || requestedPhaseId.isBlank()) {
            return Optional.empty();
        }
        return phases.stream()
                .filter(phase -> phase.getPhaseId().equals(requestedPhaseId))
                .findFirst();
    }

    private boolean isEligible(MintPhase phase, String wallet, List<String> proof) {
        if (!phase.isAllowList()) {
            return true;
        }
        if (phase.getMerkleRoot() == null) {
            logger.warn("Allow-list phase {} has no committed root; nobody can mint in it", phase.getPhaseId());
            return false;
        }
        if (proof == null) {
            return false;
        }
        return allowListVerifier.verify(wallet, proof, phase.getMerkleRoot());
    }

    private ResolvedPhase priced(MintPhase phase) {
        return new ResolvedPhase(phase, phase.getPrice(), priceOracleService.toBaseUnits(phase.getPrice()));
    }
}
