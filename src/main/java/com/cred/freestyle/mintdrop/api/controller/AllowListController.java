package com.cred.freestyle.mintdrop.api.controller;

import com.cred.freestyle.mintdrop.api.dto.AllowListCommitmentResponse;
import com.cred.freestyle.mintdrop.api.dto.AllowListProofResponse;
import com.cred.freestyle.mintdrop.service.AllowListService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for phase allow-lists.
 *
 * @author Mint Drop Team
 */
@RestController
@RequestMapping("/api/v1/phases/{phaseId}/allowlist")
public class AllowListController {

    private static final Logger logger = LoggerFactory.getLogger(AllowListController.class);

    private final AllowListService allowListService;

    public AllowListController(AllowListService allowListService) {
        this.allowListService = allowListService;
    }

    /**
     * Recompute the Merkle root from the phase's wallets and store it.
     * Proofs issued before a re-commit stop verifying if the wallet list changed.
     */
    @PostMapping("/commit")
    public ResponseEntity<AllowListCommitmentResponse> commit(@PathVariable String phaseId) {
        logger.info("Committing allow-list for phase: {}", phaseId);
        return ResponseEntity.ok(AllowListCommitmentResponse.fromCommitted(allowListService.commitAllowList(phaseId)));
    }

    @GetMapping("/proof")
    public ResponseEntity<AllowListProofResponse> getProof(
            @PathVariable String phaseId,
            @RequestParam String wallet
    ) {
        logger.debug("Fetching allow-list proof - phase: {}, wallet: {}", phaseId, wallet);
        return ResponseEntity.ok(AllowListProofResponse.fromProof(allowListService.getProof(phaseId, wallet)));
    }
}
