package com.cred.freestyle.mintdrop.service;

import com.cred.freestyle.mintdrop.domain.model.MintTransaction;
import com.cred.freestyle.mintdrop.exception.IdempotencyConflictException;
import com.cred.freestyle.mintdrop.exception.MintValidationException;
import com.cred.freestyle.mintdrop.exception.UpstreamUnavailableException;
import com.cred.freestyle.mintdrop.infrastructure.ledger.LedgerClient;
import com.cred.freestyle.mintdrop.infrastructure.ledger.LedgerClient.SignatureStatus;
import com.cred.freestyle.mintdrop.repository.MintInventoryStore;
import com.cred.freestyle.mintdrop.repository.MintInventoryStore.ConfirmCommand;
import com.cred.freestyle.mintdrop.repository.MintInventoryStore.ConfirmedMint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Records a confirmed payment: reserved items become minted to the buyer, exactly once per signature.
 *
 * When signature verification is enabled, the signature must be confirmed on the ledger
 * before anything is recorded. Verification is skipped for signatures already recorded.
 *
 * @author Mint Drop Team
 */
@Component
public class FulfillmentRecorder {

    private static final Logger logger = LoggerFactory.getLogger(FulfillmentRecorder.class);

    private final MintInventoryStore store;
    private final LedgerClient ledgerClient;
    private final boolean verifySignatures;

    public FulfillmentRecorder(
            MintInventoryStore store,
            LedgerClient ledgerClient,
            @Value("${mintdrop.ledger.verify-signatures:false}") boolean verifySignatures
    ) {
        this.store = store;
        this.ledgerClient = ledgerClient;
        this.verifySignatures = verifySignatures;
    }

    /**
     * @param itemIds items the client believes it reserved; null or empty to take the reservation's own
     */
    public ConfirmedMint complete(String idempotencyKey, String signature, String buyerWallet,
                                  List<String> itemIds, Instant now) {
        if (verifySignatures && store.findTransactionBySignature(signature).isEmpty()) {
            verifyOnLedger(signature);
        }

        ConfirmCommand command = new ConfirmCommand(idempotencyKey, signature, buyerWallet, itemIds, now);
        try {
            ConfirmedMint result = store.atomicConfirm(command);
            if (result.replay()) {
                logger.info("Signature {} already recorded for key {}, returning prior result",
                        signature, idempotencyKey);
            } else {
                logger.info("Minted {} items of collection {} to {} (signature: {})",
                        result.items().size(), result.transaction().getCollectionId(), buyerWallet, signature);
            }
            return result;
        } catch (DataIntegrityViolationException e) {
            // A concurrent completion with the same signature committed first
            MintTransaction prior = store.findTransactionBySignature(signature).orElseThrow(() -> e);
            if (!prior.getIdempotencyKey().equals(idempotencyKey)) {
                throw new IdempotencyConflictException(idempotencyKey,
                        String.format("Signature %s is already recorded for another reservation", signature));
            }
            return new ConfirmedMint(prior, store.findItemsBySignature(signature), true);
        }
    }

    private void verifyOnLedger(String signature) {
        SignatureStatus status = ledgerClient.getSignatureStatus(signature);
        if (status == SignatureStatus.FAILED) {
            throw new MintValidationException("signature", "Transaction " + signature + " failed on the ledger");
        }
        if (status != SignatureStatus.CONFIRMED) {
            logger.info("Signature {} is {} on the ledger, completion must be retried", signature, status);
            throw new UpstreamUnavailableException("ledger",
                    "Transaction " + signature + " is not confirmed yet (" + status + "), retry later");
        }
    }
}
