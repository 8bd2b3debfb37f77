package com.cred.freestyle.mintdrop.repository;

import com.cred.freestyle.mintdrop.domain.model.DropCollection;
import com.cred.freestyle.mintdrop.domain.model.Item;
import com.cred.freestyle.mintdrop.domain.model.MintPhase;
import com.cred.freestyle.mintdrop.domain.model.MintTransaction;
import com.cred.freestyle.mintdrop.domain.model.Reservation;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Operations the mint engine needs from the shared inventory store.
 *
 * Every method that changes item state (atomicReserve, atomicConfirm, expireReservation)
 * runs as one atomic unit: either all of its writes apply or none do.
 * Implementations must serialize conflicting claims in the store itself,
 * never by reading state in one round trip and writing it in another.
 *
 * A duplicate idempotency key or ledger signature surfaces as
 * {@link org.springframework.dao.DataIntegrityViolationException}.
 *
 * @author Mint Drop Team
 */
public interface MintInventoryStore {

    /**
     * @param idOrAddress collection id or collection ledger address
     */
    Optional<DropCollection> findCollection(String idOrAddress);

    List<DropCollection> findActiveCollections();

    List<DropCollection> findDraftCollections();

    /**
     * Move a DRAFT collection to ACTIVE once its earliest phase has started.
     * Collections without phases stay in DRAFT.
     *
     * @return true if this call activated the collection
     */
    boolean activateIfStarted(String collectionId, Instant now);

    /**
     * @return phases of the collection ordered by start time
     */
    List<MintPhase> findPhases(String collectionId);

    Optional<MintPhase> findPhase(String phaseId);

    MintPhase saveAllowListRoot(String phaseId, String merkleRoot);

    Optional<Reservation> findReservation(String idempotencyKey);

    Optional<MintTransaction> findTransactionBySignature(String signature);

    List<Item> findItemsBySignature(String signature);

    /**
     * Persist the draft reservation and claim exactly draft.quantity lowest-index unsold items for it.
     *
     * @param draft reservation in PENDING status, without item ids
     * @param phaseMintLimit per-wallet limit of the draft's phase, or null for none
     * @return the stored reservation with its claimed item ids
     * @throws com.cred.freestyle.mintdrop.exception.InsufficientSupplyException if fewer items are unsold
     * @throws com.cred.freestyle.mintdrop.exception.MintLimitExceededException if the wallet limit would be passed
     * @throws com.cred.freestyle.mintdrop.exception.CollectionNotActiveException if the collection stopped selling
     */
    Reservation atomicReserve(Reservation draft, Integer phaseMintLimit);

    /**
     * Attach the unsigned transaction to a PENDING reservation. Other statuses are left as they are.
     */
    Reservation markTransactionReady(String idempotencyKey, String transactionPayload);

    /**
     * Mark a PENDING reservation FAILED. Items stay reserved until the expiry sweep releases them.
     */
    Reservation markFailed(String idempotencyKey, String reason);

    /**
     * Mint the reservation's items to the buyer, append the transaction record and confirm the reservation.
     * Returns the prior result unchanged if the signature was already recorded for this key.
     */
    ConfirmedMint atomicConfirm(ConfirmCommand command);

    /**
     * Release a holding reservation's items and mark it EXPIRED, if its expiry has passed.
     *
     * @return true if this call expired the reservation
     */
    boolean expireReservation(String idempotencyKey, Instant now);

    List<String> findExpiredReservationKeys(Instant now, int limit);

    /**
     * Counts derived from item state. Authoritative for the instant they were read.
     */
    InventoryCounts countInventory(String collectionId);

    /**
     * Recompute the collection's cached minted count and complete it when sold out.
     */
    InventoryCounts refreshMintedCount(String collectionId, Instant now);

    record ConfirmCommand(
            String idempotencyKey,
            String signature,
            String buyerWallet,
            List<String> itemIds,
            Instant confirmedAt
    ) {}

    record ConfirmedMint(
            MintTransaction transaction,
            List<Item> items,
            boolean replay
    ) {}

    record InventoryCounts(
            int totalSupply,
            int minted,
            int reserved,
            int unsold
    ) {
        public int available() {
            return unsold;
        }

        public boolean soldOut() {
            return minted >= totalSupply;
        }
    }
}
