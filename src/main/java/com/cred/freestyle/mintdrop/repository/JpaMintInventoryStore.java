package com.cred.freestyle.mintdrop.repository;

import com.cred.freestyle.mintdrop.domain.model.DropCollection;
import com.cred.freestyle.mintdrop.domain.model.DropCollection.CollectionStatus;
import com.cred.freestyle.mintdrop.domain.model.Item;
import com.cred.freestyle.mintdrop.domain.model.Item.ItemState;
import com.cred.freestyle.mintdrop.domain.model.MintPhase;
import com.cred.freestyle.mintdrop.domain.model.MintTransaction;
import com.cred.freestyle.mintdrop.domain.model.Reservation;
import com.cred.freestyle.mintdrop.domain.model.Reservation.ReservationStatus;
import com.cred.freestyle.mintdrop.exception.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * PostgreSQL-backed inventory store.
 *
 * Concurrency model:
 * - atomicReserve locks the collection row (SELECT ... FOR UPDATE), so claims on one
 *   collection are serialized by the database and never overlap
 * - atomicConfirm and expireReservation lock the reservation row, so a late confirmation
 *   and the expiry sweep never interleave on the same reservation
 * - every item transition is a guarded UPDATE whose row count is checked
 *
 * @author Mint Drop Team
 */
@Repository
public class JpaMintInventoryStore implements MintInventoryStore {

    private static final Logger logger = LoggerFactory.getLogger(JpaMintInventoryStore.class);

    private static final Set<ReservationStatus> HOLDING_STATUSES = EnumSet.of(
            ReservationStatus.PENDING, ReservationStatus.TRANSACTION_READY, ReservationStatus.FAILED);

    private static final Set<ReservationStatus> COUNTED_FOR_LIMIT = EnumSet.of(
            ReservationStatus.PENDING, ReservationStatus.TRANSACTION_READY,
            ReservationStatus.FAILED, ReservationStatus.CONFIRMED);

    private final CollectionRepository collectionRepository;
    private final ItemRepository itemRepository;
    private final MintPhaseRepository phaseRepository;
    private final ReservationRepository reservationRepository;
    private final MintTransactionRepository mintTransactionRepository;

    public JpaMintInventoryStore(
            CollectionRepository collectionRepository,
            ItemRepository itemRepository,
            MintPhaseRepository phaseRepository,
            ReservationRepository reservationRepository,
            MintTransactionRepository mintTransactionRepository
    ) {
        this.collectionRepository = collectionRepository;
        this.itemRepository = itemRepository;
        this.phaseRepository = phaseRepository;
        this.reservationRepository = reservationRepository;
        this.mintTransactionRepository = mintTransactionRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<DropCollection> findCollection(String idOrAddress) {
        Optional<DropCollection> byId = collectionRepository.findById(idOrAddress);
        if (byId.isPresent()) {
            return byId;
        }
        return collectionRepository.findByCollectionAddress(idOrAddress);
    }

    @Override
    @Transactional(readOnly = true)
    public List<DropCollection> findActiveCollections() {
        return collectionRepository.findByStatus(CollectionStatus.ACTIVE);
    }

    @Override
    @Transactional(readOnly = true)
    public List<DropCollection> findDraftCollections() {
        return collectionRepository.findByStatus(CollectionStatus.DRAFT);
    }

    @Override
    @Transactional
    public boolean activateIfStarted(String collectionId, Instant now) {
        List<MintPhase> phases = phaseRepository.findByCollectionIdOrderByStartTimeAsc(collectionId);
        if (phases.isEmpty() || now.isBefore(phases.get(0).getStartTime())) {
            return false;
        }
        if (collectionRepository.transitionStatus(collectionId, CollectionStatus.DRAFT, CollectionStatus.ACTIVE) == 0) {
            return false;
        }
        logger.info("Collection {} activated, first phase {} started at {}",
                collectionId, phases.get(0).getPhaseId(), phases.get(0).getStartTime());
        return true;
    }

    @Override
    @Transactional(readOnly = true)
    public List<MintPhase> findPhases(String collectionId) {
        return phaseRepository.findByCollectionIdOrderByStartTimeAsc(collectionId);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<MintPhase> findPhase(String phaseId) {
        return phaseRepository.findById(phaseId);
    }

    @Override
    @Transactional
    public MintPhase saveAllowListRoot(String phaseId, String merkleRoot) {
        MintPhase phase = phaseRepository.findById(phaseId)
                .orElseThrow(() -> new ResourceNotFoundException("MintPhase", phaseId));
        phase.setMerkleRoot(merkleRoot);
        return phaseRepository.save(phase);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Reservation> findReservation(String idempotencyKey) {
        return reservationRepository.findByIdempotencyKey(idempotencyKey);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<MintTransaction> findTransactionBySignature(String signature) {
        return mintTransactionRepository.findByTransactionSignature(signature);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Item> findItemsBySignature(String signature) {
        return itemRepository.findByMintSignatureOrderByItemIndexAsc(signature);
    }

    @Override
    @Transactional
    public Reservation atomicReserve(Reservation draft, Integer phaseMintLimit) {
        String collectionId = draft.getCollectionId();
        int quantity = draft.getQuantity();

        // Step 1: Lock the collection row; concurrent claims on this collection queue here
        DropCollection collection = collectionRepository.findByIdWithLock(collectionId)
                .orElseThrow(() -> new ResourceNotFoundException("Collection", collectionId));
        if (!collection.isActive()) {
            throw new CollectionNotActiveException(collectionId, collection.getStatus().name());
        }

        // Step 2: Per-wallet phase limit, counted under the same lock
        if (phaseMintLimit != null && phaseMintLimit > 0) {
            long held = reservationRepository.sumQuantityByWalletAndPhase(
                    draft.getWallet(), draft.getPhaseId(), COUNTED_FOR_LIMIT);
            if (held + quantity > phaseMintLimit) {
                throw new MintLimitExceededException(draft.getWallet(), draft.getPhaseId(),
                        phaseMintLimit, (int) held);
            }
        }

        // Step 3: Insert the idempotency record first so a duplicate key fails before any item moves
        Reservation saved = reservationRepository.saveAndFlush(draft);

        // Step 4: Claim the lowest-index unsold items, all or nothing
        List<String> itemIds = itemRepository.lockUnsoldItemIds(collectionId, quantity);
        if (itemIds.size() < quantity) {
            throw new InsufficientSupplyException(collectionId, quantity, itemIds.size());
        }

        int claimed = itemRepository.reserveItems(itemIds, saved.getIdempotencyKey(), saved.getCreatedAt(),
                ItemState.UNSOLD, ItemState.RESERVED);
        if (claimed != quantity) {
            logger.error("Reserved {} items but locked {} for reservation {}",
                    claimed, quantity, saved.getIdempotencyKey());
            throw new InvariantViolationException(String.format(
                    "Claimed %d of %d locked items for %s", claimed, quantity, saved.getIdempotencyKey()));
        }

        saved.setItemIds(new ArrayList<>(itemIds));
        return reservationRepository.save(saved);
    }

    @Override
    @Transactional
    public Reservation markTransactionReady(String idempotencyKey, String transactionPayload) {
        Reservation reservation = lockReservation(idempotencyKey);
        if (reservation.getStatus() != ReservationStatus.PENDING) {
            logger.warn("Reservation {} is {}, transaction not attached",
                    idempotencyKey, reservation.getStatus());
            return reservation;
        }
        reservation.markTransactionReady(transactionPayload);
        return reservationRepository.save(reservation);
    }

    @Override
    @Transactional
    public Reservation markFailed(String idempotencyKey, String reason) {
        Reservation reservation = lockReservation(idempotencyKey);
        if (reservation.getStatus() != ReservationStatus.PENDING) {
            return reservation;
        }
        reservation.markFailed(reason);
        return reservationRepository.save(reservation);
    }

    @Override
    @Transactional
    public ConfirmedMint atomicConfirm(ConfirmCommand command) {
        String key = command.idempotencyKey();
        String signature = command.signature();

        // Step 1: Signature already recorded -> prior result
        Optional<MintTransaction> existing = mintTransactionRepository.findByTransactionSignature(signature);
        if (existing.isPresent()) {
            MintTransaction prior = existing.get();
            if (!prior.getIdempotencyKey().equals(key)) {
                throw new IdempotencyConflictException(key,
                        String.format("Signature %s is already recorded for another reservation", signature));
            }
            return new ConfirmedMint(prior, itemRepository.findByMintSignatureOrderByItemIndexAsc(signature), true);
        }

        // Step 2: Lock the reservation and check it can still be confirmed
        Reservation reservation = lockReservation(key);
        if (reservation.getStatus() == ReservationStatus.CONFIRMED
                && signature.equals(reservation.getTransactionSignature())) {
            // A concurrent confirm with this signature committed while we waited for the lock
            MintTransaction prior = mintTransactionRepository.findByTransactionSignature(signature)
                    .orElseThrow(() -> new InvariantViolationException(String.format(
                            "Reservation %s is confirmed by %s but no transaction is recorded", key, signature)));
            return new ConfirmedMint(prior, itemRepository.findByMintSignatureOrderByItemIndexAsc(signature), true);
        }
        if (!reservation.getWallet().equals(command.buyerWallet())) {
            throw new MintValidationException("wallet", "Wallet does not match the reservation");
        }
        if (reservation.getStatus() == ReservationStatus.EXPIRED) {
            throw new ReservationExpiredException(key, reservation.getExpiresAt());
        }
        if (reservation.getStatus() == ReservationStatus.CONFIRMED) {
            throw new ItemsNotReservedException(key, "reservation was confirmed with a different signature");
        }
        if (reservation.getStatus() == ReservationStatus.FAILED) {
            throw new ItemsNotReservedException(key, "reservation failed: " + reservation.getFailureReason());
        }
        if (command.itemIds() != null && !command.itemIds().isEmpty()
                && !new HashSet<>(command.itemIds()).equals(new HashSet<>(reservation.getItemIds()))) {
            throw new ItemsNotReservedException(key, "item ids do not match the reservation");
        }

        // Step 3: reserved -> minted for exactly this reservation's items
        int minted = itemRepository.mintReservedItems(key, command.buyerWallet(), signature,
                command.confirmedAt(), ItemState.RESERVED, ItemState.MINTED);
        if (minted != reservation.getQuantity()) {
            logger.error("Invariant violation: reservation {} holds {} items but {} were reserved at confirm",
                    key, reservation.getQuantity(), minted);
            throw new InvariantViolationException(String.format(
                    "Reservation %s expected %d reserved items, found %d", key, reservation.getQuantity(), minted));
        }

        // Step 4: Append the transaction record
        MintTransaction transaction = mintTransactionRepository.saveAndFlush(MintTransaction.builder()
                .transactionSignature(signature)
                .idempotencyKey(key)
                .collectionId(reservation.getCollectionId())
                .phaseId(reservation.getPhaseId())
                .buyerWallet(command.buyerWallet())
                .quantity(reservation.getQuantity())
                .amountPaidBaseUnits(reservation.getItemsTotalBaseUnits())
                .platformFeeBaseUnits(reservation.getPlatformFeeBaseUnits())
                .platformFeeFiat(reservation.getPlatformFeeFiat())
                .createdAt(command.confirmedAt())
                .build());

        // Step 5: Confirm the reservation
        reservation.confirm(signature, command.confirmedAt());
        reservationRepository.save(reservation);

        // Step 6: Supply bound, derived from item state
        DropCollection collection = collectionRepository.findById(reservation.getCollectionId())
                .orElseThrow(() -> new ResourceNotFoundException("Collection", reservation.getCollectionId()));
        long mintedTotal = itemRepository.countByCollectionIdAndState(collection.getCollectionId(), ItemState.MINTED);
        if (mintedTotal > collection.getTotalSupply()) {
            logger.error("Invariant violation: collection {} minted {} of supply {}",
                    collection.getCollectionId(), mintedTotal, collection.getTotalSupply());
            throw new InvariantViolationException(String.format(
                    "Collection %s minted count %d exceeds supply %d",
                    collection.getCollectionId(), mintedTotal, collection.getTotalSupply()));
        }

        return new ConfirmedMint(transaction, itemRepository.findByMintSignatureOrderByItemIndexAsc(signature), false);
    }

    @Override
    @Transactional
    public boolean expireReservation(String idempotencyKey, Instant now) {
        Optional<Reservation> locked = reservationRepository.findByIdempotencyKeyForUpdate(idempotencyKey);
        if (locked.isEmpty()) {
            return false;
        }

        Reservation reservation = locked.get();
        if (!reservation.isHolding() || now.isBefore(reservation.getExpiresAt())) {
            // Confirmed or renewed since it was selected for expiry
            return false;
        }

        int released = itemRepository.releaseReservedItems(idempotencyKey, ItemState.RESERVED, ItemState.UNSOLD);
        if (released != reservation.getItemIds().size()) {
            logger.error("Invariant violation: reservation {} held {} items but released {}",
                    idempotencyKey, reservation.getItemIds().size(), released);
            throw new InvariantViolationException(String.format(
                    "Reservation %s expected %d reserved items at expiry, released %d",
                    idempotencyKey, reservation.getItemIds().size(), released));
        }

        reservation.expire(now);
        reservationRepository.save(reservation);
        return true;
    }

    @Override
    @Transactional(readOnly = true)
    public List<String> findExpiredReservationKeys(Instant now, int limit) {
        return reservationRepository.findExpiredKeys(HOLDING_STATUSES, now, PageRequest.of(0, limit));
    }

    @Override
    @Transactional(readOnly = true)
    public InventoryCounts countInventory(String collectionId) {
        DropCollection collection = collectionRepository.findById(collectionId)
                .orElseThrow(() -> new ResourceNotFoundException("Collection", collectionId));
        return countFor(collection);
    }

    @Override
    @Transactional
    public InventoryCounts refreshMintedCount(String collectionId, Instant now) {
        DropCollection collection = collectionRepository.findById(collectionId)
                .orElseThrow(() -> new ResourceNotFoundException("Collection", collectionId));
        InventoryCounts counts = countFor(collection);

        collectionRepository.updateMintedCount(collectionId, counts.minted(), now);
        if (counts.soldOut()
                && collectionRepository.transitionStatus(collectionId, CollectionStatus.ACTIVE, CollectionStatus.COMPLETED) > 0) {
            logger.info("Collection {} sold out ({} minted), marked COMPLETED", collectionId, counts.minted());
        }
        return counts;
    }

    private InventoryCounts countFor(DropCollection collection) {
        Map<ItemState, Long> byState = new EnumMap<>(ItemState.class);
        for (Object[] row : itemRepository.countByStateForCollection(collection.getCollectionId())) {
            byState.put((ItemState) row[0], (Long) row[1]);
        }
        return new InventoryCounts(
                collection.getTotalSupply(),
                byState.getOrDefault(ItemState.MINTED, 0L).intValue(),
                byState.getOrDefault(ItemState.RESERVED, 0L).intValue(),
                byState.getOrDefault(ItemState.UNSOLD, 0L).intValue()
        );
    }

    private Reservation lockReservation(String idempotencyKey) {
        return reservationRepository.findByIdempotencyKeyForUpdate(idempotencyKey)
                .orElseThrow(() -> new ReservationNotFoundException(idempotencyKey));
    }
}
