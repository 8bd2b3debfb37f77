package com.cred.freestyle.mintdrop.service;

import com.cred.freestyle.mintdrop.domain.model.DropCollection;
import com.cred.freestyle.mintdrop.domain.model.MintPhase;
import com.cred.freestyle.mintdrop.domain.model.Reservation;
import com.cred.freestyle.mintdrop.domain.model.Reservation.ReservationStatus;
import com.cred.freestyle.mintdrop.exception.CollectionNotActiveException;
import com.cred.freestyle.mintdrop.exception.MintDropException;
import com.cred.freestyle.mintdrop.exception.MintValidationException;
import com.cred.freestyle.mintdrop.exception.ReservationNotFoundException;
import com.cred.freestyle.mintdrop.exception.ResourceNotFoundException;
import com.cred.freestyle.mintdrop.infrastructure.cache.MintCacheService;
import com.cred.freestyle.mintdrop.infrastructure.ledger.LedgerAddress;
import com.cred.freestyle.mintdrop.infrastructure.ledger.LedgerClient;
import com.cred.freestyle.mintdrop.infrastructure.messaging.MintEventPublisher;
import com.cred.freestyle.mintdrop.infrastructure.messaging.events.ReservationLifecycleEvent;
import com.cred.freestyle.mintdrop.infrastructure.messaging.events.ReservationLifecycleEvent.EventType;
import com.cred.freestyle.mintdrop.infrastructure.metrics.MintMetricsService;
import com.cred.freestyle.mintdrop.repository.MintInventoryStore;
import com.cred.freestyle.mintdrop.repository.MintInventoryStore.ConfirmedMint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Mint flow: reserve -> buyer signs and submits externally -> complete.
 *
 * Reserve:
 * 1. Replay check on the idempotency key
 * 2. Collection must be active
 * 3. Phase and unit price (allow-list proof checked here)
 * 4. Platform fee at the current rate
 * 5. Recent ledger checkpoint, before anything is claimed
 * 6. Atomic claim of the lowest-index unsold items
 * 7. Unsigned transaction attached to the reservation
 *
 * Complete records the signature through {@link FulfillmentRecorder}, then hands the items
 * to the {@link AssetIssuer}.
 *
 * No store transaction spans an external call; each store operation is atomic on its own.
 * Events, cache and metrics are best-effort and run after the store has committed.
 *
 * @author Mint Drop Team
 */
@Service
public class MintService {

    private static final Logger logger = LoggerFactory.getLogger(MintService.class);

    private final MintInventoryStore store;
    private final PhaseResolver phaseResolver;
    private final PriceOracleService priceOracleService;
    private final ReservationAllocator reservationAllocator;
    private final TransactionBuilder transactionBuilder;
    private final FulfillmentRecorder fulfillmentRecorder;
    private final AssetIssuer assetIssuer;
    private final LedgerClient ledgerClient;
    private final MintEventPublisher eventPublisher;
    private final MintCacheService cacheService;
    private final MintMetricsService metricsService;
    private final Clock clock;

    public MintService(
            MintInventoryStore store,
            PhaseResolver phaseResolver,
            PriceOracleService priceOracleService,
            ReservationAllocator reservationAllocator,
            TransactionBuilder transactionBuilder,
            FulfillmentRecorder fulfillmentRecorder,
            AssetIssuer assetIssuer,
            LedgerClient ledgerClient,
            MintEventPublisher eventPublisher,
            MintCacheService cacheService,
            MintMetricsService metricsService,
            Clock clock
    ) {
        this.store = store;
        this.phaseResolver = phaseResolver;
        this.priceOracleService = priceOracleService;
        this.reservationAllocator = reservationAllocator;
        this.transactionBuilder = transactionBuilder;
        this.fulfillmentRecorder = fulfillmentRecorder;
        this.assetIssuer = assetIssuer;
        this.ledgerClient = ledgerClient;
        this.eventPublisher = eventPublisher;
        this.cacheService = cacheService;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    /**
     * Reserve items and build the unsigned payment transaction.
     *
     * @param collectionIdOrAddress collection id or ledger address
     * @param quantity number of items
     * @param wallet buyer wallet
     * @param idempotencyKey client-supplied key; replays return the existing reservation
     * @param phaseId optional explicit phase
     * @param allowListProof optional Merkle proof for allow-list phases
     * @return the reservation, replay=true if it already existed
     */
    public ReservationView reserve(
            String collectionIdOrAddress,
            int quantity,
            String wallet,
            String idempotencyKey,
            String phaseId,
            List<String> allowListProof
    ) {
        if (!LedgerAddress.isValid(wallet)) {
            throw new MintValidationException("wallet", String.format("'%s' is not a valid ledger address", wallet));
        }
        Instant now = clock.instant();

        DropCollection collection = store.findCollection(collectionIdOrAddress)
                .orElseThrow(() -> new ResourceNotFoundException("Collection", collectionIdOrAddress));
        String collectionId = collection.getCollectionId();

        try {
            // Step 1: Replay
            Optional<Reservation> replay = reservationAllocator.findReplay(
                    idempotencyKey, collectionId, wallet, quantity, now);
            if (replay.isPresent()) {
                logger.info("Replayed reserve for key {}", idempotencyKey);
                metricsService.recordReplay("reserve");
                return new ReservationView(replay.get(), replay.get().getStatus(), true);
            }

            // Step 2: Collection must be selling
            if (!collection.isActive()) {
                throw new CollectionNotActiveException(collectionId, collection.getStatus().name());
            }

            // Step 3: Phase and price
            List<MintPhase> phases = store.findPhases(collectionId);
            ResolvedPhase resolvedPhase = phaseResolver.resolveActivePhase(
                    collectionId, phases, phaseId, wallet, allowListProof, now);

            // Step 4: Platform fee
            PlatformFee platformFee = priceOracleService.calculatePlatformFee();

            // Step 5: Freshness checkpoint; an unreachable ledger fails here, before any claim
            String recentCheckpoint = ledgerClient.getRecentCheckpoint();

            // Step 6: Claim
            Reservation draft = reservationAllocator.newDraft(idempotencyKey, collection, wallet, quantity,
                    resolvedPhase, platformFee, recentCheckpoint, now);
            ReservationView claimed = reservationAllocator.reserve(draft, resolvedPhase.phase().getMintLimit());
            if (claimed.replay()) {
                metricsService.recordReplay("reserve");
                return claimed;
            }

            // Step 7: Unsigned transaction
            Reservation ready = attachTransaction(claimed.reservation(), collection, resolvedPhase, platformFee);

            cacheService.invalidateAvailability(collectionId);
            metricsService.recordReservationSuccess(collectionId, quantity);
            publishQuietly(ready, null, EventType.RESERVED);
            return new ReservationView(ready, ready.getStatus(), false);

        } catch (MintDropException e) {
            metricsService.recordReservationFailure(collectionId, e.getErrorCode().name());
            throw e;
        }
    }

    /**
     * Record the buyer's confirmed payment and mint the reserved items.
     */
    public ConfirmedMint complete(String idempotencyKey, String signature, String wallet, List<String> itemIds) {
        Instant now = clock.instant();
        ConfirmedMint result = fulfillmentRecorder.complete(idempotencyKey, signature, wallet, itemIds, now);
        if (result.replay()) {
            metricsService.recordReplay("complete");
            return result;
        }

        String collectionId = result.transaction().getCollectionId();
        metricsService.recordMintConfirmed(collectionId, result.transaction().getQuantity());
        cacheService.invalidateAvailability(collectionId);

        store.findReservation(idempotencyKey)
                .ifPresent(reservation -> publishQuietly(reservation, signature, EventType.CONFIRMED));

        try {
            DropCollection collection = store.findCollection(collectionId)
                    .orElseThrow(() -> new ResourceNotFoundException("Collection", collectionId));
            assetIssuer.issue(collection, result);
        } catch (Exception e) {
            logger.error("Asset issuance hand-off failed for signature {}; mint is recorded", signature, e);
            metricsService.recordError("ASSET_ISSUANCE_FAILED", "complete");
        }
        return result;
    }

    /**
     * Current state of a reservation. Reports EXPIRED once the window has passed, even before the sweep.
     */
    public ReservationView getStatus(String idempotencyKey) {
        Reservation reservation = store.findReservation(idempotencyKey)
                .orElseThrow(() -> new ReservationNotFoundException(idempotencyKey));
        ReservationStatus effective = reservation.isExpiredAt(clock.instant())
                ? ReservationStatus.EXPIRED
                : reservation.getStatus();
        return new ReservationView(reservation, effective, false);
    }

    private Reservation attachTransaction(Reservation reservation, DropCollection collection,
                                          ResolvedPhase resolvedPhase, PlatformFee platformFee) {
        String payload;
        try {
            payload = transactionBuilder.build(reservation, collection, reservation.getWallet(),
                    resolvedPhase.unitPriceBaseUnits(), platformFee.feeInBaseUnits(),
                    reservation.getRecentCheckpoint());
        } catch (RuntimeException e) {
            logger.error("Could not build transaction for reservation {}", reservation.getIdempotencyKey(), e);
            store.markFailed(reservation.getIdempotencyKey(), e.getMessage());
            throw e;
        }
        return store.markTransactionReady(reservation.getIdempotencyKey(), payload);
    }

    private void publishQuietly(Reservation reservation, String signature, EventType eventType) {
        try {
            eventPublisher.publishLifecycleEvent(new ReservationLifecycleEvent(
                    reservation.getIdempotencyKey(),
                    reservation.getCollectionId(),
                    reservation.getWallet(),
                    reservation.getQuantity(),
                    reservation.getItemIds(),
                    signature,
                    eventType,
                    clock.instant()
            ));
        } catch (Exception e) {
            logger.error("Failed to publish {} event for reservation {}",
                    eventType, reservation.getIdempotencyKey(), e);
        }
    }
}
