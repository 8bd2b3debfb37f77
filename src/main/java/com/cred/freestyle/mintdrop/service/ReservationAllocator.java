package com.cred.freestyle.mintdrop.service;

import com.cred.freestyle.mintdrop.domain.model.DropCollection;
import com.cred.freestyle.mintdrop.domain.model.Reservation;
import com.cred.freestyle.mintdrop.domain.model.Reservation.ReservationStatus;
import com.cred.freestyle.mintdrop.exception.IdempotencyConflictException;
import com.cred.freestyle.mintdrop.exception.ReservationExpiredException;
import com.cred.freestyle.mintdrop.repository.MintInventoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Claims inventory for a reservation, at most once per idempotency key.
 *
 * The claim itself is a single atomic store operation; this class only decides whether a
 * request is a replay of an existing reservation or a new claim, and what the new
 * reservation looks like.
 *
 * @author Mint Drop Team
 */
@Component
public class ReservationAllocator {

    private static final Logger logger = LoggerFactory.getLogger(ReservationAllocator.class);

    private final MintInventoryStore store;
    private final Duration reservationExpiry;

    public ReservationAllocator(
            MintInventoryStore store,
            @Value("${mintdrop.reservation.expiry-minutes:10}") long expiryMinutes
    ) {
        this.store = store;
        this.reservationExpiry = Duration.ofMinutes(expiryMinutes);
    }

    /**
     * Existing reservation for the key, if the request is a replay.
     *
     * @throws IdempotencyConflictException if the key was used with different parameters
     * @throws ReservationExpiredException if the reservation under the key has expired
     */
    public Optional<Reservation> findReplay(String idempotencyKey, String collectionId, String wallet,
                                            int quantity, Instant now) {
        return store.findReservation(idempotencyKey)
                .map(existing -> checkReplay(existing, collectionId, wallet, quantity, now));
    }

    /**
     * New PENDING reservation with its price frozen, not yet stored.
     */
    public Reservation newDraft(
            String idempotencyKey,
            DropCollection collection,
            String wallet,
            int quantity,
            ResolvedPhase resolvedPhase,
            PlatformFee platformFee,
            String recentCheckpoint,
            Instant now
    ) {
        PriceRates rates = platformFee.rates();
        return Reservation.builder()
                .idempotencyKey(idempotencyKey)
                .collectionId(collection.getCollectionId())
                .wallet(wallet)
                .phaseId(resolvedPhase.phase().getPhaseId())
                .phaseName(resolvedPhase.phase().getName())
                .quantity(quantity)
                .status(ReservationStatus.PENDING)
                .unitPrice(resolvedPhase.unitPrice())
                .unitPriceBaseUnits(resolvedPhase.unitPriceBaseUnits())
                .itemsTotalBaseUnits(resolvedPhase.itemsTotalBaseUnits(quantity))
                .platformFeeFiat(platformFee.feeInFiat())
                .platformFeeBaseUnits(platformFee.feeInBaseUnits())
                .fiatPerCoin(rates.fiatPerCoin())
                .rateSource(rates.source().name())
                .rateDegraded(rates.degraded())
                .recentCheckpoint(recentCheckpoint)
                .createdAt(now)
                .expiresAt(now.plus(reservationExpiry))
                .build();
    }

    /**
     * Store the draft and claim its items.
     *
     * @param draft new reservation from {@link #newDraft}
     * @param phaseMintLimit per-wallet limit of the draft's phase, or null
     * @return the claimed reservation; replay=true if a concurrent request with the same key won
     */
    public ReservationView reserve(Reservation draft, Integer phaseMintLimit) {
        try {
            Reservation claimed = store.atomicReserve(draft, phaseMintLimit);
            logger.info("Reserved {} items {} of collection {} for wallet {} (key: {})",
                    claimed.getQuantity(), claimed.getItemIds(), claimed.getCollectionId(),
                    claimed.getWallet(), claimed.getIdempotencyKey());
            return new ReservationView(claimed, claimed.getStatus(), false);
        } catch (DataIntegrityViolationException e) {
            // The same key was claimed concurrently and committed first
            Reservation existing = store.findReservation(draft.getIdempotencyKey()).orElseThrow(() -> e);
            logger.info("Concurrent reserve for key {} resolved to existing reservation", draft.getIdempotencyKey());
            Reservation replayed = checkReplay(existing, draft.getCollectionId(), draft.getWallet(),
                    draft.getQuantity(), draft.getCreatedAt());
            return new ReservationView(replayed, replayed.getStatus(), true);
        }
    }

    private Reservation checkReplay(Reservation existing, String collectionId, String wallet,
                                    int quantity, Instant now) {
        if (!existing.matchesRequest(collectionId, wallet, quantity)) {
            throw new IdempotencyConflictException(existing.getIdempotencyKey(), String.format(
                    "Idempotency key %s was already used for a different request", existing.getIdempotencyKey()));
        }
        if (existing.isExpiredAt(now)) {
            throw new ReservationExpiredException(existing.getIdempotencyKey(), existing.getExpiresAt());
        }
        return existing;
    }
}
