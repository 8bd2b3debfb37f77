package com.cred.freestyle.mintdrop.infrastructure.scheduler;

import com.cred.freestyle.mintdrop.domain.model.Reservation;
import com.cred.freestyle.mintdrop.infrastructure.cache.MintCacheService;
import com.cred.freestyle.mintdrop.infrastructure.messaging.MintEventPublisher;
import com.cred.freestyle.mintdrop.infrastructure.messaging.events.ReservationLifecycleEvent;
import com.cred.freestyle.mintdrop.infrastructure.metrics.MintMetricsService;
import com.cred.freestyle.mintdrop.repository.MintInventoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Releases the items of reservations that were never confirmed.
 *
 * Each run:
 * 1. Finds up to batch-size holding reservations whose expires_at has passed
 * 2. Expires each one in its own store transaction: items back to UNSOLD, status EXPIRED
 * 3. Publishes an EXPIRED event and drops the cached availability
 *
 * A reservation confirmed between steps 1 and 2 is left alone; the store re-checks
 * status under the row lock. Running twice on the same reservation is a no-op.
 *
 * @author Mint Drop Team
 */
@Service
public class ReservationExpiryScheduler {

    private static final Logger logger = LoggerFactory.getLogger(ReservationExpiryScheduler.class);

    private final MintInventoryStore store;
    private final MintCacheService cacheService;
    private final MintEventPublisher eventPublisher;
    private final MintMetricsService metricsService;
    private final Clock clock;

    @Value("${mintdrop.reservation.expiry-scheduler.enabled:true}")
    private boolean schedulerEnabled;

    @Value("${mintdrop.reservation.expiry-scheduler.batch-size:100}")
    private int batchSize;

    public ReservationExpiryScheduler(
            MintInventoryStore store,
            MintCacheService cacheService,
            MintEventPublisher eventPublisher,
            MintMetricsService metricsService,
            Clock clock
    ) {
        this.store = store;
        this.cacheService = cacheService;
        this.eventPublisher = eventPublisher;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${mintdrop.reservation.expiry-scheduler.interval-ms:10000}")
    public void sweepExpiredReservations() {
        if (!schedulerEnabled) {
            logger.debug("Reservation expiry scheduler is disabled");
            return;
        }

        try {
            long startTime = System.currentTimeMillis();
            int expired = sweep(batchSize);
            if (expired > 0) {
                logger.info("Expiry sweep released {} reservations in {}ms",
                        expired, System.currentTimeMillis() - startTime);
            }
        } catch (Exception e) {
            logger.error("Error in reservation expiry scheduler", e);
            metricsService.recordError("RESERVATION_EXPIRY_SCHEDULER_ERROR", "sweepExpiredReservations");
        }
    }

    /**
     * Run a sweep immediately, regardless of the enabled flag.
     *
     * @return number of reservations expired
     */
    public int triggerSweepNow() {
        logger.info("Manual expiry sweep triggered");
        return sweep(batchSize);
    }

    int sweep(int limit) {
        Instant now = clock.instant();
        List<String> keys = store.findExpiredReservationKeys(now, limit);
        if (keys.isEmpty()) {
            logger.debug("No expired reservations found");
            return 0;
        }

        int expiredCount = 0;
        int failedCount = 0;
        for (String key : keys) {
            try {
                if (store.expireReservation(key, now)) {
                    expiredCount++;
                    afterExpiry(key);
                }
            } catch (Exception e) {
                failedCount++;
                logger.error("Error expiring reservation {}", key, e);
                metricsService.recordError("RESERVATION_EXPIRY_PROCESSING_ERROR", "sweepExpiredReservations");
            }
        }
        if (failedCount > 0) {
            logger.warn("Expiry sweep: {} expired, {} failed", expiredCount, failedCount);
        }
        return expiredCount;
    }

    private void afterExpiry(String key) {
        Reservation reservation = store.findReservation(key).orElse(null);
        if (reservation == null) {
            return;
        }
        String collectionId = reservation.getCollectionId();
        logger.info("Expired reservation {} (released {} items of {})",
                key, reservation.getQuantity(), collectionId);
        metricsService.recordReservationExpiry(collectionId);
        cacheService.invalidateAvailability(collectionId);

        try {
            eventPublisher.publishLifecycleEvent(new ReservationLifecycleEvent(
                    key,
                    collectionId,
                    reservation.getWallet(),
                    reservation.getQuantity(),
                    reservation.getItemIds(),
                    null,
                    ReservationLifecycleEvent.EventType.EXPIRED,
                    clock.instant()
            ));
        } catch (Exception e) {
            logger.error("Failed to publish expiry event for reservation {}", key, e);
        }
    }
}
