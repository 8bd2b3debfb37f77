package com.cred.freestyle.mintdrop.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer metrics for the mint engine, published to CloudWatch when that registry is configured.
 *
 * Key Metrics:
 * - Reservation success/failure/replay counts per collection
 * - Confirmations and expiries
 * - Price oracle fallbacks
 * - Reserve and complete latency (p50, p95, p99)
 * - Available inventory per collection
 *
 * @author Mint Drop Team
 */
@Service
public class MintMetricsService {

    private static final Logger logger = LoggerFactory.getLogger(MintMetricsService.class);

    private static final String METRIC_PREFIX = "mintdrop.";
    private static final String RESERVATION_PREFIX = METRIC_PREFIX + "reservation.";
    private static final String MINT_PREFIX = METRIC_PREFIX + "mint.";
    private static final String INVENTORY_PREFIX = METRIC_PREFIX + "inventory.";
    private static final String ORACLE_PREFIX = METRIC_PREFIX + "price_oracle.";

    private final MeterRegistry meterRegistry;

    // Gauges hold a reference to their value; keep one per collection
    private final Map<String, AtomicInteger> availableGauges = new ConcurrentHashMap<>();

    public MintMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void recordReservationSuccess(String collectionId, int quantity) {
        Counter.builder(RESERVATION_PREFIX + "success")
                .tag("collection_id", collectionId)
                .description("Successful reservations")
                .register(meterRegistry)
                .increment();
        Counter.builder(RESERVATION_PREFIX + "items")
                .tag("collection_id", collectionId)
                .description("Items claimed by reservations")
                .register(meterRegistry)
                .increment(quantity);
        logger.debug("Recorded reservation success for collection: {}", collectionId);
    }

    /**
     * @param reason stable error code, e.g. INSUFFICIENT_SUPPLY
     */
    public void recordReservationFailure(String collectionId, String reason) {
        Counter.builder(RESERVATION_PREFIX + "failure")
                .tag("collection_id", collectionId)
                .tag("reason", reason)
                .description("Rejected reservation attempts")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Idempotent replays of reserve or complete.
     */
    public void recordReplay(String operation) {
        Counter.builder(METRIC_PREFIX + "replay")
                .tag("operation", operation)
                .description("Requests answered from an existing idempotency record")
                .register(meterRegistry)
                .increment();
    }

    public void recordReservationExpiry(String collectionId) {
        Counter.builder(RESERVATION_PREFIX + "expired")
                .tag("collection_id", collectionId)
                .description("Reservations released by the expiry sweep")
                .register(meterRegistry)
                .increment();
    }

    public void recordMintConfirmed(String collectionId, int quantity) {
        Counter.builder(MINT_PREFIX + "confirmed")
                .tag("collection_id", collectionId)
                .description("Confirmed mints")
                .register(meterRegistry)
                .increment();
        Counter.builder(MINT_PREFIX + "items")
                .tag("collection_id", collectionId)
                .description("Items minted")
                .register(meterRegistry)
                .increment(quantity);
    }

    public void recordInventoryLevel(String collectionId, int availableCount) {
        availableGauges.computeIfAbsent(collectionId, id -> meterRegistry.gauge(
                INVENTORY_PREFIX + "available", Tags.of("collection_id", id), new AtomicInteger()))
                .set(availableCount);
    }

    /**
     * @param source where the served rate came from: CACHED, STALE or DEFAULT
     */
    public void recordOracleFallback(String source) {
        Counter.builder(ORACLE_PREFIX + "fallback")
                .tag("source", source)
                .description("Rates served without a fresh upstream fetch")
                .register(meterRegistry)
                .increment();
    }

    public void recordReserveLatency(long durationMs) {
        Timer.builder(RESERVATION_PREFIX + "latency")
                .description("Reserve API latency")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordCompleteLatency(long durationMs) {
        Timer.builder(MINT_PREFIX + "complete.latency")
                .description("Complete API latency")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    /**
     * @param errorType Error type or code
     * @param operation Operation that failed
     */
    public void recordError(String errorType, String operation) {
        Counter.builder(METRIC_PREFIX + "errors")
                .tag("error_type", errorType)
                .tag("operation", operation)
                .description("Application errors")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded error: {} in operation: {}", errorType, operation);
    }
}
