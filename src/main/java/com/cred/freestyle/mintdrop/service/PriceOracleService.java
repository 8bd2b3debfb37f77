package com.cred.freestyle.mintdrop.service;

import com.cred.freestyle.mintdrop.infrastructure.cache.MintCacheService;
import com.cred.freestyle.mintdrop.infrastructure.cache.MintCacheService.CachedRate;
import com.cred.freestyle.mintdrop.infrastructure.metrics.MintMetricsService;
import com.cred.freestyle.mintdrop.infrastructure.pricefeed.PriceFeedClient;
import com.cred.freestyle.mintdrop.service.PriceRates.RateSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Price oracle adapter: caches the fiat/coin exchange rate and prices the platform fee.
 *
 * Failure policy:
 * 1. Serve the cached rate while it is younger than the refresh interval
 * 2. Otherwise fetch, retrying once on failure
 * 3. If both attempts fail, serve the most recent last good rate (local or shared Redis copy)
 *    while it is younger than multiplier x refresh interval
 * 4. Otherwise serve the configured default rate, flagged as degraded
 *
 * After a failed refresh no fetch is attempted for one refresh interval; callers get the
 * fallback rate meanwhile.
 *
 * Callers never see an exception from this service.
 *
 * @author Mint Drop Team
 */
@Service
public class PriceOracleService {

    private static final Logger logger = LoggerFactory.getLogger(PriceOracleService.class);
    private static final int RATE_SCALE = 18;

    private final PriceFeedClient priceFeedClient;
    private final MintCacheService cacheService;
    private final MintMetricsService metricsService;
    private final Clock clock;

    private final Duration refreshInterval;
    private final Duration staleCeiling;
    private final BigDecimal defaultFiatPerCoin;
    private final BigDecimal platformFeeFiat;
    private final BigDecimal baseUnitsPerCoin;

    private final AtomicReference<CachedRate> lastGoodRate = new AtomicReference<>();
    private volatile Instant lastFailedRefresh;

    public PriceOracleService(
            PriceFeedClient priceFeedClient,
            MintCacheService cacheService,
            MintMetricsService metricsService,
            Clock clock,
            @Value("${mintdrop.price-oracle.refresh-seconds:60}") long refreshSeconds,
            @Value("${mintdrop.price-oracle.stale-ceiling-multiplier:10}") long staleCeilingMultiplier,
            @Value("${mintdrop.price-oracle.default-fiat-per-coin:20}") BigDecimal defaultFiatPerCoin,
            @Value("${mintdrop.platform.fee-fiat:1.25}") BigDecimal platformFeeFiat,
            @Value("${mintdrop.ledger.base-unit-decimals:9}") int baseUnitDecimals
    ) {
        this.priceFeedClient = priceFeedClient;
        this.cacheService = cacheService;
        this.metricsService = metricsService;
        this.clock = clock;
        this.refreshInterval = Duration.ofSeconds(refreshSeconds);
        this.staleCeiling = refreshInterval.multipliedBy(staleCeilingMultiplier);
        this.defaultFiatPerCoin = defaultFiatPerCoin;
        this.platformFeeFiat = platformFeeFiat;
        this.baseUnitsPerCoin = BigDecimal.TEN.pow(baseUnitDecimals);
    }

    /**
     * Current exchange rates.
     *
     * @return rates, possibly cached, stale or defaulted
     */
    public PriceRates getRates() {
        Instant now = clock.instant();
        CachedRate cached = lastGoodRate.get();
        if (isYoungerThan(cached, refreshInterval, now)) {
            return toRates(cached.fiatPerCoin(), RateSource.CACHED, cached.fetchedAt());
        }
        if (recentlyFailed(now)) {
            return fallback(now);
        }
        return refresh(now);
    }

    /**
     * Price the fixed fiat platform fee in base units, rounded up to the next whole base unit.
     */
    public PlatformFee calculatePlatformFee() {
        PriceRates rates = getRates();
        long feeInBaseUnits = platformFeeFiat
                .multiply(baseUnitsPerCoin)
                .divide(rates.fiatPerCoin(), 0, RoundingMode.CEILING)
                .longValueExact();
        return new PlatformFee(platformFeeFiat, feeInBaseUnits, rates);
    }

    /**
     * Convert whole coins to base units, rounding any fractional base unit up.
     */
    public long toBaseUnits(BigDecimal coins) {
        return coins.multiply(baseUnitsPerCoin).setScale(0, RoundingMode.CEILING).longValueExact();
    }

    private synchronized PriceRates refresh(Instant now) {
        // Another caller may have refreshed, or failed to, while this one waited
        CachedRate cached = lastGoodRate.get();
        if (isYoungerThan(cached, refreshInterval, now)) {
            return toRates(cached.fiatPerCoin(), RateSource.CACHED, cached.fetchedAt());
        }
        if (recentlyFailed(now)) {
            return fallback(now);
        }

        Optional<BigDecimal> fetched = fetchWithRetry();
        if (fetched.isPresent()) {
            CachedRate fresh = new CachedRate(fetched.get(), now);
            lastGoodRate.set(fresh);
            lastFailedRefresh = null;
            cacheService.setLastRate(fresh);
            return toRates(fresh.fiatPerCoin(), RateSource.LIVE, now);
        }

        lastFailedRefresh = now;
        return fallback(now);
    }

    private PriceRates fallback(Instant now) {
        CachedRate fallback = mostRecent(lastGoodRate.get(), cacheService.getLastRate().orElse(null));
        if (isYoungerThan(fallback, staleCeiling, now)) {
            logger.warn("Price feed unavailable, serving rate from {}", fallback.fetchedAt());
            metricsService.recordOracleFallback(RateSource.STALE.name());
            return toRates(fallback.fiatPerCoin(), RateSource.STALE, fallback.fetchedAt());
        }

        logger.warn("Price feed unavailable and no usable cached rate, serving default {} (degraded)",
                defaultFiatPerCoin);
        metricsService.recordOracleFallback(RateSource.DEFAULT.name());
        return toRates(defaultFiatPerCoin, RateSource.DEFAULT, null);
    }

    private boolean recentlyFailed(Instant now) {
        Instant failedAt = lastFailedRefresh;
        return failedAt != null && Duration.between(failedAt, now).compareTo(refreshInterval) < 0;
    }

    private static CachedRate mostRecent(CachedRate local, CachedRate shared) {
        if (local == null) {
            return shared;
        }
        if (shared == null) {
            return local;
        }
        return shared.fetchedAt().isAfter(local.fetchedAt()) ? shared : local;
    }

    private Optional<BigDecimal> fetchWithRetry() {
        for (int attempt = 1; attempt <= 2; attempt++) {
            try {
                return Optional.of(priceFeedClient.fetchFiatPerCoin());
            } catch (RuntimeException e) {
                logger.warn("Price feed attempt {} failed: {}", attempt, e.getMessage());
            }
        }
        return Optional.empty();
    }

    private PriceRates toRates(BigDecimal fiatPerCoin, RateSource source, Instant fetchedAt) {
        BigDecimal fiatPerBaseUnit = fiatPerCoin.divide(baseUnitsPerCoin, RATE_SCALE, RoundingMode.HALF_UP);
        BigDecimal baseUnitsPerFiat = baseUnitsPerCoin.divide(fiatPerCoin, MathContext.DECIMAL64);
        return new PriceRates(fiatPerCoin, fiatPerBaseUnit, baseUnitsPerFiat, source,
                source == RateSource.DEFAULT, fetchedAt);
    }

    private static boolean isYoungerThan(CachedRate rate, Duration maxAge, Instant now) {
        return rate != null && Duration.between(rate.fetchedAt(), now).compareTo(maxAge) < 0;
    }
}
