package com.cred.freestyle.mintdrop.service;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Exchange rates between fiat (USD) and the ledger's native currency.
 *
 * @param fiatPerCoin fiat per whole coin
 * @param fiatPerBaseUnit fiat per smallest ledger unit
 * @param baseUnitsPerFiat smallest ledger units per one fiat unit
 * @param source where the rate came from
 * @param degraded true when a configured default was served instead of a real rate
 * @param fetchedAt when the underlying rate was fetched (null for the default)
 */
public record PriceRates(
        BigDecimal fiatPerCoin,
        BigDecimal fiatPerBaseUnit,
        BigDecimal baseUnitsPerFiat,
        RateSource source,
        boolean degraded,
        Instant fetchedAt
) {

    public enum RateSource {
        /**
         * Fetched from the price feed for this call.
         */
        LIVE,
        /**
         * Served from cache within the refresh interval.
         */
        CACHED,
        /**
         * Upstream failed; last good value, still under the staleness ceiling.
         */
        STALE,
        /**
         * Upstream failed and nothing usable was cached.
         */
        DEFAULT
    }
}
