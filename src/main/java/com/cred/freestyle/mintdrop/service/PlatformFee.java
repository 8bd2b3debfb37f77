package com.cred.freestyle.mintdrop.service;

import java.math.BigDecimal;

/**
 * Fixed fiat platform fee converted to ledger base units at the rate it was priced with.
 */
public record PlatformFee(
        BigDecimal feeInFiat,
        long feeInBaseUnits,
        PriceRates rates
) {}
