package com.cred.freestyle.mintdrop.infrastructure.pricefeed;

import java.math.BigDecimal;

/**
 * Source of the live fiat price of one whole coin of the ledger's native currency.
 *
 * @author Mint Drop Team
 */
public interface PriceFeedClient {

    /**
     * @return fiat (USD) per whole coin, strictly positive
     * @throws com.cred.freestyle.mintdrop.exception.UpstreamUnavailableException on any fetch failure
     */
    BigDecimal fetchFiatPerCoin();
}
