package com.cred.freestyle.mintdrop.api.dto;

import com.cred.freestyle.mintdrop.service.PriceRates;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * @author Mint Drop Team
 */
public class PriceResponse {

    private BigDecimal fiatPerCoin;
    private BigDecimal fiatPerBaseUnit;
    private BigDecimal baseUnitsPerFiat;
    private String source;
    private boolean degraded;
    private Instant fetchedAt;

    public PriceResponse() {
    }

    public static PriceResponse fromRates(PriceRates rates) {
        PriceResponse response = new PriceResponse();
        response.setFiatPerCoin(rates.fiatPerCoin());
        response.setFiatPerBaseUnit(rates.fiatPerBaseUnit());
        response.setBaseUnitsPerFiat(rates.baseUnitsPerFiat());
        response.setSource(rates.source().name());
        response.setDegraded(rates.degraded());
        response.setFetchedAt(rates.fetchedAt());
        return response;
    }

    // Getters and setters
    public BigDecimal getFiatPerCoin() {
        return fiatPerCoin;
    }

    public void setFiatPerCoin(BigDecimal fiatPerCoin) {
        this.fiatPerCoin = fiatPerCoin;
    }

    public BigDecimal getFiatPerBaseUnit() {
        return fiatPerBaseUnit;
    }

    public void setFiatPerBaseUnit(BigDecimal fiatPerBaseUnit) {
        this.fiatPerBaseUnit = fiatPerBaseUnit;
    }

    public BigDecimal getBaseUnitsPerFiat() {
        return baseUnitsPerFiat;
    }

    public void setBaseUnitsPerFiat(BigDecimal baseUnitsPerFiat) {
        this.baseUnitsPerFiat = baseUnitsPerFiat;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public boolean isDegraded() {
        return degraded;
    }

    public void setDegraded(boolean degraded) {
        this.degraded = degraded;
    }

    public Instant getFetchedAt() {
        return fetchedAt;
    }

    public void setFetchedAt(Instant fetchedAt) {
        this.fetchedAt = fetchedAt;
    }
}
