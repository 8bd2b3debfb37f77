package com.cred.freestyle.mintdrop.api.dto;

import com.cred.freestyle.mintdrop.service.PlatformFee;

import java.math.BigDecimal;

/**
 * @author Mint Drop Team
 */
public class PlatformFeeResponse {

    private BigDecimal feeInFiat;
    private Long feeInBaseUnits;
    private BigDecimal fiatPerCoin;
    private String rateSource;
    private boolean degraded;

    public PlatformFeeResponse() {
    }

    public static PlatformFeeResponse fromFee(PlatformFee fee) {
        PlatformFeeResponse response = new PlatformFeeResponse();
        response.setFeeInFiat(fee.feeInFiat());
        response.setFeeInBaseUnits(fee.feeInBaseUnits());
        response.setFiatPerCoin(fee.rates().fiatPerCoin());
        response.setRateSource(fee.rates().source().name());
        response.setDegraded(fee.rates().degraded());
        return response;
    }

    // Getters and setters
    public BigDecimal getFeeInFiat() {
        return feeInFiat;
    }

    public void setFeeInFiat(BigDecimal feeInFiat) {
        this.feeInFiat = feeInFiat;
    }

    public Long getFeeInBaseUnits() {
        return feeInBaseUnits;
    }

    public void setFeeInBaseUnits(Long feeInBaseUnits) {
        this.feeInBaseUnits = feeInBaseUnits;
    }

    public BigDecimal getFiatPerCoin() {
        return fiatPerCoin;
    }

    public void setFiatPerCoin(BigDecimal fiatPerCoin) {
        this.fiatPerCoin = fiatPerCoin;
    }

    public String getRateSource() {
        return rateSource;
    }

    public void setRateSource(String rateSource) {
        this.rateSource = rateSource;
    }

    public boolean isDegraded() {
        return degraded;
    }

    public void setDegraded(boolean degraded) {
        this.degraded = degraded;
    }
}
