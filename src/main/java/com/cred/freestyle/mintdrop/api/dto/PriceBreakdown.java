package com.cred.freestyle.mintdrop.api.dto;

import com.cred.freestyle.mintdrop.domain.model.Reservation;

import java.math.BigDecimal;

/**
 * Price of a reservation as frozen at reserve time.
 * totalBaseUnits = itemsTotalBaseUnits + platformFeeBaseUnits; the buyer also pays the network fee.
 *
 * @author Mint Drop Team
 */
public class PriceBreakdown {

    private String phaseId;
    private String phaseName;
    private BigDecimal unitPrice;
    private Long unitPriceBaseUnits;
    private Long itemsTotalBaseUnits;
    private BigDecimal platformFeeFiat;
    private Long platformFeeBaseUnits;
    private Long totalBaseUnits;
    private BigDecimal fiatPerCoin;
    private String rateSource;
    private boolean degraded;

    public PriceBreakdown() {
    }

    public static PriceBreakdown fromEntity(Reservation reservation) {
        PriceBreakdown breakdown = new PriceBreakdown();
        breakdown.setPhaseId(reservation.getPhaseId());
        breakdown.setPhaseName(reservation.getPhaseName());
        breakdown.setUnitPrice(reservation.getUnitPrice());
        breakdown.setUnitPriceBaseUnits(reservation.getUnitPriceBaseUnits());
        breakdown.setItemsTotalBaseUnits(reservation.getItemsTotalBaseUnits());
        breakdown.setPlatformFeeFiat(reservation.getPlatformFeeFiat());
        breakdown.setPlatformFeeBaseUnits(reservation.getPlatformFeeBaseUnits());
        long items = reservation.getItemsTotalBaseUnits() == null ? 0L : reservation.getItemsTotalBaseUnits();
        long fee = reservation.getPlatformFeeBaseUnits() == null ? 0L : reservation.getPlatformFeeBaseUnits();
        breakdown.setTotalBaseUnits(items + fee);
        breakdown.setFiatPerCoin(reservation.getFiatPerCoin());
        breakdown.setRateSource(reservation.getRateSource());
        breakdown.setDegraded(reservation.isRateDegraded());
        return breakdown;
    }

    // Getters and setters
    public String getPhaseId() {
        return phaseId;
    }

    public void setPhaseId(String phaseId) {
        this.phaseId = phaseId;
    }

    public String getPhaseName() {
        return phaseName;
    }

    public void setPhaseName(String phaseName) {
        this.phaseName = phaseName;
    }

    public BigDecimal getUnitPrice() {
        return unitPrice;
    }

    public void setUnitPrice(BigDecimal unitPrice) {
        this.unitPrice = unitPrice;
    }

    public Long getUnitPriceBaseUnits() {
        return unitPriceBaseUnits;
    }

    public void setUnitPriceBaseUnits(Long unitPriceBaseUnits) {
        this.unitPriceBaseUnits = unitPriceBaseUnits;
    }

    public Long getItemsTotalBaseUnits() {
        return itemsTotalBaseUnits;
    }

    public void setItemsTotalBaseUnits(Long itemsTotalBaseUnits) {
        this.itemsTotalBaseUnits = itemsTotalBaseUnits;
    }

    public BigDecimal getPlatformFeeFiat() {
        return platformFeeFiat;
    }

    public void setPlatformFeeFiat(BigDecimal platformFeeFiat) {
        this.platformFeeFiat = platformFeeFiat;
    }

    public Long getPlatformFeeBaseUnits() {
        return platformFeeBaseUnits;
    }

    public void setPlatformFeeBaseUnits(Long platformFeeBaseUnits) {
        this.platformFeeBaseUnits = platformFeeBaseUnits;
    }

    public Long getTotalBaseUnits() {
        return totalBaseUnits;
    }

    public void setTotalBaseUnits(Long totalBaseUnits) {
        this.totalBaseUnits = totalBaseUnits;
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
