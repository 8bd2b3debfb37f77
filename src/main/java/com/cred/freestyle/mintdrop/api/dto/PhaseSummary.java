package com.cred.freestyle.mintdrop.api.dto;

import com.cred.freestyle.mintdrop.domain.model.MintPhase;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * @author Mint Drop Team
 */
public class PhaseSummary {

    private String phaseId;
    private String name;
    private BigDecimal price;
    private Instant startTime;
    private Instant endTime;
    private boolean allowList;
    private Integer mintLimit;

    public PhaseSummary() {
    }

    public static PhaseSummary fromEntity(MintPhase phase) {
        PhaseSummary summary = new PhaseSummary();
        summary.setPhaseId(phase.getPhaseId());
        summary.setName(phase.getName());
        summary.setPrice(phase.getPrice());
        summary.setStartTime(phase.getStartTime());
        summary.setEndTime(phase.getEndTime());
        summary.setAllowList(phase.isAllowList());
        summary.setMintLimit(phase.getMintLimit());
        return summary;
    }

    // Getters and setters
    public String getPhaseId() {
        return phaseId;
    }

    public void setPhaseId(String phaseId) {
        this.phaseId = phaseId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public BigDecimal getPrice() {
        return price;
    }

    public void setPrice(BigDecimal price) {
        this.price = price;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public void setStartTime(Instant startTime) {
        this.startTime = startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }

    public void setEndTime(Instant endTime) {
        this.endTime = endTime;
    }

    public boolean isAllowList() {
        return allowList;
    }

    public void setAllowList(boolean allowList) {
        this.allowList = allowList;
    }

    public Integer getMintLimit() {
        return mintLimit;
    }

    public void setMintLimit(Integer mintLimit) {
        this.mintLimit = mintLimit;
    }
}
