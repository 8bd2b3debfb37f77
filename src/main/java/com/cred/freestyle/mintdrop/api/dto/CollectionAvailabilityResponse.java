package com.cred.freestyle.mintdrop.api.dto;

import com.cred.freestyle.mintdrop.domain.model.DropCollection;
import com.cred.freestyle.mintdrop.repository.MintInventoryStore.InventoryCounts;
import com.cred.freestyle.mintdrop.service.CollectionService.CollectionAvailability;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collection availability for display. Counts may lag by a few seconds when served from cache.
 *
 * @author Mint Drop Team
 */
public class CollectionAvailabilityResponse {

    private String collectionId;
    private String name;
    private String collectionAddress;
    private String status;
    private Integer totalSupply;
    private Integer minted;
    private Integer reserved;
    private Integer available;
    private boolean soldOut;
    private PhaseSummary activePhase;
    private List<PhaseSummary> openPhases;
    private boolean cached;
    private Instant asOf;

    public CollectionAvailabilityResponse() {
    }

    public static CollectionAvailabilityResponse fromAvailability(CollectionAvailability availability) {
        DropCollection collection = availability.collection();
        InventoryCounts counts = availability.counts();

        CollectionAvailabilityResponse response = new CollectionAvailabilityResponse();
        response.setCollectionId(collection.getCollectionId());
        response.setName(collection.getName());
        response.setCollectionAddress(collection.getCollectionAddress());
        response.setStatus(collection.getStatus().name());
        response.setTotalSupply(counts.totalSupply());
        response.setMinted(counts.minted());
        response.setReserved(counts.reserved());
        response.setAvailable(counts.available());
        response.setSoldOut(counts.soldOut());
        response.setActivePhase(availability.activePhase().map(PhaseSummary::fromEntity).orElse(null));
        response.setOpenPhases(availability.openPhases().stream()
                .map(PhaseSummary::fromEntity)
                .collect(Collectors.toList()));
        response.setCached(availability.fromCache());
        response.setAsOf(availability.asOf());
        return response;
    }

    // Getters and setters
    public String getCollectionId() {
        return collectionId;
    }

    public void setCollectionId(String collectionId) {
        this.collectionId = collectionId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getCollectionAddress() {
        return collectionAddress;
    }

    public void setCollectionAddress(String collectionAddress) {
        this.collectionAddress = collectionAddress;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public Integer getTotalSupply() {
        return totalSupply;
    }

    public void setTotalSupply(Integer totalSupply) {
        this.totalSupply = totalSupply;
    }

    public Integer getMinted() {
        return minted;
    }

    public void setMinted(Integer minted) {
        this.minted = minted;
    }

    public Integer getReserved() {
        return reserved;
    }

    public void setReserved(Integer reserved) {
        this.reserved = reserved;
    }

    public Integer getAvailable() {
        return available;
    }

    public void setAvailable(Integer available) {
        this.available = available;
    }

    public boolean isSoldOut() {
        return soldOut;
    }

    public void setSoldOut(boolean soldOut) {
        this.soldOut = soldOut;
    }

    public PhaseSummary getActivePhase() {
        return activePhase;
    }

    public void setActivePhase(PhaseSummary activePhase) {
        this.activePhase = activePhase;
    }

    public List<PhaseSummary> getOpenPhases() {
        return openPhases;
    }

    public void setOpenPhases(List<PhaseSummary> openPhases) {
        this.openPhases = openPhases;
    }

    public boolean isCached() {
        return cached;
    }

    public void setCached(boolean cached) {
        this.cached = cached;
    }

    public Instant getAsOf() {
        return asOf;
    }

    public void setAsOf(Instant asOf) {
        this.asOf = asOf;
    }
}
