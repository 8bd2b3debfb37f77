package com.cred.freestyle.mintdrop.service;

import com.cred.freestyle.mintdrop.domain.model.DropCollection;
import com.cred.freestyle.mintdrop.domain.model.MintPhase;
import com.cred.freestyle.mintdrop.exception.ResourceNotFoundException;
import com.cred.freestyle.mintdrop.infrastructure.cache.MintCacheService;
import com.cred.freestyle.mintdrop.infrastructure.metrics.MintMetricsService;
import com.cred.freestyle.mintdrop.repository.MintInventoryStore;
import com.cred.freestyle.mintdrop.repository.MintInventoryStore.InventoryCounts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read side of a collection: availability for display, plus status and minted count upkeep.
 *
 * Availability is served from cache when present. The cache is display-only; reservations
 * always go through the store.
 *
 * @author Mint Drop Team
 */
@Service
public class CollectionService {

    private static final Logger logger = LoggerFactory.getLogger(CollectionService.class);

    private final MintInventoryStore store;
    private final PhaseResolver phaseResolver;
    private final MintCacheService cacheService;
    private final MintMetricsService metricsService;
    private final Clock clock;

    public CollectionService(
            MintInventoryStore store,
            PhaseResolver phaseResolver,
            MintCacheService cacheService,
            MintMetricsService metricsService,
            Clock clock
    ) {
        this.store = store;
        this.phaseResolver = phaseResolver;
        this.cacheService = cacheService;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    /**
     * Inventory counts and open phases of a collection.
     *
     * @param idOrAddress collection id or ledger address
     * @throws ResourceNotFoundException if no such collection exists
     */
    public CollectionAvailability getAvailability(String idOrAddress) {
        DropCollection collection = store.findCollection(idOrAddress)
                .orElseThrow(() -> new ResourceNotFoundException("Collection", idOrAddress));
        String collectionId = collection.getCollectionId();

        Optional<InventoryCounts> cached = cacheService.getAvailability(collectionId);
        InventoryCounts counts;
        if (cached.isPresent()) {
            logger.debug("Availability cache hit for collection {}", collectionId);
            counts = cached.get();
        } else {
            counts = store.countInventory(collectionId);
            cacheService.setAvailability(collectionId, counts);
            metricsService.recordInventoryLevel(collectionId, counts.available());
        }

        Instant now = clock.instant();
        List<MintPhase> openPhases = phaseResolver.openPhases(store.findPhases(collectionId), now);
        return new CollectionAvailability(collection, counts, openPhases, cached.isPresent(), now);
    }

    /**
     * Activate every DRAFT collection whose earliest phase has started.
     *
     * @return number of collections activated
     */
    public int activateStartedCollections() {
        Instant now = clock.instant();
        int activated = 0;
        for (DropCollection collection : store.findDraftCollections()) {
            try {
                if (store.activateIfStarted(collection.getCollectionId(), now)) {
                    cacheService.invalidateAvailability(collection.getCollectionId());
                    activated++;
                }
            } catch (Exception e) {
                logger.error("Failed to activate collection {}", collection.getCollectionId(), e);
                metricsService.recordError("COLLECTION_ACTIVATION_FAILED", "activateStartedCollections");
            }
        }
        return activated;
    }

    /**
     * Recompute the denormalized minted count of every active collection.
     * Collections that sell out move to COMPLETED.
     *
     * @return number of collections refreshed
     */
    public int refreshMintedCounts() {
        Instant now = clock.instant();
        int refreshed = 0;
        for (DropCollection collection : store.findActiveCollections()) {
            try {
                InventoryCounts counts = store.refreshMintedCount(collection.getCollectionId(), now);
                metricsService.recordInventoryLevel(collection.getCollectionId(), counts.available());
                if (counts.soldOut()) {
                    logger.info("Collection {} sold out ({} of {} minted)",
                            collection.getCollectionId(), counts.minted(), counts.totalSupply());
                    cacheService.invalidateAvailability(collection.getCollectionId());
                }
                refreshed++;
            } catch (Exception e) {
                logger.error("Failed to refresh minted count for collection {}", collection.getCollectionId(), e);
                metricsService.recordError("MINTED_COUNT_REFRESH_FAILED", "refreshMintedCounts");
            }
        }
        return refreshed;
    }

    /**
     * @param collection the collection
     * @param counts item counts by state
     * @param openPhases phases open at {@code asOf}, earliest start first
     * @param fromCache whether counts came from the display cache
     * @param asOf evaluation time
     */
    public record CollectionAvailability(
            DropCollection collection,
            InventoryCounts counts,
            List<MintPhase> openPhases,
            boolean fromCache,
            Instant asOf
    ) {
        public Optional<MintPhase> activePhase() {
            return openPhases.stream().findFirst();
        }
    }
}
