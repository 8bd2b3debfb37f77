package com.cred.freestyle.mintdrop.infrastructure.scheduler;

import com.cred.freestyle.mintdrop.service.CollectionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Collection status upkeep: activates draft collections whose first phase has started,
 * keeps each active collection's minted count in step with its items and completes
 * collections that have sold out.
 *
 * @author Mint Drop Team
 */
@Service
public class MintedCountRefreshScheduler {

    private static final Logger logger = LoggerFactory.getLogger(MintedCountRefreshScheduler.class);

    private final CollectionService collectionService;

    public MintedCountRefreshScheduler(CollectionService collectionService) {
        this.collectionService = collectionService;
    }

    @Scheduled(fixedDelayString = "${mintdrop.collection.minted-count-refresh-ms:60000}")
    public void refreshMintedCounts() {
        try {
            int activated = collectionService.activateStartedCollections();
            if (activated > 0) {
                logger.info("Activated {} draft collections", activated);
            }
        } catch (Exception e) {
            logger.error("Error in collection activation", e);
        }

        try {
            int refreshed = collectionService.refreshMintedCounts();
            logger.debug("Refreshed minted count of {} active collections", refreshed);
        } catch (Exception e) {
            logger.error("Error in minted count refresh", e);
        }
    }
}
