package com.cred.freestyle.mintdrop.api.controller;

import com.cred.freestyle.mintdrop.api.dto.CollectionAvailabilityResponse;
import com.cred.freestyle.mintdrop.service.CollectionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for collection display data.
 *
 * @author Mint Drop Team
 */
@RestController
@RequestMapping("/api/v1/collections")
public class CollectionController {

    private static final Logger logger = LoggerFactory.getLogger(CollectionController.class);

    private final CollectionService collectionService;

    public CollectionController(CollectionService collectionService) {
        this.collectionService = collectionService;
    }

    /**
     * Supply counts and the active phase. For display only; may lag a few seconds.
     *
     * @param idOrAddress collection id or ledger address
     */
    @GetMapping("/{idOrAddress}/availability")
    public ResponseEntity<CollectionAvailabilityResponse> getAvailability(@PathVariable String idOrAddress) {
        logger.debug("Fetching availability for collection: {}", idOrAddress);
        return ResponseEntity.ok(CollectionAvailabilityResponse.fromAvailability(
                collectionService.getAvailability(idOrAddress)));
    }
}
