package com.cred.freestyle.mintdrop.api.controller;

import com.cred.freestyle.mintdrop.api.dto.MintCompleteRequest;
import com.cred.freestyle.mintdrop.api.dto.MintCompleteResponse;
import com.cred.freestyle.mintdrop.api.dto.MintReserveRequest;
import com.cred.freestyle.mintdrop.api.dto.MintReserveResponse;
import com.cred.freestyle.mintdrop.api.dto.MintStatusResponse;
import com.cred.freestyle.mintdrop.infrastructure.metrics.MintMetricsService;
import com.cred.freestyle.mintdrop.repository.MintInventoryStore.ConfirmedMint;
import com.cred.freestyle.mintdrop.service.MintService;
import com.cred.freestyle.mintdrop.service.ReservationView;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for the mint flow: reserve, complete, status.
 *
 * Both writes are idempotent. A replayed reserve answers 200 with the original body instead of 201.
 *
 * @author Mint Drop Team
 */
@RestController
@RequestMapping("/api/v1/mints")
public class MintController {

    private static final Logger logger = LoggerFactory.getLogger(MintController.class);

    private final MintService mintService;
    private final MintMetricsService metricsService;

    public MintController(MintService mintService, MintMetricsService metricsService) {
        this.mintService = mintService;
        this.metricsService = metricsService;
    }

    /**
     * Reserve items and receive the unsigned transaction to sign.
     *
     * @param request collection, quantity, wallet and idempotency key
     * @return reservation with price breakdown and transaction
     */
    @PostMapping("/reserve")
    public ResponseEntity<MintReserveResponse> reserve(@Valid @RequestBody MintReserveRequest request) {
        long startTime = System.currentTimeMillis();

        logger.info("Reserve - collection: {}, wallet: {}, quantity: {}, key: {}",
                request.getCollectionId(), request.getWallet(), request.getQuantity(), request.getIdempotencyKey());

        ReservationView view = mintService.reserve(
                request.getCollectionId(),
                request.getQuantity(),
                request.getWallet(),
                request.getIdempotencyKey(),
                request.getPhaseId(),
                request.getAllowlistProof()
        );

        metricsService.recordReserveLatency(System.currentTimeMillis() - startTime);

        HttpStatus status = view.replay() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(MintReserveResponse.fromView(view));
    }

    /**
     * Record the buyer's confirmed payment signature and mint the reserved items.
     *
     * @param request idempotency key, signature, wallet and optionally the item ids
     * @return minted items
     */
    @PostMapping("/complete")
    public ResponseEntity<MintCompleteResponse> complete(@Valid @RequestBody MintCompleteRequest request) {
        long startTime = System.currentTimeMillis();

        logger.info("Complete - key: {}, signature: {}, wallet: {}",
                request.getIdempotencyKey(), request.getSignature(), request.getWallet());

        ConfirmedMint result = mintService.complete(
                request.getIdempotencyKey(),
                request.getSignature(),
                request.getWallet(),
                request.getItemIds()
        );

        metricsService.recordCompleteLatency(System.currentTimeMillis() - startTime);
        return ResponseEntity.ok(MintCompleteResponse.fromResult(result));
    }

    @GetMapping("/status/{idempotencyKey}")
    public ResponseEntity<MintStatusResponse> getStatus(@PathVariable String idempotencyKey) {
        logger.debug("Fetching mint status for key: {}", idempotencyKey);
        return ResponseEntity.ok(MintStatusResponse.fromView(mintService.getStatus(idempotencyKey)));
    }
}
