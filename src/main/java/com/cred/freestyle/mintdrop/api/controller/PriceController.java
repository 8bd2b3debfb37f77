package com.cred.freestyle.mintdrop.api.controller;

import com.cred.freestyle.mintdrop.api.dto.PlatformFeeResponse;
import com.cred.freestyle.mintdrop.api.dto.PriceResponse;
import com.cred.freestyle.mintdrop.service.PriceOracleService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for the current exchange rate and platform fee.
 *
 * @author Mint Drop Team
 */
@RestController
@RequestMapping("/api/v1/price")
public class PriceController {

    private final PriceOracleService priceOracleService;

    public PriceController(PriceOracleService priceOracleService) {
        this.priceOracleService = priceOracleService;
    }

    @GetMapping
    public ResponseEntity<PriceResponse> getPrice() {
        return ResponseEntity.ok(PriceResponse.fromRates(priceOracleService.getRates()));
    }

    @GetMapping("/platform-fee")
    public ResponseEntity<PlatformFeeResponse> getPlatformFee() {
        return ResponseEntity.ok(PlatformFeeResponse.fromFee(priceOracleService.calculatePlatformFee()));
    }
}
