package com.cred.freestyle.mintdrop.service;

import com.cred.freestyle.mintdrop.domain.model.MintPhase;

import java.math.BigDecimal;

/**
 * The phase a buyer mints under and its unit price.
 *
 * @param phase resolved phase
 * @param unitPrice price per item in whole coins
 * @param unitPriceBaseUnits price per item in base units
 */
public record ResolvedPhase(MintPhase phase, BigDecimal unitPrice, long unitPriceBaseUnits) {

    public long itemsTotalBaseUnits(int quantity) {
        return Math.multiplyExact(unitPriceBaseUnits, (long) quantity);
    }
}
