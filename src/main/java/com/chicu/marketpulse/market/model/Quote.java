package com.chicu.marketpulse.market.model;

import com.chicu.marketpulse.common.enums.PriceProvenance;

import java.time.Instant;

/**
 * Последняя принятая цена по символу.
 */
public record Quote(
        String symbol,
        double price,
        Instant timestamp,
        PriceProvenance provenance
) {

    /**
     * Цена пригодна для записи в стейт: конечная и строго положительная.
     */
    public static boolean isValidPrice(double price) {
        return Double.isFinite(price) && price > 0;
    }
}
