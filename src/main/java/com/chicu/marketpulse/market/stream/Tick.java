package com.chicu.marketpulse.market.stream;

import com.chicu.marketpulse.common.enums.PriceProvenance;

import java.time.Instant;

/**
 * Унифицированное обновление цены для стейта.
 *
 * live=true только для трейдов из стримингового фида.
 */
public record Tick(
        String symbol,
        double price,
        Long volume,          // null: объём неизвестен
        Instant timestamp,
        PriceProvenance provenance,
        boolean live
) {

    public static Tick live(String symbol, double price, Long volume, Instant ts) {
        return new Tick(symbol, price, volume, ts, PriceProvenance.REAL, true);
    }

    public static Tick resolved(String symbol, double price, PriceProvenance provenance, Instant ts) {
        return new Tick(symbol, price, null, ts, provenance, false);
    }
}
