package com.chicu.marketpulse.market.model;

import java.util.Map;

/**
 * Результат одной атомарной мутации стейта.
 *
 * prices/stats: снимок ВСЕХ символов, сделанный под тем же локом,
 * что и сама запись. Алерты и фан-аут работают строго по нему.
 */
public record MarketUpdate(
        Quote quote,
        DailyStats symbolStats,
        Map<String, Double> prices,
        Map<String, DailyStats> stats
) {

    public String symbol() {
        return quote.symbol();
    }

    public double price() {
        return quote.price();
    }
}
