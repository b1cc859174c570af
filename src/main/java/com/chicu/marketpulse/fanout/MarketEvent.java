package com.chicu.marketpulse.fanout;

import com.chicu.marketpulse.market.model.DailyStats;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Исходящее событие для клиентов.
 *
 * symbol заполнен только у per-symbol price_update.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MarketEvent(
        String type,
        String symbol,
        Object data
) {

    public static final String PRICE_UPDATE = "price_update";
    public static final String STATS_UPDATE = "stats_update";
    public static final String CONNECTION_STATUS_CHANGED = "connection_status_changed";
    public static final String ERROR = "error";

    public static MarketEvent symbolPrice(String symbol, double price) {
        return new MarketEvent(PRICE_UPDATE, symbol, Map.of(symbol, price));
    }

    public static MarketEvent prices(Map<String, Double> prices) {
        return new MarketEvent(PRICE_UPDATE, null, prices);
    }

    public static MarketEvent stats(Map<String, DailyStats> stats) {
        return new MarketEvent(STATS_UPDATE, null, stats);
    }

    public static MarketEvent connectionStatus(boolean connected) {
        return new MarketEvent(CONNECTION_STATUS_CHANGED, null, Map.of("connected", connected));
    }

    public static MarketEvent error(String message) {
        return new MarketEvent(ERROR, null, Map.of("message", message == null ? "error" : message));
    }
}
