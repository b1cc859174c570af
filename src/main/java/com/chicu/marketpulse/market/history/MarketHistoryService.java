package com.chicu.marketpulse.market.history;

import com.chicu.marketpulse.market.model.Candle;

import java.util.List;

/**
 * История цены по символу: провайдер свечей, иначе синтетика вокруг текущей цены.
 */
public interface MarketHistoryService {

    /**
     * @param period   код периода (1d, 5d, 1mo …)
     * @param interval код интервала (1m, 5m, 1d …)
     * @return свечи от старых к новым, никогда не пустой список
     * @throws IllegalArgumentException неизвестный символ/период/интервал
     */
    List<Candle> getHistory(String symbol, String period, String interval);
}
