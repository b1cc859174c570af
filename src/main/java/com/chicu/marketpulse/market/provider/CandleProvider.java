package com.chicu.marketpulse.market.provider;

import com.chicu.marketpulse.market.history.HistoryInterval;
import com.chicu.marketpulse.market.history.HistoryPeriod;
import com.chicu.marketpulse.market.model.Candle;

import java.time.Duration;
import java.util.List;

public interface CandleProvider {

    String getName();

    boolean isEnabled();

    Duration getHistoryTimeout();

    /**
     * Свечи от старых к новым. Пустой список: у провайдера нет данных.
     *
     * @throws QuoteProviderException при ошибке провайдера
     */
    List<Candle> fetchCandles(String symbol, HistoryPeriod period, HistoryInterval interval);
}
