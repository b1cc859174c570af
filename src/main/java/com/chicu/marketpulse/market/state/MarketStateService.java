package com.chicu.marketpulse.market.state;

import com.chicu.marketpulse.common.enums.PriceProvenance;
import com.chicu.marketpulse.market.model.DailyStats;
import com.chicu.marketpulse.market.model.MarketUpdate;
import com.chicu.marketpulse.market.model.Quote;
import com.chicu.marketpulse.market.stream.Tick;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * MarketStateService: единый источник "текущей цены" и "дневной статистики" по символу.
 *
 * Писатели (фид, refresh loop, drift loop) вызывают apply()/seed().
 * Читатели (резолвер, HTTP/WS слой) получают только неизменяемые снимки.
 * Сырые карты наружу не отдаются.
 */
public interface MarketStateService {

    /**
     * Атомарно: записать цену, при первом касании инициализировать статистику,
     * расширить high/low, обновить объём и снять снимок всех символов.
     *
     * @return пусто, если цена невалидна (≤ 0, NaN, ∞) или символ пустой
     */
    Optional<MarketUpdate> apply(Tick tick);

    /**
     * Стартовая запись символа: previousClose берётся из переданного значения.
     * Если символ уже есть: high/low не сужаются.
     */
    Optional<MarketUpdate> seed(String symbol, double price, double previousClose, PriceProvenance provenance);

    Optional<Quote> getQuote(String symbol);

    /**
     * Последний трейд из live-фида по символу (если был).
     */
    Optional<Quote> getLastLiveQuote(String symbol);

    Optional<DailyStats> getStats(String symbol);

    Map<String, Double> getSnapshot();

    Map<String, DailyStats> getStats();

    Set<String> symbols();
}
