package com.chicu.marketpulse.web.controller.api;

import com.chicu.marketpulse.common.util.Symbols;
import com.chicu.marketpulse.fanout.FanOutDistributor;
import com.chicu.marketpulse.market.feed.FinnhubFeedConnection;
import com.chicu.marketpulse.market.history.MarketHistoryService;
import com.chicu.marketpulse.market.model.Candle;
import com.chicu.marketpulse.market.model.DailyStats;
import com.chicu.marketpulse.market.model.Quote;
import com.chicu.marketpulse.market.model.ResolvedPrice;
import com.chicu.marketpulse.market.resolver.PriceResolver;
import com.chicu.marketpulse.market.state.MarketStateService;
import com.chicu.marketpulse.market.stream.MarketStreamRouter;
import com.chicu.marketpulse.market.stream.Tick;
import com.chicu.marketpulse.web.dto.FeedStatusDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 🌐 Read-API рынка: цены, статистика, история, статус фида.
 * Никакой логики: только валидация входа и чтение стейта.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api")
public class MarketApiController {

    private final MarketStateService state;
    private final PriceResolver resolver;
    private final MarketHistoryService history;
    private final FinnhubFeedConnection feed;
    private final FanOutDistributor fanOut;
    private final MarketStreamRouter router;

    // ---------------------------------------------------------------------
    // 1. ЦЕНЫ
    // ---------------------------------------------------------------------
    @GetMapping("/prices")
    public Map<String, Double> getPrices() {
        return state.getSnapshot();
    }

    /**
     * Цена из стейта: то же значение, что в /prices и у WS-клиентов.
     * Символ, которого в стейте ещё нет, один раз идёт через резолвер и цикл обновления.
     */
    @GetMapping("/prices/{symbol}")
    public ResolvedPrice getPrice(@PathVariable String symbol) {
        String s = Symbols.require(symbol);
        log.debug("💵 [API] GET price {}", s);

        Optional<Quote> known = state.getQuote(s);
        if (known.isPresent()) {
            return toResolved(known.get());
        }

        ResolvedPrice r = resolver.resolve(s);
        router.route(Tick.resolved(s, r.price(), r.provenance(), r.resolvedAt()));
        return state.getQuote(s).map(this::toResolved).orElse(r);
    }

    private ResolvedPrice toResolved(Quote q) {
        return new ResolvedPrice(q.symbol(), q.price(), q.provenance(), q.timestamp());
    }

    // ---------------------------------------------------------------------
    // 2. СТАТИСТИКА
    // ---------------------------------------------------------------------
    @GetMapping("/stats")
    public Map<String, DailyStats> getStats() {
        return state.getStats();
    }

    // ---------------------------------------------------------------------
    // 3. ИСТОРИЯ
    // ---------------------------------------------------------------------
    @GetMapping("/history/{symbol}")
    public List<Candle> getHistory(
            @PathVariable String symbol,
            @RequestParam(defaultValue = "1d") String period,
            @RequestParam(defaultValue = "1m") String interval
    ) {
        String s = Symbols.require(symbol);
        log.debug("📈 [API] GET history {} period={} interval={}", s, period, interval);
        return history.getHistory(s, period, interval);
    }

    // ---------------------------------------------------------------------
    // 4. СТАТУС ФИДА
    // ---------------------------------------------------------------------
    @GetMapping("/feed/status")
    public FeedStatusDto getFeedStatus() {
        return FeedStatusDto.builder()
                .state(feed.getState())
                .connected(feed.isConnected())
                .demoMode(feed.isDemoMode())
                .exhausted(feed.isExhausted())
                .reconnectAttempts(feed.getReconnectAttempts())
                .subscribedSymbols(feed.getSubscribedSymbols())
                .clientConnections(fanOut.connectionCount())
                .build();
    }
}
