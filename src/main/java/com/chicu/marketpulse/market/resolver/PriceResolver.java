package com.chicu.marketpulse.market.resolver;

import com.chicu.marketpulse.common.enums.PriceProvenance;
import com.chicu.marketpulse.common.util.Symbols;
import com.chicu.marketpulse.market.MarketProperties;
import com.chicu.marketpulse.market.feed.FinnhubFeedConnection;
import com.chicu.marketpulse.market.model.Quote;
import com.chicu.marketpulse.market.model.ResolvedPrice;
import com.chicu.marketpulse.market.provider.ProviderCallExecutor;
import com.chicu.marketpulse.market.provider.QuoteProvider;
import com.chicu.marketpulse.market.state.MarketStateService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Цена по символу по цепочке приоритетов, первый успех побеждает:
 *
 * 1. свежий кэш (TTL)                       → CACHED
 * 2. live-фид (CONNECTED + свежий трейд)    → REAL
 * 3. первичный REST                         → REAL, write-through в кэш
 * 4. вторичный REST / исторический close    → REAL, write-through в кэш
 * 5. синтетика вокруг последней цены        → MOCK
 *
 * Никогда не бросает исключений из-за провайдеров и не ждёт дольше суммы таймаутов.
 */
@Slf4j
@Service
public class PriceResolver {

    private final MarketStateService state;
    private final FinnhubFeedConnection feed;
    private final List<QuoteProvider> providers;
    private final ProviderCallExecutor calls;
    private final SyntheticPriceGenerator synthetic;
    private final MarketProperties props;
    private final Clock clock;

    /** symbol → последнее значение, полученное от REST-провайдера */
    private final Map<String, Quote> cache = new ConcurrentHashMap<>();

    @Autowired
    public PriceResolver(MarketStateService state,
                         FinnhubFeedConnection feed,
                         List<QuoteProvider> providers,
                         ProviderCallExecutor calls,
                         SyntheticPriceGenerator synthetic,
                         MarketProperties props) {
        this(state, feed, providers, calls, synthetic, props, Clock.systemUTC());
    }

    PriceResolver(MarketStateService state,
                  FinnhubFeedConnection feed,
                  List<QuoteProvider> providers,
                  ProviderCallExecutor calls,
                  SyntheticPriceGenerator synthetic,
                  MarketProperties props,
                  Clock clock) {
        this.state = state;
        this.feed = feed;
        this.providers = List.copyOf(providers);
        this.calls = calls;
        this.synthetic = synthetic;
        this.props = props;
        this.clock = clock;
    }

    public ResolvedPrice resolve(String rawSymbol) {
        String symbol = Symbols.normalize(rawSymbol);
        if (symbol.isEmpty()) {
            throw new IllegalArgumentException("symbol is required");
        }

        Instant now = clock.instant();
        Duration ttl = props.getCacheTtl();

        // 1️⃣ кэш
        Quote cached = cache.get(symbol);
        if (cached != null && isFresh(cached.timestamp(), now, ttl)) {
            return new ResolvedPrice(symbol, cached.price(), PriceProvenance.CACHED, now);
        }

        // 2️⃣ live-фид
        Optional<ResolvedPrice> live = fromLiveFeed(symbol, now, ttl);
        if (live.isPresent()) {
            return live.get();
        }

        // 3️⃣ + 4️⃣ REST по порядку; вторичный: только если первичный не дал цену
        for (QuoteProvider provider : providers) {
            if (!provider.isEnabled()) continue;

            Optional<Double> price = calls.call(
                    provider.getName() + ":" + symbol,
                    provider.getTimeout(),
                    () -> provider.fetchQuote(symbol)
            );

            if (price.isPresent() && Quote.isValidPrice(price.get())) {
                Instant at = clock.instant();
                cache.put(symbol, new Quote(symbol, price.get(), at, PriceProvenance.REAL));
                log.debug("🌐 [RESOLVER] {} = {} via {}", symbol, price.get(), provider.getName());
                return new ResolvedPrice(symbol, price.get(), PriceProvenance.REAL, at);
            }
        }

        // 5️⃣ синтетика
        double anchor = anchorFor(symbol, cached);
        double mock = synthetic.next(anchor);
        log.debug("🎲 [RESOLVER] {} = {} (mock, anchor={})", symbol, mock, anchor);
        return new ResolvedPrice(symbol, mock, PriceProvenance.MOCK, clock.instant());
    }

    /**
     * Фид жив и недавно присылал трейд по символу.
     */
    public boolean isLive(String rawSymbol) {
        String symbol = Symbols.normalize(rawSymbol);
        return fromLiveFeed(symbol, clock.instant(), props.getCacheTtl()).isPresent();
    }

    public void invalidate(String rawSymbol) {
        cache.remove(Symbols.normalize(rawSymbol));
    }

    // =====================================================================
    // HELPERS
    // =====================================================================

    private Optional<ResolvedPrice> fromLiveFeed(String symbol, Instant now, Duration ttl) {
        if (!feed.isConnected()) {
            return Optional.empty();
        }
        return state.getLastLiveQuote(symbol)
                .filter(q -> isFresh(q.timestamp(), now, ttl))
                .map(q -> new ResolvedPrice(symbol, q.price(), PriceProvenance.REAL, now));
    }

    /**
     * Последняя известная цена: стейт → устаревший кэш → базовая цена из конфига.
     */
    private double anchorFor(String symbol, Quote staleCached) {
        Optional<Quote> current = state.getQuote(symbol);
        if (current.isPresent()) {
            return current.get().price();
        }
        if (staleCached != null) {
            return staleCached.price();
        }
        return props.getMock().basePriceFor(symbol);
    }

    private static boolean isFresh(Instant ts, Instant now, Duration ttl) {
        return ts != null && Duration.between(ts, now).compareTo(ttl) < 0;
    }
}
