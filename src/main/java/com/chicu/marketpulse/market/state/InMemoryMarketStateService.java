package com.chicu.marketpulse.market.state;

import com.chicu.marketpulse.common.enums.PriceProvenance;
import com.chicu.marketpulse.common.util.Symbols;
import com.chicu.marketpulse.market.model.DailyStats;
import com.chicu.marketpulse.market.model.MarketUpdate;
import com.chicu.marketpulse.market.model.Quote;
import com.chicu.marketpulse.market.stream.Tick;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * InMemoryMarketStateService
 *
 * Цены и статистики хранятся в обычных картах под ОДНИМ read/write локом
 * (все символы вместе): читатель всегда видит цену и статистику символа согласованными.
 */
@Slf4j
@Service
public class InMemoryMarketStateService implements MarketStateService {

    private static final long SYNTHETIC_VOLUME_MIN = 1_000_000L;
    private static final long SYNTHETIC_VOLUME_MAX = 5_000_000L;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final Map<String, Quote> quotes = new LinkedHashMap<>();
    private final Map<String, DailyStats> stats = new LinkedHashMap<>();
    private final Map<String, Quote> lastLive = new LinkedHashMap<>();

    // =====================================================================
    // WRITE
    // =====================================================================

    @Override
    public Optional<MarketUpdate> apply(Tick tick) {
        if (tick == null) {
            return Optional.empty();
        }

        String symbol = Symbols.normalize(tick.symbol());
        if (symbol.isEmpty() || !Quote.isValidPrice(tick.price())) {
            return Optional.empty();
        }

        double price = tick.price();
        Instant ts = tick.timestamp() != null ? tick.timestamp() : Instant.now();
        Quote quote = new Quote(symbol, price, ts, tick.provenance());

        lock.writeLock().lock();
        try {
            DailyStats current = stats.get(symbol);
            if (current == null) {
                current = DailyStats.initial(price, price, syntheticVolume());
                log.debug("🆕 [STATE] first touch {} @ {}", symbol, price);
            }

            DailyStats next = current.widen(price);
            if (tick.volume() != null && tick.volume() > 0) {
                next = next.withVolume(tick.volume());
            }

            quotes.put(symbol, quote);
            stats.put(symbol, next);
            if (tick.live()) {
                lastLive.put(symbol, quote);
            }

            return Optional.of(snapshotOf(quote, next));
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<MarketUpdate> seed(String rawSymbol,
                                       double price,
                                       double previousClose,
                                       PriceProvenance provenance) {

        String symbol = Symbols.normalize(rawSymbol);
        if (symbol.isEmpty() || !Quote.isValidPrice(price)) {
            return Optional.empty();
        }
        double prevClose = Quote.isValidPrice(previousClose) ? previousClose : price;
        Quote quote = new Quote(symbol, price, Instant.now(), provenance);

        lock.writeLock().lock();
        try {
            DailyStats current = stats.get(symbol);
            DailyStats next;
            if (current == null) {
                next = DailyStats.initial(price, prevClose, syntheticVolume());
            } else {
                DailyStats widened = current.widen(price);
                next = new DailyStats(
                        widened.high(),
                        widened.low(),
                        widened.open(),
                        prevClose,
                        widened.volume()
                );
            }

            quotes.put(symbol, quote);
            stats.put(symbol, next);

            return Optional.of(snapshotOf(quote, next));
        } finally {
            lock.writeLock().unlock();
        }
    }

    // =====================================================================
    // READ
    // =====================================================================

    @Override
    public Optional<Quote> getQuote(String symbol) {
        String s = Symbols.normalize(symbol);
        if (s.isEmpty()) return Optional.empty();

        lock.readLock().lock();
        try {
            return Optional.ofNullable(quotes.get(s));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<Quote> getLastLiveQuote(String symbol) {
        String s = Symbols.normalize(symbol);
        if (s.isEmpty()) return Optional.empty();

        lock.readLock().lock();
        try {
            return Optional.ofNullable(lastLive.get(s));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<DailyStats> getStats(String symbol) {
        String s = Symbols.normalize(symbol);
        if (s.isEmpty()) return Optional.empty();

        lock.readLock().lock();
        try {
            return Optional.ofNullable(stats.get(s));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Map<String, Double> getSnapshot() {
        lock.readLock().lock();
        try {
            return pricesCopy();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Map<String, DailyStats> getStats() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableMap(new LinkedHashMap<>(stats));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Set<String> symbols() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableSet(new LinkedHashSet<>(quotes.keySet()));
        } finally {
            lock.readLock().unlock();
        }
    }

    // =====================================================================
    // HELPERS (вызывать только под локом)
    // =====================================================================

    private MarketUpdate snapshotOf(Quote quote, DailyStats symbolStats) {
        return new MarketUpdate(
                quote,
                symbolStats,
                pricesCopy(),
                Collections.unmodifiableMap(new LinkedHashMap<>(stats))
        );
    }

    private Map<String, Double> pricesCopy() {
        Map<String, Double> copy = new LinkedHashMap<>();
        quotes.forEach((k, q) -> copy.put(k, q.price()));
        return Collections.unmodifiableMap(copy);
    }

    private static long syntheticVolume() {
        return ThreadLocalRandom.current().nextLong(SYNTHETIC_VOLUME_MIN, SYNTHETIC_VOLUME_MAX);
    }
}
