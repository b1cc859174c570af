package com.chicu.marketpulse.fanout;

import com.chicu.marketpulse.common.util.Symbols;
import com.chicu.marketpulse.market.model.DailyStats;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Рассылка событий клиентам.
 *
 * - per-symbol price_update → только подписчикам символа;
 * - снапшоты и статус фида → всем соединениям.
 *
 * Публикация никогда не ждёт клиента: кадр кладётся в ограниченную очередь соединения,
 * отправка идёт на отдельном пуле. Переполненная очередь → кадр выбрасывается,
 * слишком много выброшенных подряд → соединение закрывается.
 */
@Slf4j
@Service
public class FanOutDistributor {

    private final FanOutProperties props;
    private final ObjectMapper mapper;
    private final Executor sendExecutor;
    private final ExecutorService ownedExecutor;

    /** connectionId → канал */
    private final Map<String, Channel> channels = new ConcurrentHashMap<>();

    /** symbol → connectionIds (под rw-локом) */
    private final Map<String, Set<String>> subscribers = new HashMap<>();
    private final ReadWriteLock subsLock = new ReentrantReadWriteLock();

    @Autowired
    public FanOutDistributor(FanOutProperties props, ObjectMapper mapper) {
        this(props, mapper, newSendPool());
    }

    FanOutDistributor(FanOutProperties props, ObjectMapper mapper, Executor sendExecutor) {
        this.props = props;
        this.mapper = mapper;
        this.sendExecutor = sendExecutor;
        this.ownedExecutor = sendExecutor instanceof ExecutorService es ? es : null;
    }

    private static ExecutorService newSendPool() {
        AtomicInteger seq = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "fanout-send-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    // =====================================================================
    // CONNECTIONS / SUBSCRIPTIONS
    // =====================================================================

    public void register(MarketEventSink sink) {
        int capacity = Math.max(1, props.getQueueCapacity());
        channels.put(sink.getId(), new Channel(sink, capacity));
        log.info("🔌 [FANOUT] connection {} registered (total={})", sink.getId(), channels.size());
    }

    /**
     * @return true, если подписка новая
     */
    public boolean subscribe(String connectionId, String rawSymbol) {
        String symbol = Symbols.normalize(rawSymbol);
        if (symbol.isEmpty() || !channels.containsKey(connectionId)) {
            return false;
        }

        subsLock.writeLock().lock();
        try {
            // соединение могло закрыться между проверкой выше и захватом лока
            if (!channels.containsKey(connectionId)) {
                return false;
            }
            boolean added = subscribers
                    .computeIfAbsent(symbol, s -> new LinkedHashSet<>())
                    .add(connectionId);
            if (added) {
                log.debug("➕ [FANOUT] {} subscribed to {}", connectionId, symbol);
            }
            return added;
        } finally {
            subsLock.writeLock().unlock();
        }
    }

    public boolean unsubscribe(String connectionId, String rawSymbol) {
        String symbol = Symbols.normalize(rawSymbol);
        if (symbol.isEmpty()) {
            return false;
        }

        subsLock.writeLock().lock();
        try {
            Set<String> set = subscribers.get(symbol);
            if (set == null || !set.remove(connectionId)) {
                return false;
            }
            if (set.isEmpty()) {
                subscribers.remove(symbol);
            }
            log.debug("➖ [FANOUT] {} unsubscribed from {}", connectionId, symbol);
            return true;
        } finally {
            subsLock.writeLock().unlock();
        }
    }

    /**
     * Соединение закрыто: убрать его из ВСЕХ подписок. Данные по символам не трогаются.
     */
    public void onConnectionClosed(String connectionId) {
        Channel ch = channels.remove(connectionId);
        if (ch != null) {
            ch.closed.set(true);
            ch.queue.clear();
        }

        subsLock.writeLock().lock();
        try {
            subscribers.values().forEach(set -> set.remove(connectionId));
            subscribers.values().removeIf(Set::isEmpty);
        } finally {
            subsLock.writeLock().unlock();
        }

        log.info("❌ [FANOUT] connection {} removed (total={})", connectionId, channels.size());
    }

    public Set<String> subscriptionsOf(String connectionId) {
        subsLock.readLock().lock();
        try {
            Set<String> out = new LinkedHashSet<>();
            subscribers.forEach((symbol, ids) -> {
                if (ids.contains(connectionId)) out.add(symbol);
            });
            return Collections.unmodifiableSet(out);
        } finally {
            subsLock.readLock().unlock();
        }
    }

    public int subscriberCount(String rawSymbol) {
        subsLock.readLock().lock();
        try {
            Set<String> set = subscribers.get(Symbols.normalize(rawSymbol));
            return set == null ? 0 : set.size();
        } finally {
            subsLock.readLock().unlock();
        }
    }

    public int connectionCount() {
        return channels.size();
    }

    // =====================================================================
    // PUBLISH
    // =====================================================================

    public void publishSymbolUpdate(String rawSymbol, double price) {
        String symbol = Symbols.normalize(rawSymbol);
        if (symbol.isEmpty()) return;

        List<String> targets;
        subsLock.readLock().lock();
        try {
            Set<String> set = subscribers.get(symbol);
            if (set == null || set.isEmpty()) {
                return;
            }
            targets = List.copyOf(set);
        } finally {
            subsLock.readLock().unlock();
        }

        String frame = serialize(MarketEvent.symbolPrice(symbol, price));
        if (frame == null) return;

        for (String id : targets) {
            Channel ch = channels.get(id);
            if (ch != null) {
                enqueue(ch, frame);
            }
        }
    }

    /**
     * Полный снапшот цен и статистики: всем соединениям.
     */
    public void publishSnapshot(Map<String, Double> prices, Map<String, DailyStats> stats) {
        broadcast(MarketEvent.prices(prices));
        broadcast(MarketEvent.stats(stats));
    }

    public void broadcastStatus(boolean connected) {
        broadcast(MarketEvent.connectionStatus(connected));
    }

    /**
     * Адресная отправка одному соединению (initial push).
     */
    public void sendTo(String connectionId, MarketEvent event) {
        Channel ch = channels.get(connectionId);
        if (ch == null) return;

        String frame = serialize(event);
        if (frame != null) {
            enqueue(ch, frame);
        }
    }

    private void broadcast(MarketEvent event) {
        Collection<Channel> all = channels.values();
        if (all.isEmpty()) return;

        String frame = serialize(event);
        if (frame == null) return;

        for (Channel ch : all) {
            enqueue(ch, frame);
        }
    }

    // =====================================================================
    // DELIVERY
    // =====================================================================

    private void enqueue(Channel ch, String frame) {
        if (ch.closed.get()) return;

        if (!ch.queue.offer(frame)) {
            int dropped = ch.dropped.incrementAndGet();
            log.debug("🐢 [FANOUT] {} is slow, frame dropped ({} in a row)", ch.sink.getId(), dropped);

            if (dropped >= props.getMaxDroppedFrames()) {
                log.warn("⚠️ [FANOUT] {} dropped {} frames, disconnecting", ch.sink.getId(), dropped);
                disconnect(ch);
            }
            return;
        }

        scheduleDrain(ch);
    }

    private void scheduleDrain(Channel ch) {
        if (!ch.draining.compareAndSet(false, true)) {
            return;
        }
        try {
            sendExecutor.execute(() -> drain(ch));
        } catch (RejectedExecutionException e) {
            ch.draining.set(false);
            log.debug("[FANOUT] send pool is shut down, {} not drained", ch.sink.getId());
        }
    }

    private void drain(Channel ch) {
        try {
            String frame;
            while (!ch.closed.get() && (frame = ch.queue.poll()) != null) {
                if (!ch.sink.isOpen()) {
                    disconnect(ch);
                    return;
                }
                try {
                    ch.sink.send(frame);
                    ch.dropped.set(0);
                } catch (Exception e) {
                    log.warn("⚠️ [FANOUT] send to {} failed: {}", ch.sink.getId(), e.getMessage());
                    disconnect(ch);
                    return;
                }
            }
        } finally {
            ch.draining.set(false);
        }

        // кадр мог прийти между последним poll и сбросом флага
        if (!ch.closed.get() && !ch.queue.isEmpty()) {
            scheduleDrain(ch);
        }
    }

    /**
     * Учёт снимается сразу, а сам close() уходит в пул отправки:
     * закрытие сокета может ждать зависшую запись, публикующий поток его не ждёт.
     */
    private void disconnect(Channel ch) {
        if (!ch.closed.compareAndSet(false, true)) {
            return;
        }
        onConnectionClosed(ch.sink.getId());

        try {
            sendExecutor.execute(() -> closeQuietly(ch.sink));
        } catch (RejectedExecutionException e) {
            log.debug("[FANOUT] send pool is shut down, {} close skipped", ch.sink.getId());
        }
    }

    private static void closeQuietly(MarketEventSink sink) {
        try {
            sink.close();
        } catch (Exception e) {
            log.debug("[FANOUT] close {} failed: {}", sink.getId(), e.getMessage());
        }
    }

    private String serialize(MarketEvent event) {
        try {
            return mapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("❌ [FANOUT] cannot serialize {}: {}", event.type(), e.getMessage(), e);
            return null;
        }
    }

    @PreDestroy
    public void shutdown() {
        channels.values().forEach(ch -> ch.closed.set(true));
        if (ownedExecutor != null) {
            ownedExecutor.shutdownNow();
        }
        log.info("💤 [FANOUT] stopped");
    }

    // =====================================================================
    // CHANNEL
    // =====================================================================

    private static final class Channel {
        final MarketEventSink sink;
        final BlockingQueue<String> queue;
        final AtomicBoolean draining = new AtomicBoolean();
        final AtomicBoolean closed = new AtomicBoolean();
        final AtomicInteger dropped = new AtomicInteger();

        Channel(MarketEventSink sink, int capacity) {
            this.sink = sink;
            this.queue = new ArrayBlockingQueue<>(capacity);
        }
    }
}
