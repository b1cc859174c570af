package com.chicu.marketpulse.market.feed;

import com.chicu.marketpulse.common.enums.FeedConnectionState;
import com.chicu.marketpulse.common.util.Symbols;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okio.ByteString;
import org.jetbrains.annotations.NotNull;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Одно постоянное стриминговое соединение с провайдером.
 *
 * DISCONNECTED → CONNECTING → CONNECTED; при ошибке транспорта → DISCONNECTED
 * и реконнект через фиксированную паузу. После maxReconnectAttempts подряд
 * неудачных попыток автомат останавливается навсегда (exhausted).
 *
 * Набор подписок и состояние меняются только под writeLock: так реплей подписок
 * после коннекта и subscribe() из других потоков не дают дублей.
 */
@Slf4j
@Service
public class FinnhubFeedConnection {

    private static final int NORMAL_CLOSURE = 1000;
    private static final String PONG_FRAME = new JSONObject().put("type", "pong").toString();

    private final WebSocket.Factory socketFactory;
    private final FeedProperties props;
    private final FeedMessageParser parser;
    private final ScheduledExecutorService reconnectExecutor;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Set<String> subscriptions = new LinkedHashSet<>();

    private final List<TradeListener> priceListeners = new CopyOnWriteArrayList<>();
    private final List<ConnectionStatusListener> statusListeners = new CopyOnWriteArrayList<>();

    // все поля ниже меняются только под writeLock
    private volatile FeedConnectionState state = FeedConnectionState.DISCONNECTED;
    private volatile int reconnectAttempts = 0;
    private volatile boolean exhausted = false;
    private volatile boolean stopped = false;
    private volatile long generation = 0;
    private WebSocket socket;
    private ScheduledFuture<?> pendingReconnect;

    @Autowired
    public FinnhubFeedConnection(WebSocket.Factory socketFactory,
                                 FeedProperties props,
                                 FeedMessageParser parser) {
        this(socketFactory, props, parser, Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "feed-reconnect");
            t.setDaemon(true);
            return t;
        }));
    }

    FinnhubFeedConnection(WebSocket.Factory socketFactory,
                          FeedProperties props,
                          FeedMessageParser parser,
                          ScheduledExecutorService reconnectExecutor) {
        this.socketFactory = socketFactory;
        this.props = props;
        this.parser = parser;
        this.reconnectExecutor = reconnectExecutor;
    }

    // =====================================================================
    // LISTENERS
    // =====================================================================

    public void addPriceListener(TradeListener listener) {
        if (listener != null) priceListeners.add(listener);
    }

    public void addConnectionListener(ConnectionStatusListener listener) {
        if (listener != null) statusListeners.add(listener);
    }

    // =====================================================================
    // LIFECYCLE
    // =====================================================================

    /**
     * Первое подключение. В demo-режиме ничего не делает.
     */
    public void start() {
        if (props.isDemoMode()) {
            log.info("🧪 [FEED] demo mode: streaming connection disabled (no api key)");
            return;
        }
        if (exhausted) {
            log.warn("⛔ [FEED] start ignored: reconnect attempts exhausted");
            return;
        }
        openSocket();
    }

    @PreDestroy
    public void shutdown() {
        boolean wasConnected;

        lock.writeLock().lock();
        try {
            if (stopped) return;
            stopped = true;
            wasConnected = state == FeedConnectionState.CONNECTED;
            state = FeedConnectionState.CLOSING;

            if (pendingReconnect != null) {
                pendingReconnect.cancel(true);
                pendingReconnect = null;
            }

            WebSocket ws = socket;
            socket = null;
            generation++; // все колбэки старого сокета становятся неактуальными
            if (ws != null) {
                try {
                    ws.close(NORMAL_CLOSURE, "shutdown");
                } catch (Exception e) {
                    log.warn("⚠️ [FEED] close on shutdown failed: {}", e.getMessage());
                }
            }
            state = FeedConnectionState.DISCONNECTED;
        } finally {
            lock.writeLock().unlock();
        }

        reconnectExecutor.shutdownNow();
        if (wasConnected) {
            notifyStatus(false);
        }
        log.info("💤 [FEED] connection shut down");
    }

    // =====================================================================
    // SUBSCRIPTIONS
    // =====================================================================

    /**
     * Идемпотентно: повторный subscribe на тот же символ: no-op.
     * Если соединения нет, символ уйдёт провайдеру при следующем успешном коннекте.
     */
    public void subscribe(String rawSymbol) {
        String symbol = Symbols.normalize(rawSymbol);
        if (symbol.isEmpty()) return;

        lock.writeLock().lock();
        try {
            if (!subscriptions.add(symbol)) {
                log.debug("⏭ [FEED] already subscribed {}", symbol);
                return;
            }
            if (state == FeedConnectionState.CONNECTED && socket != null) {
                sendFrame(socket, "subscribe", symbol);
            } else {
                log.info("🕓 [FEED] {} queued until next connect", symbol);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void unsubscribe(String rawSymbol) {
        String symbol = Symbols.normalize(rawSymbol);
        if (symbol.isEmpty()) return;

        lock.writeLock().lock();
        try {
            if (!subscriptions.remove(symbol)) return;
            if (state == FeedConnectionState.CONNECTED && socket != null) {
                sendFrame(socket, "unsubscribe", symbol);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Set<String> getSubscribedSymbols() {
        lock.readLock().lock();
        try {
            return Set.copyOf(subscriptions);
        } finally {
            lock.readLock().unlock();
        }
    }

    // =====================================================================
    // STATUS
    // =====================================================================

    public FeedConnectionState getState() {
        return state;
    }

    public boolean isConnected() {
        return state == FeedConnectionState.CONNECTED;
    }

    public boolean isExhausted() {
        return exhausted;
    }

    public int getReconnectAttempts() {
        return reconnectAttempts;
    }

    public boolean isDemoMode() {
        return props.isDemoMode();
    }

    // =====================================================================
    // INTERNAL: CONNECT / RECONNECT
    // =====================================================================

    private void openSocket() {
        long gen;

        lock.writeLock().lock();
        try {
            pendingReconnect = null;
            if (stopped || exhausted) return;
            if (state == FeedConnectionState.CONNECTING || state == FeedConnectionState.CONNECTED) return;

            state = FeedConnectionState.CONNECTING;
            gen = ++generation;

            log.info("⚡ [FEED] connecting {} (attempt {}/{})",
                    props.getUrl(), reconnectAttempts, props.getMaxReconnectAttempts());

            try {
                Request request = new Request.Builder()
                        .url(props.getUrl() + "?token=" + props.getApiKey())
                        .build();
                socket = socketFactory.newWebSocket(request, new FeedSocketListener(gen));
                return;
            } catch (Exception e) {
                // кривой URL и т.п.: идём по тому же пути, что и ошибка транспорта
                log.error("❌ [FEED] connect failed: {}", e.getMessage());
            }
        } finally {
            lock.writeLock().unlock();
        }

        onTransportLoss(gen, "connect error");
    }

    private void onConnected(long gen, WebSocket ws) {
        lock.writeLock().lock();
        try {
            if (gen != generation || stopped) return;

            state = FeedConnectionState.CONNECTED;
            reconnectAttempts = 0;
            socket = ws;

            // реплей подписок: каждый символ ровно один раз
            for (String symbol : subscriptions) {
                sendFrame(ws, "subscribe", symbol);
            }
            log.info("✅ [FEED] connected, replayed {} subscription(s)", subscriptions.size());
        } finally {
            lock.writeLock().unlock();
        }

        notifyStatus(true);
    }

    /**
     * Общий путь для ошибки транспорта, закрытия удалённой стороной и нарушения протокола.
     */
    private void onTransportLoss(long gen, String reason) {
        boolean wasConnected;
        boolean giveUp = false;

        lock.writeLock().lock();
        try {
            if (gen != generation) return;

            wasConnected = state == FeedConnectionState.CONNECTED;
            socket = null;
            generation++;

            if (stopped) {
                state = FeedConnectionState.DISCONNECTED;
                return;
            }

            state = FeedConnectionState.DISCONNECTED;

            if (reconnectAttempts < props.getMaxReconnectAttempts()) {
                reconnectAttempts++;
                long delayMs = props.getReconnectDelay().toMillis();
                log.warn("🔁 [FEED] lost connection ({}), reconnect {}/{} in {} ms",
                        reason, reconnectAttempts, props.getMaxReconnectAttempts(), delayMs);
                try {
                    pendingReconnect = reconnectExecutor.schedule(
                            this::openSocket, delayMs, TimeUnit.MILLISECONDS);
                } catch (RejectedExecutionException e) {
                    log.warn("⚠️ [FEED] reconnect rejected (executor stopped)");
                }
            } else {
                exhausted = true;
                giveUp = true;
            }
        } finally {
            lock.writeLock().unlock();
        }

        if (wasConnected) {
            notifyStatus(false);
        }
        if (giveUp) {
            log.error("⛔ [FEED] max reconnect attempts ({}) reached: streaming feed halted, serving via REST/mock tiers",
                    props.getMaxReconnectAttempts());
        }
    }

    // =====================================================================
    // INTERNAL: MESSAGES
    // =====================================================================

    private void onText(long gen, WebSocket ws, String text) {
        if (gen != generation) return;

        FeedMessage msg;
        try {
            msg = parser.parse(text);
        } catch (MalformedFeedMessageException e) {
            log.warn("⚠️ [FEED] malformed frame dropped: {}", e.getMessage());
            return;
        }

        switch (msg.type()) {
            case PING -> {
                // pong: раньше любой другой обработки
                if (!ws.send(PONG_FRAME)) {
                    log.warn("⚠️ [FEED] pong not accepted by socket: protocol violation");
                    ws.cancel();
                    onTransportLoss(gen, "pong failed");
                }
            }
            case TRADE -> dispatch(msg.trades());
            case ERROR -> log.warn("⚠️ [FEED] provider error: {}", msg.detail());
            case IGNORED -> log.debug("ℹ️ [FEED] ignored frame type={}", msg.detail());
        }
    }

    private void dispatch(List<FeedTrade> trades) {
        for (FeedTrade trade : trades) {
            for (TradeListener l : priceListeners) {
                try {
                    l.onTrade(trade);
                } catch (Exception e) {
                    log.error("❌ [FEED] price listener failed for {}: {}", trade.symbol(), e.getMessage(), e);
                }
            }
        }
    }

    private void notifyStatus(boolean connected) {
        for (ConnectionStatusListener l : statusListeners) {
            try {
                l.onStatusChanged(connected);
            } catch (Exception e) {
                log.error("❌ [FEED] connection listener failed: {}", e.getMessage(), e);
            }
        }
    }

    private void sendFrame(WebSocket ws, String type, String symbol) {
        String frame = new JSONObject()
                .put("type", type)
                .put("symbol", symbol)
                .toString();

        if (ws.send(frame)) {
            log.info("📡 [FEED] → {} {}", type, symbol);
        } else {
            log.warn("⚠️ [FEED] {} {} not sent (socket closing)", type, symbol);
        }
    }

    // =====================================================================
    // OKHTTP LISTENER
    // =====================================================================

    private class FeedSocketListener extends WebSocketListener {

        private final long gen;

        FeedSocketListener(long gen) {
            this.gen = gen;
        }

        @Override
        public void onOpen(@NotNull WebSocket webSocket, @NotNull Response response) {
            onConnected(gen, webSocket);
        }

        @Override
        public void onMessage(@NotNull WebSocket webSocket, @NotNull String text) {
            onText(gen, webSocket, text);
        }

        @Override
        public void onMessage(@NotNull WebSocket webSocket, @NotNull ByteString bytes) {
            onText(gen, webSocket, bytes.utf8());
        }

        @Override
        public void onClosing(@NotNull WebSocket webSocket, int code, @NotNull String reason) {
            webSocket.close(NORMAL_CLOSURE, null);
            onTransportLoss(gen, "remote close " + code + " " + reason);
        }

        @Override
        public void onClosed(@NotNull WebSocket webSocket, int code, @NotNull String reason) {
            onTransportLoss(gen, "closed " + code);
        }

        @Override
        public void onFailure(@NotNull WebSocket webSocket, @NotNull Throwable t, Response response) {
            onTransportLoss(gen, t.getClass().getSimpleName() + ": " + t.getMessage());
        }
    }
}
