package com.chicu.marketpulse.market.stream;

import com.chicu.marketpulse.alert.AlertEvaluator;
import com.chicu.marketpulse.common.enums.PriceProvenance;
import com.chicu.marketpulse.fanout.FanOutDistributor;
import com.chicu.marketpulse.market.feed.ConnectionStatusListener;
import com.chicu.marketpulse.market.feed.FeedTrade;
import com.chicu.marketpulse.market.feed.TradeListener;
import com.chicu.marketpulse.market.model.MarketUpdate;
import com.chicu.marketpulse.market.state.MarketStateService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Единый цикл обновления: mutate → alerts → fan-out.
 *
 * Все источники (фид, refresh loop, drift, seed) идут через route/seed, поэтому
 * порядок шагов одинаков везде, а рассылка отражает ровно тот снимок, который видели алерты.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MarketStreamRouter implements TradeListener, ConnectionStatusListener {

    private final MarketStateService state;
    private final AlertEvaluator alertEvaluator;
    private final FanOutDistributor fanOut;

    /** циклы не перемешиваются: снапшоты уходят клиентам в порядке мутаций */
    private final Lock cycleLock = new ReentrantLock();

    /**
     * Основной роутер
     */
    public Optional<MarketUpdate> route(Tick tick) {
        if (tick == null) return Optional.empty();

        cycleLock.lock();
        try {
            Optional<MarketUpdate> update = state.apply(tick);
            update.ifPresent(this::afterMutation);
            return update;
        } finally {
            cycleLock.unlock();
        }
    }

    /**
     * Инициализация символа ценой резолвера (previousClose = та же цена).
     */
    public Optional<MarketUpdate> seed(String symbol, double price, PriceProvenance provenance) {
        cycleLock.lock();
        try {
            Optional<MarketUpdate> update = state.seed(symbol, price, price, provenance);
            update.ifPresent(this::afterMutation);
            return update;
        } finally {
            cycleLock.unlock();
        }
    }

    private void afterMutation(MarketUpdate update) {
        try {
            alertEvaluator.evaluate(update.prices());
        } catch (Exception e) {
            log.error("❌ [ALERTS] evaluation failed for {}: {}", update.symbol(), e.getMessage(), e);
        }

        fanOut.publishSymbolUpdate(update.symbol(), update.price());
        fanOut.publishSnapshot(update.prices(), update.stats());
    }

    // =====================================================================
    // FEED CALLBACKS
    // =====================================================================

    @Override
    public void onTrade(FeedTrade trade) {
        Instant ts = trade.tsMillis() > 0 ? Instant.ofEpochMilli(trade.tsMillis()) : Instant.now();
        route(Tick.live(trade.symbol(), trade.price(), trade.volume(), ts))
                .ifPresent(u -> log.debug("💹 [FEED] {} = {}", u.symbol(), u.price()));
    }

    @Override
    public void onStatusChanged(boolean connected) {
        fanOut.broadcastStatus(connected);
    }
}
