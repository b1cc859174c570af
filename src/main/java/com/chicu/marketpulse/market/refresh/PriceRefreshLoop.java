package com.chicu.marketpulse.market.refresh;

import com.chicu.marketpulse.engine.SchedulerService;
import com.chicu.marketpulse.market.MarketProperties;
import com.chicu.marketpulse.market.feed.FinnhubFeedConnection;
import com.chicu.marketpulse.market.model.ResolvedPrice;
import com.chicu.marketpulse.market.resolver.PriceResolver;
import com.chicu.marketpulse.market.stream.MarketStreamRouter;
import com.chicu.marketpulse.market.stream.Tick;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Периодически подтягивает цены через резолвер для символов, по которым
 * фид сейчас не присылает live-тики. Пауза: idle-interval без фида, live-interval с ним.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PriceRefreshLoop {

    static final String TASK_KEY = "price-refresh";

    private final SchedulerService scheduler;
    private final PriceResolver resolver;
    private final MarketStreamRouter router;
    private final FinnhubFeedConnection feed;
    private final MarketProperties props;

    public void start() {
        scheduler.scheduleWithAdaptiveDelay(TASK_KEY, this::refreshOnce, this::nextDelay);
    }

    public void stop() {
        scheduler.cancel(TASK_KEY);
    }

    public boolean isRunning() {
        return scheduler.isActive(TASK_KEY);
    }

    /**
     * Один проход по всем отслеживаемым тикерам.
     *
     * @return сколько символов обновлено
     */
    public int refreshOnce() {
        int updated = 0;
        int skipped = 0;

        for (String symbol : props.normalizedTickers()) {
            try {
                if (resolver.isLive(symbol)) {
                    skipped++;
                    continue;
                }

                ResolvedPrice r = resolver.resolve(symbol);
                if (router.route(Tick.resolved(symbol, r.price(), r.provenance(), r.resolvedAt())).isPresent()) {
                    updated++;
                }
            } catch (Exception e) {
                log.warn("⚠️ [REFRESH] {} failed: {}", symbol, e.getMessage());
            }
        }

        log.debug("🔄 [REFRESH] updated={}, live-skipped={}", updated, skipped);
        return updated;
    }

    Duration nextDelay() {
        return feed.isConnected()
                ? props.getRefresh().getLiveInterval()
                : props.getRefresh().getIdleInterval();
    }
}
