package com.chicu.marketpulse.market.refresh;

import com.chicu.marketpulse.common.enums.PriceProvenance;
import com.chicu.marketpulse.engine.SchedulerService;
import com.chicu.marketpulse.market.MarketProperties;
import com.chicu.marketpulse.market.model.Quote;
import com.chicu.marketpulse.market.resolver.PriceResolver;
import com.chicu.marketpulse.market.resolver.SyntheticPriceGenerator;
import com.chicu.marketpulse.market.state.MarketStateService;
import com.chicu.marketpulse.market.stream.MarketStreamRouter;
import com.chicu.marketpulse.market.stream.Tick;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;

/**
 * Небольшой случайный дрейф текущих цен, чтобы UI "жил" без фида.
 * Выключен по умолчанию (market.drift.enabled). Live-символы не трогает.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SimulatedDriftLoop {

    static final String TASK_KEY = "price-drift";

    private final SchedulerService scheduler;
    private final MarketStateService state;
    private final PriceResolver resolver;
    private final SyntheticPriceGenerator synthetic;
    private final MarketStreamRouter router;
    private final MarketProperties props;

    public void start() {
        if (!props.getDrift().isEnabled()) {
            return;
        }
        scheduler.scheduleAtFixedRate(TASK_KEY, this::driftOnce, props.getDrift().getInterval());
    }

    public void stop() {
        scheduler.cancel(TASK_KEY);
    }

    public int driftOnce() {
        int moved = 0;
        for (String symbol : state.symbols()) {
            if (resolver.isLive(symbol)) continue;

            Optional<Quote> current = state.getQuote(symbol);
            if (current.isEmpty()) continue;

            double next = synthetic.next(current.get().price());
            if (router.route(Tick.resolved(symbol, next, PriceProvenance.MOCK, Instant.now())).isPresent()) {
                moved++;
            }
        }
        log.debug("🎲 [REFRESH] drift moved {} symbols", moved);
        return moved;
    }
}
