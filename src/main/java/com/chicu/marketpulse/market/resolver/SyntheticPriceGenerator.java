package com.chicu.marketpulse.market.resolver;

import com.chicu.marketpulse.market.MarketProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Случайный шаг ±variation вокруг якорной цены. Внешних зависимостей нет: не падает никогда.
 */
@Component
@RequiredArgsConstructor
public class SyntheticPriceGenerator {

    private final MarketProperties props;

    public double next(double anchor) {
        double base = Double.isFinite(anchor) && anchor > 0 ? anchor : props.getMock().getDefaultBasePrice();
        double v = Math.min(Math.abs(props.getMock().getVariation()), 0.5);
        double change = v == 0 ? 0 : ThreadLocalRandom.current().nextDouble(-v, v);
        return base * (1 + change);
    }
}
