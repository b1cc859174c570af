package com.chicu.marketpulse.market.history;

import com.chicu.marketpulse.market.MarketProperties;
import com.chicu.marketpulse.market.model.Candle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Синтетический OHLC-ряд вокруг текущей цены, когда провайдер свечей ничего не дал.
 *
 * Количество точек ограничено market.history.max-points: если period / interval
 * даёт больше, интервал расширяется. Последняя точка = anchor, порядок: от старых к новым.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SyntheticHistoryGenerator {

    private static final long MINUTES_PER_DAY = 24 * 60;
    private static final double MAX_DRIFT = 0.02;
    private static final double DRIFT_PER_DAY = 0.01;
    private static final double OPEN_JITTER = 0.005;
    private static final double WICK = 0.01;
    private static final long VOLUME_MIN = 1_000_000L;
    private static final long VOLUME_MAX = 5_000_000L;

    private final MarketProperties props;

    public List<Candle> generate(String symbol,
                                 double anchor,
                                 HistoryPeriod period,
                                 HistoryInterval interval,
                                 Instant now) {

        int cap = Math.max(1, props.getHistory().getMaxPoints());
        long totalMinutes = period.duration().toMinutes();
        long stepMinutes = Math.max(1, interval.duration().toMinutes());

        // ceil, чтобы total / step гарантированно не превышал cap
        long minStep = (totalMinutes + cap - 1) / cap;
        if (stepMinutes < minStep) {
            stepMinutes = minStep;
        }

        int points = (int) Math.max(1, Math.min(cap, totalMinutes / stepMinutes));

        log.debug("📉 [HISTORY] synthetic {} {}@{} → {} points, step={}m",
                symbol, period.code(), interval.code(), points, stepMinutes);

        ThreadLocalRandom rnd = ThreadLocalRandom.current();
        List<Candle> out = new ArrayList<>(points);

        // i = points-1: самая старая точка, i = 0: "сейчас"
        for (int i = points - 1; i >= 0; i--) {
            long ageMinutes = i * stepMinutes;
            Instant ts = now.minusSeconds(ageMinutes * 60);

            double close;
            if (i == 0) {
                close = anchor;
            } else {
                double factor = Math.min(MAX_DRIFT, (double) ageMinutes / MINUTES_PER_DAY * DRIFT_PER_DAY);
                close = anchor * (1 + uniform(rnd, -factor, factor));
            }

            double open = close * (1 + uniform(rnd, -OPEN_JITTER, OPEN_JITTER));
            double high = Math.max(open, close) * (1 + uniform(rnd, 0, WICK));
            double low = Math.min(open, close) * (1 - uniform(rnd, 0, WICK));
            long volume = rnd.nextLong(VOLUME_MIN, VOLUME_MAX);

            out.add(new Candle(ts.toEpochMilli(), open, high, low, close, volume));
        }

        return out;
    }

    private static double uniform(ThreadLocalRandom rnd, double from, double to) {
        return from >= to ? from : rnd.nextDouble(from, to);
    }
}
