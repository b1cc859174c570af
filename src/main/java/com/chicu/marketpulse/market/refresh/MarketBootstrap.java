package com.chicu.marketpulse.market.refresh;

import com.chicu.marketpulse.market.MarketProperties;
import com.chicu.marketpulse.market.feed.FeedProperties;
import com.chicu.marketpulse.market.feed.FinnhubFeedConnection;
import com.chicu.marketpulse.market.model.ResolvedPrice;
import com.chicu.marketpulse.market.resolver.PriceResolver;
import com.chicu.marketpulse.market.stream.MarketStreamRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Старт движка после поднятия контекста:
 * 1) слушатели фида → роутер;
 * 2) seed всех тикеров через резолвер (previousClose = цена резолвера);
 * 3) подписка тикеров + подключение фида;
 * 4) refresh loop и (опционально) drift.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MarketBootstrap implements ApplicationRunner {

    private final MarketProperties props;
    private final FeedProperties feedProps;
    private final FinnhubFeedConnection feed;
    private final PriceResolver resolver;
    private final MarketStreamRouter router;
    private final PriceRefreshLoop refreshLoop;
    private final SimulatedDriftLoop driftLoop;

    @Override
    public void run(ApplicationArguments args) {
        List<String> tickers = props.normalizedTickers();
        log.info("🚀 [BOOT] starting market engine, tickers={}", tickers);

        feed.addPriceListener(router);
        feed.addConnectionListener(router);

        seed(tickers);

        tickers.forEach(feed::subscribe);
        if (feedProps.isAutoStart()) {
            feed.start();
        }

        refreshLoop.start();
        driftLoop.start();
    }

    void seed(List<String> tickers) {
        for (String symbol : tickers) {
            try {
                ResolvedPrice r = resolver.resolve(symbol);
                router.seed(symbol, r.price(), r.provenance());
                log.info("🌱 [BOOT] {} initialized at {} ({})", symbol, r.price(), r.provenance().code());
            } catch (Exception e) {
                log.error("❌ [BOOT] cannot initialize {}: {}", symbol, e.getMessage(), e);
            }
        }
    }
}
