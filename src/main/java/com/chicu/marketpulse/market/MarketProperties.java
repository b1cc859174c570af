package com.chicu.marketpulse.market;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "market")
public class MarketProperties {

    /** Отслеживаемые тикеры (seed на старте + подписка фида + refresh loop) */
    private List<String> tickers = new ArrayList<>(List.of("AAPL", "TSLA", "AMZN", "GOOGL", "MSFT", "NVDA"));

    /** TTL кэша резолвера и "свежести" live-тика */
    private Duration cacheTtl = Duration.ofSeconds(300);

    private Refresh refresh = new Refresh();
    private Mock mock = new Mock();
    private History history = new History();
    private Drift drift = new Drift();

    @Getter
    @Setter
    public static class Refresh {
        /** Период, когда фид НЕ отдаёт live-тики */
        private Duration idleInterval = Duration.ofSeconds(10);
        /** Период, когда фид подключён */
        private Duration liveInterval = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    public static class Mock {
        /** ±доля случайного шага синтетической цены (0.005 = ±0.5%) */
        private double variation = 0.005;
        /** Якорь, если по символу ещё нет ни одной цены */
        private double defaultBasePrice = 100.0;
        private Map<String, Double> basePrices = new LinkedHashMap<>(Map.of(
                "AAPL", 180.0,
                "TSLA", 250.0,
                "AMZN", 3500.0,
                "GOOGL", 2800.0,
                "MSFT", 380.0,
                "NVDA", 450.0
        ));

        public double basePriceFor(String symbol) {
            if (symbol == null) return defaultBasePrice;
            Double p = basePrices.get(symbol.toUpperCase(Locale.ROOT));
            return p != null && p > 0 ? p : defaultBasePrice;
        }
    }

    @Getter
    @Setter
    public static class History {
        /** Максимум точек синтетической истории */
        private int maxPoints = 500;
    }

    @Getter
    @Setter
    public static class Drift {
        private boolean enabled = false;
        private Duration interval = Duration.ofSeconds(10);
    }

    public List<String> normalizedTickers() {
        return tickers.stream()
                .filter(t -> t != null && !t.isBlank())
                .map(t -> t.trim().toUpperCase(Locale.ROOT))
                .distinct()
                .toList();
    }
}
