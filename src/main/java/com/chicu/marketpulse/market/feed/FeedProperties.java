package com.chicu.marketpulse.market.feed;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "market.feed")
public class FeedProperties {

    public static final String DEMO_KEY = "demo";

    private String url = "wss://ws.finnhub.io";

    /** "demo" или пусто → фид не подключается вообще */
    private String apiKey = DEMO_KEY;

    /** Фиксированная пауза перед каждой попыткой реконнекта */
    private Duration reconnectDelay = Duration.ofSeconds(5);

    /** Потолок последовательных попыток реконнекта */
    private int maxReconnectAttempts = 5;

    /** Подключаться ли автоматически при старте приложения */
    private boolean autoStart = true;

    public boolean isDemoMode() {
        return apiKey == null || apiKey.isBlank() || DEMO_KEY.equalsIgnoreCase(apiKey.trim());
    }
}
