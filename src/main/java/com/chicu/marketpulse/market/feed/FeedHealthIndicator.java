package com.chicu.marketpulse.market.feed;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * /actuator/health → компонент "feed".
 *
 * DOWN только при исчерпанных попытках реконнекта: цены при этом продолжают
 * отдаваться через резолвер, но live-фид уже не вернётся без рестарта.
 */
@Component
@RequiredArgsConstructor
public class FeedHealthIndicator implements HealthIndicator {

    private final FinnhubFeedConnection feed;

    @Override
    public Health health() {
        Health.Builder b = feed.isExhausted() ? Health.down() : Health.up();
        return b.withDetail("state", feed.getState().name())
                .withDetail("connected", feed.isConnected())
                .withDetail("demo", feed.isDemoMode())
                .withDetail("exhausted", feed.isExhausted())
                .withDetail("reconnectAttempts", feed.getReconnectAttempts())
                .build();
    }
}
