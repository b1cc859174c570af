package com.chicu.marketpulse.market.provider;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "market.providers")
public class ProviderProperties {

    private Finnhub finnhub = new Finnhub();
    private Yahoo yahoo = new Yahoo();

    @Getter
    @Setter
    public static class Finnhub {
        private String baseUrl = "https://finnhub.io/api/v1";
        /** пусто → провайдер выключен */
        private String apiKey = "";
        private Duration quoteTimeout = Duration.ofSeconds(5);
        private Duration historyTimeout = Duration.ofSeconds(8);
    }

    @Getter
    @Setter
    public static class Yahoo {
        private boolean enabled = true;
        private String baseUrl = "https://query1.finance.yahoo.com";
        private Duration timeout = Duration.ofSeconds(5);
    }
}
