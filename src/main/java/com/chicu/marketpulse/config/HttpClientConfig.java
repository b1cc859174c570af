package com.chicu.marketpulse.config;

import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class HttpClientConfig {

    /**
     * 🌐 OkHttpClient для стримингового фида.
     * readTimeout = 0: соединение живёт бесконечно, живость держат ping/pong провайдера.
     */
    @Bean
    public OkHttpClient feedHttpClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(10))
                .readTimeout(Duration.ZERO)
                .writeTimeout(Duration.ofSeconds(10))
                .retryOnConnectionFailure(false) // реконнектом управляет FinnhubFeedConnection
                .build();
    }
}
