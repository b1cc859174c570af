package com.chicu.marketpulse.fanout;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "market.fanout")
public class FanOutProperties {

    /** Очередь исходящих кадров на одно соединение */
    private int queueCapacity = 256;

    /** После стольких выброшенных кадров подряд соединение закрывается */
    private int maxDroppedFrames = 64;

    /** Лимиты ConcurrentWebSocketSessionDecorator */
    private Duration sendTimeLimit = Duration.ofSeconds(5);
    private int bufferSizeLimit = 512 * 1024;
}
