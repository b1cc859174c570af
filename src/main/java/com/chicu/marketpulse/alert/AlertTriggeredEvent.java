package com.chicu.marketpulse.alert;

import java.time.Instant;

/**
 * Публикуется ровно один раз на алерт: после успешного markTriggered.
 */
public record AlertTriggeredEvent(
        PriceAlert alert,
        double price,
        Instant triggeredAt
) {
}
