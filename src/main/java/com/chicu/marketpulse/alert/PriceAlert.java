package com.chicu.marketpulse.alert;

import com.chicu.marketpulse.common.enums.AlertKind;
import com.chicu.marketpulse.domain.PriceAlertEntity;

import java.time.Instant;

/**
 * Неизменяемый вид алерта для движка и API.
 */
public record PriceAlert(
        Long id,
        String owner,
        String symbol,
        AlertKind kind,
        double threshold,
        boolean active,
        Instant createdAt,
        Instant triggeredAt
) {

    public static PriceAlert from(PriceAlertEntity e) {
        return new PriceAlert(
                e.getId(),
                e.getOwner(),
                e.getSymbol(),
                e.getKind(),
                e.getThreshold(),
                e.isActive(),
                e.getCreatedAt(),
                e.getTriggeredAt()
        );
    }
}
