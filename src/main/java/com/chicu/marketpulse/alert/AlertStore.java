package com.chicu.marketpulse.alert;

import com.chicu.marketpulse.common.enums.AlertKind;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Хранилище алертов.
 *
 * markTriggered/deactivate: условные: меняют только активный алерт
 * и возвращают false, если алерт уже неактивен (или не найден).
 */
public interface AlertStore {

    PriceAlert create(String owner, String symbol, AlertKind kind, double threshold);

    Optional<PriceAlert> findById(long id);

    List<PriceAlert> listActive();

    List<PriceAlert> listActive(String owner);

    boolean markTriggered(long id, Instant triggeredAt);

    boolean deactivate(long id);
}
