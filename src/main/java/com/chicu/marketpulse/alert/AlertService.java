package com.chicu.marketpulse.alert;

import com.chicu.marketpulse.common.enums.AlertKind;
import com.chicu.marketpulse.common.util.Symbols;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * CRUD алертов с валидацией на границе.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertService {

    public static final String DEFAULT_OWNER = "anonymous";

    private final AlertStore store;

    public PriceAlert create(String owner, String rawSymbol, String rawKind, Double threshold) {
        String symbol = Symbols.require(rawSymbol);
        AlertKind kind = AlertKind.fromCode(rawKind);

        if (threshold == null || !Double.isFinite(threshold) || threshold <= 0) {
            throw new IllegalArgumentException("threshold must be a positive number");
        }

        PriceAlert created = store.create(normalizeOwner(owner), symbol, kind, threshold);
        log.info("🔔 [ALERTS] created #{} {} {} {} (owner={})",
                created.id(), symbol, kind.code(), threshold, created.owner());
        return created;
    }

    public List<PriceAlert> listActive(String owner) {
        if (owner == null || owner.isBlank()) {
            return store.listActive();
        }
        return store.listActive(normalizeOwner(owner));
    }

    /**
     * Деактивирует алерт. Повторное удаление уже неактивного: не ошибка.
     */
    public void delete(long id) {
        if (store.findById(id).isEmpty()) {
            throw new AlertNotFoundException(id);
        }
        if (store.deactivate(id)) {
            log.info("🗑 [ALERTS] deactivated #{}", id);
        }
    }

    // =====================================================================
    // HELPERS
    // =====================================================================

    private static String normalizeOwner(String owner) {
        return owner == null || owner.isBlank() ? DEFAULT_OWNER : owner.trim();
    }
}
