package com.chicu.marketpulse.alert;

import com.chicu.marketpulse.common.enums.AlertKind;
import com.chicu.marketpulse.domain.PriceAlertEntity;
import com.chicu.marketpulse.repository.PriceAlertRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Список активных алертов читается на каждом тике, поэтому держим его в памяти.
 * Любая запись через стор сбрасывает кэш; TTL ловит изменения в БД мимо стора.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JpaAlertStore implements AlertStore {

    static final Duration ACTIVE_CACHE_TTL = Duration.ofSeconds(5);

    private final PriceAlertRepository repository;

    /** растёт на каждой записи; загрузка, начатая до записи, в кэш не попадает */
    private final AtomicLong version = new AtomicLong();
    private volatile ActiveSnapshot activeCache;

    @Override
    public PriceAlert create(String owner, String symbol, AlertKind kind, double threshold) {
        PriceAlertEntity saved = repository.save(PriceAlertEntity.builder()
                .owner(owner)
                .symbol(symbol)
                .kind(kind)
                .threshold(threshold)
                .active(true)
                .createdAt(Instant.now())
                .build());
        invalidate();
        return PriceAlert.from(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<PriceAlert> findById(long id) {
        return repository.findById(id).map(PriceAlert::from);
    }

    @Override
    public List<PriceAlert> listActive() {
        ActiveSnapshot cached = activeCache;
        long v = version.get();
        if (cached != null && cached.version == v && cached.loadedAt.plus(ACTIVE_CACHE_TTL).isAfter(Instant.now())) {
            return cached.alerts;
        }

        List<PriceAlert> loaded = repository.findByActiveTrueOrderByIdAsc().stream()
                .map(PriceAlert::from)
                .toList();
        if (version.get() == v) {
            activeCache = new ActiveSnapshot(loaded, v, Instant.now());
        }
        log.debug("🔔 [ALERTS] active alerts reloaded: {}", loaded.size());
        return loaded;
    }

    @Override
    @Transactional(readOnly = true)
    public List<PriceAlert> listActive(String owner) {
        return repository.findByOwnerAndActiveTrueOrderByIdAsc(owner).stream()
                .map(PriceAlert::from)
                .toList();
    }

    @Override
    public boolean markTriggered(long id, Instant triggeredAt) {
        try {
            return repository.markTriggered(id, triggeredAt) > 0;
        } finally {
            invalidate();
        }
    }

    @Override
    public boolean deactivate(long id) {
        try {
            return repository.deactivate(id) > 0;
        } finally {
            invalidate();
        }
    }

    private void invalidate() {
        version.incrementAndGet();
        activeCache = null;
    }

    private record ActiveSnapshot(List<PriceAlert> alerts, long version, Instant loadedAt) {
    }
}
