package com.chicu.marketpulse.engine;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Чистый планировщик периодических задач по строковому ключу.
 *
 * Он НЕ знает ни про цены, ни про фид, ни про символы.
 */
public interface SchedulerService {

    /**
     * Запускает периодическую задачу с фиксированным интервалом (первый запуск сразу).
     *
     * @param key      уникальный ключ задачи (например: "price-refresh")
     * @param task     логика, которую надо регулярно выполнять
     * @param interval интервал между запусками
     */
    void scheduleAtFixedRate(String key, Runnable task, Duration interval);

    /**
     * Задача с переменной паузой: после каждого запуска пауза до следующего
     * берётся из nextDelay (например, 10s без live-фида и 30s с ним).
     */
    void scheduleWithAdaptiveDelay(String key, Runnable task, Supplier<Duration> nextDelay);

    /**
     * Остановка задачи по ключу.
     */
    void cancel(String key);

    boolean isActive(String key);

    Optional<Instant> getStartedAt(String key);
}
