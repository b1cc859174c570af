package com.chicu.marketpulse.engine;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

@Slf4j
@Service
public class SchedulerServiceImpl implements SchedulerService {

    private static final Duration MIN_DELAY = Duration.ofMillis(100);

    /**
     * Пул потоков для фоновых циклов.
     * Делается daemon=true чтобы не блокировать завершение приложения.
     */
    private final ScheduledExecutorService executor;

    /** key → текущий future задачи */
    private final Map<String, ScheduledFuture<?>> tasks = new ConcurrentHashMap<>();

    /** key → время старта */
    private final Map<String, Instant> startedAt = new ConcurrentHashMap<>();

    public SchedulerServiceImpl() {
        this(Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r);
            t.setDaemon(true);
            t.setName("MarketScheduler-" + t.getId());
            return t;
        }));
    }

    SchedulerServiceImpl(ScheduledExecutorService executor) {
        this.executor = executor;
    }

    // ==============================================================
    // ▶️ START TASK
    // ==============================================================
    @Override
    public void scheduleAtFixedRate(String key, Runnable task, Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be > 0");
        }

        // если задача существует, отменяем перед созданием новой
        cancel(key);

        ScheduledFuture<?> future = executor.scheduleAtFixedRate(
                guarded(key, task),
                0,                   // старт немедленно
                interval.toMillis(),
                TimeUnit.MILLISECONDS
        );

        tasks.put(key, future);
        startedAt.put(key, Instant.now());

        log.info("⏱ Scheduler: started '{}' (interval={})", key, interval);
    }

    @Override
    public void scheduleWithAdaptiveDelay(String key, Runnable task, Supplier<Duration> nextDelay) {
        cancel(key);

        startedAt.put(key, Instant.now());
        tasks.put(key, executor.schedule(new AdaptiveRun(key, guarded(key, task), nextDelay), 0, TimeUnit.MILLISECONDS));

        log.info("⏱ Scheduler: started '{}' (adaptive delay)", key);
    }

    // ==============================================================
    // ⏹ CANCEL
    // ==============================================================
    @Override
    public void cancel(String key) {
        startedAt.remove(key);
        ScheduledFuture<?> future = tasks.remove(key);

        if (future != null) {
            future.cancel(false);
            log.info("🛑 Scheduler: cancelled task '{}'", key);
        }
    }

    // ==============================================================
    // ℹ STATUS
    // ==============================================================
    @Override
    public boolean isActive(String key) {
        ScheduledFuture<?> future = tasks.get(key);
        return future != null && !future.isCancelled() && startedAt.containsKey(key);
    }

    @Override
    public Optional<Instant> getStartedAt(String key) {
        return Optional.ofNullable(startedAt.get(key));
    }

    // ==============================================================
    // HELPERS
    // ==============================================================

    /**
     * Исключение внутри scheduleAtFixedRate молча убивает задачу: ловим и логируем.
     */
    private static Runnable guarded(String key, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("❌ Scheduler: task '{}' failed: {}", key, e.getMessage(), e);
            }
        };
    }

    private final class AdaptiveRun implements Runnable {

        private final String key;
        private final Runnable task;
        private final Supplier<Duration> nextDelay;

        AdaptiveRun(String key, Runnable task, Supplier<Duration> nextDelay) {
            this.key = key;
            this.task = task;
            this.nextDelay = nextDelay;
        }

        @Override
        public void run() {
            task.run();

            // задачу отменили, пока она выполнялась
            if (!startedAt.containsKey(key)) {
                return;
            }

            Duration delay = resolveDelay();

            try {
                ScheduledFuture<?> next = executor.schedule(this, delay.toMillis(), TimeUnit.MILLISECONDS);
                tasks.put(key, next);
                if (!startedAt.containsKey(key)) {
                    // cancel() успел между проверкой и перепланированием
                    next.cancel(false);
                    tasks.remove(key, next);
                }
            } catch (RejectedExecutionException e) {
                log.debug("Scheduler: '{}' not rescheduled, executor is shut down", key);
            }
        }

        /**
         * Сбой расчёта паузы не должен останавливать цикл: берём минимальную.
         */
        private Duration resolveDelay() {
            Duration delay;
            try {
                delay = nextDelay.get();
            } catch (Exception e) {
                log.error("❌ Scheduler: delay for '{}' failed, using {}: {}", key, MIN_DELAY, e.getMessage(), e);
                return MIN_DELAY;
            }
            if (delay == null || delay.compareTo(MIN_DELAY) < 0) {
                return MIN_DELAY;
            }
            return delay;
        }
    }

    // ==============================================================
    // 🛑 SHUTDOWN
    // ==============================================================
    @PreDestroy
    public void shutdown() {
        if (log.isInfoEnabled()) {
            log.info("💤 SchedulerServiceImpl shutting down…");
        }
        startedAt.clear();
        executor.shutdownNow();
    }
}
