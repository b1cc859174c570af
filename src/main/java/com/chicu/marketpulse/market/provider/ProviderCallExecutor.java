package com.chicu.marketpulse.market.provider;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Выполняет вызовы REST-провайдеров с жёсткой верхней границей ожидания на КАЖДЫЙ вызов.
 *
 * Зависший провайдер не держит вызывающий поток дольше своего таймаута;
 * на shutdown все висящие вызовы прерываются.
 */
@Slf4j
@Component
public class ProviderCallExecutor {

    private final AtomicInteger threadSeq = new AtomicInteger();

    private final ExecutorService executor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "price-provider-" + threadSeq.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    /**
     * @return пусто при таймауте, ошибке провайдера, прерывании или после shutdown
     */
    public <T> Optional<T> call(String name, Duration timeout, Callable<T> call) {
        Future<T> future;
        try {
            future = executor.submit(call);
        } catch (RejectedExecutionException e) {
            log.debug("⏹ [PROVIDER] {} skipped: executor is shut down", name);
            return Optional.empty();
        }

        try {
            return Optional.ofNullable(future.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("⏱ [PROVIDER] {} timed out after {} ms", name, timeout.toMillis());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("⚠️ [PROVIDER] {} failed: {}", name, cause.getMessage());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            log.warn("⏹ [PROVIDER] {} interrupted", name);
        }
        return Optional.empty();
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
        log.info("💤 [PROVIDER] call executor stopped");
    }
}
