package com.chicu.marketpulse.alert;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Проверка активных алертов против снимка цен.
 *
 * Срабатывание = успешный условный markTriggered (active → inactive), только после него
 * публикуется {@link AlertTriggeredEvent}. Поэтому алерт срабатывает не больше одного раза,
 * даже если два цикла увидели его активным одновременно.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AlertEvaluator {

    private final AlertStore store;
    private final ApplicationEventPublisher events;

    /**
     * @return сколько алертов сработало в этом цикле
     */
    public int evaluate(Map<String, Double> prices) {
        if (prices == null || prices.isEmpty()) {
            return 0;
        }

        List<PriceAlert> active;
        try {
            active = store.listActive();
        } catch (Exception e) {
            log.warn("⚠️ [ALERTS] cannot load active alerts: {}", e.getMessage());
            return 0;
        }

        int fired = 0;
        for (PriceAlert alert : active) {
            try {
                if (check(alert, prices)) {
                    fired++;
                }
            } catch (Exception e) {
                // один сломанный алерт не останавливает остальные
                log.warn("⚠️ [ALERTS] alert #{} failed: {}", alert.id(), e.getMessage());
            }
        }
        return fired;
    }

    private boolean check(PriceAlert alert, Map<String, Double> prices) {
        Double price = prices.get(alert.symbol());
        if (price == null) {
            return false;
        }
        if (!alert.kind().matches(price, alert.threshold())) {
            return false;
        }

        Instant now = Instant.now();
        if (!store.markTriggered(alert.id(), now)) {
            // уже сработал в другом цикле
            return false;
        }

        log.info("🚨 [ALERTS] #{} {} {} {} hit at {}",
                alert.id(), alert.symbol(), alert.kind().code(), alert.threshold(), price);
        events.publishEvent(new AlertTriggeredEvent(alert, price, now));
        return true;
    }
}
