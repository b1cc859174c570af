package com.chicu.marketpulse.alert;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Побочный эффект срабатывания алерта. Сейчас: только уведомление в лог владельца.
 */
@Slf4j
@Component
public class AlertNotificationListener {

    @EventListener
    public void onTriggered(AlertTriggeredEvent event) {
        PriceAlert a = event.alert();
        log.info("📣 [ALERTS] notify owner={} : {} is {} {} (price={})",
                a.owner(), a.symbol(),
                a.kind().code().replace('_', ' '), a.threshold(), event.price());
    }
}
