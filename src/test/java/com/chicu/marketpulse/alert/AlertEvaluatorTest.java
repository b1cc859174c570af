package com.chicu.marketpulse.alert;

import com.chicu.marketpulse.common.enums.AlertKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AlertEvaluatorTest {

    @Mock private ApplicationEventPublisher events;

    private InMemoryStore store;
    private AlertEvaluator evaluator;

    @BeforeEach
    void setUp() {
        store = new InMemoryStore();
        evaluator = new AlertEvaluator(store, events);
    }

    @Test
    void priceAbove_firesOnceOnFirstCrossing() {
        PriceAlert alert = store.create("u1", "AAPL", AlertKind.PRICE_ABOVE, 100.0);

        int fired95 = evaluator.evaluate(Map.of("AAPL", 95.0));
        int fired101 = evaluator.evaluate(Map.of("AAPL", 101.0));
        int fired105 = evaluator.evaluate(Map.of("AAPL", 105.0));

        assertEquals(0, fired95);
        assertEquals(1, fired101);
        assertEquals(0, fired105);

        ArgumentCaptor<AlertTriggeredEvent> captor = ArgumentCaptor.forClass(AlertTriggeredEvent.class);
        verify(events, times(1)).publishEvent(captor.capture());
        assertEquals(101.0, captor.getValue().price(), 1e-9);
        assertEquals(alert.id(), captor.getValue().alert().id());
        assertFalse(store.findById(alert.id()).orElseThrow().active());
    }

    @Test
    void boundaryIsInclusive() {
        store.create("u1", "AAPL", AlertKind.PRICE_ABOVE, 100.0);
        store.create("u1", "TSLA", AlertKind.PRICE_BELOW, 200.0);

        assertEquals(2, evaluator.evaluate(Map.of("AAPL", 100.0, "TSLA", 200.0)));
    }

    @Test
    void symbolMissingFromSnapshot_isSkipped() {
        store.create("u1", "NVDA", AlertKind.PRICE_BELOW, 500.0);

        assertEquals(0, evaluator.evaluate(Map.of("AAPL", 1.0)));
        verifyNoInteractions(events);
    }

    @Test
    void lostRace_doesNotNotifyTwice() {
        PriceAlert alert = store.create("u1", "AAPL", AlertKind.PRICE_ABOVE, 100.0);
        // другой цикл уже пометил алерт, но наш снимок ещё видит его активным
        store.staleActive = List.of(alert);
        store.markTriggered(alert.id(), Instant.now());

        assertEquals(0, evaluator.evaluate(Map.of("AAPL", 150.0)));
        verifyNoInteractions(events);
    }

    @Test
    void failingAlert_doesNotStopOthers() {
        store.create("u1", "AAPL", AlertKind.PRICE_ABOVE, 100.0);
        PriceAlert ok = store.create("u1", "TSLA", AlertKind.PRICE_ABOVE, 100.0);
        store.failOnSymbol = "AAPL";

        assertEquals(1, evaluator.evaluate(Map.of("AAPL", 150.0, "TSLA", 150.0)));
        assertFalse(store.findById(ok.id()).orElseThrow().active());
    }

    @Test
    void storeUnavailable_cycleSurvives() {
        AlertStore broken = mock(AlertStore.class);
        when(broken.listActive()).thenThrow(new IllegalStateException("db down"));

        assertEquals(0, new AlertEvaluator(broken, events).evaluate(Map.of("AAPL", 1.0)));
    }

    // =====================================================================
    // in-memory store с условным markTriggered
    // =====================================================================

    private static final class InMemoryStore implements AlertStore {
        private final List<PriceAlert> alerts = new ArrayList<>();
        private long seq = 0;
        List<PriceAlert> staleActive;
        String failOnSymbol;

        @Override
        public PriceAlert create(String owner, String symbol, AlertKind kind, double threshold) {
            PriceAlert a = new PriceAlert(++seq, owner, symbol, kind, threshold, true, Instant.now(), null);
            alerts.add(a);
            return a;
        }

        @Override
        public Optional<PriceAlert> findById(long id) {
            return alerts.stream().filter(a -> a.id() == id).findFirst();
        }

        @Override
        public List<PriceAlert> listActive() {
            if (staleActive != null) return staleActive;
            return alerts.stream().filter(PriceAlert::active).toList();
        }

        @Override
        public List<PriceAlert> listActive(String owner) {
            return listActive().stream().filter(a -> a.owner().equals(owner)).toList();
        }

        @Override
        public synchronized boolean markTriggered(long id, Instant triggeredAt) {
            for (int i = 0; i < alerts.size(); i++) {
                PriceAlert a = alerts.get(i);
                if (a.id() == id) {
                    if (failOnSymbol != null && failOnSymbol.equals(a.symbol())) {
                        throw new IllegalStateException("write failed");
                    }
                    if (!a.active()) return false;
                    alerts.set(i, new PriceAlert(a.id(), a.owner(), a.symbol(), a.kind(),
                            a.threshold(), false, a.createdAt(), triggeredAt));
                    return true;
                }
            }
            return false;
        }

        @Override
        public boolean deactivate(long id) {
            return markTriggered(id, null);
        }
    }
}
