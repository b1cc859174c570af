package com.chicu.marketpulse.alert;

import com.chicu.marketpulse.common.enums.AlertKind;
import com.chicu.marketpulse.domain.PriceAlertEntity;
import com.chicu.marketpulse.repository.PriceAlertRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JpaAlertStoreCachingTest {

    @Mock
    private PriceAlertRepository repository;

    @InjectMocks
    private JpaAlertStore store;

    private final PriceAlertEntity aapl = entity(1L, "AAPL");

    @BeforeEach
    void setUp() {
        lenient().when(repository.findByActiveTrueOrderByIdAsc()).thenReturn(List.of(aapl));
    }

    @Test
    void repeatedEvaluationReads_hitTheDatabaseOnce() {
        for (int i = 0; i < 10; i++) {
            assertEquals(1, store.listActive().size());
        }

        verify(repository, times(1)).findByActiveTrueOrderByIdAsc();
    }

    @Test
    void markTriggered_dropsCachedList() {
        when(repository.markTriggered(eq(1L), any(Instant.class))).thenReturn(1);
        store.listActive();

        store.markTriggered(1L, Instant.now());
        when(repository.findByActiveTrueOrderByIdAsc()).thenReturn(List.of());

        assertTrue(store.listActive().isEmpty());
        verify(repository, times(2)).findByActiveTrueOrderByIdAsc();
    }

    @Test
    void createAndDeactivate_dropCachedList() {
        PriceAlertEntity tsla = entity(2L, "TSLA");
        when(repository.save(any(PriceAlertEntity.class))).thenReturn(tsla);
        when(repository.deactivate(1L)).thenReturn(1);
        store.listActive();

        store.create("u1", "TSLA", AlertKind.PRICE_BELOW, 200.0);
        when(repository.findByActiveTrueOrderByIdAsc()).thenReturn(List.of(aapl, tsla));
        assertEquals(2, store.listActive().size());

        store.deactivate(1L);
        when(repository.findByActiveTrueOrderByIdAsc()).thenReturn(List.of(tsla));
        assertEquals(List.of(2L), store.listActive().stream().map(PriceAlert::id).toList());

        verify(repository, times(3)).findByActiveTrueOrderByIdAsc();
    }

    @Test
    void failedWrite_stillDropsCachedList() {
        when(repository.deactivate(1L)).thenThrow(new IllegalStateException("db down"));
        store.listActive();

        assertThrows(IllegalStateException.class, () -> store.deactivate(1L));
        store.listActive();

        verify(repository, times(2)).findByActiveTrueOrderByIdAsc();
    }

    private static PriceAlertEntity entity(long id, String symbol) {
        return PriceAlertEntity.builder()
                .id(id)
                .owner("u1")
                .symbol(symbol)
                .kind(AlertKind.PRICE_ABOVE)
                .threshold(100.0)
                .active(true)
                .createdAt(Instant.now())
                .build();
    }
}
