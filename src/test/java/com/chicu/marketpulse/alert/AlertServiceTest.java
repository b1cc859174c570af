package com.chicu.marketpulse.alert;

import com.chicu.marketpulse.common.enums.AlertKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AlertServiceTest {

    @Mock private AlertStore store;

    @InjectMocks
    private AlertService service;

    @Test
    void create_normalizesInput() {
        PriceAlert saved = new PriceAlert(1L, "anonymous", "AAPL", AlertKind.PRICE_ABOVE, 200.0, true, Instant.now(), null);
        when(store.create("anonymous", "AAPL", AlertKind.PRICE_ABOVE, 200.0)).thenReturn(saved);

        PriceAlert created = service.create(null, " aapl ", "price_above", 200.0);

        assertEquals(saved, created);
    }

    @Test
    void create_rejectsBadInput() {
        assertThrows(IllegalArgumentException.class, () -> service.create("u", "", "price_above", 1.0));
        assertThrows(IllegalArgumentException.class, () -> service.create("u", "AA PL", "price_above", 1.0));
        assertThrows(IllegalArgumentException.class, () -> service.create("u", "AAPL", "volume_spike", 1.0));
        assertThrows(IllegalArgumentException.class, () -> service.create("u", "AAPL", "price_below", 0.0));
        assertThrows(IllegalArgumentException.class, () -> service.create("u", "AAPL", "price_below", -3.0));
        assertThrows(IllegalArgumentException.class, () -> service.create("u", "AAPL", "price_below", Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> service.create("u", "AAPL", "price_below", null));
        verifyNoInteractions(store);
    }

    @Test
    void list_withoutOwner_returnsAllActive() {
        when(store.listActive()).thenReturn(List.of());
        service.listActive(null);
        verify(store).listActive();
        verify(store, never()).listActive(anyString());
    }

    @Test
    void delete_unknownId_throwsNotFound() {
        when(store.findById(42L)).thenReturn(Optional.empty());
        assertThrows(AlertNotFoundException.class, () -> service.delete(42L));
    }

    @Test
    void delete_deactivatesExisting() {
        PriceAlert a = new PriceAlert(7L, "u", "AAPL", AlertKind.PRICE_BELOW, 50.0, true, Instant.now(), null);
        when(store.findById(7L)).thenReturn(Optional.of(a));
        when(store.deactivate(7L)).thenReturn(true);

        service.delete(7L);

        verify(store).deactivate(7L);
    }
}
