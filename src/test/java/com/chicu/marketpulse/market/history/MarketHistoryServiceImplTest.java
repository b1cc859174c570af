package com.chicu.marketpulse.market.history;

import com.chicu.marketpulse.common.enums.PriceProvenance;
import com.chicu.marketpulse.market.MarketProperties;
import com.chicu.marketpulse.market.model.Candle;
import com.chicu.marketpulse.market.provider.CandleProvider;
import com.chicu.marketpulse.market.provider.ProviderCallExecutor;
import com.chicu.marketpulse.market.provider.QuoteProviderException;
import com.chicu.marketpulse.market.state.InMemoryMarketStateService;
import com.chicu.marketpulse.market.stream.Tick;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MarketHistoryServiceImplTest {

    @Mock private CandleProvider provider;

    private final MarketProperties props = new MarketProperties();
    private final InMemoryMarketStateService state = new InMemoryMarketStateService();
    private final ProviderCallExecutor calls = new ProviderCallExecutor();

    private MarketHistoryServiceImpl service;

    @BeforeEach
    void setUp() {
        service = new MarketHistoryServiceImpl(
                List.of(provider), calls, state, new SyntheticHistoryGenerator(props), props);
    }

    @AfterEach
    void tearDown() {
        calls.shutdown();
    }

    @Test
    void providerCandles_areReturnedAsIs() {
        List<Candle> real = List.of(new Candle(1_000L, 1, 2, 0.5, 1.5, 10));
        when(provider.isEnabled()).thenReturn(true);
        when(provider.getName()).thenReturn("finnhub");
        when(provider.getHistoryTimeout()).thenReturn(Duration.ofSeconds(1));
        when(provider.fetchCandles("AAPL", HistoryPeriod.FIVE_DAYS, HistoryInterval.M15)).thenReturn(real);

        assertEquals(real, service.getHistory("aapl", "5d", "15m"));
    }

    @Test
    void providerFailure_fallsBackToSyntheticAroundCurrentPrice() {
        when(provider.isEnabled()).thenReturn(true);
        when(provider.getName()).thenReturn("finnhub");
        when(provider.getHistoryTimeout()).thenReturn(Duration.ofSeconds(1));
        when(provider.fetchCandles(anyString(), any(), any())).thenThrow(new QuoteProviderException("boom"));
        state.apply(Tick.resolved("AAPL", 200.0, PriceProvenance.REAL, Instant.now()));

        List<Candle> candles = service.getHistory("AAPL", "1d", "1h");

        assertEquals(24, candles.size());
        assertEquals(200.0, candles.get(candles.size() - 1).close(), 1e-9);
    }

    @Test
    void disabledProvider_isNotCalled() {
        when(provider.isEnabled()).thenReturn(false);

        List<Candle> candles = service.getHistory("NVDA", "1d", "1h");

        assertEquals(450.0, candles.get(candles.size() - 1).close(), 1e-9);
        verify(provider, never()).fetchCandles(anyString(), any(), any());
    }

    @Test
    void invalidPeriodOrInterval_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> service.getHistory("AAPL", "2w", "1m"));
        assertThrows(IllegalArgumentException.class, () -> service.getHistory("AAPL", "1d", "7m"));
        assertThrows(IllegalArgumentException.class, () -> service.getHistory(" ", "1d", "1m"));
    }
}
