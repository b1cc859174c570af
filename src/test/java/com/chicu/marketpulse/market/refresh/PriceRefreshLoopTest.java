package com.chicu.marketpulse.market.refresh;

import com.chicu.marketpulse.common.enums.PriceProvenance;
import com.chicu.marketpulse.engine.SchedulerService;
import com.chicu.marketpulse.market.MarketProperties;
import com.chicu.marketpulse.market.feed.FinnhubFeedConnection;
import com.chicu.marketpulse.market.model.ResolvedPrice;
import com.chicu.marketpulse.market.resolver.PriceResolver;
import com.chicu.marketpulse.market.stream.MarketStreamRouter;
import com.chicu.marketpulse.market.stream.Tick;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PriceRefreshLoopTest {

    @Mock private SchedulerService scheduler;
    @Mock private PriceResolver resolver;
    @Mock private MarketStreamRouter router;
    @Mock private FinnhubFeedConnection feed;

    private final MarketProperties props = new MarketProperties();
    private PriceRefreshLoop loop;

    @BeforeEach
    void setUp() {
        props.setTickers(List.of("AAPL", "TSLA", "MSFT"));
        loop = new PriceRefreshLoop(scheduler, resolver, router, feed, props);
    }

    @Test
    void liveSymbols_areSkipped_othersResolvedIntoState() {
        when(resolver.isLive("AAPL")).thenReturn(true);
        when(resolver.isLive("TSLA")).thenReturn(false);
        when(resolver.isLive("MSFT")).thenReturn(false);
        when(resolver.resolve("TSLA")).thenReturn(new ResolvedPrice("TSLA", 250.0, PriceProvenance.REAL, Instant.now()));
        when(resolver.resolve("MSFT")).thenReturn(new ResolvedPrice("MSFT", 380.0, PriceProvenance.MOCK, Instant.now()));
        when(router.route(any(Tick.class))).thenReturn(Optional.empty());

        loop.refreshOnce();

        verify(resolver, never()).resolve("AAPL");
        ArgumentCaptor<Tick> ticks = ArgumentCaptor.forClass(Tick.class);
        verify(router, times(2)).route(ticks.capture());
        assertEquals(List.of("TSLA", "MSFT"), ticks.getAllValues().stream().map(Tick::symbol).toList());
        assertTrue(ticks.getAllValues().stream().noneMatch(Tick::live));
        assertEquals(PriceProvenance.MOCK, ticks.getAllValues().get(1).provenance());
    }

    @Test
    void oneFailingSymbol_doesNotStopTheRest() {
        when(resolver.isLive(anyString())).thenReturn(false);
        when(resolver.resolve("AAPL")).thenThrow(new IllegalStateException("boom"));
        when(resolver.resolve("TSLA")).thenReturn(new ResolvedPrice("TSLA", 250.0, PriceProvenance.REAL, Instant.now()));
        when(resolver.resolve("MSFT")).thenReturn(new ResolvedPrice("MSFT", 380.0, PriceProvenance.REAL, Instant.now()));
        when(router.route(any(Tick.class))).thenReturn(Optional.empty());

        loop.refreshOnce();

        verify(router, times(2)).route(any(Tick.class));
    }

    @Test
    void delay_dependsOnFeedLiveness() {
        when(feed.isConnected()).thenReturn(false, true);

        assertEquals(Duration.ofSeconds(10), loop.nextDelay());
        assertEquals(Duration.ofSeconds(30), loop.nextDelay());
    }

    @Test
    void start_registersAdaptiveTask() {
        loop.start();
        verify(scheduler).scheduleWithAdaptiveDelay(eq("price-refresh"), any(Runnable.class), any());
    }
}
