package com.chicu.marketpulse.market.refresh;

import com.chicu.marketpulse.common.enums.PriceProvenance;
import com.chicu.marketpulse.engine.SchedulerService;
import com.chicu.marketpulse.market.MarketProperties;
import com.chicu.marketpulse.market.resolver.PriceResolver;
import com.chicu.marketpulse.market.resolver.SyntheticPriceGenerator;
import com.chicu.marketpulse.market.state.InMemoryMarketStateService;
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
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SimulatedDriftLoopTest {

    @Mock private SchedulerService scheduler;
    @Mock private PriceResolver resolver;
    @Mock private MarketStreamRouter router;

    private final MarketProperties props = new MarketProperties();
    private final InMemoryMarketStateService state = new InMemoryMarketStateService();

    private SimulatedDriftLoop loop;

    @BeforeEach
    void setUp() {
        loop = new SimulatedDriftLoop(scheduler, state, resolver, new SyntheticPriceGenerator(props), router, props);
    }

    @Test
    void disabledByDefault_nothingScheduled() {
        loop.start();

        verifyNoInteractions(scheduler);
    }

    @Test
    void enabled_schedulesAtConfiguredInterval() {
        props.getDrift().setEnabled(true);
        props.getDrift().setInterval(Duration.ofSeconds(7));

        loop.start();

        verify(scheduler).scheduleAtFixedRate(eq(SimulatedDriftLoop.TASK_KEY), any(Runnable.class), eq(Duration.ofSeconds(7)));
    }

    @Test
    void driftOnce_movesOnlyNonLiveSymbols_asMock() {
        state.apply(Tick.resolved("AAPL", 180.0, PriceProvenance.REAL, Instant.now()));
        state.apply(Tick.resolved("TSLA", 250.0, PriceProvenance.REAL, Instant.now()));
        when(resolver.isLive("AAPL")).thenReturn(true);
        when(resolver.isLive("TSLA")).thenReturn(false);
        when(router.route(any(Tick.class))).thenReturn(Optional.empty());

        loop.driftOnce();

        ArgumentCaptor<Tick> tick = ArgumentCaptor.forClass(Tick.class);
        verify(router, times(1)).route(tick.capture());
        assertEquals("TSLA", tick.getValue().symbol());
        assertEquals(PriceProvenance.MOCK, tick.getValue().provenance());
        assertEquals(250.0, tick.getValue().price(), 250.0 * 0.005 + 1e-9);
    }
}
