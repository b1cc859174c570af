package com.chicu.marketpulse.market.stream;

import com.chicu.marketpulse.alert.AlertEvaluator;
import com.chicu.marketpulse.common.enums.PriceProvenance;
import com.chicu.marketpulse.fanout.FanOutDistributor;
import com.chicu.marketpulse.market.feed.FeedTrade;
import com.chicu.marketpulse.market.model.MarketUpdate;
import com.chicu.marketpulse.market.state.InMemoryMarketStateService;
import com.chicu.marketpulse.market.state.MarketStateService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MarketStreamRouterTest {

    @Mock private AlertEvaluator alertEvaluator;
    @Mock private FanOutDistributor fanOut;

    private MarketStateService state;
    private MarketStreamRouter router;

    @BeforeEach
    void setUp() {
        state = spy(new InMemoryMarketStateService());
        router = new MarketStreamRouter(state, alertEvaluator, fanOut);
    }

    @Test
    void cycleOrder_isMutateThenAlertsThenFanOut_withSameSnapshot() {
        router.route(Tick.resolved("TSLA", 250.0, PriceProvenance.REAL, Instant.now()));
        clearInvocations(state, alertEvaluator, fanOut);

        MarketUpdate update = router.route(Tick.live("AAPL", 180.0, 10L, Instant.now())).orElseThrow();

        InOrder order = inOrder(state, alertEvaluator, fanOut);
        order.verify(state).apply(any(Tick.class));
        order.verify(alertEvaluator).evaluate(update.prices());
        order.verify(fanOut).publishSymbolUpdate("AAPL", 180.0);
        order.verify(fanOut).publishSnapshot(update.prices(), update.stats());

        assertEquals(Map.of("AAPL", 180.0, "TSLA", 250.0), update.prices());
    }

    @Test
    void invalidTick_producesNoAlertsAndNoFanOut() {
        assertTrue(router.route(Tick.live("AAPL", -1.0, null, Instant.now())).isEmpty());

        verifyNoInteractions(alertEvaluator, fanOut);
    }

    @Test
    void alertFailure_doesNotBlockFanOut() {
        when(alertEvaluator.evaluate(anyMap())).thenThrow(new IllegalStateException("db down"));

        router.route(Tick.live("AAPL", 180.0, null, Instant.now()));

        verify(fanOut).publishSymbolUpdate("AAPL", 180.0);
    }

    @Test
    void feedTrade_isRecordedAsLive() {
        router.onTrade(new FeedTrade("AAPL", 181.0, 5L, 1_700_000_000_000L));

        assertEquals(181.0, state.getLastLiveQuote("AAPL").orElseThrow().price(), 1e-9);
        assertEquals(Instant.ofEpochMilli(1_700_000_000_000L), state.getQuote("AAPL").orElseThrow().timestamp());
    }

    @Test
    void seed_usesPriceAsPreviousClose() {
        router.seed("MSFT", 380.0, PriceProvenance.MOCK);

        assertEquals(380.0, state.getStats("MSFT").orElseThrow().previousClose(), 1e-9);
        verify(fanOut).publishSymbolUpdate("MSFT", 380.0);
    }

    @Test
    void statusChange_isBroadcast() {
        router.onStatusChanged(false);
        verify(fanOut).broadcastStatus(false);
    }
}
