package com.chicu.marketpulse.web.ws;

import com.chicu.marketpulse.common.util.Symbols;
import com.chicu.marketpulse.fanout.FanOutDistributor;
import com.chicu.marketpulse.fanout.FanOutProperties;
import com.chicu.marketpulse.fanout.MarketEvent;
import com.chicu.marketpulse.market.feed.FinnhubFeedConnection;
import com.chicu.marketpulse.market.model.Quote;
import com.chicu.marketpulse.market.state.MarketStateService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Locale;
import java.util.Optional;

/**
 * 🌐 WebSocket-канал рыночного стрима: /ws/market
 *
 * Вход:  {"action":"subscribe","symbol":"AAPL"} / {"action":"unsubscribe","symbol":"AAPL"}
 * Выход: {"type":"price_update"|"stats_update"|"connection_status_changed", "symbol":…, "data":…}
 *
 * Сразу после подключения клиент получает полный снапшот цен и статистики.
 * НИКАКОЙ бизнес-логики внутри: только регистрация в дистрибьюторе.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MarketStreamWebSocketHandler extends TextWebSocketHandler {

    private final FanOutDistributor fanOut;
    private final FanOutProperties fanOutProps;
    private final MarketStateService state;
    private final FinnhubFeedConnection feed;
    private final ObjectMapper mapper;

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        fanOut.register(new WebSocketSessionSink(
                session,
                (int) fanOutProps.getSendTimeLimit().toMillis(),
                fanOutProps.getBufferSizeLimit()
        ));

        log.info("🔌 [WS-MARKET] CONNECT from {} (total={})",
                session.getRemoteAddress(), fanOut.connectionCount());

        // initial push
        fanOut.sendTo(session.getId(), MarketEvent.prices(state.getSnapshot()));
        fanOut.sendTo(session.getId(), MarketEvent.stats(state.getStats()));
        fanOut.sendTo(session.getId(), MarketEvent.connectionStatus(feed.isConnected()));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        String id = session.getId();
        try {
            JsonNode node = mapper.readTree(message.getPayload());
            String action = node.path("action").asText("").trim().toLowerCase(Locale.ROOT);

            switch (action) {
                case "subscribe" -> {
                    String symbol = Symbols.require(node.path("symbol").asText(null));
                    fanOut.subscribe(id, symbol);
                    Optional<Quote> q = state.getQuote(symbol);
                    q.ifPresent(quote -> fanOut.sendTo(id, MarketEvent.symbolPrice(symbol, quote.price())));
                    log.debug("💬 [WS-MARKET] {} subscribe {}", id, symbol);
                }
                case "unsubscribe" -> {
                    String symbol = Symbols.require(node.path("symbol").asText(null));
                    fanOut.unsubscribe(id, symbol);
                    log.debug("💬 [WS-MARKET] {} unsubscribe {}", id, symbol);
                }
                default -> throw new IllegalArgumentException("Unknown action: " + action);
            }
        } catch (IllegalArgumentException e) {
            fanOut.sendTo(id, MarketEvent.error(e.getMessage()));
        } catch (Exception e) {
            log.warn("⚠️ [WS-MARKET] bad frame from {}: {}", id, e.getMessage());
            fanOut.sendTo(id, MarketEvent.error("Malformed message"));
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        fanOut.onConnectionClosed(session.getId());
        log.info("❌ [WS-MARKET] DISCONNECT {} (status={}, total={})",
                session.getRemoteAddress(), status, fanOut.connectionCount());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("⚠️ [WS-MARKET] Transport error from {}: {}",
                session.getRemoteAddress(), exception.getMessage());
    }
}
