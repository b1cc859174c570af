package com.chicu.marketpulse.web.ws;

import com.chicu.marketpulse.fanout.MarketEventSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;

/**
 * Spring-сессия как получатель событий дистрибьютора.
 * Отправка сериализована декоратором, медленный клиент упирается в его лимиты.
 */
@Slf4j
class WebSocketSessionSink implements MarketEventSink {

    private final WebSocketSession session;

    WebSocketSessionSink(WebSocketSession session, int sendTimeLimitMs, int bufferSizeLimit) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, bufferSizeLimit);
    }

    @Override
    public String getId() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(String frame) throws IOException {
        session.sendMessage(new TextMessage(frame));
    }

    @Override
    public void close() {
        try {
            session.close(CloseStatus.SESSION_NOT_RELIABLE);
        } catch (IOException e) {
            log.debug("[WS-MARKET] close {} failed: {}", session.getId(), e.getMessage());
        }
    }
}
