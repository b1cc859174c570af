package com.chicu.marketpulse.fanout;

import java.io.IOException;

/**
 * Одно клиентское соединение с точки зрения дистрибьютора.
 */
public interface MarketEventSink {

    String getId();

    boolean isOpen();

    void send(String frame) throws IOException;

    /**
     * Принудительное закрытие (например, клиент не успевает читать).
     */
    void close();
}
