package com.chicu.marketpulse.market.provider;

import java.time.Duration;

/**
 * REST-источник последней цены по символу.
 */
public interface QuoteProvider {

    String getName();

    boolean isEnabled();

    /**
     * Верхняя граница ожидания одного вызова fetchQuote().
     */
    Duration getTimeout();

    /**
     * @return цена > 0
     * @throws QuoteProviderException при любой ошибке провайдера
     */
    double fetchQuote(String symbol);
}
