package com.chicu.marketpulse.market.provider;

/**
 * Ошибка REST-провайдера: таймаут, 4xx/5xx, пустое или битое тело, выключенный ключ.
 * Наружу резолвера не выходит никогда.
 */
public class QuoteProviderException extends RuntimeException {

    public QuoteProviderException(String message) {
        super(message);
    }

    public QuoteProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
