package com.chicu.marketpulse.market.feed;

/**
 * 🔔 Получает трейды от стримингового фида.
 *
 * Вызывается синхронно из receive-потока сокета, в порядке регистрации.
 */
@FunctionalInterface
public interface TradeListener {

    void onTrade(FeedTrade trade);
}
