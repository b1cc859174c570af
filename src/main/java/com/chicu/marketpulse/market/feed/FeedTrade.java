package com.chicu.marketpulse.market.feed;

/**
 * Один декодированный трейд провайдера: {s, p, v, t}.
 */
public record FeedTrade(
        String symbol,
        double price,
        Long volume,
        long tsMillis
) {}
