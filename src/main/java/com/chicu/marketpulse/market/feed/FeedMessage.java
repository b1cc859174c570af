package com.chicu.marketpulse.market.feed;

import java.util.List;

public record FeedMessage(Type type, List<FeedTrade> trades, String detail) {

    public enum Type {
        TRADE,
        PING,
        ERROR,
        IGNORED
    }

    public static FeedMessage trades(List<FeedTrade> trades) {
        return new FeedMessage(Type.TRADE, List.copyOf(trades), null);
    }

    public static FeedMessage ping() {
        return new FeedMessage(Type.PING, List.of(), null);
    }

    public static FeedMessage error(String detail) {
        return new FeedMessage(Type.ERROR, List.of(), detail);
    }

    public static FeedMessage ignored(String type) {
        return new FeedMessage(Type.IGNORED, List.of(), type);
    }
}
