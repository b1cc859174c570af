package com.chicu.marketpulse.market.feed;

public class MalformedFeedMessageException extends RuntimeException {

    public MalformedFeedMessageException(String message) {
        super(message);
    }

    public MalformedFeedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
