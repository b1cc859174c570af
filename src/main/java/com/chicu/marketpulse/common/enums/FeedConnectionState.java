package com.chicu.marketpulse.common.enums;

public enum FeedConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    CLOSING
}
