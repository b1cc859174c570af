package com.chicu.marketpulse.web.dto;

import com.chicu.marketpulse.common.enums.FeedConnectionState;
import lombok.Builder;
import lombok.Value;

import java.util.Set;

@Value
@Builder
public class FeedStatusDto {
    FeedConnectionState state;
    boolean connected;
    boolean demoMode;
    boolean exhausted;
    int reconnectAttempts;
    Set<String> subscribedSymbols;
    int clientConnections;
}
