package com.chicu.marketpulse.market.feed;

@FunctionalInterface
public interface ConnectionStatusListener {

    /**
     * @param connected true: переход в CONNECTED, false: потеря соединения
     */
    void onStatusChanged(boolean connected);
}
