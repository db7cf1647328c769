package com.binance.connector.ws.client.reconnect;

import com.binance.connector.ws.client.model.ReconnectMethod;
import com.binance.connector.ws.client.model.ReconnectReason;
import com.binance.connector.ws.client.model.WebSocketEvent;
import com.binance.connector.ws.client.network.NetworkPath;

/**
 * 不重连
 */
public final class NoReconnectStrategy implements ReconnectStrategy {

    @Override
    public ReconnectMethod reconnectMethod(ReconnectReason reason, long attemptCount, NetworkPath networkPath) {
        return ReconnectMethod.none("");
    }

    @Override
    public boolean shouldReconnectImmediatelyWhenNetworkRecovered(NetworkPath networkPath) {
        return false;
    }

    @Override
    public boolean shouldReconnectWhenReceivingEvent(WebSocketEvent event) {
        return false;
    }
}
