package com.binance.connector.ws.client.model;

import com.binance.connector.ws.client.network.NetworkPath;
import java.util.Objects;

/**
 * 触发重连的原因，仅用于决策与通知，不会被修改
 */
public final class ReconnectReason {

    public enum Type {
        SUGGESTED_BY_EVENT,
        NETWORK_RECOVERY
    }

    private final Type type;
    private final WebSocketEvent event;
    private final NetworkPath networkPath;

    private ReconnectReason(Type type, WebSocketEvent event, NetworkPath networkPath) {
        this.type = type;
        this.event = event;
        this.networkPath = networkPath;
    }

    public static ReconnectReason suggestedByEvent(WebSocketEvent event) {
        return new ReconnectReason(Type.SUGGESTED_BY_EVENT, Objects.requireNonNull(event, "event"), null);
    }

    public static ReconnectReason networkRecovery(NetworkPath networkPath) {
        return new ReconnectReason(Type.NETWORK_RECOVERY, null, Objects.requireNonNull(networkPath, "networkPath"));
    }

    public Type getType() {
        return type;
    }

    /**
     * 触发重连的事件，网络恢复时为 null
     */
    public WebSocketEvent getEvent() {
        return event;
    }

    /**
     * 恢复后的网络路径，事件触发时为 null
     */
    public NetworkPath getNetworkPath() {
        return networkPath;
    }

    public String describe() {
        if (type == Type.SUGGESTED_BY_EVENT) {
            return "suggested reconnect event(" + event.describe() + ")";
        }
        return "network recovery(" + networkPath + ")";
    }

    @Override
    public String toString() {
        return type == Type.SUGGESTED_BY_EVENT ? "suggested reconnect event" : "network recovery";
    }
}
