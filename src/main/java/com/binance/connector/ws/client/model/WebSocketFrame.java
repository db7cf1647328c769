package com.binance.connector.ws.client.model;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * 待发送的WebSocket帧
 */
public final class WebSocketFrame {
    public static final WebSocketFrame PING = new WebSocketFrame(Type.PING, null, null);

    public enum Type {
        PING,
        TEXT,
        DATA
    }

    private final Type type;
    private final String text;
    private final byte[] data;

    private WebSocketFrame(Type type, String text, byte[] data) {
        this.type = type;
        this.text = text;
        this.data = data;
    }

    public static WebSocketFrame text(String text) {
        return new WebSocketFrame(Type.TEXT, Objects.requireNonNull(text, "text"), null);
    }

    public static WebSocketFrame data(byte[] data) {
        Objects.requireNonNull(data, "data");
        return new WebSocketFrame(Type.DATA, null, data.clone());
    }

    public Type getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    public byte[] getData() {
        return data != null ? data.clone() : null;
    }

    /**
     * 帧负载字节数，PING 为 0
     */
    public int size() {
        switch (type) {
            case TEXT:
                return text.getBytes(StandardCharsets.UTF_8).length;
            case DATA:
                return data.length;
            default:
                return 0;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WebSocketFrame)) {
            return false;
        }
        WebSocketFrame other = (WebSocketFrame) o;
        return type == other.type && Objects.equals(text, other.text) && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(type, text) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return type.name().toLowerCase();
    }
}
