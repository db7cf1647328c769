package com.binance.connector.ws.client.model;

import com.binance.connector.ws.client.enums.CloseCode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 后端上报的WebSocket事件
 */
public final class WebSocketEvent {
    private static final WebSocketEvent PONG = new WebSocketEvent(Type.PONG, null, null, null, null, null, null);
    private static final WebSocketEvent RECONNECT_SUGGESTED =
        new WebSocketEvent(Type.RECONNECT_SUGGESTED, null, null, null, null, null, null);

    public enum Type {
        CONNECTED,
        DISCONNECTED,
        TEXT,
        DATA,
        PONG,
        ERROR,
        RECONNECT_SUGGESTED     // 部分后端会在连接仍可用时建议重连
    }

    private final Type type;
    private final Map<String, String> headers;
    private final String reason;
    private final CloseCode closeCode;
    private final String text;
    private final byte[] data;
    private final Throwable error;

    private WebSocketEvent(Type type, Map<String, String> headers, String reason, CloseCode closeCode,
                           String text, byte[] data, Throwable error) {
        this.type = type;
        this.headers = headers;
        this.reason = reason;
        this.closeCode = closeCode;
        this.text = text;
        this.data = data;
        this.error = error;
    }

    public static WebSocketEvent connected(Map<String, String> headers) {
        Map<String, String> copy = headers == null ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        return new WebSocketEvent(Type.CONNECTED, copy, null, null, null, null, null);
    }

    /**
     * @param reason 关闭原因（可能为null）
     * @param closeCode 关闭码
     */
    public static WebSocketEvent disconnected(String reason, CloseCode closeCode) {
        return new WebSocketEvent(Type.DISCONNECTED, null, reason, Objects.requireNonNull(closeCode, "closeCode"),
            null, null, null);
    }

    public static WebSocketEvent text(String text) {
        return new WebSocketEvent(Type.TEXT, null, null, null, Objects.requireNonNull(text, "text"), null, null);
    }

    public static WebSocketEvent data(byte[] data) {
        return new WebSocketEvent(Type.DATA, null, null, null, null, data.clone(), null);
    }

    public static WebSocketEvent pong() {
        return PONG;
    }

    public static WebSocketEvent error(Throwable error) {
        return new WebSocketEvent(Type.ERROR, null, null, null, null, null, Objects.requireNonNull(error, "error"));
    }

    public static WebSocketEvent reconnectSuggested() {
        return RECONNECT_SUGGESTED;
    }

    public Type getType() {
        return type;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public String getReason() {
        return reason;
    }

    public CloseCode getCloseCode() {
        return closeCode;
    }

    public String getText() {
        return text;
    }

    public byte[] getData() {
        return data != null ? data.clone() : null;
    }

    public Throwable getError() {
        return error;
    }

    /**
     * 事件是否表明连接处于可用状态
     */
    public boolean isConnected() {
        switch (type) {
            case CONNECTED:
            case TEXT:
            case DATA:
            case PONG:
                return true;
            default:
                return false;
        }
    }

    /**
     * 是否为异常关闭：传输错误，或携带异常关闭码的断开事件
     */
    public boolean isAbnormalClosed() {
        if (type == Type.ERROR) {
            return true;
        }
        return type == Type.DISCONNECTED && closeCode.isAbnormal();
    }

    public boolean isReconnectSuggested() {
        return type == Type.RECONNECT_SUGGESTED;
    }

    /**
     * 带负载信息的描述，用于日志
     */
    public String describe() {
        switch (type) {
            case CONNECTED:
                return "connected with headers: " + headers;
            case DISCONNECTED:
                return "disconnected with close code: " + closeCode + ", reason: " + (reason != null ? reason : "");
            case TEXT:
                return "text: " + text;
            case DATA:
                return "data of " + data.length + " bytes";
            case ERROR:
                return "error occurred for " + error.getMessage();
            default:
                return toString();
        }
    }

    @Override
    public String toString() {
        return type == Type.RECONNECT_SUGGESTED ? "reconnectSuggested" : type.name().toLowerCase();
    }
}
