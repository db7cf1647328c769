package com.binance.connector.ws.client.exceptions;

/**
 * WebSocket客户端异常
 * 用于后端写入失败以及客户端关闭后的调用
 */
public class WebSocketClientException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public WebSocketClientException(String message) {
        super(message);
    }

    public WebSocketClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
