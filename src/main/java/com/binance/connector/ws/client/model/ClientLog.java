package com.binance.connector.ws.client.model;

import com.binance.connector.ws.client.enums.LogLevel;

/**
 * 客户端输出给监听器的日志
 */
public final class ClientLog {
    private final LogLevel level;
    private final String message;

    public ClientLog(LogLevel level, String message) {
        this.level = level;
        this.message = message;
    }

    public LogLevel getLevel() {
        return level;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return "[" + level + "] " + message;
    }
}
