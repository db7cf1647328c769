package com.binance.connector.ws.client.enums;

public enum LogLevel {
    VERBOSE,
    DEBUG,
    INFO,
    WARNING,
    ERROR
}
