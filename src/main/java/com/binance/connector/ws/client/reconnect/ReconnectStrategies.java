package com.binance.connector.ws.client.reconnect;

/**
 * 预置策略
 */
public final class ReconnectStrategies {
    private static final ReconnectStrategy DEFAULT_STRATEGY = new ExponentialReconnectStrategy();
    private static final ReconnectStrategy NONE = new NoReconnectStrategy();

    private ReconnectStrategies() {
    }

    /**
     * 默认策略：指数退避，底数2、系数0.5秒、不限次数、最大间隔10分钟、抖动0.2
     * 网络不可用时暂停重连
     */
    public static ReconnectStrategy defaultStrategy() {
        return DEFAULT_STRATEGY;
    }

    public static ReconnectStrategy none() {
        return NONE;
    }
}
