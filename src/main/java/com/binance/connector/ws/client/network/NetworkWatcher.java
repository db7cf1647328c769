package com.binance.connector.ws.client.network;

import java.util.function.Consumer;

/**
 * 网络路径监视器
 * 由单个客户端独占，不在多个客户端之间共享
 */
public interface NetworkWatcher {

    boolean isActive();

    /**
     * 最近一次上报的网络路径，尚未上报时为数据源的初始路径
     */
    NetworkPath currentPath();

    /**
     * 开始监听
     */
    void fire();

    /**
     * 停止监听
     */
    void invalidate();

    /**
     * 订阅经过防抖处理的路径变化
     */
    Subscription onPathChange(Consumer<NetworkPath> listener);

    interface Subscription {
        void cancel();
    }
}
