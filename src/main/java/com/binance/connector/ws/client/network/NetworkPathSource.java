package com.binance.connector.ws.client.network;

import java.util.function.Consumer;

/**
 * 原始网络路径的来源，通常是对平台网络状态回调的适配
 */
public interface NetworkPathSource {

    NetworkPath currentPath();

    /**
     * 开始上报；实现应当在开始时先上报一次当前路径
     */
    void start(Consumer<NetworkPath> sink);

    void stop();
}
