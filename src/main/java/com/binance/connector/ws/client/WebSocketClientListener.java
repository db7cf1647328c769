package com.binance.connector.ws.client;

import com.binance.connector.ws.client.impl.ResilientWebSocketClient;
import com.binance.connector.ws.client.model.ClientLog;
import com.binance.connector.ws.client.model.ConnectionStatus;
import com.binance.connector.ws.client.model.ReconnectReason;
import com.binance.connector.ws.client.model.WebSocketEvent;
import com.binance.connector.ws.client.network.NetworkPath;
import java.time.Duration;

/**
 * WebSocket客户端事件监听器
 * 所有回调都有空的默认实现，按需覆盖；回调在客户端的串行线程上执行，不要在其中阻塞等待客户端返回的Future
 */
public interface WebSocketClientListener {

    /**
     * 连接状态变化时调用，每次真实的状态切换只通知一次
     * @param status 新的连接状态
     */
    default void onStatusChanged(ResilientWebSocketClient client, ConnectionStatus status) {}

    /**
     * 收到后端事件时调用
     * @param event 原始事件
     */
    default void onEvent(ResilientWebSocketClient client, WebSocketEvent event) {}

    /**
     * 客户端输出日志时调用
     */
    default void onLog(ResilientWebSocketClient client, ClientLog log) {}

    /**
     * 即将重连时调用
     * @param reason 重连原因
     * @param delay 距离重连的延迟，0 表示立即
     */
    default void onWillReconnect(ResilientWebSocketClient client, ReconnectReason reason, Duration delay) {}

    /**
     * 重连已发起时调用
     * @param reason 重连原因
     * @param attemptCount 重连尝试次数（从1开始）
     */
    default void onDidReconnect(ResilientWebSocketClient client, ReconnectReason reason, long attemptCount) {}

    /**
     * 自动ping发送后调用
     */
    default void onAutoPingSent(ResilientWebSocketClient client) {}

    /**
     * 网络路径变化时调用
     * @param path 新的网络路径
     */
    default void onNetworkPathChanged(ResilientWebSocketClient client, NetworkPath path) {}
}
