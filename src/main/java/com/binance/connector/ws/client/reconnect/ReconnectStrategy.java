package com.binance.connector.ws.client.reconnect;

import com.binance.connector.ws.client.model.ReconnectMethod;
import com.binance.connector.ws.client.model.ReconnectReason;
import com.binance.connector.ws.client.model.WebSocketEvent;
import com.binance.connector.ws.client.network.NetworkPath;

/**
 * 重连策略
 * 纯决策接口，不持有定时器也不产生副作用；除显式的随机抖动外，相同输入必须得到相同结果
 */
public interface ReconnectStrategy {

    /**
     * 每次重连尝试的方式
     * @param reason 重连原因
     * @param attemptCount 已执行的重连次数
     * @param networkPath 当前网络路径
     */
    ReconnectMethod reconnectMethod(ReconnectReason reason, long attemptCount, NetworkPath networkPath);

    /**
     * 网络恢复时是否跳过退避延迟立即重连
     */
    default boolean shouldReconnectImmediatelyWhenNetworkRecovered(NetworkPath networkPath) {
        return networkPath.isSatisfied();
    }

    /**
     * 收到某个事件时是否需要评估重连
     * 默认在异常关闭或后端建议重连时返回 true，最终是否重连仍由 {@link #reconnectMethod} 决定
     */
    default boolean shouldReconnectWhenReceivingEvent(WebSocketEvent event) {
        return event.isAbnormalClosed() || event.isReconnectSuggested();
    }
}
