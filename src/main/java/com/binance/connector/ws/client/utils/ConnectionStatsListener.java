package com.binance.connector.ws.client.utils;

import com.binance.connector.ws.client.WebSocketClientListener;
import com.binance.connector.ws.client.impl.ResilientWebSocketClient;
import com.binance.connector.ws.client.model.ConnectionStatus;
import com.binance.connector.ws.client.model.ReconnectReason;
import com.binance.connector.ws.client.model.WebSocketEvent;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 统计连接运行情况的监听器
 * 记录收到的消息数、重连次数与自动ping次数，并可把状态变化转成字符串回调
 */
public class ConnectionStatsListener implements WebSocketClientListener {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionStatsListener.class);

    private final Consumer<String> messageHandler;
    private final Consumer<String> connectionStatusCallback;

    // 连接统计
    private final AtomicLong totalMessagesReceived = new AtomicLong();
    private final AtomicLong totalReconnects = new AtomicLong();
    private final AtomicLong totalAutoPings = new AtomicLong();
    private volatile long lastMessageTime = 0;
    private volatile ConnectionStatus lastStatus = ConnectionStatus.NORMAL_CLOSED;

    /**
     * @param messageHandler 文本消息处理器（可选）
     * @param connectionStatusCallback 连接状态变化回调（可选）
     */
    public ConnectionStatsListener(Consumer<String> messageHandler, Consumer<String> connectionStatusCallback) {
        this.messageHandler = messageHandler;
        this.connectionStatusCallback = connectionStatusCallback;
    }

    public ConnectionStatsListener() {
        this(null, null);
    }

    @Override
    public void onStatusChanged(ResilientWebSocketClient client, ConnectionStatus status) {
        lastStatus = status;
        notifyStatus("STATE_" + status);
    }

    @Override
    public void onEvent(ResilientWebSocketClient client, WebSocketEvent event) {
        if (event.getType() != WebSocketEvent.Type.TEXT && event.getType() != WebSocketEvent.Type.DATA) {
            return;
        }
        totalMessagesReceived.incrementAndGet();
        lastMessageTime = System.currentTimeMillis();
        if (messageHandler != null && event.getType() == WebSocketEvent.Type.TEXT) {
            try {
                messageHandler.accept(event.getText());
            } catch (Exception e) {
                logger.error("[Client {}] Error processing message", client.getClientId(), e);
            }
        }
    }

    @Override
    public void onWillReconnect(ResilientWebSocketClient client, ReconnectReason reason, Duration delay) {
        notifyStatus("RECONNECTING_IN_" + delay.toMillis() + "MS");
    }

    @Override
    public void onDidReconnect(ResilientWebSocketClient client, ReconnectReason reason, long attemptCount) {
        totalReconnects.incrementAndGet();
        notifyStatus("RECONNECT_ATTEMPT_" + attemptCount);
    }

    @Override
    public void onAutoPingSent(ResilientWebSocketClient client) {
        totalAutoPings.incrementAndGet();
    }

    /**
     * 获取连接统计信息
     */
    public ConnectionStats getStats() {
        return new ConnectionStats(
            lastStatus.isConnected(),
            totalMessagesReceived.get(),
            totalReconnects.get(),
            totalAutoPings.get(),
            lastMessageTime
        );
    }

    private void notifyStatus(String status) {
        if (connectionStatusCallback != null) {
            try {
                connectionStatusCallback.accept(status);
            } catch (Exception e) {
                logger.warn("Error in connection status callback", e);
            }
        }
    }

    /**
     * 连接统计信息
     */
    public static class ConnectionStats {
        public final boolean isConnected;
        public final long totalMessages;
        public final long totalReconnects;
        public final long totalAutoPings;
        public final long lastMessageTime;

        public ConnectionStats(boolean isConnected, long totalMessages, long totalReconnects,
                               long totalAutoPings, long lastMessageTime) {
            this.isConnected = isConnected;
            this.totalMessages = totalMessages;
            this.totalReconnects = totalReconnects;
            this.totalAutoPings = totalAutoPings;
            this.lastMessageTime = lastMessageTime;
        }

        @Override
        public String toString() {
            return String.format("ConnectionStats{connected=%s, messages=%d, reconnects=%d, pings=%d, lastMessage=%d}",
                isConnected, totalMessages, totalReconnects, totalAutoPings, lastMessageTime);
        }
    }
}
