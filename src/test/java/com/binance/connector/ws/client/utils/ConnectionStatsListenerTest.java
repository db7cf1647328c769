package com.binance.connector.ws.client.utils;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.binance.connector.ws.client.impl.ResilientWebSocketClient;
import com.binance.connector.ws.client.model.ConnectionStatus;
import com.binance.connector.ws.client.model.ReconnectReason;
import com.binance.connector.ws.client.model.WebSocketEvent;
import com.binance.connector.ws.client.network.NetworkPath;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ConnectionStatsListenerTest {

    @Mock
    private ResilientWebSocketClient client;

    private final List<String> messages = new CopyOnWriteArrayList<>();
    private final List<String> statuses = new CopyOnWriteArrayList<>();
    private ConnectionStatsListener listener;

    @BeforeEach
    void setUp() {
        listener = new ConnectionStatsListener(messages::add, statuses::add);
    }

    @Test
    @DisplayName("Counts messages and forwards text to the handler")
    void countsMessages() {
        listener.onEvent(client, WebSocketEvent.text("a"));
        listener.onEvent(client, WebSocketEvent.data(new byte[] {1}));
        listener.onEvent(client, WebSocketEvent.pong());

        ConnectionStatsListener.ConnectionStats stats = listener.getStats();
        assertThat(stats.totalMessages).isEqualTo(2);
        assertThat(stats.lastMessageTime).isPositive();
        assertThat(messages).containsExactly("a");
    }

    @Test
    @DisplayName("Tracks reconnects, pings and the connected flag")
    void tracksConnection() {
        ReconnectReason reason = ReconnectReason.networkRecovery(NetworkPath.satisfied());

        listener.onStatusChanged(client, ConnectionStatus.CONNECTING);
        listener.onWillReconnect(client, reason, Duration.ofMillis(500));
        listener.onDidReconnect(client, reason, 1);
        listener.onStatusChanged(client, ConnectionStatus.CONNECTED);
        listener.onAutoPingSent(client);

        ConnectionStatsListener.ConnectionStats stats = listener.getStats();
        assertThat(stats.isConnected).isTrue();
        assertThat(stats.totalReconnects).isEqualTo(1);
        assertThat(stats.totalAutoPings).isEqualTo(1);
        assertThat(statuses).containsExactly(
            "STATE_connecting", "RECONNECTING_IN_500MS", "RECONNECT_ATTEMPT_1", "STATE_connected");
        assertThat(stats.toString()).contains("reconnects=1");
    }

    @Test
    @DisplayName("Handler failures are logged and do not stop counting")
    void handlerFailure() {
        when(client.getClientId()).thenReturn(7);
        ConnectionStatsListener failing = new ConnectionStatsListener(text -> {
            throw new IllegalStateException("bad message");
        }, null);

        failing.onEvent(client, WebSocketEvent.text("a"));
        failing.onEvent(client, WebSocketEvent.text("b"));

        assertThat(failing.getStats().totalMessages).isEqualTo(2);
    }
}
