package com.binance.connector.ws.client.backend;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.binance.connector.ws.client.enums.CloseCode;
import com.binance.connector.ws.client.exceptions.WebSocketClientException;
import com.binance.connector.ws.client.model.WebSocketEvent;
import com.binance.connector.ws.client.model.WebSocketFrame;
import com.binance.connector.ws.client.utils.HttpClientSingleton;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okio.ByteString;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

/**
 * 在本地回显帧的 MockWebServer 上运行 OkHttp 后端
 */
@Timeout(value = 20, unit = TimeUnit.SECONDS)
class OkHttpWebSocketBackendTest {

    private MockWebServer server;
    private OkHttpWebSocketBackend backend;
    private volatile WebSocket serverSocket;

    private final WebSocketListener echoServer = new WebSocketListener() {
        @Override
        public void onOpen(WebSocket webSocket, Response response) {
            serverSocket = webSocket;
            webSocket.send("welcome");
        }

        @Override
        public void onMessage(WebSocket webSocket, String text) {
            webSocket.send("echo:" + text);
        }

        @Override
        public void onMessage(WebSocket webSocket, ByteString bytes) {
            webSocket.send(bytes);
        }

        @Override
        public void onClosing(WebSocket webSocket, int code, String reason) {
            webSocket.close(code, reason);
        }
    };

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        backend = OkHttpWebSocketBackend.withDedicatedClient(HttpClientSingleton.createDedicatedWebSocketClient(
            Duration.ofSeconds(5), Duration.ZERO, null, null));
    }

    @AfterEach
    void tearDown() throws IOException {
        backend.close();
        server.shutdown();
    }

    private Request request() {
        return new Request.Builder().url(server.url("/ws")).build();
    }

    private WebSocketEvent next() throws InterruptedException {
        WebSocketEvent event = backend.nextEvent();
        assertThat(event).isNotNull();
        return event;
    }

    private void openEchoConnection() throws InterruptedException {
        server.enqueue(new MockResponse().withWebSocketUpgrade(echoServer));
        backend.connect(request());

        WebSocketEvent connected = next();
        assertThat(connected.getType()).isEqualTo(WebSocketEvent.Type.CONNECTED);
        assertThat(connected.getHeaders()).isNotEmpty();
        assertThat(next().getText()).isEqualTo("welcome");
    }

    @Test
    @DisplayName("Text and binary frames travel both ways")
    void exchangesFrames() throws InterruptedException {
        openEchoConnection();

        backend.write(WebSocketFrame.text("hi"));
        WebSocketEvent text = next();
        backend.write(WebSocketFrame.data(new byte[] {1, 2, 3}));
        WebSocketEvent data = next();

        assertThat(text.getType()).isEqualTo(WebSocketEvent.Type.TEXT);
        assertThat(text.getText()).isEqualTo("echo:hi");
        assertThat(data.getType()).isEqualTo(WebSocketEvent.Type.DATA);
        assertThat(data.getData()).containsExactly(1, 2, 3);
    }

    @Test
    @DisplayName("Ping frames are accepted while connected")
    void pingAccepted() throws InterruptedException {
        openEchoConnection();

        backend.write(WebSocketFrame.PING);
    }

    @Test
    @DisplayName("Server close is reported with its close code")
    void serverClose() throws InterruptedException {
        openEchoConnection();

        serverSocket.close(CloseCode.GOING_AWAY.getCode(), "bye");

        WebSocketEvent event = next();
        assertThat(event.getType()).isEqualTo(WebSocketEvent.Type.DISCONNECTED);
        assertThat(event.getCloseCode()).isEqualTo(CloseCode.GOING_AWAY);
        assertThat(event.getReason()).isEqualTo("bye");
        assertThatThrownBy(() -> backend.write(WebSocketFrame.text("late")))
            .isInstanceOf(WebSocketClientException.class);
    }

    @Test
    @DisplayName("Client close completes the handshake")
    void clientClose() throws InterruptedException {
        openEchoConnection();

        backend.disconnect(CloseCode.NORMAL_CLOSURE, "done");

        WebSocketEvent event = next();
        assertThat(event.getType()).isEqualTo(WebSocketEvent.Type.DISCONNECTED);
        assertThat(event.getCloseCode()).isEqualTo(CloseCode.NORMAL_CLOSURE);
    }

    @Test
    @DisplayName("Reserved close codes cancel the socket and are reported locally")
    void reservedCloseCode() throws InterruptedException {
        openEchoConnection();

        backend.disconnect(CloseCode.ABNORMAL_CLOSURE, null);

        WebSocketEvent event = next();
        assertThat(event.getCloseCode()).isEqualTo(CloseCode.ABNORMAL_CLOSURE);
        assertThatThrownBy(() -> backend.write(WebSocketFrame.text("late")))
            .isInstanceOf(WebSocketClientException.class);
    }

    @Test
    @DisplayName("Failed handshake is reported as an error")
    void handshakeFailure() throws InterruptedException {
        server.enqueue(new MockResponse().setResponseCode(500));

        backend.connect(request());

        assertThat(next().getType()).isEqualTo(WebSocketEvent.Type.ERROR);
    }

    @Test
    @DisplayName("Writing without a connection fails")
    void writeWithoutConnection() {
        assertThatThrownBy(() -> backend.write(WebSocketFrame.text("x")))
            .isInstanceOf(WebSocketClientException.class)
            .hasMessageContaining("not connected");
    }

    @Test
    @DisplayName("Close ends the event stream and rejects new connections")
    void closeEndsStream() throws InterruptedException {
        backend.close();

        assertThat(backend.nextEvent()).isNull();
        assertThatThrownBy(() -> backend.connect(request())).isInstanceOf(WebSocketClientException.class);
    }

    @Test
    @DisplayName("Only codes allowed in a close frame are sent")
    void sendableCloseCodes() {
        assertThat(OkHttpWebSocketBackend.isSendableCloseCode(CloseCode.NORMAL_CLOSURE)).isTrue();
        assertThat(OkHttpWebSocketBackend.isSendableCloseCode(CloseCode.INTERNAL_SERVER_ERROR)).isTrue();
        assertThat(OkHttpWebSocketBackend.isSendableCloseCode(CloseCode.NO_STATUS_RECEIVED)).isFalse();
        assertThat(OkHttpWebSocketBackend.isSendableCloseCode(CloseCode.ABNORMAL_CLOSURE)).isFalse();
        assertThat(OkHttpWebSocketBackend.isSendableCloseCode(CloseCode.TLS_HANDSHAKE_FAILURE)).isFalse();
        assertThat(OkHttpWebSocketBackend.isSendableCloseCode(CloseCode.INVALID)).isFalse();
    }
}
