package com.binance.connector.ws.client.backend;

import com.binance.connector.ws.client.enums.CloseCode;
import com.binance.connector.ws.client.exceptions.WebSocketClientException;
import com.binance.connector.ws.client.model.WebSocketEvent;
import com.binance.connector.ws.client.model.WebSocketFrame;
import com.binance.connector.ws.client.utils.HttpClientSingleton;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okio.ByteString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 基于OkHttp的WebSocket后端
 *
 * OkHttp不提供应用层发送ping帧的接口，协议层心跳由独立客户端的 pingInterval 负责，
 * 未按时收到pong时OkHttp会以失败关闭连接，因此写入 PING 帧只校验连接是否可用。
 */
public class OkHttpWebSocketBackend extends WebSocketListener implements WebSocketBackend {
    private static final AtomicInteger backendCounter = new AtomicInteger(0);
    private static final Logger logger = LoggerFactory.getLogger(OkHttpWebSocketBackend.class);

    private final int backendId;
    private final OkHttpClient dedicatedClient; // 每个后端独立的客户端
    private final boolean ownsClient;
    private final WebSocketEventStream eventStream = new WebSocketEventStream();
    private final Object mutex = new Object();

    private volatile WebSocket webSocket;
    private volatile boolean closed;

    public OkHttpWebSocketBackend() {
        this(HttpClientSingleton.createDedicatedWebSocketClient(), true);
    }

    /**
     * @param client 外部提供的客户端，关闭后端时不会被关闭
     */
    public OkHttpWebSocketBackend(OkHttpClient client) {
        this(client, false);
    }

    private OkHttpWebSocketBackend(OkHttpClient client, boolean ownsClient) {
        this.backendId = backendCounter.incrementAndGet();
        this.dedicatedClient = client;
        this.ownsClient = ownsClient;
    }

    /**
     * 创建使用独立客户端的后端
     */
    public static OkHttpWebSocketBackend withDedicatedClient(OkHttpClient client) {
        return new OkHttpWebSocketBackend(client, true);
    }

    public OkHttpClient getHttpClient() {
        return dedicatedClient;
    }

    @Override
    public void connect(Request request) {
        synchronized (mutex) {
            if (closed) {
                throw new WebSocketClientException("Backend " + backendId + " is closed");
            }
            if (webSocket != null) {
                // 丢弃旧连接，之后它的回调都会被忽略
                webSocket.cancel();
                webSocket = null;
            }
            logger.info("[Backend {}] Connecting to {}", backendId, request.url());
            webSocket = dedicatedClient.newWebSocket(request, this);
        }
    }

    @Override
    public void disconnect(CloseCode closeCode, String reason) {
        synchronized (mutex) {
            WebSocket ws = webSocket;
            if (ws == null) {
                return;
            }
            logger.info("[Backend {}] Closing connection: {} - {}", backendId, closeCode, reason);
            if (isSendableCloseCode(closeCode)) {
                ws.close(closeCode.getCode(), reason);
                return;
            }
            // 保留码不能出现在关闭帧中，直接取消并自行上报断开
            webSocket = null;
            ws.cancel();
            eventStream.emit(WebSocketEvent.disconnected(reason, closeCode));
        }
    }

    @Override
    public void write(WebSocketFrame frame) {
        WebSocket ws = webSocket;
        if (ws == null) {
            throw new WebSocketClientException("Backend " + backendId + " is not connected");
        }
        boolean accepted;
        switch (frame.getType()) {
            case TEXT:
                accepted = ws.send(frame.getText());
                break;
            case DATA:
                accepted = ws.send(ByteString.of(frame.getData()));
                break;
            default:
                logger.trace("[Backend {}] Ping delegated to protocol keep-alive", backendId);
                return;
        }
        if (!accepted) {
            throw new WebSocketClientException("Backend " + backendId + " rejected " + frame + " frame, connection closing or queue full");
        }
    }

    /**
     * OkHttp 不提供发送ping帧的接口，保活依赖客户端的 pingInterval
     */
    @Override
    public boolean supportsPingFrames() {
        return false;
    }

    @Override
    public WebSocketEvent nextEvent() throws InterruptedException {
        return eventStream.take();
    }

    @Override
    public void close() {
        synchronized (mutex) {
            if (closed) {
                return;
            }
            closed = true;
            if (webSocket != null) {
                webSocket.cancel();
                webSocket = null;
            }
        }
        eventStream.finish();
        if (ownsClient) {
            HttpClientSingleton.shutdownClient(dedicatedClient);
        }
        logger.info("[Backend {}] Resources cleaned up", backendId);
    }

    public int getBackendId() {
        return backendId;
    }

    @Override
    public void onOpen(WebSocket ws, Response response) {
        if (isStale(ws)) {
            return;
        }
        logger.info("[Backend {}] Connected to Server", backendId);
        Map<String, String> headers = new LinkedHashMap<>();
        for (String name : response.headers().names()) {
            headers.put(name, response.header(name));
        }
        eventStream.emit(WebSocketEvent.connected(headers));
    }

    @Override
    public void onMessage(WebSocket ws, String text) {
        if (isStale(ws)) {
            return;
        }
        eventStream.emit(WebSocketEvent.text(text));
    }

    @Override
    public void onMessage(WebSocket ws, ByteString bytes) {
        if (isStale(ws)) {
            return;
        }
        eventStream.emit(WebSocketEvent.data(bytes.toByteArray()));
    }

    @Override
    public void onClosing(WebSocket ws, int code, String reason) {
        if (isStale(ws)) {
            return;
        }
        logger.info("[Backend {}] Connection closing: {} - {}", backendId, code, reason);
        // 回应对端的关闭帧
        ws.close(isSendableCloseCode(CloseCode.of(code)) ? code : CloseCode.NORMAL_CLOSURE.getCode(), null);
        synchronized (mutex) {
            if (webSocket == ws) {
                webSocket = null;
            }
        }
        eventStream.emit(WebSocketEvent.disconnected(reason, CloseCode.of(code)));
    }

    @Override
    public void onFailure(WebSocket ws, Throwable t, Response response) {
        if (isStale(ws)) {
            return;
        }
        logger.error("[Backend {}] Failure", backendId, t);
        synchronized (mutex) {
            if (webSocket == ws) {
                webSocket = null;
            }
        }
        eventStream.emit(WebSocketEvent.error(t));
    }

    private boolean isStale(WebSocket ws) {
        if (ws != webSocket) {
            logger.debug("[Backend {}] Ignoring callback from a replaced connection", backendId);
            return true;
        }
        return false;
    }

    /**
     * OkHttp只允许在关闭帧中发送 1000-1003、1007-1014 范围内的关闭码
     */
    static boolean isSendableCloseCode(CloseCode closeCode) {
        int code = closeCode.getCode();
        return (code >= 1000 && code <= 1003) || (code >= 1007 && code <= 1014);
    }
}
