package com.binance.connector.ws.client.support;

import com.binance.connector.ws.client.backend.WebSocketBackend;
import com.binance.connector.ws.client.backend.WebSocketEventStream;
import com.binance.connector.ws.client.enums.CloseCode;
import com.binance.connector.ws.client.exceptions.WebSocketClientException;
import com.binance.connector.ws.client.model.WebSocketEvent;
import com.binance.connector.ws.client.model.WebSocketFrame;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import okhttp3.Request;

/**
 * 内存中的后端，由测试脚本推送事件
 * 主动断开时模拟对端回应，推送一条对应关闭码的断开事件
 */
public class FakeBackend implements WebSocketBackend {
    private final WebSocketEventStream eventStream = new WebSocketEventStream();
    private final AtomicInteger connectCount = new AtomicInteger();
    private final List<Request> requests = new CopyOnWriteArrayList<>();
    private final List<CloseCode> disconnects = new CopyOnWriteArrayList<>();
    private final List<WebSocketFrame> written = new CopyOnWriteArrayList<>();

    private volatile boolean failWrites;
    private volatile boolean echoDisconnect = true;
    private volatile boolean supportsPingFrames = true;
    private volatile boolean closed;

    @Override
    public void connect(Request request) {
        connectCount.incrementAndGet();
        requests.add(request);
    }

    @Override
    public void disconnect(CloseCode closeCode, String reason) {
        disconnects.add(closeCode);
        if (echoDisconnect) {
            eventStream.emit(WebSocketEvent.disconnected(reason, closeCode));
        }
    }

    @Override
    public void write(WebSocketFrame frame) {
        if (failWrites) {
            throw new WebSocketClientException("write failed");
        }
        written.add(frame);
    }

    @Override
    public boolean supportsPingFrames() {
        return supportsPingFrames;
    }

    @Override
    public WebSocketEvent nextEvent() throws InterruptedException {
        return eventStream.take();
    }

    @Override
    public void close() {
        closed = true;
        eventStream.finish();
    }

    public void emit(WebSocketEvent event) {
        eventStream.emit(event);
    }

    public int connectCount() {
        return connectCount.get();
    }

    public List<Request> requests() {
        return requests;
    }

    public List<CloseCode> disconnects() {
        return disconnects;
    }

    public List<WebSocketFrame> written() {
        return written;
    }

    public void setFailWrites(boolean failWrites) {
        this.failWrites = failWrites;
    }

    public void setSupportsPingFrames(boolean supportsPingFrames) {
        this.supportsPingFrames = supportsPingFrames;
    }

    public void setEchoDisconnect(boolean echoDisconnect) {
        this.echoDisconnect = echoDisconnect;
    }

    public boolean isClosed() {
        return closed;
    }
}
