package com.binance.connector.ws.client.backend;

import com.binance.connector.ws.client.enums.CloseCode;
import com.binance.connector.ws.client.exceptions.WebSocketClientException;
import com.binance.connector.ws.client.model.WebSocketEvent;
import com.binance.connector.ws.client.model.WebSocketFrame;
import okhttp3.Request;

/**
 * WebSocket传输后端
 * 负责握手、帧编解码与实际I/O；每个后端实例只属于一个客户端
 */
public interface WebSocketBackend extends AutoCloseable {

    /**
     * 发起连接，结果通过事件流上报
     */
    void connect(Request request);

    /**
     * @param closeCode 关闭码
     * @param reason 关闭原因（可能为null）
     */
    void disconnect(CloseCode closeCode, String reason);

    /**
     * 写出一帧
     * @throws WebSocketClientException 传输层拒绝或写入失败
     */
    void write(WebSocketFrame frame);

    /**
     * 是否能写出应用层ping帧
     * 返回 false 时由传输层自行保活，客户端不会启动自动ping定时器
     */
    default boolean supportsPingFrames() {
        return true;
    }

    /**
     * 阻塞等待下一个事件，事件按产生顺序返回
     * @return 下一个事件；事件流结束时返回 null
     */
    WebSocketEvent nextEvent() throws InterruptedException;

    /**
     * 释放后端资源并结束事件流
     */
    @Override
    void close();
}
