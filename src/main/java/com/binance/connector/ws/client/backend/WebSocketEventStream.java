package com.binance.connector.ws.client.backend;

import com.binance.connector.ws.client.model.WebSocketEvent;
import java.util.Objects;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * 后端事件流：无界、有序、单消费者
 */
public final class WebSocketEventStream {
    // 结束标记，不会交给消费者
    private static final WebSocketEvent END_OF_STREAM = WebSocketEvent.text("<end-of-stream>");

    private final LinkedBlockingQueue<WebSocketEvent> queue = new LinkedBlockingQueue<>();
    private volatile boolean finished;

    /**
     * @return 流已结束时返回 false，事件被丢弃
     */
    public boolean emit(WebSocketEvent event) {
        Objects.requireNonNull(event, "event");
        if (finished) {
            return false;
        }
        return queue.offer(event);
    }

    public WebSocketEvent take() throws InterruptedException {
        if (finished && queue.isEmpty()) {
            return null;
        }
        WebSocketEvent event = queue.take();
        return event == END_OF_STREAM ? null : event;
    }

    /**
     * @return 超时返回 null，同 {@link #take()} 一样在流结束时也返回 null
     */
    public WebSocketEvent poll(long timeout, TimeUnit unit) throws InterruptedException {
        WebSocketEvent event = queue.poll(timeout, unit);
        return event == END_OF_STREAM ? null : event;
    }

    /**
     * 结束事件流，已入队的事件仍会被消费
     */
    public void finish() {
        if (!finished) {
            finished = true;
            queue.offer(END_OF_STREAM);
        }
    }

    public boolean isFinished() {
        return finished;
    }
}
