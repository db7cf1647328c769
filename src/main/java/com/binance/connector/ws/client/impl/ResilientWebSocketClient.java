package com.binance.connector.ws.client.impl;

import com.binance.connector.ws.client.WebSocketClientListener;
import com.binance.connector.ws.client.backend.WebSocketBackend;
import com.binance.connector.ws.client.enums.CloseCode;
import com.binance.connector.ws.client.enums.ClosureState;
import com.binance.connector.ws.client.enums.LogLevel;
import com.binance.connector.ws.client.exceptions.WebSocketClientException;
import com.binance.connector.ws.client.model.ClientLog;
import com.binance.connector.ws.client.model.ConnectionStatus;
import com.binance.connector.ws.client.model.ReconnectMethod;
import com.binance.connector.ws.client.model.ReconnectReason;
import com.binance.connector.ws.client.model.WebSocketEvent;
import com.binance.connector.ws.client.model.WebSocketFrame;
import com.binance.connector.ws.client.network.NetworkPath;
import com.binance.connector.ws.client.network.NetworkPathMonitor;
import com.binance.connector.ws.client.network.NetworkWatcher;
import com.binance.connector.ws.client.reconnect.ReconnectStrategy;
import com.binance.connector.ws.client.utils.AsyncTimer;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Supplier;
import okhttp3.Request;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 具备自动重连能力的WebSocket客户端
 *
 * 状态、重连次数与两个定时器只在客户端自己的串行线程上读写。
 * 公共方法、后端事件、网络变化与定时器触发都会被投递到该线程执行，
 * 因此“当前状态为X则执行Y”的判断不存在竞态。
 */
public class ResilientWebSocketClient implements AutoCloseable {
    private static final AtomicInteger clientCounter = new AtomicInteger(0);
    private static final Logger logger = LoggerFactory.getLogger(ResilientWebSocketClient.class);
    private static final long CLOSE_TIMEOUT_SECONDS = 5;

    private final int clientId;
    private final WebSocketClientConfig config;
    private final Request request;
    private final WebSocketBackend backend;
    private final ReconnectStrategy reconnectStrategy;
    private final Duration autoPingInterval;
    private final NetworkWatcher networkWatcher;
    private final NetworkPathMonitor ownedMonitor; // 由客户端创建的监视器，关闭时一并释放
    private final ScheduledExecutorService executor;
    private final Thread eventPump;
    private final NetworkWatcher.Subscription networkSubscription;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile WebSocketClientListener listener;
    private volatile Thread serialThread;

    // 以下状态只在串行线程上修改
    private volatile ConnectionStatus status = ConnectionStatus.NORMAL_CLOSED;
    private volatile long reconnectCount;
    private volatile AsyncTimer autoPingTimer;
    private volatile AsyncTimer reconnectTimer;
    private volatile boolean disconnectedByUser; // 用户主动断开后，直到下次 connect() 前不再自动重连

    public ResilientWebSocketClient(WebSocketClientConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.clientId = clientCounter.incrementAndGet();
        this.request = config.getRequest();
        this.backend = config.getBackend();
        this.reconnectStrategy = config.getReconnectStrategy();
        this.autoPingInterval = config.getAutoPingInterval();
        this.listener = config.getListener();

        if (config.getNetworkWatcher() != null) {
            this.networkWatcher = config.getNetworkWatcher();
            this.ownedMonitor = null;
        } else {
            this.ownedMonitor = new NetworkPathMonitor(config.getNetworkPathSource(),
                config.getNetworkMonitorDebounceInterval());
            this.networkWatcher = ownedMonitor;
        }

        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "ws-client-" + clientId);
            t.setDaemon(true);
            serialThread = t;
            return t;
        });

        this.eventPump = new Thread(this::pumpEvents, "ws-client-" + clientId + "-events");
        this.eventPump.setDaemon(true);
        this.eventPump.start();

        this.networkSubscription = networkWatcher.onPathChange(path -> execute(() -> handleNetworkPath(path)));
        networkWatcher.fire();

        logger.info("[Client {}] Created for {}", clientId, request.url());
    }

    /**
     * 发起连接
     * @return true 表示已发起连接（不代表已连上）；当前不是关闭状态时返回 false
     */
    public CompletableFuture<Boolean> connect() {
        return submit(() -> {
            disconnectedByUser = false;
            return doConnect();
        });
    }

    /**
     * 以正常关闭码主动断开
     */
    public CompletableFuture<Void> disconnect() {
        return disconnect(CloseCode.NORMAL_CLOSURE, null);
    }

    /**
     * 主动断开连接，同时停止自动ping并取消待执行的重连
     * 之后的错误事件与网络恢复都不会触发重连，直到再次调用 connect()
     * @param closeCode 关闭码
     * @param reason 关闭原因（可能为null）
     */
    public CompletableFuture<Void> disconnect(CloseCode closeCode, String reason) {
        Objects.requireNonNull(closeCode, "closeCode");
        return submit(() -> {
            disconnectedByUser = true;
            doDisconnect(closeCode, reason);
            if (status.isClosed()) {
                // 已经断开时后端不会再上报事件
                updateStatus(ConnectionStatus.NORMAL_CLOSED);
            }
            return null;
        });
    }

    /**
     * 发送一帧；未连接时丢弃该帧并正常完成
     * 后端写入失败时返回的Future以 WebSocketClientException 异常完成
     */
    public CompletableFuture<Void> send(WebSocketFrame frame) {
        Objects.requireNonNull(frame, "frame");
        return submit(() -> {
            doSend(frame);
            return null;
        });
    }

    public CompletableFuture<Void> send(String text) {
        return send(WebSocketFrame.text(text));
    }

    public CompletableFuture<Void> ping() {
        return send(WebSocketFrame.PING);
    }

    /**
     * 销毁客户端：停止定时器与网络监听，停止消费事件并关闭后端
     * 之后调用任何操作都会以 WebSocketClientException 失败
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        logger.info("[Client {}] Closing client", clientId);
        Runnable cleanup = () -> {
            disableAutoPing();
            destroyReconnectTimer(true);
        };
        if (Thread.currentThread() == serialThread) {
            cleanup.run();
        } else {
            awaitCleanup(cleanup);
        }

        networkSubscription.cancel();
        if (ownedMonitor != null) {
            ownedMonitor.close();
        } else {
            networkWatcher.invalidate();
        }

        eventPump.interrupt();
        try {
            backend.close();
        } catch (RuntimeException e) {
            logger.warn("[Client {}] Failed to close backend", clientId, e);
        }
        executor.shutdown();
        logger.info("[Client {}] Resources cleaned up", clientId);
    }

    public boolean isClosed() {
        return closed.get();
    }

    public int getClientId() {
        return clientId;
    }

    public WebSocketClientConfig getConfig() {
        return config;
    }

    public ConnectionStatus getStatus() {
        return status;
    }

    public long getReconnectCount() {
        return reconnectCount;
    }

    public boolean hasActiveReconnectTimer() {
        AsyncTimer timer = reconnectTimer;
        return timer != null && timer.isActive();
    }

    public boolean hasActiveAutoPingTimer() {
        AsyncTimer timer = autoPingTimer;
        return timer != null && timer.isActive();
    }

    public NetworkWatcher getNetworkWatcher() {
        return networkWatcher;
    }

    public WebSocketClientListener getListener() {
        return listener;
    }

    public void setListener(WebSocketClientListener listener) {
        this.listener = listener;
    }

    private boolean doConnect() {
        if (!status.isClosed()) {
            log(LogLevel.WARNING, "Connect ignored, current status is " + status);
            return false;
        }
        updateStatus(ConnectionStatus.CONNECTING);
        log(LogLevel.INFO, "Connecting to " + request.url());
        try {
            backend.connect(request);
        } catch (RuntimeException e) {
            log(LogLevel.ERROR, "Backend failed to start connecting: " + e.getMessage());
            // 与后端上报的错误走同一条路径
            execute(() -> handleEvent(WebSocketEvent.error(e)));
        }
        return true;
    }

    private void doDisconnect(CloseCode closeCode, String reason) {
        log(LogLevel.INFO, "Disconnecting with close code " + closeCode + (reason != null ? ", reason: " + reason : ""));
        disableAutoPing();
        destroyReconnectTimer(true);
        try {
            backend.disconnect(closeCode, reason);
        } catch (RuntimeException e) {
            log(LogLevel.ERROR, "Backend failed to disconnect: " + e.getMessage());
        }
    }

    private void doSend(WebSocketFrame frame) {
        if (!status.isConnected()) {
            log(LogLevel.WARNING, "Dropping " + frame + " frame, current status is " + status);
            return;
        }
        try {
            backend.write(frame);
        } catch (WebSocketClientException e) {
            log(LogLevel.ERROR, "Failed to send " + frame + " frame: " + e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log(LogLevel.ERROR, "Failed to send " + frame + " frame: " + e.getMessage());
            throw new WebSocketClientException("Failed to send " + frame + " frame", e);
        }
    }

    private void updateStatus(ConnectionStatus newStatus) {
        if (status.equals(newStatus)) {
            return;
        }
        status = newStatus;
        log(LogLevel.INFO, "Status changed to " + newStatus);
        if (newStatus.isConnected()) {
            enableAutoPing();
            destroyReconnectTimer(true);
        } else if (newStatus.isClosed()) {
            disableAutoPing();
            // 异常关闭保留重连次数，退避继续增长
            destroyReconnectTimer(newStatus.getClosureState().isNormal());
        }
        notifyListener(l -> l.onStatusChanged(this, newStatus));
    }

    private void handleEvent(WebSocketEvent event) {
        log(LogLevel.VERBOSE, "Received event: " + event.describe());
        switch (event.getType()) {
            case CONNECTED:
                updateStatus(ConnectionStatus.CONNECTED);
                break;
            case DISCONNECTED:
                updateStatus(closedStatus(ClosureState.from(event.getCloseCode())));
                break;
            case ERROR:
                updateStatus(closedStatus(ClosureState.ABNORMAL));
                break;
            default:
                break;
        }
        notifyListener(l -> l.onEvent(this, event));

        if (reconnectStrategy.shouldReconnectWhenReceivingEvent(event)) {
            reconnect(ReconnectReason.suggestedByEvent(event), false);
        } else {
            destroyReconnectTimer(true);
        }
    }

    /**
     * 用户主动断开后，无论后端如何上报都视为正常关闭
     */
    private ConnectionStatus closedStatus(ClosureState closureState) {
        return disconnectedByUser ? ConnectionStatus.NORMAL_CLOSED : ConnectionStatus.closed(closureState);
    }

    private void handleNetworkPath(NetworkPath path) {
        notifyListener(l -> l.onNetworkPathChanged(this, path));
        if (!path.isSatisfied()) {
            return;
        }
        if (path.isFirstUpdate()) {
            log(LogLevel.VERBOSE, "Ignoring first network path update: " + path);
            return;
        }
        if (!status.isAbnormalClosed() || disconnectedByUser) {
            return;
        }
        boolean immediate = reconnectStrategy.shouldReconnectImmediatelyWhenNetworkRecovered(path);
        log(LogLevel.INFO, "Network recovered, reconnecting" + (immediate ? " immediately" : ""));
        reconnect(ReconnectReason.networkRecovery(path), immediate);
    }

    private void reconnect(ReconnectReason reason, boolean immediate) {
        if (disconnectedByUser) {
            log(LogLevel.DEBUG, "Skip reconnect for " + reason + ", disconnected by user");
            return;
        }
        if (status.isConnecting()) {
            log(LogLevel.DEBUG, "Skip reconnect for " + reason + ", already connecting");
            return;
        }
        ReconnectMethod method = reconnectStrategy.reconnectMethod(reason, reconnectCount, networkWatcher.currentPath());
        if (method.isNone()) {
            log(LogLevel.INFO, "Won't reconnect for " + reason + ": " + method.getReason());
            return;
        }
        Duration delay = method.getInterval();
        if (delay.isZero() || delay.isNegative()) {
            log(LogLevel.DEBUG, "Skip reconnect for " + reason + ", no valid delay");
            return;
        }
        if (status.isConnected()) {
            doDisconnect(CloseCode.NORMAL_CLOSURE, null);
        }
        scheduleReconnectTimer(reason, immediate ? Duration.ZERO : delay);
    }

    private void scheduleReconnectTimer(ReconnectReason reason, Duration delay) {
        destroyReconnectTimer(false);
        log(LogLevel.INFO, "Will reconnect for " + reason + " in " + delay.toMillis() + "ms");
        notifyListener(l -> l.onWillReconnect(this, reason, delay));
        if (delay.isZero()) {
            executeReconnect(reason);
            return;
        }
        AsyncTimer timer = AsyncTimer.oneShot(executor, delay, () -> {
            reconnectTimer = null;
            executeReconnect(reason);
        });
        reconnectTimer = timer;
        timer.start();
    }

    private void executeReconnect(ReconnectReason reason) {
        if (!doConnect()) {
            return;
        }
        reconnectCount++;
        long attempt = reconnectCount;
        log(LogLevel.INFO, "Reconnect attempt " + attempt + " started for " + reason);
        notifyListener(l -> l.onDidReconnect(this, reason, attempt));
    }

    private void destroyReconnectTimer(boolean resetCount) {
        AsyncTimer timer = reconnectTimer;
        if (timer != null) {
            timer.stop();
            reconnectTimer = null;
        }
        if (resetCount) {
            reconnectCount = 0;
        }
    }

    private void enableAutoPing() {
        disableAutoPing();
        if (autoPingInterval.isZero()) {
            return;
        }
        if (!backend.supportsPingFrames()) {
            log(LogLevel.DEBUG, "Backend keeps the connection alive itself, auto ping timer not started");
            return;
        }
        AsyncTimer timer = AsyncTimer.repeating(executor, autoPingInterval, true, this::sendAutoPing);
        autoPingTimer = timer;
        timer.start();
    }

    private void disableAutoPing() {
        AsyncTimer timer = autoPingTimer;
        if (timer != null) {
            timer.stop();
            autoPingTimer = null;
        }
    }

    /**
     * 只有ping帧成功写入后才通知监听器
     */
    private void sendAutoPing() {
        if (!status.isConnected()) {
            return;
        }
        try {
            backend.write(WebSocketFrame.PING);
        } catch (RuntimeException e) {
            log(LogLevel.WARNING, "Auto ping failed: " + e.getMessage());
            return;
        }
        log(LogLevel.VERBOSE, "Auto ping sent");
        notifyListener(l -> l.onAutoPingSent(this));
    }

    private void pumpEvents() {
        logger.debug("[Client {}] Event pump started", clientId);
        while (!closed.get()) {
            WebSocketEvent event;
            try {
                event = backend.nextEvent();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (event == null) {
                break;
            }
            execute(() -> handleEvent(event));
        }
        logger.debug("[Client {}] Event pump stopped", clientId);
    }

    /**
     * 在串行线程上执行，客户端关闭后忽略
     */
    private void execute(Runnable task) {
        if (closed.get()) {
            return;
        }
        try {
            executor.execute(() -> {
                if (closed.get()) {
                    return;
                }
                try {
                    task.run();
                } catch (RuntimeException e) {
                    logger.error("[Client {}] Unexpected error on client thread", clientId, e);
                }
            });
        } catch (RejectedExecutionException e) {
            logger.debug("[Client {}] Task rejected, client is closing", clientId);
        }
    }

    private <T> CompletableFuture<T> submit(Supplier<T> task) {
        CompletableFuture<T> future = new CompletableFuture<>();
        if (closed.get()) {
            future.completeExceptionally(new WebSocketClientException("client closed"));
            return future;
        }
        try {
            executor.execute(() -> {
                if (closed.get()) {
                    future.completeExceptionally(new WebSocketClientException("client closed"));
                    return;
                }
                try {
                    future.complete(task.get());
                } catch (RuntimeException e) {
                    future.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            future.completeExceptionally(new WebSocketClientException("client closed", e));
        }
        return future;
    }

    private void awaitCleanup(Runnable cleanup) {
        Future<?> done;
        try {
            done = executor.submit(cleanup);
        } catch (RejectedExecutionException e) {
            return;
        }
        try {
            done.get(CLOSE_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            logger.warn("[Client {}] Failed to stop timers while closing", clientId, e);
        }
    }

    private void log(LogLevel level, String message) {
        switch (level) {
            case VERBOSE:
                logger.trace("[Client {}] {}", clientId, message);
                break;
            case DEBUG:
                logger.debug("[Client {}] {}", clientId, message);
                break;
            case INFO:
                logger.info("[Client {}] {}", clientId, message);
                break;
            case WARNING:
                logger.warn("[Client {}] {}", clientId, message);
                break;
            default:
                logger.error("[Client {}] {}", clientId, message);
                break;
        }
        ClientLog clientLog = new ClientLog(level, message);
        notifyListener(l -> l.onLog(this, clientLog));
    }

    private void notifyListener(Consumer<WebSocketClientListener> callback) {
        WebSocketClientListener current = listener;
        if (current == null) {
            return;
        }
        try {
            callback.accept(current);
        } catch (RuntimeException e) {
            logger.warn("[Client {}] Listener callback failed", clientId, e);
        }
    }
}
