package com.binance.connector.ws.client.network;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 带防抖的网络路径监视器
 *
 * 防抖窗口内的连续变化只上报最后一次的稳定值；防抖间隔为0时直接上报。
 * 每次 fire() 之后的第一次上报带有 firstUpdate 标记。
 */
public class NetworkPathMonitor implements NetworkWatcher, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(NetworkPathMonitor.class);
    private static final AtomicInteger monitorCounter = new AtomicInteger(0);

    private final int monitorId;
    private final NetworkPathSource source;
    private final Duration debounceInterval;
    private final List<Consumer<NetworkPath>> listeners = new CopyOnWriteArrayList<>();
    private final Object mutex = new Object();

    private ScheduledExecutorService debounceScheduler;
    private ScheduledFuture<?> pendingUpdate;
    private volatile NetworkPath currentPath;
    private volatile boolean active;
    private boolean firstUpdatePending;
    private long updateSequence;

    public NetworkPathMonitor(NetworkPathSource source) {
        this(source, Duration.ZERO);
    }

    /**
     * @param source 原始路径数据源
     * @param debounceInterval 防抖间隔，0 表示不防抖
     */
    public NetworkPathMonitor(NetworkPathSource source, Duration debounceInterval) {
        Objects.requireNonNull(debounceInterval, "debounceInterval");
        if (debounceInterval.isNegative()) {
            throw new IllegalArgumentException("debounceInterval must be greater than or equal to 0");
        }
        this.monitorId = monitorCounter.incrementAndGet();
        this.source = Objects.requireNonNull(source, "source");
        this.debounceInterval = debounceInterval;
        this.currentPath = source.currentPath();
    }

    @Override
    public boolean isActive() {
        return active;
    }

    @Override
    public NetworkPath currentPath() {
        return currentPath;
    }

    public Duration getDebounceInterval() {
        return debounceInterval;
    }

    @Override
    public void fire() {
        synchronized (mutex) {
            if (active) {
                return;
            }
            active = true;
            firstUpdatePending = true;
        }
        logger.debug("[Monitor {}] Start monitoring network path, debounce {}ms", monitorId, debounceInterval.toMillis());
        source.start(this::onRawPath);
    }

    @Override
    public void invalidate() {
        synchronized (mutex) {
            if (!active) {
                return;
            }
            active = false;
            cancelPendingUpdate();
        }
        source.stop();
        logger.debug("[Monitor {}] Stop monitoring network path", monitorId);
    }

    @Override
    public Subscription onPathChange(Consumer<NetworkPath> listener) {
        Objects.requireNonNull(listener, "listener");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /**
     * 停止监听并释放防抖线程
     */
    @Override
    public void close() {
        invalidate();
        synchronized (mutex) {
            if (debounceScheduler != null) {
                debounceScheduler.shutdownNow();
                debounceScheduler = null;
            }
        }
    }

    private void onRawPath(NetworkPath path) {
        if (path == null) {
            return;
        }
        synchronized (mutex) {
            if (!active) {
                return;
            }
            if (!debounceInterval.isZero()) {
                cancelPendingUpdate();
                long sequence = ++updateSequence;
                pendingUpdate = scheduler().schedule(() -> emit(path, sequence),
                    debounceInterval.toNanos(), TimeUnit.NANOSECONDS);
                return;
            }
        }
        emit(path, -1);
    }

    /**
     * @param sequence 防抖序号，-1 表示未经防抖
     */
    private void emit(NetworkPath rawPath, long sequence) {
        NetworkPath path;
        synchronized (mutex) {
            if (!active) {
                return;
            }
            if (sequence != -1 && sequence != updateSequence) {
                // 已被更新的变化取代
                return;
            }
            path = rawPath.withFirstUpdate(firstUpdatePending);
            firstUpdatePending = false;
            currentPath = path;
            pendingUpdate = null;
        }
        logger.trace("[Monitor {}] Network path updated: {}", monitorId, path);
        for (Consumer<NetworkPath> listener : listeners) {
            try {
                listener.accept(path);
            } catch (RuntimeException e) {
                logger.warn("[Monitor {}] Network path listener failed", monitorId, e);
            }
        }
    }

    private void cancelPendingUpdate() {
        if (pendingUpdate != null) {
            pendingUpdate.cancel(false);
            pendingUpdate = null;
        }
    }

    private ScheduledExecutorService scheduler() {
        if (debounceScheduler == null) {
            debounceScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "network-path-monitor-" + monitorId);
                t.setDaemon(true);
                return t;
            });
        }
        return debounceScheduler;
    }
}
