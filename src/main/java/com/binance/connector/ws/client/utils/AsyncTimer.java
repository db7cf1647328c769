package com.binance.connector.ws.client.utils;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 可取消、可重启的定时器，支持单次与重复两种模式
 *
 * 每次启动对应一个独立的取消令牌，处理器执行前会再次检查令牌，
 * 因此 stop() 返回后该次启动不会再调用处理器。
 * 若在调度线程上调用 stop()（单线程调度器），已经排队的触发同样会被抑制。
 */
public final class AsyncTimer {
    private static final Logger logger = LoggerFactory.getLogger(AsyncTimer.class);

    private final ScheduledExecutorService scheduler;
    private final boolean repeating;
    private final boolean firesImmediately;
    private final Runnable handler;
    private final Runnable cancelHandler;
    private final Object mutex = new Object();

    private volatile Duration interval;
    private Run currentRun;

    /**
     * @param scheduler 执行处理器的调度器，由调用方持有
     * @param interval 触发间隔；重复模式下必须大于0
     * @param repeating 是否重复触发
     * @param firesImmediately 重复模式下启动时是否立即触发一次
     * @param handler 触发时执行的任务
     * @param cancelHandler 被取消时执行的任务（可能为null），每次启动最多执行一次
     */
    public AsyncTimer(ScheduledExecutorService scheduler,
                      Duration interval,
                      boolean repeating,
                      boolean firesImmediately,
                      Runnable handler,
                      Runnable cancelHandler) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.repeating = repeating;
        this.firesImmediately = firesImmediately;
        this.handler = Objects.requireNonNull(handler, "handler");
        this.cancelHandler = cancelHandler;
        this.interval = validateInterval(interval);
    }

    public static AsyncTimer oneShot(ScheduledExecutorService scheduler, Duration interval, Runnable handler) {
        return new AsyncTimer(scheduler, interval, false, false, handler, null);
    }

    public static AsyncTimer repeating(ScheduledExecutorService scheduler, Duration interval,
                                       boolean firesImmediately, Runnable handler) {
        return new AsyncTimer(scheduler, interval, true, firesImmediately, handler, null);
    }

    /**
     * 启动定时器，已在运行时先取消旧的一次
     */
    public void start() {
        synchronized (mutex) {
            stopLocked();
            Run run = new Run();
            currentRun = run;
            long intervalNanos = interval.toNanos();
            if (repeating) {
                long initialDelay = firesImmediately ? 0 : intervalNanos;
                run.future = scheduler.scheduleAtFixedRate(() -> fire(run), initialDelay, intervalNanos, TimeUnit.NANOSECONDS);
            } else {
                run.future = scheduler.schedule(() -> fire(run), intervalNanos, TimeUnit.NANOSECONDS);
            }
        }
    }

    /**
     * 停止定时器，空闲时调用无副作用
     */
    public void stop() {
        Run cancelled;
        synchronized (mutex) {
            cancelled = stopLocked();
        }
        if (cancelled != null && cancelHandler != null) {
            try {
                cancelHandler.run();
            } catch (RuntimeException e) {
                logger.warn("Timer cancel handler failed", e);
            }
        }
    }

    public void restart() {
        stop();
        start();
    }

    /**
     * 调整间隔并重启
     */
    public void setInterval(Duration newInterval) {
        this.interval = validateInterval(newInterval);
        restart();
    }

    public Duration getInterval() {
        return interval;
    }

    public boolean isRepeating() {
        return repeating;
    }

    /**
     * 是否有尚未完成的启动
     */
    public boolean isActive() {
        synchronized (mutex) {
            return currentRun != null && !currentRun.finished.get();
        }
    }

    /**
     * @return 被取消且尚未完成的那次启动，没有则返回null
     */
    private Run stopLocked() {
        Run run = currentRun;
        currentRun = null;
        if (run == null) {
            return null;
        }
        run.cancelled.set(true);
        if (run.future != null) {
            run.future.cancel(false);
        }
        // 单次定时器正常完成后不再触发取消回调
        return run.finished.get() ? null : run;
    }

    private void fire(Run run) {
        if (run.cancelled.get()) {
            return;
        }
        if (!repeating) {
            run.finished.set(true);
        }
        try {
            handler.run();
        } catch (RuntimeException e) {
            logger.error("Timer handler failed", e);
        }
    }

    private Duration validateInterval(Duration value) {
        Objects.requireNonNull(value, "interval");
        if (value.isNegative()) {
            throw new IllegalArgumentException("Timer interval must not be negative: " + value);
        }
        if (repeating && value.isZero()) {
            throw new IllegalArgumentException("Repeating timer interval must be greater than 0");
        }
        return value;
    }

    private static final class Run {
        private final AtomicBoolean cancelled = new AtomicBoolean(false);
        private final AtomicBoolean finished = new AtomicBoolean(false);
        private volatile ScheduledFuture<?> future;
    }
}
