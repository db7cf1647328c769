package com.binance.connector.ws.client.reconnect;

import com.binance.connector.ws.client.model.ReconnectMethod;
import com.binance.connector.ws.client.model.ReconnectReason;
import com.binance.connector.ws.client.network.NetworkPath;
import java.time.Duration;

/**
 * 延迟类策略的公共部分：网络不可用或重试次数耗尽时不再重连
 */
public abstract class BaseReconnectStrategy implements ReconnectStrategy {
    public static final long UNLIMITED_RETRY_COUNT = Long.MAX_VALUE;
    public static final Duration DEFAULT_MAX_RETRY_INTERVAL = Duration.ofMinutes(10);

    private final long maxRetryCount;

    protected BaseReconnectStrategy(long maxRetryCount) {
        if (maxRetryCount < 0) {
            throw new IllegalArgumentException("maxRetryCount must be greater than or equal to 0");
        }
        this.maxRetryCount = maxRetryCount;
    }

    @Override
    public final ReconnectMethod reconnectMethod(ReconnectReason reason, long attemptCount, NetworkPath networkPath) {
        if (!networkPath.isSatisfied()) {
            return ReconnectMethod.NONE_FOR_UNSATISFIED_NETWORK;
        }
        if (attemptCount >= maxRetryCount) {
            return ReconnectMethod.NONE_FOR_MAX_RETRY_COUNT;
        }
        return ReconnectMethod.delay(computeDelay(attemptCount));
    }

    /**
     * 计算第 attemptCount 次重连的延迟，返回值不能为负
     */
    protected abstract Duration computeDelay(long attemptCount);

    public long getMaxRetryCount() {
        return maxRetryCount;
    }

    static Duration requireNonNegative(Duration value, String name) {
        if (value == null || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be greater than or equal to 0");
        }
        return value;
    }

    static Duration ofSeconds(double seconds) {
        if (seconds <= 0) {
            return Duration.ZERO;
        }
        return Duration.ofNanos(Math.round(seconds * 1_000_000_000L));
    }

    static double toSeconds(Duration duration) {
        return duration.toNanos() / 1_000_000_000.0;
    }
}
