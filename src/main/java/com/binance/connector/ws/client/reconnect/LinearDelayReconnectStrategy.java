package com.binance.connector.ws.client.reconnect;

import java.time.Duration;

/**
 * 线性延迟：min(linearDelay * attemptCount, maxRetryInterval)
 * 注意第 0 次尝试的延迟为 0，客户端会因此跳过该次重连
 */
public class LinearDelayReconnectStrategy extends BaseReconnectStrategy {
    private final Duration linearDelay;
    private final Duration maxRetryInterval;

    public LinearDelayReconnectStrategy(Duration linearDelay) {
        this(linearDelay, UNLIMITED_RETRY_COUNT, DEFAULT_MAX_RETRY_INTERVAL);
    }

    public LinearDelayReconnectStrategy(Duration linearDelay, long maxRetryCount, Duration maxRetryInterval) {
        super(maxRetryCount);
        this.linearDelay = requireNonNegative(linearDelay, "linearDelay");
        this.maxRetryInterval = requireNonNegative(maxRetryInterval, "maxRetryInterval");
    }

    @Override
    protected Duration computeDelay(long attemptCount) {
        return ofSeconds(Math.min(toSeconds(linearDelay) * attemptCount, toSeconds(maxRetryInterval)));
    }

    public Duration getLinearDelay() {
        return linearDelay;
    }

    public Duration getMaxRetryInterval() {
        return maxRetryInterval;
    }
}
