package com.binance.connector.ws.client.reconnect;

import java.time.Duration;

/**
 * 固定延迟
 */
public class FixedDelayReconnectStrategy extends BaseReconnectStrategy {
    private final Duration fixedDelay;

    public FixedDelayReconnectStrategy(Duration fixedDelay) {
        this(fixedDelay, UNLIMITED_RETRY_COUNT);
    }

    public FixedDelayReconnectStrategy(Duration fixedDelay, long maxRetryCount) {
        super(maxRetryCount);
        this.fixedDelay = requireNonNegative(fixedDelay, "fixedDelay");
    }

    @Override
    protected Duration computeDelay(long attemptCount) {
        return fixedDelay;
    }

    public Duration getFixedDelay() {
        return fixedDelay;
    }
}
