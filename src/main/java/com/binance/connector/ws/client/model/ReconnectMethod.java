package com.binance.connector.ws.client.model;

import java.time.Duration;
import java.util.Objects;

/**
 * 重连策略的决策结果：不重连（附原因）或延迟重连
 */
public final class ReconnectMethod {
    public static final ReconnectMethod NONE_FOR_UNSATISFIED_NETWORK = none("Network not satisfied");
    public static final ReconnectMethod NONE_FOR_MAX_RETRY_COUNT = none("Max retry count reached");

    private final String reason;
    private final Duration interval;

    private ReconnectMethod(String reason, Duration interval) {
        this.reason = reason;
        this.interval = interval;
    }

    public static ReconnectMethod none(String reason) {
        return new ReconnectMethod(reason != null ? reason : "", null);
    }

    /**
     * @param interval 重连延迟，不能为负数；为 0 时客户端不会安排重连
     */
    public static ReconnectMethod delay(Duration interval) {
        Objects.requireNonNull(interval, "interval");
        if (interval.isNegative()) {
            throw new IllegalArgumentException("Reconnect delay must not be negative: " + interval);
        }
        return new ReconnectMethod(null, interval);
    }

    public boolean isNone() {
        return interval == null;
    }

    public boolean isDelay() {
        return interval != null;
    }

    /**
     * 不重连的原因，延迟重连时为 null
     */
    public String getReason() {
        return reason;
    }

    /**
     * 重连延迟，不重连时为 null
     */
    public Duration getInterval() {
        return interval;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ReconnectMethod)) {
            return false;
        }
        ReconnectMethod other = (ReconnectMethod) o;
        return Objects.equals(reason, other.reason) && Objects.equals(interval, other.interval);
    }

    @Override
    public int hashCode() {
        return Objects.hash(reason, interval);
    }

    @Override
    public String toString() {
        return isNone() ? "none(" + reason + ")" : "delay(" + interval.toMillis() + "ms)";
    }
}
