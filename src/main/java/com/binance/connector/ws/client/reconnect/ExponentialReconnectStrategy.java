package com.binance.connector.ws.client.reconnect;

import java.time.Duration;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 指数退避
 * delay = min(base^attemptCount * scale, maxRetryInterval)，再叠加 ±delay*delayJitter 的均匀随机抖动
 */
public class ExponentialReconnectStrategy extends BaseReconnectStrategy {
    public static final int DEFAULT_BASE = 2;
    public static final Duration DEFAULT_SCALE = Duration.ofMillis(500);
    public static final double DEFAULT_DELAY_JITTER = 0.2;

    private final int exponentialBackoffBase;
    private final Duration exponentialBackoffScale;
    private final Duration maxRetryInterval;
    private final double delayJitter;
    private final Random random;

    /**
     * 默认参数：底数2，系数0.5秒，不限次数，最大间隔10分钟，抖动0.2
     */
    public ExponentialReconnectStrategy() {
        this(DEFAULT_BASE, DEFAULT_SCALE, UNLIMITED_RETRY_COUNT, DEFAULT_MAX_RETRY_INTERVAL, DEFAULT_DELAY_JITTER);
    }

    public ExponentialReconnectStrategy(int exponentialBackoffBase,
                                        Duration exponentialBackoffScale,
                                        long maxRetryCount,
                                        Duration maxRetryInterval,
                                        double delayJitter) {
        this(exponentialBackoffBase, exponentialBackoffScale, maxRetryCount, maxRetryInterval, delayJitter, null);
    }

    /**
     * @param random 抖动使用的随机源，为 null 时使用 {@link ThreadLocalRandom}
     */
    public ExponentialReconnectStrategy(int exponentialBackoffBase,
                                        Duration exponentialBackoffScale,
                                        long maxRetryCount,
                                        Duration maxRetryInterval,
                                        double delayJitter,
                                        Random random) {
        super(maxRetryCount);
        if (exponentialBackoffBase < 1) {
            throw new IllegalArgumentException("exponentialBackoffBase must be greater than or equal to 1");
        }
        if (delayJitter < 0 || delayJitter > 1) {
            throw new IllegalArgumentException("delayJitter must be between 0 and 1");
        }
        this.exponentialBackoffBase = exponentialBackoffBase;
        this.exponentialBackoffScale = requireNonNegative(exponentialBackoffScale, "exponentialBackoffScale");
        this.maxRetryInterval = requireNonNegative(maxRetryInterval, "maxRetryInterval");
        this.delayJitter = delayJitter;
        this.random = random;
    }

    @Override
    protected Duration computeDelay(long attemptCount) {
        double interval = Math.pow(exponentialBackoffBase, attemptCount) * toSeconds(exponentialBackoffScale);
        double delay = Math.min(interval, toSeconds(maxRetryInterval));
        double jitterRange = delay * delayJitter;
        double randomJitter = jitterRange > 0 ? (nextDouble() * 2 - 1) * jitterRange : 0;
        return ofSeconds(delay + randomJitter);
    }

    private double nextDouble() {
        return random != null ? random.nextDouble() : ThreadLocalRandom.current().nextDouble();
    }

    public int getExponentialBackoffBase() {
        return exponentialBackoffBase;
    }

    public Duration getExponentialBackoffScale() {
        return exponentialBackoffScale;
    }

    public Duration getMaxRetryInterval() {
        return maxRetryInterval;
    }

    public double getDelayJitter() {
        return delayJitter;
    }
}
