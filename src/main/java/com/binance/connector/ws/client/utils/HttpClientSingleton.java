package com.binance.connector.ws.client.utils;

import java.net.Proxy;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import okhttp3.Authenticator;
import okhttp3.ConnectionPool;
import okhttp3.Dispatcher;
import okhttp3.OkHttpClient;

public final class HttpClientSingleton {
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_PING_INTERVAL = Duration.ofSeconds(30);

    private static OkHttpClient httpClient = null;

    private HttpClientSingleton() {
    }

    /**
     * 获取全局共享HTTP客户端
     */
    public static synchronized OkHttpClient getHttpClient() {
        if (httpClient == null) {
            httpClient = new OkHttpClient();
        }
        return httpClient;
    }

    /**
     * 为WebSocket后端创建独立的OkHttpClient实例
     */
    public static OkHttpClient createDedicatedWebSocketClient() {
        return createDedicatedWebSocketClient(DEFAULT_CONNECT_TIMEOUT, DEFAULT_PING_INTERVAL, null, null);
    }

    /**
     * 为WebSocket后端创建独立的OkHttpClient实例
     * 每个实例拥有独立的调度器与连接池，关闭时不会影响其他后端
     *
     * @param connectTimeout 连接超时，必须大于0
     * @param pingInterval 协议层心跳间隔，0 表示关闭
     * @param proxy 代理（可能为null）
     * @param proxyAuthenticator 代理认证（可能为null）
     */
    public static OkHttpClient createDedicatedWebSocketClient(Duration connectTimeout,
                                                              Duration pingInterval,
                                                              Proxy proxy,
                                                              Authenticator proxyAuthenticator) {
        if (connectTimeout == null || connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be greater than 0");
        }
        if (pingInterval == null || pingInterval.isNegative()) {
            throw new IllegalArgumentException("pingInterval must be greater than or equal to 0");
        }
        OkHttpClient.Builder builder = getHttpClient().newBuilder()
            // 独立的调度器和连接池
            .dispatcher(new Dispatcher())
            .connectionPool(new ConnectionPool())
            .connectTimeout(connectTimeout.toMillis(), TimeUnit.MILLISECONDS)
            .readTimeout(0, TimeUnit.MILLISECONDS)    // WebSocket需要无限读取超时
            .writeTimeout(0, TimeUnit.MILLISECONDS)   // WebSocket需要无限写入超时
            .pingInterval(pingInterval.toMillis(), TimeUnit.MILLISECONDS);

        if (proxy != null) {
            builder.proxy(proxy);
            if (proxyAuthenticator != null) {
                builder.proxyAuthenticator(proxyAuthenticator);
            }
        }

        return builder.build();
    }

    /**
     * 安全关闭OkHttpClient实例及其相关资源
     */
    public static void shutdownClient(OkHttpClient client) {
        if (client != null) {
            // 关闭调度器和线程池
            client.dispatcher().executorService().shutdown();

            // 清理连接池
            client.connectionPool().evictAll();

            // 等待线程池关闭
            try {
                if (!client.dispatcher().executorService().awaitTermination(5, TimeUnit.SECONDS)) {
                    client.dispatcher().executorService().shutdownNow();
                }
            } catch (InterruptedException e) {
                client.dispatcher().executorService().shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }
}
