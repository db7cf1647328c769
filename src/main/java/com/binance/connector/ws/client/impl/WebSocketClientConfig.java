package com.binance.connector.ws.client.impl;

import com.binance.connector.ws.client.WebSocketClientListener;
import com.binance.connector.ws.client.backend.OkHttpWebSocketBackend;
import com.binance.connector.ws.client.backend.WebSocketBackend;
import com.binance.connector.ws.client.network.ManualNetworkPathSource;
import com.binance.connector.ws.client.network.NetworkPathSource;
import com.binance.connector.ws.client.network.NetworkWatcher;
import com.binance.connector.ws.client.reconnect.ReconnectStrategies;
import com.binance.connector.ws.client.reconnect.ReconnectStrategy;
import com.binance.connector.ws.client.utils.HttpClientSingleton;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import okhttp3.Request;

/**
 * 客户端配置，创建后不可变
 */
public final class WebSocketClientConfig {
    private final Request request;
    private final Duration autoPingInterval;
    private final WebSocketBackend backend;
    private final ReconnectStrategy reconnectStrategy;
    private final Duration networkMonitorDebounceInterval;
    private final NetworkPathSource networkPathSource;
    private final NetworkWatcher networkWatcher;
    private final WebSocketClientListener listener;

    private WebSocketClientConfig(Builder builder, WebSocketBackend backend, NetworkPathSource networkPathSource) {
        this.request = builder.request;
        this.autoPingInterval = builder.autoPingInterval;
        this.backend = backend;
        this.reconnectStrategy = builder.reconnectStrategy;
        this.networkMonitorDebounceInterval = builder.networkMonitorDebounceInterval;
        this.networkPathSource = networkPathSource;
        this.networkWatcher = builder.networkWatcher;
        this.listener = builder.listener;
    }

    /**
     * 连接使用的请求
     */
    public Request getRequest() {
        return request;
    }

    /**
     * 自动ping间隔，0 表示关闭
     */
    public Duration getAutoPingInterval() {
        return autoPingInterval;
    }

    public WebSocketBackend getBackend() {
        return backend;
    }

    public ReconnectStrategy getReconnectStrategy() {
        return reconnectStrategy;
    }

    /**
     * 网络监听的防抖间隔，0 表示不防抖
     */
    public Duration getNetworkMonitorDebounceInterval() {
        return networkMonitorDebounceInterval;
    }

    public NetworkPathSource getNetworkPathSource() {
        return networkPathSource;
    }

    /**
     * 外部提供的网络监视器，未提供时为 null，客户端会基于数据源自行创建
     */
    public NetworkWatcher getNetworkWatcher() {
        return networkWatcher;
    }

    public WebSocketClientListener getListener() {
        return listener;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Request request;
        private Duration autoPingInterval = Duration.ZERO;
        private WebSocketBackend backend;
        private ReconnectStrategy reconnectStrategy = ReconnectStrategies.defaultStrategy();
        private Duration networkMonitorDebounceInterval = Duration.ZERO;
        private NetworkPathSource networkPathSource;
        private NetworkWatcher networkWatcher;
        private WebSocketClientListener listener;
        private Duration connectTimeout;

        private Builder() {
        }

        public Builder request(Request request) {
            this.request = request;
            return this;
        }

        /**
         * 通过地址与请求头构建请求；未指定后端时使用该连接超时创建OkHttp后端
         * 连接超时只作用于默认后端，与 backend(...) 同时设置时 build() 会失败
         *
         * @param url ws/wss 地址
         * @param httpHeaders 请求头
         * @param connectTimeout 连接超时，必须大于0
         */
        public Builder url(String url, Map<String, String> httpHeaders, Duration connectTimeout) {
            if (connectTimeout == null || connectTimeout.isNegative() || connectTimeout.isZero()) {
                throw new IllegalArgumentException("connectTimeout must be greater than 0");
            }
            Request.Builder requestBuilder = new Request.Builder().url(url);
            if (httpHeaders != null) {
                for (Map.Entry<String, String> header : httpHeaders.entrySet()) {
                    requestBuilder.header(header.getKey(), header.getValue());
                }
            }
            this.request = requestBuilder.build();
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder autoPingInterval(Duration autoPingInterval) {
            this.autoPingInterval = autoPingInterval;
            return this;
        }

        public Builder backend(WebSocketBackend backend) {
            this.backend = backend;
            return this;
        }

        public Builder reconnectStrategy(ReconnectStrategy reconnectStrategy) {
            this.reconnectStrategy = reconnectStrategy;
            return this;
        }

        public Builder networkMonitorDebounceInterval(Duration networkMonitorDebounceInterval) {
            this.networkMonitorDebounceInterval = networkMonitorDebounceInterval;
            return this;
        }

        public Builder networkPathSource(NetworkPathSource networkPathSource) {
            this.networkPathSource = networkPathSource;
            return this;
        }

        public Builder networkWatcher(NetworkWatcher networkWatcher) {
            this.networkWatcher = networkWatcher;
            return this;
        }

        public Builder listener(WebSocketClientListener listener) {
            this.listener = listener;
            return this;
        }

        /**
         * 每次调用都会创建新的默认后端与网络数据源，同一个Builder构建的多个配置互不共享
         *
         * @throws IllegalArgumentException 间隔为负数，或同时指定了后端与连接超时
         * @throws NullPointerException 缺少请求或重连策略
         */
        public WebSocketClientConfig build() {
            Objects.requireNonNull(request, "request");
            Objects.requireNonNull(reconnectStrategy, "reconnectStrategy");
            requireNonNegative(autoPingInterval, "autoPingInterval");
            requireNonNegative(networkMonitorDebounceInterval, "networkMonitorDebounceInterval");
            if (backend != null && connectTimeout != null) {
                throw new IllegalArgumentException("connectTimeout only applies to the default backend");
            }
            WebSocketBackend builtBackend = backend != null ? backend : createDefaultBackend();
            NetworkPathSource builtSource = networkPathSource != null ? networkPathSource : new ManualNetworkPathSource();
            return new WebSocketClientConfig(this, builtBackend, builtSource);
        }

        /**
         * OkHttp 无法写出ping帧，自动ping间隔交给它的协议层ping
         */
        private WebSocketBackend createDefaultBackend() {
            Duration timeout = connectTimeout != null ? connectTimeout : HttpClientSingleton.DEFAULT_CONNECT_TIMEOUT;
            Duration pingInterval = autoPingInterval.isZero() ? HttpClientSingleton.DEFAULT_PING_INTERVAL : autoPingInterval;
            return OkHttpWebSocketBackend.withDedicatedClient(HttpClientSingleton.createDedicatedWebSocketClient(
                timeout, pingInterval, null, null));
        }

        private static void requireNonNegative(Duration value, String name) {
            if (value == null || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be greater than or equal to 0");
            }
        }
    }
}
