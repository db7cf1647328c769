package com.binance.connector.ws.client.network;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * 由宿主程序主动推送路径的数据源，初始路径为可用
 */
public class ManualNetworkPathSource implements NetworkPathSource {
    private final Object mutex = new Object();
    private NetworkPath path;
    private Consumer<NetworkPath> sink;

    public ManualNetworkPathSource() {
        this(NetworkPath.satisfied());
    }

    public ManualNetworkPathSource(NetworkPath initialPath) {
        this.path = Objects.requireNonNull(initialPath, "initialPath").withFirstUpdate(false);
    }

    /**
     * 推送新的网络路径
     */
    public void post(NetworkPath newPath) {
        Consumer<NetworkPath> target;
        synchronized (mutex) {
            path = Objects.requireNonNull(newPath, "newPath").withFirstUpdate(false);
            target = sink;
        }
        if (target != null) {
            target.accept(newPath.withFirstUpdate(false));
        }
    }

    @Override
    public NetworkPath currentPath() {
        synchronized (mutex) {
            return path;
        }
    }

    @Override
    public void start(Consumer<NetworkPath> sink) {
        NetworkPath initial;
        synchronized (mutex) {
            this.sink = Objects.requireNonNull(sink, "sink");
            initial = path;
        }
        sink.accept(initial);
    }

    @Override
    public void stop() {
        synchronized (mutex) {
            sink = null;
        }
    }
}
