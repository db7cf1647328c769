package com.binance.connector.ws.client.support;

import com.binance.connector.ws.client.network.NetworkPath;
import com.binance.connector.ws.client.network.NetworkWatcher;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * 直接推送路径（含首次更新标记）的网络监视器，不做防抖
 */
public class StubNetworkWatcher implements NetworkWatcher {
    private final List<Consumer<NetworkPath>> listeners = new CopyOnWriteArrayList<>();
    private volatile NetworkPath currentPath = NetworkPath.satisfied();
    private volatile boolean active;
    private volatile int fireCount;
    private volatile int invalidateCount;

    @Override
    public boolean isActive() {
        return active;
    }

    @Override
    public NetworkPath currentPath() {
        return currentPath;
    }

    @Override
    public void fire() {
        active = true;
        fireCount++;
    }

    @Override
    public void invalidate() {
        active = false;
        invalidateCount++;
    }

    @Override
    public Subscription onPathChange(Consumer<NetworkPath> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public void push(NetworkPath path) {
        currentPath = path;
        for (Consumer<NetworkPath> listener : listeners) {
            listener.accept(path);
        }
    }

    public int listenerCount() {
        return listeners.size();
    }

    public int getFireCount() {
        return fireCount;
    }

    public int getInvalidateCount() {
        return invalidateCount;
    }
}
