package com.binance.connector.ws.client.model;

import com.binance.connector.ws.client.enums.ClosureState;

/**
 * 连接状态
 * 取值只有三种：连接中、已连接、已关闭（附带关闭性质）
 */
public final class ConnectionStatus {
    public static final ConnectionStatus CONNECTING = new ConnectionStatus(Kind.CONNECTING, null);
    public static final ConnectionStatus CONNECTED = new ConnectionStatus(Kind.CONNECTED, null);
    public static final ConnectionStatus NORMAL_CLOSED = new ConnectionStatus(Kind.CLOSED, ClosureState.NORMAL);
    public static final ConnectionStatus ABNORMAL_CLOSED = new ConnectionStatus(Kind.CLOSED, ClosureState.ABNORMAL);

    public enum Kind {
        CONNECTING,
        CONNECTED,
        CLOSED
    }

    private final Kind kind;
    private final ClosureState closureState;

    private ConnectionStatus(Kind kind, ClosureState closureState) {
        this.kind = kind;
        this.closureState = closureState;
    }

    public static ConnectionStatus closed(ClosureState closureState) {
        return closureState.isNormal() ? NORMAL_CLOSED : ABNORMAL_CLOSED;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * 关闭性质，非关闭状态时为 null
     */
    public ClosureState getClosureState() {
        return closureState;
    }

    public boolean isConnecting() {
        return kind == Kind.CONNECTING;
    }

    public boolean isConnected() {
        return kind == Kind.CONNECTED;
    }

    public boolean isClosed() {
        return kind == Kind.CLOSED;
    }

    public boolean isNormalClosed() {
        return isClosed() && closureState.isNormal();
    }

    public boolean isAbnormalClosed() {
        return isClosed() && closureState.isAbnormal();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ConnectionStatus)) {
            return false;
        }
        ConnectionStatus other = (ConnectionStatus) o;
        return kind == other.kind && closureState == other.closureState;
    }

    @Override
    public int hashCode() {
        return 31 * kind.hashCode() + (closureState != null ? closureState.hashCode() : 0);
    }

    @Override
    public String toString() {
        switch (kind) {
            case CONNECTING:
                return "connecting";
            case CONNECTED:
                return "connected";
            default:
                return closureState.isNormal() ? "normalClosed" : "abnormalClosed";
        }
    }
}
