package com.binance.connector.ws.client.network;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * 网络路径快照
 * 由外部的系统网络监视器产生，本库只读取其可用性
 */
public final class NetworkPath {

    public enum Status {
        SATISFIED,
        UNSATISFIED,
        REQUIRES_CONNECTION
    }

    public enum InterfaceType {
        WIFI,
        CELLULAR,
        WIRED_ETHERNET,
        LOOPBACK,
        OTHER
    }

    private final Status status;
    private final Set<InterfaceType> interfaceTypes;
    private final boolean expensive;
    private final boolean constrained;
    private final boolean firstUpdate;

    private NetworkPath(Builder builder) {
        this.status = builder.status;
        this.interfaceTypes = builder.interfaceTypes.isEmpty()
            ? Collections.emptySet()
            : Collections.unmodifiableSet(EnumSet.copyOf(builder.interfaceTypes));
        this.expensive = builder.expensive;
        this.constrained = builder.constrained;
        this.firstUpdate = builder.firstUpdate;
    }

    public static NetworkPath satisfied() {
        return builder().status(Status.SATISFIED).build();
    }

    public static NetworkPath unsatisfied() {
        return builder().status(Status.UNSATISFIED).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .status(status)
            .interfaceTypes(interfaceTypes)
            .expensive(expensive)
            .constrained(constrained)
            .firstUpdate(firstUpdate);
    }

    /**
     * 返回仅修改了首次更新标记的副本
     */
    public NetworkPath withFirstUpdate(boolean firstUpdate) {
        if (this.firstUpdate == firstUpdate) {
            return this;
        }
        return toBuilder().firstUpdate(firstUpdate).build();
    }

    public Status getStatus() {
        return status;
    }

    public boolean isSatisfied() {
        return status == Status.SATISFIED;
    }

    public Set<InterfaceType> getInterfaceTypes() {
        return interfaceTypes;
    }

    public boolean usesInterfaceType(InterfaceType type) {
        return interfaceTypes.contains(type);
    }

    public boolean isExpensive() {
        return expensive;
    }

    public boolean isConstrained() {
        return constrained;
    }

    /**
     * 是否为开始监听后的第一次上报
     */
    public boolean isFirstUpdate() {
        return firstUpdate;
    }

    /**
     * 比较网络状况，忽略首次更新标记
     */
    public boolean sameConditionAs(NetworkPath other) {
        return other != null
            && status == other.status
            && interfaceTypes.equals(other.interfaceTypes)
            && expensive == other.expensive
            && constrained == other.constrained;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NetworkPath)) {
            return false;
        }
        NetworkPath other = (NetworkPath) o;
        return sameConditionAs(other) && firstUpdate == other.firstUpdate;
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, interfaceTypes, expensive, constrained, firstUpdate);
    }

    @Override
    public String toString() {
        return "NetworkPath{status=" + status
            + ", interfaces=" + interfaceTypes
            + ", expensive=" + expensive
            + ", constrained=" + constrained
            + ", firstUpdate=" + firstUpdate + '}';
    }

    public static final class Builder {
        private Status status = Status.SATISFIED;
        private Set<InterfaceType> interfaceTypes = EnumSet.noneOf(InterfaceType.class);
        private boolean expensive;
        private boolean constrained;
        private boolean firstUpdate;

        private Builder() {
        }

        public Builder status(Status status) {
            this.status = Objects.requireNonNull(status, "status");
            return this;
        }

        public Builder interfaceTypes(Set<InterfaceType> interfaceTypes) {
            this.interfaceTypes = interfaceTypes.isEmpty()
                ? EnumSet.noneOf(InterfaceType.class)
                : EnumSet.copyOf(interfaceTypes);
            return this;
        }

        public Builder addInterfaceType(InterfaceType interfaceType) {
            this.interfaceTypes.add(interfaceType);
            return this;
        }

        public Builder expensive(boolean expensive) {
            this.expensive = expensive;
            return this;
        }

        public Builder constrained(boolean constrained) {
            this.constrained = constrained;
            return this;
        }

        public Builder firstUpdate(boolean firstUpdate) {
            this.firstUpdate = firstUpdate;
            return this;
        }

        public NetworkPath build() {
            return new NetworkPath(this);
        }
    }
}
