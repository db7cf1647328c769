package com.binance.connector.ws.client.enums;

/**
 * 连接关闭的性质
 */
public enum ClosureState {
    NORMAL,     // 调用方或重连策略主动结束
    ABNORMAL;   // 后端错误、异常关闭码或传输被取消

    public boolean isNormal() {
        return this == NORMAL;
    }

    public boolean isAbnormal() {
        return this == ABNORMAL;
    }

    public static ClosureState from(CloseCode closeCode) {
        return closeCode.isAbnormal() ? ABNORMAL : NORMAL;
    }
}
