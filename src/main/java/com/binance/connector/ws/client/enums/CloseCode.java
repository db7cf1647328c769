package com.binance.connector.ws.client.enums;

/**
 * WebSocket关闭码
 * 参考 RFC 6455 7.4.1: https://datatracker.ietf.org/doc/html/rfc6455#section-7.4.1
 */
public enum CloseCode {
    INVALID(0),                       // 连接仍处于打开状态
    NORMAL_CLOSURE(1000),             // 正常关闭
    GOING_AWAY(1001),                 // 端点离开
    PROTOCOL_ERROR(1002),             // 协议错误
    UNSUPPORTED_DATA(1003),           // 收到无法处理的数据类型
    NO_STATUS_RECEIVED(1005),         // 保留码，未收到状态码
    ABNORMAL_CLOSURE(1006),           // 保留码，未收到关闭帧
    INVALID_FRAME_PAYLOAD_DATA(1007), // 数据与消息类型不一致
    POLICY_VIOLATION(1008),           // 违反策略
    MESSAGE_TOO_BIG(1009),            // 消息过大
    MANDATORY_EXTENSION_MISSING(1010),// 服务端未协商必需的扩展
    INTERNAL_SERVER_ERROR(1011),      // 服务端内部错误
    TLS_HANDSHAKE_FAILURE(1015);      // 保留码，TLS握手失败

    private final int code;

    CloseCode(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    /**
     * 是否属于异常关闭
     * 只有 1000、1001、1010 视为正常关闭，其余全部为异常关闭
     */
    public boolean isAbnormal() {
        switch (this) {
            case NORMAL_CLOSURE:
            case GOING_AWAY:
            case MANDATORY_EXTENSION_MISSING:
                return false;
            default:
                return true;
        }
    }

    /**
     * 根据数值查找关闭码，未知数值返回 {@link #INVALID}
     */
    public static CloseCode of(int code) {
        for (CloseCode closeCode : values()) {
            if (closeCode.code == code) {
                return closeCode;
            }
        }
        return INVALID;
    }
}
