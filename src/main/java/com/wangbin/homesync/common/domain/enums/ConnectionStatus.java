package com.wangbin.homesync.common.domain.enums;

import lombok.Getter;

/**
 * 推送通道连接状态枚举
 */
@Getter
public enum ConnectionStatus {

    DISCONNECTED("已断开"),
    CONNECTING("连接中"),
    CONNECTED("已连接"),
    RECONNECTING("等待重连"),
    FAILED("连续失败，长间隔重试");

    private final String description;

    ConnectionStatus(String description) {
        this.description = description;
    }

    // 判断是否已连接
    public boolean isConnected() {
        return this == CONNECTED;
    }

    // 判断是否处于连接建立或已连接阶段（此时connect()为空操作）
    public boolean isActive() {
        return this == CONNECTING || this == CONNECTED;
    }
}
