package com.wangbin.homesync.core.codec;

import lombok.Getter;

/**
 * 推送帧类型（帧中的 type 字段）
 */
@Getter
public enum MessageType {

    DEVICE_UPDATE("device_update", "设备状态增量"),
    PING("ping", "服务端心跳"),
    PONG("pong", "心跳应答");

    private final String code;
    private final String description;

    MessageType(String code, String description) {
        this.code = code;
        this.description = description;
    }

    /**
     * 未知类型返回 null
     */
    public static MessageType fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (MessageType type : values()) {
            if (type.code.equals(code)) {
                return type;
            }
        }
        return null;
    }
}
