package com.wangbin.homesync.core.diagnostic;

import com.wangbin.homesync.common.domain.enums.SyncErrorType;
import lombok.Getter;

/**
 * 诊断事件类型
 */
@Getter
public enum DiagnosticType {

    TRANSPORT_ERROR("传输错误", true),
    PROTOCOL_ERROR("协议错误", true),
    FETCH_ERROR("快照拉取失败", true),
    WRITE_ERROR("设备写入失败", true),
    UNKNOWN_MESSAGE("未知消息类型", false),
    CONNECTION_STATE("连接状态变化", false),
    POLL_SKIPPED("轮询跳过", false),
    PATCH_BUFFERED("未知设备增量已缓存", false),
    PATCH_DROPPED("未知设备增量已丢弃", false);

    private final String description;
    private final boolean error;

    DiagnosticType(String description, boolean error) {
        this.description = description;
        this.error = error;
    }

    public static DiagnosticType fromErrorType(SyncErrorType errorType) {
        if (errorType == null) {
            return TRANSPORT_ERROR;
        }
        return switch (errorType) {
            case TRANSPORT -> TRANSPORT_ERROR;
            case PROTOCOL -> PROTOCOL_ERROR;
            case FETCH -> FETCH_ERROR;
            case WRITE -> WRITE_ERROR;
        };
    }
}
