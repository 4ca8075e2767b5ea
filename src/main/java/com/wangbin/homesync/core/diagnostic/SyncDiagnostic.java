package com.wangbin.homesync.core.diagnostic;

import com.wangbin.homesync.common.exception.SyncException;

/**
 * 诊断事件
 *
 * @param type      事件类型
 * @param source    产生事件的组件
 * @param deviceId  关联设备，可为空
 * @param message   描述
 * @param timestamp 毫秒时间戳
 */
public record SyncDiagnostic(DiagnosticType type,
                             String source,
                             String deviceId,
                             String message,
                             long timestamp) {

    public static SyncDiagnostic of(DiagnosticType type, String source, String deviceId, String message) {
        return new SyncDiagnostic(type, source, deviceId, message, System.currentTimeMillis());
    }

    public static SyncDiagnostic fromException(String source, SyncException exception) {
        return of(DiagnosticType.fromErrorType(exception.getErrorType()),
                source,
                exception.getDeviceId(),
                exception.getMessage());
    }

    public boolean isError() {
        return type.isError();
    }
}
