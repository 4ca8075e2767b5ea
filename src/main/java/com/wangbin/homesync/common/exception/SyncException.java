package com.wangbin.homesync.common.exception;

import com.wangbin.homesync.common.domain.enums.SyncErrorType;
import lombok.Getter;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * 同步异常，按 {@link SyncErrorType} 分类。
 * <p>
 * 同步子系统内部不会把该异常抛给调用方，而是转换为诊断事件和状态迁移。
 */
@Getter
public class SyncException extends BusinessException {

    private final SyncErrorType errorType;
    private final String deviceId;

    public SyncException(SyncErrorType errorType, String message, String deviceId) {
        super(errorType.getCode(), message);
        this.errorType = errorType;
        this.deviceId = deviceId;
    }

    public SyncException(SyncErrorType errorType, String message, String deviceId, Throwable cause) {
        super(errorType.getCode(), message, cause);
        this.errorType = errorType;
        this.deviceId = deviceId;
    }

    // 创建传输异常
    public static SyncException transportError(String message, Throwable cause) {
        return new SyncException(SyncErrorType.TRANSPORT, message, null, cause);
    }

    // 创建协议异常
    public static SyncException protocolError(String message) {
        return new SyncException(SyncErrorType.PROTOCOL, message, null);
    }

    public static SyncException protocolError(String message, Throwable cause) {
        return new SyncException(SyncErrorType.PROTOCOL, message, null, cause);
    }

    // 创建拉取异常
    public static SyncException fetchError(String message, Throwable cause) {
        return new SyncException(SyncErrorType.FETCH, message, null, cause);
    }

    // 创建写入异常
    public static SyncException writeError(String message, String deviceId, Throwable cause) {
        return new SyncException(SyncErrorType.WRITE, message, deviceId, cause);
    }

    /**
     * 从异步链路中的异常解包出同步异常，非同步异常按给定类型包装
     */
    public static SyncException unwrap(Throwable throwable, SyncErrorType fallbackType, String deviceId) {
        Throwable cause = throwable;
        while ((cause instanceof CompletionException
                || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof SyncException syncException) {
            return syncException;
        }
        String message = cause != null && cause.getMessage() != null
                ? cause.getMessage()
                : (cause != null ? cause.getClass().getSimpleName() : fallbackType.getDescription());
        return new SyncException(fallbackType, message, deviceId, cause);
    }
}
