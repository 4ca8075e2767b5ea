package com.wangbin.homesync.core.sync;

import com.wangbin.homesync.common.domain.enums.ConnectionStatus;
import lombok.Getter;

/**
 * 同步模式，由会话是否运行、推送通道状态和是否存在待确认写入共同决定
 */
@Getter
public enum SyncMode {

    STOPPED("会话未运行"),
    POLL_FALLBACK("推送未连接，依靠轮询"),
    PUSH_PRIMARY("推送已连接，轮询降频"),
    WRITE_GATED("存在待确认写入，暂停定时轮询");

    private final String description;

    SyncMode(String description) {
        this.description = description;
    }

    public static SyncMode resolve(boolean running, ConnectionStatus status, boolean pendingWrites) {
        if (!running) {
            return STOPPED;
        }
        if (pendingWrites) {
            return WRITE_GATED;
        }
        return status != null && status.isConnected() ? PUSH_PRIMARY : POLL_FALLBACK;
    }
}
