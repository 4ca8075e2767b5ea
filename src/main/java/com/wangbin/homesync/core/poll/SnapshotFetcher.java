package com.wangbin.homesync.core.poll;

import com.wangbin.homesync.common.domain.entity.DeviceEntity;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 全量设备快照来源
 */
public interface SnapshotFetcher {

    /**
     * 异步拉取全部设备，失败时以 {@link com.wangbin.homesync.common.exception.SyncException} 异常完成
     */
    CompletableFuture<List<DeviceEntity>> fetchAll();
}
