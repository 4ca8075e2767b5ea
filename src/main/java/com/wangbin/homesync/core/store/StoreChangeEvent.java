package com.wangbin.homesync.core.store;

import java.util.Set;

/**
 * 副本变更通知
 *
 * @param type      变更类型
 * @param deviceIds 受影响的设备ID（快照替换时包含新增、删除和变化的设备）
 * @param snapshot  变更后发布的快照
 */
public record StoreChangeEvent(ChangeType type, Set<String> deviceIds, StoreSnapshot snapshot) {

    public StoreChangeEvent {
        deviceIds = deviceIds == null ? Set.of() : Set.copyOf(deviceIds);
    }
}
