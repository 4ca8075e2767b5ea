package com.wangbin.homesync.core.store;

import com.wangbin.homesync.common.domain.entity.DeviceEntity;
import com.wangbin.homesync.common.domain.entity.PendingWrite;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 设备副本的一致性快照，整体原子发布。
 *
 * @param version       单调递增的版本号，每次成功变更加一
 * @param devices       设备ID到设备实体，保持插入顺序，不可修改
 * @param pendingWrites 设备ID到待确认写入，不可修改
 */
public record StoreSnapshot(long version,
                            Map<String, DeviceEntity> devices,
                            Map<String, PendingWrite> pendingWrites) {

    public static final StoreSnapshot EMPTY = new StoreSnapshot(0L, Collections.emptyMap(), Collections.emptyMap());

    public Optional<DeviceEntity> getDevice(String deviceId) {
        return Optional.ofNullable(deviceId == null ? null : devices.get(deviceId));
    }

    public List<DeviceEntity> deviceList() {
        return Collections.unmodifiableList(new ArrayList<>(devices.values()));
    }

    public boolean hasPendingWrites() {
        return !pendingWrites.isEmpty();
    }

    public boolean isPending(String deviceId) {
        return deviceId != null && pendingWrites.containsKey(deviceId);
    }

    public int size() {
        return devices.size();
    }
}
