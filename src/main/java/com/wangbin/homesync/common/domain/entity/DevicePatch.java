package com.wangbin.homesync.common.domain.entity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 单个设备的增量属性更新。
 * <p>
 * 值为 null 的键表示删除该属性；未出现的键表示不变。
 *
 * @param deviceId  设备ID
 * @param diff      增量属性，允许 null 值
 * @param timestamp 来源时间戳（推送帧中的 ISO8601 字符串），可为空
 */
public record DevicePatch(String deviceId, Map<String, Object> diff, String timestamp) {

    public DevicePatch {
        if (deviceId == null || deviceId.isBlank()) {
            throw new IllegalArgumentException("设备ID不能为空");
        }
        // Map.copyOf 不允许 null 值
        diff = diff == null || diff.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(diff));
    }

    public static DevicePatch of(String deviceId, Map<String, Object> diff) {
        return new DevicePatch(deviceId, diff, null);
    }

    public boolean isEmpty() {
        return diff.isEmpty();
    }

    /**
     * 与之后到达的增量合并，后者按键覆盖（包括 null 删除标记）
     */
    public DevicePatch mergeWith(DevicePatch later) {
        if (later == null || !deviceId.equals(later.deviceId())) {
            return this;
        }
        Map<String, Object> merged = new LinkedHashMap<>(diff);
        merged.putAll(later.diff());
        return new DevicePatch(deviceId, merged, later.timestamp() != null ? later.timestamp() : timestamp);
    }
}
