package com.wangbin.homesync.common.domain.entity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 等待远端确认的乐观写入。
 *
 * @param deviceId   设备ID
 * @param properties 已合并、等待确认的属性
 * @param deadline   防抖截止时间（毫秒时间戳），立即发送的写入为创建时间
 * @param inFlight   是否已有请求发出且未返回
 */
public record PendingWrite(String deviceId, Map<String, Object> properties, long deadline, boolean inFlight) {

    public PendingWrite {
        if (deviceId == null || deviceId.isBlank()) {
            throw new IllegalArgumentException("设备ID不能为空");
        }
        properties = properties == null || properties.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }
}
