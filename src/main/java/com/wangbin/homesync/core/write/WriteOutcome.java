package com.wangbin.homesync.core.write;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一次属性修改请求的最终结果
 *
 * @param deviceId   设备ID
 * @param success    远端是否确认
 * @param properties 实际发送的属性（可能包含同一设备合并进来的其他修改）
 * @param error      失败原因，成功时为 null
 */
public record WriteOutcome(String deviceId, boolean success, Map<String, Object> properties, String error) {

    public WriteOutcome {
        properties = properties == null || properties.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public static WriteOutcome success(String deviceId, Map<String, Object> properties) {
        return new WriteOutcome(deviceId, true, properties, null);
    }

    public static WriteOutcome failure(String deviceId, Map<String, Object> properties, String error) {
        return new WriteOutcome(deviceId, false, properties, error);
    }
}
