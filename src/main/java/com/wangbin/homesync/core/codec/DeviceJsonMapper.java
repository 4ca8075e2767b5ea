package com.wangbin.homesync.core.codec;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.wangbin.homesync.common.domain.entity.DeviceEntity;
import com.wangbin.homesync.common.exception.SyncException;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 网关设备列表 JSON 与 {@link DeviceEntity} 的映射
 */
@Slf4j
public class DeviceJsonMapper {

    /**
     * 解析 list_devices 响应体。空响应或字面量 null 视为空列表，
     * 缺少 friendly_name 的条目跳过。
     *
     * @throws SyncException 响应体不是 JSON 数组
     */
    public List<DeviceEntity> parseDeviceList(String body) {
        if (body == null || body.isBlank() || "null".equals(body.trim())) {
            return Collections.emptyList();
        }
        Object parsed;
        try {
            parsed = JSON.parse(body);
        } catch (JSONException e) {
            throw SyncException.protocolError("设备列表不是合法JSON: " + e.getMessage(), e);
        }
        if (parsed == null) {
            return Collections.emptyList();
        }
        if (!(parsed instanceof JSONArray array)) {
            throw SyncException.protocolError("设备列表不是JSON数组");
        }
        List<DeviceEntity> devices = new ArrayList<>(array.size());
        for (Object item : array) {
            if (!(item instanceof JSONObject json)) {
                log.warn("跳过非对象的设备条目: {}", item);
                continue;
            }
            DeviceEntity device = toEntity(json);
            if (device != null) {
                devices.add(device);
            }
        }
        return devices;
    }

    /**
     * 单个设备条目转换，缺少 friendly_name 时返回 null
     */
    public DeviceEntity toEntity(JSONObject json) {
        String id = json.getString("friendly_name");
        if (id == null || id.isBlank()) {
            log.warn("设备条目缺少 friendly_name，已跳过: ieee={}", json.getString("ieee_address"));
            return null;
        }
        JSONObject state = json.getJSONObject("state");
        Map<String, Object> properties = state != null ? new LinkedHashMap<>(state) : Collections.emptyMap();

        return DeviceEntity.builder()
                .id(id)
                .properties(properties)
                .zones(readZones(json.getJSONArray("zones")))
                .online(!Boolean.TRUE.equals(json.getBoolean("disabled")))
                .interviewing(Boolean.TRUE.equals(json.getBoolean("interviewing")))
                .lastSeen(parseLastSeen(json.get("last_seen")))
                .ieeeAddress(json.getString("ieee_address"))
                .type(json.getString("type"))
                .manufacturer(json.getString("manufacturer"))
                .modelId(json.getString("model_id"))
                .customName(json.getString("custom_name"))
                .customCategory(json.getString("custom_category"))
                .build();
    }

    /**
     * last_seen 可能是毫秒时间戳或 ISO8601 字符串，无法识别时返回 null
     */
    static Long parseLastSeen(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        if (text.length() <= 18 && text.chars().allMatch(Character::isDigit)) {
            return Long.parseLong(text);
        }
        try {
            return OffsetDateTime.parse(text).toInstant().toEpochMilli();
        } catch (DateTimeParseException e) {
            return parseLocalDateTime(text);
        }
    }

    private static Long parseLocalDateTime(String text) {
        try {
            return LocalDateTime.parse(text).atZone(ZoneId.systemDefault()).toInstant().toEpochMilli();
        } catch (DateTimeParseException e) {
            log.debug("无法解析 last_seen: {}", text);
            return null;
        }
    }

    private static Set<String> readZones(JSONArray zones) {
        if (zones == null || zones.isEmpty()) {
            return Collections.emptySet();
        }
        Set<String> result = new LinkedHashSet<>();
        for (Object zone : zones) {
            if (zone != null && !zone.toString().isBlank()) {
                result.add(zone.toString());
            }
        }
        return result;
    }
}
