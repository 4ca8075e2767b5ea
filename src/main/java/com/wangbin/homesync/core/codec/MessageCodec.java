package com.wangbin.homesync.core.codec;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.wangbin.homesync.common.domain.entity.DevicePatch;
import com.wangbin.homesync.common.exception.SyncException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 推送帧编解码。
 * <p>
 * 帧格式为带 type 标签的 JSON 对象。格式错误的帧抛出协议异常；
 * 类型未知的帧解码为空，由调用方忽略。
 */
public class MessageCodec {

    private static final String FIELD_TYPE = "type";
    private static final String FIELD_DEVICE_NAME = "device_name";
    private static final String FIELD_STATE = "state";
    private static final String FIELD_TIMESTAMP = "timestamp";

    /**
     * 解码一帧文本
     *
     * @return 已知类型的消息；未知类型返回空
     * @throws SyncException 帧不是合法 JSON 对象，缺少 type，或已知类型的必填字段缺失
     */
    public Optional<PushMessage> decode(String frame) {
        JSONObject json = parseObject(frame);
        Object typeValue = json.get(FIELD_TYPE);
        if (!(typeValue instanceof String typeCode) || typeCode.isBlank()) {
            throw SyncException.protocolError("帧缺少 type 字段");
        }
        MessageType type = MessageType.fromCode(typeCode);
        if (type == null) {
            return Optional.empty();
        }
        return Optional.of(switch (type) {
            case DEVICE_UPDATE -> decodeDeviceUpdate(json);
            case PING -> new PushMessage.Ping(readTimestamp(json));
            case PONG -> {
                Long timestamp = readTimestamp(json);
                yield new PushMessage.Pong(timestamp != null ? timestamp : 0L);
            }
        });
    }

    /**
     * 读取帧的 type 字段，不做其他校验，用于未知类型的诊断信息
     */
    public String peekType(String frame) {
        try {
            JSONObject json = JSON.parseObject(frame);
            return json != null ? json.getString(FIELD_TYPE) : null;
        } catch (JSONException e) {
            return null;
        }
    }

    public String encodePong(long timestamp) {
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put(FIELD_TYPE, MessageType.PONG.getCode());
        frame.put(FIELD_TIMESTAMP, timestamp);
        return JSON.toJSONString(frame);
    }

    private JSONObject parseObject(String frame) {
        if (frame == null || frame.isBlank()) {
            throw SyncException.protocolError("空帧");
        }
        Object parsed;
        try {
            parsed = JSON.parse(frame);
        } catch (JSONException e) {
            throw SyncException.protocolError("帧不是合法JSON: " + e.getMessage(), e);
        }
        if (!(parsed instanceof JSONObject json)) {
            throw SyncException.protocolError("帧不是JSON对象");
        }
        return json;
    }

    private PushMessage decodeDeviceUpdate(JSONObject json) {
        Object name = json.get(FIELD_DEVICE_NAME);
        if (!(name instanceof String deviceName) || deviceName.isBlank()) {
            throw SyncException.protocolError("device_update 缺少 device_name");
        }
        Object state = json.get(FIELD_STATE);
        if (!(state instanceof JSONObject stateObject)) {
            throw SyncException.protocolError("device_update 的 state 不是对象: " + deviceName);
        }
        Object timestamp = json.get(FIELD_TIMESTAMP);
        Map<String, Object> diff = new LinkedHashMap<>(stateObject);
        return new PushMessage.DeviceUpdate(
                new DevicePatch(deviceName, diff, timestamp != null ? timestamp.toString() : null));
    }

    private Long readTimestamp(JSONObject json) {
        Object value = json.get(FIELD_TIMESTAMP);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            throw SyncException.protocolError("timestamp 不是数字: " + value, e);
        }
    }
}
