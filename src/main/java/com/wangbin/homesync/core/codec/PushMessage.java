package com.wangbin.homesync.core.codec;

import com.wangbin.homesync.common.domain.entity.DevicePatch;

/**
 * 推送通道上的已解码消息
 */
public interface PushMessage {

    MessageType type();

    /**
     * 设备状态增量
     */
    record DeviceUpdate(DevicePatch patch) implements PushMessage {
        @Override
        public MessageType type() {
            return MessageType.DEVICE_UPDATE;
        }
    }

    /**
     * 服务端心跳，timestamp 可能缺失
     */
    record Ping(Long timestamp) implements PushMessage {
        @Override
        public MessageType type() {
            return MessageType.PING;
        }
    }

    record Pong(long timestamp) implements PushMessage {
        @Override
        public MessageType type() {
            return MessageType.PONG;
        }
    }
}
