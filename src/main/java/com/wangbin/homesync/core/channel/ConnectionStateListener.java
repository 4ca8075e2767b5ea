package com.wangbin.homesync.core.channel;

import com.wangbin.homesync.common.domain.enums.ConnectionStatus;

/**
 * 推送通道状态变化监听
 */
@FunctionalInterface
public interface ConnectionStateListener {

    void onStateChanged(ConnectionStatus previous, ConnectionStatus current);
}
