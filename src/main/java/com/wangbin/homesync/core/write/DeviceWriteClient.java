package com.wangbin.homesync.core.write;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * 设备写入接口
 */
public interface DeviceWriteClient {

    /**
     * 发送属性修改，失败时以 {@link com.wangbin.homesync.common.exception.SyncException} 异常完成
     */
    CompletableFuture<Void> write(String deviceId, Map<String, Object> properties);

    /**
     * 请求网关重新读取设备状态
     */
    CompletableFuture<Void> requestRefresh(String deviceId);
}
