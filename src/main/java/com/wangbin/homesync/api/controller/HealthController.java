package com.wangbin.homesync.api.controller;

import com.wangbin.homesync.core.sync.SyncLifecycle;
import com.wangbin.homesync.core.sync.SyncMode;
import com.wangbin.homesync.core.sync.SyncSession;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 服务健康检查接口。
 * 会话运行中即为 UP，推送通道断开只影响 mode，不影响健康状态。
 */
@RestController
@RequiredArgsConstructor
public class HealthController {

    private final SyncLifecycle syncLifecycle;

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> health = new LinkedHashMap<>();
        SyncSession session = syncLifecycle.current().orElse(null);
        health.put("status", session != null ? "UP" : "DOWN");
        health.put("mode", session != null ? session.getMode().name() : SyncMode.STOPPED.name());
        if (session != null) {
            health.put("connectionStatus", session.getConnectionStatus().name());
            health.put("devices", session.getStore().snapshot().size());
            health.put("pendingWrites", session.getStore().snapshot().pendingWrites().size());
        }
        health.put("timestamp", System.currentTimeMillis());
        return health;
    }
}
