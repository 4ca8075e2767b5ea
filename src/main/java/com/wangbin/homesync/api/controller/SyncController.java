package com.wangbin.homesync.api.controller;

import com.wangbin.homesync.common.web.result.ApiResult;
import com.wangbin.homesync.core.diagnostic.SyncDiagnostic;
import com.wangbin.homesync.core.sync.SyncLifecycle;
import com.wangbin.homesync.core.sync.SyncSession;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * 同步会话状态与控制接口
 */
@RestController
@RequestMapping("/api/sync")
@RequiredArgsConstructor
public class SyncController {

    private final SyncLifecycle syncLifecycle;

    @GetMapping("/status")
    public ApiResult<Map<String, Object>> status() {
        return ApiResult.success(syncLifecycle.requireSession().getStatus());
    }

    @GetMapping("/diagnostics")
    public ApiResult<List<SyncDiagnostic>> diagnostics() {
        return ApiResult.success(syncLifecycle.requireSession().getDiagnosticRecorder().getRecent());
    }

    /**
     * 重置推送通道的重连计数并立即重连；会话未运行时启动新会话
     */
    @PostMapping("/restart")
    public ApiResult<Map<String, Object>> restart() {
        SyncSession session = syncLifecycle.current().orElse(null);
        if (session == null) {
            session = syncLifecycle.start();
        } else {
            session.restart();
        }
        return ApiResult.success("已重启同步", session.getStatus());
    }

    @PostMapping("/resync")
    public CompletableFuture<ApiResult<Boolean>> resync() {
        return syncLifecycle.requireSession()
                .resync()
                .thenApply(applied -> ApiResult.success(applied ? "快照已应用" : "快照未应用", applied));
    }
}
