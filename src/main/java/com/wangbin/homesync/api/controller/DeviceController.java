package com.wangbin.homesync.api.controller;

import com.wangbin.homesync.common.domain.entity.DeviceEntity;
import com.wangbin.homesync.common.exception.BusinessException;
import com.wangbin.homesync.common.web.result.ApiResult;
import com.wangbin.homesync.common.web.result.ResultCode;
import com.wangbin.homesync.core.store.DeviceStore;
import com.wangbin.homesync.core.sync.SyncLifecycle;
import com.wangbin.homesync.core.sync.SyncSession;
import com.wangbin.homesync.core.write.WriteOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * 设备副本读取与属性修改接口
 */
@Slf4j
@RestController
@RequestMapping("/api/devices")
@RequiredArgsConstructor
public class DeviceController {

    private final SyncLifecycle syncLifecycle;

    @GetMapping
    public ApiResult<List<DeviceEntity>> listDevices(@RequestParam(required = false) List<String> zones) {
        DeviceStore store = syncLifecycle.requireSession().getStore();
        return ApiResult.success(zones == null || zones.isEmpty() ? store.getDevices() : store.getDevicesByZones(zones));
    }

    @GetMapping("/{deviceId}")
    public ApiResult<DeviceEntity> getDevice(@PathVariable String deviceId) {
        return ApiResult.success(requireDevice(syncLifecycle.requireSession().getStore(), deviceId));
    }

    @GetMapping("/zones/{zone}")
    public ApiResult<List<DeviceEntity>> listDevicesInZone(@PathVariable String zone) {
        return ApiResult.success(syncLifecycle.requireSession().getStore().getDevicesByZones(List.of(zone)));
    }

    /**
     * 修改设备属性，本地立即生效（连续型属性在静默期后生效），远端确认后返回结果
     */
    @PostMapping("/{deviceId}/state")
    public CompletableFuture<ApiResult<WriteOutcome>> changeState(@PathVariable String deviceId,
                                                                  @RequestBody Map<String, Object> changes) {
        if (changes == null || changes.isEmpty()) {
            throw new BusinessException(ResultCode.PARAM_ERROR, "没有要修改的属性");
        }
        SyncSession session = syncLifecycle.requireSession();
        requireDevice(session.getStore(), deviceId);
        log.debug("请求修改设备属性: {} {}", deviceId, changes);
        return session.getWriteCoordinator()
                .requestStateChange(deviceId, changes)
                .thenApply(outcome -> {
                    if (outcome.success()) {
                        return ApiResult.success(outcome);
                    }
                    ApiResult<WriteOutcome> result = ApiResult.error(ResultCode.WRITE_ERROR.getCode(), outcome.error());
                    result.setData(outcome);
                    return result;
                });
    }

    private static DeviceEntity requireDevice(DeviceStore store, String deviceId) {
        return store.getDevice(deviceId)
                .orElseThrow(() -> new BusinessException(ResultCode.DATA_NOT_FOUND, "设备不存在: " + deviceId));
    }
}
