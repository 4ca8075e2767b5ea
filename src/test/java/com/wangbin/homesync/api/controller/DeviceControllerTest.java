package com.wangbin.homesync.api.controller;

import com.wangbin.homesync.common.domain.entity.DeviceEntity;
import com.wangbin.homesync.common.exception.BusinessException;
import com.wangbin.homesync.common.web.result.ApiResult;
import com.wangbin.homesync.common.web.result.ResultCode;
import com.wangbin.homesync.core.config.SyncProperties;
import com.wangbin.homesync.core.sync.SyncLifecycle;
import com.wangbin.homesync.core.write.WriteOutcome;
import com.wangbin.homesync.support.FakeSyncSessionFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class DeviceControllerTest {

    private FakeSyncSessionFactory factory;
    private SyncLifecycle lifecycle;
    private DeviceController controller;

    @BeforeEach
    void setUp() {
        SyncProperties properties = new SyncProperties();
        factory = new FakeSyncSessionFactory(properties);
        lifecycle = new SyncLifecycle(properties, factory);
        controller = new DeviceController(lifecycle);
    }

    @Test
    void requestsFailWhenSessionNotRunning() {
        BusinessException e = assertThrows(BusinessException.class, () -> controller.listDevices(null));
        assertEquals(ResultCode.SERVICE_UNAVAILABLE.getCode(), e.getCode());
    }

    @Test
    void readsDevicesFromStore() {
        startWithDevices();

        ApiResult<List<DeviceEntity>> all = controller.listDevices(null);
        assertTrue(all.isSuccess());
        assertEquals(2, all.getData().size());

        assertEquals(1, controller.listDevicesInZone("kitchen").getData().size());
        assertEquals(1, controller.listDevices(List.of("bedroom")).getData().size());
        assertEquals("lamp", controller.getDevice("lamp").getData().getId());

        BusinessException e = assertThrows(BusinessException.class, () -> controller.getDevice("ghost"));
        assertEquals(ResultCode.DATA_NOT_FOUND.getCode(), e.getCode());
    }

    @Test
    void changeStateReturnsOutcome() {
        startWithDevices();

        CompletableFuture<ApiResult<WriteOutcome>> ok = controller.changeState("lamp", Map.of("state", "ON"));
        factory.writeClient.write(0).future().complete(null);
        assertTrue(ok.join().isSuccess());

        CompletableFuture<ApiResult<WriteOutcome>> failed = controller.changeState("lamp", Map.of("state", "OFF"));
        factory.writeClient.write(1).future().completeExceptionally(new IOException("timeout"));
        ApiResult<WriteOutcome> result = failed.join();
        assertEquals(ResultCode.WRITE_ERROR.getCode(), result.getCode());
        assertFalse(result.getData().success());
    }

    @Test
    void changeStateValidatesInput() {
        startWithDevices();
        assertThrows(BusinessException.class, () -> controller.changeState("lamp", Map.of()));
        assertThrows(BusinessException.class, () -> controller.changeState("ghost", Map.of("state", "ON")));
    }

    private void startWithDevices() {
        lifecycle.start();
        factory.fetcher.respond(List.of(
                DeviceEntity.builder().id("lamp").zones(Set.of("kitchen")).properties(Map.of("state", "OFF")).build(),
                DeviceEntity.builder().id("bed_light").zones(Set.of("bedroom")).build()));
    }
}
