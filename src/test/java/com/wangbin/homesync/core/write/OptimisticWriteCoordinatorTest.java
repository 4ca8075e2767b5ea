package com.wangbin.homesync.core.write;

import com.wangbin.homesync.common.domain.entity.DeviceEntity;
import com.wangbin.homesync.common.domain.entity.PendingWrite;
import com.wangbin.homesync.common.exception.SyncException;
import com.wangbin.homesync.core.diagnostic.DiagnosticRecorder;
import com.wangbin.homesync.core.diagnostic.DiagnosticType;
import com.wangbin.homesync.core.store.DeviceStore;
import com.wangbin.homesync.support.FakeWriteClient;
import com.wangbin.homesync.support.ManualSyncTimer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class OptimisticWriteCoordinatorTest {

    private ManualSyncTimer timer;
    private DeviceStore store;
    private FakeWriteClient client;
    private DiagnosticRecorder recorder;
    private AtomicInteger resyncCount;
    private OptimisticWriteCoordinator coordinator;

    @BeforeEach
    void setUp() {
        timer = new ManualSyncTimer();
        recorder = new DiagnosticRecorder(50);
        store = new DeviceStore(recorder, true, 16);
        store.applyFullSnapshot(List.of(
                DeviceEntity.of("lamp", Map.of("state", "OFF", "brightness", 0)),
                DeviceEntity.of("strip", Map.of("state", "OFF", "brightness", 0))));
        client = new FakeWriteClient();
        resyncCount = new AtomicInteger();
        coordinator = new OptimisticWriteCoordinator(store, client,
                new PropertyClassifier(List.of("brightness", "color_temp", "color")),
                timer, 100, 8000, recorder);
        coordinator.setResyncTrigger(resyncCount::incrementAndGet);
    }

    @Test
    void sliderChangesWithinQuietPeriodCoalesceIntoOneWrite() {
        CompletableFuture<WriteOutcome> first = coordinator.requestPropertyChange("lamp", "brightness", 10);
        timer.advance(50);
        CompletableFuture<WriteOutcome> second = coordinator.requestPropertyChange("lamp", "brightness", 20);

        // 静默期内不发送，但已标记待确认
        timer.advance(99);
        assertEquals(0, client.writeCount());
        assertTrue(store.hasPendingWrites());

        timer.advance(1);
        assertEquals(1, client.writeCount());
        assertEquals(Map.of("brightness", 20), client.write(0).properties());
        assertEquals(20, store.getDevice("lamp").orElseThrow().getProperty("brightness"));

        client.write(0).future().complete(null);
        assertTrue(first.join().success());
        assertTrue(second.join().success());
        assertFalse(store.hasPendingWrites());
    }

    @Test
    void snapshotDuringQuietPeriodDoesNotShowUnsentSliderValue() {
        coordinator.requestPropertyChange("lamp", "brightness", 200);
        assertTrue(store.hasPendingWrites());
        assertTrue(store.getPendingWrite("lamp").orElseThrow().properties().isEmpty());

        timer.advance(50);
        store.applyFullSnapshot(List.of(
                DeviceEntity.of("lamp", Map.of("state", "OFF", "brightness", 0)),
                DeviceEntity.of("strip", Map.of("state", "OFF", "brightness", 0))));
        assertEquals(0, store.getDevice("lamp").orElseThrow().getProperty("brightness"));

        timer.advance(50);
        assertEquals(200, store.getDevice("lamp").orElseThrow().getProperty("brightness"));
        assertEquals(Map.of("brightness", 200), store.getPendingWrite("lamp").orElseThrow().properties());
    }

    @Test
    void discreteChangeIsAppliedAndSentImmediately() {
        CompletableFuture<WriteOutcome> outcome = coordinator.requestPropertyChange("lamp", "state", "ON");

        assertEquals(1, client.writeCount());
        assertEquals("ON", store.getDevice("lamp").orElseThrow().getProperty("state"));
        PendingWrite pending = store.getPendingWrite("lamp").orElseThrow();
        assertTrue(pending.inFlight());

        client.write(0).future().complete(null);
        WriteOutcome result = outcome.join();
        assertTrue(result.success());
        assertEquals(Map.of("state", "ON"), result.properties());
        assertTrue(store.getPendingWrite("lamp").isEmpty());
    }

    @Test
    void discreteChangeFlushesBufferedSliderChangesForSameDevice() {
        coordinator.requestPropertyChange("lamp", "brightness", 120);
        coordinator.requestPropertyChange("lamp", "state", "ON");

        assertEquals(1, client.writeCount());
        assertEquals(Map.of("brightness", 120, "state", "ON"), client.write(0).properties());
        assertEquals(0, timer.pendingCount());
    }

    @Test
    void differentDevicesAreNeverCoalesced() {
        coordinator.requestPropertyChange("lamp", "brightness", 10);
        coordinator.requestPropertyChange("strip", "brightness", 30);
        timer.advance(100);

        assertEquals(2, client.writeCount());
        assertEquals("lamp", client.write(0).deviceId());
        assertEquals(Map.of("brightness", 10), client.write(0).properties());
        assertEquals("strip", client.write(1).deviceId());
        assertEquals(Map.of("brightness", 30), client.write(1).properties());
    }

    @Test
    void pendingLastsUntilLastRequestForDeviceResolves() {
        coordinator.requestPropertyChange("lamp", "state", "ON");
        coordinator.requestPropertyChange("lamp", "state", "OFF");
        assertEquals(2, client.writeCount());

        client.write(0).future().complete(null);
        assertTrue(store.hasPendingWrites());
        assertEquals(Map.of("state", "OFF"), store.getPendingWrite("lamp").orElseThrow().properties());

        client.write(1).future().complete(null);
        assertFalse(store.hasPendingWrites());
        assertFalse(coordinator.hasOutstanding("lamp"));
    }

    @Test
    void failureClearsPendingAndTriggersTargetedResync() {
        CompletableFuture<WriteOutcome> outcome = coordinator.requestPropertyChange("lamp", "state", "ON");
        client.write(0).future().completeExceptionally(
                SyncException.writeError("gateway returned 500", "lamp", new IOException("500")));

        WriteOutcome result = outcome.join();
        assertFalse(result.success());
        assertEquals("gateway returned 500", result.error());
        assertFalse(store.hasPendingWrites());
        assertEquals(1, recorder.getCount(DiagnosticType.WRITE_ERROR));
        assertEquals(List.of("lamp"), client.refreshes());
        assertEquals(1, resyncCount.get());
    }

    @Test
    void resyncDoesNotWaitForHangingRefresh() {
        client.holdRefreshes();
        coordinator.setResyncTrigger(() -> {
            resyncCount.incrementAndGet();
            store.applyFullSnapshot(List.of(
                    DeviceEntity.of("lamp", Map.of("state", "OFF", "brightness", 0)),
                    DeviceEntity.of("strip", Map.of("state", "OFF", "brightness", 0))));
        });

        CompletableFuture<WriteOutcome> outcome = coordinator.requestPropertyChange("lamp", "state", "ON");
        assertEquals("ON", store.getDevice("lamp").orElseThrow().getProperty("state"));
        client.write(0).future().completeExceptionally(new IOException("gateway down"));

        assertFalse(outcome.join().success());
        assertEquals(1, resyncCount.get());
        assertEquals("OFF", store.getDevice("lamp").orElseThrow().getProperty("state"));
        assertEquals(1, client.heldRefreshes().size());
        assertFalse(client.heldRefreshes().get(0).isDone());
    }

    @Test
    void futureNeverCompletesExceptionallyWhenClientThrows() {
        DeviceWriteClient throwing = new DeviceWriteClient() {
            @Override
            public CompletableFuture<Void> write(String deviceId, Map<String, Object> properties) {
                throw new IllegalStateException("client broken");
            }

            @Override
            public CompletableFuture<Void> requestRefresh(String deviceId) {
                return CompletableFuture.completedFuture(null);
            }
        };
        OptimisticWriteCoordinator broken = new OptimisticWriteCoordinator(store, throwing,
                new PropertyClassifier(List.of("brightness")), timer, 100, 8000, recorder);

        WriteOutcome result = broken.requestPropertyChange("lamp", "state", "ON").join();
        assertFalse(result.success());
        assertFalse(store.hasPendingWrites());
    }

    @Test
    void invalidRequestsFailFast() {
        assertFalse(coordinator.requestStateChange("", Map.of("state", "ON")).join().success());
        assertFalse(coordinator.requestStateChange("lamp", Map.of()).join().success());
        assertEquals(0, client.writeCount());
    }

    @Test
    void closeCancelsDebouncedChanges() {
        CompletableFuture<WriteOutcome> outcome = coordinator.requestPropertyChange("lamp", "brightness", 80);
        coordinator.close();

        WriteOutcome result = outcome.join();
        assertFalse(result.success());
        timer.advance(1000);
        assertEquals(0, client.writeCount());
        assertFalse(coordinator.requestPropertyChange("lamp", "state", "ON").join().success());
    }

    @Test
    void nullValueIsSentAsDeletion() {
        coordinator.requestPropertyChange("lamp", "state", null);
        assertTrue(client.write(0).properties().containsKey("state"));
        assertFalse(store.getDevice("lamp").orElseThrow().hasProperty("state"));
    }
}
