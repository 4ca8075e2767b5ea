package com.wangbin.homesync.core.write;

import com.wangbin.homesync.common.domain.entity.PendingWrite;
import com.wangbin.homesync.common.domain.enums.SyncErrorType;
import com.wangbin.homesync.common.exception.SyncException;
import com.wangbin.homesync.core.diagnostic.DiagnosticListener;
import com.wangbin.homesync.core.diagnostic.SyncDiagnostic;
import com.wangbin.homesync.core.schedule.SyncTimer;
import com.wangbin.homesync.core.schedule.TimerHandle;
import com.wangbin.homesync.core.store.DeviceStore;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 乐观写入协调器。
 * <p>
 * 连续型属性（亮度、色温、颜色）按设备防抖：静默期内的多次修改合并为一次本地应用和一次远端请求；
 * 离散型属性立即应用并发送，同时带上该设备尚在防抖中的修改。
 * 从第一次修改到该设备最后一个请求返回期间，副本中保持一条待确认写入，轮询不会覆盖乐观值。
 * 请求失败时清除对应的待确认属性，并请求网关刷新该设备、立即触发一次全量同步。
 * <p>
 * 返回的 future 只会正常完成，结果通过 {@link WriteOutcome} 表达。
 */
@Slf4j
public class OptimisticWriteCoordinator implements AutoCloseable {

    private static final String SOURCE = "WriteCoordinator";

    private final DeviceStore store;
    private final DeviceWriteClient writeClient;
    private final PropertyClassifier classifier;
    private final SyncTimer timer;
    private final long debounceMs;
    private final long requestTimeoutMs;
    private final DiagnosticListener diagnostics;
    private volatile Runnable resyncTrigger = () -> { };

    private final Object lock = new Object();
    // 以下字段仅在 lock 内访问
    private final Map<String, DeviceWriteState> states = new HashMap<>();
    private boolean closed;

    // 统计信息
    private final AtomicLong requestCount = new AtomicLong(0);
    private final AtomicLong dispatchCount = new AtomicLong(0);
    private final AtomicLong successCount = new AtomicLong(0);
    private final AtomicLong failureCount = new AtomicLong(0);

    public OptimisticWriteCoordinator(DeviceStore store,
                                      DeviceWriteClient writeClient,
                                      PropertyClassifier classifier,
                                      SyncTimer timer,
                                      long debounceMs,
                                      long requestTimeoutMs,
                                      DiagnosticListener diagnostics) {
        this.store = store;
        this.writeClient = writeClient;
        this.classifier = classifier;
        this.timer = timer;
        this.debounceMs = debounceMs;
        this.requestTimeoutMs = requestTimeoutMs;
        this.diagnostics = diagnostics != null ? diagnostics : DiagnosticListener.NOOP;
    }

    /**
     * 写入失败后的全量同步动作（通常是轮询器的强制同步）
     */
    public void setResyncTrigger(Runnable resyncTrigger) {
        this.resyncTrigger = resyncTrigger != null ? resyncTrigger : () -> { };
    }

    public CompletableFuture<WriteOutcome> requestPropertyChange(String deviceId, String property, Object value) {
        Map<String, Object> changes = new LinkedHashMap<>();
        if (property != null) {
            changes.put(property, value);
        }
        return requestStateChange(deviceId, changes);
    }

    /**
     * 请求修改一个设备的若干属性
     */
    public CompletableFuture<WriteOutcome> requestStateChange(String deviceId, Map<String, Object> changes) {
        if (deviceId == null || deviceId.isBlank()) {
            return CompletableFuture.completedFuture(WriteOutcome.failure(deviceId, changes, "设备ID不能为空"));
        }
        if (changes == null || changes.isEmpty()) {
            return CompletableFuture.completedFuture(WriteOutcome.failure(deviceId, changes, "没有要修改的属性"));
        }
        requestCount.incrementAndGet();
        PropertyKind kind = classifier.classify(changes);
        CompletableFuture<WriteOutcome> future = new CompletableFuture<>();
        Dispatch dispatch = null;

        synchronized (lock) {
            if (closed) {
                return CompletableFuture.completedFuture(WriteOutcome.failure(deviceId, changes, "写入协调器已关闭"));
            }
            DeviceWriteState state = states.computeIfAbsent(deviceId, DeviceWriteState::new);
            state.buffered.putAll(changes);
            state.waiters.add(future);
            cancel(state.debounce);
            state.debounce = null;

            if (kind == PropertyKind.CONTINUOUS) {
                long deadline = timer.currentTimeMillis() + debounceMs;
                state.debounce = timer.schedule("write-debounce:" + deviceId, () -> flush(deviceId), debounceMs);
                store.markPending(new PendingWrite(deviceId, state.appliedProperties(), deadline, state.inFlightCount() > 0));
                log.debug("连续型属性进入防抖: {} {}", deviceId, changes.keySet());
            } else {
                dispatch = prepareDispatch(state);
            }
        }
        if (dispatch != null) {
            send(dispatch);
        }
        return future;
    }

    /**
     * 设备是否有未完成的写入（防抖中或请求中）
     */
    public boolean hasOutstanding(String deviceId) {
        synchronized (lock) {
            return states.containsKey(deviceId);
        }
    }

    /**
     * 取消所有防抖中的修改，之后的请求直接失败。已发出的请求照常返回，但不再修改副本。
     */
    @Override
    public void close() {
        List<CompletableFuture<WriteOutcome>> cancelled = new ArrayList<>();
        List<WriteOutcome> outcomes = new ArrayList<>();
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            for (DeviceWriteState state : states.values()) {
                cancel(state.debounce);
                state.debounce = null;
                for (CompletableFuture<WriteOutcome> waiter : state.waiters) {
                    cancelled.add(waiter);
                    outcomes.add(WriteOutcome.failure(state.deviceId, state.buffered, "写入已取消"));
                }
                state.waiters.clear();
                state.buffered.clear();
            }
            states.clear();
        }
        for (int i = 0; i < cancelled.size(); i++) {
            cancelled.get(i).complete(outcomes.get(i));
        }
        log.info("写入协调器已关闭，取消 {} 个未发送的修改", cancelled.size());
    }

    public Map<String, Object> getStatistics() {
        Map<String, Object> statistics = new LinkedHashMap<>();
        statistics.put("requestCount", requestCount.get());
        statistics.put("dispatchCount", dispatchCount.get());
        statistics.put("successCount", successCount.get());
        statistics.put("failureCount", failureCount.get());
        synchronized (lock) {
            statistics.put("outstandingDevices", states.size());
        }
        return statistics;
    }

    // ========== 内部方法 ==========

    private void flush(String deviceId) {
        Dispatch dispatch;
        synchronized (lock) {
            if (closed) {
                return;
            }
            DeviceWriteState state = states.get(deviceId);
            if (state == null || state.buffered.isEmpty()) {
                return;
            }
            state.debounce = null;
            dispatch = prepareDispatch(state);
        }
        send(dispatch);
    }

    // lock 内调用：取出缓冲的修改，本地应用并标记为请求中
    private Dispatch prepareDispatch(DeviceWriteState state) {
        Map<String, Object> properties = new LinkedHashMap<>(state.buffered);
        List<CompletableFuture<WriteOutcome>> waiters = new ArrayList<>(state.waiters);
        state.buffered.clear();
        state.waiters.clear();
        Dispatch dispatch = new Dispatch(state.deviceId, properties, waiters);
        state.inFlight.add(dispatch);

        store.applyOptimistic(state.deviceId, properties);
        store.markPending(new PendingWrite(state.deviceId, state.appliedProperties(), timer.currentTimeMillis(), true));
        return dispatch;
    }

    private void send(Dispatch dispatch) {
        dispatchCount.incrementAndGet();
        CompletableFuture<Void> request;
        try {
            request = writeClient.write(dispatch.deviceId(), dispatch.properties());
        } catch (Exception e) {
            request = CompletableFuture.failedFuture(e);
        }
        request.orTimeout(requestTimeoutMs, TimeUnit.MILLISECONDS)
                .whenComplete((ignored, error) -> onWriteComplete(dispatch, error));
    }

    private void onWriteComplete(Dispatch dispatch, Throwable error) {
        String deviceId = dispatch.deviceId();
        boolean active;
        synchronized (lock) {
            active = !closed;
            DeviceWriteState state = states.get(deviceId);
            if (state != null) {
                state.inFlight.remove(dispatch);
                if (active) {
                    if (state.isIdle()) {
                        states.remove(deviceId);
                        store.clearPending(deviceId);
                    } else {
                        store.markPending(new PendingWrite(deviceId, state.appliedProperties(),
                                timer.currentTimeMillis(), state.inFlightCount() > 0));
                    }
                }
            }
        }

        WriteOutcome outcome;
        if (error == null) {
            successCount.incrementAndGet();
            log.debug("设备写入成功: {} {}", deviceId, dispatch.properties().keySet());
            outcome = WriteOutcome.success(deviceId, dispatch.properties());
        } else {
            failureCount.incrementAndGet();
            SyncException exception = SyncException.unwrap(error, SyncErrorType.WRITE, deviceId);
            log.warn("设备写入失败: {} - {}", deviceId, exception.getMessage());
            diagnostics.onDiagnostic(SyncDiagnostic.fromException(SOURCE, exception));
            outcome = WriteOutcome.failure(deviceId, dispatch.properties(), exception.getMessage());
            if (active) {
                resyncDevice(deviceId);
            }
        }
        for (CompletableFuture<WriteOutcome> waiter : dispatch.waiters()) {
            waiter.complete(outcome);
        }
    }

    /**
     * 立即触发一次全量同步，同时请求网关刷新设备，两者互不等待
     */
    private void resyncDevice(String deviceId) {
        try {
            resyncTrigger.run();
        } catch (Exception e) {
            log.warn("写入失败后的全量同步触发失败: {}", deviceId, e);
        }
        CompletableFuture<Void> refresh;
        try {
            refresh = writeClient.requestRefresh(deviceId);
        } catch (Exception e) {
            refresh = CompletableFuture.failedFuture(e);
        }
        refresh.orTimeout(requestTimeoutMs, TimeUnit.MILLISECONDS)
                .whenComplete((ignored, error) -> {
                    if (error != null) {
                        log.debug("设备刷新请求失败: {} - {}", deviceId, error.getMessage());
                    }
                });
    }

    private static void cancel(TimerHandle handle) {
        if (handle != null) {
            handle.cancel();
        }
    }

    private record Dispatch(String deviceId,
                            Map<String, Object> properties,
                            List<CompletableFuture<WriteOutcome>> waiters) {
    }

    /**
     * 单个设备的写入状态
     */
    private static final class DeviceWriteState {

        private final String deviceId;
        private final Map<String, Object> buffered = new LinkedHashMap<>();
        private final List<CompletableFuture<WriteOutcome>> waiters = new ArrayList<>();
        private final List<Dispatch> inFlight = new ArrayList<>();
        private TimerHandle debounce;

        private DeviceWriteState(String deviceId) {
            this.deviceId = deviceId;
        }

        int inFlightCount() {
            return inFlight.size();
        }

        boolean isIdle() {
            return inFlight.isEmpty() && buffered.isEmpty() && debounce == null;
        }

        /**
         * 已本地应用、请求尚未返回的属性，按发送顺序合并。防抖中的属性尚未应用，不在其中。
         */
        Map<String, Object> appliedProperties() {
            Map<String, Object> applied = new LinkedHashMap<>();
            inFlight.forEach(dispatch -> applied.putAll(dispatch.properties()));
            return applied;
        }
    }
}
