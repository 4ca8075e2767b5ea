package com.wangbin.homesync.core.poll;

import com.wangbin.homesync.common.domain.entity.DeviceEntity;
import com.wangbin.homesync.common.domain.enums.ConnectionStatus;
import com.wangbin.homesync.common.domain.enums.SyncErrorType;
import com.wangbin.homesync.common.exception.SyncException;
import com.wangbin.homesync.core.channel.ConnectionStateListener;
import com.wangbin.homesync.core.diagnostic.DiagnosticListener;
import com.wangbin.homesync.core.diagnostic.DiagnosticType;
import com.wangbin.homesync.core.diagnostic.SyncDiagnostic;
import com.wangbin.homesync.core.schedule.SyncTimer;
import com.wangbin.homesync.core.schedule.TimerHandle;
import com.wangbin.homesync.core.store.DeviceStore;
import com.wangbin.homesync.core.store.SnapshotTicket;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 轮询拉取器：定期拉取全量快照作为推送通道的兜底。
 * <p>
 * 推送通道未连接时按短间隔轮询，已连接时按长间隔轮询，连接状态一变化立即切换。
 * 存在待确认写入时跳过定时轮询，避免旧数据覆盖乐观值；强制同步不受此限制。
 */
@Slf4j
public class PollScheduler implements ConnectionStateListener, AutoCloseable {

    private static final String SOURCE = "PollScheduler";

    private final SnapshotFetcher fetcher;
    private final DeviceStore store;
    private final SyncTimer timer;
    private final long intervalMs;
    private final long connectedIntervalMs;
    private final long requestTimeoutMs;
    private final DiagnosticListener diagnostics;

    private final Object lock = new Object();
    private volatile boolean running;
    private volatile boolean pushConnected;
    // 以下字段仅在 lock 内访问
    private TimerHandle nextTick;
    private boolean scheduledFetchInFlight;
    private long fetchSequence;
    private long appliedSequence;

    // 统计信息
    private final AtomicLong fetchCount = new AtomicLong(0);
    private final AtomicLong successCount = new AtomicLong(0);
    private final AtomicLong failureCount = new AtomicLong(0);
    private final AtomicLong skippedCount = new AtomicLong(0);
    private final AtomicLong discardedCount = new AtomicLong(0);
    private volatile long lastSuccessTime;

    public PollScheduler(SnapshotFetcher fetcher,
                         DeviceStore store,
                         SyncTimer timer,
                         long intervalMs,
                         long connectedIntervalMs,
                         long requestTimeoutMs,
                         DiagnosticListener diagnostics) {
        this.fetcher = fetcher;
        this.store = store;
        this.timer = timer;
        this.intervalMs = intervalMs;
        this.connectedIntervalMs = connectedIntervalMs;
        this.requestTimeoutMs = requestTimeoutMs;
        this.diagnostics = diagnostics != null ? diagnostics : DiagnosticListener.NOOP;
    }

    /**
     * 启动轮询：立即拉取一次，然后按当前间隔定时拉取
     */
    public void start() {
        synchronized (lock) {
            if (running) {
                return;
            }
            running = true;
        }
        log.info("轮询启动，间隔: {}ms / 推送已连接时 {}ms", intervalMs, connectedIntervalMs);
        tick();
    }

    public void stop() {
        synchronized (lock) {
            running = false;
            cancelNextTick();
        }
        log.info("轮询已停止");
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * 当前生效的轮询间隔
     */
    public long currentInterval() {
        return pushConnected ? connectedIntervalMs : intervalMs;
    }

    @Override
    public void onStateChanged(ConnectionStatus previous, ConnectionStatus current) {
        boolean connected = current != null && current.isConnected();
        if (connected == pushConnected) {
            return;
        }
        pushConnected = connected;
        synchronized (lock) {
            if (!running) {
                return;
            }
            log.debug("推送通道{}，轮询间隔切换为 {}ms", connected ? "已连接" : "未连接", currentInterval());
            scheduleNextTick();
        }
    }

    /**
     * 立即拉取，忽略待确认写入（待确认的属性会覆盖在快照之上）
     *
     * @return 快照是否被应用
     */
    public CompletableFuture<Boolean> forceResync() {
        if (!running) {
            return CompletableFuture.completedFuture(false);
        }
        log.debug("强制同步设备快照");
        return fetch();
    }

    private void tick() {
        boolean doFetch = false;
        synchronized (lock) {
            if (!running) {
                return;
            }
            nextTick = null;
            if (store.hasPendingWrites()) {
                skippedCount.incrementAndGet();
                log.debug("存在待确认写入，跳过本次轮询");
                diagnostics.onDiagnostic(SyncDiagnostic.of(DiagnosticType.POLL_SKIPPED, SOURCE, null,
                        "存在待确认写入"));
            } else if (scheduledFetchInFlight) {
                log.debug("上一次轮询尚未完成，跳过本次轮询");
            } else {
                scheduledFetchInFlight = true;
                doFetch = true;
            }
            scheduleNextTick();
        }
        if (doFetch) {
            fetch().whenComplete((applied, error) -> {
                synchronized (lock) {
                    scheduledFetchInFlight = false;
                }
            });
        }
    }

    private CompletableFuture<Boolean> fetch() {
        long sequence;
        synchronized (lock) {
            sequence = ++fetchSequence;
        }
        fetchCount.incrementAndGet();
        SnapshotTicket ticket = store.beginFullSnapshot();

        CompletableFuture<List<DeviceEntity>> future;
        try {
            future = fetcher.fetchAll();
        } catch (Exception e) {
            future = CompletableFuture.failedFuture(e);
        }
        return future
                .orTimeout(requestTimeoutMs, TimeUnit.MILLISECONDS)
                .handle((devices, error) -> onFetchComplete(sequence, ticket, devices, error));
    }

    private boolean onFetchComplete(long sequence, SnapshotTicket ticket, List<DeviceEntity> devices, Throwable error) {
        if (error != null) {
            store.releaseTicket(ticket);
            failureCount.incrementAndGet();
            SyncException exception = SyncException.unwrap(error, SyncErrorType.FETCH, null);
            log.warn("设备快照拉取失败，保持当前状态: {}", exception.getMessage());
            diagnostics.onDiagnostic(SyncDiagnostic.of(DiagnosticType.FETCH_ERROR, SOURCE, null,
                    exception.getMessage()));
            return false;
        }
        synchronized (lock) {
            if (!running || sequence <= appliedSequence) {
                discardedCount.incrementAndGet();
                log.debug("丢弃过期的快照结果: #{}", sequence);
                store.releaseTicket(ticket);
                return false;
            }
            appliedSequence = sequence;
            store.applyFullSnapshot(devices, ticket);
        }
        successCount.incrementAndGet();
        lastSuccessTime = timer.currentTimeMillis();
        return true;
    }

    // lock 内调用
    private void scheduleNextTick() {
        cancelNextTick();
        nextTick = timer.schedule("poll-tick", this::tick, currentInterval());
    }

    // lock 内调用
    private void cancelNextTick() {
        if (nextTick != null) {
            nextTick.cancel();
            nextTick = null;
        }
    }

    public Map<String, Object> getStatistics() {
        Map<String, Object> statistics = new LinkedHashMap<>();
        statistics.put("running", running);
        statistics.put("currentInterval", currentInterval());
        statistics.put("fetchCount", fetchCount.get());
        statistics.put("successCount", successCount.get());
        statistics.put("failureCount", failureCount.get());
        statistics.put("skippedCount", skippedCount.get());
        statistics.put("discardedCount", discardedCount.get());
        statistics.put("lastSuccessTime", lastSuccessTime);
        return statistics;
    }
}
