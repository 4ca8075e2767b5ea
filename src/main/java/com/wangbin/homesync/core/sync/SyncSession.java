package com.wangbin.homesync.core.sync;

import com.wangbin.homesync.common.domain.enums.ConnectionStatus;
import com.wangbin.homesync.core.channel.PushChannelManager;
import com.wangbin.homesync.core.channel.ReconnectPolicy;
import com.wangbin.homesync.core.channel.transport.DuplexTransport;
import com.wangbin.homesync.core.codec.MessageCodec;
import com.wangbin.homesync.core.config.SyncProperties;
import com.wangbin.homesync.core.diagnostic.DiagnosticBus;
import com.wangbin.homesync.core.diagnostic.DiagnosticRecorder;
import com.wangbin.homesync.core.poll.PollScheduler;
import com.wangbin.homesync.core.poll.SnapshotFetcher;
import com.wangbin.homesync.core.schedule.SyncTimer;
import com.wangbin.homesync.core.store.DeviceStore;
import com.wangbin.homesync.core.write.DeviceWriteClient;
import com.wangbin.homesync.core.write.OptimisticWriteCoordinator;
import com.wangbin.homesync.core.write.PropertyClassifier;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 一次同步会话：组装副本、推送通道、轮询器和写入协调器。
 * <p>
 * 每个会话显式构造，不共享任何单例状态。{@link #close()} 取消全部定时任务、
 * 断开推送通道（不重连）、清空副本，可重复调用。
 */
@Slf4j
public class SyncSession implements AutoCloseable {

    private final SyncTimer timer;
    private final DiagnosticBus diagnosticBus = new DiagnosticBus();
    private final DiagnosticRecorder diagnosticRecorder;
    private final DeviceStore store;
    private final PushChannelManager pushChannel;
    private final PollScheduler pollScheduler;
    private final OptimisticWriteCoordinator writeCoordinator;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile SyncMode mode = SyncMode.STOPPED;

    public SyncSession(SyncProperties properties,
                       DuplexTransport transport,
                       SnapshotFetcher snapshotFetcher,
                       DeviceWriteClient writeClient,
                       SyncTimer timer) {
        this.timer = timer;
        this.diagnosticRecorder = new DiagnosticRecorder(properties.getDiagnosticHistorySize());
        diagnosticBus.addListener(diagnosticRecorder);

        SyncProperties.Store storeConfig = properties.getStore();
        this.store = new DeviceStore(diagnosticBus, storeConfig.isBufferUnknownPatches(),
                storeConfig.getMaxBufferedDevices());

        SyncProperties.Push push = properties.getPush();
        this.pushChannel = new PushChannelManager(push.getUrl(),
                transport,
                new MessageCodec(),
                timer,
                ReconnectPolicy.from(push),
                push.getConnectTimeoutMs(),
                diagnosticBus,
                store::applyPatch);

        SyncProperties.Poll poll = properties.getPoll();
        this.pollScheduler = new PollScheduler(snapshotFetcher,
                store,
                timer,
                poll.getIntervalMs(),
                poll.getConnectedIntervalMs(),
                poll.getRequestTimeoutMs(),
                diagnosticBus);
        pushChannel.addStateListener(pollScheduler);

        SyncProperties.Write write = properties.getWrite();
        this.writeCoordinator = new OptimisticWriteCoordinator(store,
                writeClient,
                new PropertyClassifier(write.getContinuousProperties()),
                timer,
                write.getDebounceMs(),
                write.getRequestTimeoutMs(),
                diagnosticBus);
        writeCoordinator.setResyncTrigger(pollScheduler::forceResync);

        // 同步模式跟随连接状态和待确认写入变化
        pushChannel.addStateListener((previous, current) -> refreshMode());
        store.addListener(event -> refreshMode());
    }

    /**
     * 启动会话：开始轮询（立即拉取一次）并连接推送通道
     */
    public void start() {
        if (closed.get()) {
            throw new IllegalStateException("同步会话已关闭");
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }
        log.info("同步会话启动");
        pollScheduler.start();
        pushChannel.connect();
        refreshMode();
    }

    /**
     * 重置推送通道的重连计数并立即连接，同时强制同步一次
     */
    public void restart() {
        if (!isRunning()) {
            return;
        }
        log.info("重启同步会话的推送通道");
        pushChannel.restart();
        pollScheduler.forceResync();
    }

    /**
     * 立即拉取全量快照
     *
     * @return 快照是否被应用
     */
    public CompletableFuture<Boolean> resync() {
        if (!isRunning()) {
            return CompletableFuture.completedFuture(false);
        }
        return pollScheduler.forceResync();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("同步会话关闭");
        writeCoordinator.close();
        pollScheduler.close();
        pushChannel.close();
        timer.close();
        store.clear();
        mode = SyncMode.STOPPED;
    }

    public boolean isRunning() {
        return started.get() && !closed.get();
    }

    public SyncMode getMode() {
        return mode;
    }

    public ConnectionStatus getConnectionStatus() {
        return pushChannel.getStatus();
    }

    public DeviceStore getStore() {
        return store;
    }

    public OptimisticWriteCoordinator getWriteCoordinator() {
        return writeCoordinator;
    }

    public PushChannelManager getPushChannel() {
        return pushChannel;
    }

    public PollScheduler getPollScheduler() {
        return pollScheduler;
    }

    public DiagnosticBus getDiagnosticBus() {
        return diagnosticBus;
    }

    public DiagnosticRecorder getDiagnosticRecorder() {
        return diagnosticRecorder;
    }

    public Map<String, Object> getStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("running", isRunning());
        status.put("mode", mode.name());
        status.put("connectionStatus", pushChannel.getStatus().name());
        status.put("store", store.getStatistics());
        status.put("push", pushChannel.getStatistics());
        status.put("poll", pollScheduler.getStatistics());
        status.put("write", writeCoordinator.getStatistics());
        status.put("diagnostics", diagnosticRecorder.getCounts());
        return status;
    }

    private void refreshMode() {
        SyncMode next = SyncMode.resolve(isRunning(), pushChannel.getStatus(), store.hasPendingWrites());
        SyncMode previous = mode;
        if (previous != next) {
            mode = next;
            log.info("同步模式变化: {} -> {}", previous, next);
        }
    }
}
