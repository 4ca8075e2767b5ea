package com.wangbin.homesync.core.channel;

import com.wangbin.homesync.common.domain.entity.DevicePatch;
import com.wangbin.homesync.common.domain.enums.ConnectionStatus;
import com.wangbin.homesync.common.domain.enums.SyncErrorType;
import com.wangbin.homesync.common.exception.SyncException;
import com.wangbin.homesync.core.channel.transport.DuplexTransport;
import com.wangbin.homesync.core.channel.transport.TransportListener;
import com.wangbin.homesync.core.channel.transport.TransportSession;
import com.wangbin.homesync.core.codec.MessageCodec;
import com.wangbin.homesync.core.codec.PushMessage;
import com.wangbin.homesync.core.diagnostic.DiagnosticListener;
import com.wangbin.homesync.core.diagnostic.DiagnosticType;
import com.wangbin.homesync.core.diagnostic.SyncDiagnostic;
import com.wangbin.homesync.core.schedule.SyncTimer;
import com.wangbin.homesync.core.schedule.TimerHandle;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * 推送通道管理器。
 * <p>
 * 维护连接状态机：连接、连接超时、断线后自动重连（指数退避，连续失败过多后长间隔重试），
 * 以及服务端驱动的心跳应答。收到的设备增量交给增量接收方。
 * <p>
 * 对调用方不抛出任何异常，失败一律转换为状态迁移和诊断事件。
 * 每次建立连接都会递增会话纪元，旧会话的迟到回调直接忽略。
 */
@Slf4j
public class PushChannelManager implements AutoCloseable {

    private static final String SOURCE = "PushChannel";

    private final String url;
    private final DuplexTransport transport;
    private final MessageCodec codec;
    private final SyncTimer timer;
    private final ReconnectPolicy reconnectPolicy;
    private final long connectTimeoutMs;
    private final DiagnosticListener diagnostics;
    private final Consumer<DevicePatch> patchSink;
    private final List<ConnectionStateListener> stateListeners = new CopyOnWriteArrayList<>();

    private final Object lock = new Object();
    private volatile ConnectionStatus status = ConnectionStatus.DISCONNECTED;
    private volatile long epoch;
    // 以下字段仅在 lock 内访问
    private int failureCount;
    private boolean manualDisconnect;
    private boolean closed;
    private TransportSession session;
    private TimerHandle connectTimeoutHandle;
    private TimerHandle reconnectHandle;

    // 统计信息
    private final AtomicLong framesReceived = new AtomicLong(0);
    private final AtomicLong patchesReceived = new AtomicLong(0);
    private final AtomicLong pingsAnswered = new AtomicLong(0);
    private final AtomicLong protocolErrors = new AtomicLong(0);
    private final AtomicLong transportErrors = new AtomicLong(0);
    private final AtomicLong reconnectsScheduled = new AtomicLong(0);
    private volatile long lastConnectedTime;
    private volatile long lastFrameTime;

    public PushChannelManager(String url,
                              DuplexTransport transport,
                              MessageCodec codec,
                              SyncTimer timer,
                              ReconnectPolicy reconnectPolicy,
                              long connectTimeoutMs,
                              DiagnosticListener diagnostics,
                              Consumer<DevicePatch> patchSink) {
        this.url = url;
        this.transport = transport;
        this.codec = codec;
        this.timer = timer;
        this.reconnectPolicy = reconnectPolicy;
        this.connectTimeoutMs = connectTimeoutMs;
        this.diagnostics = diagnostics != null ? diagnostics : DiagnosticListener.NOOP;
        this.patchSink = patchSink != null ? patchSink : patch -> { };
    }

    // ========== 对外操作 ==========

    /**
     * 建立连接。正在连接或已连接时无操作；会清除手动断开标记并取消待执行的重连。
     */
    public void connect() {
        List<Transition> transitions = new ArrayList<>();
        long sessionEpoch;
        synchronized (lock) {
            if (closed) {
                log.debug("推送通道已关闭，忽略连接请求");
                return;
            }
            if (status.isActive()) {
                log.debug("推送通道正在连接或已连接，忽略连接请求: {}", status);
                return;
            }
            manualDisconnect = false;
            cancel(reconnectHandle);
            reconnectHandle = null;
            sessionEpoch = ++epoch;
            transition(ConnectionStatus.CONNECTING, transitions);
            connectTimeoutHandle = timer.schedule("push-connect-timeout",
                    () -> onConnectTimeout(sessionEpoch), connectTimeoutMs);
        }
        fireTransitions(transitions);
        log.info("开始连接推送通道: {}", url);

        CompletableFuture<TransportSession> future;
        try {
            future = transport.open(url, new SessionListener(sessionEpoch));
        } catch (Exception e) {
            handleFailure(sessionEpoch, SyncException.transportError("推送通道打开失败: " + e.getMessage(), e));
            return;
        }
        future.whenComplete((opened, error) -> onOpened(sessionEpoch, opened, error));
    }

    /**
     * 重置失败计数，未连接时立即连接
     */
    public void restart() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            failureCount = 0;
            manualDisconnect = false;
            if (status.isActive()) {
                log.debug("推送通道正在连接或已连接，仅重置失败计数");
                return;
            }
        }
        log.info("重启推送通道: {}", url);
        connect();
    }

    /**
     * 主动断开，不会自动重连，直到再次调用 {@link #connect()}
     */
    public void disconnect() {
        List<Transition> transitions = new ArrayList<>();
        TransportSession toClose;
        synchronized (lock) {
            manualDisconnect = true;
            epoch++;
            cancel(connectTimeoutHandle);
            cancel(reconnectHandle);
            connectTimeoutHandle = null;
            reconnectHandle = null;
            toClose = session;
            session = null;
            if (status != ConnectionStatus.DISCONNECTED) {
                transition(ConnectionStatus.DISCONNECTED, transitions);
            }
        }
        closeQuietly(toClose);
        fireTransitions(transitions);
        log.info("推送通道已断开: {}", url);
    }

    /**
     * 断开并释放，之后所有操作无效果
     */
    @Override
    public void close() {
        disconnect();
        synchronized (lock) {
            closed = true;
        }
        stateListeners.clear();
    }

    public ConnectionStatus getStatus() {
        return status;
    }

    public boolean isConnected() {
        return status.isConnected();
    }

    public int getFailureCount() {
        synchronized (lock) {
            return failureCount;
        }
    }

    public void addStateListener(ConnectionStateListener listener) {
        if (listener != null) {
            stateListeners.add(listener);
        }
    }

    public void removeStateListener(ConnectionStateListener listener) {
        stateListeners.remove(listener);
    }

    public Map<String, Object> getStatistics() {
        Map<String, Object> statistics = new LinkedHashMap<>();
        statistics.put("url", url);
        statistics.put("status", status.name());
        statistics.put("failureCount", getFailureCount());
        statistics.put("framesReceived", framesReceived.get());
        statistics.put("patchesReceived", patchesReceived.get());
        statistics.put("pingsAnswered", pingsAnswered.get());
        statistics.put("protocolErrors", protocolErrors.get());
        statistics.put("transportErrors", transportErrors.get());
        statistics.put("reconnectsScheduled", reconnectsScheduled.get());
        statistics.put("lastConnectedTime", lastConnectedTime);
        statistics.put("lastFrameTime", lastFrameTime);
        return statistics;
    }

    // ========== 通道事件 ==========

    private void onOpened(long sessionEpoch, TransportSession opened, Throwable error) {
        if (error != null) {
            handleFailure(sessionEpoch, SyncException.unwrap(error, SyncErrorType.TRANSPORT, null));
            return;
        }
        boolean stale;
        synchronized (lock) {
            stale = sessionEpoch != epoch;
            if (!stale) {
                session = opened;
                // 连接超时只限制握手，网关空闲时可能很久才发首帧
                cancel(connectTimeoutHandle);
                connectTimeoutHandle = null;
            }
        }
        if (stale) {
            log.debug("丢弃过期的推送通道会话");
            closeQuietly(opened);
        } else {
            log.debug("推送通道握手完成，等待首帧: {}", url);
        }
    }

    private void onFrame(long sessionEpoch, String text) {
        if (sessionEpoch != epoch) {
            return;
        }
        framesReceived.incrementAndGet();
        lastFrameTime = timer.currentTimeMillis();

        Optional<PushMessage> decoded;
        try {
            decoded = codec.decode(text);
        } catch (SyncException e) {
            protocolErrors.incrementAndGet();
            log.warn("丢弃格式错误的推送帧: {}", e.getMessage());
            diagnostics.onDiagnostic(SyncDiagnostic.fromException(SOURCE, e));
            return;
        }
        markAlive(sessionEpoch);

        if (decoded.isEmpty()) {
            String type = codec.peekType(text);
            log.debug("忽略未知类型的推送帧: {}", type);
            diagnostics.onDiagnostic(SyncDiagnostic.of(DiagnosticType.UNKNOWN_MESSAGE, SOURCE, null,
                    "未知消息类型: " + type));
            return;
        }

        PushMessage message = decoded.get();
        if (message instanceof PushMessage.DeviceUpdate update) {
            patchesReceived.incrementAndGet();
            try {
                patchSink.accept(update.patch());
            } catch (Exception e) {
                log.error("设备增量处理失败: {}", update.patch().deviceId(), e);
            }
        } else if (message instanceof PushMessage.Ping) {
            answerPing(sessionEpoch);
        } else {
            log.debug("收到{}: {}", message.type().getDescription(), message);
        }
    }

    private void answerPing(long sessionEpoch) {
        TransportSession current;
        synchronized (lock) {
            current = sessionEpoch == epoch ? session : null;
        }
        if (current == null) {
            return;
        }
        String pong = codec.encodePong(timer.currentTimeMillis());
        current.sendText(pong).whenComplete((ignored, error) -> {
            if (error != null) {
                log.warn("心跳应答发送失败: {}", error.getMessage());
            } else {
                pingsAnswered.incrementAndGet();
            }
        });
    }

    /**
     * 收到首个有效帧或传输层 ping 后视为连接成功
     */
    private void markAlive(long sessionEpoch) {
        List<Transition> transitions = new ArrayList<>();
        synchronized (lock) {
            if (sessionEpoch != epoch || status != ConnectionStatus.CONNECTING) {
                return;
            }
            cancel(connectTimeoutHandle);
            connectTimeoutHandle = null;
            failureCount = 0;
            lastConnectedTime = timer.currentTimeMillis();
            transition(ConnectionStatus.CONNECTED, transitions);
        }
        log.info("推送通道连接成功: {}", url);
        fireTransitions(transitions);
    }

    private void onConnectTimeout(long sessionEpoch) {
        handleFailure(sessionEpoch,
                SyncException.transportError("推送通道连接超时(" + connectTimeoutMs + "ms)", null));
    }

    /**
     * 连接失败、错误、关闭、超时的统一处理：先进入 DISCONNECTED，再安排一次重连
     */
    private void handleFailure(long sessionEpoch, SyncException cause) {
        List<Transition> transitions = new ArrayList<>();
        TransportSession toClose;
        long delay = -1;
        int failures;
        synchronized (lock) {
            if (sessionEpoch != epoch || !status.isActive()) {
                return;
            }
            epoch++;
            cancel(connectTimeoutHandle);
            connectTimeoutHandle = null;
            toClose = session;
            session = null;
            failures = ++failureCount;
            transition(ConnectionStatus.DISCONNECTED, transitions);

            if (!manualDisconnect && !closed) {
                delay = reconnectPolicy.nextDelay(failureCount);
                transition(reconnectPolicy.isLongInterval(failureCount)
                        ? ConnectionStatus.FAILED
                        : ConnectionStatus.RECONNECTING, transitions);
                cancel(reconnectHandle);
                reconnectHandle = timer.schedule("push-reconnect", this::reconnectFromTimer, delay);
                reconnectsScheduled.incrementAndGet();
            }
        }
        closeQuietly(toClose);
        if (cause != null) {
            transportErrors.incrementAndGet();
            log.warn("推送通道断开: {} (连续失败 {} 次)", cause.getMessage(), failures);
            diagnostics.onDiagnostic(SyncDiagnostic.fromException(SOURCE, cause));
        }
        if (delay >= 0) {
            log.info("等待 {} 毫秒后重连推送通道: {}", delay, url);
        }
        fireTransitions(transitions);
    }

    private void onRemoteClose(long sessionEpoch, int statusCode, String reason) {
        handleFailure(sessionEpoch, SyncException.transportError(
                "推送通道被关闭 (状态码: " + statusCode + ", 原因: " + reason + ")", null));
    }

    private void reconnectFromTimer() {
        synchronized (lock) {
            reconnectHandle = null;
            if (manualDisconnect || closed) {
                return;
            }
        }
        connect();
    }

    // ========== 内部方法 ==========

    // lock 内调用
    private void transition(ConnectionStatus next, List<Transition> transitions) {
        ConnectionStatus previous = status;
        if (previous == next) {
            return;
        }
        status = next;
        transitions.add(new Transition(previous, next));
    }

    private void fireTransitions(List<Transition> transitions) {
        for (Transition t : transitions) {
            log.debug("推送通道状态变化: {} -> {}", t.previous(), t.current());
            diagnostics.onDiagnostic(SyncDiagnostic.of(DiagnosticType.CONNECTION_STATE, SOURCE, null,
                    t.previous().name() + " -> " + t.current().name()));
            for (ConnectionStateListener listener : stateListeners) {
                try {
                    listener.onStateChanged(t.previous(), t.current());
                } catch (Exception e) {
                    log.warn("连接状态监听器处理失败", e);
                }
            }
        }
    }

    private static void cancel(TimerHandle handle) {
        if (handle != null) {
            handle.cancel();
        }
    }

    private static void closeQuietly(TransportSession session) {
        if (session == null) {
            return;
        }
        try {
            session.close();
        } catch (Exception e) {
            log.debug("关闭推送通道会话异常: {}", e.getMessage());
        }
    }

    private record Transition(ConnectionStatus previous, ConnectionStatus current) {
    }

    /**
     * 绑定到某一会话纪元的通道监听器
     */
    private final class SessionListener implements TransportListener {

        private final long sessionEpoch;

        private SessionListener(long sessionEpoch) {
            this.sessionEpoch = sessionEpoch;
        }

        @Override
        public void onText(String text) {
            onFrame(sessionEpoch, text);
        }

        @Override
        public void onPing() {
            markAlive(sessionEpoch);
        }

        @Override
        public void onError(Throwable error) {
            handleFailure(sessionEpoch, SyncException.transportError("推送通道错误: " + error.getMessage(), error));
        }

        @Override
        public void onClose(int statusCode, String reason) {
            onRemoteClose(sessionEpoch, statusCode, reason);
        }
    }
}
