package com.wangbin.homesync.core.channel;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONObject;
import com.wangbin.homesync.common.domain.entity.DevicePatch;
import com.wangbin.homesync.common.domain.enums.ConnectionStatus;
import com.wangbin.homesync.core.codec.MessageCodec;
import com.wangbin.homesync.core.diagnostic.DiagnosticRecorder;
import com.wangbin.homesync.core.diagnostic.DiagnosticType;
import com.wangbin.homesync.support.FakeDuplexTransport;
import com.wangbin.homesync.support.ManualSyncTimer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PushChannelManagerTest {

    private static final String DEVICE_UPDATE =
            "{\"type\":\"device_update\",\"device_name\":\"lamp\",\"state\":{\"state\":\"ON\"},\"timestamp\":\"t\"}";

    private ManualSyncTimer timer;
    private FakeDuplexTransport transport;
    private DiagnosticRecorder recorder;
    private List<DevicePatch> patches;
    private List<ConnectionStatus> states;
    private PushChannelManager manager;

    @BeforeEach
    void setUp() {
        timer = new ManualSyncTimer();
        transport = new FakeDuplexTransport();
        recorder = new DiagnosticRecorder(100);
        patches = new ArrayList<>();
        states = new ArrayList<>();
        manager = new PushChannelManager("ws://gateway/ws", transport, new MessageCodec(), timer,
                new ReconnectPolicy(2000, 30000, 5, 120000), 10000, recorder, patches::add);
        manager.addStateListener((previous, current) -> states.add(current));
    }

    @Test
    void firstFrameMarksConnectedAndForwardsPatch() {
        manager.connect();
        assertEquals(ConnectionStatus.CONNECTING, manager.getStatus());

        transport.last().completeOpen();
        assertEquals(ConnectionStatus.CONNECTING, manager.getStatus());

        transport.last().receive(DEVICE_UPDATE);
        assertEquals(ConnectionStatus.CONNECTED, manager.getStatus());
        assertEquals(1, patches.size());
        assertEquals("lamp", patches.get(0).deviceId());
        assertEquals(0, timer.pendingCount("push-connect-timeout"));
    }

    @Test
    void transportPingAlsoMarksConnected() {
        manager.connect();
        transport.last().completeOpen().ping();
        assertEquals(ConnectionStatus.CONNECTED, manager.getStatus());
    }

    @Test
    void connectIsNoopWhileActive() {
        manager.connect();
        manager.connect();
        assertEquals(1, transport.openCount());

        transport.last().completeOpen().ping();
        manager.connect();
        assertEquals(1, transport.openCount());
    }

    @Test
    void closeAfterConnectedSchedulesExactlyOneReconnect() {
        manager.connect();
        FakeDuplexTransport.Connection connection = transport.last().completeOpen();
        connection.ping();

        connection.error(new IOException("reset"));
        connection.remoteClose(1006, "abnormal");

        assertEquals(List.of(ConnectionStatus.CONNECTING, ConnectionStatus.CONNECTED,
                ConnectionStatus.DISCONNECTED, ConnectionStatus.RECONNECTING), states);
        assertEquals(1, timer.pendingCount("push-reconnect"));
        assertEquals(2000, timer.delayOf("push-reconnect"));
        assertTrue(connection.isClosed());

        timer.advance(2000);
        assertEquals(2, transport.openCount());
        assertEquals(ConnectionStatus.CONNECTING, manager.getStatus());
    }

    @Test
    void staleSessionCallbacksAreIgnored() {
        manager.connect();
        FakeDuplexTransport.Connection first = transport.last().completeOpen();
        first.ping();
        first.remoteClose(1000, "bye");
        timer.advance(2000);

        FakeDuplexTransport.Connection second = transport.last().completeOpen();
        second.ping();
        assertEquals(ConnectionStatus.CONNECTED, manager.getStatus());

        first.error(new IOException("late"));
        first.receive(DEVICE_UPDATE);
        assertEquals(ConnectionStatus.CONNECTED, manager.getStatus());
        assertTrue(patches.isEmpty());
        assertEquals(0, timer.pendingCount("push-reconnect"));
    }

    @Test
    void backoffGrowsThenEntersFailedMode() {
        manager.connect();
        long[] expected = {2000, 4000, 8000, 16000, 30000};
        for (long delay : expected) {
            transport.last().failOpen(new IOException("refused"));
            assertEquals(ConnectionStatus.RECONNECTING, manager.getStatus());
            assertEquals(delay, timer.delayOf("push-reconnect"));
            timer.advance(delay);
        }

        transport.last().failOpen(new IOException("refused"));
        assertEquals(ConnectionStatus.FAILED, manager.getStatus());
        assertEquals(120000, timer.delayOf("push-reconnect"));
        assertEquals(6, manager.getFailureCount());
        assertEquals(6, recorder.getCount(DiagnosticType.TRANSPORT_ERROR));

        // 长间隔重试仍然会连接，成功后计数清零
        timer.advance(120000);
        transport.last().completeOpen().ping();
        assertEquals(ConnectionStatus.CONNECTED, manager.getStatus());
        assertEquals(0, manager.getFailureCount());
    }

    @Test
    void connectTimeoutCountsAsFailure() {
        manager.connect();
        FakeDuplexTransport.Connection pending = transport.last();
        timer.advance(10000);

        assertEquals(ConnectionStatus.RECONNECTING, manager.getStatus());
        assertEquals(1, manager.getFailureCount());

        // 超时之后才完成的握手属于旧会话，直接关闭
        pending.completeOpen();
        assertTrue(pending.isClosed());
        assertEquals(ConnectionStatus.RECONNECTING, manager.getStatus());
    }

    @Test
    void openedQuietSessionIsNotTimedOut() {
        manager.connect();
        FakeDuplexTransport.Connection connection = transport.last().completeOpen();
        assertEquals(0, timer.pendingCount("push-connect-timeout"));

        timer.advance(60000);
        assertEquals(ConnectionStatus.CONNECTING, manager.getStatus());
        assertEquals(1, transport.openCount());
        assertEquals(0, manager.getFailureCount());
        assertFalse(connection.isClosed());

        connection.ping();
        assertEquals(ConnectionStatus.CONNECTED, manager.getStatus());
    }

    @Test
    void disconnectSuppressesReconnectUntilConnect() {
        manager.connect();
        FakeDuplexTransport.Connection connection = transport.last().completeOpen();
        connection.ping();

        manager.disconnect();
        assertEquals(ConnectionStatus.DISCONNECTED, manager.getStatus());
        assertTrue(connection.isClosed());

        connection.remoteClose(1000, "closed");
        timer.advance(300000);
        assertEquals(1, transport.openCount());
        assertEquals(0, timer.pendingCount());

        manager.connect();
        assertEquals(2, transport.openCount());
    }

    @Test
    void disconnectCancelsPendingReconnect() {
        manager.connect();
        transport.last().failOpen(new IOException("refused"));
        assertEquals(1, timer.pendingCount("push-reconnect"));

        manager.disconnect();
        assertEquals(0, timer.pendingCount());
        timer.advance(60000);
        assertEquals(1, transport.openCount());
    }

    @Test
    void restartResetsCounterAndConnectsImmediately() {
        manager.connect();
        transport.last().failOpen(new IOException("refused"));
        timer.advance(2000);
        transport.last().failOpen(new IOException("refused"));
        assertEquals(2, manager.getFailureCount());

        manager.restart();
        assertEquals(0, manager.getFailureCount());
        assertEquals(3, transport.openCount());
        assertEquals(ConnectionStatus.CONNECTING, manager.getStatus());
        assertEquals(0, timer.pendingCount("push-reconnect"));
    }

    @Test
    void answersJsonPingWithPong() {
        manager.connect();
        FakeDuplexTransport.Connection connection = transport.last().completeOpen();
        connection.receive("{\"type\":\"ping\"}");

        assertEquals(ConnectionStatus.CONNECTED, manager.getStatus());
        assertEquals(1, connection.sent().size());
        JSONObject pong = JSON.parseObject(connection.sent().get(0));
        assertEquals("pong", pong.getString("type"));
        assertEquals(timer.currentTimeMillis(), pong.getLongValue("timestamp"));
    }

    @Test
    void malformedFrameIsDroppedWithDiagnostic() {
        manager.connect();
        FakeDuplexTransport.Connection connection = transport.last().completeOpen();
        connection.receive("{\"type\":\"device_update\",");

        assertEquals(ConnectionStatus.CONNECTING, manager.getStatus());
        assertEquals(1, recorder.getCount(DiagnosticType.PROTOCOL_ERROR));

        connection.receive("{\"type\":\"bridge_state\"}");
        assertEquals(ConnectionStatus.CONNECTED, manager.getStatus());
        assertEquals(1, recorder.getCount(DiagnosticType.UNKNOWN_MESSAGE));
        assertTrue(patches.isEmpty());
    }

    @Test
    void closeStopsEverything() {
        manager.connect();
        transport.last().failOpen(new IOException("refused"));
        manager.close();

        assertEquals(0, timer.pendingCount());
        manager.connect();
        manager.restart();
        assertEquals(1, transport.openCount());
    }
}
