package com.wangbin.homesync.core.sync;

import com.wangbin.homesync.core.channel.transport.WebSocketDuplexTransport;
import com.wangbin.homesync.core.codec.DeviceJsonMapper;
import com.wangbin.homesync.core.config.SyncProperties;
import com.wangbin.homesync.core.poll.HttpSnapshotFetcher;
import com.wangbin.homesync.core.schedule.ExecutorSyncTimer;
import com.wangbin.homesync.core.write.HttpDeviceWriteClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.util.concurrent.ScheduledExecutorService;

/**
 * 按当前配置创建同步会话，每次调用返回一个全新的会话
 */
@Component
public class SyncSessionFactory {

    private final SyncProperties properties;
    private final HttpClient httpClient;
    private final ScheduledExecutorService scheduler;

    public SyncSessionFactory(SyncProperties properties,
                              HttpClient gatewayHttpClient,
                              @Qualifier("syncScheduler") ScheduledExecutorService syncScheduler) {
        this.properties = properties;
        this.httpClient = gatewayHttpClient;
        this.scheduler = syncScheduler;
    }

    public SyncSession create() {
        SyncProperties.Poll poll = properties.getPoll();
        SyncProperties.Write write = properties.getWrite();
        return new SyncSession(properties,
                new WebSocketDuplexTransport(httpClient, properties.getPush().getConnectTimeoutMs()),
                new HttpSnapshotFetcher(httpClient, new DeviceJsonMapper(), properties.getZigbeeApiUrl(),
                        poll.getListPath(), poll.getRequestTimeoutMs()),
                new HttpDeviceWriteClient(httpClient, properties.getZigbeeApiUrl(), write.getSetPath(),
                        write.getRefreshPath(), write.getMethod(), write.getRequestTimeoutMs()),
                new ExecutorSyncTimer(scheduler));
    }
}
