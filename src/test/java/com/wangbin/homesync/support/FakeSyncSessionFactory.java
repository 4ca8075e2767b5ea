package com.wangbin.homesync.support;

import com.wangbin.homesync.core.config.SyncProperties;
import com.wangbin.homesync.core.sync.SyncSession;
import com.wangbin.homesync.core.sync.SyncSessionFactory;

import java.net.http.HttpClient;

/**
 * 使用假通道、假拉取器和手动定时器创建会话
 */
public class FakeSyncSessionFactory extends SyncSessionFactory {

    private final SyncProperties properties;
    public final ManualSyncTimer timer = new ManualSyncTimer();
    public final FakeDuplexTransport transport = new FakeDuplexTransport();
    public final FakeSnapshotFetcher fetcher = new FakeSnapshotFetcher();
    public final FakeWriteClient writeClient = new FakeWriteClient();

    public FakeSyncSessionFactory(SyncProperties properties) {
        super(properties, HttpClient.newHttpClient(), null);
        this.properties = properties;
    }

    @Override
    public SyncSession create() {
        return new SyncSession(properties, transport, fetcher, writeClient, timer);
    }
}
