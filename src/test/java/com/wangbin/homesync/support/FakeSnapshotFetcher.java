package com.wangbin.homesync.support;

import com.wangbin.homesync.common.domain.entity.DeviceEntity;
import com.wangbin.homesync.core.poll.SnapshotFetcher;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 每次拉取返回一个未完成的 future，由测试决定完成顺序和结果
 */
public class FakeSnapshotFetcher implements SnapshotFetcher {

    private final List<CompletableFuture<List<DeviceEntity>>> requests = new ArrayList<>();

    @Override
    public synchronized CompletableFuture<List<DeviceEntity>> fetchAll() {
        CompletableFuture<List<DeviceEntity>> future = new CompletableFuture<>();
        requests.add(future);
        return future;
    }

    public synchronized int fetchCount() {
        return requests.size();
    }

    public synchronized CompletableFuture<List<DeviceEntity>> request(int index) {
        return requests.get(index);
    }

    public synchronized CompletableFuture<List<DeviceEntity>> lastRequest() {
        return requests.get(requests.size() - 1);
    }

    /**
     * 完成最近一次拉取
     */
    public void respond(List<DeviceEntity> devices) {
        lastRequest().complete(new ArrayList<>(devices));
    }

    public void fail(Throwable error) {
        lastRequest().completeExceptionally(error);
    }
}
