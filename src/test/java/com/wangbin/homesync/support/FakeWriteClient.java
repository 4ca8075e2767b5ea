package com.wangbin.homesync.support;

import com.wangbin.homesync.core.write.DeviceWriteClient;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * 记录写入请求，由测试决定每个请求的结果
 */
public class FakeWriteClient implements DeviceWriteClient {

    public record WriteCall(String deviceId, Map<String, Object> properties, CompletableFuture<Void> future) {
    }

    private final List<WriteCall> writes = new ArrayList<>();
    private final List<String> refreshes = new ArrayList<>();
    private final List<CompletableFuture<Void>> heldRefreshes = new ArrayList<>();
    private boolean holdRefreshes;

    @Override
    public synchronized CompletableFuture<Void> write(String deviceId, Map<String, Object> properties) {
        WriteCall call = new WriteCall(deviceId, new LinkedHashMap<>(properties), new CompletableFuture<>());
        writes.add(call);
        return call.future();
    }

    @Override
    public synchronized CompletableFuture<Void> requestRefresh(String deviceId) {
        refreshes.add(deviceId);
        if (holdRefreshes) {
            CompletableFuture<Void> held = new CompletableFuture<>();
            heldRefreshes.add(held);
            return held;
        }
        return CompletableFuture.completedFuture(null);
    }

    /**
     * 之后的刷新请求不再自动完成
     */
    public synchronized void holdRefreshes() {
        holdRefreshes = true;
    }

    public synchronized List<CompletableFuture<Void>> heldRefreshes() {
        return new ArrayList<>(heldRefreshes);
    }

    public synchronized List<WriteCall> writes() {
        return new ArrayList<>(writes);
    }

    public synchronized WriteCall write(int index) {
        return writes.get(index);
    }

    public synchronized int writeCount() {
        return writes.size();
    }

    public synchronized List<String> refreshes() {
        return new ArrayList<>(refreshes);
    }
}
