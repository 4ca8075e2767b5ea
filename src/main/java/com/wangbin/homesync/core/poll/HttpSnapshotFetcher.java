package com.wangbin.homesync.core.poll;

import com.wangbin.homesync.common.domain.entity.DeviceEntity;
import com.wangbin.homesync.common.exception.SyncException;
import com.wangbin.homesync.core.codec.DeviceJsonMapper;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 通过网关 HTTP 接口拉取设备列表
 */
@Slf4j
public class HttpSnapshotFetcher implements SnapshotFetcher {

    private final HttpClient httpClient;
    private final DeviceJsonMapper mapper;
    private final String listUrl;
    private final long requestTimeoutMs;

    public HttpSnapshotFetcher(HttpClient httpClient, DeviceJsonMapper mapper,
                               String baseUrl, String listPath, long requestTimeoutMs) {
        this.httpClient = httpClient;
        this.mapper = mapper;
        this.listUrl = joinUrl(baseUrl, listPath);
        this.requestTimeoutMs = requestTimeoutMs;
    }

    @Override
    public CompletableFuture<List<DeviceEntity>> fetchAll() {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(URI.create(listUrl))
                    .timeout(Duration.ofMillis(requestTimeoutMs))
                    .header("Accept", "application/json")
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(SyncException.fetchError("快照地址非法: " + listUrl, e));
        }
        log.debug("拉取设备快照: {}", listUrl);
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .handle((response, error) -> {
                    if (error != null) {
                        throw SyncException.fetchError("快照请求失败: " + rootMessage(error), error);
                    }
                    if (response.statusCode() < 200 || response.statusCode() >= 300) {
                        throw SyncException.fetchError("快照请求失败: 状态码 " + response.statusCode(), null);
                    }
                    try {
                        return mapper.parseDeviceList(response.body());
                    } catch (SyncException e) {
                        throw SyncException.fetchError("快照解析失败: " + e.getMessage(), e);
                    }
                });
    }

    public String getListUrl() {
        return listUrl;
    }

    static String joinUrl(String baseUrl, String path) {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        if (path == null || path.isEmpty()) {
            return base;
        }
        return path.startsWith("/") ? base + path : base + "/" + path;
    }

    private static String rootMessage(Throwable error) {
        Throwable cause = error;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
