package com.wangbin.homesync.core.write;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONWriter;
import com.wangbin.homesync.common.exception.SyncException;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * 通过网关 HTTP 接口写入设备属性。
 * <p>
 * POST 方式以 JSON 请求体发送属性；GET 方式把 JSON 放在 state 查询参数中（兼容旧网关）。
 */
@Slf4j
public class HttpDeviceWriteClient implements DeviceWriteClient {

    private static final String DEVICE_ID_PLACEHOLDER = "{deviceId}";

    private final HttpClient httpClient;
    private final String baseUrl;
    private final String setPath;
    private final String refreshPath;
    private final boolean useGet;
    private final long requestTimeoutMs;

    public HttpDeviceWriteClient(HttpClient httpClient, String baseUrl, String setPath, String refreshPath,
                                 String method, long requestTimeoutMs) {
        this.httpClient = httpClient;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.setPath = setPath;
        this.refreshPath = refreshPath;
        this.useGet = "GET".equalsIgnoreCase(method);
        this.requestTimeoutMs = requestTimeoutMs;
    }

    @Override
    public CompletableFuture<Void> write(String deviceId, Map<String, Object> properties) {
        String body = JSON.toJSONString(properties, JSONWriter.Feature.WriteMapNullValue);
        HttpRequest request;
        try {
            String url = resolve(setPath, deviceId);
            HttpRequest.Builder builder = HttpRequest.newBuilder()
                    .timeout(Duration.ofMillis(requestTimeoutMs));
            if (useGet) {
                builder.uri(URI.create(url + "?state=" + URLEncoder.encode(body, StandardCharsets.UTF_8))).GET();
            } else {
                builder.uri(URI.create(url))
                        .header("Content-Type", "application/json")
                        .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
            }
            request = builder.build();
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(SyncException.writeError("写入地址非法: " + e.getMessage(), deviceId, e));
        }
        log.debug("写入设备属性: {} -> {}", deviceId, body);
        return send(request, deviceId, "设备写入失败");
    }

    @Override
    public CompletableFuture<Void> requestRefresh(String deviceId) {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(URI.create(resolve(refreshPath, deviceId)))
                    .timeout(Duration.ofMillis(requestTimeoutMs))
                    .POST(HttpRequest.BodyPublishers.noBody())
                    .build();
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(SyncException.writeError("刷新地址非法: " + e.getMessage(), deviceId, e));
        }
        log.debug("请求网关刷新设备状态: {}", deviceId);
        return send(request, deviceId, "设备刷新请求失败");
    }

    private CompletableFuture<Void> send(HttpRequest request, String deviceId, String failureMessage) {
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.discarding())
                .handle((response, error) -> {
                    if (error != null) {
                        throw SyncException.writeError(failureMessage + ": " + error.getMessage(), deviceId, error);
                    }
                    if (response.statusCode() < 200 || response.statusCode() >= 300) {
                        throw SyncException.writeError(failureMessage + ": 状态码 " + response.statusCode(),
                                deviceId, null);
                    }
                    return null;
                });
    }

    String resolve(String pathTemplate, String deviceId) {
        String encoded = URLEncoder.encode(deviceId, StandardCharsets.UTF_8).replace("+", "%20");
        String path = pathTemplate.replace(DEVICE_ID_PLACEHOLDER, encoded);
        return path.startsWith("/") ? baseUrl + path : baseUrl + "/" + path;
    }
}
