package com.wangbin.homesync.core.channel.transport;

import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 基于 JDK {@link WebSocket} 的通道实现。
 * <p>
 * 分片的文本帧在监听器内拼接完整后再回调；传输层 ping 由 JDK 自动回复 pong。
 */
@Slf4j
public class WebSocketDuplexTransport implements DuplexTransport {

    private static final int NORMAL_CLOSURE = 1000;

    private final HttpClient httpClient;
    private final long connectTimeoutMs;

    public WebSocketDuplexTransport(HttpClient httpClient, long connectTimeoutMs) {
        this.httpClient = httpClient;
        this.connectTimeoutMs = connectTimeoutMs;
    }

    @Override
    public CompletableFuture<TransportSession> open(String url, TransportListener listener) {
        log.info("开始连接WebSocket: {}", url);
        ListenerBridge bridge = new ListenerBridge(url, listener);
        try {
            return httpClient.newWebSocketBuilder()
                    .connectTimeout(Duration.ofMillis(connectTimeoutMs))
                    .buildAsync(URI.create(url), bridge)
                    .thenApply(WebSocketSession::new);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * JDK 监听器到 {@link TransportListener} 的转换
     */
    private static final class ListenerBridge implements WebSocket.Listener {

        private final String url;
        private final TransportListener listener;
        private final StringBuilder textBuffer = new StringBuilder();

        private ListenerBridge(String url, TransportListener listener) {
            this.url = url;
            this.listener = listener;
        }

        @Override
        public void onOpen(WebSocket webSocket) {
            log.info("WebSocket连接已打开: {}", url);
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            textBuffer.append(data);
            if (last) {
                String text = textBuffer.toString();
                textBuffer.setLength(0);
                log.debug("收到WebSocket文本消息: {} chars", text.length());
                listener.onText(text);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onBinary(WebSocket webSocket, ByteBuffer data, boolean last) {
            log.debug("忽略WebSocket二进制消息: {} bytes", data.remaining());
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onPing(WebSocket webSocket, ByteBuffer message) {
            listener.onPing();
            webSocket.request(1);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            log.warn("WebSocket发生错误: {} - {}", url, error.getMessage());
            listener.onError(error);
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            log.info("WebSocket连接关闭: {} (状态码: {}, 原因: {})", url, statusCode, reason);
            listener.onClose(statusCode, reason);
            return null;
        }
    }

    private static final class WebSocketSession implements TransportSession {

        private final WebSocket webSocket;
        private final AtomicBoolean closing = new AtomicBoolean(false);
        // JDK WebSocket 不允许并发发送，后一帧等待前一帧完成
        private CompletableFuture<WebSocket> sendChain;

        private WebSocketSession(WebSocket webSocket) {
            this.webSocket = webSocket;
            this.sendChain = CompletableFuture.completedFuture(webSocket);
        }

        @Override
        public synchronized CompletableFuture<Void> sendText(String text) {
            if (!isOpen()) {
                return CompletableFuture.failedFuture(new IllegalStateException("WebSocket连接未激活"));
            }
            CompletableFuture<WebSocket> next = sendChain
                    .exceptionally(e -> webSocket)
                    .thenCompose(ws -> ws.sendText(text, true));
            sendChain = next;
            return next.thenApply(ws -> null);
        }

        @Override
        public void close() {
            if (!closing.compareAndSet(false, true)) {
                return;
            }
            if (webSocket.isOutputClosed()) {
                webSocket.abort();
                return;
            }
            webSocket.sendClose(NORMAL_CLOSURE, "Normal closure")
                    .orTimeout(3, TimeUnit.SECONDS)
                    .whenComplete((ws, e) -> {
                        if (e != null) {
                            log.debug("WebSocket关闭帧发送失败，直接中止: {}", e.getMessage());
                            webSocket.abort();
                        }
                    });
        }

        @Override
        public boolean isOpen() {
            return !closing.get() && !webSocket.isOutputClosed() && !webSocket.isInputClosed();
        }
    }
}
