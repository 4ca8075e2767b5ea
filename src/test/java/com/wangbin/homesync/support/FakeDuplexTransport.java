package com.wangbin.homesync.support;

import com.wangbin.homesync.core.channel.transport.DuplexTransport;
import com.wangbin.homesync.core.channel.transport.TransportListener;
import com.wangbin.homesync.core.channel.transport.TransportSession;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 记录每次 open 的假通道，测试通过 {@link Connection} 驱动通道事件
 */
public class FakeDuplexTransport implements DuplexTransport {

    private final List<Connection> connections = new ArrayList<>();

    @Override
    public synchronized CompletableFuture<TransportSession> open(String url, TransportListener listener) {
        Connection connection = new Connection(url, listener);
        connections.add(connection);
        return connection.openFuture;
    }

    public synchronized int openCount() {
        return connections.size();
    }

    public synchronized Connection last() {
        return connections.get(connections.size() - 1);
    }

    public synchronized Connection get(int index) {
        return connections.get(index);
    }

    public static final class Connection implements TransportSession {

        private final String url;
        private final TransportListener listener;
        private final CompletableFuture<TransportSession> openFuture = new CompletableFuture<>();
        private final List<String> sent = new ArrayList<>();
        private boolean closed;

        private Connection(String url, TransportListener listener) {
            this.url = url;
            this.listener = listener;
        }

        public Connection completeOpen() {
            openFuture.complete(this);
            return this;
        }

        public void failOpen(Throwable error) {
            openFuture.completeExceptionally(error);
        }

        public void receive(String text) {
            listener.onText(text);
        }

        public void ping() {
            listener.onPing();
        }

        public void error(Throwable error) {
            listener.onError(error);
        }

        public void remoteClose(int statusCode, String reason) {
            listener.onClose(statusCode, reason);
        }

        public synchronized List<String> sent() {
            return new ArrayList<>(sent);
        }

        public String url() {
            return url;
        }

        @Override
        public synchronized CompletableFuture<Void> sendText(String text) {
            if (closed) {
                return CompletableFuture.failedFuture(new IllegalStateException("closed"));
            }
            sent.add(text);
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public synchronized void close() {
            closed = true;
        }

        @Override
        public synchronized boolean isOpen() {
            return !closed;
        }

        public synchronized boolean isClosed() {
            return closed;
        }
    }
}
