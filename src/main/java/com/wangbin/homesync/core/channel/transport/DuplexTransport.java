package com.wangbin.homesync.core.channel.transport;

import java.util.concurrent.CompletableFuture;

/**
 * 全双工文本通道
 */
public interface DuplexTransport {

    /**
     * 异步打开通道。握手失败时返回的 future 异常完成，
     * 之后该会话的所有事件通过 listener 回调。
     */
    CompletableFuture<TransportSession> open(String url, TransportListener listener);
}
