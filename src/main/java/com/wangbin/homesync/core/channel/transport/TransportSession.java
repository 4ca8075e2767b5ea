package com.wangbin.homesync.core.channel.transport;

import java.util.concurrent.CompletableFuture;

/**
 * 已打开的通道会话
 */
public interface TransportSession {

    /**
     * 发送一帧文本，发送按调用顺序串行
     */
    CompletableFuture<Void> sendText(String text);

    /**
     * 关闭会话，重复调用无效果
     */
    void close();

    boolean isOpen();
}
