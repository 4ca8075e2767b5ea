package com.wangbin.homesync.core.channel.transport;

/**
 * 通道事件回调，可能在任意线程上调用
 */
public interface TransportListener {

    /**
     * 收到一帧完整文本
     */
    void onText(String text);

    /**
     * 收到传输层 ping，应答由传输层完成
     */
    void onPing();

    void onError(Throwable error);

    void onClose(int statusCode, String reason);
}
