package com.wangbin.homesync.core.schedule;

/**
 * 定时任务句柄
 */
public interface TimerHandle {

    /**
     * 取消任务，已执行或已取消时无效果
     *
     * @return 本次调用是否取消了尚未执行的任务
     */
    boolean cancel();

    boolean isCancelled();

    boolean isDone();
}
