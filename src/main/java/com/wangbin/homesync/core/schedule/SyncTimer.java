package com.wangbin.homesync.core.schedule;

/**
 * 同步子系统的定时器抽象。
 * <p>
 * 重连退避、连接超时、轮询和写入防抖都通过它调度，每个任务都可以取消；
 * {@link #close()} 之后不再执行任何任务。
 */
public interface SyncTimer extends AutoCloseable {

    /**
     * 延迟执行一次任务
     *
     * @param name    任务名称，用于日志
     * @param task    任务
     * @param delayMs 延迟（毫秒），小于0按0处理
     * @return 可取消的句柄；定时器已关闭时返回已取消的句柄
     */
    TimerHandle schedule(String name, Runnable task, long delayMs);

    /**
     * 当前时间（毫秒）
     */
    long currentTimeMillis();

    boolean isClosed();

    /**
     * 取消所有未执行的任务并拒绝新任务
     */
    @Override
    void close();
}
