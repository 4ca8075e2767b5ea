package com.wangbin.homesync.core.schedule;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 基于共享 {@link ScheduledExecutorService} 的定时器。
 * <p>
 * 线程池由容器管理，本类只跟踪自己提交的任务；关闭时取消这些任务，不关闭线程池。
 */
@Slf4j
public class ExecutorSyncTimer implements SyncTimer {

    private final ScheduledExecutorService scheduler;
    private final Set<ExecutorTask> tasks = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public ExecutorSyncTimer(ScheduledExecutorService scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public TimerHandle schedule(String name, Runnable task, long delayMs) {
        ExecutorTask handle = new ExecutorTask(name, task);
        if (closed.get()) {
            handle.cancelled = true;
            return handle;
        }
        tasks.add(handle);
        try {
            handle.future = scheduler.schedule(handle, Math.max(0, delayMs), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("定时任务提交被拒绝: {}", name);
            tasks.remove(handle);
            handle.cancelled = true;
            return handle;
        }
        // 提交与关闭并发时补一次取消
        if (closed.get()) {
            handle.cancel();
        }
        return handle;
    }

    @Override
    public long currentTimeMillis() {
        return System.currentTimeMillis();
    }

    @Override
    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        List<ExecutorTask> snapshot = new ArrayList<>(tasks);
        snapshot.forEach(ExecutorTask::cancel);
        tasks.clear();
        log.debug("定时器已关闭，取消 {} 个任务", snapshot.size());
    }

    int pendingTaskCount() {
        return tasks.size();
    }

    private final class ExecutorTask implements Runnable, TimerHandle {

        private final String name;
        private final Runnable task;
        private volatile ScheduledFuture<?> future;
        private volatile boolean cancelled;
        private volatile boolean done;

        private ExecutorTask(String name, Runnable task) {
            this.name = name;
            this.task = task;
        }

        @Override
        public void run() {
            tasks.remove(this);
            if (cancelled || closed.get()) {
                return;
            }
            try {
                task.run();
            } catch (Exception e) {
                log.error("定时任务执行异常: {}", name, e);
            } finally {
                done = true;
            }
        }

        @Override
        public boolean cancel() {
            if (cancelled || done) {
                return false;
            }
            cancelled = true;
            tasks.remove(this);
            ScheduledFuture<?> f = future;
            if (f != null) {
                f.cancel(false);
            }
            return true;
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }

        @Override
        public boolean isDone() {
            return done || cancelled;
        }
    }
}
