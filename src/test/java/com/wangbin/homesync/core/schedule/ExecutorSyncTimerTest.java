package com.wangbin.homesync.core.schedule;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ExecutorSyncTimerTest {

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    void runsScheduledTask() throws InterruptedException {
        ExecutorSyncTimer timer = new ExecutorSyncTimer(scheduler);
        CountDownLatch latch = new CountDownLatch(1);

        TimerHandle handle = timer.schedule("once", latch::countDown, 10);

        assertTrue(latch.await(2, TimeUnit.SECONDS));
        assertFalse(handle.isCancelled());
    }

    @Test
    void closeCancelsTasksButLeavesPoolRunning() throws InterruptedException {
        ExecutorSyncTimer timer = new ExecutorSyncTimer(scheduler);
        AtomicInteger runs = new AtomicInteger();
        TimerHandle handle = timer.schedule("later", runs::incrementAndGet, 200);
        assertEquals(1, timer.pendingTaskCount());

        timer.close();

        assertTrue(handle.isCancelled());
        assertEquals(0, timer.pendingTaskCount());
        assertTrue(timer.schedule("after-close", runs::incrementAndGet, 0).isCancelled());
        assertFalse(scheduler.isShutdown());

        Thread.sleep(400);
        assertEquals(0, runs.get());
    }

    @Test
    void cancelledTaskDoesNotRun() throws InterruptedException {
        ExecutorSyncTimer timer = new ExecutorSyncTimer(scheduler);
        AtomicInteger runs = new AtomicInteger();
        TimerHandle handle = timer.schedule("cancelled", runs::incrementAndGet, 100);

        assertTrue(handle.cancel());
        assertFalse(handle.cancel());

        Thread.sleep(250);
        assertEquals(0, runs.get());
        assertTrue(handle.isDone());
    }
}
