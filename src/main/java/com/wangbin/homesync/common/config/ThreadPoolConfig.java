package com.wangbin.homesync.common.config;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

@Configuration
public class ThreadPoolConfig {

    private final int cpuCores = Runtime.getRuntime().availableProcessors();

    private ThreadFactory buildNamedThreadFactory(String prefix, boolean daemon) {
        return new ThreadFactoryBuilder()
                .setNameFormat(prefix + "-%d")
                .setDaemon(daemon)
                .setPriority(Thread.NORM_PRIORITY)
                .build();
    }

    /**
     * 同步定时器线程池（重连退避、连接超时、轮询、防抖）
     */
    @Bean(name = "syncScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService syncScheduler() {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(
                2,
                buildNamedThreadFactory("sync-timer", true)
        );
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }

    /**
     * 网关HTTP/WebSocket客户端线程池（IO密集型）
     */
    @Bean(name = "gatewayIoExecutor", destroyMethod = "shutdown")
    public ExecutorService gatewayIoExecutor() {
        return new ThreadPoolExecutor(
                2,
                Math.max(4, cpuCores * 2),
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(1000),
                buildNamedThreadFactory("gateway-io", true),
                new ThreadPoolExecutor.CallerRunsPolicy()
        );
    }

    /**
     * 网关共享 HttpClient
     */
    @Bean
    public HttpClient gatewayHttpClient(@Qualifier("gatewayIoExecutor") ExecutorService gatewayIoExecutor) {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .executor(gatewayIoExecutor)
                .build();
    }
}
