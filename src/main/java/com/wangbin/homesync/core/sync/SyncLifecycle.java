package com.wangbin.homesync.core.sync;

import com.wangbin.homesync.common.exception.BusinessException;
import com.wangbin.homesync.common.web.result.ResultCode;
import com.wangbin.homesync.core.config.SyncProperties;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 同步会话生命周期：应用就绪后按配置启动，容器关闭时释放
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SyncLifecycle {

    private final SyncProperties properties;
    private final SyncSessionFactory sessionFactory;

    private final Object lock = new Object();
    private volatile SyncSession session;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!properties.isAutoStart()) {
            log.info("未开启自动同步，等待手动启动");
            return;
        }
        start();
    }

    /**
     * 启动新会话，已有运行中的会话时直接返回
     */
    public SyncSession start() {
        synchronized (lock) {
            if (session != null && session.isRunning()) {
                return session;
            }
            SyncSession created = sessionFactory.create();
            created.start();
            session = created;
            log.info("同步会话已启动，推送地址: {}, 网关地址: {}",
                    properties.getPush().getUrl(), properties.getZigbeeApiUrl());
            return created;
        }
    }

    @PreDestroy
    public void stop() {
        synchronized (lock) {
            if (session != null) {
                session.close();
                session = null;
            }
        }
    }

    public Optional<SyncSession> current() {
        SyncSession current = session;
        return current != null && current.isRunning() ? Optional.of(current) : Optional.empty();
    }

    /**
     * 获取运行中的会话，没有时抛出服务不可用
     */
    public SyncSession requireSession() {
        return current().orElseThrow(() -> new BusinessException(ResultCode.SERVICE_UNAVAILABLE, "同步会话未运行"));
    }
}
