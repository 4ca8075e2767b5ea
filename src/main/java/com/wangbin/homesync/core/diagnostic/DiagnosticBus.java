package com.wangbin.homesync.core.diagnostic;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 诊断事件分发，单个监听器异常不影响其他监听器和事件产生方
 */
@Slf4j
public class DiagnosticBus implements DiagnosticListener {

    private final List<DiagnosticListener> listeners = new CopyOnWriteArrayList<>();

    public void addListener(DiagnosticListener listener) {
        if (listener != null) {
            listeners.add(listener);
        }
    }

    public void removeListener(DiagnosticListener listener) {
        listeners.remove(listener);
    }

    @Override
    public void onDiagnostic(SyncDiagnostic diagnostic) {
        for (DiagnosticListener listener : listeners) {
            try {
                listener.onDiagnostic(diagnostic);
            } catch (Exception e) {
                log.warn("诊断监听器处理失败: {}", diagnostic.type(), e);
            }
        }
    }
}
