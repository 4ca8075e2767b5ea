package com.wangbin.homesync.core.diagnostic;

/**
 * 诊断事件监听器
 */
@FunctionalInterface
public interface DiagnosticListener {

    DiagnosticListener NOOP = diagnostic -> { };

    void onDiagnostic(SyncDiagnostic diagnostic);
}
