package com.wangbin.homesync.core.diagnostic;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * 诊断事件记录：按类型计数，保留最近的若干条事件。
 */
public class DiagnosticRecorder implements DiagnosticListener {

    private final int maxRecent;
    private final Map<DiagnosticType, LongAdder> counters = new ConcurrentHashMap<>();
    private final ArrayDeque<SyncDiagnostic> recent;

    public DiagnosticRecorder(int maxRecent) {
        this.maxRecent = Math.max(1, maxRecent);
        this.recent = new ArrayDeque<>(this.maxRecent);
    }

    @Override
    public void onDiagnostic(SyncDiagnostic diagnostic) {
        if (diagnostic == null) {
            return;
        }
        counters.computeIfAbsent(diagnostic.type(), k -> new LongAdder()).increment();
        synchronized (recent) {
            if (recent.size() >= maxRecent) {
                recent.removeFirst();
            }
            recent.addLast(diagnostic);
        }
    }

    public long getCount(DiagnosticType type) {
        LongAdder adder = counters.get(type);
        return adder != null ? adder.sum() : 0L;
    }

    public Map<DiagnosticType, Long> getCounts() {
        Map<DiagnosticType, Long> result = new EnumMap<>(DiagnosticType.class);
        counters.forEach((type, adder) -> result.put(type, adder.sum()));
        return Collections.unmodifiableMap(result);
    }

    /**
     * 最近的事件，按发生顺序
     */
    public List<SyncDiagnostic> getRecent() {
        synchronized (recent) {
            return Collections.unmodifiableList(new ArrayList<>(recent));
        }
    }

    public void clear() {
        counters.clear();
        synchronized (recent) {
            recent.clear();
        }
    }
}
