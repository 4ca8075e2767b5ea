package com.wangbin.homesync.core.store;

import com.wangbin.homesync.common.domain.entity.DeviceEntity;
import com.wangbin.homesync.common.domain.entity.DevicePatch;
import com.wangbin.homesync.common.domain.entity.PendingWrite;
import com.wangbin.homesync.core.diagnostic.DiagnosticListener;
import com.wangbin.homesync.core.diagnostic.DiagnosticType;
import com.wangbin.homesync.core.diagnostic.SyncDiagnostic;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 设备副本：会话内设备状态的唯一权威来源。
 * <p>
 * 所有变更（全量替换、增量合并、乐观写入、待确认标记）都在同一把写锁内串行执行，
 * 每次成功变更后原子发布一个新的 {@link StoreSnapshot}。读操作不加锁，只读取已发布的快照。
 * 变更通知在释放写锁后同步派发。
 */
@Slf4j
public class DeviceStore {

    private static final String SOURCE = "DeviceStore";
    private static final int MAX_JOURNAL_SIZE = 10000;

    private final ReentrantLock writeLock = new ReentrantLock();
    private volatile StoreSnapshot current = StoreSnapshot.EMPTY;
    private final List<DeviceStoreListener> listeners = new CopyOnWriteArrayList<>();
    private final DiagnosticListener diagnostics;
    private final boolean bufferUnknownPatches;
    private final int maxBufferedDevices;

    // 以下字段仅在写锁内访问
    private final Map<String, BufferedPatch> unknownPatches = new LinkedHashMap<>();
    private final List<JournalEntry> journal = new ArrayList<>();
    private final Map<Long, SnapshotTicket> openTickets = new HashMap<>();
    private long ticketSequence;
    private long patchSequence;

    // 统计计数器
    private final AtomicLong snapshotsApplied = new AtomicLong(0);
    private final AtomicLong patchesApplied = new AtomicLong(0);
    private final AtomicLong patchesReplayed = new AtomicLong(0);
    private final AtomicLong patchesDropped = new AtomicLong(0);
    private final AtomicLong optimisticApplied = new AtomicLong(0);

    public DeviceStore() {
        this(DiagnosticListener.NOOP, true, 64);
    }

    public DeviceStore(DiagnosticListener diagnostics, boolean bufferUnknownPatches, int maxBufferedDevices) {
        this.diagnostics = diagnostics != null ? diagnostics : DiagnosticListener.NOOP;
        this.bufferUnknownPatches = bufferUnknownPatches;
        this.maxBufferedDevices = Math.max(0, maxBufferedDevices);
    }

    // ========== 读操作 ==========

    public StoreSnapshot snapshot() {
        return current;
    }

    public Optional<DeviceEntity> getDevice(String deviceId) {
        return current.getDevice(deviceId);
    }

    public List<DeviceEntity> getDevices() {
        return current.deviceList();
    }

    /**
     * 按区域过滤设备，区域为空时返回全部
     */
    public List<DeviceEntity> getDevicesByZones(Collection<String> zones) {
        List<DeviceEntity> result = new ArrayList<>();
        for (DeviceEntity device : current.devices().values()) {
            if (device.inAnyZone(zones)) {
                result.add(device);
            }
        }
        return result;
    }

    /**
     * 当前所有设备涉及的区域，按名称排序
     */
    public Set<String> getZones() {
        Set<String> zones = new TreeSet<>();
        current.devices().values().forEach(device -> zones.addAll(device.getZones()));
        return zones;
    }

    public boolean hasPendingWrites() {
        return current.hasPendingWrites();
    }

    public Optional<PendingWrite> getPendingWrite(String deviceId) {
        return Optional.ofNullable(deviceId == null ? null : current.pendingWrites().get(deviceId));
    }

    public long getVersion() {
        return current.version();
    }

    // ========== 监听器 ==========

    public void addListener(DeviceStoreListener listener) {
        if (listener != null) {
            listeners.add(listener);
        }
    }

    public void removeListener(DeviceStoreListener listener) {
        listeners.remove(listener);
    }

    // ========== 全量快照 ==========

    /**
     * 开始一次全量拉取前调用，之后到达的增量会被记录，应用快照时回放
     */
    public SnapshotTicket beginFullSnapshot() {
        writeLock.lock();
        try {
            SnapshotTicket ticket = new SnapshotTicket(++ticketSequence, patchSequence);
            openTickets.put(ticket.id(), ticket);
            return ticket;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * 放弃凭证（拉取失败或结果过期时调用）
     */
    public void releaseTicket(SnapshotTicket ticket) {
        if (ticket == null) {
            return;
        }
        writeLock.lock();
        try {
            openTickets.remove(ticket.id());
            trimJournal();
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * 用权威设备列表整体替换副本，不在列表中的设备被移除。
     * 未知设备缓存的增量在此回放。
     */
    public void applyFullSnapshot(Collection<DeviceEntity> devices) {
        applyFullSnapshot(devices, null);
    }

    /**
     * 用拉取开始时领取凭证对应的快照整体替换副本，并回放凭证之后到达的增量。
     */
    public void applyFullSnapshot(Collection<DeviceEntity> devices, SnapshotTicket ticket) {
        StoreChangeEvent event;
        writeLock.lock();
        try {
            StoreSnapshot previous = current;
            Map<String, DeviceEntity> next = new LinkedHashMap<>();
            if (devices != null) {
                for (DeviceEntity device : devices) {
                    if (device == null) {
                        continue;
                    }
                    if (next.put(device.getId(), device) != null) {
                        log.warn("快照中存在重复设备ID，保留最后一条: {}", device.getId());
                    }
                }
            }

            int replayed = 0;
            SnapshotTicket open = ticket != null ? openTickets.remove(ticket.id()) : null;
            if (open != null) {
                // 拉取期间到达的增量
                for (JournalEntry entry : journal) {
                    if (entry.sequence() > open.patchSeq() && mergeInto(next, entry.patch())) {
                        replayed++;
                    }
                }
            } else {
                if (ticket != null) {
                    log.debug("快照凭证已失效，按无凭证快照处理: {}", ticket.id());
                }
                for (BufferedPatch buffered : unknownPatches.values()) {
                    if (mergeInto(next, buffered.patch())) {
                        replayed++;
                    }
                }
            }
            unknownPatches.clear();
            trimJournal();

            // 待确认的乐观值覆盖在快照之上
            for (PendingWrite pending : previous.pendingWrites().values()) {
                DeviceEntity device = next.get(pending.deviceId());
                if (device != null) {
                    next.put(device.getId(), device.mergeProperties(pending.properties()));
                }
            }

            Set<String> affected = diffIds(previous.devices(), next);
            publish(previous.version() + 1, next, previous.pendingWrites());
            snapshotsApplied.incrementAndGet();
            patchesReplayed.addAndGet(replayed);
            log.debug("全量快照已应用: {} 个设备, 变化 {} 个, 回放增量 {} 条", next.size(), affected.size(), replayed);
            event = new StoreChangeEvent(ChangeType.SNAPSHOT, affected, current);
        } finally {
            writeLock.unlock();
        }
        notifyListeners(event);
    }

    // ========== 增量合并 ==========

    public boolean applyPatch(String deviceId, Map<String, Object> diff) {
        return applyPatch(DevicePatch.of(deviceId, diff));
    }

    /**
     * 合并推送增量：null 值删除属性。设备未知时不修改副本（按配置缓存到下一次快照）。
     *
     * @return 副本是否发生变化
     */
    public boolean applyPatch(DevicePatch patch) {
        if (patch == null) {
            return false;
        }
        StoreChangeEvent event = null;
        SyncDiagnostic diagnostic = null;
        writeLock.lock();
        try {
            long sequence = ++patchSequence;
            if (!openTickets.isEmpty()) {
                journal.add(new JournalEntry(sequence, patch));
                if (journal.size() > MAX_JOURNAL_SIZE) {
                    journal.remove(0);
                    log.warn("增量日志超过上限 {}，丢弃最早的记录", MAX_JOURNAL_SIZE);
                }
            }

            StoreSnapshot previous = current;
            DeviceEntity existing = previous.devices().get(patch.deviceId());
            if (existing == null) {
                diagnostic = handleUnknownPatch(patch);
            } else {
                DeviceEntity merged = existing.mergeProperties(patch.diff());
                if (merged != existing) {
                    Map<String, DeviceEntity> next = new LinkedHashMap<>(previous.devices());
                    next.put(merged.getId(), merged);
                    publish(previous.version() + 1, next, previous.pendingWrites());
                    patchesApplied.incrementAndGet();
                    event = new StoreChangeEvent(ChangeType.PATCH, Set.of(merged.getId()), current);
                }
            }
        } finally {
            writeLock.unlock();
        }
        if (diagnostic != null) {
            diagnostics.onDiagnostic(diagnostic);
        }
        if (event != null) {
            notifyListeners(event);
            return true;
        }
        return false;
    }

    // 写锁内调用
    private SyncDiagnostic handleUnknownPatch(DevicePatch patch) {
        String deviceId = patch.deviceId();
        if (bufferUnknownPatches) {
            BufferedPatch buffered = unknownPatches.get(deviceId);
            if (buffered != null) {
                unknownPatches.put(deviceId, new BufferedPatch(buffered.patch().mergeWith(patch)));
                return null;
            }
            if (unknownPatches.size() < maxBufferedDevices) {
                unknownPatches.put(deviceId, new BufferedPatch(patch));
                log.debug("设备未知，增量已缓存等待下一次快照: {}", deviceId);
                return SyncDiagnostic.of(DiagnosticType.PATCH_BUFFERED, SOURCE, deviceId, "设备未知，增量已缓存");
            }
            log.warn("未知设备增量缓存已满({})，丢弃: {}", maxBufferedDevices, deviceId);
        } else {
            log.debug("设备未知，丢弃增量: {}", deviceId);
        }
        patchesDropped.incrementAndGet();
        return SyncDiagnostic.of(DiagnosticType.PATCH_DROPPED, SOURCE, deviceId, "设备未知，增量已丢弃");
    }

    // ========== 乐观写入 ==========

    /**
     * 本地乐观写入，立即对读者可见。设备未知时不做任何修改。
     *
     * @return 副本是否发生变化
     */
    public boolean applyOptimistic(String deviceId, Map<String, Object> properties) {
        if (deviceId == null || properties == null || properties.isEmpty()) {
            return false;
        }
        StoreChangeEvent event = null;
        writeLock.lock();
        try {
            StoreSnapshot previous = current;
            DeviceEntity existing = previous.devices().get(deviceId);
            if (existing == null) {
                log.debug("乐观写入的设备不在副本中: {}", deviceId);
            } else {
                DeviceEntity merged = existing.mergeProperties(properties);
                if (merged != existing) {
                    Map<String, DeviceEntity> next = new LinkedHashMap<>(previous.devices());
                    next.put(deviceId, merged);
                    publish(previous.version() + 1, next, previous.pendingWrites());
                    optimisticApplied.incrementAndGet();
                    event = new StoreChangeEvent(ChangeType.OPTIMISTIC, Set.of(deviceId), current);
                }
            }
        } finally {
            writeLock.unlock();
        }
        if (event != null) {
            notifyListeners(event);
            return true;
        }
        return false;
    }

    // ========== 待确认写入 ==========

    public void markPending(PendingWrite pendingWrite) {
        if (pendingWrite == null) {
            return;
        }
        StoreChangeEvent event = null;
        writeLock.lock();
        try {
            StoreSnapshot previous = current;
            if (!pendingWrite.equals(previous.pendingWrites().get(pendingWrite.deviceId()))) {
                Map<String, PendingWrite> pending = new LinkedHashMap<>(previous.pendingWrites());
                pending.put(pendingWrite.deviceId(), pendingWrite);
                publish(previous.version() + 1, previous.devices(), pending);
                event = new StoreChangeEvent(ChangeType.PENDING, Set.of(pendingWrite.deviceId()), current);
            }
        } finally {
            writeLock.unlock();
        }
        if (event != null) {
            notifyListeners(event);
        }
    }

    public boolean clearPending(String deviceId) {
        if (deviceId == null) {
            return false;
        }
        StoreChangeEvent event = null;
        writeLock.lock();
        try {
            StoreSnapshot previous = current;
            if (previous.pendingWrites().containsKey(deviceId)) {
                Map<String, PendingWrite> pending = new LinkedHashMap<>(previous.pendingWrites());
                pending.remove(deviceId);
                publish(previous.version() + 1, previous.devices(), pending);
                event = new StoreChangeEvent(ChangeType.PENDING, Set.of(deviceId), current);
            }
        } finally {
            writeLock.unlock();
        }
        if (event != null) {
            notifyListeners(event);
            return true;
        }
        return false;
    }

    // ========== 生命周期 ==========

    /**
     * 会话结束时清空副本、缓存和凭证
     */
    public void clear() {
        StoreChangeEvent event;
        writeLock.lock();
        try {
            StoreSnapshot previous = current;
            unknownPatches.clear();
            journal.clear();
            openTickets.clear();
            publish(previous.version() + 1, Collections.emptyMap(), Collections.emptyMap());
            event = new StoreChangeEvent(ChangeType.CLEARED, previous.devices().keySet(), current);
        } finally {
            writeLock.unlock();
        }
        notifyListeners(event);
    }

    public Map<String, Object> getStatistics() {
        StoreSnapshot snapshot = current;
        Map<String, Object> statistics = new LinkedHashMap<>();
        statistics.put("version", snapshot.version());
        statistics.put("devices", snapshot.size());
        statistics.put("pendingWrites", snapshot.pendingWrites().size());
        statistics.put("snapshotsApplied", snapshotsApplied.get());
        statistics.put("patchesApplied", patchesApplied.get());
        statistics.put("patchesReplayed", patchesReplayed.get());
        statistics.put("patchesDropped", patchesDropped.get());
        statistics.put("optimisticApplied", optimisticApplied.get());
        writeLock.lock();
        try {
            statistics.put("bufferedDevices", unknownPatches.size());
            statistics.put("openTickets", openTickets.size());
        } finally {
            writeLock.unlock();
        }
        return statistics;
    }

    // ========== 内部方法 ==========

    private void publish(long version, Map<String, DeviceEntity> devices, Map<String, PendingWrite> pending) {
        current = new StoreSnapshot(version,
                Collections.unmodifiableMap(new LinkedHashMap<>(devices)),
                Collections.unmodifiableMap(new LinkedHashMap<>(pending)));
    }

    private static boolean mergeInto(Map<String, DeviceEntity> devices, DevicePatch patch) {
        DeviceEntity device = devices.get(patch.deviceId());
        if (device == null) {
            return false;
        }
        devices.put(device.getId(), device.mergeProperties(patch.diff()));
        return true;
    }

    private static Set<String> diffIds(Map<String, DeviceEntity> before, Map<String, DeviceEntity> after) {
        Set<String> changed = new LinkedHashSet<>();
        for (String id : before.keySet()) {
            if (!after.containsKey(id)) {
                changed.add(id);
            }
        }
        after.forEach((id, device) -> {
            if (!Objects.equals(before.get(id), device)) {
                changed.add(id);
            }
        });
        return changed;
    }

    // 写锁内调用：丢弃所有未关闭凭证都已覆盖的日志
    private void trimJournal() {
        if (openTickets.isEmpty()) {
            journal.clear();
            return;
        }
        long oldest = Long.MAX_VALUE;
        for (SnapshotTicket ticket : openTickets.values()) {
            oldest = Math.min(oldest, ticket.patchSeq());
        }
        Iterator<JournalEntry> iterator = journal.iterator();
        while (iterator.hasNext()) {
            if (iterator.next().sequence() <= oldest) {
                iterator.remove();
            } else {
                break;
            }
        }
    }

    private void notifyListeners(StoreChangeEvent event) {
        for (DeviceStoreListener listener : listeners) {
            try {
                listener.onStoreChanged(event);
            } catch (Exception e) {
                log.warn("副本变更监听器处理失败: {}", event.type(), e);
            }
        }
    }

    private record JournalEntry(long sequence, DevicePatch patch) {
    }

    private record BufferedPatch(DevicePatch patch) {
    }
}
