package com.wangbin.homesync.common.domain.entity;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 设备实体（不可变值对象）。
 * <p>
 * 任何修改都会生成新的实例并整体替换，读者永远不会看到只更新了一半的记录。
 * 属性包中不保存 null 值，null 在增量更新中表示删除该属性。
 */
@Getter
@ToString
@EqualsAndHashCode
public final class DeviceEntity {

    /**
     * 设备唯一标识（网关中的 friendly_name）
     */
    private final String id;
    private final Map<String, Object> properties;
    private final Set<String> zones;
    private final boolean online;
    private final boolean interviewing;
    /**
     * 最后在线时间（毫秒时间戳），未知为 null
     */
    private final Long lastSeen;

    // 描述信息
    private final String ieeeAddress;
    private final String type;
    private final String manufacturer;
    private final String modelId;
    private final String customName;
    private final String customCategory;

    @Builder(toBuilder = true)
    private DeviceEntity(String id,
                         Map<String, Object> properties,
                         Set<String> zones,
                         Boolean online,
                         boolean interviewing,
                         Long lastSeen,
                         String ieeeAddress,
                         String type,
                         String manufacturer,
                         String modelId,
                         String customName,
                         String customCategory) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("设备ID不能为空");
        }
        this.id = id;
        this.properties = copyProperties(properties);
        this.zones = zones == null || zones.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(new LinkedHashSet<>(zones));
        this.online = online == null || online;
        this.interviewing = interviewing;
        this.lastSeen = lastSeen;
        this.ieeeAddress = ieeeAddress;
        this.type = type;
        this.manufacturer = manufacturer;
        this.modelId = modelId;
        this.customName = customName;
        this.customCategory = customCategory;
    }

    public static DeviceEntity of(String id, Map<String, Object> properties) {
        return builder().id(id).properties(properties).build();
    }

    /**
     * 用新的属性包替换
     */
    public DeviceEntity withProperties(Map<String, Object> newProperties) {
        return toBuilder().properties(newProperties).build();
    }

    /**
     * 合并增量：null 值删除该属性，其余覆盖
     *
     * @return 合并后的新实例；增量未改变任何属性时返回当前实例
     */
    public DeviceEntity mergeProperties(Map<String, Object> diff) {
        if (diff == null || diff.isEmpty()) {
            return this;
        }
        Map<String, Object> merged = new LinkedHashMap<>(properties);
        diff.forEach((key, value) -> {
            if (key == null) {
                return;
            }
            if (value == null) {
                merged.remove(key);
            } else {
                merged.put(key, value);
            }
        });
        if (merged.equals(properties)) {
            return this;
        }
        return withProperties(merged);
    }

    public Object getProperty(String name) {
        return properties.get(name);
    }

    public boolean hasProperty(String name) {
        return properties.containsKey(name);
    }

    public boolean inAnyZone(Collection<String> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return true;
        }
        for (String zone : candidates) {
            if (zones.contains(zone)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 展示名称，优先使用自定义名称
     */
    public String getDisplayName() {
        return customName != null && !customName.isBlank() ? customName : id;
    }

    private static Map<String, Object> copyProperties(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> {
            if (key != null && value != null) {
                copy.put(key, freeze(value));
            }
        });
        return Collections.unmodifiableMap(copy);
    }

    /**
     * 嵌套的对象和数组（如 color）逐层复制为只读结构
     */
    private static Object freeze(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            map.forEach((key, nested) -> copy.put(key, freeze(nested)));
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>(collection.size());
            collection.forEach(nested -> copy.add(freeze(nested)));
            return Collections.unmodifiableList(copy);
        }
        return value;
    }
}
