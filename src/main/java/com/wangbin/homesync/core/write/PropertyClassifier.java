package com.wangbin.homesync.core.write;

import java.util.Collection;
import java.util.Map;
import java.util.Set;

/**
 * 按属性名区分连续型和离散型属性
 */
public class PropertyClassifier {

    private final Set<String> continuousProperties;

    public PropertyClassifier(Collection<String> continuousProperties) {
        this.continuousProperties = continuousProperties == null ? Set.of() : Set.copyOf(continuousProperties);
    }

    public PropertyKind classify(String property) {
        return property != null && continuousProperties.contains(property)
                ? PropertyKind.CONTINUOUS
                : PropertyKind.DISCRETE;
    }

    /**
     * 一组属性只要包含离散型属性就按离散型处理
     */
    public PropertyKind classify(Map<String, ?> changes) {
        for (String property : changes.keySet()) {
            if (classify(property) == PropertyKind.DISCRETE) {
                return PropertyKind.DISCRETE;
            }
        }
        return PropertyKind.CONTINUOUS;
    }

    public Set<String> getContinuousProperties() {
        return continuousProperties;
    }
}
