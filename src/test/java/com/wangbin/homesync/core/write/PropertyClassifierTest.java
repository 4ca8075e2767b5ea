package com.wangbin.homesync.core.write;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PropertyClassifierTest {

    private final PropertyClassifier classifier = new PropertyClassifier(List.of("brightness", "color_temp", "color"));

    @Test
    void classifiesSingleProperties() {
        assertEquals(PropertyKind.CONTINUOUS, classifier.classify("brightness"));
        assertEquals(PropertyKind.CONTINUOUS, classifier.classify("color"));
        assertEquals(PropertyKind.DISCRETE, classifier.classify("state"));
        assertEquals(PropertyKind.DISCRETE, classifier.classify((String) null));
    }

    @Test
    void anyDiscretePropertyMakesChangeDiscrete() {
        assertEquals(PropertyKind.CONTINUOUS, classifier.classify(Map.of("brightness", 1, "color_temp", 300)));
        assertEquals(PropertyKind.DISCRETE, classifier.classify(Map.of("brightness", 1, "state", "ON")));
    }
}
