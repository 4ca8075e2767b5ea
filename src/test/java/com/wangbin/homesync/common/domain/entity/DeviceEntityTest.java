package com.wangbin.homesync.common.domain.entity;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONObject;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DeviceEntityTest {

    @Test
    void nestedValuesAreCopiedAndReadOnly() {
        JSONObject color = JSON.parseObject("{\"x\":0.3,\"y\":0.4}");
        List<Object> effects = new ArrayList<>(List.of("blink", "breathe"));
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("color", color);
        properties.put("effect_list", effects);

        DeviceEntity lamp = DeviceEntity.of("lamp", properties);
        color.put("x", 0.9);
        effects.add("okay");

        @SuppressWarnings("unchecked")
        Map<String, Object> storedColor = (Map<String, Object>) lamp.getProperty("color");
        assertEquals(0.3, ((Number) storedColor.get("x")).doubleValue());
        assertEquals(2, ((List<?>) lamp.getProperty("effect_list")).size());
        assertThrows(UnsupportedOperationException.class, () -> storedColor.put("x", 1.0));
    }

    @Test
    void mergeDeletesNullKeysAndKeepsInstanceWhenUnchanged() {
        DeviceEntity lamp = DeviceEntity.of("lamp", Map.of("state", "ON", "brightness", 10));

        assertSame(lamp, lamp.mergeProperties(Map.of("state", "ON")));

        Map<String, Object> diff = new LinkedHashMap<>();
        diff.put("brightness", null);
        DeviceEntity merged = lamp.mergeProperties(diff);
        assertFalse(merged.hasProperty("brightness"));
        assertEquals("ON", merged.getProperty("state"));
        assertTrue(lamp.hasProperty("brightness"));
    }
}
