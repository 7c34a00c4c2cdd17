package com.krickert.hacluster.config.option;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ValuePairTest {

    @Test
    void isEmpty_nullAndEmptyString() {
        assertTrue(ValuePair.of(null).isEmpty());
        assertTrue(ValuePair.of("").isEmpty());
        assertFalse(ValuePair.of(" ").isEmpty());
    }

    @Test
    void wrap_keepsOrderAndNullValues() {
        Map<String, String> options = new LinkedHashMap<>();
        options.put("b", "1");
        options.put("a", null);

        Map<String, ValuePair> wrapped = ValuePair.wrap(options);

        assertEquals(List.of("b", "a"), List.copyOf(wrapped.keySet()));
        assertTrue(wrapped.get("a").isEmpty());
        assertEquals("1", wrapped.get("b").original());
    }

    @Test
    void wrap_null_isEmptyMap() {
        assertTrue(ValuePair.wrap(null).isEmpty());
        assertTrue(ValuePair.wrap(new HashMap<>()).isEmpty());
    }
}
