package com.plang.value;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Value.
 */
class ValueTest {

    @Test
    @DisplayName("Plain Java objects convert to tagged values")
    void fromJava() {
        assertEquals(ValueType.NULL, Value.from(null).type());
        assertEquals(Value.of(7L), Value.from(7));
        assertEquals(Value.of(2.5), Value.from(new BigDecimal("2.5")));
        assertEquals(Value.TRUE, Value.from(true));
        assertEquals(ValueType.LIST, Value.from(List.of(1, "a")).type());
        assertEquals(ValueType.MAP, Value.from(Map.of("k", List.of())).type());
        assertThrows(IllegalArgumentException.class, () -> Value.from(new Object()));
    }

    @Test
    @DisplayName("Map entries are held in key order")
    void mapKeyOrder() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("zeta", 1L);
        raw.put("alpha", 2L);

        Value.MapValue map = (Value.MapValue) Value.from(raw);

        assertEquals(List.of("alpha", "zeta"), List.copyOf(map.entries().keySet()));
        assertEquals(Value.NULL, map.get("missing"));
        assertEquals(raw, map.toJava());
    }

    @Test
    @DisplayName("Truthiness")
    void truthiness() {
        assertFalse(Value.NULL.isTruthy());
        assertFalse(Value.of(0L).isTruthy());
        assertTrue(Value.of(0.1).isTruthy());
        assertFalse(Value.of("").isTruthy());
        assertTrue(Value.from(List.of(1)).isTruthy());
        assertFalse(Value.from(Map.of()).isTruthy());
    }
}
