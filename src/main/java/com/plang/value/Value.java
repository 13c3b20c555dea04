package com.plang.value;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Tagged value bound to a context variable or produced while evaluating a condition.
 * Sealed interface with record variants; dispatch on {@link #type()}.
 * <p>
 * Map entries are held in key order so that rendering and iteration never depend on
 * the insertion order of the caller's map.
 */
public sealed interface Value permits Value.NullValue, Value.BoolValue, Value.IntValue,
        Value.FloatValue, Value.StringValue, Value.ListValue, Value.MapValue {

    NullValue NULL = new NullValue();
    BoolValue TRUE = new BoolValue(true);
    BoolValue FALSE = new BoolValue(false);

    ValueType type();

    record NullValue() implements Value {
        @Override
        public ValueType type() {
            return ValueType.NULL;
        }

        @Override
        public String toString() {
            return "null";
        }
    }

    record BoolValue(boolean value) implements Value {
        @Override
        public ValueType type() {
            return ValueType.BOOL;
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    record IntValue(long value) implements Value {
        @Override
        public ValueType type() {
            return ValueType.INT;
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    record FloatValue(double value) implements Value {
        @Override
        public ValueType type() {
            return ValueType.FLOAT;
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    record StringValue(String value) implements Value {
        public StringValue {
            if (value == null) {
                throw new IllegalArgumentException("StringValue cannot hold null");
            }
        }

        @Override
        public ValueType type() {
            return ValueType.STRING;
        }

        @Override
        public String toString() {
            return value;
        }
    }

    record ListValue(List<Value> items) implements Value {
        public ListValue {
            items = List.copyOf(items);
        }

        @Override
        public ValueType type() {
            return ValueType.LIST;
        }

        @Override
        public String toString() {
            return items.toString();
        }
    }

    record MapValue(Map<String, Value> entries) implements Value {
        public MapValue {
            entries = Collections.unmodifiableMap(new TreeMap<>(entries));
        }

        /**
         * Member lookup; a missing key is {@link Value#NULL}.
         */
        public Value get(String key) {
            Value value = entries.get(key);
            return value == null ? NULL : value;
        }

        @Override
        public ValueType type() {
            return ValueType.MAP;
        }

        @Override
        public String toString() {
            return entries.toString();
        }
    }

    static Value of(boolean b) {
        return b ? TRUE : FALSE;
    }

    static Value of(long n) {
        return new IntValue(n);
    }

    static Value of(double d) {
        return new FloatValue(d);
    }

    static Value of(String s) {
        return s == null ? NULL : new StringValue(s);
    }

    /**
     * Convert a plain Java object (as produced by Jackson or SnakeYAML) into a tagged value.
     *
     * @throws IllegalArgumentException for types with no tagged equivalent and integers outside the long range
     */
    static Value from(Object raw) {
        if (raw == null) {
            return NULL;
        }
        if (raw instanceof Value v) {
            return v;
        }
        if (raw instanceof Boolean b) {
            return of(b);
        }
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
            return of(((Number) raw).longValue());
        }
        if (raw instanceof BigInteger big) {
            if (big.bitLength() > 63) {
                throw new IllegalArgumentException("Integer out of range: " + big);
            }
            return of(big.longValue());
        }
        if (raw instanceof Float || raw instanceof Double || raw instanceof BigDecimal) {
            return of(((Number) raw).doubleValue());
        }
        if (raw instanceof CharSequence cs) {
            return of(cs.toString());
        }
        if (raw instanceof Collection<?> collection) {
            List<Value> items = new ArrayList<>(collection.size());
            for (Object item : collection) {
                items.add(from(item));
            }
            return new ListValue(items);
        }
        if (raw instanceof Map<?, ?> map) {
            Map<String, Value> entries = new TreeMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                entries.put(String.valueOf(entry.getKey()), from(entry.getValue()));
            }
            return new MapValue(entries);
        }
        throw new IllegalArgumentException("Unsupported variable type: " + raw.getClass().getName());
    }

    /**
     * Convert back to plain Java objects (for JSON rendering).
     */
    default Object toJava() {
        return switch (type()) {
            case NULL -> null;
            case BOOL -> ((BoolValue) this).value();
            case INT -> ((IntValue) this).value();
            case FLOAT -> ((FloatValue) this).value();
            case STRING -> ((StringValue) this).value();
            case LIST -> {
                List<Object> out = new ArrayList<>();
                for (Value item : ((ListValue) this).items()) {
                    out.add(item.toJava());
                }
                yield out;
            }
            case MAP -> {
                Map<String, Object> out = new TreeMap<>();
                ((MapValue) this).entries().forEach((k, v) -> out.put(k, v.toJava()));
                yield out;
            }
        };
    }

    /**
     * Truthiness used by conditions: null is false, numbers are true when non-zero,
     * strings and collections are true when non-empty.
     */
    default boolean isTruthy() {
        return switch (type()) {
            case NULL -> false;
            case BOOL -> ((BoolValue) this).value();
            case INT -> ((IntValue) this).value() != 0L;
            case FLOAT -> ((FloatValue) this).value() != 0.0;
            case STRING -> !((StringValue) this).value().isEmpty();
            case LIST -> !((ListValue) this).items().isEmpty();
            case MAP -> !((MapValue) this).entries().isEmpty();
        };
    }

    default boolean isNumeric() {
        return type() == ValueType.INT || type() == ValueType.FLOAT;
    }

    /**
     * Numeric view; only valid when {@link #isNumeric()} is true.
     */
    default double asDouble() {
        return switch (type()) {
            case INT -> ((IntValue) this).value();
            case FLOAT -> ((FloatValue) this).value();
            default -> throw new IllegalStateException(type() + " is not numeric");
        };
    }
}
