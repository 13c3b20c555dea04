package com.plang.runtime;

import com.plang.value.Value;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Pure builtin functions callable from conditions.
 */
public enum Builtin {
    CONTAINS("contains", 2) {
        @Override
        Value invoke(List<Value> args) {
            return Value.of(ExpressionEvaluator.contains(args.get(0), args.get(1)));
        }
    },
    LEN("len", 1) {
        @Override
        Value invoke(List<Value> args) {
            Value value = args.get(0);
            return switch (value.type()) {
                case STRING -> Value.of((long) ((Value.StringValue) value).value().length());
                case LIST -> Value.of((long) ((Value.ListValue) value).items().size());
                case MAP -> Value.of((long) ((Value.MapValue) value).entries().size());
                default -> Value.of(0L);
            };
        }
    },
    IS_EMPTY("is_empty", 1) {
        @Override
        Value invoke(List<Value> args) {
            Value value = args.get(0);
            return switch (value.type()) {
                case NULL -> Value.TRUE;
                case STRING, LIST, MAP -> Value.of(!value.isTruthy());
                default -> Value.FALSE;
            };
        }
    };

    private final String functionName;
    private final int arity;

    Builtin(String functionName, int arity) {
        this.functionName = functionName;
        this.arity = arity;
    }

    public String functionName() {
        return functionName;
    }

    public int arity() {
        return arity;
    }

    public static Optional<Builtin> lookup(String name) {
        return Arrays.stream(values())
                .filter(b -> b.functionName.equals(name))
                .findFirst();
    }

    /**
     * Apply the builtin; the caller has already checked the arity.
     */
    abstract Value invoke(List<Value> args);
}
