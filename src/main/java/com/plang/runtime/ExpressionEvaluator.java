package com.plang.runtime;

import com.plang.ir.IrExpression;
import com.plang.value.Value;
import com.plang.value.ValueType;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates call-free IR conditions to values.
 * <p>
 * Comparison semantics:
 * <ul>
 *   <li>== and != compare numbers by value across int and float, anything else by type and value</li>
 *   <li>ordering applies to two numbers or two strings; any other pair is false</li>
 *   <li>in tests list membership, substring, or map key</li>
 * </ul>
 * Missing variables are null and never raise.
 */
public class ExpressionEvaluator {

    /**
     * Evaluate an expression.
     *
     * @param expression Expression to evaluate
     * @param variables  Variable lookup
     * @param temps      Results of hoisted calls, indexed by slot
     * @return Resulting value
     */
    public Value evaluate(IrExpression expression, VariableResolver variables, Value[] temps) {
        return switch (expression.kind()) {
            case CONST -> ((IrExpression.Const) expression).value();
            case VAR -> variables.resolve(((IrExpression.Var) expression).path());
            case TEMP -> {
                Value value = temps[((IrExpression.Temp) expression).slot()];
                yield value == null ? Value.NULL : value;
            }
            case LIST -> {
                List<Value> items = new ArrayList<>();
                for (IrExpression item : ((IrExpression.ListOf) expression).items()) {
                    items.add(evaluate(item, variables, temps));
                }
                yield new Value.ListValue(items);
            }
            case NOT -> Value.of(!evaluate(((IrExpression.Not) expression).operand(), variables, temps).isTruthy());
            case BINARY -> evaluateBinary((IrExpression.Binary) expression, variables, temps);
        };
    }

    private Value evaluateBinary(IrExpression.Binary binary, VariableResolver variables, Value[] temps) {
        // Short-circuit logical operators
        switch (binary.operator()) {
            case AND -> {
                if (!evaluate(binary.left(), variables, temps).isTruthy()) {
                    return Value.FALSE;
                }
                return Value.of(evaluate(binary.right(), variables, temps).isTruthy());
            }
            case OR -> {
                if (evaluate(binary.left(), variables, temps).isTruthy()) {
                    return Value.TRUE;
                }
                return Value.of(evaluate(binary.right(), variables, temps).isTruthy());
            }
            default -> {
                // comparisons below
            }
        }

        Value left = evaluate(binary.left(), variables, temps);
        Value right = evaluate(binary.right(), variables, temps);
        return Value.of(switch (binary.operator()) {
            case EQ -> compareValues(left, right);
            case NE -> !compareValues(left, right);
            case GT -> ordered(left, right) && compareOrdered(left, right) > 0;
            case GTE -> ordered(left, right) && compareOrdered(left, right) >= 0;
            case LT -> ordered(left, right) && compareOrdered(left, right) < 0;
            case LTE -> ordered(left, right) && compareOrdered(left, right) <= 0;
            case IN -> contains(right, left);
            case AND, OR -> throw new IllegalStateException("Logical operator handled above");
        });
    }

    /**
     * Equality: numbers by value across int and float, everything else by type and value.
     * Two integers compare exactly; a float on either side widens both to double.
     */
    public static boolean compareValues(Value actual, Value expected) {
        if (actual instanceof Value.IntValue a && expected instanceof Value.IntValue b) {
            return a.value() == b.value();
        }
        if (actual.isNumeric() && expected.isNumeric()) {
            return actual.asDouble() == expected.asDouble();
        }
        return actual.equals(expected);
    }

    /**
     * Membership: element of a list, substring of a string, or key of a map.
     */
    public static boolean contains(Value haystack, Value needle) {
        return switch (haystack.type()) {
            case LIST -> {
                for (Value item : ((Value.ListValue) haystack).items()) {
                    if (compareValues(item, needle)) {
                        yield true;
                    }
                }
                yield false;
            }
            case STRING -> needle.type() == ValueType.STRING
                    && ((Value.StringValue) haystack).value().contains(((Value.StringValue) needle).value());
            case MAP -> needle.type() == ValueType.STRING
                    && ((Value.MapValue) haystack).entries().containsKey(((Value.StringValue) needle).value());
            default -> false;
        };
    }

    private static boolean ordered(Value left, Value right) {
        return (left.isNumeric() && right.isNumeric())
                || (left.type() == ValueType.STRING && right.type() == ValueType.STRING);
    }

    private static int compareOrdered(Value left, Value right) {
        if (left instanceof Value.IntValue a && right instanceof Value.IntValue b) {
            return Long.compare(a.value(), b.value());
        }
        if (left.isNumeric()) {
            return Double.compare(left.asDouble(), right.asDouble());
        }
        return ((Value.StringValue) left).value().compareTo(((Value.StringValue) right).value());
    }
}
