package com.plang.ir;

import com.plang.ast.BinaryOperator;
import com.plang.value.Value;
import com.plang.value.ValueType;

import java.util.List;

/**
 * Call-free condition expression. Dispatch on {@link #kind()}.
 */
public sealed interface IrExpression permits IrExpression.Const, IrExpression.Var, IrExpression.Temp,
        IrExpression.ListOf, IrExpression.Not, IrExpression.Binary {

    enum Kind {
        CONST,
        VAR,
        TEMP,
        LIST,
        NOT,
        BINARY
    }

    Kind kind();

    record Const(Value value) implements IrExpression {
        @Override
        public Kind kind() {
            return Kind.CONST;
        }

        @Override
        public String toString() {
            return value.type() == ValueType.STRING ? "\"" + value + "\"" : value.toString();
        }
    }

    /**
     * Variable path looked up in the context bindings.
     */
    record Var(List<String> path) implements IrExpression {
        public Var {
            path = List.copyOf(path);
        }

        @Override
        public Kind kind() {
            return Kind.VAR;
        }

        @Override
        public String toString() {
            return String.join(".", path);
        }
    }

    /**
     * Result of a hoisted builtin call.
     */
    record Temp(int slot) implements IrExpression {
        @Override
        public Kind kind() {
            return Kind.TEMP;
        }

        @Override
        public String toString() {
            return "%t" + slot;
        }
    }

    record ListOf(List<IrExpression> items) implements IrExpression {
        public ListOf {
            items = List.copyOf(items);
        }

        @Override
        public Kind kind() {
            return Kind.LIST;
        }

        @Override
        public String toString() {
            return items.toString();
        }
    }

    record Not(IrExpression operand) implements IrExpression {
        @Override
        public Kind kind() {
            return Kind.NOT;
        }

        @Override
        public String toString() {
            return "not " + operand;
        }
    }

    record Binary(BinaryOperator operator, IrExpression left, IrExpression right) implements IrExpression {
        @Override
        public Kind kind() {
            return Kind.BINARY;
        }

        @Override
        public String toString() {
            return "(" + left + " " + operator.symbol() + " " + right + ")";
        }
    }
}
