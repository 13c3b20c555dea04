package com.plang.ast;

import com.plang.value.Value;

import java.util.List;

/**
 * Condition expression as written in source. Sealed interface with record variants.
 */
public sealed interface Expression permits Expression.Literal, Expression.Path, Expression.ListLiteral,
        Expression.Call, Expression.Not, Expression.Binary {

    /**
     * Constant value ({@code "text"}, {@code 42}, {@code 1.5}, {@code true}, {@code null}).
     */
    record Literal(Value value) implements Expression {
    }

    /**
     * Dotted variable reference such as {@code request.id} or {@code user.tier}.
     */
    record Path(List<String> segments) implements Expression {
        public Path {
            segments = List.copyOf(segments);
        }

        public String dotted() {
            return String.join(".", segments);
        }
    }

    /**
     * {@code [a, b, c]}.
     */
    record ListLiteral(List<Expression> items) implements Expression {
        public ListLiteral {
            items = List.copyOf(items);
        }
    }

    /**
     * Builtin function call such as {@code contains(request.tags, "pii")}.
     */
    record Call(String function, List<Expression> args) implements Expression {
        public Call {
            args = List.copyOf(args);
        }
    }

    record Not(Expression operand) implements Expression {
    }

    record Binary(BinaryOperator operator, Expression left, Expression right) implements Expression {
    }
}
