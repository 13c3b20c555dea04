package com.plang.ast;

import java.util.List;

/**
 * {@code when <condition> then <body> [else <body>]}.
 *
 * @param condition Condition expression
 * @param thenBody  Statements run when the condition holds
 * @param elseBody  Statements run otherwise (empty when there is no else)
 * @param line      Source line of {@code when}
 */
public record WhenStatement(
        Expression condition,
        List<Statement> thenBody,
        List<Statement> elseBody,
        int line
) implements Statement {

    public WhenStatement {
        thenBody = List.copyOf(thenBody);
        elseBody = List.copyOf(elseBody);
    }
}
