package com.plang.parser;

import com.plang.ast.ActionStatement;
import com.plang.ast.BinaryOperator;
import com.plang.ast.Expression;
import com.plang.ast.PolicyDeclaration;
import com.plang.ast.PolicySet;
import com.plang.ast.Statement;
import com.plang.ast.WhenStatement;
import com.plang.exception.ParseException;
import com.plang.governance.ActionType;
import com.plang.governance.GovernanceCategory;
import com.plang.value.Value;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.plang.parser.GrammarConfig.*;

/**
 * Recursive descent parser for PLang.
 * Converts tokens into a {@link PolicySet}; fails on the first error and never returns a partial result.
 * <p>
 * Grammar (condition precedence: NOT > AND > OR):
 * <pre>
 * program    := policy*
 * policy     := 'policy' NAME ':' CATEGORY ('priority' INTEGER)? '{' statement* '}'
 * statement  := 'when' expr 'then' body ('else' body)? | action
 * body       := action | '{' statement* '}'
 * action     := 'allow' | 'deny' STRING? | 'route' 'to' target | 'escalate' ('to' target)? STRING?
 * expr       := or
 * or         := and ('or' and)*
 * and        := not ('and' not)*
 * not        := 'not' not | comparison
 * comparison := primary (op primary | 'not'? 'in' primary)?
 * primary    := literal | list | call | path | '(' expr ')'
 * </pre>
 */
public final class PlangParser {

    /**
     * Deepest nesting of conditions, lists, calls and {@code when} blocks accepted.
     */
    public static final int MAX_NESTING_DEPTH = 256;

    private static final Map<TokenType, BinaryOperator> COMPARISONS = Map.of(
            TokenType.EQ, BinaryOperator.EQ,
            TokenType.NE, BinaryOperator.NE,
            TokenType.GT, BinaryOperator.GT,
            TokenType.GTE, BinaryOperator.GTE,
            TokenType.LT, BinaryOperator.LT,
            TokenType.LTE, BinaryOperator.LTE
    );

    private final List<Token> tokens;
    private int index;
    private int depth;

    public PlangParser(List<Token> tokens) {
        this.tokens = tokens;
        this.index = 0;
    }

    /**
     * Tokenize and parse PLang source in one step.
     *
     * @param source PLang source text
     * @return Parsed policy set
     * @throws ParseException on malformed source
     */
    public static PolicySet parse(String source) {
        return new PlangParser(new PlangLexer(source).tokenize()).parse();
    }

    /**
     * Parse the token stream into a policy set.
     *
     * @return Root of the AST
     */
    public PolicySet parse() {
        List<PolicyDeclaration> policies = new ArrayList<>();
        Set<String> names = new HashSet<>();

        while (!isAtEnd()) {
            Token start = peek();
            PolicyDeclaration policy = parsePolicy();
            if (!names.add(policy.name())) {
                throw error(start, "Duplicate policy '" + policy.name() + "'");
            }
            policies.add(policy);
        }

        expect(TokenType.EOF);
        return new PolicySet(policies);
    }

    private PolicyDeclaration parsePolicy() {
        Token keyword = consume(TokenType.POLICY, "Expected 'policy'");
        Token name = consume(TokenType.IDENT, "Expected policy name");
        consume(TokenType.COLON, "Expected ':' after policy name");

        Token categoryToken = consume(TokenType.IDENT, "Expected category");
        GovernanceCategory category = CATEGORIES.get(categoryToken.text().toUpperCase());
        if (category == null) {
            throw error(categoryToken, "Unknown category '" + categoryToken.text()
                    + "', expected one of " + Arrays.toString(GovernanceCategory.values()));
        }

        Integer priority = null;
        if (checkWord(PRIORITY)) {
            advance();
            Token number = consume(TokenType.INTEGER, "Expected integer priority");
            long value = (Long) number.literal();
            if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
                throw error(number, "Priority out of range: " + value);
            }
            priority = (int) value;
        }

        consume(TokenType.LBRACE, "Expected '{' to open policy body");
        List<Statement> body = parseStatementsUntilBrace();

        return new PolicyDeclaration(name.text(), category, priority, body, keyword.line());
    }

    private List<Statement> parseStatementsUntilBrace() {
        List<Statement> statements = new ArrayList<>();
        while (true) {
            while (match(TokenType.SEMICOLON)) {
                // separators are optional
            }
            if (match(TokenType.RBRACE)) {
                return statements;
            }
            if (isAtEnd()) {
                throw error(peek(), "Expected '}'");
            }
            statements.add(parseStatement());
        }
    }

    private Statement parseStatement() {
        if (check(TokenType.WHEN)) {
            return parseWhen();
        }
        if (isActionStart()) {
            return parseAction();
        }
        throw error(peek(), "Expected statement (when, allow, deny, route, escalate)");
    }

    private WhenStatement parseWhen() {
        Token when = advance();
        descend(when, "Statements nested too deeply");
        try {
            Expression condition = parseExpression();
            consume(TokenType.THEN, "Expected 'then' after condition");
            List<Statement> thenBody = parseBody();
            List<Statement> elseBody = List.of();
            if (match(TokenType.ELSE)) {
                elseBody = parseBody();
            }
            return new WhenStatement(condition, thenBody, elseBody, when.line());
        } finally {
            depth--;
        }
    }

    private List<Statement> parseBody() {
        if (match(TokenType.LBRACE)) {
            return parseStatementsUntilBrace();
        }
        if (isActionStart()) {
            return List.of(parseAction());
        }
        throw error(peek(), "Expected action or '{'");
    }

    private ActionStatement parseAction() {
        Token keyword = advance();
        ActionType action = ACTIONS.get(keyword.type());

        return switch (action) {
            case ALLOW -> new ActionStatement(ActionType.ALLOW, null, null, keyword.line());
            case DENY -> {
                String reason = match(TokenType.STRING) ? previous().text() : null;
                yield new ActionStatement(ActionType.DENY, null, reason, keyword.line());
            }
            case ROUTE -> {
                if (!checkWord(TO)) {
                    throw error(peek(), "Expected 'to' after route");
                }
                advance();
                String target = parseTarget("Expected route target");
                yield new ActionStatement(ActionType.ROUTE, target, null, keyword.line());
            }
            case ESCALATE -> {
                String target = null;
                if (checkWord(TO)) {
                    advance();
                    target = parseTarget("Expected escalation target");
                }
                String reason = match(TokenType.STRING) ? previous().text() : null;
                yield new ActionStatement(ActionType.ESCALATE, target, reason, keyword.line());
            }
        };
    }

    private String parseTarget(String message) {
        if (match(TokenType.IDENT, TokenType.STRING)) {
            String target = previous().text();
            if (target.isBlank()) {
                throw error(previous(), message);
            }
            return target;
        }
        throw error(peek(), message);
    }

    // Conditions

    private Expression parseExpression() {
        descend(peek(), "Expression nested too deeply");
        try {
            return parseOr();
        } finally {
            depth--;
        }
    }

    private Expression parseOr() {
        Expression left = parseAnd();
        while (match(TokenType.OR)) {
            Expression right = parseAnd();
            left = new Expression.Binary(BinaryOperator.OR, left, right);
        }
        return left;
    }

    private Expression parseAnd() {
        Expression left = parseNot();
        while (match(TokenType.AND)) {
            Expression right = parseNot();
            left = new Expression.Binary(BinaryOperator.AND, left, right);
        }
        return left;
    }

    private Expression parseNot() {
        if (match(TokenType.NOT)) {
            descend(previous(), "Expression nested too deeply");
            try {
                return new Expression.Not(parseNot());
            } finally {
                depth--;
            }
        }
        return parseComparison();
    }

    private Expression parseComparison() {
        Expression left = parsePrimary();

        BinaryOperator comparison = COMPARISONS.get(peek().type());
        if (comparison != null) {
            advance();
            return new Expression.Binary(comparison, left, parsePrimary());
        }

        // NOT IN
        if (check(TokenType.NOT) && peekNext().type() == TokenType.IN) {
            advance();
            advance();
            return new Expression.Not(new Expression.Binary(BinaryOperator.IN, left, parsePrimary()));
        }

        // IN
        if (match(TokenType.IN)) {
            return new Expression.Binary(BinaryOperator.IN, left, parsePrimary());
        }

        return left;
    }

    private Expression parsePrimary() {
        // Parenthesized expression
        if (match(TokenType.LPAREN)) {
            Expression expr = parseExpression();
            consume(TokenType.RPAREN, "Expected ')'");
            return expr;
        }

        if (match(TokenType.LBRACKET)) {
            List<Expression> items = new ArrayList<>();
            if (!check(TokenType.RBRACKET)) {
                items.add(parseExpression());
                while (match(TokenType.COMMA)) {
                    items.add(parseExpression());
                }
            }
            consume(TokenType.RBRACKET, "Expected ']'");
            return new Expression.ListLiteral(items);
        }

        if (match(TokenType.STRING)) {
            return new Expression.Literal(Value.of(previous().text()));
        }
        if (match(TokenType.INTEGER)) {
            return new Expression.Literal(Value.of((long) (Long) previous().literal()));
        }
        if (match(TokenType.FLOAT)) {
            return new Expression.Literal(Value.of((double) (Double) previous().literal()));
        }
        if (match(TokenType.BOOLEAN)) {
            return new Expression.Literal(Value.of((boolean) (Boolean) previous().literal()));
        }
        if (match(TokenType.NULL)) {
            return new Expression.Literal(Value.NULL);
        }

        if (match(TokenType.IDENT)) {
            Token identifier = previous();
            if (match(TokenType.LPAREN)) {
                return parseCall(identifier);
            }
            return parsePath(identifier);
        }

        throw error(peek(), "Expected expression");
    }

    private Expression parseCall(Token name) {
        if (name.text().indexOf(Operators.DOT) >= 0) {
            throw error(name, "Invalid function name '" + name.text() + "'");
        }
        List<Expression> args = new ArrayList<>();
        if (!check(TokenType.RPAREN)) {
            args.add(parseExpression());
            while (match(TokenType.COMMA)) {
                args.add(parseExpression());
            }
        }
        consume(TokenType.RPAREN, "Expected ')' after arguments");
        return new Expression.Call(name.text(), args);
    }

    private Expression parsePath(Token identifier) {
        String[] segments = identifier.text().split("\\.", -1);
        for (String segment : segments) {
            if (segment.isEmpty()) {
                throw error(identifier, "Invalid path '" + identifier.text() + "'");
            }
        }
        return new Expression.Path(Arrays.asList(segments));
    }

    // Token helpers

    private boolean isActionStart() {
        return ACTIONS.containsKey(peek().type());
    }

    private boolean checkWord(String word) {
        return check(TokenType.IDENT) && peek().text().equalsIgnoreCase(word);
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw error(peek(), message);
    }

    private void expect(TokenType type) {
        if (!check(type)) {
            throw error(peek(), "Expected " + type);
        }
        advance();
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) {
            index++;
        }
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token peekNext() {
        return index + 1 < tokens.size() ? tokens.get(index + 1) : tokens.get(tokens.size() - 1);
    }

    private Token previous() {
        return tokens.get(index - 1);
    }

    private void descend(Token at, String message) {
        if (++depth > MAX_NESTING_DEPTH) {
            depth--;
            throw new ParseException(at.line(), at.column(), message);
        }
    }

    private ParseException error(Token token, String message) {
        if (!message.startsWith("Expected") || message.contains(" but found ")) {
            return new ParseException(token.line(), token.column(), message);
        }
        String found = token.type() == TokenType.EOF ? "end of input" : "'" + token.text() + "'";
        return new ParseException(token.line(), token.column(), message + " but found " + found);
    }
}
