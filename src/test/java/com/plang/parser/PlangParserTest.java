package com.plang.parser;

import com.plang.ast.ActionStatement;
import com.plang.ast.BinaryOperator;
import com.plang.ast.Expression;
import com.plang.ast.PolicyDeclaration;
import com.plang.ast.PolicySet;
import com.plang.ast.WhenStatement;
import com.plang.exception.ParseException;
import com.plang.governance.ActionType;
import com.plang.governance.GovernanceCategory;
import com.plang.value.Value;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PlangParser.
 */
class PlangParserTest {

    @Test
    @DisplayName("Should parse a simple deny policy")
    void shouldParseSimpleDeny() {
        PolicySet set = PlangParser.parse("policy block_all: SAFETY { deny \"blocked\" }");

        assertEquals(1, set.size());
        PolicyDeclaration policy = set.policies().get(0);
        assertEquals("block_all", policy.name());
        assertEquals(GovernanceCategory.SAFETY, policy.category());
        assertFalse(policy.hasExplicitPriority());

        ActionStatement action = (ActionStatement) policy.body().get(0);
        assertEquals(ActionType.DENY, action.action());
        assertEquals("blocked", action.reason());
    }

    @Test
    @DisplayName("Should parse priority and every action form")
    void shouldParseActions() {
        PolicySet set = PlangParser.parse("""
                policy p: routing priority 7 {
                    when a then route to expert_agent
                    when b then escalate to "human desk" "needs review"
                    when c then escalate
                    allow
                }
                """);

        PolicyDeclaration policy = set.policies().get(0);
        assertEquals(GovernanceCategory.ROUTING, policy.category());
        assertEquals(7, policy.priority());
        assertEquals(4, policy.body().size());

        ActionStatement route = (ActionStatement) ((WhenStatement) policy.body().get(0)).thenBody().get(0);
        assertEquals(ActionType.ROUTE, route.action());
        assertEquals("expert_agent", route.target());

        ActionStatement escalate = (ActionStatement) ((WhenStatement) policy.body().get(1)).thenBody().get(0);
        assertEquals("human desk", escalate.target());
        assertEquals("needs review", escalate.reason());

        ActionStatement bare = (ActionStatement) ((WhenStatement) policy.body().get(2)).thenBody().get(0);
        assertNull(bare.target());
        assertNull(bare.reason());

        assertEquals(ActionType.ALLOW, ((ActionStatement) policy.body().get(3)).action());
    }

    @Test
    @DisplayName("NOT binds tighter than AND, AND tighter than OR")
    void shouldRespectPrecedence() {
        PolicySet set = PlangParser.parse("policy p: CUSTOM { when a or not b and c then deny }");
        WhenStatement when = (WhenStatement) set.policies().get(0).body().get(0);

        Expression.Binary or = (Expression.Binary) when.condition();
        assertEquals(BinaryOperator.OR, or.operator());
        Expression.Binary and = (Expression.Binary) or.right();
        assertEquals(BinaryOperator.AND, and.operator());
        assertInstanceOf(Expression.Not.class, and.left());
    }

    @Test
    @DisplayName("Should parse calls, lists, paths and not-in")
    void shouldParseOperands() {
        PolicySet set = PlangParser.parse(
                "policy p: PRIVACY { when contains(tags, 'pii') and user.tier not in [\"gold\", 2] then deny }");
        WhenStatement when = (WhenStatement) set.policies().get(0).body().get(0);
        Expression.Binary and = (Expression.Binary) when.condition();

        Expression.Call call = (Expression.Call) and.left();
        assertEquals("contains", call.function());
        assertEquals(2, call.args().size());
        assertEquals(new Expression.Literal(Value.of("pii")), call.args().get(1));

        Expression.Not not = (Expression.Not) and.right();
        Expression.Binary in = (Expression.Binary) not.operand();
        assertEquals(BinaryOperator.IN, in.operator());
        assertEquals(List.of("user", "tier"), ((Expression.Path) in.left()).segments());
        assertEquals(2, ((Expression.ListLiteral) in.right()).items().size());
    }

    @Test
    @DisplayName("Should parse nested blocks with else")
    void shouldParseElse() {
        PolicySet set = PlangParser.parse("""
                policy p: OPERATIONAL {
                    when load > 0.8 then {
                        when critical == true then deny; allow
                    } else allow
                }
                """);
        WhenStatement when = (WhenStatement) set.policies().get(0).body().get(0);
        assertEquals(2, when.thenBody().size());
        assertEquals(1, when.elseBody().size());
    }

    @Test
    @DisplayName("Empty source yields an empty policy set")
    void emptySource() {
        assertEquals(0, PlangParser.parse("  # nothing here\n").size());
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "policy p: BOGUS { allow }|Unknown category 'BOGUS'",
            "policy p SAFETY { allow }|Expected ':' after policy name",
            "policy p: SAFETY { when a deny }|Expected 'then' after condition",
            "policy p: SAFETY { allow|Expected '}'",
            "policy p: SAFETY { route expert }|Expected 'to' after route",
            "policy p: SAFETY { when a == then deny }|Expected expression"
    })
    @DisplayName("Should reject malformed source")
    void shouldRejectMalformedSource(String source, String expectedMessage) {
        ParseException e = assertThrows(ParseException.class, () -> PlangParser.parse(source));
        assertTrue(e.getMessage().contains(expectedMessage), e.getMessage());
        assertEquals(1, e.getLine());
    }

    @Test
    @DisplayName("Should reject duplicate policy names")
    void shouldRejectDuplicates() {
        ParseException e = assertThrows(ParseException.class,
                () -> PlangParser.parse("policy p: SAFETY { deny }\npolicy p: CUSTOM { allow }"));
        assertTrue(e.getMessage().contains("Duplicate policy 'p'"));
        assertEquals(2, e.getLine());
    }

    @Test
    @DisplayName("Should reject conditions nested past the limit")
    void shouldRejectDeepNesting() {
        String parens = "policy p: SAFETY { when " + "(".repeat(20000) + "a" + ")".repeat(20000) + " then deny }";
        String nots = "policy p: SAFETY { when " + "not ".repeat(20000) + "a then deny }";
        String lists = "policy p: SAFETY { when a in " + "[".repeat(20000) + "]".repeat(20000) + " then deny }";

        for (String source : List.of(parens, nots, lists)) {
            ParseException e = assertThrows(ParseException.class, () -> PlangParser.parse(source));
            assertTrue(e.getMessage().contains("Expression nested too deeply"), e.getMessage());
            assertEquals(1, e.getLine());
        }
    }

    @Test
    @DisplayName("Should reject when blocks nested past the limit")
    void shouldRejectDeepWhenNesting() {
        int levels = PlangParser.MAX_NESTING_DEPTH + 1;
        String source = "policy p: SAFETY { " + "when a then { ".repeat(levels) + "deny" + " }".repeat(levels) + " }";

        ParseException e = assertThrows(ParseException.class, () -> PlangParser.parse(source));
        assertTrue(e.getMessage().contains("nested too deeply"), e.getMessage());
        assertEquals(1, e.getLine());
    }

    @Test
    @DisplayName("Should accept moderate nesting")
    void shouldAcceptModerateNesting() {
        String source = "policy p: SAFETY { when " + "(".repeat(100) + "a" + ")".repeat(100) + " then deny }";

        PolicySet set = PlangParser.parse(source);
        WhenStatement when = (WhenStatement) set.policies().get(0).body().get(0);
        assertInstanceOf(Expression.Path.class, when.condition());
    }
}
