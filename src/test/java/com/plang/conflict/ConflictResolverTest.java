package com.plang.conflict;

import com.plang.governance.GovernanceCategory;
import com.plang.ir.IrBuilder;
import com.plang.ir.IrFunction;
import com.plang.ir.IrModule;
import com.plang.parser.PlangParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConflictResolver.
 */
class ConflictResolverTest {

    private ConflictResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new ConflictResolver();
    }

    private static IrModule compile(String source) {
        return new IrBuilder().build(PlangParser.parse(source));
    }

    @Test
    @DisplayName("Action conflict: the deny policy wins")
    void actionConflictDenyWins() {
        ResolutionResult result = resolver.resolve(compile("""
                policy allow_all: SAFETY { allow }
                policy deny_all: SAFETY { deny }
                """));

        List<PolicyConflict> actions = result.conflictsOf(ConflictType.ACTION);
        assertEquals(1, actions.size());
        PolicyConflict conflict = actions.get(0);
        assertEquals(List.of("allow_all", "deny_all"), conflict.getPolicies());
        assertEquals("deny_all", conflict.getWinner());
        assertEquals(70, conflict.getSeverity());
        assertTrue(conflict.isResolved());
    }

    @Test
    @DisplayName("Same actions under the same signature are not a conflict")
    void sameActionsNoConflict() {
        ResolutionResult result = resolver.resolve(compile("""
                policy a: SAFETY { deny "x" }
                policy b: SAFETY { deny "y" }
                """));

        assertTrue(result.conflictsOf(ConflictType.ACTION).isEmpty());
    }

    @Test
    @DisplayName("Signature length decides which policies are compared")
    void signatureLengthIsConfigurable() {
        String source = """
                policy x: SAFETY { when len(a) > 1 then deny }
                policy y: SAFETY { when len(b) > 1 and len(c) > 1 then allow }
                """;

        assertEquals(1, new ConflictResolver(1).resolve(compile(source)).conflictsOf(ConflictType.ACTION).size());
        assertTrue(new ConflictResolver(3).resolve(compile(source)).conflictsOf(ConflictType.ACTION).isEmpty());
    }

    @Test
    @DisplayName("Shared priorities become unique within their category")
    void priorityConflictsResolveToUniquePriorities() {
        ResolutionResult result = resolver.resolve(compile("""
                policy c: SAFETY priority 5 { deny }
                policy a: SAFETY priority 5 { deny }
                policy b: SAFETY priority 5 { deny }
                policy d: SAFETY priority 6 { deny }
                policy e: ROUTING priority 5 { route to somewhere }
                """));

        IrModule module = result.module();
        assertEquals(5, module.get("a").orElseThrow().priority());
        assertEquals(7, module.get("b").orElseThrow().priority());
        assertEquals(8, module.get("c").orElseThrow().priority());
        assertEquals(6, module.get("d").orElseThrow().priority());
        assertEquals(5, module.get("e").orElseThrow().priority());

        for (GovernanceCategory category : GovernanceCategory.values()) {
            Set<Integer> seen = new HashSet<>();
            for (IrFunction function : module.functions()) {
                if (function.category() == category) {
                    assertTrue(seen.add(function.priority()), "duplicate priority in " + category);
                }
            }
        }

        List<PolicyConflict> priorities = result.conflictsOf(ConflictType.PRIORITY);
        assertEquals(1, priorities.size());
        assertEquals("c", priorities.get(0).getWinner());
        assertTrue(priorities.get(0).isResolved());
    }

    @Test
    @DisplayName("Resolution leaves the input module untouched")
    void inputModuleIsNotModified() {
        IrModule module = compile("""
                policy a: CUSTOM priority 1 { allow }
                policy b: CUSTOM priority 1 { allow }
                """);

        ResolutionResult result = resolver.resolve(module);

        assertEquals(1, module.get("b").orElseThrow().priority());
        assertEquals(2, result.module().get("b").orElseThrow().priority());
        assertEquals(List.of("a", "b"), result.module().ids());
    }

    @Test
    @DisplayName("Category conflict between a routing allow and a safety deny")
    void categoryConflict() {
        ResolutionResult result = resolver.resolve(compile("""
                policy let_through: ROUTING { allow }
                policy guard: SAFETY { when flagged then deny }
                """));

        List<PolicyConflict> categories = result.conflictsOf(ConflictType.CATEGORY);
        assertEquals(1, categories.size());
        assertEquals(List.of("let_through", "guard"), categories.get(0).getPolicies());
        assertEquals("guard", categories.get(0).getWinner());
        assertEquals(90, categories.get(0).getSeverity());
    }

    @Test
    @DisplayName("Operational allows are outside the category pair set")
    void operationalAllowIsNotACategoryConflict() {
        ResolutionResult result = resolver.resolve(compile("""
                policy ops: OPERATIONAL { allow }
                policy guard: SAFETY { when flagged then deny }
                """));

        assertTrue(result.conflictsOf(ConflictType.CATEGORY).isEmpty());
    }

    @Test
    @DisplayName("A two-policy routing loop yields exactly one circular conflict")
    void twoPolicyCycle() {
        ResolutionResult result = resolver.resolve(compile("""
                policy a: ROUTING { route to b }
                policy b: ROUTING { route to a }
                """));

        List<PolicyConflict> circular = result.conflictsOf(ConflictType.CIRCULAR);
        assertEquals(1, circular.size());
        PolicyConflict conflict = circular.get(0);
        assertEquals(List.of("a", "b"), conflict.getPolicies());
        assertEquals("a", conflict.getWinner());
        assertEquals(100, conflict.getSeverity());
        assertTrue(conflict.isResolved());
        assertEquals("Break route a -> b", conflict.getResolution());
    }

    @Test
    @DisplayName("Priority ties in a cycle go to the later declaration")
    void cycleTieGoesToLaterDeclaration() {
        ResolutionResult result = resolver.resolve(compile("""
                policy a: ROUTING priority 3 { route to b }
                policy b: CUSTOM priority 3 { route to a }
                """));

        PolicyConflict conflict = result.conflictsOf(ConflictType.CIRCULAR).get(0);
        assertEquals("b", conflict.getWinner());
        assertEquals("Break route b -> a", conflict.getResolution());
    }

    @Test
    @DisplayName("A break that leaves another cycle keeps the conflict unresolved")
    void unverifiedBreakStaysUnresolved() {
        ResolutionResult result = resolver.resolve(compile("""
                policy a: ROUTING { route to b }
                policy b: ROUTING { when x then route to a else route to c }
                policy c: ROUTING { route to b }
                """));

        List<PolicyConflict> circular = result.conflictsOf(ConflictType.CIRCULAR);
        assertEquals(1, circular.size());
        PolicyConflict conflict = circular.get(0);
        assertFalse(conflict.isResolved());
        assertEquals("a", conflict.getWinner());
        assertTrue(conflict.getResolution().contains("b -> c -> b"), conflict.getResolution());
        assertEquals(List.of(conflict), result.unresolved());
    }

    @Test
    @DisplayName("Separate components each report their own cycle")
    void cyclesPerComponent() {
        ResolutionResult result = resolver.resolve(compile("""
                policy a: ROUTING { route to b }
                policy b: ROUTING { route to a }
                policy c: CUSTOM { route to c }
                policy d: CUSTOM { route to external_agent }
                """));

        List<PolicyConflict> circular = result.conflictsOf(ConflictType.CIRCULAR);
        assertEquals(2, circular.size());
        assertEquals(List.of("c"), circular.get(1).getPolicies());
        assertTrue(circular.get(1).isResolved());
    }

    @Test
    @DisplayName("Resolver is pure: same input, same conflicts")
    void resolverIsPure() {
        IrModule module = compile("""
                policy a: ROUTING { route to b }
                policy b: ROUTING { route to a }
                policy c: SAFETY { deny }
                """);

        ResolutionResult first = resolver.resolve(module);
        ResolutionResult second = resolver.resolve(module);

        assertEquals(first.conflicts().size(), second.conflicts().size());
        for (int i = 0; i < first.conflicts().size(); i++) {
            assertEquals(first.conflicts().get(i).toString(), second.conflicts().get(i).toString());
        }
    }

    @Test
    @DisplayName("Routes to unknown targets are not graph edges")
    void unknownTargetsIgnored() {
        RouteGraph graph = RouteGraph.of(compile("policy a: ROUTING { route to expert_agent }"));
        assertEquals(1, graph.size());
        assertEquals(0, graph.edgeCount());
        assertTrue(graph.findCycles(Set.of()).isEmpty());
    }
}
