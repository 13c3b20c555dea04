package com.plang.conflict;

import com.plang.conflict.RouteGraph.RouteEdge;
import com.plang.governance.ActionType;
import com.plang.governance.GovernanceCategory;
import com.plang.ir.Instruction;
import com.plang.ir.InstructionKind;
import com.plang.ir.IrFunction;
import com.plang.ir.IrModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Static conflict detection and resolution over a compiled module.
 * <p>
 * Four passes run on every call, in this order:
 * <ol>
 *   <li>ACTION: policies whose entry blocks share a structural signature but emit different actions</li>
 *   <li>PRIORITY: policies sharing a (category, priority) pair; their priorities are reassigned</li>
 *   <li>CATEGORY: ROUTING or CUSTOM allows against SAFETY denies</li>
 *   <li>CIRCULAR: cycles in the routing graph, with a verified break edge per cycle</li>
 * </ol>
 * The resolver keeps no state between calls. The input module is never modified; priority
 * resolution produces a new one.
 */
public class ConflictResolver {

    private static final Logger log = LoggerFactory.getLogger(ConflictResolver.class);

    public static final int DEFAULT_SIGNATURE_LENGTH = 3;

    private static final Set<GovernanceCategory> PERMISSIVE_CATEGORIES =
            Set.of(GovernanceCategory.ROUTING, GovernanceCategory.CUSTOM);

    private final int signatureLength;

    public ConflictResolver() {
        this(DEFAULT_SIGNATURE_LENGTH);
    }

    /**
     * @param signatureLength Number of leading entry-block instructions compared by the action pass
     */
    public ConflictResolver(int signatureLength) {
        if (signatureLength < 1) {
            throw new IllegalArgumentException("Signature length must be positive: " + signatureLength);
        }
        this.signatureLength = signatureLength;
    }

    /**
     * Detect and resolve conflicts.
     *
     * @param module Compiled module
     * @return Re-prioritized module and all detected conflicts
     */
    public ResolutionResult resolve(IrModule module) {
        List<PolicyConflict> conflicts = new ArrayList<>();

        detectActionConflicts(module, conflicts);
        IrModule resolved = resolvePriorityConflicts(module, conflicts);
        detectCategoryConflicts(resolved, conflicts);
        detectCircularConflicts(resolved, conflicts);

        for (PolicyConflict conflict : conflicts) {
            if (conflict.isResolved()) {
                log.debug("Conflict {} between {} resolved: {}",
                        conflict.getType(), conflict.getPolicies(), conflict.getResolution());
            } else {
                log.warn("Unresolved {} conflict between {}: {}",
                        conflict.getType(), conflict.getPolicies(), conflict.getDescription());
            }
        }
        log.debug("Resolved {} policies, {} conflict(s)", module.size(), conflicts.size());
        return new ResolutionResult(resolved, conflicts);
    }

    // ACTION

    private void detectActionConflicts(IrModule module, List<PolicyConflict> conflicts) {
        Map<List<InstructionKind>, List<IrFunction>> groups = new LinkedHashMap<>();
        for (IrFunction function : module.functions()) {
            groups.computeIfAbsent(signature(function), k -> new ArrayList<>()).add(function);
        }

        for (Map.Entry<List<InstructionKind>, List<IrFunction>> group : groups.entrySet()) {
            List<IrFunction> members = group.getValue();
            if (members.size() < 2) {
                continue;
            }
            Set<Set<ActionType>> distinct = members.stream()
                    .map(IrFunction::actionTypes)
                    .collect(Collectors.toSet());
            if (distinct.size() < 2) {
                continue;
            }

            IrFunction winner = members.get(0);
            for (IrFunction member : members) {
                if (strongestAction(member) > strongestAction(winner)) {
                    winner = member;
                }
            }

            List<String> ids = members.stream().map(IrFunction::id).toList();
            String actions = members.stream()
                    .map(f -> f.id() + "=" + f.actionTypes())
                    .collect(Collectors.joining(", "));
            PolicyConflict conflict = new PolicyConflict(ConflictType.ACTION, ids,
                    "Policies with signature " + group.getKey() + " emit different actions: " + actions);
            conflict.markResolved(winner.id(), "Highest-precedence action wins: " + winner.id());
            conflicts.add(conflict);
        }
    }

    private List<InstructionKind> signature(IrFunction function) {
        List<Instruction> instructions = function.entry().instructions();
        int length = Math.min(signatureLength, instructions.size());
        List<InstructionKind> kinds = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            kinds.add(instructions.get(i).kind());
        }
        return kinds;
    }

    private int strongestAction(IrFunction function) {
        int strongest = 0;
        for (ActionType type : function.actionTypes()) {
            strongest = Math.max(strongest, type.precedence());
        }
        return strongest;
    }

    // PRIORITY

    private IrModule resolvePriorityConflicts(IrModule module, List<PolicyConflict> conflicts) {
        Map<GovernanceCategory, TreeMap<Integer, List<String>>> byCategory = new TreeMap<>();
        for (IrFunction function : module.functions()) {
            byCategory.computeIfAbsent(function.category(), k -> new TreeMap<>())
                    .computeIfAbsent(function.priority(), k -> new ArrayList<>())
                    .add(function.id());
        }

        Map<String, Integer> reassigned = new HashMap<>();
        for (Map.Entry<GovernanceCategory, TreeMap<Integer, List<String>>> category : byCategory.entrySet()) {
            Set<Integer> taken = new HashSet<>();
            category.getValue().forEach((priority, ids) -> {
                if (ids.size() == 1) {
                    taken.add(priority);
                }
            });

            for (Map.Entry<Integer, List<String>> group : category.getValue().entrySet()) {
                List<String> ids = group.getValue();
                if (ids.size() < 2) {
                    continue;
                }
                List<String> ordered = ids.stream().sorted().toList();
                Map<String, Integer> assigned = new LinkedHashMap<>();
                int next = group.getKey();
                for (String id : ordered) {
                    while (taken.contains(next)) {
                        next = Math.incrementExact(next);
                    }
                    assigned.put(id, next);
                    taken.add(next);
                }
                reassigned.putAll(assigned);

                String winner = ordered.get(ordered.size() - 1);
                PolicyConflict conflict = new PolicyConflict(ConflictType.PRIORITY, ids,
                        ids.size() + " " + category.getKey() + " policies share priority " + group.getKey());
                conflict.markResolved(winner, "Reassigned priorities " + assigned);
                conflicts.add(conflict);
            }
        }
        return module.withPriorities(reassigned);
    }

    // CATEGORY

    private void detectCategoryConflicts(IrModule module, List<PolicyConflict> conflicts) {
        List<IrFunction> permissive = new ArrayList<>();
        List<IrFunction> safetyDenies = new ArrayList<>();
        for (IrFunction function : module.functions()) {
            if (PERMISSIVE_CATEGORIES.contains(function.category()) && function.canEmit(ActionType.ALLOW)) {
                permissive.add(function);
            } else if (function.category() == GovernanceCategory.SAFETY && function.canEmit(ActionType.DENY)) {
                safetyDenies.add(function);
            }
        }

        for (IrFunction allow : permissive) {
            for (IrFunction deny : safetyDenies) {
                IrFunction winner = allow.category().precedence() > deny.category().precedence() ? allow : deny;
                PolicyConflict conflict = new PolicyConflict(ConflictType.CATEGORY, List.of(allow.id(), deny.id()),
                        allow.category() + " policy '" + allow.id() + "' may allow what "
                                + deny.category() + " policy '" + deny.id() + "' denies");
                conflict.markResolved(winner.id(), winner.category() + " takes precedence");
                conflicts.add(conflict);
            }
        }
    }

    // CIRCULAR

    private void detectCircularConflicts(IrModule module, List<PolicyConflict> conflicts) {
        RouteGraph graph = RouteGraph.of(module);
        if (graph.edgeCount() == 0) {
            return;
        }

        List<String> order = module.ids();
        Map<PolicyConflict, List<String>> cycles = new LinkedHashMap<>();
        Set<RouteEdge> breaks = new LinkedHashSet<>();

        for (List<String> cycle : graph.findCycles(Set.of())) {
            String winner = cycle.stream()
                    .min(Comparator.<String>comparingInt(id -> priorityOf(module, id))
                            .thenComparing(Comparator.<String>comparingInt(order::indexOf).reversed()))
                    .orElseThrow();
            String successor = cycle.get((cycle.indexOf(winner) + 1) % cycle.size());
            RouteEdge edge = new RouteEdge(winner, successor);
            breaks.add(edge);

            PolicyConflict conflict = new PolicyConflict(ConflictType.CIRCULAR, cycle,
                    "Routing cycle " + renderCycle(cycle));
            conflict.setWinner(winner);
            cycles.put(conflict, cycle);
        }

        List<List<String>> remaining = graph.findCycles(breaks);
        for (Map.Entry<PolicyConflict, List<String>> entry : cycles.entrySet()) {
            PolicyConflict conflict = entry.getKey();
            int component = graph.componentOf(entry.getValue().get(0));
            List<String> left = null;
            for (List<String> cycle : remaining) {
                if (graph.componentOf(cycle.get(0)) == component) {
                    left = cycle;
                    break;
                }
            }
            RouteEdge edge = breakEdgeOf(breaks, conflict.getWinner(), entry.getValue());
            if (left == null) {
                conflict.markResolved(conflict.getWinner(), "Break route " + edge);
            } else {
                conflict.markUnresolved("Breaking route " + edge + " leaves cycle " + renderCycle(left));
            }
            conflicts.add(conflict);
        }
    }

    private RouteEdge breakEdgeOf(Set<RouteEdge> breaks, String winner, List<String> cycle) {
        String successor = cycle.get((cycle.indexOf(winner) + 1) % cycle.size());
        RouteEdge edge = new RouteEdge(winner, successor);
        if (!breaks.contains(edge)) {
            throw new IllegalStateException("Missing break edge " + edge);
        }
        return edge;
    }

    private int priorityOf(IrModule module, String id) {
        return module.get(id).orElseThrow().priority();
    }

    private String renderCycle(List<String> cycle) {
        return String.join(" -> ", cycle) + " -> " + cycle.get(0);
    }
}
