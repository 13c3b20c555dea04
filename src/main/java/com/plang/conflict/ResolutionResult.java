package com.plang.conflict;

import com.plang.ir.IrModule;

import java.util.List;

/**
 * Output of a resolver run: the (possibly re-prioritized) module and every conflict found.
 *
 * @param module    Module with resolved priorities
 * @param conflicts Conflicts in detection order
 */
public record ResolutionResult(IrModule module, List<PolicyConflict> conflicts) {

    public ResolutionResult {
        conflicts = List.copyOf(conflicts);
    }

    public List<PolicyConflict> conflictsOf(ConflictType type) {
        return conflicts.stream().filter(c -> c.getType() == type).toList();
    }

    public List<PolicyConflict> unresolved() {
        return conflicts.stream().filter(c -> !c.isResolved()).toList();
    }

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }
}
