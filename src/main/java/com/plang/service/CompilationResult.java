package com.plang.service;

import com.plang.conflict.PolicyConflict;
import com.plang.ir.IrModule;

import java.util.List;

/**
 * A compiled, conflict-resolved module ready to evaluate or publish.
 *
 * @param module    Module with resolved priorities
 * @param conflicts Conflicts detected during resolution
 */
public record CompilationResult(IrModule module, List<PolicyConflict> conflicts) {

    public CompilationResult {
        conflicts = List.copyOf(conflicts);
    }

    public List<PolicyConflict> unresolvedConflicts() {
        return conflicts.stream().filter(c -> !c.isResolved()).toList();
    }
}
