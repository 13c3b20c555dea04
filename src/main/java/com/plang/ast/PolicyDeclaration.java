package com.plang.ast;

import com.plang.governance.GovernanceCategory;

import java.util.List;

/**
 * A parsed {@code policy <name>: <CATEGORY> [priority N] { ... }} block.
 *
 * @param name     Policy identifier
 * @param category Governance category
 * @param priority Explicit priority, or null when the source leaves it out
 * @param body     Statements in source order
 * @param line     Line of the {@code policy} keyword
 */
public record PolicyDeclaration(
        String name,
        GovernanceCategory category,
        Integer priority,
        List<Statement> body,
        int line
) {
    public PolicyDeclaration {
        body = List.copyOf(body);
    }

    public boolean hasExplicitPriority() {
        return priority != null;
    }
}
