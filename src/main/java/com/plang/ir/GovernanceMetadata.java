package com.plang.ir;

import com.plang.governance.GovernanceCategory;

/**
 * Governance metadata attached to a compiled policy function.
 *
 * @param category Governance category (decides the execution stage)
 * @param priority Priority within the category; larger means higher priority
 */
public record GovernanceMetadata(GovernanceCategory category, int priority) {

    public GovernanceMetadata withPriority(int newPriority) {
        return new GovernanceMetadata(category, newPriority);
    }
}
