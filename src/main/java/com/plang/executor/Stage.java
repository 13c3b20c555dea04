package com.plang.executor;

import com.plang.governance.GovernanceCategory;

import java.util.List;

/**
 * Policies of one category, in declaration order.
 *
 * @param category  Category shared by every policy in the stage
 * @param policyIds Policy ids in declaration order
 */
public record Stage(GovernanceCategory category, List<String> policyIds) {

    public Stage {
        policyIds = List.copyOf(policyIds);
    }

    public int size() {
        return policyIds.size();
    }
}
