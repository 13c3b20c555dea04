package com.plang.ast;

import java.util.List;

/**
 * Root of a parsed PLang source: the policy declarations in source order.
 *
 * @param policies Declarations in the order they appear
 */
public record PolicySet(List<PolicyDeclaration> policies) {

    public PolicySet {
        policies = List.copyOf(policies);
    }

    public int size() {
        return policies.size();
    }
}
