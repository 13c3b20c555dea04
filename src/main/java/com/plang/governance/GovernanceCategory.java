package com.plang.governance;

/**
 * Governance categories in execution-stage order.
 * Declaration order is the stage order: SAFETY runs first, CUSTOM last.
 */
public enum GovernanceCategory {
    SAFETY(5),
    PRIVACY(4),
    OPERATIONAL(3),
    ROUTING(2),
    CUSTOM(1);

    private final int precedence;

    GovernanceCategory(int precedence) {
        this.precedence = precedence;
    }

    /**
     * Fixed category precedence used for category-override conflicts (higher wins).
     */
    public int precedence() {
        return precedence;
    }

    /**
     * Name of the governance counter for this category (e.g. "safety_checks_passed").
     */
    public String counterName() {
        return name().toLowerCase() + "_checks_passed";
    }
}
