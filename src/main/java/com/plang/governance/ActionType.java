package com.plang.governance;

/**
 * Actions a policy can take.
 * Precedence is the fixed total order deny &gt; escalate &gt; route &gt; allow.
 */
public enum ActionType {
    ALLOW(1),
    ROUTE(2),
    ESCALATE(3),
    DENY(4);

    private final int precedence;

    ActionType(int precedence) {
        this.precedence = precedence;
    }

    public int precedence() {
        return precedence;
    }

    /**
     * Return whichever action has the higher precedence.
     */
    public static ActionType strongest(ActionType a, ActionType b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.precedence >= b.precedence ? a : b;
    }

    /**
     * Lowercase keyword as written in PLang source and trace events.
     */
    public String keyword() {
        return name().toLowerCase();
    }
}
