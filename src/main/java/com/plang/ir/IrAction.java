package com.plang.ir;

import com.plang.governance.ActionType;

/**
 * Action emission. Ends the function with the given action.
 *
 * @param action Action type
 * @param target Route or escalation target, null when absent
 * @param reason Deny or escalation reason, null when absent
 */
public record IrAction(ActionType action, String target, String reason) implements Instruction {

    @Override
    public InstructionKind kind() {
        return InstructionKind.ACTION;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(action.keyword());
        if (target != null) {
            sb.append(" to ").append(target);
        }
        if (reason != null) {
            sb.append(" \"").append(reason).append('"');
        }
        return sb.toString();
    }
}
