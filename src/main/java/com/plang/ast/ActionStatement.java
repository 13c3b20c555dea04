package com.plang.ast;

import com.plang.governance.ActionType;

/**
 * An action: {@code allow}, {@code deny ["reason"]}, {@code route to <target>}
 * or {@code escalate [to <target>] ["reason"]}.
 *
 * @param action Action type
 * @param target Route or escalation target, null when absent
 * @param reason Deny or escalation reason, null when absent
 * @param line   Source line
 */
public record ActionStatement(
        ActionType action,
        String target,
        String reason,
        int line
) implements Statement {
}
