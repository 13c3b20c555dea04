package com.plang.intent;

/**
 * Kinds of side-effect descriptions a policy evaluation can produce.
 */
public enum IntentType {
    ROUTE,
    DENY,
    ALLOW,
    ESCALATE,
    NOTIFY,
    LOG
}
