package com.plang.conflict;

/**
 * Kinds of conflicts the resolver detects, with their default severity (0..100).
 */
public enum ConflictType {
    ACTION(70),
    PRIORITY(30),
    CATEGORY(90),
    CIRCULAR(100);

    private final int severity;

    ConflictType(int severity) {
        this.severity = severity;
    }

    public int severity() {
        return severity;
    }
}
