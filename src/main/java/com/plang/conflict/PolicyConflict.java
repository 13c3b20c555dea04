package com.plang.conflict;

import java.util.List;

/**
 * A detected conflict between policies.
 * <p>
 * Created unresolved; the resolver marks it resolved, with a winner and a resolution note,
 * once it has applied or verified a resolution. Conflicts are warnings, never errors.
 */
public class PolicyConflict {

    private final ConflictType type;
    private final List<String> policies;
    private final String description;
    private final int severity;
    private boolean resolved;
    private String winner;
    private String resolution;

    public PolicyConflict(ConflictType type, List<String> policies, String description) {
        this(type, policies, description, type.severity());
    }

    public PolicyConflict(ConflictType type, List<String> policies, String description, int severity) {
        if (severity < 0 || severity > 100) {
            throw new IllegalArgumentException("Severity must be within 0..100: " + severity);
        }
        this.type = type;
        this.policies = List.copyOf(policies);
        this.description = description;
        this.severity = severity;
    }

    public ConflictType getType() {
        return type;
    }

    public List<String> getPolicies() {
        return policies;
    }

    public String getDescription() {
        return description;
    }

    public int getSeverity() {
        return severity;
    }

    public boolean isResolved() {
        return resolved;
    }

    public String getWinner() {
        return winner;
    }

    public String getResolution() {
        return resolution;
    }

    void setWinner(String winner) {
        this.winner = winner;
    }

    void markResolved(String winner, String resolution) {
        this.resolved = true;
        this.winner = winner;
        this.resolution = resolution;
    }

    void markUnresolved(String resolution) {
        this.resolved = false;
        this.resolution = resolution;
    }

    @Override
    public String toString() {
        return "PolicyConflict{" +
                "type=" + type +
                ", policies=" + policies +
                ", severity=" + severity +
                ", resolved=" + resolved +
                (winner != null ? ", winner=" + winner : "") +
                '}';
    }
}
