package com.plang.intent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Description of a side effect for the caller to carry out. Never executed by the runtime.
 * <p>
 * Everything except the validation errors is fixed at creation; {@link IntentManager#validate}
 * replaces the error list.
 */
public final class Intent {

    private final String id;
    private final IntentType type;
    private final Map<String, Object> payload;
    private final int priority;
    private final String sourcePolicy;
    private final boolean requiresConfirmation;
    private List<String> validationErrors = List.of();

    Intent(String id, IntentType type, Map<String, Object> payload, int priority,
           String sourcePolicy, boolean requiresConfirmation) {
        this.id = id;
        this.type = type;
        this.payload = Collections.unmodifiableMap(new TreeMap<>(payload));
        this.priority = priority;
        this.sourcePolicy = sourcePolicy;
        this.requiresConfirmation = requiresConfirmation;
    }

    public String getId() {
        return id;
    }

    public IntentType getType() {
        return type;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    /**
     * Payload entry as a string, or null when absent.
     */
    public String getString(String key) {
        Object value = payload.get(key);
        return value == null ? null : value.toString();
    }

    public int getPriority() {
        return priority;
    }

    public String getSourcePolicy() {
        return sourcePolicy;
    }

    public boolean isRequiresConfirmation() {
        return requiresConfirmation;
    }

    public List<String> getValidationErrors() {
        return validationErrors;
    }

    public boolean isValid() {
        return validationErrors.isEmpty();
    }

    void setValidationErrors(List<String> errors) {
        this.validationErrors = Collections.unmodifiableList(new ArrayList<>(errors));
    }

    @Override
    public String toString() {
        return "Intent{" +
                "id='" + id + '\'' +
                ", type=" + type +
                ", payload=" + payload +
                ", source=" + sourcePolicy +
                '}';
    }
}
