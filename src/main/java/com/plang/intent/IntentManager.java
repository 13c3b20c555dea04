package com.plang.intent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Creates, validates and emits intents for one evaluation.
 * <p>
 * Ids are derived from the source policy and a per-manager sequence, so the same evaluation
 * always yields the same ids. Not thread-safe; one manager per evaluation.
 */
public class IntentManager {

    private static final Logger log = LoggerFactory.getLogger(IntentManager.class);

    public static final int DEFAULT_PRIORITY = 0;

    private final Map<String, Intent> pending = new LinkedHashMap<>();
    private final Map<String, Intent> emitted = new LinkedHashMap<>();
    private int sequence;

    public Intent create(IntentType type, Map<String, Object> payload) {
        return create(type, payload, null, null);
    }

    /**
     * Create a pending intent.
     *
     * @param type         Intent type
     * @param payload      Type-specific fields
     * @param priority     Priority, or null for {@link #DEFAULT_PRIORITY}
     * @param sourcePolicy Originating policy, may be null
     * @return New pending intent
     */
    public Intent create(IntentType type, Map<String, Object> payload, Integer priority, String sourcePolicy) {
        sequence++;
        String id = sourcePolicy == null
                ? "intent-" + sequence
                : "intent-" + sourcePolicy + "-" + sequence;
        Intent intent = new Intent(id, type, payload == null ? Map.of() : payload,
                priority == null ? DEFAULT_PRIORITY : priority, sourcePolicy, type == IntentType.ESCALATE);
        pending.put(id, intent);
        return intent;
    }

    /**
     * Validate an intent against the rules of its type and record the errors on it.
     *
     * @return true when valid
     */
    public boolean validate(Intent intent) {
        List<String> errors = new ArrayList<>();
        switch (intent.getType()) {
            case ROUTE -> require(intent, "target_agent", errors);
            case DENY -> require(intent, "reason", errors);
            case ESCALATE -> {
                if (isBlank(intent.getString("target")) && isBlank(intent.getString("reason"))) {
                    errors.add("Escalation requires a target or a reason");
                }
            }
            case NOTIFY -> require(intent, "channel", errors);
            case ALLOW, LOG -> {
                // no required fields
            }
        }
        intent.setValidationErrors(errors);
        return errors.isEmpty();
    }

    /**
     * Move a valid pending intent to the emitted set.
     *
     * @return false when the intent is invalid, unknown or already emitted
     */
    public boolean emit(Intent intent) {
        if (emitted.containsKey(intent.getId())) {
            log.debug("Intent {} already emitted", intent.getId());
            return false;
        }
        if (!pending.containsKey(intent.getId())) {
            log.debug("Intent {} is not pending", intent.getId());
            return false;
        }
        if (!validate(intent)) {
            log.debug("Intent {} rejected: {}", intent.getId(), intent.getValidationErrors());
            return false;
        }
        pending.remove(intent.getId());
        emitted.put(intent.getId(), intent);
        return true;
    }

    public List<Intent> getPending() {
        return Collections.unmodifiableList(new ArrayList<>(pending.values()));
    }

    /**
     * Emitted intents in emission order.
     */
    public List<Intent> getEmitted() {
        return Collections.unmodifiableList(new ArrayList<>(emitted.values()));
    }

    private static void require(Intent intent, String field, List<String> errors) {
        if (isBlank(intent.getString(field))) {
            errors.add(intent.getType() + " intent requires non-empty '" + field + "'");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
