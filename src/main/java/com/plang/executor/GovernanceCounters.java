package com.plang.executor;

import com.plang.governance.GovernanceCategory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Counters kept over one plan execution.
 */
public class GovernanceCounters {

    public static final String POLICIES_EVALUATED = "policies_evaluated";
    public static final String POLICIES_FAILED = "policies_failed";
    public static final String STAGES_EXECUTED = "stages_executed";

    private final Map<String, Integer> counters = new LinkedHashMap<>();

    public GovernanceCounters() {
        for (GovernanceCategory category : GovernanceCategory.values()) {
            counters.put(category.counterName(), 0);
        }
        counters.put(POLICIES_EVALUATED, 0);
        counters.put(POLICIES_FAILED, 0);
        counters.put(STAGES_EXECUTED, 0);
    }

    public void increment(String name) {
        counters.merge(name, 1, Integer::sum);
    }

    public void passed(GovernanceCategory category) {
        increment(category.counterName());
    }

    public int get(String name) {
        return counters.getOrDefault(name, 0);
    }

    public Map<String, Integer> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(counters));
    }
}
