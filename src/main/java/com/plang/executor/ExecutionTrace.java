package com.plang.executor;

import com.plang.governance.ActionType;
import com.plang.intent.Intent;
import com.plang.runtime.TraceEvent;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of executing a whole plan.
 *
 * @param finalAction Combined action of every policy that ran
 * @param deniedBy    Policy that stopped execution with DENY, or null
 * @param intents     Emitted intents in emission order
 * @param events      Full event trace
 * @param counters    Governance counters
 */
public record ExecutionTrace(
        ActionType finalAction,
        String deniedBy,
        List<Intent> intents,
        List<TraceEvent> events,
        Map<String, Integer> counters
) {
    public ExecutionTrace {
        intents = List.copyOf(intents);
        events = List.copyOf(events);
        counters = Collections.unmodifiableMap(new LinkedHashMap<>(counters));
    }

    public List<TraceEvent> eventsNamed(String name) {
        return events.stream().filter(e -> e.event().equals(name)).toList();
    }

    public int counter(String name) {
        return counters.getOrDefault(name, 0);
    }

    public boolean isDenied() {
        return finalAction == ActionType.DENY;
    }
}
