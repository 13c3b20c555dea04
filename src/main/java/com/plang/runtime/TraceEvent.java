package com.plang.runtime;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One entry of an execution trace.
 *
 * @param event     Event name, e.g. "branch" or "policy_failed"
 * @param step      Step counter of the current policy when the event was recorded
 * @param data      Event details as plain values, in insertion order
 * @param timestamp Wall-clock time; not part of the deterministic content
 */
public record TraceEvent(String event, int step, Map<String, Object> data, Instant timestamp) {

    public TraceEvent {
        data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    /**
     * Event data from alternating key and value arguments. Values may be null.
     */
    public static Map<String, Object> data(Object... pairs) {
        Map<String, Object> data = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            data.put((String) pairs[i], pairs[i + 1]);
        }
        return data;
    }

    public Object get(String key) {
        return data.get(key);
    }

    /**
     * Whether two events carry the same content, ignoring the timestamp.
     */
    public boolean sameContent(TraceEvent other) {
        return event.equals(other.event) && step == other.step && data.equals(other.data);
    }

    @Override
    public String toString() {
        return event + "@" + step + data;
    }
}
