package com.plang.intent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical JSON rendering of intents: every object has its keys sorted,
 * so equal intent lists render to identical strings.
 */
public final class IntentJson {

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private IntentJson() {
    }

    public static String toJson(List<Intent> intents) {
        List<Map<String, Object>> nodes = new ArrayList<>(intents.size());
        for (Intent intent : intents) {
            nodes.add(toMap(intent));
        }
        try {
            return objectMapper.writeValueAsString(nodes);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Intent payload is not serializable: " + e.getMessage(), e);
        }
    }

    private static Map<String, Object> toMap(Intent intent) {
        Map<String, Object> node = new LinkedHashMap<>();
        node.put("id", intent.getId());
        node.put("type", intent.getType().name());
        node.put("payload", intent.getPayload());
        node.put("priority", intent.getPriority());
        node.put("source_policy", intent.getSourcePolicy());
        node.put("requires_confirmation", intent.isRequiresConfirmation());
        return node;
    }
}
