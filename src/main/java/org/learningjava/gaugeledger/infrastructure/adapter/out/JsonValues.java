package org.learningjava.gaugeledger.infrastructure.adapter.out;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;

/**
 * Free-form metadata and variant config maps as every backend hands them back: whole numbers as
 * Integer or Long, decimals as Double, nested values as fresh maps and lists.
 */
public final class JsonValues {

    public static final TypeReference<Map<String, Object>> JSON_MAP = new TypeReference<>() {
    };

    private JsonValues() {
    }

    public static String write(ObjectMapper om, Object value) {
        try {
            return om.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value is not JSON-serializable", e);
        }
    }

    /** Passes {@code map} through its JSON text, so the result is detached from the caller's objects. */
    public static Map<String, Object> normalize(ObjectMapper om, Map<String, Object> map) {
        if (map == null || map.isEmpty()) {
            return Map.of();
        }
        String json = write(om, map);
        try {
            return om.readValue(json, JSON_MAP);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value does not read back as a JSON object: " + json, e);
        }
    }
}
