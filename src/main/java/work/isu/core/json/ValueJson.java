package work.isu.core.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import work.isu.core.runtime.Values;

/**
 * Converts between JSON payloads and Isu runtime values. JSON integers become {@link Long};
 * fractional numbers and {@code null} are rejected.
 */
public final class ValueJson {
    private static final ObjectMapper JSON = new ObjectMapper()
        .enable(DeserializationFeature.USE_LONG_FOR_INTS)
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<>() {};

    private ValueJson() {}

    /** Parses an object payload such as {@code {"xs": [1, 2], "i": 0}} into input bindings. */
    public static Map<String, Object> readBindings(String payload) {
        if (payload == null || payload.isBlank()) {
            return Map.of();
        }
        Map<String, Object> parsed;
        try {
            parsed = JSON.readValue(payload, MAP_REF);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Invalid JSON input payload: " + ex.getOriginalMessage(), ex);
        }
        if (parsed == null) {
            throw new IllegalArgumentException("Input payload must be a JSON object");
        }
        var bindings = new LinkedHashMap<String, Object>();
        parsed.forEach((name, value) -> bindings.put(name, Values.normalize(value)));
        return Collections.unmodifiableMap(bindings);
    }

    public static Object readValue(String json) {
        try {
            return Values.normalize(JSON.readValue(json, Object.class));
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Invalid JSON value: " + ex.getOriginalMessage(), ex);
        }
    }

    public static String write(Object value) {
        try {
            return JSON.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize value: " + ex.getMessage(), ex);
        }
    }
}
