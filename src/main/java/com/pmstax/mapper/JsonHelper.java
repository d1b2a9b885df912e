package com.pmstax.mapper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Static JSON utility for nested component records.
 *
 * <p>Records travel as {@code Map<String, Object>} trees. Decimals are read as
 * {@link java.math.BigDecimal} so amounts survive copies without binary rounding.
 */
public final class JsonHelper {

    private static final Logger log = LoggerFactory.getLogger(JsonHelper.class);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    static {
        OBJECT_MAPPER.findAndRegisterModules();
        OBJECT_MAPPER.enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    }

    private JsonHelper() {}

    /** Parse a JSON object. Returns an empty map for blank input. */
    public static Map<String, Object> toMap(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return OBJECT_MAPPER.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            log.debug("Body is not a JSON object: {}", json);
            throw new IllegalArgumentException("Not a JSON object", e);
        }
    }

    /** Deep, mutable copy of a nested record. */
    public static Map<String, Object> deepCopy(Map<String, Object> source) {
        if (source == null) {
            return new LinkedHashMap<>();
        }
        return OBJECT_MAPPER.convertValue(source, MAP_TYPE);
    }

    /**
     * Copy of {@code base} with {@code patch} applied: nested objects merge key by key,
     * anything else in the patch replaces the base value.
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> deepMerge(Map<String, Object> base, Map<String, Object> patch) {
        Map<String, Object> merged = deepCopy(base);
        if (patch == null) {
            return merged;
        }
        deepCopy(patch).forEach((key, value) -> {
            Object existing = merged.get(key);
            if (existing instanceof Map<?, ?> existingMap && value instanceof Map<?, ?> patchMap) {
                merged.put(key, deepMerge((Map<String, Object>) existingMap, (Map<String, Object>) patchMap));
            } else {
                merged.put(key, value);
            }
        });
        return merged;
    }
}
