package com.example.notification.shared.util;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Utility class for storing structured key/value data in a notification's opaque intent data string.
 */
@Slf4j
public final class JsonUtils {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private JsonUtils() {}

    /**
     * Parses intent data written by {@link #writeIntentData(Map)}.
     *
     * @param intentData The intent data string of a notification.
     * @return The key/value pairs, or an empty map if the input is empty or not a JSON object.
     */
    public static Map<String, String> readIntentData(String intentData) {
        if (intentData == null || intentData.trim().isEmpty()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(intentData, new TypeReference<LinkedHashMap<String, String>>() {});
        } catch (Exception e) {
            log.warn("Intent data is not a JSON object of strings: {}", intentData, e);
            return Map.of();
        }
    }

    /**
     * Converts key/value pairs into a JSON object string suitable for intent data.
     *
     * @param values The pairs to store.
     * @return A JSON object as a string, or an empty string if the map is null/empty.
     */
    public static String writeIntentData(Map<String, String> values) {
        if (values == null || values.isEmpty()) {
            return Constants.EMPTY;
        }
        try {
            return objectMapper.writeValueAsString(values);
        } catch (Exception e) {
            log.error("Failed to serialize intent data map", e);
            return Constants.EMPTY;
        }
    }
}
