package com.phillippitts.voicebridge.presentation.controller;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds snake_case JSON response bodies.
 */
final class ResponseBodies {

    private ResponseBodies() {
    }

    /**
     * Ordered map from alternating keys and values. Unlike {@code Map.of}, null values are kept
     * and serialized as JSON null.
     */
    static Map<String, Object> of(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected key/value pairs, got " + keyValues.length + " items");
        }
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return map;
    }
}
