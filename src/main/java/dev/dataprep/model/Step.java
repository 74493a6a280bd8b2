package dev.dataprep.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One parameterised transformation in a recipe. {@code type} is the key into the step registry;
 * {@code params} is validated against that step's parameter type before it runs.
 */
public record Step(
    String id,
    String type,
    String label,
    Map<String, Object> params
) {
    public Step {
        params = params == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public static Step of(String id, String type, Map<String, Object> params) {
        return new Step(id, type, type, params);
    }
}
