package com.workflowplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stage configuration, tagged by its category. The properties map is agent specific;
 * only the keys the executor itself reads have typed accessors.
 */
public record StageConfig(
    @JsonProperty("category")   StageCategory category,
    @JsonProperty("properties") Map<String, Object> properties
) {
    public static final String AGGREGATION_STRATEGY_KEY = "aggregationStrategy";
    public static final String TIMEOUT_SECONDS_KEY      = "timeoutSeconds";
    public static final String DEFAULT_AGGREGATION      = "merge";

    public StageConfig {
        properties = properties == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public static StageConfig of(StageCategory category) {
        return new StageConfig(category, Map.of());
    }

    public static StageConfig of(StageCategory category, Map<String, Object> properties) {
        return new StageConfig(category, properties);
    }

    /** Raw aggregation strategy name for MONITOR stages; {@code merge} when absent. */
    @JsonIgnore
    public String aggregationStrategy() {
        Object value = properties.get(AGGREGATION_STRATEGY_KEY);
        return value == null ? DEFAULT_AGGREGATION : value.toString();
    }

    /** Per-stage timeout override, or {@code null} when the stage uses the execution default. */
    @JsonIgnore
    public Integer timeoutSeconds() {
        Object value = properties.get(TIMEOUT_SECONDS_KEY);
        if (value instanceof Number n) {
            return n.intValue();
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("timeoutSeconds is not a number: " + s, e);
            }
        }
        return null;
    }
}
