package com.recoveryplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One weighted part of a composite score.
 *
 * <p>{@code normalizedValue} is always on the 0–100 scale (clamped on construction);
 * the weighted contribution is derived, never stored independently.
 * {@code gap} is null exactly when {@code complete} is true.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ScoreComponent(
    ComponentKind name,
    double weight,
    double normalizedValue,
    Map<String, Double> rawInputs,
    boolean complete,
    DataGap gap
) {
    public ScoreComponent {
        Objects.requireNonNull(name, "name");
        if (weight < 0.0 || weight > 1.0) {
            throw new IllegalArgumentException("Component weight out of range: " + name + "=" + weight);
        }
        normalizedValue = clamp(normalizedValue);
        rawInputs = rawInputs == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(rawInputs));
        if (complete && gap != null) {
            throw new IllegalArgumentException("Complete component cannot carry a data gap: " + name);
        }
        if (!complete && gap == null) {
            throw new IllegalArgumentException("Incomplete component requires a data gap: " + name);
        }
    }

    /** Component with all of its inputs present. */
    public static ScoreComponent scored(ComponentKind kind, double normalizedValue, Map<String, Double> rawInputs) {
        return new ScoreComponent(kind, kind.weight(), normalizedValue, rawInputs, true, null);
    }

    /** Component computed from a subset of its inputs; still flagged incomplete. */
    public static ScoreComponent partial(ComponentKind kind, double normalizedValue,
                                         Map<String, Double> rawInputs, DataGap gap) {
        return new ScoreComponent(kind, kind.weight(), normalizedValue, rawInputs, false, gap);
    }

    /** Component with no usable input: contributes 0. */
    public static ScoreComponent missing(ComponentKind kind, Map<String, Double> rawInputs, DataGap gap) {
        return new ScoreComponent(kind, kind.weight(), 0.0, rawInputs, false, gap);
    }

    @JsonProperty("contribution")
    public double contribution() {
        return weight * normalizedValue;
    }

    static double clamp(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(100.0, value));
    }
}
