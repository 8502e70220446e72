package com.recoveryplatform.common.scoring;

import com.recoveryplatform.common.model.DataGap;
import com.recoveryplatform.common.model.MetricKind;
import com.recoveryplatform.common.model.StressBand;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Intermediate result of the physiological stress assessment.
 *
 * @param score                     0–100, higher means less deviation from baseline
 * @param averageWeightedDeviation  mean of the sensitivity-weighted deviations, percent
 * @param band                      descriptive band for {@code averageWeightedDeviation}; null when nothing was assessed
 * @param weightedDeviations        per-metric weighted deviation, only for metrics that were assessed
 * @param gap                       first reason a metric could not be assessed, or null when all were
 */
public record StressAssessment(
    double score,
    double averageWeightedDeviation,
    StressBand band,
    Map<MetricKind, Double> weightedDeviations,
    DataGap gap
) {

    public StressAssessment {
        weightedDeviations = weightedDeviations.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new EnumMap<>(weightedDeviations));
    }

    public int availableMetrics() {
        return weightedDeviations.size();
    }

    public boolean isComplete() {
        return gap == null;
    }
}
