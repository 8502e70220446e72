package com.recoveryplatform.common.scoring;

import com.recoveryplatform.common.model.ComponentKind;
import com.recoveryplatform.common.model.DataGap;
import com.recoveryplatform.common.model.MetricKind;
import com.recoveryplatform.common.model.ScoreComponent;
import com.recoveryplatform.common.model.StressBand;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Physiological stress: how far secondary vitals have drifted from their baselines.
 *
 * <pre>
 *   deviation%         = |current − baseline| / baseline × 100
 *   weightedDeviation  = deviation% × sensitivity
 *   score              = clamp(100 − mean(weightedDeviation), 0, 100)
 *
 *   Sensitivities: walking HR 1.2, respiratory rate 1.5, SpO2 2.0
 * </pre>
 *
 * <p>The mean is taken over the metrics that could be assessed. The component is
 * complete only when all three were; with none assessable it is missing.
 */
public final class PhysiologicalStressCalculator {

    static final Map<MetricKind, Double> SENSITIVITY;

    static {
        Map<MetricKind, Double> sensitivity = new EnumMap<>(MetricKind.class);
        sensitivity.put(MetricKind.WALKING_HEART_RATE, 1.2);
        sensitivity.put(MetricKind.RESPIRATORY_RATE,   1.5);
        sensitivity.put(MetricKind.OXYGEN_SATURATION,  2.0);
        SENSITIVITY = Collections.unmodifiableMap(sensitivity);
    }

    private PhysiologicalStressCalculator() {}

    public static StressAssessment assess(DayInputs inputs, BaselineSet baselines) {
        Map<MetricKind, Double> weighted = new EnumMap<>(MetricKind.class);
        DataGap firstGap = null;

        for (Map.Entry<MetricKind, Double> e : SENSITIVITY.entrySet()) {
            MetricKind metric = e.getKey();
            OptionalDouble current = inputs.positive(metric);
            if (current.isEmpty()) {
                if (firstGap == null) firstGap = DataGap.MISSING_SAMPLE;
                continue;
            }
            OptionalDouble baseline = baselines.positive(metric);
            if (baseline.isEmpty()) {
                if (firstGap == null) firstGap = DataGap.INSUFFICIENT_BASELINE;
                continue;
            }
            double deviationPct = Math.abs(current.getAsDouble() - baseline.getAsDouble())
                / baseline.getAsDouble() * 100.0;
            weighted.put(metric, deviationPct * e.getValue());
        }

        if (weighted.isEmpty()) {
            return new StressAssessment(0.0, 0.0, null, weighted, firstGap);
        }
        double avg = weighted.values().stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double score = Math.max(0.0, Math.min(100.0, 100.0 - avg));
        return new StressAssessment(score, avg, StressBand.classify(avg), weighted, firstGap);
    }

    public static ScoreComponent component(DayInputs inputs, BaselineSet baselines) {
        StressAssessment assessment = assess(inputs, baselines);

        Map<String, Double> raw = new LinkedHashMap<>();
        assessment.weightedDeviations().forEach((metric, dev) -> raw.put(metric.name(), dev));

        if (assessment.availableMetrics() == 0) {
            return ScoreComponent.missing(ComponentKind.PHYSIOLOGICAL_STRESS, raw, assessment.gap());
        }
        raw.put("averageWeightedDeviation", assessment.averageWeightedDeviation());
        if (!assessment.isComplete()) {
            return ScoreComponent.partial(ComponentKind.PHYSIOLOGICAL_STRESS, assessment.score(), raw, assessment.gap());
        }
        return ScoreComponent.scored(ComponentKind.PHYSIOLOGICAL_STRESS, assessment.score(), raw);
    }
}
