package com.recoveryplatform.common.scoring;

import com.recoveryplatform.common.model.CompositeScore;
import com.recoveryplatform.common.model.ComponentKind;
import com.recoveryplatform.common.model.DataGap;
import com.recoveryplatform.common.model.MetricKind;
import com.recoveryplatform.common.model.ScoreComponent;
import com.recoveryplatform.common.model.ScoreKind;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Recovery Score: how ready the body is today, relative to its own recent norm.
 *
 * <pre>
 *   HRV                   50%   curve(current / baseline)
 *   Resting heart rate    25%   curve(baseline / current)   lower RHR is better
 *   Sleep quality         15%   {@link SleepQualityCalculator}
 *   Physiological stress  10%   {@link PhysiologicalStressCalculator}
 * </pre>
 */
public final class RecoveryScoreCalculator {

    private RecoveryScoreCalculator() {}

    public static CompositeScore calculate(DayInputs inputs, BaselineSet baselines,
                                           GrowthCurve curve, Instant computedAt) {
        return CompositeScore.of(ScoreKind.RECOVERY, inputs.day(), components(inputs, baselines, curve), computedAt);
    }

    public static List<ScoreComponent> components(DayInputs inputs, BaselineSet baselines, GrowthCurve curve) {
        return List.of(
            hrvComponent(inputs, baselines, curve),
            restingHeartRateComponent(inputs, baselines, curve),
            SleepQualityCalculator.component(inputs, baselines),
            PhysiologicalStressCalculator.component(inputs, baselines));
    }

    static ScoreComponent hrvComponent(DayInputs inputs, BaselineSet baselines, GrowthCurve curve) {
        return ratioComponent(ComponentKind.HRV, MetricKind.HEART_RATE_VARIABILITY, inputs, baselines, curve, false);
    }

    static ScoreComponent restingHeartRateComponent(DayInputs inputs, BaselineSet baselines, GrowthCurve curve) {
        return ratioComponent(ComponentKind.RESTING_HEART_RATE, MetricKind.RESTING_HEART_RATE, inputs, baselines, curve, true);
    }

    private static ScoreComponent ratioComponent(ComponentKind kind, MetricKind metric,
                                                 DayInputs inputs, BaselineSet baselines,
                                                 GrowthCurve curve, boolean lowerIsBetter) {
        OptionalDouble current = inputs.positive(metric);
        if (current.isEmpty()) {
            return ScoreComponent.missing(kind, Map.of(), DataGap.MISSING_SAMPLE);
        }
        Map<String, Double> raw = new LinkedHashMap<>();
        raw.put("current", current.getAsDouble());

        OptionalDouble baseline = baselines.positive(metric);
        if (baseline.isEmpty()) {
            return ScoreComponent.missing(kind, raw, DataGap.INSUFFICIENT_BASELINE);
        }
        double ratio = lowerIsBetter
            ? baseline.getAsDouble() / current.getAsDouble()
            : current.getAsDouble() / baseline.getAsDouble();
        raw.put("baseline", baseline.getAsDouble());
        raw.put("ratio", ratio);
        return ScoreComponent.scored(kind, curve.score(ratio), raw);
    }
}
