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
 * Sleep Score: five point-scaled components, each normalized to 0–100 before
 * the top-level weights apply.
 *
 * <pre>
 *   Duration            30%   (0–30 pts)
 *   Deep sleep          25%   (0–25 pts)
 *   REM sleep           20%   (0–20 pts)
 *   Efficiency          15%   (0–15 pts)
 *   Bedtime consistency 10%   (0–10 pts, vs. bedtime baseline)
 *
 *   normalized = points / maxPoints × 100
 *   overall    = round(Σ weight × normalized)
 * </pre>
 *
 * <p>The weighted sum only ever sees the normalized scale. Mixing raw points into
 * the headline number produces a total that disagrees with the per-component
 * percentages shown next to it.
 */
public final class SleepScoreCalculator {

    private SleepScoreCalculator() {}

    public static CompositeScore calculate(DayInputs inputs, BaselineSet baselines, Instant computedAt) {
        return CompositeScore.of(ScoreKind.SLEEP, inputs.day(), components(inputs, baselines), computedAt);
    }

    public static List<ScoreComponent> components(DayInputs inputs, BaselineSet baselines) {
        return List.of(
            durationComponent(inputs),
            deepSleepComponent(inputs),
            remSleepComponent(inputs),
            efficiencyComponent(inputs),
            bedtimeConsistencyComponent(inputs, baselines));
    }

    static ScoreComponent durationComponent(DayInputs inputs) {
        OptionalDouble asleep = inputs.get(MetricKind.TIME_ASLEEP);
        if (asleep.isEmpty()) {
            return ScoreComponent.missing(ComponentKind.SLEEP_DURATION, Map.of(), DataGap.MISSING_SAMPLE);
        }
        int points = SleepPointScale.durationPoints(asleep.getAsDouble());
        return pointsComponent(ComponentKind.SLEEP_DURATION, points, "minutesAsleep", asleep.getAsDouble());
    }

    static ScoreComponent deepSleepComponent(DayInputs inputs) {
        OptionalDouble deep = inputs.get(MetricKind.DEEP_SLEEP);
        if (deep.isEmpty()) {
            return ScoreComponent.missing(ComponentKind.DEEP_SLEEP, Map.of(), DataGap.MISSING_SAMPLE);
        }
        int points = SleepPointScale.deepSleepPoints(deep.getAsDouble());
        return pointsComponent(ComponentKind.DEEP_SLEEP, points, "deepMinutes", deep.getAsDouble());
    }

    static ScoreComponent remSleepComponent(DayInputs inputs) {
        OptionalDouble rem = inputs.get(MetricKind.REM_SLEEP);
        if (rem.isEmpty()) {
            return ScoreComponent.missing(ComponentKind.REM_SLEEP, Map.of(), DataGap.MISSING_SAMPLE);
        }
        int points = SleepPointScale.remPoints(rem.getAsDouble());
        return pointsComponent(ComponentKind.REM_SLEEP, points, "remMinutes", rem.getAsDouble());
    }

    static ScoreComponent efficiencyComponent(DayInputs inputs) {
        OptionalDouble asleep = inputs.get(MetricKind.TIME_ASLEEP);
        OptionalDouble inBed  = inputs.positive(MetricKind.TIME_IN_BED);
        if (asleep.isEmpty() || inBed.isEmpty()) {
            return ScoreComponent.missing(ComponentKind.SLEEP_EFFICIENCY, Map.of(), DataGap.MISSING_SAMPLE);
        }
        double efficiency = SleepPointScale.efficiencyPct(asleep.getAsDouble(), inBed.getAsDouble());
        int points = SleepPointScale.efficiencyPoints(efficiency);
        return pointsComponent(ComponentKind.SLEEP_EFFICIENCY, points, "efficiencyPct", efficiency);
    }

    static ScoreComponent bedtimeConsistencyComponent(DayInputs inputs, BaselineSet baselines) {
        OptionalDouble bedtime = inputs.get(MetricKind.BEDTIME);
        if (bedtime.isEmpty()) {
            return ScoreComponent.missing(ComponentKind.BEDTIME_CONSISTENCY, Map.of(), DataGap.MISSING_SAMPLE);
        }
        OptionalDouble baseline = baselines.available(MetricKind.BEDTIME);
        if (baseline.isEmpty()) {
            return ScoreComponent.missing(ComponentKind.BEDTIME_CONSISTENCY,
                Map.of("bedtimeMinute", bedtime.getAsDouble()), DataGap.INSUFFICIENT_BASELINE);
        }
        int points = SleepPointScale.bedtimeConsistencyPoints(bedtime.getAsDouble(), baseline.getAsDouble());
        Map<String, Double> raw = new LinkedHashMap<>();
        raw.put("bedtimeMinute", bedtime.getAsDouble());
        raw.put("baselineBedtimeMinute", baseline.getAsDouble());
        return pointsComponent(ComponentKind.BEDTIME_CONSISTENCY, points, raw);
    }

    private static ScoreComponent pointsComponent(ComponentKind kind, int points, String inputName, double input) {
        Map<String, Double> raw = new LinkedHashMap<>();
        raw.put(inputName, input);
        return pointsComponent(kind, points, raw);
    }

    private static ScoreComponent pointsComponent(ComponentKind kind, int points, Map<String, Double> raw) {
        raw.put("points", (double) points);
        raw.put("maxPoints", (double) kind.maxPoints());
        return ScoreComponent.scored(kind, SleepPointScale.normalize(points, kind.maxPoints()), raw);
    }
}
