package com.recoveryplatform.common.scoring;

import com.recoveryplatform.common.model.ComponentKind;
import com.recoveryplatform.common.model.DataGap;
import com.recoveryplatform.common.model.MetricKind;
import com.recoveryplatform.common.model.ScoreComponent;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Sleep-quality sub-score feeding the Recovery Score: the sleep components at
 * reduced granularity, each on 0–100, combined with their own sub-weights.
 *
 * <pre>
 *   efficiency            30%   efficiency points / 15 × 100
 *   deep + REM proportion 30%   (deep + rem) / asleep, full marks at 40%
 *   heart-rate dip        25%   1 − sleepingHR / RHR, full marks at a 10% dip
 *   bed/wake consistency  15%   mean of bedtime and wake points / 10 × 100
 * </pre>
 *
 * <p>Parts whose inputs are missing contribute 0; the component is complete only
 * when all four parts were scored.
 */
public final class SleepQualityCalculator {

    static final double EFFICIENCY_WEIGHT   = 0.30;
    static final double DEEP_REM_WEIGHT     = 0.30;
    static final double HR_DIP_WEIGHT       = 0.25;
    static final double CONSISTENCY_WEIGHT  = 0.15;

    /** Deep + REM share of sleep at which the part scores 100. */
    static final double TARGET_DEEP_REM_PROPORTION = 0.40;

    /** Relative heart-rate drop during sleep at which the part scores 100. */
    static final double TARGET_HR_DIP = 0.10;

    /** Sleeping heart rate is capped at this multiple of RHR before the dip is taken. */
    static final double SLEEPING_HR_CAP = 1.1;

    private SleepQualityCalculator() {}

    private record Part(OptionalDouble score, DataGap gap) {
        static Part of(double score) { return new Part(OptionalDouble.of(score), null); }
        static Part gap(DataGap gap) { return new Part(OptionalDouble.empty(), gap); }
    }

    public static ScoreComponent component(DayInputs inputs, BaselineSet baselines) {
        Part efficiency  = efficiency(inputs);
        Part deepRem     = deepRemProportion(inputs);
        Part hrDip       = heartRateDip(inputs, baselines);
        Part consistency = consistency(inputs, baselines);

        Map<String, Double> raw = new LinkedHashMap<>();
        double total = 0.0;
        boolean anyScored = false;
        DataGap firstGap = null;

        Part[] parts = {efficiency, deepRem, hrDip, consistency};
        double[] weights = {EFFICIENCY_WEIGHT, DEEP_REM_WEIGHT, HR_DIP_WEIGHT, CONSISTENCY_WEIGHT};
        String[] names = {"efficiency", "deepRemProportion", "heartRateDip", "consistency"};
        for (int i = 0; i < parts.length; i++) {
            if (parts[i].score().isPresent()) {
                double score = parts[i].score().getAsDouble();
                raw.put(names[i], score);
                total += weights[i] * score;
                anyScored = true;
            } else if (firstGap == null) {
                firstGap = parts[i].gap();
            }
        }

        if (!anyScored) {
            return ScoreComponent.missing(ComponentKind.SLEEP_QUALITY, raw, firstGap);
        }
        if (firstGap != null) {
            return ScoreComponent.partial(ComponentKind.SLEEP_QUALITY, total, raw, firstGap);
        }
        return ScoreComponent.scored(ComponentKind.SLEEP_QUALITY, total, raw);
    }

    static Part efficiency(DayInputs inputs) {
        OptionalDouble asleep = inputs.get(MetricKind.TIME_ASLEEP);
        OptionalDouble inBed  = inputs.positive(MetricKind.TIME_IN_BED);
        if (asleep.isEmpty() || inBed.isEmpty()) {
            return Part.gap(DataGap.MISSING_SAMPLE);
        }
        double pct = SleepPointScale.efficiencyPct(asleep.getAsDouble(), inBed.getAsDouble());
        int points = SleepPointScale.efficiencyPoints(pct);
        return Part.of(SleepPointScale.normalize(points, ComponentKind.SLEEP_EFFICIENCY.maxPoints()));
    }

    static Part deepRemProportion(DayInputs inputs) {
        OptionalDouble asleep = inputs.positive(MetricKind.TIME_ASLEEP);
        OptionalDouble deep   = inputs.get(MetricKind.DEEP_SLEEP);
        OptionalDouble rem    = inputs.get(MetricKind.REM_SLEEP);
        if (asleep.isEmpty() || deep.isEmpty() || rem.isEmpty()) {
            return Part.gap(DataGap.MISSING_SAMPLE);
        }
        double proportion = (deep.getAsDouble() + rem.getAsDouble()) / asleep.getAsDouble();
        return Part.of(clamp(proportion / TARGET_DEEP_REM_PROPORTION * 100.0));
    }

    static Part heartRateDip(DayInputs inputs, BaselineSet baselines) {
        OptionalDouble sleeping = inputs.positive(MetricKind.SLEEPING_HEART_RATE);
        if (sleeping.isEmpty()) {
            return Part.gap(DataGap.MISSING_SAMPLE);
        }
        OptionalDouble rhr = inputs.positive(MetricKind.RESTING_HEART_RATE);
        if (rhr.isEmpty()) {
            rhr = baselines.positive(MetricKind.RESTING_HEART_RATE);
        }
        if (rhr.isEmpty()) {
            return Part.gap(DataGap.MISSING_SAMPLE);
        }
        double cappedSleeping = Math.min(sleeping.getAsDouble(), rhr.getAsDouble() * SLEEPING_HR_CAP);
        double dip = 1.0 - cappedSleeping / rhr.getAsDouble();
        return Part.of(clamp(dip / TARGET_HR_DIP * 100.0));
    }

    static Part consistency(DayInputs inputs, BaselineSet baselines) {
        OptionalDouble bedtime = inputs.get(MetricKind.BEDTIME);
        OptionalDouble wake    = inputs.get(MetricKind.WAKE_TIME);
        if (bedtime.isEmpty() && wake.isEmpty()) {
            return Part.gap(DataGap.MISSING_SAMPLE);
        }
        OptionalDouble bedtimeBaseline = baselines.available(MetricKind.BEDTIME);
        OptionalDouble wakeBaseline    = baselines.available(MetricKind.WAKE_TIME);

        double sum = 0.0;
        int count = 0;
        if (bedtime.isPresent() && bedtimeBaseline.isPresent()) {
            sum += SleepPointScale.bedtimeConsistencyPoints(bedtime.getAsDouble(), bedtimeBaseline.getAsDouble());
            count++;
        }
        if (wake.isPresent() && wakeBaseline.isPresent()) {
            sum += SleepPointScale.wakeConsistencyPoints(wake.getAsDouble(), wakeBaseline.getAsDouble());
            count++;
        }
        if (count == 0) {
            return Part.gap(DataGap.INSUFFICIENT_BASELINE);
        }
        return Part.of(sum / count * 10.0);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(100.0, value));
    }
}
