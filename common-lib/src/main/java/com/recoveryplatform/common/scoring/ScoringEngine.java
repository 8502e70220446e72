package com.recoveryplatform.common.scoring;

import com.recoveryplatform.common.model.CompositeScore;
import com.recoveryplatform.common.model.ComponentKind;
import com.recoveryplatform.common.model.MetricKind;
import com.recoveryplatform.common.model.ScoreKind;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Entry point of the scoring engine. Stateless apart from its curve and clock;
 * the same inputs and the same clock instant always produce an equal score.
 *
 * <p>The static input maps describe which metrics a score kind reads as same-day
 * inputs and which it reads through baselines. The update coordinator uses them to
 * work out which keys a new sample invalidates.
 */
public final class ScoringEngine {

    private static final Set<MetricKind> RECOVERY_DAY_INPUTS =
        Collections.unmodifiableSet(EnumSet.allOf(MetricKind.class));

    private static final Set<MetricKind> RECOVERY_BASELINE_INPUTS = Collections.unmodifiableSet(EnumSet.of(
        MetricKind.HEART_RATE_VARIABILITY,
        MetricKind.RESTING_HEART_RATE,
        MetricKind.WALKING_HEART_RATE,
        MetricKind.RESPIRATORY_RATE,
        MetricKind.OXYGEN_SATURATION,
        MetricKind.BEDTIME,
        MetricKind.WAKE_TIME));

    private static final Set<MetricKind> SLEEP_DAY_INPUTS = Collections.unmodifiableSet(EnumSet.of(
        MetricKind.TIME_IN_BED,
        MetricKind.TIME_ASLEEP,
        MetricKind.DEEP_SLEEP,
        MetricKind.REM_SLEEP,
        MetricKind.BEDTIME));

    private static final Set<MetricKind> SLEEP_BASELINE_INPUTS =
        Collections.unmodifiableSet(EnumSet.of(MetricKind.BEDTIME));

    private final GrowthCurve curve;
    private final Clock clock;

    public ScoringEngine(GrowthCurve curve, Clock clock) {
        ComponentKind.verifyWeights();
        this.curve = Objects.requireNonNull(curve, "curve");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public GrowthCurve curve() {
        return curve;
    }

    public CompositeScore score(ScoreKind kind, LocalDate day, DayInputs inputs, BaselineSet baselines) {
        if (!day.equals(inputs.day())) {
            throw new IllegalArgumentException("Inputs are for " + inputs.day() + ", not " + day);
        }
        return switch (kind) {
            case RECOVERY -> RecoveryScoreCalculator.calculate(inputs, baselines, curve, clock.instant());
            case SLEEP    -> SleepScoreCalculator.calculate(inputs, baselines, clock.instant());
        };
    }

    public static Set<MetricKind> dayInputs(ScoreKind kind) {
        return switch (kind) {
            case RECOVERY -> RECOVERY_DAY_INPUTS;
            case SLEEP    -> SLEEP_DAY_INPUTS;
        };
    }

    public static Set<MetricKind> baselineInputs(ScoreKind kind) {
        return switch (kind) {
            case RECOVERY -> RECOVERY_BASELINE_INPUTS;
            case SLEEP    -> SLEEP_BASELINE_INPUTS;
        };
    }

    /** Score kinds that read {@code metric} as a same-day input. */
    public static Set<ScoreKind> affectedByDayInput(MetricKind metric) {
        Set<ScoreKind> kinds = EnumSet.noneOf(ScoreKind.class);
        for (ScoreKind kind : ScoreKind.values()) {
            if (dayInputs(kind).contains(metric)) kinds.add(kind);
        }
        return kinds;
    }

    /** Score kinds that read {@code metric} through a baseline. */
    public static Set<ScoreKind> affectedByBaseline(MetricKind metric) {
        Set<ScoreKind> kinds = EnumSet.noneOf(ScoreKind.class);
        for (ScoreKind kind : ScoreKind.values()) {
            if (baselineInputs(kind).contains(metric)) kinds.add(kind);
        }
        return kinds;
    }
}
