package com.recoveryplatform.common.model;

/**
 * Closed set of biometric metrics accepted by the scoring engine.
 *
 * <p>Units: heart rates in BPM, HRV (SDNN) in milliseconds, respiratory rate in
 * breaths/min, oxygen saturation in percent, sleep durations in minutes.
 * {@link #BEDTIME} and {@link #WAKE_TIME} carry the clock minute after local
 * midnight (0–1439) and are timestamped at wake-up, so a night belongs to the
 * day it ends on.
 */
public enum MetricKind {
    HEART_RATE_VARIABILITY(DailyAggregation.MEAN),
    RESTING_HEART_RATE(DailyAggregation.MEAN),
    SLEEPING_HEART_RATE(DailyAggregation.MEAN),
    WALKING_HEART_RATE(DailyAggregation.MEAN),
    RESPIRATORY_RATE(DailyAggregation.MEAN),
    OXYGEN_SATURATION(DailyAggregation.MEAN),
    TIME_IN_BED(DailyAggregation.SUM),
    TIME_ASLEEP(DailyAggregation.SUM),
    DEEP_SLEEP(DailyAggregation.SUM),
    REM_SLEEP(DailyAggregation.SUM),
    BEDTIME(DailyAggregation.FIRST),
    WAKE_TIME(DailyAggregation.LAST);

    private final DailyAggregation dailyAggregation;

    MetricKind(DailyAggregation dailyAggregation) {
        this.dailyAggregation = dailyAggregation;
    }

    public DailyAggregation dailyAggregation() {
        return dailyAggregation;
    }

    /** Clock-time metrics wrap at midnight and must be averaged on the circle. */
    public boolean isClockTime() {
        return this == BEDTIME || this == WAKE_TIME;
    }
}
