package com.recoveryplatform.common.model;

/**
 * How several samples of one metric on the same local day collapse into that
 * day's single value.
 */
public enum DailyAggregation {
    /** Arithmetic mean of the day's readings (physiological measurements). */
    MEAN,
    /** Sum of the day's segments (sleep-stage durations in minutes). */
    SUM,
    /** Earliest sample of the day by timestamp. */
    FIRST,
    /** Latest sample of the day by timestamp. */
    LAST
}
