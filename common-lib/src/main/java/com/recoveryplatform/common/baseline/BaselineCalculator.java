package com.recoveryplatform.common.baseline;

import com.recoveryplatform.common.model.Baseline;
import com.recoveryplatform.common.model.BiometricSample;
import com.recoveryplatform.common.model.MetricKind;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Collection;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Pure trailing-window baseline computation.
 *
 * <p>The window is {@code [asOf - windowDays, asOf)} in user-local days. Samples
 * are first collapsed to daily values; the baseline is the mean of those values
 * (circular mean for clock-time metrics) and its {@code sampleCount} is the number
 * of covered days. Samples outside the window, including any from {@code asOf}
 * itself, are ignored, so a same-day outlier never inflates its own reference.
 */
public final class BaselineCalculator {

    public static final int DEFAULT_WINDOW_DAYS = 14;

    private BaselineCalculator() {}

    /** Half the window, rounded up. */
    public static int defaultMinCoverage(int windowDays) {
        return (windowDays + 1) / 2;
    }

    public static Baseline compute(MetricKind metric, LocalDate asOf,
                                   Collection<BiometricSample> samples,
                                   int windowDays, int minCoverage,
                                   ZoneId zone, Instant computedAt) {
        if (windowDays <= 0) {
            throw new IllegalArgumentException("windowDays must be positive: " + windowDays);
        }
        LocalDate from = windowStart(asOf, windowDays);
        List<Double> values = List.copyOf(
            DailyValues.collapse(metric, samples, zone).subMap(from, true, asOf, false).values());

        OptionalDouble mean = metric.isClockTime()
            ? ClockTime.circularMean(values)
            : values.stream().mapToDouble(Double::doubleValue).average();

        return Baseline.from(metric, asOf, windowDays, mean, values.size(), minCoverage, computedAt);
    }

    public static LocalDate windowStart(LocalDate asOf, int windowDays) {
        return asOf.minusDays(windowDays);
    }

    /**
     * True when a sample on {@code sampleDay} falls inside the window of the
     * baseline for {@code asOf}.
     */
    public static boolean windowContains(LocalDate asOf, int windowDays, LocalDate sampleDay) {
        return !sampleDay.isBefore(windowStart(asOf, windowDays)) && sampleDay.isBefore(asOf);
    }
}
