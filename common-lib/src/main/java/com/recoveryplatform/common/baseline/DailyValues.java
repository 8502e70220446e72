package com.recoveryplatform.common.baseline;

import com.recoveryplatform.common.model.BiometricSample;
import com.recoveryplatform.common.model.MetricKind;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Collapses raw samples into one value per metric per user-local day using each
 * metric's {@link com.recoveryplatform.common.model.DailyAggregation}.
 *
 * <p>Samples sharing {@code (metricKind, timestamp)} are treated as one sample
 * (at-least-once delivery), so duplicates never inflate a sum or skew a mean.
 */
public final class DailyValues {

    private DailyValues() {}

    /**
     * Daily values of one metric, keyed and ordered by day.
     */
    public static NavigableMap<LocalDate, Double> collapse(MetricKind metric,
                                                           Collection<BiometricSample> samples,
                                                           ZoneId zone) {
        Map<LocalDate, TreeMap<Instant, Double>> byDay = new TreeMap<>();
        for (BiometricSample sample : samples) {
            if (sample.metricKind() != metric) continue;
            byDay.computeIfAbsent(sample.day(zone), d -> new TreeMap<>())
                 .put(sample.timestamp(), sample.value());
        }

        NavigableMap<LocalDate, Double> daily = new TreeMap<>();
        byDay.forEach((day, readings) -> daily.put(day, aggregate(metric, readings)));
        return daily;
    }

    /**
     * Every metric's value on {@code day}; metrics without samples that day are absent.
     */
    public static Map<MetricKind, Double> forDay(LocalDate day,
                                                 Collection<BiometricSample> samples,
                                                 ZoneId zone) {
        Map<MetricKind, TreeMap<Instant, Double>> byMetric = new EnumMap<>(MetricKind.class);
        for (BiometricSample sample : samples) {
            if (!day.equals(sample.day(zone))) continue;
            byMetric.computeIfAbsent(sample.metricKind(), m -> new TreeMap<>())
                    .put(sample.timestamp(), sample.value());
        }

        Map<MetricKind, Double> values = new EnumMap<>(MetricKind.class);
        byMetric.forEach((metric, readings) -> values.put(metric, aggregate(metric, readings)));
        return values;
    }

    private static double aggregate(MetricKind metric, TreeMap<Instant, Double> readings) {
        return switch (metric.dailyAggregation()) {
            case MEAN  -> readings.values().stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
            case SUM   -> readings.values().stream().mapToDouble(Double::doubleValue).sum();
            case FIRST -> readings.firstEntry().getValue();
            case LAST  -> readings.lastEntry().getValue();
        };
    }
}
