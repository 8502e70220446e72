package com.recoveryplatform.common.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Objects;

/**
 * One externally supplied reading. Identity is {@code (metricKind, timestamp)};
 * a re-delivered sample with the same identity is the same sample.
 */
public record BiometricSample(
    MetricKind metricKind,
    Instant timestamp,
    double value
) {
    public BiometricSample {
        Objects.requireNonNull(metricKind, "metricKind");
        Objects.requireNonNull(timestamp, "timestamp");
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Sample value must be finite: " + metricKind + "@" + timestamp);
        }
    }

    public static BiometricSample of(MetricKind metricKind, Instant timestamp, double value) {
        return new BiometricSample(metricKind, timestamp, value);
    }

    /** The user-local calendar day this sample is attributed to. */
    public LocalDate day(ZoneId zone) {
        return timestamp.atZone(zone).toLocalDate();
    }
}
