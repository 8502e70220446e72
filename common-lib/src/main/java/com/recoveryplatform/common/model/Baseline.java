package com.recoveryplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Rolling personal reference value for one metric.
 *
 * <p>The aggregate covers the daily values of {@code [asOf - windowDays, asOf)};
 * the {@code asOf} day itself never contributes. {@code sampleCount} is the number
 * of days in the window that carried data. When it is below {@code minCoverage}
 * the baseline is {@link BaselineStatus#INSUFFICIENT} and {@code aggregate} is null.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Baseline(
    MetricKind metricKind,
    LocalDate asOf,
    int windowDays,
    Double aggregate,
    int sampleCount,
    int minCoverage,
    BaselineStatus status,
    Instant computedAt
) {
    public Baseline {
        Objects.requireNonNull(metricKind, "metricKind");
        Objects.requireNonNull(asOf, "asOf");
        Objects.requireNonNull(status, "status");
        if (status == BaselineStatus.AVAILABLE && aggregate == null) {
            throw new IllegalArgumentException("Available baseline requires an aggregate: " + metricKind);
        }
        if (status == BaselineStatus.INSUFFICIENT) {
            aggregate = null;
        }
    }

    /**
     * Builds a baseline, deciding availability from coverage.
     *
     * @param mean mean of the window's daily values; empty when the window has no data
     */
    public static Baseline from(MetricKind metricKind, LocalDate asOf, int windowDays,
                                OptionalDouble mean, int sampleCount, int minCoverage,
                                Instant computedAt) {
        boolean covered = mean.isPresent() && sampleCount >= minCoverage;
        return new Baseline(
            metricKind, asOf, windowDays,
            covered ? mean.getAsDouble() : null,
            sampleCount, minCoverage,
            covered ? BaselineStatus.AVAILABLE : BaselineStatus.INSUFFICIENT,
            computedAt);
    }

    public boolean isAvailable() {
        return status == BaselineStatus.AVAILABLE;
    }

    public OptionalDouble value() {
        return isAvailable() ? OptionalDouble.of(aggregate) : OptionalDouble.empty();
    }
}
