package com.recoveryplatform.common.scoring;

import com.recoveryplatform.common.baseline.DailyValues;
import com.recoveryplatform.common.model.BiometricSample;
import com.recoveryplatform.common.model.MetricKind;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * The scored day's value per metric, already collapsed from raw samples.
 */
public record DayInputs(LocalDate day, Map<MetricKind, Double> values) {

    public DayInputs {
        Objects.requireNonNull(day, "day");
        EnumMap<MetricKind, Double> copy = new EnumMap<>(MetricKind.class);
        if (values != null) copy.putAll(values);
        values = Collections.unmodifiableMap(copy);
    }

    public static DayInputs of(LocalDate day, Map<MetricKind, Double> values) {
        return new DayInputs(day, values);
    }

    public static DayInputs empty(LocalDate day) {
        return new DayInputs(day, Map.of());
    }

    public static DayInputs fromSamples(LocalDate day, Collection<BiometricSample> samples, ZoneId zone) {
        return new DayInputs(day, DailyValues.forDay(day, samples, zone));
    }

    public OptionalDouble get(MetricKind metric) {
        Double value = values.get(metric);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    /** Present only for strictly positive values, the precondition of every ratio. */
    public OptionalDouble positive(MetricKind metric) {
        Double value = values.get(metric);
        return value != null && value > 0.0 ? OptionalDouble.of(value) : OptionalDouble.empty();
    }
}
