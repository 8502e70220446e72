package com.recoveryplatform.common.scoring;

import com.recoveryplatform.common.model.Baseline;
import com.recoveryplatform.common.model.MetricKind;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Baselines fetched once per metric for a single scoring pass. Components read
 * from this set; they never trigger baseline computation themselves.
 */
public record BaselineSet(Map<MetricKind, Baseline> baselines) {

    public BaselineSet {
        EnumMap<MetricKind, Baseline> copy = new EnumMap<>(MetricKind.class);
        if (baselines != null) copy.putAll(baselines);
        baselines = Collections.unmodifiableMap(copy);
    }

    public static BaselineSet of(Collection<Baseline> baselines) {
        Map<MetricKind, Baseline> map = new EnumMap<>(MetricKind.class);
        for (Baseline baseline : baselines) {
            map.put(baseline.metricKind(), baseline);
        }
        return new BaselineSet(map);
    }

    public static BaselineSet empty() {
        return new BaselineSet(Map.of());
    }

    public Optional<Baseline> get(MetricKind metric) {
        return Optional.ofNullable(baselines.get(metric));
    }

    /** The aggregate when the baseline exists, is available and is strictly positive. */
    public OptionalDouble positive(MetricKind metric) {
        Baseline baseline = baselines.get(metric);
        if (baseline == null || !baseline.isAvailable() || baseline.aggregate() <= 0.0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(baseline.aggregate());
    }

    /** The aggregate when the baseline is available, without a sign check (clock-time metrics). */
    public OptionalDouble available(MetricKind metric) {
        Baseline baseline = baselines.get(metric);
        return baseline == null ? OptionalDouble.empty() : baseline.value();
    }
}
