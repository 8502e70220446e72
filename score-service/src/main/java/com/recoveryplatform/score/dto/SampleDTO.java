package com.recoveryplatform.score.dto;

import com.recoveryplatform.common.model.BiometricSample;
import com.recoveryplatform.common.model.MetricKind;

import java.time.Instant;

/**
 * Wire form of one incoming sample. Clock-time metrics carry minutes after
 * local midnight as {@code value}.
 */
public record SampleDTO(MetricKind metricKind, Instant timestamp, Double value) {

    public BiometricSample toSample() {
        if (metricKind == null || timestamp == null || value == null) {
            throw new IllegalArgumentException("metricKind, timestamp and value are required");
        }
        return BiometricSample.of(metricKind, timestamp, value);
    }
}
