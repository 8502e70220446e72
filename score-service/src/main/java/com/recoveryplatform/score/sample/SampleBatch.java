package com.recoveryplatform.score.sample;

import com.recoveryplatform.common.model.BiometricSample;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One delivery from the health-data provider. Delivery is at-least-once and
 * batches may mix metric kinds and days.
 */
public record SampleBatch(List<BiometricSample> samples, Instant receivedAt) {

    public SampleBatch {
        samples = List.copyOf(samples);
        Objects.requireNonNull(receivedAt, "receivedAt");
    }

    public boolean isEmpty() {
        return samples.isEmpty();
    }
}
