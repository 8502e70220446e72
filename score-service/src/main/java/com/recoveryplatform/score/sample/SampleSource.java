package com.recoveryplatform.score.sample;

import com.recoveryplatform.common.model.BiometricSample;
import com.recoveryplatform.common.model.MetricKind;
import reactor.core.publisher.Flux;

import java.time.Instant;

/**
 * Read side of the sample store. Both ranges are half-open: {@code [from, to)}.
 */
public interface SampleSource {

    Flux<BiometricSample> fetch(MetricKind metric, Instant from, Instant to);

    Flux<BiometricSample> fetchRange(Instant from, Instant to);
}
