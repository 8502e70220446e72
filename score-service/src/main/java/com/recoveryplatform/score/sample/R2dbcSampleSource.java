package com.recoveryplatform.score.sample;

import com.recoveryplatform.common.model.BiometricSample;
import com.recoveryplatform.common.model.MetricKind;
import com.recoveryplatform.score.model.BiometricSampleEntity;
import com.recoveryplatform.score.repository.BiometricSampleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

@Component
public class R2dbcSampleSource implements SampleSource {

    private static final Logger log = LoggerFactory.getLogger(R2dbcSampleSource.class);

    private final BiometricSampleRepository repository;

    public R2dbcSampleSource(BiometricSampleRepository repository) {
        this.repository = repository;
    }

    @Override
    public Flux<BiometricSample> fetch(MetricKind metric, Instant from, Instant to) {
        return repository.findByMetricInRange(metric.name(), utc(from), utc(to))
            .map(R2dbcSampleSource::toSample)
            .doOnError(e -> log.error("Sample fetch failed. metric={} from={} to={}", metric, from, to, e));
    }

    @Override
    public Flux<BiometricSample> fetchRange(Instant from, Instant to) {
        return repository.findInRange(utc(from), utc(to))
            .map(R2dbcSampleSource::toSample)
            .doOnError(e -> log.error("Sample range fetch failed. from={} to={}", from, to, e));
    }

    static BiometricSample toSample(BiometricSampleEntity entity) {
        return BiometricSample.of(
            MetricKind.valueOf(entity.getMetricKind()),
            entity.getSampledAt().toInstant(ZoneOffset.UTC),
            entity.getValue());
    }

    static LocalDateTime utc(Instant instant) {
        return LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    }
}
