package com.recoveryplatform.score.service;

import com.recoveryplatform.common.model.BiometricSample;
import com.recoveryplatform.score.repository.BiometricSampleRepository;
import com.recoveryplatform.score.sample.SampleBatch;
import com.recoveryplatform.score.sample.SampleFeed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Persists incoming samples, then announces the batch on the {@link SampleFeed}.
 * The insert is idempotent, so a re-delivered batch only re-triggers work that
 * the coordinator already treats as a no-op.
 */
@Service
public class SampleIngestionService {

    private static final Logger log = LoggerFactory.getLogger(SampleIngestionService.class);

    private final BiometricSampleRepository repository;
    private final SampleFeed sampleFeed;
    private final Clock clock;

    public SampleIngestionService(BiometricSampleRepository repository, SampleFeed sampleFeed, Clock clock) {
        this.repository = repository;
        this.sampleFeed = sampleFeed;
        this.clock      = clock;
    }

    /**
     * @return number of samples that were new
     */
    public Mono<Integer> ingest(List<BiometricSample> samples) {
        if (samples.isEmpty()) {
            return Mono.just(0);
        }
        SampleBatch batch = new SampleBatch(samples, clock.instant());
        return Flux.fromIterable(batch.samples())
            .concatMap(s -> repository.insertIfAbsent(
                s.metricKind().name(), LocalDateTime.ofInstant(s.timestamp(), ZoneOffset.UTC), s.value()))
            .reduce(0, Integer::sum)
            .doOnSuccess(inserted -> {
                log.info("SAMPLES_INGESTED received={} inserted={}", batch.samples().size(), inserted);
                sampleFeed.publish(batch);
            })
            .doOnError(e -> log.error("Sample ingestion failed. size={}", batch.samples().size(), e));
    }
}
