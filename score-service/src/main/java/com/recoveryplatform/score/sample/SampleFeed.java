package com.recoveryplatform.score.sample;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * In-process notification stream of persisted sample batches. Publishing never
 * blocks; subscribers receive batches on the publisher's thread.
 */
@Component
public class SampleFeed {

    private static final Logger log = LoggerFactory.getLogger(SampleFeed.class);

    private final Sinks.Many<SampleBatch> sink = Sinks.many().multicast().onBackpressureBuffer(256);

    public synchronized void publish(SampleBatch batch) {
        Sinks.EmitResult result = sink.tryEmitNext(batch);
        if (result.isFailure()) {
            log.warn("SAMPLE_BATCH_DROPPED size={} result={}", batch.samples().size(), result);
        }
    }

    public Flux<SampleBatch> batches() {
        return sink.asFlux();
    }
}
