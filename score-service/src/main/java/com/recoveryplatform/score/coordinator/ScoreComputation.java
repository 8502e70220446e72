package com.recoveryplatform.score.coordinator;

import com.recoveryplatform.common.model.CompositeScore;
import com.recoveryplatform.common.model.ScoreKey;
import reactor.core.publisher.Mono;

/**
 * Produces a fresh score for one key from the samples and baselines currently stored.
 */
@FunctionalInterface
public interface ScoreComputation {

    Mono<CompositeScore> compute(ScoreKey key);
}
