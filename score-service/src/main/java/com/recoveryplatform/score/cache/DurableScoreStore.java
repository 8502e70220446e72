package com.recoveryplatform.score.cache;

import com.recoveryplatform.common.model.ScoreKey;
import com.recoveryplatform.common.model.ScoreKind;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Durable tier behind {@link ScoreCacheStore}. Implementations must never
 * replace a stored entry with one computed earlier.
 */
public interface DurableScoreStore {

    Mono<Void> save(CacheEntry entry);

    Mono<CacheEntry> find(ScoreKey key);

    /** Most recent day first. */
    Flux<CacheEntry> findRecent(ScoreKind kind, long offset, int limit);

    Mono<Void> delete(ScoreKey key);
}
