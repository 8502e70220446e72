package com.recoveryplatform.score.service;

import com.recoveryplatform.common.model.Baseline;
import com.recoveryplatform.common.model.CompositeScore;
import com.recoveryplatform.common.model.MetricKind;
import com.recoveryplatform.common.model.ScoreKey;
import com.recoveryplatform.common.model.ScoreKind;
import com.recoveryplatform.score.baseline.BaselineTracker;
import com.recoveryplatform.score.cache.CacheEntry;
import com.recoveryplatform.score.cache.CacheStats;
import com.recoveryplatform.score.cache.ScoreCacheStore;
import com.recoveryplatform.score.coordinator.ScoreUpdateCoordinator;
import com.recoveryplatform.score.dto.FreshnessStatusDTO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Read side for consumers. Reads never compute inline: a miss asks the
 * coordinator to compute and the result arrives through the cache and the
 * update stream.
 */
@Service
public class ScoreQueryService {

    private static final Logger log = LoggerFactory.getLogger(ScoreQueryService.class);

    static final int MAX_RANGE_DAYS = 366;
    static final int MAX_PAGE_SIZE  = 100;

    private final ScoreCacheStore cacheStore;
    private final ScoreUpdateCoordinator coordinator;
    private final BaselineTracker baselineTracker;
    private final FreshnessPolicy freshnessPolicy;
    private final Clock clock;
    private final ZoneId zone;

    public ScoreQueryService(ScoreCacheStore cacheStore,
                             ScoreUpdateCoordinator coordinator,
                             BaselineTracker baselineTracker,
                             FreshnessPolicy freshnessPolicy,
                             Clock clock,
                             ZoneId scoringZone) {
        this.cacheStore      = cacheStore;
        this.coordinator     = coordinator;
        this.baselineTracker = baselineTracker;
        this.freshnessPolicy = freshnessPolicy;
        this.clock           = clock;
        this.zone            = scoringZone;
    }

    /** Cached score, or empty after scheduling a computation for a never-computed key. */
    public Mono<CompositeScore> currentScore(ScoreKind kind, LocalDate day) {
        ScoreKey key = ScoreKey.of(kind, day);
        return cacheStore.get(key)
            .switchIfEmpty(Mono.defer(() -> {
                if (!day.isAfter(today()) && coordinator.requestCompute(key)) {
                    log.info("Score not cached, computation requested. key={}", key);
                }
                return Mono.empty();
            }));
    }

    /** Scores of the last {@code rangeDays} days including today, most recent first. */
    public Flux<CompositeScore> history(ScoreKind kind, int rangeDays) {
        if (rangeDays <= 0 || rangeDays > MAX_RANGE_DAYS) {
            return Flux.error(new IllegalArgumentException(
                "rangeDays must be in 1.." + MAX_RANGE_DAYS + ": " + rangeDays));
        }
        LocalDate oldest = today().minusDays(rangeDays - 1L);
        return cacheStore.listRecent(kind, 0, rangeDays)
            .filter(score -> !score.dayKey().isBefore(oldest));
    }

    public Flux<CompositeScore> listRecent(ScoreKind kind, long offset, int limit) {
        if (limit > MAX_PAGE_SIZE) {
            return Flux.error(new IllegalArgumentException("limit must be at most " + MAX_PAGE_SIZE + ": " + limit));
        }
        return cacheStore.listRecent(kind, offset, limit);
    }

    public Mono<FreshnessStatusDTO> freshnessStatus(ScoreKind kind, LocalDate day) {
        ScoreKey key = ScoreKey.of(kind, day);
        return cacheStore.getEntry(key)
            .map(entry -> freshnessPolicy.evaluate(key, coordinator.state(key), entry))
            .switchIfEmpty(Mono.fromSupplier(() ->
                freshnessPolicy.evaluate(key, coordinator.state(key), (CacheEntry) null)));
    }

    /** Drops the cached score and schedules a recompute from stored samples. */
    public Mono<Void> recompute(ScoreKind kind, LocalDate day) {
        ScoreKey key = ScoreKey.of(kind, day);
        return cacheStore.invalidate(key)
            .then(Mono.fromRunnable(() -> coordinator.invalidate(key)));
    }

    public Mono<Baseline> baseline(MetricKind metric, LocalDate asOf) {
        return baselineTracker.refreshBaseline(metric, asOf);
    }

    public Flux<CompositeScore> updates() {
        return coordinator.updates();
    }

    public CacheStats cacheStats() {
        return cacheStore.stats();
    }

    private LocalDate today() {
        return clock.instant().atZone(zone).toLocalDate();
    }
}
