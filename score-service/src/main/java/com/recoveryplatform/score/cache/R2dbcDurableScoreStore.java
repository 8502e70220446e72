package com.recoveryplatform.score.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.recoveryplatform.common.model.CompositeScore;
import com.recoveryplatform.common.model.ScoreComponent;
import com.recoveryplatform.common.model.ScoreKey;
import com.recoveryplatform.common.model.ScoreKind;
import com.recoveryplatform.score.model.ScoreHistoryEntity;
import com.recoveryplatform.score.repository.ScoreHistoryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

/**
 * {@link DurableScoreStore} on the {@code score_history} table. Components are
 * serialized as a JSON array; timestamps are stored as UTC.
 */
@Component
public class R2dbcDurableScoreStore implements DurableScoreStore {

    private static final Logger log = LoggerFactory.getLogger(R2dbcDurableScoreStore.class);

    private static final TypeReference<List<ScoreComponent>> COMPONENT_LIST = new TypeReference<>() {};

    private final ScoreHistoryRepository repository;
    private final ObjectMapper objectMapper;

    public R2dbcDurableScoreStore(ScoreHistoryRepository repository, ObjectMapper objectMapper) {
        this.repository   = repository;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<Void> save(CacheEntry entry) {
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(entry.value().components()))
            .flatMap(json -> repository.upsertScore(
                entry.key().scoreKind().name(),
                entry.key().dayKey(),
                entry.value().overall(),
                entry.value().dataComplete(),
                json,
                utc(entry.lastComputedAt()),
                utc(entry.lastPublishedAt())))
            .doOnNext(rows -> {
                if (rows == 0) {
                    log.debug("Durable row already newer, write skipped. key={}", entry.key());
                }
            })
            .then();
    }

    @Override
    public Mono<CacheEntry> find(ScoreKey key) {
        return repository.findByScoreKindAndDayKey(key.scoreKind().name(), key.dayKey())
            .flatMap(this::toEntry);
    }

    @Override
    public Flux<CacheEntry> findRecent(ScoreKind kind, long offset, int limit) {
        return repository.findRecent(kind.name(), limit, offset)
            .concatMap(this::toEntry);
    }

    @Override
    public Mono<Void> delete(ScoreKey key) {
        return repository.deleteByScoreKindAndDayKey(key.scoreKind().name(), key.dayKey());
    }

    // ── Entity Mapping ──────────────────────────────────────────────────────

    /** Rows whose components cannot be read are skipped; the score is re-derivable from samples. */
    private Mono<CacheEntry> toEntry(ScoreHistoryEntity entity) {
        try {
            List<ScoreComponent> components = objectMapper.readValue(entity.getComponents(), COMPONENT_LIST);
            Instant computedAt = entity.getComputedAt().toInstant(ZoneOffset.UTC);
            CompositeScore score = new CompositeScore(
                ScoreKind.valueOf(entity.getScoreKind()),
                entity.getDayKey(),
                entity.getOverall(),
                components,
                computedAt,
                entity.isDataComplete());
            return Mono.just(new CacheEntry(score.key(), score, computedAt,
                entity.getPublishedAt().toInstant(ZoneOffset.UTC)));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Unreadable score_history row skipped. kind={} day={}",
                     entity.getScoreKind(), entity.getDayKey(), e);
            return Mono.empty();
        }
    }

    private static LocalDateTime utc(Instant instant) {
        return LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    }
}
