package com.recoveryplatform.score.repository;

import com.recoveryplatform.score.model.ScoreHistoryEntity;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Repository
public interface ScoreHistoryRepository extends ReactiveCrudRepository<ScoreHistoryEntity, Long> {

    /**
     * Inserts or replaces the row for {@code (scoreKind, dayKey)}. A row is never
     * replaced by a score computed earlier than the one it holds, so a slow
     * durable write cannot roll a newer value back.
     */
    @Modifying
    @Query("""
        INSERT INTO score_history
            (score_kind, day_key, overall, data_complete, components, computed_at, published_at)
        VALUES
            (:scoreKind, :dayKey, :overall, :dataComplete, :components, :computedAt, :publishedAt)
        ON CONFLICT (score_kind, day_key) DO UPDATE SET
            overall       = EXCLUDED.overall,
            data_complete = EXCLUDED.data_complete,
            components    = EXCLUDED.components,
            computed_at   = EXCLUDED.computed_at,
            published_at  = EXCLUDED.published_at
        WHERE score_history.computed_at <= EXCLUDED.computed_at
        """)
    Mono<Integer> upsertScore(String scoreKind, LocalDate dayKey, int overall, boolean dataComplete,
                              String components, LocalDateTime computedAt, LocalDateTime publishedAt);

    Mono<ScoreHistoryEntity> findByScoreKindAndDayKey(String scoreKind, LocalDate dayKey);

    @Query("""
        SELECT * FROM score_history
        WHERE score_kind = :scoreKind
        ORDER BY day_key DESC
        LIMIT :limit OFFSET :offset
        """)
    Flux<ScoreHistoryEntity> findRecent(String scoreKind, int limit, long offset);

    Mono<Void> deleteByScoreKindAndDayKey(String scoreKind, LocalDate dayKey);
}
