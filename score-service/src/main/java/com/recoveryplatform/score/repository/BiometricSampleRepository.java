package com.recoveryplatform.score.repository;

import com.recoveryplatform.score.model.BiometricSampleEntity;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface BiometricSampleRepository extends ReactiveCrudRepository<BiometricSampleEntity, Long> {

    /**
     * Idempotent insert keyed on {@code (metric_kind, sampled_at)}.
     *
     * @return rows inserted: 1 for a new sample, 0 for a duplicate
     */
    @Modifying
    @Query("""
        INSERT INTO biometric_sample (metric_kind, sampled_at, value, received_at)
        VALUES (:metricKind, :sampledAt, :value, NOW())
        ON CONFLICT (metric_kind, sampled_at) DO NOTHING
        """)
    Mono<Integer> insertIfAbsent(String metricKind, LocalDateTime sampledAt, double value);

    /** Samples of one metric in the half-open range {@code [from, to)}. */
    @Query("""
        SELECT * FROM biometric_sample
        WHERE metric_kind = :metricKind
          AND sampled_at >= :from
          AND sampled_at <  :to
        ORDER BY sampled_at
        """)
    Flux<BiometricSampleEntity> findByMetricInRange(String metricKind, LocalDateTime from, LocalDateTime to);

    /** Samples of every metric in the half-open range {@code [from, to)}. */
    @Query("""
        SELECT * FROM biometric_sample
        WHERE sampled_at >= :from
          AND sampled_at <  :to
        ORDER BY sampled_at
        """)
    Flux<BiometricSampleEntity> findInRange(LocalDateTime from, LocalDateTime to);
}
