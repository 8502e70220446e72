package com.recoveryplatform.score.cache;

import com.recoveryplatform.common.model.CompositeScore;
import com.recoveryplatform.common.model.ScoreKey;

import java.time.Instant;
import java.util.Objects;

/**
 * A published score with its bookkeeping timestamps.
 *
 * @param lastComputedAt  when the engine produced {@code value}
 * @param lastPublishedAt when the value became visible to readers
 */
public record CacheEntry(
    ScoreKey key,
    CompositeScore value,
    Instant lastComputedAt,
    Instant lastPublishedAt
) {
    public CacheEntry {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        if (!key.equals(value.key())) {
            throw new IllegalArgumentException("Entry key " + key + " does not match score " + value.key());
        }
    }

    public static CacheEntry published(CompositeScore value, Instant publishedAt) {
        return new CacheEntry(value.key(), value, value.computedAt(), publishedAt);
    }

    boolean isNewerThan(CacheEntry other) {
        return lastComputedAt.isAfter(other.lastComputedAt);
    }
}
