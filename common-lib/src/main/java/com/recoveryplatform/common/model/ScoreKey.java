package com.recoveryplatform.common.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Cache and coordination key: one composite score per kind per user-local day.
 */
public record ScoreKey(LocalDate dayKey, ScoreKind scoreKind) {

    public ScoreKey {
        Objects.requireNonNull(dayKey, "dayKey");
        Objects.requireNonNull(scoreKind, "scoreKind");
    }

    public static ScoreKey of(ScoreKind scoreKind, LocalDate dayKey) {
        return new ScoreKey(dayKey, scoreKind);
    }

    @Override
    public String toString() {
        return scoreKind + "@" + dayKey;
    }
}
