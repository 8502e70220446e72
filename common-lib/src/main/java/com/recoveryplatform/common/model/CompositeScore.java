package com.recoveryplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Final 0–100 score for one kind on one user-local day.
 *
 * <p>Immutable. A newer computation for the same day produces a new instance
 * that supersedes this one; nothing patches an existing score.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CompositeScore(
    ScoreKind scoreKind,
    LocalDate dayKey,
    int overall,
    List<ScoreComponent> components,
    Instant computedAt,
    boolean dataComplete
) {
    public CompositeScore {
        Objects.requireNonNull(scoreKind, "scoreKind");
        Objects.requireNonNull(dayKey, "dayKey");
        Objects.requireNonNull(computedAt, "computedAt");
        components = List.copyOf(components);
        if (overall < 0 || overall > 100) {
            throw new IllegalArgumentException("Overall score out of range: " + overall);
        }
    }

    /**
     * Assembles a score from already normalized components:
     * {@code overall = round(clamp(Σ contribution))}, complete iff every component is.
     */
    public static CompositeScore of(ScoreKind scoreKind, LocalDate dayKey,
                                    List<ScoreComponent> components, Instant computedAt) {
        double total = 0.0;
        boolean complete = true;
        for (ScoreComponent component : components) {
            total += component.contribution();
            complete &= component.complete();
        }
        int overall = (int) Math.round(ScoreComponent.clamp(total));
        return new CompositeScore(scoreKind, dayKey, overall, components, computedAt, complete);
    }

    public ScoreKey key() {
        return ScoreKey.of(scoreKind, dayKey);
    }

    public Optional<ScoreComponent> find(ComponentKind kind) {
        return components.stream().filter(c -> c.name() == kind).findFirst();
    }
}
