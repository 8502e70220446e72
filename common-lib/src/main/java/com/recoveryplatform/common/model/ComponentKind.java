package com.recoveryplatform.common.model;

import java.util.Arrays;
import java.util.List;

/**
 * Every component of every composite score, with its owning profile, top-level
 * weight and, for point-scaled sleep components, the maximum raw points.
 *
 * <p>Declaration order is the component order inside a {@link CompositeScore}.
 */
public enum ComponentKind {
    HRV(ScoreKind.RECOVERY, 0.50, 0),
    RESTING_HEART_RATE(ScoreKind.RECOVERY, 0.25, 0),
    SLEEP_QUALITY(ScoreKind.RECOVERY, 0.15, 0),
    PHYSIOLOGICAL_STRESS(ScoreKind.RECOVERY, 0.10, 0),

    SLEEP_DURATION(ScoreKind.SLEEP, 0.30, 30),
    DEEP_SLEEP(ScoreKind.SLEEP, 0.25, 25),
    REM_SLEEP(ScoreKind.SLEEP, 0.20, 20),
    SLEEP_EFFICIENCY(ScoreKind.SLEEP, 0.15, 15),
    BEDTIME_CONSISTENCY(ScoreKind.SLEEP, 0.10, 10);

    /** Tolerance for the weights of one profile summing to 1.0. */
    public static final double WEIGHT_TOLERANCE = 1e-6;

    private final ScoreKind scoreKind;
    private final double weight;
    private final int maxPoints;

    ComponentKind(ScoreKind scoreKind, double weight, int maxPoints) {
        this.scoreKind = scoreKind;
        this.weight    = weight;
        this.maxPoints = maxPoints;
    }

    public ScoreKind scoreKind() { return scoreKind; }

    public double weight() { return weight; }

    /** Maximum raw points of the component's own scale; 0 when not point-scaled. */
    public int maxPoints() { return maxPoints; }

    public static List<ComponentKind> of(ScoreKind scoreKind) {
        return Arrays.stream(values())
            .filter(c -> c.scoreKind == scoreKind)
            .toList();
    }

    public static double totalWeight(ScoreKind scoreKind) {
        return of(scoreKind).stream().mapToDouble(ComponentKind::weight).sum();
    }

    /**
     * @throws IllegalStateException if any profile's weights do not sum to 1.0
     */
    public static void verifyWeights() {
        for (ScoreKind kind : ScoreKind.values()) {
            double total = totalWeight(kind);
            if (Math.abs(total - 1.0) > WEIGHT_TOLERANCE) {
                throw new IllegalStateException("Component weights for " + kind + " sum to " + total);
            }
        }
    }
}
