package com.recoveryplatform.common.scoring;

/**
 * Baseline-ratio growth curve shared by the HRV and resting-heart-rate components.
 *
 * <p>{@code ratio} is oriented so that values above 1.0 are always "better than
 * baseline". The curve is anchored at {@code ratio == 1.0 → anchorScore}:
 * <pre>
 *   ratio ≥ 1 : anchor + (100 − anchor) × (1 − e^(−upsideRate × (ratio − 1)))
 *   ratio &lt; 1 : anchor × max(0, 1 − downsideRate × (1 − ratio))
 * </pre>
 * Both branches are monotonic non-decreasing and meet at the anchor; the result is
 * clamped to [0, 100]. Non-finite or non-positive ratios score 0.
 *
 * <p>Default constants: +12.5% over baseline scores ≈87, +20% ≈91;
 * −20% scores 37.5 and −40% or worse scores 0.
 */
public record GrowthCurve(double anchorScore, double upsideRate, double downsideRate) {

    public static final GrowthCurve DEFAULT = new GrowthCurve(75.0, 5.0, 2.5);

    public GrowthCurve {
        if (!(anchorScore > 0.0 && anchorScore < 100.0)) {
            throw new IllegalArgumentException("anchorScore must be in (0, 100): " + anchorScore);
        }
        if (!(upsideRate > 0.0) || !(downsideRate > 0.0)) {
            throw new IllegalArgumentException(
                "Curve rates must be positive: upside=" + upsideRate + " downside=" + downsideRate);
        }
    }

    public double score(double ratio) {
        if (!Double.isFinite(ratio) || ratio <= 0.0) {
            return 0.0;
        }
        double raw;
        if (ratio >= 1.0) {
            raw = anchorScore + (100.0 - anchorScore) * (1.0 - Math.exp(-upsideRate * (ratio - 1.0)));
        } else {
            raw = anchorScore * Math.max(0.0, 1.0 - downsideRate * (1.0 - ratio));
        }
        return Math.max(0.0, Math.min(100.0, raw));
    }
}
