package com.recoveryplatform.common.scoring;

import com.recoveryplatform.common.baseline.ClockTime;

/**
 * Raw point scales of the sleep components. Each scale has its own maximum
 * (see {@link com.recoveryplatform.common.model.ComponentKind#maxPoints()});
 * callers normalize to 0–100 before any weighting.
 */
public final class SleepPointScale {

    /** Sleep efficiency above this is treated as a data artefact and capped. */
    static final double MAX_EFFICIENCY_PCT = 100.0;

    private SleepPointScale() {}

    /** Duration points, 0–30, from minutes asleep. */
    public static int durationPoints(double minutesAsleep) {
        if (minutesAsleep > 480) return 30;
        if (minutesAsleep >= 470) return 29;
        if (minutesAsleep >= 460) return 28;
        if (minutesAsleep >= 450) return 27;
        if (minutesAsleep >= 440) return 26;
        if (minutesAsleep >= 420) return 25;
        if (minutesAsleep >= 410) return 24;
        if (minutesAsleep >= 400) return 22;
        if (minutesAsleep >= 390) return 20;
        if (minutesAsleep >= 380) return 18;
        if (minutesAsleep >= 370) return 16;
        if (minutesAsleep >= 360) return 15;
        if (minutesAsleep >= 330) return 10;
        if (minutesAsleep >= 300) return 5;
        return 0;
    }

    /** Deep-sleep points, 0–25, from minutes of deep sleep. */
    public static int deepSleepPoints(double deepMinutes) {
        if (deepMinutes >= 105) return 25;
        if (deepMinutes >= 90)  return 22;
        if (deepMinutes >= 75)  return 18;
        if (deepMinutes >= 60)  return 14;
        if (deepMinutes >= 45)  return 8;
        return 0;
    }

    /** REM points, 0–20; below one hour the scale is proportional up to 5 points. */
    public static int remPoints(double remMinutes) {
        if (remMinutes >= 120) return 20;
        if (remMinutes >= 105) return 18;
        if (remMinutes >= 90)  return 16;
        if (remMinutes >= 75)  return 13;
        if (remMinutes >= 60)  return 10;
        if (remMinutes <= 0)   return 0;
        return (int) Math.floor(remMinutes / 60.0 * 5.0);
    }

    /** Efficiency as a percentage of time in bed, capped at 100. */
    public static double efficiencyPct(double minutesAsleep, double minutesInBed) {
        if (minutesInBed <= 0) return 0.0;
        return Math.min(MAX_EFFICIENCY_PCT, minutesAsleep / minutesInBed * 100.0);
    }

    /** Efficiency points, 0–15. */
    public static int efficiencyPoints(double efficiencyPct) {
        if (efficiencyPct >= 95)   return 15;
        if (efficiencyPct >= 92.5) return 12;
        if (efficiencyPct >= 90)   return 10;
        if (efficiencyPct >= 85)   return 5;
        return 0;
    }

    /**
     * Bedtime consistency points, 0–10. Going to bed at or before the baseline
     * bedtime scores 10; each full 10 minutes later costs a point.
     */
    public static int bedtimeConsistencyPoints(double bedtimeMinute, double baselineBedtimeMinute) {
        double late = ClockTime.signedDeviation(bedtimeMinute, baselineBedtimeMinute);
        if (late <= 0) return 10;
        return (int) Math.floor(Math.max(0.0, 10.0 - late / 10.0));
    }

    /** Wake-time consistency points, 0–10; deviation in either direction costs a point per 10 minutes. */
    public static int wakeConsistencyPoints(double wakeMinute, double baselineWakeMinute) {
        double deviation = Math.abs(ClockTime.signedDeviation(wakeMinute, baselineWakeMinute));
        return (int) Math.floor(Math.max(0.0, 10.0 - deviation / 10.0));
    }

    public static double normalize(int points, int maxPoints) {
        return (double) points / maxPoints * 100.0;
    }
}
