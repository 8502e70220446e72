package com.recoveryplatform.common.baseline;

import java.util.Collection;
import java.util.OptionalDouble;

/**
 * Arithmetic on clock minutes (minutes after local midnight) that wraps at 24h.
 */
public final class ClockTime {

    public static final int MINUTES_PER_DAY = 1_440;

    private static final int HALF_DAY = MINUTES_PER_DAY / 2;

    private ClockTime() {}

    /** Maps any minute value onto {@code [0, 1440)}. */
    public static double normalize(double minuteOfDay) {
        double m = minuteOfDay % MINUTES_PER_DAY;
        return m < 0 ? m + MINUTES_PER_DAY : m;
    }

    /**
     * Circular mean of clock minutes: 23:30 and 00:30 average to 00:00.
     * Empty when there are no values or the values cancel out exactly.
     */
    public static OptionalDouble circularMean(Collection<Double> minutesOfDay) {
        if (minutesOfDay.isEmpty()) {
            return OptionalDouble.empty();
        }
        double sinSum = 0.0;
        double cosSum = 0.0;
        for (double minute : minutesOfDay) {
            double angle = normalize(minute) / MINUTES_PER_DAY * 2.0 * Math.PI;
            sinSum += Math.sin(angle);
            cosSum += Math.cos(angle);
        }
        if (Math.abs(sinSum) < 1e-9 && Math.abs(cosSum) < 1e-9) {
            return OptionalDouble.empty();
        }
        double meanAngle = Math.atan2(sinSum, cosSum);
        return OptionalDouble.of(normalize(meanAngle / (2.0 * Math.PI) * MINUTES_PER_DAY));
    }

    /**
     * Signed shortest distance from {@code reference} to {@code actual} in minutes,
     * in {@code [-720, 720)}. Positive means {@code actual} is later.
     */
    public static double signedDeviation(double actual, double reference) {
        double diff = normalize(actual - reference);
        return diff >= HALF_DAY ? diff - MINUTES_PER_DAY : diff;
    }
}
