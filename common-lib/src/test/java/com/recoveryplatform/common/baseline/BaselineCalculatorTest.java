package com.recoveryplatform.common.baseline;

import com.recoveryplatform.common.model.Baseline;
import com.recoveryplatform.common.model.BaselineStatus;
import com.recoveryplatform.common.model.BiometricSample;
import com.recoveryplatform.common.model.MetricKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of {@link BaselineCalculator} and {@link DailyValues}.
 */
class BaselineCalculatorTest {

    private static final ZoneId UTC = ZoneOffset.UTC;
    private static final LocalDate AS_OF = LocalDate.of(2024, 3, 15);
    private static final Instant NOW = Instant.parse("2024-03-15T12:00:00Z");

    private static BiometricSample at(MetricKind metric, LocalDate day, int hour, double value) {
        return BiometricSample.of(metric, day.atTime(hour, 0).toInstant(ZoneOffset.UTC), value);
    }

    private static List<BiometricSample> daily(MetricKind metric, LocalDate from, int days, double value) {
        List<BiometricSample> samples = new ArrayList<>();
        for (int i = 0; i < days; i++) {
            samples.add(at(metric, from.plusDays(i), 7, value));
        }
        return samples;
    }

    // ── Window bounds ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("window [asOf - 14, asOf)")
    class WindowTests {

        @Test
        @DisplayName("14 covered days → AVAILABLE with the mean of daily values")
        void fullWindow_available() {
            List<BiometricSample> samples = daily(MetricKind.HEART_RATE_VARIABILITY, AS_OF.minusDays(14), 14, 40.0);
            Baseline b = BaselineCalculator.compute(MetricKind.HEART_RATE_VARIABILITY, AS_OF, samples, 14, 7, UTC, NOW);

            assertEquals(BaselineStatus.AVAILABLE, b.status());
            assertEquals(40.0, b.aggregate(), 1e-9);
            assertEquals(14, b.sampleCount());
            assertEquals(NOW, b.computedAt());
        }

        @Test
        @DisplayName("current-day outlier never enters its own baseline")
        void asOfDay_excluded() {
            List<BiometricSample> samples = new ArrayList<>(
                daily(MetricKind.HEART_RATE_VARIABILITY, AS_OF.minusDays(14), 14, 40.0));
            samples.add(at(MetricKind.HEART_RATE_VARIABILITY, AS_OF, 7, 400.0));

            Baseline b = BaselineCalculator.compute(MetricKind.HEART_RATE_VARIABILITY, AS_OF, samples, 14, 7, UTC, NOW);
            assertEquals(40.0, b.aggregate(), 1e-9);
            assertEquals(14, b.sampleCount());
        }

        @Test
        @DisplayName("day 15 before asOf is outside the window")
        void oldDay_excluded() {
            List<BiometricSample> samples = new ArrayList<>(
                daily(MetricKind.HEART_RATE_VARIABILITY, AS_OF.minusDays(14), 14, 40.0));
            samples.add(at(MetricKind.HEART_RATE_VARIABILITY, AS_OF.minusDays(15), 7, 10.0));

            Baseline b = BaselineCalculator.compute(MetricKind.HEART_RATE_VARIABILITY, AS_OF, samples, 14, 7, UTC, NOW);
            assertEquals(40.0, b.aggregate(), 1e-9);
        }

        @Test
        @DisplayName("windowContains matches (asOf - w ≤ day < asOf)")
        void windowContains() {
            assertTrue(BaselineCalculator.windowContains(AS_OF, 14, AS_OF.minusDays(14)));
            assertTrue(BaselineCalculator.windowContains(AS_OF, 14, AS_OF.minusDays(1)));
            assertFalse(BaselineCalculator.windowContains(AS_OF, 14, AS_OF));
            assertFalse(BaselineCalculator.windowContains(AS_OF, 14, AS_OF.minusDays(15)));
        }
    }

    // ── Coverage ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("coverage")
    class CoverageTests {

        @Test
        @DisplayName("fewer covered days than minCoverage → INSUFFICIENT, no aggregate")
        void belowCoverage_insufficient() {
            List<BiometricSample> samples = daily(MetricKind.RESTING_HEART_RATE, AS_OF.minusDays(6), 6, 55.0);
            Baseline b = BaselineCalculator.compute(MetricKind.RESTING_HEART_RATE, AS_OF, samples, 14, 7, UTC, NOW);

            assertEquals(BaselineStatus.INSUFFICIENT, b.status());
            assertNull(b.aggregate());
            assertEquals(6, b.sampleCount());
            assertTrue(b.value().isEmpty());
        }

        @Test
        @DisplayName("exactly minCoverage days → AVAILABLE")
        void atCoverage_available() {
            List<BiometricSample> samples = daily(MetricKind.RESTING_HEART_RATE, AS_OF.minusDays(7), 7, 55.0);
            Baseline b = BaselineCalculator.compute(MetricKind.RESTING_HEART_RATE, AS_OF, samples, 14, 7, UTC, NOW);
            assertTrue(b.isAvailable());
        }

        @Test
        @DisplayName("no samples → INSUFFICIENT with count 0")
        void empty_insufficient() {
            Baseline b = BaselineCalculator.compute(MetricKind.RESTING_HEART_RATE, AS_OF, List.of(), 14, 7, UTC, NOW);
            assertEquals(BaselineStatus.INSUFFICIENT, b.status());
            assertEquals(0, b.sampleCount());
        }

        @Test
        void defaultMinCoverage_isHalfWindow() {
            assertEquals(7, BaselineCalculator.defaultMinCoverage(14));
            assertEquals(4, BaselineCalculator.defaultMinCoverage(7));
        }
    }

    // ── Daily collapse ────────────────────────────────────────────────────

    @Nested
    @DisplayName("daily values")
    class DailyValueTests {

        @Test
        @DisplayName("several readings on one day count as one covered day (mean)")
        void severalReadings_oneDay() {
            LocalDate day = AS_OF.minusDays(1);
            List<BiometricSample> samples = List.of(
                at(MetricKind.HEART_RATE_VARIABILITY, day, 6, 30.0),
                at(MetricKind.HEART_RATE_VARIABILITY, day, 7, 50.0));

            Baseline b = BaselineCalculator.compute(MetricKind.HEART_RATE_VARIABILITY, AS_OF, samples, 14, 1, UTC, NOW);
            assertEquals(1, b.sampleCount());
            assertEquals(40.0, b.aggregate(), 1e-9);
        }

        @Test
        @DisplayName("sleep-stage minutes sum per day; duplicate deliveries are ignored")
        void sum_dedupes() {
            LocalDate day = AS_OF.minusDays(1);
            BiometricSample a = at(MetricKind.DEEP_SLEEP, day, 2, 40.0);
            BiometricSample b = at(MetricKind.DEEP_SLEEP, day, 4, 35.0);

            var daily = DailyValues.collapse(MetricKind.DEEP_SLEEP, List.of(a, b, a), UTC);
            assertEquals(75.0, daily.get(day), 1e-9);
        }

        @Test
        @DisplayName("bedtime keeps the first reading, wake time the last")
        void firstAndLast() {
            LocalDate day = AS_OF.minusDays(1);
            List<BiometricSample> samples = List.of(
                at(MetricKind.BEDTIME, day, 1, 1380.0),
                at(MetricKind.BEDTIME, day, 3, 60.0),
                at(MetricKind.WAKE_TIME, day, 6, 360.0),
                at(MetricKind.WAKE_TIME, day, 8, 480.0));

            var values = DailyValues.forDay(day, samples, UTC);
            assertEquals(1380.0, values.get(MetricKind.BEDTIME), 1e-9);
            assertEquals(480.0, values.get(MetricKind.WAKE_TIME), 1e-9);
        }

        @Test
        @DisplayName("bedtime baseline uses a circular mean")
        void bedtimeBaseline_circular() {
            List<BiometricSample> samples = new ArrayList<>();
            for (int i = 1; i <= 8; i++) {
                samples.add(at(MetricKind.BEDTIME, AS_OF.minusDays(i), 7, i % 2 == 0 ? 1410.0 : 30.0));
            }
            Baseline b = BaselineCalculator.compute(MetricKind.BEDTIME, AS_OF, samples, 14, 7, UTC, NOW);

            assertTrue(b.isAvailable());
            double m = b.aggregate();
            assertTrue(m < 0.5 || m > 1439.5, "expected ~midnight, got " + m);
        }
    }
}
