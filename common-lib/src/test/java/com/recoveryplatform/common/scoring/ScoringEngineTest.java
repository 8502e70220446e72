package com.recoveryplatform.common.scoring;

import com.recoveryplatform.common.model.CompositeScore;
import com.recoveryplatform.common.model.ComponentKind;
import com.recoveryplatform.common.model.MetricKind;
import com.recoveryplatform.common.model.ScoreComponent;
import com.recoveryplatform.common.model.ScoreKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static com.recoveryplatform.common.scoring.ScoringFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class ScoringEngineTest {

    private final ScoringEngine engine = new ScoringEngine(GrowthCurve.DEFAULT, Clock.fixed(NOW, ZoneOffset.UTC));

    @Nested
    @DisplayName("properties")
    class PropertyTests {

        @Test
        @DisplayName("each profile's weights sum to 1.0")
        void weightsSumToOne() {
            for (ScoreKind kind : ScoreKind.values()) {
                assertEquals(1.0, ComponentKind.totalWeight(kind), ComponentKind.WEIGHT_TOLERANCE);
            }
        }

        @Test
        @DisplayName("same inputs and clock → equal scores")
        void idempotent() {
            Inputs in = fullRecoveryDay();
            for (ScoreKind kind : ScoreKind.values()) {
                CompositeScore first  = engine.score(kind, DAY, in.dayInputs(), in.baselineSet());
                CompositeScore second = engine.score(kind, DAY, in.dayInputs(), in.baselineSet());
                assertEquals(first, second);
                assertEquals(NOW, first.computedAt());
            }
        }

        @Test
        @DisplayName("random inputs stay within [0,100] and overall = round(Σ contribution)")
        void rangeAndRounding() {
            Random random = new Random(42);
            for (int i = 0; i < 500; i++) {
                Inputs in = inputs();
                for (MetricKind metric : MetricKind.values()) {
                    if (random.nextInt(4) == 0) continue;
                    double value = metric.isClockTime() ? random.nextInt(1440) : random.nextDouble() * 600;
                    in.day(metric, value);
                    if (random.nextBoolean()) {
                        in.baseline(metric, metric.isClockTime() ? random.nextInt(1440) : 1 + random.nextDouble() * 600);
                    }
                }
                for (ScoreKind kind : ScoreKind.values()) {
                    CompositeScore score = engine.score(kind, DAY, in.dayInputs(), in.baselineSet());
                    double sum = 0.0;
                    for (ScoreComponent c : score.components()) {
                        assertTrue(c.normalizedValue() >= 0.0 && c.normalizedValue() <= 100.0);
                        sum += c.contribution();
                    }
                    assertTrue(score.overall() >= 0 && score.overall() <= 100);
                    assertEquals(Math.round(Math.min(100.0, sum)), score.overall());
                }
            }
        }

        @Test
        @DisplayName("rising HRV never lowers the recovery score")
        void monotonicInHrv() {
            int previous = -1;
            for (double hrv = 10.0; hrv <= 120.0; hrv += 2.5) {
                Map<MetricKind, Double> values = new EnumMap<>(fullRecoveryDay().dayInputs().values());
                values.put(MetricKind.HEART_RATE_VARIABILITY, hrv);
                CompositeScore score = engine.score(ScoreKind.RECOVERY, DAY,
                    DayInputs.of(DAY, values), fullRecoveryDay().baselineSet());
                assertTrue(score.overall() >= previous, "dropped at HRV " + hrv);
                previous = score.overall();
            }
        }
    }

    @Nested
    @DisplayName("dispatch and input maps")
    class DispatchTests {

        @Test
        void dispatchesByKind() {
            Inputs in = fullRecoveryDay();
            assertEquals(ScoreKind.RECOVERY, engine.score(ScoreKind.RECOVERY, DAY, in.dayInputs(), in.baselineSet()).scoreKind());
            assertEquals(ScoreKind.SLEEP, engine.score(ScoreKind.SLEEP, DAY, in.dayInputs(), in.baselineSet()).scoreKind());
        }

        @Test
        @DisplayName("inputs for another day are rejected")
        void wrongDay() {
            assertThrows(IllegalArgumentException.class,
                () -> engine.score(ScoreKind.SLEEP, DAY.plusDays(1), DayInputs.empty(DAY), BaselineSet.empty()));
        }

        @Test
        @DisplayName("HRV affects recovery only; bedtime affects both, also through baselines")
        void affectedKinds() {
            assertEquals(Set.of(ScoreKind.RECOVERY), ScoringEngine.affectedByDayInput(MetricKind.HEART_RATE_VARIABILITY));
            assertEquals(Set.of(ScoreKind.RECOVERY, ScoreKind.SLEEP), ScoringEngine.affectedByDayInput(MetricKind.BEDTIME));
            assertEquals(Set.of(ScoreKind.RECOVERY, ScoreKind.SLEEP), ScoringEngine.affectedByBaseline(MetricKind.BEDTIME));
            assertEquals(Set.of(), ScoringEngine.affectedByBaseline(MetricKind.DEEP_SLEEP));
        }
    }
}
