package com.recoveryplatform.common.baseline;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

class ClockTimeTest {

    @Test
    @DisplayName("23:30 and 00:30 average to midnight, not noon")
    void circularMean_wrapsMidnight() {
        OptionalDouble mean = ClockTime.circularMean(List.of(1410.0, 30.0));
        assertTrue(mean.isPresent());
        double m = mean.getAsDouble();
        assertTrue(m < 0.5 || m > 1439.5, "expected ~0, got " + m);
    }

    @Test
    @DisplayName("non-wrapping values → ordinary mean")
    void circularMean_plainValues() {
        assertEquals(630.0, ClockTime.circularMean(List.of(600.0, 660.0)).getAsDouble(), 1e-6);
    }

    @Test
    @DisplayName("empty or cancelling values → empty")
    void circularMean_empty() {
        assertTrue(ClockTime.circularMean(List.of()).isEmpty());
        assertTrue(ClockTime.circularMean(List.of(0.0, 720.0)).isEmpty());
    }

    @Test
    @DisplayName("signed deviation takes the short way round the clock")
    void signedDeviation() {
        assertEquals(60.0,  ClockTime.signedDeviation(30.0, 1410.0), 1e-9);
        assertEquals(-60.0, ClockTime.signedDeviation(1410.0, 30.0), 1e-9);
        assertEquals(180.0, ClockTime.signedDeviation(120.0, 1380.0), 1e-9);
    }

    @Test
    void normalize_negative() {
        assertEquals(1380.0, ClockTime.normalize(-60.0), 1e-9);
        assertEquals(0.0, ClockTime.normalize(1440.0), 1e-9);
    }
}
