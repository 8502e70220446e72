package com.recoveryplatform.common.model;

/**
 * Descriptive interpretation of the average weighted deviation (percent) behind
 * the physiological stress component. Bands never feed back into the numeric score.
 */
public enum StressBand {
    EXCELLENT,
    GOOD,
    ELEVATED,
    HIGH;

    public static StressBand classify(double averageWeightedDeviationPct) {
        if (averageWeightedDeviationPct <= 3.0)  return EXCELLENT;
        if (averageWeightedDeviationPct <= 8.0)  return GOOD;
        if (averageWeightedDeviationPct <= 15.0) return ELEVATED;
        return HIGH;
    }
}
