package com.recoveryplatform.common.model;

/**
 * Composite score profiles produced by the engine.
 */
public enum ScoreKind {
    RECOVERY,
    SLEEP
}
