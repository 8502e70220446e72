package com.recoveryplatform.score.coordinator;

/**
 * Recompute lifecycle of one {@code (dayKey, scoreKind)} key.
 */
public enum KeyState {
    /** Nothing pending; the cached value, if any, reflects every notified sample. */
    IDLE,
    /** A recompute is scheduled but has not started reading inputs. */
    INVALIDATED,
    /** A recompute is running. */
    COMPUTING,
    /** New input arrived while computing; the running result will be discarded. */
    SUPERSEDED;

    public boolean isPending() {
        return this != IDLE;
    }
}
