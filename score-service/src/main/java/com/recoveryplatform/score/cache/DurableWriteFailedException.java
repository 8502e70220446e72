package com.recoveryplatform.score.cache;

import com.recoveryplatform.common.model.ScoreKey;

public class DurableWriteFailedException extends RuntimeException {
    private final ScoreKey key;

    public DurableWriteFailedException(ScoreKey key, long attempts, Throwable cause) {
        super("[" + key + "] durable write failed after " + attempts + " attempt(s)", cause);
        this.key = key;
    }

    public ScoreKey getKey() {
        return key;
    }
}
