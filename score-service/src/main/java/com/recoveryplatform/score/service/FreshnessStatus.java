package com.recoveryplatform.score.service;

public enum FreshnessStatus {
    SILENT,
    RECENTLY_UPDATED,
    WAITING_FOR_DATA,
    COMPUTING
}
