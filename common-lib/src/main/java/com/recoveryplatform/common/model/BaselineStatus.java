package com.recoveryplatform.common.model;

public enum BaselineStatus {
    AVAILABLE,
    INSUFFICIENT
}
