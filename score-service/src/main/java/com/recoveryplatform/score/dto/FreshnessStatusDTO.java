package com.recoveryplatform.score.dto;

import com.recoveryplatform.common.model.ScoreKind;
import com.recoveryplatform.score.service.FreshnessStatus;

import java.time.Instant;
import java.time.LocalDate;

public record FreshnessStatusDTO(
    ScoreKind scoreKind,
    LocalDate dayKey,
    FreshnessStatus status,
    String message,
    Instant lastPublishedAt,
    Boolean dataComplete
) {}
