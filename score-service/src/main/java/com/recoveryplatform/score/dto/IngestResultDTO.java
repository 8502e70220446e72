package com.recoveryplatform.score.dto;

public record IngestResultDTO(int received, int inserted) {}
