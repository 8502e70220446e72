package com.recoveryplatform.score.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Raw sample row. {@code (metricKind, sampledAt)} is unique; a re-delivered
 * sample is dropped at insert time.
 */
@Data
@NoArgsConstructor
@Table("biometric_sample")
public class BiometricSampleEntity {

    @Id
    private Long id;

    private String metricKind;

    /** UTC. */
    private LocalDateTime sampledAt;

    private double value;

    private LocalDateTime receivedAt;
}
