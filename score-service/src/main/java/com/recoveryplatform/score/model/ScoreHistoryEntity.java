package com.recoveryplatform.score.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Durable tier of the score cache: one row per {@code (scoreKind, dayKey)},
 * holding the latest published composite score. Components are stored as JSON.
 */
@Data
@NoArgsConstructor
@Table("score_history")
public class ScoreHistoryEntity {

    @Id
    private Long id;

    private String scoreKind;

    private LocalDate dayKey;

    private int overall;

    private boolean dataComplete;

    private String components;

    private LocalDateTime computedAt;

    private LocalDateTime publishedAt;
}
