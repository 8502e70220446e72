package com.recoveryplatform.score.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.recoveryplatform.common.model.ComponentKind;
import com.recoveryplatform.common.model.CompositeScore;
import com.recoveryplatform.common.model.DataGap;
import com.recoveryplatform.common.model.ScoreComponent;
import com.recoveryplatform.common.model.ScoreKey;
import com.recoveryplatform.common.model.ScoreKind;
import com.recoveryplatform.score.model.ScoreHistoryEntity;
import com.recoveryplatform.score.repository.ScoreHistoryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Mapping between cache entries and {@code score_history} rows, with the
 * repository mocked out.
 */
class R2dbcDurableScoreStoreTest {

    private static final LocalDate DAY = LocalDate.of(2024, 3, 15);
    private static final Instant COMPUTED = Instant.parse("2024-03-15T08:00:00Z");
    private static final Instant PUBLISHED = Instant.parse("2024-03-15T08:00:02Z");

    private ScoreHistoryRepository repository;
    private ObjectMapper objectMapper;
    private R2dbcDurableScoreStore store;

    @BeforeEach
    void setUp() {
        repository = Mockito.mock(ScoreHistoryRepository.class);
        objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        store = new R2dbcDurableScoreStore(repository, objectMapper);
    }

    private static CompositeScore score() {
        return CompositeScore.of(ScoreKind.RECOVERY, DAY, List.of(
            ScoreComponent.scored(ComponentKind.HRV, 80, Map.of("current", 52.0, "baseline", 48.0)),
            ScoreComponent.scored(ComponentKind.RESTING_HEART_RATE, 70, Map.of()),
            ScoreComponent.partial(ComponentKind.SLEEP_QUALITY, 60, Map.of("efficiency", 0.9), DataGap.MISSING_SAMPLE),
            ScoreComponent.missing(ComponentKind.PHYSIOLOGICAL_STRESS, Map.of(), DataGap.INSUFFICIENT_BASELINE)
        ), COMPUTED);
    }

    @Test
    @DisplayName("save() writes one upsert with UTC timestamps and JSON components")
    void save() {
        when(repository.upsertScore(any(), any(), anyInt(), anyBoolean(), any(), any(), any()))
            .thenReturn(Mono.just(1));
        CompositeScore score = score();

        StepVerifier.create(store.save(CacheEntry.published(score, PUBLISHED))).verifyComplete();

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(repository).upsertScore(eq("RECOVERY"), eq(DAY), eq(score.overall()), eq(false),
            json.capture(), eq(LocalDateTime.of(2024, 3, 15, 8, 0, 0)), eq(LocalDateTime.of(2024, 3, 15, 8, 0, 2)));
        assertTrue(json.getValue().contains("\"SLEEP_QUALITY\""));
        assertTrue(json.getValue().contains("\"MISSING_SAMPLE\""));
    }

    @Test
    @DisplayName("a row written by save() reads back as the same score")
    void readBack() throws Exception {
        CompositeScore score = score();
        ScoreHistoryEntity row = new ScoreHistoryEntity();
        row.setScoreKind("RECOVERY");
        row.setDayKey(DAY);
        row.setOverall(score.overall());
        row.setDataComplete(false);
        row.setComponents(objectMapper.writeValueAsString(score.components()));
        row.setComputedAt(LocalDateTime.ofInstant(COMPUTED, ZoneOffset.UTC));
        row.setPublishedAt(LocalDateTime.ofInstant(PUBLISHED, ZoneOffset.UTC));
        when(repository.findByScoreKindAndDayKey("RECOVERY", DAY)).thenReturn(Mono.just(row));

        StepVerifier.create(store.find(ScoreKey.of(ScoreKind.RECOVERY, DAY)))
            .assertNext(entry -> {
                assertEquals(score, entry.value());
                assertEquals(PUBLISHED, entry.lastPublishedAt());
                assertEquals(COMPUTED, entry.lastComputedAt());
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("rows with unreadable components are skipped, the rest are returned")
    void unreadableRowSkipped() {
        ScoreHistoryEntity broken = new ScoreHistoryEntity();
        broken.setScoreKind("RECOVERY");
        broken.setDayKey(DAY);
        broken.setComponents("{not json");
        broken.setComputedAt(LocalDateTime.ofInstant(COMPUTED, ZoneOffset.UTC));
        broken.setPublishedAt(LocalDateTime.ofInstant(PUBLISHED, ZoneOffset.UTC));

        ScoreHistoryEntity good = new ScoreHistoryEntity();
        good.setScoreKind("RECOVERY");
        good.setDayKey(DAY.minusDays(1));
        good.setOverall(64);
        good.setDataComplete(true);
        good.setComponents("[]");
        good.setComputedAt(LocalDateTime.ofInstant(COMPUTED, ZoneOffset.UTC));
        good.setPublishedAt(LocalDateTime.ofInstant(PUBLISHED, ZoneOffset.UTC));

        when(repository.findRecent("RECOVERY", 10, 0L)).thenReturn(Flux.just(broken, good));

        StepVerifier.create(store.findRecent(ScoreKind.RECOVERY, 0, 10))
            .assertNext(entry -> assertEquals(DAY.minusDays(1), entry.key().dayKey()))
            .verifyComplete();
    }
}
