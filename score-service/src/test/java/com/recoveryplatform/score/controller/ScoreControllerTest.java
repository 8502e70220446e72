package com.recoveryplatform.score.controller;

import com.recoveryplatform.common.model.Baseline;
import com.recoveryplatform.common.model.BaselineStatus;
import com.recoveryplatform.common.model.CompositeScore;
import com.recoveryplatform.common.model.MetricKind;
import com.recoveryplatform.common.model.ScoreKind;
import com.recoveryplatform.score.config.ApiExceptionHandler;
import com.recoveryplatform.score.service.SampleIngestionService;
import com.recoveryplatform.score.service.ScoreQueryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * HTTP surface of the score service, bound to the controllers directly with the
 * services mocked.
 */
class ScoreControllerTest {

    private static final LocalDate DAY = LocalDate.of(2024, 3, 15);
    private static final Instant NOW = Instant.parse("2024-03-15T12:00:00Z");

    private ScoreQueryService queryService;
    private SampleIngestionService ingestionService;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        queryService = Mockito.mock(ScoreQueryService.class);
        ingestionService = Mockito.mock(SampleIngestionService.class);
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        client = WebTestClient
            .bindToController(
                new ScoreController(queryService),
                new SampleController(ingestionService),
                new BaselineController(queryService, clock, ZoneOffset.UTC))
            .controllerAdvice(new ApiExceptionHandler())
            .build();
    }

    private static CompositeScore score(int overall) {
        return new CompositeScore(ScoreKind.RECOVERY, DAY, overall, List.of(), NOW, true);
    }

    // ── Scores ──────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("/api/v1/scores")
    class ScoreEndpointTests {

        @Test
        @DisplayName("cached score → 200 with body")
        void cached() {
            when(queryService.currentScore(ScoreKind.RECOVERY, DAY)).thenReturn(Mono.just(score(72)));

            client.get().uri("/api/v1/scores/recovery/2024-03-15")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.overall").isEqualTo(72)
                .jsonPath("$.scoreKind").isEqualTo("RECOVERY")
                .jsonPath("$.dayKey").isEqualTo("2024-03-15");
        }

        @Test
        @DisplayName("not yet computed → 202 without body")
        void miss() {
            when(queryService.currentScore(ScoreKind.SLEEP, DAY)).thenReturn(Mono.empty());

            client.get().uri("/api/v1/scores/SLEEP/2024-03-15")
                .exchange()
                .expectStatus().isAccepted()
                .expectBody().isEmpty();
        }

        @Test
        @DisplayName("unknown kind → 400 problem detail")
        void unknownKind() {
            client.get().uri("/api/v1/scores/strain/2024-03-15")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.status").isEqualTo(400)
                .jsonPath("$.detail").isEqualTo("Unknown score kind: strain");
        }

        @Test
        @DisplayName("malformed day → 400")
        void badDay() {
            client.get().uri("/api/v1/scores/recovery/15-03-2024")
                .exchange()
                .expectStatus().isBadRequest();
        }

        @Test
        @DisplayName("history takes the literal path over a day key")
        void history() {
            when(queryService.history(ScoreKind.RECOVERY, 3))
                .thenReturn(Flux.just(score(70), score(65)));

            client.get().uri("/api/v1/scores/recovery/history?rangeDays=3")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(2);
        }

        @Test
        @DisplayName("invalid range from the service → 400")
        void historyOutOfRange() {
            when(queryService.history(ScoreKind.RECOVERY, 0))
                .thenReturn(Flux.error(new IllegalArgumentException("rangeDays must be in 1..366: 0")));

            client.get().uri("/api/v1/scores/recovery/history?rangeDays=0")
                .exchange()
                .expectStatus().isBadRequest();
        }

        @Test
        @DisplayName("DELETE schedules a recompute → 202")
        void recompute() {
            when(queryService.recompute(ScoreKind.RECOVERY, DAY)).thenReturn(Mono.empty());

            client.delete().uri("/api/v1/scores/recovery/2024-03-15")
                .exchange()
                .expectStatus().isAccepted();

            verify(queryService).recompute(ScoreKind.RECOVERY, DAY);
        }

        @Test
        @DisplayName("stream delivers published scores as 'score' events")
        void stream() {
            when(queryService.updates()).thenReturn(Flux.just(score(72)));

            Flux<ServerSentEvent<CompositeScore>> events = client.get().uri("/api/v1/scores/stream")
                .accept(MediaType.TEXT_EVENT_STREAM)
                .exchange()
                .expectStatus().isOk()
                .returnResult(new ParameterizedTypeReference<ServerSentEvent<CompositeScore>>() {})
                .getResponseBody();

            StepVerifier.create(events)
                .assertNext(event -> {
                    assertEquals("score", event.event());
                    assertEquals("RECOVERY@2024-03-15", event.id());
                    assertEquals(72, event.data().overall());
                })
                .verifyComplete();
        }
    }

    // ── Samples ─────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("/api/v1/samples")
    class SampleEndpointTests {

        @Test
        @DisplayName("valid batch → 200 with received and inserted counts")
        void ingest() {
            when(ingestionService.ingest(anyList())).thenReturn(Mono.just(1));

            client.post().uri("/api/v1/samples")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                    [{"metricKind":"HEART_RATE_VARIABILITY","timestamp":"2024-03-15T06:00:00Z","value":48.0},
                     {"metricKind":"RESTING_HEART_RATE","timestamp":"2024-03-15T06:00:00Z","value":55.0}]
                    """)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.received").isEqualTo(2)
                .jsonPath("$.inserted").isEqualTo(1);
        }

        @Test
        @DisplayName("sample without value → 400, nothing ingested")
        void missingValue() {
            client.post().uri("/api/v1/samples")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                    [{"metricKind":"HEART_RATE_VARIABILITY","timestamp":"2024-03-15T06:00:00Z"}]
                    """)
                .exchange()
                .expectStatus().isBadRequest();

            verify(ingestionService, never()).ingest(anyList());
        }
    }

    // ── Baselines ───────────────────────────────────────────────────────────

    @Test
    @DisplayName("baseline metric accepts dashes and defaults asOf to today")
    void baselineDefaultsToToday() {
        Baseline baseline = new Baseline(MetricKind.HEART_RATE_VARIABILITY, DAY, 14, 48.0, 12, 7,
            BaselineStatus.AVAILABLE, NOW);
        when(queryService.baseline(MetricKind.HEART_RATE_VARIABILITY, DAY)).thenReturn(Mono.just(baseline));

        client.get().uri("/api/v1/baselines/heart-rate-variability")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.aggregate").isEqualTo(48.0)
            .jsonPath("$.status").isEqualTo("AVAILABLE");
    }

    @Test
    @DisplayName("baseline asOf after today → 400 without querying")
    void baselineRejectsFutureAsOf() {
        client.get().uri("/api/v1/baselines/heart-rate-variability?asOf=2024-03-16")
            .exchange()
            .expectStatus().isBadRequest();

        verify(queryService, never()).baseline(any(), any());
    }
}
