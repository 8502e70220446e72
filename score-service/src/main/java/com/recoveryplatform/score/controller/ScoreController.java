package com.recoveryplatform.score.controller;

import com.recoveryplatform.common.model.CompositeScore;
import com.recoveryplatform.common.model.ScoreKind;
import com.recoveryplatform.score.cache.CacheStats;
import com.recoveryplatform.score.dto.FreshnessStatusDTO;
import com.recoveryplatform.score.service.ScoreQueryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.util.Locale;

@RestController
@RequestMapping("/api/v1/scores")
public class ScoreController {

    private static final Logger log = LoggerFactory.getLogger(ScoreController.class);

    private final ScoreQueryService queryService;

    public ScoreController(ScoreQueryService queryService) {
        this.queryService = queryService;
    }

    /**
     * 200 with the cached score, or 202 when the score is not available yet and a
     * computation has been scheduled.
     */
    @GetMapping("/{kind}/{day}")
    public Mono<ResponseEntity<CompositeScore>> currentScore(
            @PathVariable String kind,
            @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate day) {
        ScoreKind scoreKind = parseKind(kind);
        log.info("Score query received. kind={} day={}", scoreKind, day);
        return queryService.currentScore(scoreKind, day)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.accepted().build());
    }

    @GetMapping("/{kind}/history")
    public Flux<CompositeScore> history(@PathVariable String kind,
                                        @RequestParam(defaultValue = "7") int rangeDays) {
        ScoreKind scoreKind = parseKind(kind);
        log.info("Score history query received. kind={} rangeDays={}", scoreKind, rangeDays);
        return queryService.history(scoreKind, rangeDays);
    }

    @GetMapping("/{kind}")
    public Flux<CompositeScore> listRecent(@PathVariable String kind,
                                           @RequestParam(defaultValue = "0") long offset,
                                           @RequestParam(defaultValue = "20") int limit) {
        ScoreKind scoreKind = parseKind(kind);
        log.info("Recent scores query received. kind={} offset={} limit={}", scoreKind, offset, limit);
        return queryService.listRecent(scoreKind, offset, limit);
    }

    @GetMapping("/{kind}/{day}/freshness")
    public Mono<FreshnessStatusDTO> freshness(
            @PathVariable String kind,
            @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate day) {
        return queryService.freshnessStatus(parseKind(kind), day);
    }

    /** Drops the cached score for the key and recomputes it from stored samples. */
    @DeleteMapping("/{kind}/{day}")
    public Mono<ResponseEntity<Void>> recompute(
            @PathVariable String kind,
            @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate day) {
        ScoreKind scoreKind = parseKind(kind);
        log.info("Score recompute requested. kind={} day={}", scoreKind, day);
        return queryService.recompute(scoreKind, day)
            .then(Mono.just(ResponseEntity.accepted().<Void>build()));
    }

    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<CompositeScore>> stream() {
        log.info("Score stream subscriber connected");
        return queryService.updates()
            .map(score -> ServerSentEvent.<CompositeScore>builder()
                .id(score.key().toString())
                .event("score")
                .data(score)
                .build());
    }

    @GetMapping("/cache-stats")
    public CacheStats cacheStats() {
        return queryService.cacheStats();
    }

    static ScoreKind parseKind(String kind) {
        try {
            return ScoreKind.valueOf(kind.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown score kind: " + kind, e);
        }
    }
}
