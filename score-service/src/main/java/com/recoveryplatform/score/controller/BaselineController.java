package com.recoveryplatform.score.controller;

import com.recoveryplatform.common.model.Baseline;
import com.recoveryplatform.common.model.MetricKind;
import com.recoveryplatform.score.service.ScoreQueryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Locale;

@RestController
@RequestMapping("/api/v1/baselines")
public class BaselineController {

    private static final Logger log = LoggerFactory.getLogger(BaselineController.class);

    private final ScoreQueryService queryService;
    private final Clock clock;
    private final ZoneId zone;

    public BaselineController(ScoreQueryService queryService, Clock clock, ZoneId scoringZone) {
        this.queryService = queryService;
        this.clock        = clock;
        this.zone         = scoringZone;
    }

    /** Baseline for {@code asOf} (default today, never later), covering the days before it. */
    @GetMapping("/{metric}")
    public Mono<Baseline> baseline(
            @PathVariable String metric,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {
        MetricKind metricKind = parseMetric(metric);
        LocalDate today = clock.instant().atZone(zone).toLocalDate();
        if (asOf != null && asOf.isAfter(today)) {
            throw new IllegalArgumentException("asOf must not be in the future: " + asOf);
        }
        LocalDate day = asOf != null ? asOf : today;
        log.info("Baseline query received. metric={} asOf={}", metricKind, day);
        return queryService.baseline(metricKind, day);
    }

    static MetricKind parseMetric(String metric) {
        try {
            return MetricKind.valueOf(metric.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown metric kind: " + metric, e);
        }
    }
}
