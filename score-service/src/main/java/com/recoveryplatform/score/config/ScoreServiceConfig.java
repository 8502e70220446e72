package com.recoveryplatform.score.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.recoveryplatform.common.scoring.GrowthCurve;
import com.recoveryplatform.common.scoring.ScoringEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class ScoreServiceConfig {

    private static final Logger log = LoggerFactory.getLogger(ScoreServiceConfig.class);

    @Value("${scoring.zone:}")
    private String zoneId;

    @Value("${scoring.curve.anchor-score:75.0}")
    private double anchorScore;

    @Value("${scoring.curve.upside-rate:5.0}")
    private double upsideRate;

    @Value("${scoring.curve.downside-rate:2.5}")
    private double downsideRate;

    @Value("${scoring.worker-threads:4}")
    private int workerThreads;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** User-local zone that defines day keys; blank means the system zone. */
    @Bean
    public ZoneId scoringZone() {
        ZoneId zone = zoneId == null || zoneId.isBlank() ? ZoneId.systemDefault() : ZoneId.of(zoneId);
        log.info("Scoring zone resolved. zone={}", zone);
        return zone;
    }

    @Bean
    public GrowthCurve growthCurve() {
        GrowthCurve curve = new GrowthCurve(anchorScore, upsideRate, downsideRate);
        log.info("Growth curve configured. anchor={} upsideRate={} downsideRate={}",
                 anchorScore, upsideRate, downsideRate);
        return curve;
    }

    @Bean
    public ScoringEngine scoringEngine(GrowthCurve growthCurve, Clock clock) {
        return new ScoringEngine(growthCurve, clock);
    }

    /** Worker pool for score recomputation; notification threads only enqueue work. */
    @Bean(destroyMethod = "dispose")
    public Scheduler recomputeScheduler() {
        return Schedulers.newBoundedElastic(workerThreads, Integer.MAX_VALUE, "score-recompute");
    }

    /** Background pool for durable cache writes. */
    @Bean(destroyMethod = "dispose")
    public Scheduler durableWriteScheduler() {
        return Schedulers.newBoundedElastic(2, Integer.MAX_VALUE, "score-durable-write");
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
