package com.recoveryplatform.score.coordinator;

import com.recoveryplatform.common.model.CompositeScore;
import com.recoveryplatform.common.model.ScoreKey;
import com.recoveryplatform.common.scoring.DayInputs;
import com.recoveryplatform.common.scoring.ScoringEngine;
import com.recoveryplatform.score.baseline.BaselineTracker;
import com.recoveryplatform.score.sample.SampleSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Fetches the day's samples in one range read, the needed baselines through the
 * {@link BaselineTracker}, and hands both to the {@link ScoringEngine}.
 */
@Component
public class DailyScoreComputation implements ScoreComputation {

    private static final Logger log = LoggerFactory.getLogger(DailyScoreComputation.class);

    private final SampleSource sampleSource;
    private final BaselineTracker baselineTracker;
    private final ScoringEngine scoringEngine;
    private final ZoneId zone;

    public DailyScoreComputation(SampleSource sampleSource,
                                 BaselineTracker baselineTracker,
                                 ScoringEngine scoringEngine,
                                 ZoneId scoringZone) {
        this.sampleSource    = sampleSource;
        this.baselineTracker = baselineTracker;
        this.scoringEngine   = scoringEngine;
        this.zone            = scoringZone;
    }

    @Override
    public Mono<CompositeScore> compute(ScoreKey key) {
        LocalDate day = key.dayKey();
        Instant from = day.atStartOfDay(zone).toInstant();
        Instant to   = day.plusDays(1).atStartOfDay(zone).toInstant();

        Mono<DayInputs> inputs = sampleSource.fetchRange(from, to)
            .collectList()
            .map(samples -> DayInputs.fromSamples(day, samples, zone));

        return Mono.zip(inputs, baselineTracker.baselines(ScoringEngine.baselineInputs(key.scoreKind()), day))
            .map(t -> scoringEngine.score(key.scoreKind(), day, t.getT1(), t.getT2()))
            .doOnNext(score -> log.debug("SCORE_COMPUTED key={} overall={} dataComplete={}",
                                         key, score.overall(), score.dataComplete()));
    }
}
