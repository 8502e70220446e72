package com.recoveryplatform.score.baseline;

import com.recoveryplatform.common.baseline.BaselineCalculator;
import com.recoveryplatform.common.model.Baseline;
import com.recoveryplatform.common.model.MetricKind;
import com.recoveryplatform.common.scoring.BaselineSet;
import com.recoveryplatform.score.sample.SampleSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Rolling personal baselines, cached per {@code (metric, asOf)}.
 *
 * <p>Each cache slot holds a shared {@link Mono}, so concurrent callers for the
 * same baseline trigger one sample fetch between them. A failed fetch removes its
 * own slot and the next caller retries. {@link #invalidate} drops every baseline
 * whose window contains the day a new sample landed on.
 */
@Component
public class BaselineTracker {

    private static final Logger log = LoggerFactory.getLogger(BaselineTracker.class);

    private record BaselineKey(MetricKind metric, LocalDate asOf) {}

    private final SampleSource sampleSource;
    private final ZoneId zone;
    private final Clock clock;
    private final int windowDays;
    private final int minCoverage;
    private final int maxCached;

    private final Map<BaselineKey, Mono<Baseline>> cache = new ConcurrentHashMap<>();

    public BaselineTracker(SampleSource sampleSource,
                           ZoneId scoringZone,
                           Clock clock,
                           @Value("${scoring.baseline.window-days:14}") int windowDays,
                           @Value("${scoring.baseline.min-coverage:7}") int minCoverage,
                           @Value("${scoring.baseline.max-cached:512}") int maxCached) {
        if (windowDays <= 0 || minCoverage <= 0 || maxCached <= 0) {
            throw new IllegalArgumentException("Baseline settings must be positive: windowDays="
                + windowDays + " minCoverage=" + minCoverage + " maxCached=" + maxCached);
        }
        this.sampleSource = sampleSource;
        this.zone         = scoringZone;
        this.clock        = clock;
        this.windowDays   = windowDays;
        this.minCoverage  = minCoverage;
        this.maxCached    = maxCached;
    }

    public int windowDays() {
        return windowDays;
    }

    /**
     * Baseline of {@code metric} for the day {@code asOf}, computed over
     * {@code [asOf - windowDays, asOf)}.
     */
    public Mono<Baseline> refreshBaseline(MetricKind metric, LocalDate asOf) {
        BaselineKey key = new BaselineKey(metric, asOf);
        Mono<Baseline> baseline = cache.computeIfAbsent(key, this::load);
        if (cache.size() > maxCached) {
            trim();
        }
        return baseline;
    }

    /** One baseline per metric, fetched concurrently. */
    public Mono<BaselineSet> baselines(Collection<MetricKind> metrics, LocalDate asOf) {
        return Flux.fromIterable(metrics)
            .flatMap(metric -> refreshBaseline(metric, asOf))
            .collectList()
            .map(BaselineSet::of);
    }

    /**
     * Drops every cached baseline of {@code metric} whose window contains
     * {@code sampleDay}, i.e. {@code asOf ∈ (sampleDay, sampleDay + windowDays]}.
     *
     * @return number of baselines dropped
     */
    public int invalidate(MetricKind metric, LocalDate sampleDay) {
        int before = cache.size();
        cache.keySet().removeIf(k -> k.metric() == metric
            && BaselineCalculator.windowContains(k.asOf(), windowDays, sampleDay));
        int dropped = Math.max(0, before - cache.size());
        if (dropped > 0) {
            log.debug("BASELINE_INVALIDATED metric={} sampleDay={} dropped={}", metric, sampleDay, dropped);
        }
        return dropped;
    }

    public int cachedCount() {
        return cache.size();
    }

    private Mono<Baseline> load(BaselineKey key) {
        Instant from = BaselineCalculator.windowStart(key.asOf(), windowDays).atStartOfDay(zone).toInstant();
        Instant to   = key.asOf().atStartOfDay(zone).toInstant();

        AtomicReference<Mono<Baseline>> self = new AtomicReference<>();
        Mono<Baseline> loading = sampleSource.fetch(key.metric(), from, to)
            .collectList()
            .map(samples -> BaselineCalculator.compute(
                key.metric(), key.asOf(), samples, windowDays, minCoverage, zone, clock.instant()))
            .doOnNext(b -> log.debug("BASELINE_COMPUTED metric={} asOf={} status={} days={} aggregate={}",
                                     b.metricKind(), b.asOf(), b.status(), b.sampleCount(), b.aggregate()))
            .doOnError(e -> {
                cache.remove(key, self.get());
                log.warn("Baseline fetch failed, not cached. metric={} asOf={}", key.metric(), key.asOf(), e);
            })
            .cache();
        self.set(loading);
        return loading;
    }

    private void trim() {
        List<BaselineKey> oldestFirst = cache.keySet().stream()
            .sorted(Comparator.comparing(BaselineKey::asOf))
            .toList();
        int excess = oldestFirst.size() - maxCached;
        for (int i = 0; i < excess; i++) {
            cache.remove(oldestFirst.get(i));
        }
    }
}
