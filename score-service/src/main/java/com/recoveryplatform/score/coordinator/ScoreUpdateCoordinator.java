package com.recoveryplatform.score.coordinator;

import com.recoveryplatform.common.model.BiometricSample;
import com.recoveryplatform.common.model.CompositeScore;
import com.recoveryplatform.common.model.MetricKind;
import com.recoveryplatform.common.model.ScoreKey;
import com.recoveryplatform.common.model.ScoreKind;
import com.recoveryplatform.common.scoring.ScoringEngine;
import com.recoveryplatform.score.baseline.BaselineTracker;
import com.recoveryplatform.score.cache.ScoreCacheStore;
import com.recoveryplatform.score.sample.SampleBatch;
import com.recoveryplatform.score.sample.SampleFeed;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns sample notifications into at most one running recompute per key.
 *
 * <p>Per-key state machine:
 * <pre>
 *   notify    IDLE → INVALIDATED (schedule)    INVALIDATED/SUPERSEDED → no-op
 *             COMPUTING → SUPERSEDED
 *   complete  COMPUTING → publish → IDLE       SUPERSEDED → discard → INVALIDATED (reschedule)
 *   fail      COMPUTING → IDLE                 SUPERSEDED → INVALIDATED (reschedule)
 * </pre>
 *
 * <p>Notification handling only updates state and enqueues work on the recompute
 * scheduler. Publishing happens under the key's lock, so a result computed from
 * older input can never overwrite one computed from newer input.
 *
 * <p>A published score with {@code dataComplete = false} for today or yesterday
 * re-invalidates itself after {@code incompleteRetryInterval}, which picks up
 * samples that sync late without a fresh notification.
 */
@Component
public class ScoreUpdateCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ScoreUpdateCoordinator.class);

    private static final class Slot {
        private KeyState state = KeyState.IDLE;
        private Disposable pendingRetry;
        private boolean retired;
    }

    private final ScoreComputation computation;
    private final ScoreCacheStore cacheStore;
    private final BaselineTracker baselineTracker;
    private final SampleFeed sampleFeed;
    private final Scheduler recomputeScheduler;
    private final Clock clock;
    private final ZoneId zone;
    private final Duration incompleteRetryInterval;

    private final Map<ScoreKey, Slot> slots = new ConcurrentHashMap<>();
    private final Sinks.Many<CompositeScore> updates = Sinks.many().multicast().onBackpressureBuffer(64);
    private Disposable feedSubscription;

    public ScoreUpdateCoordinator(ScoreComputation computation,
                                  ScoreCacheStore cacheStore,
                                  BaselineTracker baselineTracker,
                                  SampleFeed sampleFeed,
                                  @Qualifier("recomputeScheduler") Scheduler recomputeScheduler,
                                  Clock clock,
                                  ZoneId scoringZone,
                                  @Value("${scoring.coordinator.incomplete-retry-interval:15m}") Duration incompleteRetryInterval) {
        this.computation             = computation;
        this.cacheStore              = cacheStore;
        this.baselineTracker         = baselineTracker;
        this.sampleFeed              = sampleFeed;
        this.recomputeScheduler      = recomputeScheduler;
        this.clock                   = clock;
        this.zone                    = scoringZone;
        this.incompleteRetryInterval = incompleteRetryInterval;
    }

    @PostConstruct
    public void start() {
        feedSubscription = sampleFeed.batches().subscribe(
            this::onSamples,
            err -> log.error("Sample feed terminated with error", err));
        log.info("Score update coordinator started. incompleteRetryInterval={} windowDays={}",
                 incompleteRetryInterval, baselineTracker.windowDays());
    }

    @PreDestroy
    public void stop() {
        if (feedSubscription != null) {
            feedSubscription.dispose();
        }
        slots.values().forEach(slot -> {
            synchronized (slot) {
                cancelRetry(slot);
            }
        });
    }

    // ── Notification → affected keys ────────────────────────────────────────

    /**
     * Resolves the keys a batch touches and invalidates them.
     *
     * <p>A sample of metric M on day D drops the baselines whose window holds D and
     * invalidates {@code (D, kind)} for every kind reading M as a day input. Kinds
     * reading M through a baseline also get {@code (D', kind)} invalidated for
     * {@code D < D' ≤ min(D + windowDays, today)} where a score for D' has
     * already been published or a computation for D' is pending, since that
     * computation may already have read the old baseline.
     */
    public void onSamples(SampleBatch batch) {
        if (batch.isEmpty()) {
            return;
        }
        Map<MetricKind, Set<LocalDate>> touched = new EnumMap<>(MetricKind.class);
        for (BiometricSample sample : batch.samples()) {
            touched.computeIfAbsent(sample.metricKind(), m -> new TreeSet<>()).add(sample.day(zone));
        }

        LocalDate today = today();
        int windowDays = baselineTracker.windowDays();
        Set<ScoreKey> direct = new LinkedHashSet<>();
        Set<ScoreKey> downstream = new LinkedHashSet<>();

        touched.forEach((metric, days) -> {
            Set<ScoreKind> dayKinds = ScoringEngine.affectedByDayInput(metric);
            Set<ScoreKind> baselineKinds = ScoringEngine.affectedByBaseline(metric);
            for (LocalDate day : days) {
                baselineTracker.invalidate(metric, day);
                dayKinds.forEach(kind -> direct.add(ScoreKey.of(kind, day)));
                for (LocalDate later = day.plusDays(1);
                     !later.isAfter(day.plusDays(windowDays)) && !later.isAfter(today);
                     later = later.plusDays(1)) {
                    for (ScoreKind kind : baselineKinds) {
                        downstream.add(ScoreKey.of(kind, later));
                    }
                }
            }
        });
        downstream.removeAll(direct);

        log.debug("SAMPLES_NOTIFIED samples={} metrics={} directKeys={} downstreamCandidates={}",
                  batch.samples().size(), touched.keySet(), direct.size(), downstream.size());

        direct.forEach(this::invalidate);
        Set<ScoreKey> unknown = new LinkedHashSet<>();
        for (ScoreKey key : downstream) {
            if (state(key).isPending()) {
                invalidate(key);
            } else {
                unknown.add(key);
            }
        }
        if (!unknown.isEmpty()) {
            Flux.fromIterable(unknown)
                .filterWhen(cacheStore::exists)
                .subscribe(
                    this::invalidate,
                    err -> log.warn("Downstream key resolution failed. candidates={}", unknown.size(), err));
        }
    }

    // ── State transitions ───────────────────────────────────────────────────

    /** Notification for one key. Idempotent while a recompute is already pending. */
    public void invalidate(ScoreKey key) {
        Slot slot;
        boolean schedule = false;
        while (true) {
            slot = slot(key);
            synchronized (slot) {
                if (slot.retired) {
                    continue;
                }
                schedule = transitionOnNotify(key, slot);
                break;
            }
        }
        if (schedule) {
            scheduleCompute(key, slot);
        }
    }

    private boolean transitionOnNotify(ScoreKey key, Slot slot) {
        boolean schedule = false;
        cancelRetry(slot);
        switch (slot.state) {
            case IDLE -> {
                slot.state = KeyState.INVALIDATED;
                schedule = true;
            }
            case COMPUTING -> {
                slot.state = KeyState.SUPERSEDED;
                log.debug("SCORE_SUPERSEDED key={}", key);
            }
            case INVALIDATED, SUPERSEDED -> log.debug("SCORE_INVALIDATE_NOOP key={} state={}", key, slot.state);
        }
        return schedule;
    }

    /**
     * Starts a computation only when the key is idle. Used by readers asking for a
     * score that was never computed; unlike {@link #invalidate} it never supersedes
     * a running computation.
     *
     * @return true if a computation was scheduled
     */
    public boolean requestCompute(ScoreKey key) {
        Slot slot;
        while (true) {
            slot = slot(key);
            synchronized (slot) {
                if (slot.retired) {
                    continue;
                }
                if (slot.state != KeyState.IDLE) {
                    return false;
                }
                cancelRetry(slot);
                slot.state = KeyState.INVALIDATED;
                break;
            }
        }
        log.debug("SCORE_COMPUTE_REQUESTED key={}", key);
        scheduleCompute(key, slot);
        return true;
    }

    public KeyState state(ScoreKey key) {
        Slot slot = slots.get(key);
        if (slot == null) {
            return KeyState.IDLE;
        }
        synchronized (slot) {
            return slot.state;
        }
    }

    /** Keys with a slot: pending work or a scheduled incomplete retry. */
    int trackedKeys() {
        return slots.size();
    }

    /** Every published score, in publish order per key. */
    public Flux<CompositeScore> updates() {
        return updates.asFlux();
    }

    // ── Computation lifecycle ───────────────────────────────────────────────

    private void scheduleCompute(ScoreKey key, Slot slot) {
        Mono.defer(() -> {
                synchronized (slot) {
                    slot.state = KeyState.COMPUTING;
                }
                return computation.compute(key);
            })
            .switchIfEmpty(Mono.error(() -> new IllegalStateException("Computation produced no score for " + key)))
            .subscribeOn(recomputeScheduler)
            .subscribe(
                score -> onComputed(key, slot, score),
                err -> onFailed(key, slot, err));
    }

    private void onComputed(ScoreKey key, Slot slot, CompositeScore score) {
        boolean rerun;
        synchronized (slot) {
            rerun = slot.state == KeyState.SUPERSEDED;
            if (rerun) {
                slot.state = KeyState.INVALIDATED;
            } else {
                cacheStore.put(key, score);
                emit(score);
                slot.state = KeyState.IDLE;
                scheduleIncompleteRetry(key, slot, score);
                retireIfIdle(key, slot);
            }
        }
        if (rerun) {
            log.debug("SCORE_DISCARDED_SUPERSEDED key={} overall={}", key, score.overall());
            scheduleCompute(key, slot);
        } else {
            log.info("SCORE_PUBLISHED key={} overall={} dataComplete={}",
                     key, score.overall(), score.dataComplete());
        }
    }

    private void onFailed(ScoreKey key, Slot slot, Throwable err) {
        boolean rerun;
        synchronized (slot) {
            rerun = slot.state == KeyState.SUPERSEDED;
            slot.state = rerun ? KeyState.INVALIDATED : KeyState.IDLE;
            retireIfIdle(key, slot);
        }
        log.warn("SCORE_COMPUTE_FAILED key={} rerun={}", key, rerun, err);
        if (rerun) {
            scheduleCompute(key, slot);
        }
    }

    private void scheduleIncompleteRetry(ScoreKey key, Slot slot, CompositeScore score) {
        cancelRetry(slot);
        if (score.dataComplete()) {
            return;
        }
        LocalDate today = today();
        if (key.dayKey().isAfter(today) || key.dayKey().isBefore(today.minusDays(1))) {
            return;
        }
        slot.pendingRetry = Mono.delay(incompleteRetryInterval, recomputeScheduler)
            .subscribe(tick -> {
                log.debug("SCORE_INCOMPLETE_RETRY key={}", key);
                invalidate(key);
            });
    }

    /** Caller holds the slot lock. An idle slot with no retry carries no state worth keeping. */
    private void retireIfIdle(ScoreKey key, Slot slot) {
        if (slot.state == KeyState.IDLE && slot.pendingRetry == null) {
            slot.retired = true;
            slots.remove(key, slot);
        }
    }

    private static void cancelRetry(Slot slot) {
        if (slot.pendingRetry != null) {
            slot.pendingRetry.dispose();
            slot.pendingRetry = null;
        }
    }

    private synchronized void emit(CompositeScore score) {
        Sinks.EmitResult result = updates.tryEmitNext(score);
        if (result.isFailure()) {
            log.debug("Score update not delivered to subscribers. key={} result={}", score.key(), result);
        }
    }

    private Slot slot(ScoreKey key) {
        return slots.computeIfAbsent(key, k -> new Slot());
    }

    private LocalDate today() {
        return clock.instant().atZone(zone).toLocalDate();
    }
}
