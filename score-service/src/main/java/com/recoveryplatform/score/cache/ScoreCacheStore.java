package com.recoveryplatform.score.cache;

import com.recoveryplatform.common.model.CompositeScore;
import com.recoveryplatform.common.model.ScoreKey;
import com.recoveryplatform.common.model.ScoreKind;
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
import reactor.core.scheduler.Scheduler;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Two-tier store of published composite scores.
 *
 * <p><strong>Memory tier:</strong> access-ordered LRU of {@code capacity} entries
 * (default 100). Every read and write of the LRU structure happens under one lock.
 *
 * <p><strong>Durable tier:</strong> written asynchronously after the in-memory
 * publish, retried with exponential backoff. Until a write is acknowledged the
 * entry also sits in {@code pendingWrites}, so it keeps answering reads even if
 * the LRU evicts it. A write that exhausts its retries is logged as
 * {@link DurableWriteFailedException}; the entry stays pending and is written
 * again after the next successful durable write of any key, or by the periodic
 * re-drive every {@code redriveInterval}.
 *
 * <p>{@link #invalidate} deletes the durable row. A write that was already in
 * flight for the dropped entry may still land after that delete; such rows are
 * hidden from reads and deleted again once the write completes.
 *
 * <p>Counters are diagnostics only and never influence what is served.
 */
@Component
public class ScoreCacheStore {

    private static final Logger log = LoggerFactory.getLogger(ScoreCacheStore.class);

    private final DurableScoreStore durableStore;
    private final Scheduler durableWriteScheduler;
    private final Clock clock;
    private final int capacity;
    private final int maxWriteAttempts;
    private final Duration initialBackoff;
    private final Duration redriveInterval;

    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<ScoreKey, CacheEntry> memory;
    private final Map<ScoreKey, CacheEntry> pendingWrites = new ConcurrentHashMap<>();
    private final Set<ScoreKey> failedWrites = ConcurrentHashMap.newKeySet();
    // computedAt of the newest dropped entry whose durable write may still land
    private final Map<ScoreKey, Instant> droppedInFlight = new ConcurrentHashMap<>();
    private Disposable redriveSubscription;

    private final AtomicLong hits                 = new AtomicLong();
    private final AtomicLong misses               = new AtomicLong();
    private final AtomicLong durableHits          = new AtomicLong();
    private final AtomicLong evictions            = new AtomicLong();
    private final AtomicLong durableWrites        = new AtomicLong();
    private final AtomicLong durableWriteFailures = new AtomicLong();

    public ScoreCacheStore(DurableScoreStore durableStore,
                           @Qualifier("durableWriteScheduler") Scheduler durableWriteScheduler,
                           Clock clock,
                           @Value("${scoring.cache.capacity:100}") int capacity,
                           @Value("${scoring.cache.durable-write.max-attempts:3}") int maxWriteAttempts,
                           @Value("${scoring.cache.durable-write.initial-backoff:200ms}") Duration initialBackoff,
                           @Value("${scoring.cache.durable-write.redrive-interval:1m}") Duration redriveInterval) {
        if (capacity <= 0 || maxWriteAttempts <= 0) {
            throw new IllegalArgumentException(
                "capacity and maxWriteAttempts must be positive: " + capacity + ", " + maxWriteAttempts);
        }
        this.durableStore          = durableStore;
        this.durableWriteScheduler = durableWriteScheduler;
        this.clock                 = clock;
        this.capacity              = capacity;
        this.maxWriteAttempts      = maxWriteAttempts;
        this.initialBackoff        = initialBackoff;
        this.redriveInterval       = redriveInterval;
        this.memory = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<ScoreKey, CacheEntry> eldest) {
                boolean evict = size() > ScoreCacheStore.this.capacity;
                if (evict) {
                    evictions.incrementAndGet();
                    log.debug("CACHE_EVICT key={}", eldest.getKey());
                }
                return evict;
            }
        };
    }

    @PostConstruct
    public void start() {
        redriveSubscription = Flux.interval(redriveInterval, durableWriteScheduler)
            .subscribe(
                tick -> redriveFailedWrites(),
                err -> log.error("Durable write re-drive stopped", err));
    }

    @PreDestroy
    public void stop() {
        if (redriveSubscription != null) {
            redriveSubscription.dispose();
        }
    }

    // ── Reads ───────────────────────────────────────────────────────────────

    public Mono<CompositeScore> get(ScoreKey key) {
        return getEntry(key).map(CacheEntry::value);
    }

    /**
     * Memory first, then pending writes, then the durable tier. A durable hit is
     * promoted into memory unless a newer value was published meanwhile.
     */
    public Mono<CacheEntry> getEntry(ScoreKey key) {
        CacheEntry local = lookupLocal(key);
        if (local != null) {
            hits.incrementAndGet();
            return Mono.just(local);
        }
        misses.incrementAndGet();
        return durableStore.find(key)
            .filter(found -> !isDropped(found))
            .doOnNext(found -> {
                durableHits.incrementAndGet();
                log.debug("CACHE_DURABLE_HIT key={}", key);
            })
            .map(this::promote);
    }

    /** True when the memory tier or a pending write holds {@code key}. Does not touch LRU order. */
    public boolean contains(ScoreKey key) {
        lock.lock();
        try {
            if (memory.containsKey(key)) return true;
        } finally {
            lock.unlock();
        }
        return pendingWrites.containsKey(key);
    }

    /** Like {@link #contains}, but also consults the durable tier. */
    public Mono<Boolean> exists(ScoreKey key) {
        if (contains(key)) {
            return Mono.just(true);
        }
        return durableStore.find(key).filter(found -> !isDropped(found)).hasElement();
    }

    /**
     * Page of scores of one kind, most recent day first. The durable page is
     * merged with memory and pending entries; the in-process value wins.
     */
    public Flux<CompositeScore> listRecent(ScoreKind kind, long offset, int limit) {
        if (offset < 0 || limit <= 0) {
            return Flux.error(new IllegalArgumentException(
                "offset must be >= 0 and limit > 0: offset=" + offset + " limit=" + limit));
        }
        int window = (int) Math.min(Integer.MAX_VALUE, offset + limit);
        return durableStore.findRecent(kind, 0, window)
            .collectList()
            .flatMapMany(durable -> {
                Map<LocalDate, CacheEntry> merged = new HashMap<>();
                durable.stream()
                    .filter(e -> !isDropped(e))
                    .forEach(e -> merged.put(e.key().dayKey(), e));
                localSnapshot(kind).forEach(e -> merged.merge(e.key().dayKey(), e,
                    (stored, local) -> stored.isNewerThan(local) ? stored : local));
                return Flux.fromIterable(merged.values())
                    .sort(Comparator.comparing((CacheEntry e) -> e.key().dayKey()).reversed())
                    .skip(offset)
                    .take(limit)
                    .map(CacheEntry::value);
            });
    }

    // ── Writes ──────────────────────────────────────────────────────────────

    /**
     * Publishes {@code value} to the memory tier and schedules its durable write.
     * A value computed earlier than the one already held is ignored.
     *
     * @return the entry now held for {@code key}
     */
    public CacheEntry put(ScoreKey key, CompositeScore value) {
        if (!key.equals(value.key())) {
            throw new IllegalArgumentException("Key " + key + " does not match score " + value.key());
        }
        CacheEntry entry = CacheEntry.published(value, clock.instant());

        lock.lock();
        try {
            CacheEntry current = memory.get(key);
            if (current == null) current = pendingWrites.get(key);
            if (current != null && current.isNewerThan(entry)) {
                log.warn("CACHE_STALE_PUT_IGNORED key={} heldComputedAt={} offeredComputedAt={}",
                         key, current.lastComputedAt(), entry.lastComputedAt());
                return current;
            }
            memory.put(key, entry);
            pendingWrites.put(key, entry);
            failedWrites.remove(key);
        } finally {
            lock.unlock();
        }

        log.info("CACHE_PUT key={} overall={} dataComplete={}", key, value.overall(), value.dataComplete());
        writeDurably(entry);
        return entry;
    }

    /** Drops {@code key} from both tiers. */
    public Mono<Void> invalidate(ScoreKey key) {
        lock.lock();
        try {
            memory.remove(key);
            failedWrites.remove(key);
            CacheEntry inFlight = pendingWrites.remove(key);
            if (inFlight != null) {
                droppedInFlight.merge(key, inFlight.lastComputedAt(),
                    (a, b) -> a.isAfter(b) ? a : b);
            }
        } finally {
            lock.unlock();
        }
        log.info("CACHE_INVALIDATE key={}", key);
        return durableStore.delete(key);
    }

    /**
     * Writes again every entry whose durable write exhausted its retries.
     *
     * @return number of writes started
     */
    public int redriveFailedWrites() {
        int started = 0;
        for (ScoreKey key : List.copyOf(failedWrites)) {
            if (!failedWrites.remove(key)) continue;
            CacheEntry entry = pendingWrites.get(key);
            if (entry != null) {
                log.info("DURABLE_WRITE_REDRIVE key={} computedAt={}", key, entry.lastComputedAt());
                writeDurably(entry);
                started++;
            }
        }
        return started;
    }

    public CacheStats stats() {
        int size;
        lock.lock();
        try {
            size = memory.size();
        } finally {
            lock.unlock();
        }
        return new CacheStats(size, capacity, pendingWrites.size(),
            hits.get(), misses.get(), durableHits.get(), evictions.get(),
            durableWrites.get(), durableWriteFailures.get());
    }

    // ── Internals ───────────────────────────────────────────────────────────

    private CacheEntry lookupLocal(ScoreKey key) {
        lock.lock();
        try {
            CacheEntry entry = memory.get(key);
            if (entry != null) return entry;
            entry = pendingWrites.get(key);
            if (entry != null) {
                memory.put(key, entry);
            }
            return entry;
        } finally {
            lock.unlock();
        }
    }

    private CacheEntry promote(CacheEntry loaded) {
        lock.lock();
        try {
            CacheEntry current = memory.get(loaded.key());
            if (current != null && !loaded.isNewerThan(current)) {
                return current;
            }
            memory.put(loaded.key(), loaded);
            return loaded;
        } finally {
            lock.unlock();
        }
    }

    private List<CacheEntry> localSnapshot(ScoreKind kind) {
        List<CacheEntry> snapshot = new ArrayList<>();
        lock.lock();
        try {
            memory.values().forEach(e -> { if (e.key().scoreKind() == kind) snapshot.add(e); });
        } finally {
            lock.unlock();
        }
        pendingWrites.values().forEach(e -> { if (e.key().scoreKind() == kind) snapshot.add(e); });
        return snapshot;
    }

    private boolean isDropped(CacheEntry entry) {
        Instant dropped = droppedInFlight.get(entry.key());
        return dropped != null && !entry.lastComputedAt().isAfter(dropped);
    }

    /** Deletes a row written by an in-flight write after its entry was invalidated. */
    private void purgeIfDropped(CacheEntry entry) {
        Instant dropped = droppedInFlight.get(entry.key());
        if (dropped == null || entry.lastComputedAt().isAfter(dropped)) {
            return;
        }
        durableStore.find(entry.key())
            .filter(this::isDropped)
            .flatMap(row -> durableStore.delete(row.key()))
            .subscribe(
                unused -> { },
                err -> log.warn("DURABLE_PURGE_FAILED key={}", entry.key(), err),
                () -> {
                    droppedInFlight.remove(entry.key(), dropped);
                    log.debug("DURABLE_PURGE_OK key={} computedAt={}", entry.key(), entry.lastComputedAt());
                });
    }

    private void writeDurably(CacheEntry entry) {
        durableStore.save(entry)
            .retryWhen(Retry.backoff(maxWriteAttempts - 1L, initialBackoff)
                .doBeforeRetry(s -> log.warn("DURABLE_WRITE_RETRY key={} attempt={}",
                                             entry.key(), s.totalRetries() + 2))
                .onRetryExhaustedThrow((backoff, signal) ->
                    new DurableWriteFailedException(entry.key(), signal.totalRetries() + 1, signal.failure())))
            .subscribeOn(durableWriteScheduler)
            .subscribe(
                unused -> { },
                err -> {
                    if (pendingWrites.get(entry.key()) == entry) {
                        failedWrites.add(entry.key());
                    }
                    durableWriteFailures.incrementAndGet();
                    log.error("DURABLE_WRITE_FAILED key={} computedAt={}", entry.key(), entry.lastComputedAt(), err);
                    purgeIfDropped(entry);
                },
                () -> {
                    durableWrites.incrementAndGet();
                    pendingWrites.remove(entry.key(), entry);
                    log.debug("DURABLE_WRITE_OK key={} computedAt={}", entry.key(), entry.lastComputedAt());
                    purgeIfDropped(entry);
                    if (!failedWrites.isEmpty()) {
                        redriveFailedWrites();
                    }
                });
    }
}
