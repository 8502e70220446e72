package com.recoveryplatform.score.service;

import com.recoveryplatform.common.model.ScoreKey;
import com.recoveryplatform.score.cache.CacheEntry;
import com.recoveryplatform.score.coordinator.KeyState;
import com.recoveryplatform.score.dto.FreshnessStatusDTO;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;

/**
 * Derives what a reader should be told about one score.
 *
 * <pre>
 *   1. COMPUTING         key is invalidated or computing
 *   2. WAITING_FOR_DATA  no score yet, or the score is missing inputs
 *   3. RECENTLY_UPDATED  published within {@code recentWindow} (30 min)
 *   4. SILENT            otherwise
 * </pre>
 *
 * The waiting-for-data message depends on local time: the watch usually syncs
 * the night's data by mid-morning.
 */
@Component
public class FreshnessPolicy {

    static final String MSG_COMPUTING        = "Updating score with new health data";
    static final String MSG_RECENT           = "Score updated with latest data";
    static final String MSG_SILENT           = "Score is up to date";
    static final String MSG_UPDATED_WAITING  = "Score updated, waiting for more data";
    static final String MSG_WAITING_SYNC     = "Waiting for watch sync";
    static final String MSG_MONITORING       = "Monitoring for health data updates";

    private final Clock clock;
    private final ZoneId zone;
    private final Duration recentWindow;
    private final int syncExpectedByHour;

    public FreshnessPolicy(Clock clock,
                           ZoneId scoringZone,
                           @Value("${scoring.freshness.recent-window:30m}") Duration recentWindow,
                           @Value("${scoring.freshness.sync-expected-by-hour:10}") int syncExpectedByHour) {
        this.clock              = clock;
        this.zone               = scoringZone;
        this.recentWindow       = recentWindow;
        this.syncExpectedByHour = syncExpectedByHour;
    }

    /**
     * @param entry the published entry for {@code key}, or null when none exists
     */
    public FreshnessStatusDTO evaluate(ScoreKey key, KeyState state, CacheEntry entry) {
        Instant now = clock.instant();
        Instant publishedAt = entry != null ? entry.lastPublishedAt() : null;
        Boolean complete = entry != null ? entry.value().dataComplete() : null;
        boolean recent = publishedAt != null && !publishedAt.plus(recentWindow).isBefore(now);

        FreshnessStatus status;
        String message;
        if (state.isPending()) {
            status  = FreshnessStatus.COMPUTING;
            message = MSG_COMPUTING;
        } else if (entry == null || !entry.value().dataComplete()) {
            status  = FreshnessStatus.WAITING_FOR_DATA;
            if (recent) {
                message = MSG_UPDATED_WAITING;
            } else if (now.atZone(zone).getHour() < syncExpectedByHour) {
                message = MSG_WAITING_SYNC;
            } else {
                message = MSG_MONITORING;
            }
        } else if (recent) {
            status  = FreshnessStatus.RECENTLY_UPDATED;
            message = MSG_RECENT;
        } else {
            status  = FreshnessStatus.SILENT;
            message = MSG_SILENT;
        }
        return new FreshnessStatusDTO(key.scoreKind(), key.dayKey(), status, message, publishedAt, complete);
    }
}
