package com.recoveryplatform.score.service;

import com.recoveryplatform.common.model.ComponentKind;
import com.recoveryplatform.common.model.CompositeScore;
import com.recoveryplatform.common.model.DataGap;
import com.recoveryplatform.common.model.ScoreComponent;
import com.recoveryplatform.common.model.ScoreKey;
import com.recoveryplatform.common.model.ScoreKind;
import com.recoveryplatform.score.cache.CacheEntry;
import com.recoveryplatform.score.coordinator.KeyState;
import com.recoveryplatform.score.dto.FreshnessStatusDTO;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FreshnessPolicyTest {

    private static final LocalDate DAY = LocalDate.of(2024, 3, 15);
    private static final ScoreKey KEY = ScoreKey.of(ScoreKind.RECOVERY, DAY);
    private static final Instant NOON = Instant.parse("2024-03-15T12:00:00Z");

    private static FreshnessPolicy policyAt(Instant now) {
        return new FreshnessPolicy(Clock.fixed(now, ZoneOffset.UTC), ZoneOffset.UTC, Duration.ofMinutes(30), 10);
    }

    private static CacheEntry entry(boolean complete, Instant publishedAt) {
        List<ScoreComponent> components = complete
            ? List.of()
            : List.of(ScoreComponent.missing(ComponentKind.HRV, Map.of(), DataGap.MISSING_SAMPLE));
        CompositeScore score = new CompositeScore(ScoreKind.RECOVERY, DAY, 70, components,
            publishedAt.minusSeconds(1), complete);
        return CacheEntry.published(score, publishedAt);
    }

    @Test
    @DisplayName("pending recompute wins over everything else")
    void computing() {
        FreshnessStatusDTO status = policyAt(NOON).evaluate(KEY, KeyState.SUPERSEDED, entry(true, NOON));

        assertEquals(FreshnessStatus.COMPUTING, status.status());
        assertEquals(FreshnessPolicy.MSG_COMPUTING, status.message());
    }

    @Test
    @DisplayName("complete score published within the window → recently updated")
    void recentlyUpdated() {
        FreshnessStatusDTO status = policyAt(NOON).evaluate(KEY, KeyState.IDLE, entry(true, NOON.minusSeconds(600)));

        assertEquals(FreshnessStatus.RECENTLY_UPDATED, status.status());
        assertEquals(NOON.minusSeconds(600), status.lastPublishedAt());
        assertTrue(status.dataComplete());
    }

    @Test
    @DisplayName("complete score older than the window → silent")
    void silent() {
        FreshnessStatusDTO status = policyAt(NOON).evaluate(KEY, KeyState.IDLE, entry(true, NOON.minusSeconds(3600)));

        assertEquals(FreshnessStatus.SILENT, status.status());
        assertEquals(FreshnessPolicy.MSG_SILENT, status.message());
    }

    @Test
    @DisplayName("no score before the sync hour → waiting for watch sync")
    void waitingForSyncInTheMorning() {
        FreshnessStatusDTO status = policyAt(Instant.parse("2024-03-15T07:00:00Z"))
            .evaluate(KEY, KeyState.IDLE, null);

        assertEquals(FreshnessStatus.WAITING_FOR_DATA, status.status());
        assertEquals(FreshnessPolicy.MSG_WAITING_SYNC, status.message());
        assertNull(status.lastPublishedAt());
        assertNull(status.dataComplete());
    }

    @Test
    @DisplayName("incomplete score after the sync hour → monitoring")
    void monitoringLater() {
        FreshnessStatusDTO status = policyAt(NOON).evaluate(KEY, KeyState.IDLE, entry(false, NOON.minusSeconds(7200)));

        assertEquals(FreshnessStatus.WAITING_FOR_DATA, status.status());
        assertEquals(FreshnessPolicy.MSG_MONITORING, status.message());
        assertFalse(status.dataComplete());
    }

    @Test
    @DisplayName("incomplete score just published → updated, waiting for more")
    void updatedButWaiting() {
        FreshnessStatusDTO status = policyAt(NOON).evaluate(KEY, KeyState.IDLE, entry(false, NOON.minusSeconds(60)));

        assertEquals(FreshnessStatus.WAITING_FOR_DATA, status.status());
        assertEquals(FreshnessPolicy.MSG_UPDATED_WAITING, status.message());
    }
}
