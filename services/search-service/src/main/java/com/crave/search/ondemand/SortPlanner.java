package com.crave.search.ondemand;

import com.crave.search.collection.SortPlanEntry;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Decides which sort modes a keyword cycle should run for a request, given each mode's last run.
 * {@code new} always runs; {@code top} and {@code relevance} wait out a long refresh window.
 */
@Component
public class SortPlanner {
    static final int TOP_REFRESH_MULTIPLIER = 3;
    static final Duration TOP_REFRESH_FLOOR = Duration.ofDays(60);
    static final Duration SHORT_SAFE_INTERVAL = Duration.ofDays(10);
    static final int FALLBACK_MIN_RESULTS = 20;

    public List<SortPlanEntry> plan(
        OnDemandMetadata metadata,
        long safeIntervalMs,
        List<String> configuredSorts,
        Instant now
    ) {
        List<SortPlanEntry> plan = new ArrayList<>();
        long topRefreshMs = refreshWindowMs(safeIntervalMs);
        for (String sort : configuredSorts) {
            if (!"top".equals(sort) && !"relevance".equals(sort)) {
                plan.add(SortPlanEntry.of(sort));
                continue;
            }
            Instant lastRunAt = metadata.lastSortRun(sort);
            if (lastRunAt != null && now.toEpochMilli() - lastRunAt.toEpochMilli() < topRefreshMs) {
                continue;
            }
            boolean monthly = lastRunAt != null && safeIntervalMs <= SHORT_SAFE_INTERVAL.toMillis();
            if (monthly) {
                plan.add(new SortPlanEntry(sort, "month", "year", FALLBACK_MIN_RESULTS));
            } else {
                plan.add(new SortPlanEntry(sort, "year", null, null));
            }
        }
        return plan;
    }

    /** Also the cooldown applied after a run that found nothing. */
    public static long refreshWindowMs(long safeIntervalMs) {
        return Math.max(Math.max(safeIntervalMs, 0L) * TOP_REFRESH_MULTIPLIER, TOP_REFRESH_FLOOR.toMillis());
    }
}
