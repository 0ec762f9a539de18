package com.crave.search.collection;

import java.time.Duration;

/**
 * An active collection area. The name doubles as the location key of on-demand requests.
 */
public record CollectionArea(String name, double safeIntervalDays, Double centerLatitude, Double centerLongitude) {
    public static final String GLOBAL = "global";

    /** Non-positive or missing intervals fall back to one day. */
    public long safeIntervalMs() {
        double days = Double.isFinite(safeIntervalDays) && safeIntervalDays > 0 ? safeIntervalDays : 1d;
        return Math.round(days * Duration.ofDays(1).toMillis());
    }

    public boolean hasCenter() {
        return centerLatitude != null && centerLongitude != null;
    }

    public static String normalizeKey(String locationKey) {
        if (locationKey == null) {
            return GLOBAL;
        }
        String normalized = locationKey.trim().toLowerCase();
        return normalized.isEmpty() ? GLOBAL : normalized;
    }
}
