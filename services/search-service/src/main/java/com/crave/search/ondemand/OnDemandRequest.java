package com.crave.search.ondemand;

import com.crave.search.plan.EntityScope;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.List;

/**
 * A persisted on-demand request row, keyed by {@code (term, entityType, reason, locationKey)}.
 */
public record OnDemandRequest(
    String requestId,
    String term,
    EntityScope entityType,
    OnDemandReason reason,
    String locationKey,
    int occurrenceCount,
    OnDemandStatus status,
    String entityId,
    JsonNode metadata,
    int resultRestaurantCount,
    int resultFoodCount,
    List<String> attemptedAreas,
    int deferredAttempts,
    OnDemandOutcome lastOutcome,
    Instant lastSeenAt,
    Instant lastEnqueuedAt,
    Instant lastAttemptAt,
    Instant lastCompletedAt
) {

    /** Latest of completion, attempt and enqueue times; null when the key never ran. */
    public Instant lastRunAt() {
        Instant latest = null;
        for (Instant candidate : new Instant[] {lastCompletedAt, lastAttemptAt, lastEnqueuedAt}) {
            if (candidate != null && (latest == null || candidate.isAfter(latest))) {
                latest = candidate;
            }
        }
        return latest;
    }
}
