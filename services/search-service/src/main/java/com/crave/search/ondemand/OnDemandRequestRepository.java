package com.crave.search.ondemand;

import com.crave.search.execution.RowValues;
import com.crave.search.plan.EntityScope;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Persistence of on-demand requests. Every status change is a single {@code UPDATE ... WHERE status = ?}
 * so concurrent callers racing on one key see exactly one winner.
 */
@Repository
public class OnDemandRequestRepository {
    static final String COLUMNS = "request_id, term, entity_type, reason, location_key, occurrence_count, status, "
        + "entity_id, metadata, result_restaurant_count, result_food_count, attempted_areas, deferred_attempts, "
        + "last_outcome, last_seen_at, last_enqueued_at, last_attempt_at, last_completed_at";

    static final String RELEASE_STALE_SQL = "UPDATE collection_on_demand_requests SET status = 'pending', "
        + "last_outcome = ?, last_attempt_at = last_enqueued_at, updated_at = ? "
        + "WHERE status IN ('queued', 'processing') AND last_enqueued_at < ?";

    static final String UPSERT_SQL = "INSERT INTO collection_on_demand_requests "
        + "(term, entity_type, reason, location_key, entity_id, metadata, result_restaurant_count, result_food_count, "
        + "occurrence_count, status, deferred_attempts, last_seen_at, created_at, updated_at) "
        + "VALUES (?, ?, ?, ?, ?::uuid, ?::jsonb, ?, ?, 1, 'pending', 0, ?, ?, ?) "
        + "ON CONFLICT (term, entity_type, reason, location_key) DO UPDATE SET "
        + "occurrence_count = collection_on_demand_requests.occurrence_count + 1, "
        + "last_seen_at = EXCLUDED.last_seen_at, "
        + "updated_at = EXCLUDED.updated_at, "
        + "entity_id = COALESCE(EXCLUDED.entity_id, collection_on_demand_requests.entity_id), "
        + "result_restaurant_count = EXCLUDED.result_restaurant_count, "
        + "result_food_count = EXCLUDED.result_food_count, "
        + "metadata = COALESCE(collection_on_demand_requests.metadata, '{}'::jsonb) || EXCLUDED.metadata "
        + "|| jsonb_build_object('context', COALESCE(collection_on_demand_requests.metadata->'context', '{}'::jsonb) "
        + "|| COALESCE(EXCLUDED.metadata->'context', '{}'::jsonb)), "
        + "status = CASE WHEN collection_on_demand_requests.status = 'completed' THEN 'pending' "
        + "ELSE collection_on_demand_requests.status END";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public OnDemandRequestRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    public void upsert(
        OnDemandRequestInput input,
        String metadataJson,
        int restaurantCount,
        int foodCount,
        Instant seenAt
    ) {
        Timestamp timestamp = Timestamp.from(seenAt);
        jdbcTemplate.update(
            UPSERT_SQL,
            input.getTerm(),
            input.getEntityType().value(),
            input.getReason().value(),
            input.getLocationKey(),
            input.getEntityId(),
            metadataJson,
            restaurantCount,
            foodCount,
            timestamp,
            timestamp,
            timestamp
        );
    }

    public OnDemandRequest findByKey(String term, EntityScope entityType, OnDemandReason reason, String locationKey) {
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(
            "SELECT " + COLUMNS + " FROM collection_on_demand_requests "
                + "WHERE term = ? AND entity_type = ? AND reason = ? AND location_key = ?",
            term,
            entityType.value(),
            reason.value(),
            locationKey
        );
        return rows.isEmpty() ? null : toRequest(rows.get(0));
    }

    public List<OnDemandRequest> findPendingBacklog(int limit) {
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(
            "SELECT " + COLUMNS + " FROM collection_on_demand_requests "
                + "WHERE status = 'pending' AND location_key <> 'global' "
                + "ORDER BY occurrence_count DESC, last_seen_at ASC LIMIT ?",
            limit
        );
        List<OnDemandRequest> requests = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            requests.add(toRequest(row));
        }
        return requests;
    }

    public boolean markQueued(String requestId, Instant enqueuedAt) {
        return transition(
            requestId,
            OnDemandStatus.PENDING,
            OnDemandStatus.QUEUED,
            "last_enqueued_at = ?, updated_at = ?",
            Timestamp.from(enqueuedAt),
            Timestamp.from(enqueuedAt)
        );
    }

    public boolean markProcessing(String requestId, Instant startedAt) {
        return transition(
            requestId,
            OnDemandStatus.QUEUED,
            OnDemandStatus.PROCESSING,
            "updated_at = ?",
            Timestamp.from(startedAt)
        );
    }

    public boolean markCompleted(
        String requestId,
        String entityId,
        Instant completedAt,
        List<String> attemptedAreas,
        String metadataJson
    ) {
        Timestamp timestamp = Timestamp.from(completedAt);
        return transition(
            requestId,
            OnDemandStatus.PROCESSING,
            OnDemandStatus.COMPLETED,
            "entity_id = ?::uuid, last_outcome = ?, last_completed_at = ?, last_attempt_at = ?, deferred_attempts = 0, "
                + "attempted_areas = ?::text[], metadata = ?::jsonb, updated_at = ?",
            entityId,
            OnDemandOutcome.SUCCESS.value(),
            timestamp,
            timestamp,
            attemptedAreas.toArray(new String[0]),
            metadataJson,
            timestamp
        );
    }

    /**
     * Returns the request to {@code pending} with an outcome. {@code expected} is {@code PROCESSING} after a
     * cycle, or {@code PENDING} when the request never left the queue gate.
     */
    public boolean resetToPending(
        String requestId,
        OnDemandStatus expected,
        OnDemandOutcome outcome,
        Instant attemptedAt,
        List<String> attemptedAreas,
        String metadataJson
    ) {
        Timestamp timestamp = Timestamp.from(attemptedAt);
        return transition(
            requestId,
            expected,
            OnDemandStatus.PENDING,
            "last_outcome = ?, last_attempt_at = ?, deferred_attempts = 0, attempted_areas = ?::text[], "
                + "metadata = ?::jsonb, updated_at = ?",
            outcome.value(),
            timestamp,
            attemptedAreas.toArray(new String[0]),
            metadataJson,
            timestamp
        );
    }

    public boolean markDeferred(String requestId, int deferredAttempts, String metadataJson, Instant deferredAt) {
        int updated = jdbcTemplate.update(
            "UPDATE collection_on_demand_requests SET deferred_attempts = ?, last_outcome = ?, metadata = ?::jsonb, "
                + "updated_at = ? WHERE request_id = ?::uuid AND status = ?",
            deferredAttempts,
            OnDemandOutcome.DEFERRED.value(),
            metadataJson,
            Timestamp.from(deferredAt),
            requestId,
            OnDemandStatus.PENDING.value()
        );
        return updated > 0;
    }

    /**
     * Returns {@code queued} and {@code processing} rows enqueued before {@code cutoff} to {@code pending}
     * with an {@code error} outcome. Such rows belong to jobs lost in a restart; no live worker holds them.
     */
    public int releaseStaleLeases(Instant cutoff, Instant now) {
        return jdbcTemplate.update(
            RELEASE_STALE_SQL,
            OnDemandOutcome.ERROR.value(),
            Timestamp.from(now),
            Timestamp.from(cutoff)
        );
    }

    private boolean transition(
        String requestId,
        OnDemandStatus from,
        OnDemandStatus to,
        String assignments,
        Object... values
    ) {
        if (from != to && !from.canTransitionTo(to)) {
            throw new IllegalStateException("Illegal on-demand transition " + from.value() + " -> " + to.value());
        }
        Object[] args = new Object[values.length + 3];
        args[0] = to.value();
        System.arraycopy(values, 0, args, 1, values.length);
        args[values.length + 1] = requestId;
        args[values.length + 2] = from.value();
        int updated = jdbcTemplate.update(
            "UPDATE collection_on_demand_requests SET status = ?, " + assignments
                + " WHERE request_id = ?::uuid AND status = ?",
            args
        );
        return updated > 0;
    }

    private OnDemandRequest toRequest(Map<String, Object> row) {
        return new OnDemandRequest(
            RowValues.string(row, "request_id"),
            RowValues.string(row, "term"),
            EntityScope.fromValue(RowValues.string(row, "entity_type")),
            OnDemandReason.fromValue(RowValues.string(row, "reason")),
            RowValues.string(row, "location_key"),
            (int) RowValues.longOrZero(row, "occurrence_count"),
            OnDemandStatus.fromValue(RowValues.string(row, "status")),
            RowValues.string(row, "entity_id"),
            RowValues.json(objectMapper, row, "metadata"),
            (int) RowValues.longOrZero(row, "result_restaurant_count"),
            (int) RowValues.longOrZero(row, "result_food_count"),
            RowValues.stringList(row, "attempted_areas"),
            (int) RowValues.longOrZero(row, "deferred_attempts"),
            OnDemandOutcome.fromValue(RowValues.string(row, "last_outcome")),
            RowValues.toInstant(row.get("last_seen_at")),
            RowValues.toInstant(row.get("last_enqueued_at")),
            RowValues.toInstant(row.get("last_attempt_at")),
            RowValues.toInstant(row.get("last_completed_at"))
        );
    }
}
