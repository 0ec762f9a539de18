package com.crave.search.ondemand;

import com.crave.search.collection.QueueDepth;
import com.crave.search.collection.SortPlanEntry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Open-ended metadata blob of an on-demand request. Unknown keys are carried through untouched.
 */
public final class OnDemandMetadata {
    static final String INSTANT_COOLDOWN_UNTIL = "instantCooldownUntil";
    static final String SORT_HISTORY = "sortHistory";
    static final String CONTEXT = "context";

    private final ObjectNode node;

    private OnDemandMetadata(ObjectNode node) {
        this.node = node;
    }

    public static OnDemandMetadata from(JsonNode raw) {
        if (raw instanceof ObjectNode objectNode) {
            return new OnDemandMetadata(objectNode.deepCopy());
        }
        return new OnDemandMetadata(JsonNodeFactory.instance.objectNode());
    }

    public OnDemandMetadata copy() {
        return new OnDemandMetadata(node.deepCopy());
    }

    public ObjectNode node() {
        return node;
    }

    public Instant instantCooldownUntil() {
        return parseInstant(node.get(INSTANT_COOLDOWN_UNTIL));
    }

    public OnDemandMetadata stampCooldown(Instant until) {
        node.put(INSTANT_COOLDOWN_UNTIL, until.toString());
        return this;
    }

    public Instant lastSortRun(String sort) {
        JsonNode history = node.get(SORT_HISTORY);
        if (history == null || !history.isObject()) {
            return null;
        }
        JsonNode entry = history.get(sort);
        return entry == null ? null : parseInstant(entry.get("lastRunAt"));
    }

    public OnDemandMetadata recordSortRuns(List<SortPlanEntry> sortPlan, Instant runAt) {
        if (sortPlan == null || sortPlan.isEmpty()) {
            return this;
        }
        JsonNode existing = node.get(SORT_HISTORY);
        ObjectNode history = existing instanceof ObjectNode objectNode ? objectNode : node.putObject(SORT_HISTORY);
        for (SortPlanEntry entry : sortPlan) {
            ObjectNode run = history.putObject(entry.sort());
            run.put("lastRunAt", runAt.toString());
            if (entry.timeFilter() != null) {
                run.put("lastTimeFilter", entry.timeFilter());
            }
        }
        return this;
    }

    public OnDemandMetadata recordDeferral(DeferReason reason, int deferredAttempts, Instant at, QueueDepth snapshot) {
        node.put("lastOutcome", OnDemandOutcome.DEFERRED.value());
        node.put("lastDeferredAt", at.toString());
        node.put("deferredReason", reason.value());
        node.put("deferredAttempts", deferredAttempts);
        if (snapshot != null) {
            ObjectNode queue = node.putObject("lastQueueSnapshot");
            putStage(queue.putObject("execution"), snapshot.getExecution());
            putStage(queue.putObject("processing"), snapshot.getProcessing());
        }
        return this;
    }

    public OnDemandMetadata put(String key, String value) {
        node.put(key, value);
        return this;
    }

    public OnDemandMetadata put(String key, int value) {
        node.put(key, value);
        return this;
    }

    public String toJson(ObjectMapper objectMapper) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize on-demand metadata", e);
        }
    }

    private static void putStage(ObjectNode target, QueueDepth.Stage stage) {
        target.put("waiting", stage.getWaiting());
        target.put("active", stage.getActive());
        target.put("delayed", stage.getDelayed());
    }

    private static Instant parseInstant(JsonNode value) {
        if (value == null || !value.isTextual()) {
            return null;
        }
        try {
            return Instant.parse(value.asText());
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
