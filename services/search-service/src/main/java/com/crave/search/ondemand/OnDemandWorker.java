package com.crave.search.ondemand;

import com.crave.search.collection.CollectionCycleResult;
import com.crave.search.collection.CollectionGateway;
import com.crave.search.collection.PriorityTarget;
import com.crave.search.plan.EntityScope;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Metrics;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Owns a queued request from {@code queued} onwards: marks it processing, runs one keyword cycle for its
 * collection area and settles it as completed or back to pending with a cooldown.
 */
@Component
public class OnDemandWorker {
    private static final Logger logger = LoggerFactory.getLogger(OnDemandWorker.class);

    private final OnDemandRequestRepository requestRepository;
    private final PlaceholderEntityRepository placeholderRepository;
    private final CollectionGateway collectionGateway;
    private final OnDemandProperties properties;
    private final ObjectMapper objectMapper;
    private final ExecutorService onDemandExecutor;

    public OnDemandWorker(
        OnDemandRequestRepository requestRepository,
        PlaceholderEntityRepository placeholderRepository,
        CollectionGateway collectionGateway,
        OnDemandProperties properties,
        ObjectMapper objectMapper,
        @Qualifier("onDemandExecutor") ExecutorService onDemandExecutor
    ) {
        this.requestRepository = requestRepository;
        this.placeholderRepository = placeholderRepository;
        this.collectionGateway = collectionGateway;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.onDemandExecutor = onDemandExecutor;
    }

    /**
     * Hands the job to the worker pool. A full pool puts the request straight back to pending.
     */
    public void submit(OnDemandJob job) {
        try {
            onDemandExecutor.execute(() -> run(job));
        } catch (RejectedExecutionException e) {
            logger.warn("on_demand_worker_rejected request_id={} term={}", job.request().requestId(), job.normalizedTerm());
            Instant now = Instant.now();
            OnDemandMetadata metadata = job.metadata().copy()
                .put("lastError", "worker pool rejected job")
                .stampCooldown(now.plusMillis(properties.getInstantCooldownMs()));
            // queued -> pending is not a transition the table allows; take the processing step first.
            if (requestRepository.markProcessing(job.request().requestId(), now)) {
                requestRepository.resetToPending(
                    job.request().requestId(),
                    OnDemandStatus.PROCESSING,
                    OnDemandOutcome.ERROR,
                    now,
                    List.of(),
                    metadata.toJson(objectMapper)
                );
            }
        }
    }

    void run(OnDemandJob job) {
        OnDemandRequest request = job.request();
        if (!requestRepository.markProcessing(request.requestId(), Instant.now())) {
            logger.debug("on_demand_job_skipped request_id={} reason=not_queued", request.requestId());
            return;
        }
        List<String> attemptedAreas = List.of(job.area().name());
        try {
            CollectionCycleResult result = collectionGateway.executeKeywordSearchCycle(
                job.area().name(),
                List.of(buildPriorityTarget(job)),
                job.sortPlan()
            );
            Instant finishedAt = Instant.now();
            OnDemandMetadata metadata = job.metadata().copy()
                .recordSortRuns(job.sortPlan(), finishedAt)
                .put("reason", request.reason().value());
            if (result.succeededFor(job.normalizedTerm())) {
                CollectionCycleResult.TermSearch search = result.getSearchResults().get(job.normalizedTerm());
                metadata.put("posts", search == null ? 0 : search.getPosts());
                metadata.put("comments", search == null ? 0 : search.getComments());
                String entityId = resolveEntityId(job, finishedAt);
                requestRepository.markCompleted(
                    request.requestId(),
                    entityId,
                    finishedAt,
                    attemptedAreas,
                    metadata.toJson(objectMapper)
                );
                Metrics.counter("crave.on_demand.completion.total", "outcome", OnDemandOutcome.SUCCESS.value()).increment();
                logger.info(
                    "on_demand_completed request_id={} term={} entity_type={} entity_id={} area={}",
                    request.requestId(),
                    request.term(),
                    request.entityType().value(),
                    entityId,
                    job.area().name()
                );
                return;
            }
            metadata.stampCooldown(finishedAt.plusMillis(properties.getInstantCooldownMs()));
            requestRepository.resetToPending(
                request.requestId(),
                OnDemandStatus.PROCESSING,
                OnDemandOutcome.NO_RESULTS,
                finishedAt,
                attemptedAreas,
                metadata.toJson(objectMapper)
            );
            Metrics.counter("crave.on_demand.completion.total", "outcome", OnDemandOutcome.NO_RESULTS.value()).increment();
            logger.info(
                "on_demand_no_results request_id={} term={} area={}",
                request.requestId(),
                request.term(),
                job.area().name()
            );
        } catch (RuntimeException e) {
            logger.error(
                "on_demand_cycle_failed request_id={} term={} entity_type={} error={}",
                request.requestId(),
                request.term(),
                request.entityType().value(),
                e.getMessage(),
                e
            );
            Instant failedAt = Instant.now();
            OnDemandMetadata metadata = job.metadata().copy()
                .put("reason", request.reason().value())
                .put("lastError", e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage())
                .stampCooldown(failedAt.plusMillis(properties.getInstantCooldownMs()));
            requestRepository.resetToPending(
                request.requestId(),
                OnDemandStatus.PROCESSING,
                OnDemandOutcome.ERROR,
                failedAt,
                attemptedAreas,
                metadata.toJson(objectMapper)
            );
            Metrics.counter("crave.on_demand.completion.total", "outcome", OnDemandOutcome.ERROR.value()).increment();
        }
    }

    static PriorityTarget buildPriorityTarget(OnDemandJob job) {
        OnDemandRequest request = job.request();
        boolean lowResult = request.reason() == OnDemandReason.LOW_RESULT;
        PriorityTarget target = new PriorityTarget();
        target.setEntityId(lowResult && request.entityId() != null ? request.entityId() : request.requestId());
        target.setEntityName(job.normalizedTerm());
        target.setEntityType(request.entityType().value());
        target.setScore(priorityScore(request));
        target.setFactors(new PriorityTarget.Factors(lowResult ? 2 : 1, lowResult ? 1 : 0, request.occurrenceCount()));
        target.setNewEntity(request.reason() == OnDemandReason.UNRESOLVED);
        return target;
    }

    static int priorityScore(OnDemandRequest request) {
        int base = request.reason() == OnDemandReason.LOW_RESULT ? 200 : 100;
        return base + request.occurrenceCount();
    }

    /**
     * Low-result requests keep their entity. Otherwise an entity with the normalized name is reused, and a
     * placeholder is created as a last resort.
     */
    String resolveEntityId(OnDemandJob job, Instant now) {
        OnDemandRequest request = job.request();
        if (request.reason() == OnDemandReason.LOW_RESULT && request.entityId() != null) {
            return request.entityId();
        }
        if (request.entityId() != null && placeholderRepository.exists(request.entityId())) {
            return request.entityId();
        }
        String existing = placeholderRepository.findIdByName(
            job.normalizedTerm(),
            request.entityType(),
            request.locationKey()
        );
        if (existing != null) {
            return existing;
        }
        String created = placeholderRepository.createPlaceholder(
            job.normalizedTerm(),
            request.entityType(),
            request.locationKey(),
            request.term().trim(),
            now
        );
        logger.info(
            "on_demand_placeholder_created entity_id={} name={} entity_type={}",
            created,
            job.normalizedTerm(),
            request.entityType().value()
        );
        return created;
    }

    /** Food terms are lower-cased; restaurant and attribute names are title-cased. */
    public static String normalizeEntityName(String term, EntityScope type) {
        String sanitized = OnDemandRequestService.sanitizeTerm(term);
        if (type == EntityScope.FOOD || type == EntityScope.FOOD_ATTRIBUTE) {
            return sanitized.toLowerCase();
        }
        StringBuilder builder = new StringBuilder(sanitized.length());
        for (String word : sanitized.split(" ")) {
            if (builder.length() > 0) {
                builder.append(' ');
            }
            if (!word.isEmpty()) {
                builder.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1).toLowerCase());
            }
        }
        return builder.toString();
    }
}
