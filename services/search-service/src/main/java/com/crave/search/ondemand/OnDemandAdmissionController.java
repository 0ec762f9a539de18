package com.crave.search.ondemand;

import com.crave.search.collection.CollectionArea;
import com.crave.search.collection.CollectionAreaRepository;
import com.crave.search.collection.CollectionGateway;
import com.crave.search.collection.QueueDepth;
import com.crave.search.collection.SortPlanEntry;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Metrics;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Decides, per recorded request, whether a collection job is dispatched now. Requests move
 * {@code pending -> queued} only after the cooldown, refresh, backpressure and sort-plan gates pass;
 * everything after that belongs to {@link OnDemandWorker}.
 */
@Service
public class OnDemandAdmissionController {
    private static final Logger logger = LoggerFactory.getLogger(OnDemandAdmissionController.class);
    private static final long DEFAULT_SAFE_INTERVAL_MS = Duration.ofDays(1).toMillis();

    private final OnDemandRequestRepository requestRepository;
    private final CollectionAreaRepository areaRepository;
    private final CollectionGateway collectionGateway;
    private final SortPlanner sortPlanner;
    private final OnDemandWorker worker;
    private final OnDemandProperties properties;
    private final ObjectMapper objectMapper;

    public OnDemandAdmissionController(
        OnDemandRequestRepository requestRepository,
        CollectionAreaRepository areaRepository,
        CollectionGateway collectionGateway,
        SortPlanner sortPlanner,
        OnDemandWorker worker,
        OnDemandProperties properties,
        ObjectMapper objectMapper
    ) {
        this.requestRepository = requestRepository;
        this.areaRepository = areaRepository;
        this.collectionGateway = collectionGateway;
        this.sortPlanner = sortPlanner;
        this.worker = worker;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public List<EnqueueResult> enqueueRequests(List<OnDemandRequestInput> inputs) {
        return enqueueRequests(inputs, Instant.now());
    }

    public List<EnqueueResult> enqueueRequests(List<OnDemandRequestInput> inputs, Instant now) {
        List<EnqueueResult> results = new ArrayList<>();
        if (inputs == null || inputs.isEmpty() || !properties.isEnabled()) {
            return results;
        }

        try {
            sweepBacklog(now);
        } catch (RuntimeException e) {
            logger.warn("on_demand_backlog_sweep_failed error={}", e.getMessage());
        }

        int limit = Math.max(1, properties.getMaxPerBatch());
        for (OnDemandRequestInput input : inputs.subList(0, Math.min(limit, inputs.size()))) {
            try {
                OnDemandRequest record = requestRepository.findByKey(
                    input.getTerm(),
                    input.getEntityType(),
                    input.getReason(),
                    CollectionArea.normalizeKey(input.getLocationKey())
                );
                if (record != null) {
                    results.add(processRecord(record, now));
                }
            } catch (RuntimeException e) {
                logger.error(
                    "on_demand_enqueue_failed term={} entity_type={} reason={} error={}",
                    input.getTerm(),
                    input.getEntityType().value(),
                    input.getReason().value(),
                    e.getMessage(),
                    e
                );
            }
        }

        boolean needsEta = false;
        for (EnqueueResult result : results) {
            if (result.isQueued() && result.getEtaMs() == null) {
                needsEta = true;
                break;
            }
        }
        if (needsEta) {
            long etaMs = estimateQueueDelayMs();
            for (EnqueueResult result : results) {
                if (result.isQueued() && result.getEtaMs() == null) {
                    result.setEtaMs(etaMs);
                }
            }
        }
        return results;
    }

    /**
     * Re-runs the gates for the most requested, longest-waiting pending requests.
     */
    public int sweepBacklog(Instant now) {
        List<OnDemandRequest> backlog = requestRepository.findPendingBacklog(Math.max(1, properties.getMaxPerBatch()));
        int queued = 0;
        for (OnDemandRequest record : backlog) {
            try {
                if (processRecord(record, now).isQueued()) {
                    queued++;
                }
            } catch (RuntimeException e) {
                logger.error(
                    "on_demand_backlog_request_failed request_id={} term={} error={}",
                    record.requestId(),
                    record.term(),
                    e.getMessage(),
                    e
                );
            }
        }
        return queued;
    }

    /**
     * Recovers requests whose job was lost before it reported back, e.g. across a restart.
     */
    public int releaseStaleLeases(Instant now) {
        int released = requestRepository.releaseStaleLeases(now.minusMillis(properties.getStaleLeaseMs()), now);
        if (released > 0) {
            logger.warn("on_demand_stale_leases_released count={}", released);
            Metrics.counter("crave.on_demand.stale_lease.released").increment(released);
        }
        return released;
    }

    /** Falls back to a single job's duration when the queue cannot be inspected. */
    public long estimateQueueDelayMs() {
        long estimatedJobMs = properties.getEstimatedJobMs();
        try {
            QueueDepth depth = collectionGateway.getQueueDepth();
            long position = Math.max(1, depth.getBacklog() + 1);
            return position * estimatedJobMs;
        } catch (RuntimeException e) {
            logger.debug("on_demand_eta_unavailable error={}", e.getMessage());
            return estimatedJobMs;
        }
    }

    EnqueueResult processRecord(OnDemandRequest record, Instant now) {
        String locationKey = CollectionArea.normalizeKey(record.locationKey());
        if (record.status() != OnDemandStatus.PENDING) {
            logger.debug("on_demand_in_flight request_id={} status={}", record.requestId(), record.status());
            countAdmission("in_flight");
            return EnqueueResult.notQueued(record, locationKey);
        }
        if (CollectionArea.GLOBAL.equals(locationKey)) {
            logger.debug("on_demand_skipped_global request_id={} term={}", record.requestId(), record.term());
            countAdmission("global");
            return EnqueueResult.notQueued(record, locationKey);
        }

        OnDemandMetadata metadata = OnDemandMetadata.from(record.metadata());
        CollectionArea area = areaRepository.findActiveByName(locationKey);
        long safeIntervalMs = area == null ? DEFAULT_SAFE_INTERVAL_MS : area.safeIntervalMs();

        AdmissionDecision decision = evaluateGates(record, metadata, safeIntervalMs, now);
        if (!decision.runNow()) {
            defer(record, metadata, decision, now);
            return EnqueueResult.notQueued(record, locationKey);
        }

        List<SortPlanEntry> sortPlan = sortPlanner.plan(metadata, safeIntervalMs, collectionGateway.configuredSorts(), now);
        if (sortPlan.isEmpty()) {
            defer(record, metadata, AdmissionDecision.defer(DeferReason.SORTS_NOT_DUE), now);
            return EnqueueResult.notQueued(record, locationKey);
        }

        if (area == null) {
            OnDemandMetadata updated = metadata.copy()
                .put("lastOutcome", OnDemandOutcome.NO_ACTIVE_AREA.value())
                .put("lastAttemptAt", now.toString())
                .put("deferredAttempts", 0)
                .stampCooldown(now.plusMillis(properties.getInstantCooldownMs()));
            requestRepository.resetToPending(
                record.requestId(),
                OnDemandStatus.PENDING,
                OnDemandOutcome.NO_ACTIVE_AREA,
                now,
                List.of(),
                updated.toJson(objectMapper)
            );
            logger.warn("on_demand_no_active_area request_id={} location_key={}", record.requestId(), locationKey);
            countAdmission(OnDemandOutcome.NO_ACTIVE_AREA.value());
            return EnqueueResult.notQueued(record, locationKey);
        }

        if (!requestRepository.markQueued(record.requestId(), now)) {
            logger.debug("on_demand_lost_race request_id={}", record.requestId());
            countAdmission("lost_race");
            return EnqueueResult.notQueued(record, locationKey);
        }

        worker.submit(new OnDemandJob(
            record,
            OnDemandWorker.normalizeEntityName(record.term(), record.entityType()),
            area,
            sortPlan,
            metadata
        ));
        logger.info(
            "on_demand_queued request_id={} term={} entity_type={} area={} sorts={}",
            record.requestId(),
            record.term(),
            record.entityType().value(),
            area.name(),
            sortPlan.size()
        );
        countAdmission("queued");
        return EnqueueResult.queued(record, locationKey);
    }

    AdmissionDecision evaluateGates(OnDemandRequest record, OnDemandMetadata metadata, long safeIntervalMs, Instant now) {
        Instant cooldownUntil = metadata.instantCooldownUntil();
        if (cooldownUntil != null && cooldownUntil.isAfter(now)) {
            return AdmissionDecision.defer(DeferReason.COOLDOWN_ACTIVE);
        }

        Instant lastRunAt = record.lastRunAt();
        long cooldownMs = record.lastOutcome() == OnDemandOutcome.NO_RESULTS
            ? SortPlanner.refreshWindowMs(safeIntervalMs)
            : safeIntervalMs;
        if (lastRunAt != null && now.toEpochMilli() - lastRunAt.toEpochMilli() < cooldownMs) {
            return AdmissionDecision.defer(DeferReason.REFRESH_COOLDOWN);
        }

        QueueDepth depth;
        try {
            depth = collectionGateway.getQueueDepth();
        } catch (RuntimeException e) {
            logger.warn(
                "on_demand_queue_depth_unavailable request_id={} error={} action=admit",
                record.requestId(),
                e.getMessage()
            );
            return AdmissionDecision.admit(null);
        }
        if (depth.getExecution().getWaiting() >= properties.getMaxImmediateWaiting()) {
            return AdmissionDecision.defer(DeferReason.EXECUTION_QUEUE_WAITING, depth);
        }
        if (depth.getExecution().getActive() >= properties.getMaxImmediateActive()) {
            return AdmissionDecision.defer(DeferReason.EXECUTION_QUEUE_ACTIVE, depth);
        }
        int processingBacklog = depth.getProcessing().getWaiting() + depth.getProcessing().getActive();
        if (processingBacklog >= properties.getMaxProcessingBacklog()) {
            return AdmissionDecision.defer(DeferReason.PROCESSING_QUEUE_BACKLOG, depth);
        }
        return AdmissionDecision.admit(depth);
    }

    private void defer(OnDemandRequest record, OnDemandMetadata metadata, AdmissionDecision decision, Instant now) {
        DeferReason reason = decision.deferReason();
        int attempts = record.deferredAttempts() + 1;
        OnDemandMetadata updated = metadata.copy().recordDeferral(reason, attempts, now, decision.snapshot());
        if (reason.stampsCooldown()) {
            updated.stampCooldown(now.plusMillis(properties.getInstantCooldownMs()));
        }
        requestRepository.markDeferred(record.requestId(), attempts, updated.toJson(objectMapper), now);
        logger.debug(
            "on_demand_deferred request_id={} term={} reason={} attempts={}",
            record.requestId(),
            record.term(),
            reason.value(),
            attempts
        );
        countAdmission("deferred");
    }

    private static void countAdmission(String outcome) {
        Metrics.counter("crave.on_demand.admission.total", "outcome", outcome).increment();
    }
}
