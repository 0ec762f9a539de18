package com.crave.search.ondemand;

import com.crave.search.plan.EntityScope;

public class EnqueueResult {
    private final String requestId;
    private final String term;
    private final EntityScope entityType;
    private final OnDemandReason reason;
    private final String locationKey;
    private final boolean queued;
    private Long etaMs;

    public EnqueueResult(
        String requestId,
        String term,
        EntityScope entityType,
        OnDemandReason reason,
        String locationKey,
        boolean queued
    ) {
        this.requestId = requestId;
        this.term = term;
        this.entityType = entityType;
        this.reason = reason;
        this.locationKey = locationKey;
        this.queued = queued;
    }

    static EnqueueResult notQueued(OnDemandRequest record, String locationKey) {
        return new EnqueueResult(
            record.requestId(),
            record.term(),
            record.entityType(),
            record.reason(),
            locationKey,
            false
        );
    }

    static EnqueueResult queued(OnDemandRequest record, String locationKey) {
        return new EnqueueResult(
            record.requestId(),
            record.term(),
            record.entityType(),
            record.reason(),
            locationKey,
            true
        );
    }

    public String getRequestId() {
        return requestId;
    }

    public String getTerm() {
        return term;
    }

    public EntityScope getEntityType() {
        return entityType;
    }

    public OnDemandReason getReason() {
        return reason;
    }

    public String getLocationKey() {
        return locationKey;
    }

    public boolean isQueued() {
        return queued;
    }

    public Long getEtaMs() {
        return etaMs;
    }

    public void setEtaMs(Long etaMs) {
        this.etaMs = etaMs;
    }
}
