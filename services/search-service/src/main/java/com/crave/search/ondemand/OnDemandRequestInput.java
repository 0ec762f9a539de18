package com.crave.search.ondemand;

import com.crave.search.plan.EntityScope;
import java.util.LinkedHashMap;
import java.util.Map;

public class OnDemandRequestInput {
    private final String term;
    private final EntityScope entityType;
    private final OnDemandReason reason;
    private final String entityId;
    private final String locationKey;
    private final Map<String, Object> metadata;

    public OnDemandRequestInput(
        String term,
        EntityScope entityType,
        OnDemandReason reason,
        String entityId,
        String locationKey,
        Map<String, Object> metadata
    ) {
        this.term = term;
        this.entityType = entityType;
        this.reason = reason;
        this.entityId = entityId;
        this.locationKey = locationKey;
        this.metadata = metadata == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metadata);
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

    public String getEntityId() {
        return entityId;
    }

    public String getLocationKey() {
        return locationKey;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    @Override
    public String toString() {
        return reason.value() + ":" + entityType.value() + ":" + term + "@" + locationKey;
    }
}
