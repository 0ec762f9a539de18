package com.crave.search.ondemand;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of an on-demand request. {@code COMPLETED -> PENDING} happens when the same key is seen again.
 * Stale {@code QUEUED} and {@code PROCESSING} rows are returned to {@code PENDING} in bulk by
 * {@link OnDemandRequestRepository#releaseStaleLeases}, outside this table.
 */
public enum OnDemandStatus {
    PENDING("pending"),
    QUEUED("queued"),
    PROCESSING("processing"),
    COMPLETED("completed");

    private final String value;

    OnDemandStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public Set<OnDemandStatus> nextStates() {
        return switch (this) {
            case PENDING -> EnumSet.of(QUEUED);
            case QUEUED -> EnumSet.of(PROCESSING);
            case PROCESSING -> EnumSet.of(COMPLETED, PENDING);
            case COMPLETED -> EnumSet.of(PENDING);
        };
    }

    public boolean canTransitionTo(OnDemandStatus next) {
        return next != null && nextStates().contains(next);
    }

    public static OnDemandStatus fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (OnDemandStatus status : values()) {
            if (status.value.equalsIgnoreCase(value.trim())) {
                return status;
            }
        }
        return null;
    }
}
