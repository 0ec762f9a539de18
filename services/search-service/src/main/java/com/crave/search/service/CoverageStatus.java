package com.crave.search.service;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CoverageStatus {
    FULL("full"),
    PARTIAL("partial"),
    UNRESOLVED("unresolved");

    private final String value;

    CoverageStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Searches without entity targets are always full. With targets, zero results is unresolved and a
     * triggered backfill is partial.
     */
    public static CoverageStatus resolve(boolean hasTargets, long totalResults, boolean onDemandTriggered) {
        if (!hasTargets) {
            return FULL;
        }
        if (totalResults == 0) {
            return UNRESOLVED;
        }
        return onDemandTriggered ? PARTIAL : FULL;
    }
}
