package com.crave.search.ondemand;

import com.fasterxml.jackson.annotation.JsonValue;

public enum OnDemandOutcome {
    SUCCESS("success"),
    NO_RESULTS("no_results"),
    ERROR("error"),
    DEFERRED("deferred"),
    NO_ACTIVE_AREA("no_active_area");

    private final String value;

    OnDemandOutcome(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static OnDemandOutcome fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (OnDemandOutcome outcome : values()) {
            if (outcome.value.equalsIgnoreCase(value.trim())) {
                return outcome;
            }
        }
        return null;
    }
}
