package com.crave.search.ondemand;

import com.fasterxml.jackson.annotation.JsonValue;

public enum OnDemandReason {
    LOW_RESULT("low_result"),
    UNRESOLVED("unresolved");

    private final String value;

    OnDemandReason(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static OnDemandReason fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (OnDemandReason reason : values()) {
            if (reason.value.equalsIgnoreCase(value.trim())) {
                return reason;
            }
        }
        return null;
    }
}
