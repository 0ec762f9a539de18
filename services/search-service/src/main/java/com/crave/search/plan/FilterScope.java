package com.crave.search.plan;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FilterScope {
    RESTAURANT("restaurant"),
    CONNECTION("connection");

    private final String value;

    FilterScope(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
