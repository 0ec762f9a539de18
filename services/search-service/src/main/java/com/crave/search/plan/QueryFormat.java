package com.crave.search.plan;

import com.fasterxml.jackson.annotation.JsonValue;

public enum QueryFormat {
    SINGLE_LIST("single_list"),
    DUAL_LIST("dual_list");

    private final String value;

    QueryFormat(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
