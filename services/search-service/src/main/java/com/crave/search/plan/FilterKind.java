package com.crave.search.plan;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FilterKind {
    ENTITIES("entities"),
    BOUNDS("bounds"),
    OPEN_NOW("open_now"),
    PRICE_LEVEL("price_level"),
    MINIMUM_VOTES("minimum_votes");

    private final String value;

    FilterKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
