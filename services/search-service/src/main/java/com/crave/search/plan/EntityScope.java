package com.crave.search.plan;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EntityScope {
    RESTAURANT("restaurant"),
    FOOD("food"),
    FOOD_ATTRIBUTE("food_attribute"),
    RESTAURANT_ATTRIBUTE("restaurant_attribute");

    private final String value;

    EntityScope(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static EntityScope fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        for (EntityScope scope : values()) {
            if (scope.value.equalsIgnoreCase(raw.trim())) {
                return scope;
            }
        }
        return null;
    }
}
