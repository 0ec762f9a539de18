package com.crave.search.hours;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * The three layouts stored hours arrive in.
 */
public enum ScheduleShape {
    DAY_MAP,
    ENTRY_LIST,
    UNIFORM_TEXT,
    UNSUPPORTED;

    public static ScheduleShape of(JsonNode hours) {
        if (hours == null) {
            return UNSUPPORTED;
        }
        if (hours.isObject()) {
            return DAY_MAP;
        }
        if (hours.isArray()) {
            return ENTRY_LIST;
        }
        if (hours.isTextual() && !hours.asText().isEmpty()) {
            return UNIFORM_TEXT;
        }
        return UNSUPPORTED;
    }
}
