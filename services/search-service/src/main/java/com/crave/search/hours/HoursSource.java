package com.crave.search.hours;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Raw schedule inputs for one venue: the hours document plus whatever time-zone hints were stored
 * alongside it. Nothing is interpreted here beyond locating the hints.
 */
public final class HoursSource {
    private static final String[] ZONE_KEYS = {"timezone", "timeZone", "time_zone", "tz"};
    private static final String OFFSET_KEY = "utc_offset_minutes";

    private final JsonNode hours;
    private final String timeZone;
    private final Double utcOffsetMinutes;

    public HoursSource(JsonNode hours, String timeZone, Double utcOffsetMinutes) {
        this.hours = hours;
        this.timeZone = timeZone;
        this.utcOffsetMinutes = utcOffsetMinutes;
    }

    /**
     * Location columns ({@code hours}, {@code utc_offset_minutes}, {@code time_zone}). Returns null when
     * none of them carries anything.
     */
    public static HoursSource fromLocation(JsonNode hours, Object utcOffsetMinutes, String timeZone) {
        JsonNode usableHours = isPresent(hours) ? hours : null;
        String zone = timeZone == null || timeZone.isBlank() ? null : timeZone.trim();
        Double offset = toDouble(utcOffsetMinutes);
        if (usableHours == null && zone == null && offset == null) {
            return null;
        }
        return new HoursSource(usableHours, zone, offset);
    }

    public static HoursSource fromRestaurantMetadata(JsonNode metadata) {
        if (metadata == null || !metadata.isObject()) {
            return null;
        }
        JsonNode offsetNode = metadata.has(OFFSET_KEY) ? metadata.get(OFFSET_KEY) : metadata.get("utcOffsetMinutes");
        return fromLocation(metadata.get("hours"), offsetNode, firstText(metadata));
    }

    /**
     * Location data wins; the restaurant-level metadata document is the fallback.
     */
    public static HoursSource resolve(JsonNode hours, Object utcOffsetMinutes, String timeZone, JsonNode restaurantMetadata) {
        HoursSource fromLocation = fromLocation(hours, utcOffsetMinutes, timeZone);
        if (fromLocation != null) {
            return fromLocation;
        }
        return fromRestaurantMetadata(restaurantMetadata);
    }

    public JsonNode getHours() {
        return hours;
    }

    String resolveTimeZone() {
        if (timeZone != null) {
            return timeZone;
        }
        if (hours != null && hours.isObject()) {
            return firstText(hours);
        }
        return null;
    }

    Double resolveUtcOffsetMinutes() {
        if (utcOffsetMinutes != null) {
            return utcOffsetMinutes;
        }
        if (hours != null && hours.isObject()) {
            return toDouble(hours.get(OFFSET_KEY));
        }
        return null;
    }

    private static String firstText(JsonNode node) {
        for (String key : ZONE_KEYS) {
            JsonNode value = node.get(key);
            if (value != null && value.isTextual() && !value.asText().isBlank()) {
                return value.asText().trim();
            }
        }
        return null;
    }

    private static boolean isPresent(JsonNode node) {
        return node != null && !node.isNull() && !node.isMissingNode();
    }

    static Double toDouble(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof JsonNode) {
            JsonNode node = (JsonNode) value;
            if (node.isNumber()) {
                return finite(node.asDouble());
            }
            if (node.isTextual()) {
                return parse(node.asText());
            }
            return null;
        }
        if (value instanceof Number) {
            return finite(((Number) value).doubleValue());
        }
        return parse(value.toString());
    }

    private static Double parse(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return finite(Double.parseDouble(text.trim()));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Double finite(double value) {
        return Double.isFinite(value) ? value : null;
    }
}
