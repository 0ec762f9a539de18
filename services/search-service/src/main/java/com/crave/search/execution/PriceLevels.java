package com.crave.search.execution;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

public final class PriceLevels {
    private static final List<String> SYMBOLS = List.of("Free", "$", "$$", "$$$", "$$$$");
    private static final List<String> DESCRIPTORS = List.of(
        "Free",
        "Budget friendly",
        "Moderate",
        "Expensive",
        "Very expensive"
    );

    private PriceLevels() {
    }

    public static String symbol(Integer level) {
        return level == null ? null : SYMBOLS.get(clamp(level));
    }

    public static String descriptor(Integer level) {
        return level == null ? null : DESCRIPTORS.get(clamp(level));
    }

    /**
     * Human price range from restaurant metadata: {@code googlePlaces.priceRange}, then {@code priceRange};
     * either a string or a {@code {min, max}} object.
     */
    public static String priceRangeText(JsonNode metadata) {
        if (metadata == null || !metadata.isObject()) {
            return null;
        }
        JsonNode googlePlaces = metadata.path("googlePlaces");
        JsonNode candidate = googlePlaces.isObject() ? googlePlaces.get("priceRange") : null;
        if (candidate == null && googlePlaces.isObject()) {
            candidate = googlePlaces.get("price_range");
        }
        if (candidate == null) {
            candidate = metadata.get("priceRange");
        }
        if (candidate == null || candidate.isNull()) {
            return null;
        }
        if (candidate.isTextual()) {
            String trimmed = candidate.asText().trim();
            return trimmed.isEmpty() ? null : trimmed;
        }
        if (!candidate.isObject()) {
            return null;
        }
        String min = number(candidate.get("min"));
        String max = number(candidate.get("max"));
        if (min != null && max != null) {
            return "$" + min + "-" + max;
        }
        if (max != null) {
            return "<$" + max;
        }
        if (min != null) {
            return "$" + min + "+";
        }
        for (String key : new String[] {"formattedText", "rawText", "text"}) {
            JsonNode text = candidate.get(key);
            if (text != null && text.isTextual() && !text.asText().isBlank()) {
                return text.asText().trim();
            }
        }
        return null;
    }

    private static String number(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        Double value = RowValues.toOptionalDouble(node.isNumber() ? node.numberValue() : node.asText());
        if (value == null) {
            return null;
        }
        return value == Math.rint(value) ? String.valueOf(value.longValue()) : String.valueOf(value);
    }

    private static int clamp(int level) {
        return Math.max(0, Math.min(SYMBOLS.size() - 1, level));
    }
}
