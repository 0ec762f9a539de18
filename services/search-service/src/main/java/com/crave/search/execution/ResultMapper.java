package com.crave.search.execution;

import com.crave.search.api.dto.Coordinate;
import com.crave.search.api.dto.DishResult;
import com.crave.search.api.dto.DishSnippet;
import com.crave.search.api.dto.LocationSummary;
import com.crave.search.api.dto.RestaurantResult;
import com.crave.search.hours.GeoDistance;
import com.crave.search.hours.HoursSource;
import com.crave.search.hours.OperatingHoursEvaluator;
import com.crave.search.hours.OperatingStatus;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Turns candidate rows into response objects. Operating status is evaluated once per restaurant through
 * {@link #buildContexts}; the per-row mappers reuse those contexts.
 */
@Component
public class ResultMapper {
    private final OperatingHoursEvaluator hoursEvaluator;
    private final ObjectMapper objectMapper;

    public ResultMapper(OperatingHoursEvaluator hoursEvaluator, ObjectMapper objectMapper) {
        this.hoursEvaluator = hoursEvaluator;
        this.objectMapper = objectMapper;
    }

    /**
     * Restaurant rows first, then restaurants seen only through dish rows.
     */
    public Map<String, RestaurantContext> buildContexts(
        List<Map<String, Object>> restaurantRows,
        List<Map<String, Object>> dishRows,
        Instant reference,
        Coordinate userLocation
    ) {
        Map<String, RestaurantContext> contexts = new LinkedHashMap<>();
        for (Map<String, Object> row : restaurantRows) {
            addContext(contexts, row, "price_level", reference, userLocation);
        }
        for (Map<String, Object> row : dishRows) {
            addContext(contexts, row, "restaurant_price_level", reference, userLocation);
        }
        return contexts;
    }

    public RestaurantResult toRestaurantResult(
        Map<String, Object> row,
        RestaurantContext context,
        Instant reference,
        Coordinate userLocation
    ) {
        Integer priceLevel = context != null && context.getPriceLevel() != null
            ? context.getPriceLevel()
            : RowValues.optionalInt(row, "price_level");
        Double latitude = RowValues.optionalDouble(row, "latitude");
        Double longitude = RowValues.optionalDouble(row, "longitude");
        OperatingStatus status = context != null ? context.getOperatingStatus() : evaluate(row, reference);
        Double distance = context != null && context.getDistanceMiles() != null
            ? context.getDistanceMiles()
            : distanceMiles(userLocation, latitude, longitude);
        JsonNode metadata = RowValues.json(objectMapper, row, "restaurant_metadata");

        LocationSummary displayLocation = new LocationSummary();
        displayLocation.setLocationId(RowValues.string(row, "location_id"));
        displayLocation.setGooglePlaceId(RowValues.string(row, "google_place_id"));
        displayLocation.setLatitude(latitude);
        displayLocation.setLongitude(longitude);
        displayLocation.setAddress(RowValues.string(row, "address"));
        displayLocation.setCity(RowValues.string(row, "city"));
        displayLocation.setRegion(RowValues.string(row, "region"));
        displayLocation.setCountry(RowValues.string(row, "country"));
        displayLocation.setPostalCode(RowValues.string(row, "postal_code"));
        displayLocation.setPhoneNumber(RowValues.string(row, "phone_number"));
        displayLocation.setWebsiteUrl(RowValues.string(row, "website_url"));
        displayLocation.setHours(RowValues.json(objectMapper, row, "hours"));
        displayLocation.setUtcOffsetMinutes(RowValues.optionalDouble(row, "utc_offset_minutes"));
        displayLocation.setTimeZone(RowValues.string(row, "time_zone"));
        displayLocation.setOperatingStatus(status);
        displayLocation.setPrimary(RowValues.bool(row, "is_primary"));
        displayLocation.setLastPolledAt(RowValues.isoInstant(row, "last_polled_at"));

        List<LocationSummary> locations = parseLocations(RowValues.json(objectMapper, row, "locations_json"), reference);
        if (locations.isEmpty()) {
            locations.add(displayLocation);
        }
        Integer locationCount = RowValues.optionalInt(row, "location_count");

        RestaurantResult result = new RestaurantResult();
        result.setRestaurantId(RowValues.string(row, "restaurant_id"));
        result.setRestaurantName(RowValues.string(row, "restaurant_name"));
        result.setRestaurantAliases(RowValues.stringList(row, "restaurant_aliases"));
        result.setRestaurantQualityScore(RowValues.optionalDouble(row, "restaurant_quality_score"));
        result.setDisplayScore(RowValues.optionalDouble(row, "display_score"));
        result.setDisplayPercentile(RowValues.optionalDouble(row, "display_percentile"));
        result.setCoverageKey(RowValues.string(row, "location_key"));
        result.setMentionCount(RowValues.longOrZero(row, "total_mentions"));
        result.setTotalUpvotes(RowValues.longOrZero(row, "total_upvotes"));
        result.setLatitude(latitude);
        result.setLongitude(longitude);
        result.setAddress(displayLocation.getAddress());
        result.setRestaurantLocationId(displayLocation.getLocationId());
        result.setPriceLevel(priceLevel);
        result.setPriceSymbol(PriceLevels.symbol(priceLevel));
        result.setPriceText(PriceLevels.descriptor(priceLevel));
        result.setPriceRange(PriceLevels.priceRangeText(metadata));
        result.setPriceLevelUpdatedAt(RowValues.isoInstant(row, "price_level_updated_at"));
        result.setOperatingStatus(status);
        result.setDistanceMiles(distance);
        result.setDisplayLocation(displayLocation);
        result.setLocations(locations);
        result.setLocationCount(locationCount == null ? locations.size() : locationCount);
        result.setTopFood(parseTopDishes(RowValues.json(objectMapper, row, "top_dishes")));
        result.setTotalDishCount((int) RowValues.longOrZero(row, "total_dish_count"));
        return result;
    }

    public DishResult toDishResult(Map<String, Object> row, RestaurantContext context, Instant reference) {
        Integer priceLevel = context != null && context.getPriceLevel() != null
            ? context.getPriceLevel()
            : RowValues.optionalInt(row, "restaurant_price_level");
        OperatingStatus status = context != null ? context.getOperatingStatus() : evaluate(row, reference);

        DishResult result = new DishResult();
        result.setConnectionId(RowValues.string(row, "connection_id"));
        result.setFoodId(RowValues.string(row, "food_id"));
        result.setFoodName(RowValues.string(row, "food_name"));
        result.setFoodAliases(RowValues.stringList(row, "food_aliases"));
        result.setRestaurantId(RowValues.string(row, "restaurant_id"));
        result.setRestaurantName(RowValues.string(row, "restaurant_name"));
        result.setRestaurantAliases(RowValues.stringList(row, "restaurant_aliases"));
        result.setRestaurantLocationId(RowValues.string(row, "location_id"));
        result.setQualityScore(RowValues.doubleOrZero(row, "food_quality_score"));
        result.setDisplayScore(RowValues.optionalDouble(row, "connection_display_score"));
        result.setDisplayPercentile(RowValues.optionalDouble(row, "connection_display_percentile"));
        result.setCoverageKey(RowValues.string(row, "coverage_key"));
        result.setActivityLevel(RowValues.string(row, "activity_level"));
        result.setMentionCount(RowValues.longOrZero(row, "mention_count"));
        result.setTotalUpvotes(RowValues.longOrZero(row, "total_upvotes"));
        result.setRecentMentionCount(RowValues.longOrZero(row, "recent_mention_count"));
        result.setLastMentionedAt(RowValues.isoInstant(row, "last_mentioned_at"));
        result.setCategories(RowValues.stringList(row, "categories"));
        result.setFoodAttributes(RowValues.stringList(row, "food_attributes"));
        result.setRestaurantPriceLevel(priceLevel);
        result.setRestaurantPriceSymbol(PriceLevels.symbol(priceLevel));
        result.setRestaurantDistanceMiles(context == null ? null : context.getDistanceMiles());
        result.setRestaurantOperatingStatus(status);
        result.setRestaurantDisplayScore(RowValues.optionalDouble(row, "restaurant_display_score"));
        result.setRestaurantDisplayPercentile(RowValues.optionalDouble(row, "restaurant_display_percentile"));
        result.setRestaurantLatitude(RowValues.optionalDouble(row, "latitude"));
        result.setRestaurantLongitude(RowValues.optionalDouble(row, "longitude"));
        return result;
    }

    /**
     * Entries missing a connection id, food id or food name are skipped.
     */
    List<DishSnippet> parseTopDishes(JsonNode node) {
        List<DishSnippet> snippets = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return snippets;
        }
        for (JsonNode entry : node) {
            String connectionId = text(entry, "connectionId");
            String foodId = text(entry, "foodId");
            String foodName = text(entry, "foodName");
            if (connectionId == null || foodId == null || foodName == null) {
                continue;
            }
            DishSnippet snippet = new DishSnippet();
            snippet.setConnectionId(connectionId);
            snippet.setFoodId(foodId);
            snippet.setFoodName(foodName);
            Double quality = RowValues.toOptionalDouble(scalar(entry.get("qualityScore")));
            snippet.setQualityScore(quality == null ? 0d : quality);
            snippet.setDisplayScore(RowValues.toOptionalDouble(scalar(entry.get("displayScore"))));
            snippet.setDisplayPercentile(RowValues.toOptionalDouble(scalar(entry.get("displayPercentile"))));
            String activity = text(entry, "activityLevel");
            snippet.setActivityLevel(activity == null ? "normal" : activity);
            snippets.add(snippet);
        }
        return snippets;
    }

    List<LocationSummary> parseLocations(JsonNode node, Instant reference) {
        List<LocationSummary> locations = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return locations;
        }
        for (JsonNode entry : node) {
            String locationId = firstText(entry, "locationId", "location_id");
            if (locationId == null) {
                continue;
            }
            JsonNode hours = entry.has("hours") ? entry.get("hours") : entry.get("hours_json");
            if (hours != null && !hours.isObject()) {
                hours = null;
            }
            Double offset = RowValues.toOptionalDouble(scalar(entry.get("utcOffsetMinutes")));
            String timeZone = firstText(entry, "timeZone", "time_zone");

            LocationSummary summary = new LocationSummary();
            summary.setLocationId(locationId);
            summary.setGooglePlaceId(firstText(entry, "googlePlaceId", "google_place_id"));
            summary.setLatitude(RowValues.toOptionalDouble(scalar(entry.get("latitude"))));
            summary.setLongitude(RowValues.toOptionalDouble(scalar(entry.get("longitude"))));
            summary.setAddress(text(entry, "address"));
            summary.setCity(text(entry, "city"));
            summary.setRegion(text(entry, "region"));
            summary.setCountry(text(entry, "country"));
            summary.setPostalCode(text(entry, "postalCode"));
            summary.setPhoneNumber(firstText(entry, "phoneNumber", "phone_number"));
            summary.setWebsiteUrl(firstText(entry, "websiteUrl", "website_url"));
            summary.setHours(hours);
            summary.setUtcOffsetMinutes(offset);
            summary.setTimeZone(timeZone);
            summary.setOperatingStatus(hoursEvaluator.evaluate(HoursSource.fromLocation(hours, offset, timeZone), reference));
            summary.setPrimary(entry.path("isPrimary").asBoolean(entry.path("is_primary").asBoolean(false)));
            summary.setLastPolledAt(text(entry, "lastPolledAt"));
            locations.add(summary);
        }
        return locations;
    }

    private void addContext(
        Map<String, RestaurantContext> contexts,
        Map<String, Object> row,
        String priceColumn,
        Instant reference,
        Coordinate userLocation
    ) {
        String restaurantId = RowValues.string(row, "restaurant_id");
        if (restaurantId == null || contexts.containsKey(restaurantId)) {
            return;
        }
        Integer priceLevel = RowValues.optionalInt(row, priceColumn);
        contexts.put(restaurantId, new RestaurantContext(
            RowValues.string(row, "location_id"),
            evaluate(row, reference),
            priceLevel,
            PriceLevels.symbol(priceLevel),
            distanceMiles(userLocation, RowValues.optionalDouble(row, "latitude"), RowValues.optionalDouble(row, "longitude"))
        ));
    }

    private OperatingStatus evaluate(Map<String, Object> row, Instant reference) {
        HoursSource source = HoursSource.resolve(
            RowValues.json(objectMapper, row, "hours"),
            row.get("utc_offset_minutes"),
            RowValues.string(row, "time_zone"),
            RowValues.json(objectMapper, row, "restaurant_metadata")
        );
        return hoursEvaluator.evaluate(source, reference);
    }

    private static Double distanceMiles(Coordinate userLocation, Double latitude, Double longitude) {
        if (userLocation == null || !userLocation.isFinite() || latitude == null || longitude == null) {
            return null;
        }
        return GeoDistance.miles(userLocation.getLat(), userLocation.getLng(), latitude, longitude);
    }

    private static Object scalar(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        return node.isNumber() ? node.numberValue() : node.asText();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isEmpty() ? null : text;
    }

    private static String firstText(JsonNode node, String primary, String fallback) {
        String value = text(node, primary);
        return value != null ? value : text(node, fallback);
    }
}
