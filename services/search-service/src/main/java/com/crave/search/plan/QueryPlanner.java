package com.crave.search.plan;

import com.crave.search.api.dto.EntityGroups;
import com.crave.search.api.dto.MapBounds;
import com.crave.search.api.dto.QueryEntity;
import com.crave.search.api.dto.SearchRequest;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Translates a structured search request into a {@link QueryPlan}. Performs no I/O; the evaluation instant
 * is supplied by the caller so identical inputs always yield equal plans.
 */
@Component
public class QueryPlanner {
    private static final Logger logger = LoggerFactory.getLogger(QueryPlanner.class);

    public static final String FOOD_ORDER = "food_quality_score DESC";
    public static final String CONTEXTUAL_RESTAURANT_ORDER = "contextual_food_quality DESC";

    static final String NOTE_NO_FOOD = "No food entities provided; results will not include contextual restaurant rankings.";
    static final String NOTE_BOUNDS = "Map bounds supplied; restaurants are limited to locations inside the viewport.";
    static final String NOTE_OPEN_NOW = "Open-now filter requested; requires restaurant hour metadata.";
    static final String NOTE_PRICE = "Price filter requested; ensure price metadata is available.";

    public QueryPlan buildQueryPlan(SearchRequest request, Instant evaluationTime) {
        EntityGroups entities = request.getEntities() == null ? new EntityGroups() : request.getEntities();
        boolean hasRestaurants = !EntityGroups.isEmpty(entities.getRestaurants());
        boolean hasFood = !EntityGroups.isEmpty(entities.getFood());
        boolean hasFoodAttributes = !EntityGroups.isEmpty(entities.getFoodAttributes());
        boolean hasRestaurantAttributes = !EntityGroups.isEmpty(entities.getRestaurantAttributes());
        List<Integer> priceLevels = normalizePriceLevels(request.getPriceLevels());

        QueryFormat format = hasRestaurants && !hasFood && !hasFoodAttributes && !hasRestaurantAttributes
            ? QueryFormat.SINGLE_LIST
            : QueryFormat.DUAL_LIST;

        List<FilterClause> restaurantFilters = buildRestaurantFilters(request, entities, priceLevels, evaluationTime);
        List<FilterClause> connectionFilters = buildConnectionFilters(request, entities);

        List<String> missing = new ArrayList<>();
        if (!hasRestaurants) {
            missing.add(EntityScope.RESTAURANT.value());
        }
        if (!hasFood) {
            missing.add(EntityScope.FOOD.value());
        }
        if (!hasFoodAttributes) {
            missing.add(EntityScope.FOOD_ATTRIBUTE.value());
        }
        if (!hasRestaurantAttributes) {
            missing.add(EntityScope.RESTAURANT_ATTRIBUTE.value());
        }

        List<String> notes = new ArrayList<>();
        if (!hasFood && !hasFoodAttributes) {
            notes.add(NOTE_NO_FOOD);
        }
        if (request.getBounds() != null) {
            notes.add(NOTE_BOUNDS);
        }
        if (request.isOpenNowRequested()) {
            notes.add(NOTE_OPEN_NOW);
        }
        if (!priceLevels.isEmpty()) {
            notes.add(NOTE_PRICE);
        }

        QueryPlan.Ranking ranking = new QueryPlan.Ranking(
            FOOD_ORDER,
            format == QueryFormat.SINGLE_LIST ? FOOD_ORDER : CONTEXTUAL_RESTAURANT_ORDER
        );

        QueryPlan plan = new QueryPlan(
            format,
            restaurantFilters,
            connectionFilters,
            ranking,
            new QueryPlan.Diagnostics(missing, notes)
        );
        if (logger.isDebugEnabled()) {
            logger.debug(
                "query plan built format={} restaurantFilters={} connectionFilters={}",
                format.value(),
                restaurantFilters.size(),
                connectionFilters.size()
            );
        }
        return plan;
    }

    /**
     * Integers 0-4 only, deduplicated and ascending.
     */
    public static List<Integer> normalizePriceLevels(List<Integer> levels) {
        if (levels == null || levels.isEmpty()) {
            return List.of();
        }
        Set<Integer> normalized = new TreeSet<>();
        for (Integer level : levels) {
            if (level != null && level >= 0 && level <= 4) {
                normalized.add(level);
            }
        }
        return List.copyOf(normalized);
    }

    /**
     * Ids in first-seen order, blanks dropped.
     */
    public static List<String> collectEntityIds(List<QueryEntity> entities) {
        if (entities == null || entities.isEmpty()) {
            return List.of();
        }
        Set<String> ids = new LinkedHashSet<>();
        for (QueryEntity entity : entities) {
            if (entity == null || entity.getEntityIds() == null) {
                continue;
            }
            for (String id : entity.getEntityIds()) {
                if (id != null && !id.isBlank()) {
                    ids.add(id.trim());
                }
            }
        }
        return List.copyOf(ids);
    }

    private List<FilterClause> buildRestaurantFilters(
        SearchRequest request,
        EntityGroups entities,
        List<Integer> priceLevels,
        Instant evaluationTime
    ) {
        List<FilterClause> filters = new ArrayList<>();
        if (!EntityGroups.isEmpty(entities.getRestaurants())) {
            filters.add(FilterClause.entities(
                FilterScope.RESTAURANT,
                EntityScope.RESTAURANT,
                collectEntityIds(entities.getRestaurants()),
                "Match explicit restaurant entities"
            ));
        }
        if (!EntityGroups.isEmpty(entities.getRestaurantAttributes())) {
            filters.add(FilterClause.entities(
                FilterScope.RESTAURANT,
                EntityScope.RESTAURANT_ATTRIBUTE,
                collectEntityIds(entities.getRestaurantAttributes()),
                "Filter by restaurant attributes"
            ));
        }
        MapBounds bounds = request.getBounds();
        if (bounds != null && bounds.isComplete()) {
            filters.add(FilterClause.bounds(bounds, describeBounds(bounds)));
        }
        if (request.isOpenNowRequested()) {
            filters.add(FilterClause.openNow(evaluationTime, "Filter restaurants open at " + evaluationTime));
        }
        if (!priceLevels.isEmpty()) {
            List<String> labels = new ArrayList<>();
            for (Integer level : priceLevels) {
                labels.add(String.valueOf(level));
            }
            filters.add(FilterClause.priceLevels(
                priceLevels,
                "Restrict to price levels (" + String.join(", ", labels) + ")"
            ));
        }
        return filters;
    }

    private List<FilterClause> buildConnectionFilters(SearchRequest request, EntityGroups entities) {
        List<FilterClause> filters = new ArrayList<>();
        List<String> foodIds = collectEntityIds(entities.getFood());
        if (!foodIds.isEmpty()) {
            filters.add(FilterClause.entities(FilterScope.CONNECTION, EntityScope.FOOD, foodIds, "Match food entities"));
        }

        if (!EntityGroups.isEmpty(entities.getFoodAttributes())) {
            List<String> attributeIds = collectEntityIds(entities.getFoodAttributes());
            boolean foodRequested = !EntityGroups.isEmpty(entities.getFood());
            // attributes never stand alone against a food group whose ids all failed to resolve
            if (!attributeIds.isEmpty() && (!foodIds.isEmpty() || !foodRequested)) {
                filters.add(FilterClause.entities(
                    FilterScope.CONNECTION,
                    EntityScope.FOOD_ATTRIBUTE,
                    attributeIds,
                    "Filter by food attributes"
                ));
            }
        }

        Double minimumVotes = request.getMinimumVotes();
        if (minimumVotes != null && Double.isFinite(minimumVotes)) {
            int threshold = (int) Math.floor(minimumVotes);
            if (threshold > 0) {
                filters.add(FilterClause.minimumVotes(threshold, "Require at least " + threshold + " votes"));
            }
        }
        return filters;
    }

    private static String describeBounds(MapBounds bounds) {
        return String.format(
            Locale.ROOT,
            "Restrict to map bounds (%.4f, %.4f) <-> (%.4f, %.4f)",
            bounds.getSouthWest().getLat(),
            bounds.getSouthWest().getLng(),
            bounds.getNorthEast().getLat(),
            bounds.getNorthEast().getLng()
        );
    }
}
