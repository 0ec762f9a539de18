package com.crave.search.query;

import com.crave.search.api.dto.Coordinate;
import com.crave.search.api.dto.MapBounds;
import com.crave.search.plan.EntityScope;
import com.crave.search.plan.FilterClause;
import com.crave.search.plan.FilterKind;
import com.crave.search.plan.QueryPlan;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Compiles a {@link QueryPlan} into the restaurant-centric and dish-centric PostgreSQL statements.
 * Every user-supplied value travels as a bind parameter.
 */
@Component
public class SearchQueryBuilder {
    public static final int DEFAULT_TOP_DISHES_LIMIT = 3;

    private static final String FILTERED_RESTAURANTS_SELECT =
        "filtered_restaurants AS (\n"
            + "  SELECT r.entity_id, r.name, r.aliases, r.location_key, r.restaurant_quality_score,\n"
            + "         r.restaurant_attributes, r.restaurant_metadata, r.price_level, r.price_level_updated_at\n"
            + "  FROM core_entities r\n"
            + "  WHERE ";

    private static final String LOCATION_COLUMNS =
        "rl.location_id, rl.restaurant_id, rl.google_place_id, rl.latitude, rl.longitude, rl.address, rl.city,\n"
            + "         rl.region, rl.country, rl.postal_code, rl.phone_number, rl.website_url, rl.hours,\n"
            + "         rl.utc_offset_minutes, rl.time_zone, rl.is_primary, rl.last_polled_at, rl.created_at, rl.updated_at";

    private static final String LOCATION_COMPLETE =
        "rl.latitude IS NOT NULL AND rl.longitude IS NOT NULL AND rl.google_place_id IS NOT NULL AND rl.address IS NOT NULL";

    private static final String RESTAURANT_VOTE_TOTALS =
        "restaurant_vote_totals AS (\n"
            + "  SELECT c.restaurant_id, SUM(c.total_upvotes) AS total_upvotes, SUM(c.mention_count) AS total_mentions\n"
            + "  FROM core_connections c\n"
            + "  JOIN filtered_restaurants fr ON fr.entity_id = c.restaurant_id\n"
            + "  GROUP BY c.restaurant_id\n"
            + ")";

    private static final String LOCATION_AGGREGATES =
        "location_aggregates AS (\n"
            + "  SELECT rl.restaurant_id, COUNT(*) AS location_count,\n"
            + "    json_agg(jsonb_build_object(\n"
            + "      'locationId', rl.location_id, 'googlePlaceId', rl.google_place_id,\n"
            + "      'latitude', rl.latitude, 'longitude', rl.longitude, 'address', rl.address,\n"
            + "      'city', rl.city, 'region', rl.region, 'country', rl.country, 'postalCode', rl.postal_code,\n"
            + "      'phoneNumber', rl.phone_number, 'websiteUrl', rl.website_url, 'hours', rl.hours,\n"
            + "      'utcOffsetMinutes', rl.utc_offset_minutes, 'timeZone', rl.time_zone, 'isPrimary', rl.is_primary,\n"
            + "      'lastPolledAt', rl.last_polled_at, 'createdAt', rl.created_at, 'updatedAt', rl.updated_at\n"
            + "    ) ORDER BY rl.updated_at DESC, rl.location_id ASC) AS locations_json\n"
            + "  FROM core_restaurant_locations rl\n"
            + "  JOIN filtered_restaurants fr ON fr.entity_id = rl.restaurant_id\n"
            + "  WHERE " + LOCATION_COMPLETE + "\n"
            + "  GROUP BY rl.restaurant_id\n"
            + ")";

    private static final String RESTAURANT_RANK_JOIN =
        "  LEFT JOIN core_display_rank_scores drr\n"
            + "    ON drr.subject_type = 'restaurant' AND drr.subject_id = fr.entity_id AND drr.location_key = fr.location_key\n";

    public CompiledQuery buildRestaurantQuery(QueryPlan plan, PageWindow window, Coordinate searchCenter, int topDishesLimit) {
        ParsedFilters filters = ParsedFilters.from(plan);
        int dishLimit = topDishesLimit > 0 ? topDishesLimit : DEFAULT_TOP_DISHES_LIMIT;

        SqlFragment restaurantWhere = restaurantConditions(filters);

        SqlFragment minimumVotesWhere = filters.minimumVotes == null
            ? SqlFragment.EMPTY
            : SqlFragment.of("  WHERE COALESCE(rvt.total_upvotes, 0) >= ?\n", filters.minimumVotes);

        SqlFragment sharedCtes = SqlFragment.builder()
            .append("WITH\n")
            .append(filteredRestaurants(restaurantWhere))
            .append(",\n")
            .append(filteredLocations(filters.bounds))
            .append(",\n")
            .append(selectedLocations(searchCenter))
            .append(",\n")
            .append(RESTAURANT_VOTE_TOTALS)
            .build();

        SqlFragment rankedRestaurants = SqlFragment.builder()
            .append("ranked_restaurants AS (\n")
            .append("  SELECT fr.entity_id AS restaurant_id, fr.name AS restaurant_name, fr.aliases AS restaurant_aliases,\n")
            .append("         fr.restaurant_quality_score, fr.location_key, fr.restaurant_metadata,\n")
            .append("         fr.price_level, fr.price_level_updated_at,\n")
            .append("         COALESCE(drr.rank_score_display, 0) AS display_score,\n")
            .append("         COALESCE(drr.rank_percentile, 0) AS display_percentile,\n")
            .append("         COALESCE(drr.rank_percentile, fr.restaurant_quality_score / 100) AS rank_value,\n")
            .append("         COALESCE(rvt.total_upvotes, 0) AS total_upvotes,\n")
            .append("         COALESCE(rvt.total_mentions, 0) AS total_mentions,\n")
            .append("         sl.location_id, sl.google_place_id, sl.latitude, sl.longitude, sl.address, sl.city,\n")
            .append("         sl.region, sl.country, sl.postal_code, sl.phone_number, sl.website_url, sl.hours,\n")
            .append("         sl.utc_offset_minutes, sl.time_zone, sl.is_primary, sl.last_polled_at,\n")
            .append("         sl.created_at AS location_created_at, sl.updated_at AS location_updated_at,\n")
            .append("         la.locations_json, la.location_count\n")
            .append("  FROM filtered_restaurants fr\n")
            .append("  JOIN selected_locations sl ON sl.restaurant_id = fr.entity_id\n")
            .append("  LEFT JOIN restaurant_vote_totals rvt ON rvt.restaurant_id = fr.entity_id\n")
            .append(RESTAURANT_RANK_JOIN)
            .append("  LEFT JOIN location_aggregates la ON la.restaurant_id = fr.entity_id\n")
            .append(minimumVotesWhere)
            .append("  ORDER BY COALESCE(drr.rank_percentile, fr.restaurant_quality_score / 100) DESC NULLS LAST,\n")
            .append("           COALESCE(rvt.total_upvotes, 0) DESC,\n")
            .append("           COALESCE(rvt.total_mentions, 0) DESC,\n")
            .append("           fr.entity_id ASC\n")
            .append("  OFFSET ").param(window.getSkip())
            .append(" LIMIT ").param(window.getTake())
            .append("\n)")
            .build();

        SqlFragment data = SqlFragment.builder()
            .append(sharedCtes)
            .append(",\n")
            .append(LOCATION_AGGREGATES)
            .append(",\n")
            .append(rankedRestaurants)
            .append("\nSELECT rr.*,\n")
            .append("  COALESCE(td.top_dishes, '[]'::json) AS top_dishes,\n")
            .append("  COALESCE(td.total_dish_count, 0)::int AS total_dish_count\n")
            .append("FROM ranked_restaurants rr\n")
            .append("LEFT JOIN LATERAL (\n")
            .append("  SELECT json_agg(json_build_object(\n")
            .append("      'connectionId', sub.connection_id, 'foodId', sub.food_id, 'foodName', sub.food_name,\n")
            .append("      'qualityScore', sub.food_quality_score, 'displayScore', sub.display_score,\n")
            .append("      'displayPercentile', sub.display_percentile, 'activityLevel', sub.activity_level\n")
            .append("    ) ORDER BY sub.rn) FILTER (WHERE sub.rn <= ").param(dishLimit).append(") AS top_dishes,\n")
            .append("    COUNT(*)::int AS total_dish_count\n")
            .append("  FROM (\n")
            .append("    SELECT c.connection_id, c.food_id, f.name AS food_name, c.food_quality_score,\n")
            .append("           drc.rank_score_display AS display_score, drc.rank_percentile AS display_percentile,\n")
            .append("           c.activity_level,\n")
            .append("           ROW_NUMBER() OVER (ORDER BY COALESCE(drc.rank_percentile, c.food_quality_score / 100) DESC,\n")
            .append("                              c.total_upvotes DESC, c.connection_id ASC) AS rn\n")
            .append("    FROM core_connections c\n")
            .append("    JOIN core_entities f ON f.entity_id = c.food_id\n")
            .append("    LEFT JOIN core_display_rank_scores drc\n")
            .append("      ON drc.subject_type = 'connection' AND drc.subject_id = c.connection_id\n")
            .append("      AND drc.location_key = rr.location_key\n")
            .append("    WHERE c.restaurant_id = rr.restaurant_id\n")
            .append("  ) sub\n")
            .append(") td ON true\n")
            .append("ORDER BY rr.rank_value DESC NULLS LAST,\n")
            .append("         rr.total_upvotes DESC, rr.total_mentions DESC, rr.restaurant_id ASC")
            .build();

        SqlFragment count = SqlFragment.builder()
            .append(sharedCtes)
            .append("\nSELECT COUNT(DISTINCT fr.entity_id)::bigint AS total_restaurants\n")
            .append("FROM filtered_restaurants fr\n")
            .append("JOIN selected_locations sl ON sl.restaurant_id = fr.entity_id\n")
            .append("LEFT JOIN restaurant_vote_totals rvt ON rvt.restaurant_id = fr.entity_id\n")
            .append(minimumVotesWhere)
            .build();

        return new CompiledQuery(
            data,
            count,
            SqlPreviewRenderer.render(data),
            new AppliedFilters(filters.bounds != null, !filters.priceLevels.isEmpty(), filters.minimumVotes != null)
        );
    }

    public CompiledQuery buildDishQuery(QueryPlan plan, PageWindow window, Coordinate searchCenter) {
        ParsedFilters filters = ParsedFilters.from(plan);

        List<SqlFragment> connectionClauses = new ArrayList<>();
        if (filters.foodIds != null) {
            connectionClauses.add(SqlFragment.builder()
                .append(uuidMembership("c.food_id", filters.foodIds))
                .append(" OR ")
                .append(uuidOverlap("c.categories", filters.foodIds))
                .build());
        }
        if (filters.foodAttributeIds != null) {
            connectionClauses.add(uuidOverlap("c.food_attributes", filters.foodAttributeIds));
        }
        if (filters.minimumVotes != null) {
            connectionClauses.add(SqlFragment.of("c.total_upvotes >= ?", filters.minimumVotes));
            connectionClauses.add(SqlFragment.of("rvt.total_upvotes >= ?", filters.minimumVotes));
        }

        SqlFragment filteredConnections = SqlFragment.builder()
            .append("filtered_connections AS (\n")
            .append("  SELECT c.connection_id, c.restaurant_id, c.food_id, c.categories, c.food_attributes,\n")
            .append("         c.mention_count, c.total_upvotes, c.recent_mention_count, c.last_mentioned_at,\n")
            .append("         c.activity_level, c.food_quality_score,\n")
            .append("         drc.rank_score_display AS connection_display_score,\n")
            .append("         drc.rank_percentile AS connection_display_percentile,\n")
            .append("         f.name AS food_name, f.aliases AS food_aliases, fr.location_key AS coverage_key,\n")
            .append("         fr.entity_id AS restaurant_entity_id, fr.name AS restaurant_name,\n")
            .append("         fr.aliases AS restaurant_aliases, fr.restaurant_metadata,\n")
            .append("         drr.rank_score_display AS restaurant_display_score,\n")
            .append("         drr.rank_percentile AS restaurant_display_percentile,\n")
            .append("         fr.price_level AS restaurant_price_level,\n")
            .append("         fr.price_level_updated_at AS restaurant_price_level_updated_at,\n")
            .append("         sl.location_id, sl.google_place_id, sl.latitude, sl.longitude, sl.address, sl.city,\n")
            .append("         sl.hours, sl.utc_offset_minutes, sl.time_zone\n")
            .append("  FROM core_connections c\n")
            .append("  JOIN filtered_restaurants fr ON fr.entity_id = c.restaurant_id\n")
            .append("  JOIN selected_locations sl ON sl.restaurant_id = fr.entity_id\n")
            .append("  JOIN restaurant_vote_totals rvt ON rvt.restaurant_id = fr.entity_id\n")
            .append(RESTAURANT_RANK_JOIN)
            .append("  LEFT JOIN core_display_rank_scores drc\n")
            .append("    ON drc.subject_type = 'connection' AND drc.subject_id = c.connection_id AND drc.location_key = fr.location_key\n")
            .append("  JOIN core_entities f ON f.entity_id = c.food_id\n")
            .append("  WHERE ").append(SqlFragment.and(connectionClauses))
            .append("\n)")
            .build();

        SqlFragment withClause = SqlFragment.builder()
            .append("WITH\n")
            .append(filteredRestaurants(restaurantConditions(filters)))
            .append(",\n")
            .append(filteredLocations(filters.bounds))
            .append(",\n")
            .append(selectedLocations(searchCenter))
            .append(",\n")
            .append(RESTAURANT_VOTE_TOTALS)
            .append(",\n")
            .append(filteredConnections)
            .build();

        String direction = resolveDirection(plan.getRanking() == null ? null : plan.getRanking().getFoodOrder());
        SqlFragment data = SqlFragment.builder()
            .append(withClause)
            .append("\nSELECT *\n")
            .append("FROM filtered_connections fc\n")
            .append("ORDER BY COALESCE(fc.connection_display_percentile, fc.food_quality_score / 100) ")
            .append(direction)
            .append(", fc.total_upvotes ").append(direction)
            .append(", fc.mention_count ").append(direction)
            .append(", fc.connection_id ASC\n")
            .append("OFFSET ").param(window.getSkip())
            .append(" LIMIT ").param(window.getTake())
            .build();

        SqlFragment count = SqlFragment.builder()
            .append(withClause)
            .append("\nSELECT COUNT(*)::bigint AS total_connections,\n")
            .append("       COUNT(DISTINCT fc.restaurant_id)::bigint AS total_restaurants\n")
            .append("FROM filtered_connections fc")
            .build();

        return new CompiledQuery(
            data,
            count,
            SqlPreviewRenderer.render(data),
            new AppliedFilters(filters.bounds != null, !filters.priceLevels.isEmpty(), filters.minimumVotes != null)
        );
    }

    private static SqlFragment restaurantConditions(ParsedFilters filters) {
        List<SqlFragment> clauses = new ArrayList<>();
        clauses.add(SqlFragment.raw("r.type = 'restaurant'"));
        if (filters.restaurantIds != null) {
            clauses.add(uuidMembership("r.entity_id", filters.restaurantIds));
        }
        if (filters.restaurantAttributeIds != null) {
            clauses.add(uuidOverlap("r.restaurant_attributes", filters.restaurantAttributeIds));
        }
        if (!filters.priceLevels.isEmpty()) {
            clauses.add(numberMembership("r.price_level", filters.priceLevels));
        }
        return SqlFragment.and(clauses);
    }

    static String resolveDirection(String order) {
        String normalized = order == null ? "" : order.toLowerCase(Locale.ROOT);
        return normalized.contains("asc") ? "ASC" : "DESC";
    }

    /**
     * An empty id list matches nothing.
     */
    public static SqlFragment uuidMembership(String column, List<String> ids) {
        if (ids.isEmpty()) {
            return SqlFragment.FALSE;
        }
        return SqlFragment.builder().append(column).append(" = ANY(").append(uuidArray(ids)).append(")").build();
    }

    static SqlFragment uuidOverlap(String column, List<String> ids) {
        if (ids.isEmpty()) {
            return SqlFragment.FALSE;
        }
        return SqlFragment.builder().append(column).append(" && ").append(uuidArray(ids)).build();
    }

    /**
     * An empty numeric list leaves the column unconstrained.
     */
    static SqlFragment numberMembership(String column, List<Integer> values) {
        if (values.isEmpty()) {
            return SqlFragment.TRUE;
        }
        SqlFragment.Builder builder = SqlFragment.builder().append(column).append(" = ANY(ARRAY[");
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                builder.append(", ");
            }
            builder.param(values.get(i));
        }
        return builder.append("]::smallint[])").build();
    }

    private static SqlFragment uuidArray(List<String> ids) {
        SqlFragment.Builder builder = SqlFragment.builder().append("ARRAY[");
        for (int i = 0; i < ids.size(); i++) {
            if (i > 0) {
                builder.append(", ");
            }
            builder.param(ids.get(i)).append("::uuid");
        }
        return builder.append("]::uuid[]").build();
    }

    private static SqlFragment filteredRestaurants(SqlFragment where) {
        return SqlFragment.builder()
            .append(FILTERED_RESTAURANTS_SELECT)
            .append(where)
            .append("\n)")
            .build();
    }

    private static SqlFragment filteredLocations(MapBounds bounds) {
        List<SqlFragment> clauses = new ArrayList<>();
        if (bounds != null) {
            clauses.add(SqlFragment.of(
                "rl.latitude BETWEEN ? AND ?",
                bounds.getSouthWest().getLat(),
                bounds.getNorthEast().getLat()
            ));
            clauses.add(SqlFragment.of(
                "rl.longitude BETWEEN ? AND ?",
                bounds.getSouthWest().getLng(),
                bounds.getNorthEast().getLng()
            ));
        }
        clauses.add(SqlFragment.raw(LOCATION_COMPLETE));
        return SqlFragment.builder()
            .append("filtered_locations AS (\n")
            .append("  SELECT ").append(LOCATION_COLUMNS).append("\n")
            .append("  FROM core_restaurant_locations rl\n")
            .append("  JOIN filtered_restaurants fr ON fr.entity_id = rl.restaurant_id\n")
            .append("  WHERE ").append(SqlFragment.and(clauses))
            .append("\n)")
            .build();
    }

    private static SqlFragment selectedLocations(Coordinate searchCenter) {
        SqlFragment.Builder builder = SqlFragment.builder()
            .append("selected_locations AS (\n")
            .append("  SELECT DISTINCT ON (fl.restaurant_id) fl.*\n")
            .append("  FROM filtered_locations fl\n")
            .append("  ORDER BY fl.restaurant_id");
        if (searchCenter != null && searchCenter.isFinite()) {
            builder.append(", (POWER(fl.latitude - ").param(searchCenter.getLat())
                .append(", 2) + POWER(fl.longitude - ").param(searchCenter.getLng())
                .append(", 2)) ASC");
        }
        return builder
            .append(", fl.updated_at DESC, fl.location_id ASC\n")
            .append(")")
            .build();
    }

    static final class ParsedFilters {
        final List<String> restaurantIds;
        final List<String> restaurantAttributeIds;
        final List<String> foodIds;
        final List<String> foodAttributeIds;
        final MapBounds bounds;
        final List<Integer> priceLevels;
        final Integer minimumVotes;

        private ParsedFilters(
            List<String> restaurantIds,
            List<String> restaurantAttributeIds,
            List<String> foodIds,
            List<String> foodAttributeIds,
            MapBounds bounds,
            List<Integer> priceLevels,
            Integer minimumVotes
        ) {
            this.restaurantIds = restaurantIds;
            this.restaurantAttributeIds = restaurantAttributeIds;
            this.foodIds = foodIds;
            this.foodAttributeIds = foodAttributeIds;
            this.bounds = bounds;
            this.priceLevels = priceLevels;
            this.minimumVotes = minimumVotes;
        }

        static ParsedFilters from(QueryPlan plan) {
            MapBounds bounds = null;
            List<Integer> priceLevels = List.of();
            for (FilterClause clause : plan.getRestaurantFilters()) {
                if (bounds == null && clause.is(FilterKind.BOUNDS) && clause.getBounds() != null
                    && clause.getBounds().isComplete()) {
                    bounds = clause.getBounds();
                }
                if (priceLevels.isEmpty() && clause.is(FilterKind.PRICE_LEVEL) && clause.getPriceLevels() != null) {
                    priceLevels = clause.getPriceLevels();
                }
            }
            Integer minimumVotes = null;
            for (FilterClause clause : plan.getConnectionFilters()) {
                if (clause.is(FilterKind.MINIMUM_VOTES) && clause.getMinimumVotes() != null
                    && clause.getMinimumVotes() > 0) {
                    minimumVotes = clause.getMinimumVotes();
                    break;
                }
            }
            return new ParsedFilters(
                ids(plan.getRestaurantFilters(), EntityScope.RESTAURANT),
                ids(plan.getRestaurantFilters(), EntityScope.RESTAURANT_ATTRIBUTE),
                ids(plan.getConnectionFilters(), EntityScope.FOOD),
                ids(plan.getConnectionFilters(), EntityScope.FOOD_ATTRIBUTE),
                bounds,
                priceLevels,
                minimumVotes
            );
        }

        /**
         * Null when the plan has no clause of this type; an empty list when a clause exists but resolved no ids.
         */
        private static List<String> ids(List<FilterClause> clauses, EntityScope type) {
            Set<String> ids = null;
            for (FilterClause clause : clauses) {
                if (clause.is(FilterKind.ENTITIES, type)) {
                    if (ids == null) {
                        ids = new LinkedHashSet<>();
                    }
                    ids.addAll(clause.getEntityIds());
                }
            }
            return ids == null ? null : List.copyOf(ids);
        }
    }
}
