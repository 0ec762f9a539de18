package com.crave.search.plan;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Objects;

public final class QueryPlan {
    private final QueryFormat format;
    private final List<FilterClause> restaurantFilters;
    private final List<FilterClause> connectionFilters;
    private final Ranking ranking;
    private final Diagnostics diagnostics;

    public QueryPlan(
        QueryFormat format,
        List<FilterClause> restaurantFilters,
        List<FilterClause> connectionFilters,
        Ranking ranking,
        Diagnostics diagnostics
    ) {
        this.format = format;
        this.restaurantFilters = List.copyOf(restaurantFilters);
        this.connectionFilters = List.copyOf(connectionFilters);
        this.ranking = ranking;
        this.diagnostics = diagnostics;
    }

    @JsonProperty("format")
    public QueryFormat getFormat() {
        return format;
    }

    @JsonProperty("restaurant_filters")
    public List<FilterClause> getRestaurantFilters() {
        return restaurantFilters;
    }

    @JsonProperty("connection_filters")
    public List<FilterClause> getConnectionFilters() {
        return connectionFilters;
    }

    @JsonProperty("ranking")
    public Ranking getRanking() {
        return ranking;
    }

    @JsonProperty("diagnostics")
    public Diagnostics getDiagnostics() {
        return diagnostics;
    }

    public boolean isSingleList() {
        return format == QueryFormat.SINGLE_LIST;
    }

    public FilterClause findRestaurantFilter(FilterKind kind) {
        return find(restaurantFilters, kind, null);
    }

    public FilterClause findRestaurantFilter(FilterKind kind, EntityScope type) {
        return find(restaurantFilters, kind, type);
    }

    public FilterClause findConnectionFilter(FilterKind kind, EntityScope type) {
        return find(connectionFilters, kind, type);
    }

    public boolean requestsOpenNow() {
        return findRestaurantFilter(FilterKind.OPEN_NOW) != null;
    }

    private static FilterClause find(List<FilterClause> clauses, FilterKind kind, EntityScope type) {
        for (FilterClause clause : clauses) {
            if (clause.getKind() == kind && (type == null || clause.getEntityType() == type)) {
                return clause;
            }
        }
        return null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof QueryPlan)) {
            return false;
        }
        QueryPlan that = (QueryPlan) o;
        return format == that.format
            && restaurantFilters.equals(that.restaurantFilters)
            && connectionFilters.equals(that.connectionFilters)
            && Objects.equals(ranking, that.ranking)
            && Objects.equals(diagnostics, that.diagnostics);
    }

    @Override
    public int hashCode() {
        return Objects.hash(format, restaurantFilters, connectionFilters, ranking, diagnostics);
    }

    public static final class Ranking {
        private final String foodOrder;
        private final String restaurantOrder;

        public Ranking(String foodOrder, String restaurantOrder) {
            this.foodOrder = foodOrder;
            this.restaurantOrder = restaurantOrder;
        }

        @JsonProperty("food_order")
        public String getFoodOrder() {
            return foodOrder;
        }

        @JsonProperty("restaurant_order")
        public String getRestaurantOrder() {
            return restaurantOrder;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Ranking)) {
                return false;
            }
            Ranking that = (Ranking) o;
            return Objects.equals(foodOrder, that.foodOrder) && Objects.equals(restaurantOrder, that.restaurantOrder);
        }

        @Override
        public int hashCode() {
            return Objects.hash(foodOrder, restaurantOrder);
        }
    }

    public static final class Diagnostics {
        private final List<String> missingEntities;
        private final List<String> notes;

        public Diagnostics(List<String> missingEntities, List<String> notes) {
            this.missingEntities = List.copyOf(missingEntities);
            this.notes = List.copyOf(notes);
        }

        @JsonProperty("missing_entities")
        public List<String> getMissingEntities() {
            return missingEntities;
        }

        @JsonProperty("notes")
        public List<String> getNotes() {
            return notes;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Diagnostics)) {
                return false;
            }
            Diagnostics that = (Diagnostics) o;
            return missingEntities.equals(that.missingEntities) && notes.equals(that.notes);
        }

        @Override
        public int hashCode() {
            return Objects.hash(missingEntities, notes);
        }
    }
}
