package com.crave.search.plan;

import com.crave.search.api.dto.MapBounds;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable constraint produced by {@link QueryPlanner}. Entity clauses carry ids; the other kinds carry a
 * single typed payload and an empty id list.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class FilterClause {
    private final FilterScope scope;
    private final FilterKind kind;
    private final EntityScope entityType;
    private final List<String> entityIds;
    private final String description;
    private final MapBounds bounds;
    private final List<Integer> priceLevels;
    private final Integer minimumVotes;
    private final Instant openAt;

    private FilterClause(
        FilterScope scope,
        FilterKind kind,
        EntityScope entityType,
        List<String> entityIds,
        String description,
        MapBounds bounds,
        List<Integer> priceLevels,
        Integer minimumVotes,
        Instant openAt
    ) {
        this.scope = scope;
        this.kind = kind;
        this.entityType = entityType;
        this.entityIds = entityIds == null ? List.of() : List.copyOf(entityIds);
        this.description = description;
        this.bounds = bounds;
        this.priceLevels = priceLevels == null ? null : List.copyOf(priceLevels);
        this.minimumVotes = minimumVotes;
        this.openAt = openAt;
    }

    public static FilterClause entities(FilterScope scope, EntityScope entityType, List<String> ids, String description) {
        return new FilterClause(scope, FilterKind.ENTITIES, entityType, ids, description, null, null, null, null);
    }

    public static FilterClause bounds(MapBounds bounds, String description) {
        return new FilterClause(
            FilterScope.RESTAURANT, FilterKind.BOUNDS, EntityScope.RESTAURANT, null, description, bounds, null, null, null
        );
    }

    public static FilterClause openNow(Instant openAt, String description) {
        return new FilterClause(
            FilterScope.RESTAURANT, FilterKind.OPEN_NOW, EntityScope.RESTAURANT, null, description, null, null, null, openAt
        );
    }

    public static FilterClause priceLevels(List<Integer> levels, String description) {
        return new FilterClause(
            FilterScope.RESTAURANT, FilterKind.PRICE_LEVEL, EntityScope.RESTAURANT, null, description, null, levels, null, null
        );
    }

    public static FilterClause minimumVotes(int minimumVotes, String description) {
        return new FilterClause(
            FilterScope.CONNECTION, FilterKind.MINIMUM_VOTES, EntityScope.FOOD, null, description, null, null, minimumVotes, null
        );
    }

    @JsonProperty("scope")
    public FilterScope getScope() {
        return scope;
    }

    @JsonProperty("kind")
    public FilterKind getKind() {
        return kind;
    }

    @JsonProperty("entity_type")
    public EntityScope getEntityType() {
        return entityType;
    }

    @JsonProperty("entity_ids")
    public List<String> getEntityIds() {
        return Collections.unmodifiableList(entityIds);
    }

    @JsonProperty("description")
    public String getDescription() {
        return description;
    }

    @JsonProperty("bounds")
    public MapBounds getBounds() {
        return bounds;
    }

    @JsonProperty("price_levels")
    public List<Integer> getPriceLevels() {
        return priceLevels;
    }

    @JsonProperty("minimum_votes")
    public Integer getMinimumVotes() {
        return minimumVotes;
    }

    @JsonProperty("open_at")
    public Instant getOpenAt() {
        return openAt;
    }

    public boolean is(FilterKind candidate) {
        return kind == candidate;
    }

    public boolean is(FilterKind candidate, EntityScope type) {
        return kind == candidate && entityType == type;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FilterClause)) {
            return false;
        }
        FilterClause that = (FilterClause) o;
        return scope == that.scope
            && kind == that.kind
            && entityType == that.entityType
            && entityIds.equals(that.entityIds)
            && Objects.equals(description, that.description)
            && sameBounds(bounds, that.bounds)
            && Objects.equals(priceLevels, that.priceLevels)
            && Objects.equals(minimumVotes, that.minimumVotes)
            && Objects.equals(openAt, that.openAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(scope, kind, entityType, entityIds, description, priceLevels, minimumVotes, openAt);
    }

    private static boolean sameBounds(MapBounds left, MapBounds right) {
        if (left == right) {
            return true;
        }
        if (left == null || right == null || !left.isComplete() || !right.isComplete()) {
            return false;
        }
        return left.getNorthEast().getLat().equals(right.getNorthEast().getLat())
            && left.getNorthEast().getLng().equals(right.getNorthEast().getLng())
            && left.getSouthWest().getLat().equals(right.getSouthWest().getLat())
            && left.getSouthWest().getLng().equals(right.getSouthWest().getLng());
    }
}
