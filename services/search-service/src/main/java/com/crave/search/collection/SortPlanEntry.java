package com.crave.search.collection;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One sort mode to run in a keyword cycle. Time filters apply to {@code top} and {@code relevance} only.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SortPlanEntry(
    @JsonProperty("sort") String sort,
    @JsonProperty("time_filter") String timeFilter,
    @JsonProperty("fallback_time_filter") String fallbackTimeFilter,
    @JsonProperty("min_results_for_fallback") Integer minResultsForFallback
) {
    public static SortPlanEntry of(String sort) {
        return new SortPlanEntry(sort, null, null, null);
    }
}
