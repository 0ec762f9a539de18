package com.crave.search.execution;

import com.crave.search.api.dto.Coordinate;
import com.crave.search.plan.QueryPlan;
import com.crave.search.query.PageWindow;
import java.time.Instant;

/**
 * @param page          1-based page the caller asked for
 * @param dbWindow      window pushed into SQL; with open-now this is an over-fetch starting at 0
 * @param searchCenter  bounds center, else the user location; null disables nearest-location selection
 * @param referenceTime single "now" for every operating-hours evaluation in this execution
 */
public record ExecutionRequest(
    QueryPlan plan,
    int page,
    int pageSize,
    PageWindow dbWindow,
    int perRestaurantLimit,
    int topDishesLimit,
    boolean includeSqlPreview,
    Coordinate userLocation,
    Coordinate searchCenter,
    Instant referenceTime
) {
    public PageWindow pageWindow() {
        return PageWindow.forPage(page, pageSize);
    }
}
