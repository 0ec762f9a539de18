package com.crave.search.ondemand;

import com.crave.search.collection.CollectionArea;
import com.crave.search.collection.SortPlanEntry;
import java.util.List;

/**
 * A request that passed every admission gate and is now queued, handed to the worker pool.
 */
public record OnDemandJob(
    OnDemandRequest request,
    String normalizedTerm,
    CollectionArea area,
    List<SortPlanEntry> sortPlan,
    OnDemandMetadata metadata
) {
}
