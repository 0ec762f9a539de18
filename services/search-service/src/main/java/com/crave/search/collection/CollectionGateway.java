package com.crave.search.collection;

import java.util.List;

/**
 * Client side of the collection subsystem that runs keyword searches against a collection area.
 */
public interface CollectionGateway {

    CollectionCycleResult executeKeywordSearchCycle(String area, List<PriorityTarget> targets, List<SortPlanEntry> sortPlan);

    QueueDepth getQueueDepth();

    List<String> configuredSorts();
}
