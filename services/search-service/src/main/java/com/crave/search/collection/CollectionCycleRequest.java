package com.crave.search.collection;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public class CollectionCycleRequest {
    @JsonProperty("area")
    private String area;

    @JsonProperty("targets")
    private List<PriorityTarget> targets;

    @JsonProperty("sort_plan")
    private List<SortPlanEntry> sortPlan;

    public String getArea() {
        return area;
    }

    public void setArea(String area) {
        this.area = area;
    }

    public List<PriorityTarget> getTargets() {
        return targets;
    }

    public void setTargets(List<PriorityTarget> targets) {
        this.targets = targets;
    }

    public List<SortPlanEntry> getSortPlan() {
        return sortPlan;
    }

    public void setSortPlan(List<SortPlanEntry> sortPlan) {
        this.sortPlan = sortPlan;
    }
}
