package com.crave.search.api.dto;

import com.crave.search.plan.QueryFormat;
import com.crave.search.plan.QueryPlan;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;

public class SearchResponse {
    @JsonProperty("trace_id")
    private String traceId;

    @JsonProperty("request_id")
    private String requestId;

    @JsonProperty("format")
    private QueryFormat format;

    @JsonProperty("plan")
    private QueryPlan plan;

    @JsonProperty("food")
    private List<DishResult> food = new ArrayList<>();

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty("restaurants")
    private List<RestaurantResult> restaurants;

    @JsonProperty("sql_preview")
    private String sqlPreview;

    @JsonProperty("metadata")
    private Metadata metadata;

    public String getTraceId() {
        return traceId;
    }

    public void setTraceId(String traceId) {
        this.traceId = traceId;
    }

    public String getRequestId() {
        return requestId;
    }

    public void setRequestId(String requestId) {
        this.requestId = requestId;
    }

    public QueryFormat getFormat() {
        return format;
    }

    public void setFormat(QueryFormat format) {
        this.format = format;
    }

    public QueryPlan getPlan() {
        return plan;
    }

    public void setPlan(QueryPlan plan) {
        this.plan = plan;
    }

    public List<DishResult> getFood() {
        return food;
    }

    public void setFood(List<DishResult> food) {
        this.food = food;
    }

    public List<RestaurantResult> getRestaurants() {
        return restaurants;
    }

    public void setRestaurants(List<RestaurantResult> restaurants) {
        this.restaurants = restaurants;
    }

    public String getSqlPreview() {
        return sqlPreview;
    }

    public void setSqlPreview(String sqlPreview) {
        this.sqlPreview = sqlPreview;
    }

    public Metadata getMetadata() {
        return metadata;
    }

    public void setMetadata(Metadata metadata) {
        this.metadata = metadata;
    }

    public static class Metadata {
        @JsonProperty("total_food_results")
        private long totalFoodResults;

        @JsonProperty("total_restaurant_results")
        private long totalRestaurantResults;

        @JsonProperty("query_execution_time_ms")
        private long queryExecutionTimeMs;

        @JsonProperty("bounds_applied")
        private boolean boundsApplied;

        @JsonProperty("open_now_applied")
        private boolean openNowApplied;

        @JsonProperty("open_now_supported_restaurants")
        private int openNowSupportedRestaurants;

        @JsonProperty("open_now_unsupported_restaurants")
        private int openNowUnsupportedRestaurants;

        @JsonProperty("open_now_unsupported_restaurant_ids")
        private List<String> openNowUnsupportedRestaurantIds = new ArrayList<>();

        @JsonProperty("open_now_filtered_out")
        private int openNowFilteredOut;

        @JsonProperty("price_filter_applied")
        private boolean priceFilterApplied;

        @JsonProperty("minimum_votes_applied")
        private boolean minimumVotesApplied;

        @JsonProperty("page")
        private int page;

        @JsonProperty("page_size")
        private int pageSize;

        @JsonProperty("per_restaurant_limit")
        private int perRestaurantLimit;

        @JsonProperty("coverage_status")
        private String coverageStatus;

        @JsonProperty("on_demand_queued")
        private int onDemandQueued;

        @JsonInclude(JsonInclude.Include.NON_NULL)
        @JsonProperty("on_demand_eta_ms")
        private Long onDemandEtaMs;

        public long getTotalFoodResults() {
            return totalFoodResults;
        }

        public void setTotalFoodResults(long totalFoodResults) {
            this.totalFoodResults = totalFoodResults;
        }

        public long getTotalRestaurantResults() {
            return totalRestaurantResults;
        }

        public void setTotalRestaurantResults(long totalRestaurantResults) {
            this.totalRestaurantResults = totalRestaurantResults;
        }

        public long getQueryExecutionTimeMs() {
            return queryExecutionTimeMs;
        }

        public void setQueryExecutionTimeMs(long queryExecutionTimeMs) {
            this.queryExecutionTimeMs = queryExecutionTimeMs;
        }

        public boolean isBoundsApplied() {
            return boundsApplied;
        }

        public void setBoundsApplied(boolean boundsApplied) {
            this.boundsApplied = boundsApplied;
        }

        public boolean isOpenNowApplied() {
            return openNowApplied;
        }

        public void setOpenNowApplied(boolean openNowApplied) {
            this.openNowApplied = openNowApplied;
        }

        public int getOpenNowSupportedRestaurants() {
            return openNowSupportedRestaurants;
        }

        public void setOpenNowSupportedRestaurants(int openNowSupportedRestaurants) {
            this.openNowSupportedRestaurants = openNowSupportedRestaurants;
        }

        public int getOpenNowUnsupportedRestaurants() {
            return openNowUnsupportedRestaurants;
        }

        public void setOpenNowUnsupportedRestaurants(int openNowUnsupportedRestaurants) {
            this.openNowUnsupportedRestaurants = openNowUnsupportedRestaurants;
        }

        public List<String> getOpenNowUnsupportedRestaurantIds() {
            return openNowUnsupportedRestaurantIds;
        }

        public void setOpenNowUnsupportedRestaurantIds(List<String> openNowUnsupportedRestaurantIds) {
            this.openNowUnsupportedRestaurantIds = openNowUnsupportedRestaurantIds;
        }

        public int getOpenNowFilteredOut() {
            return openNowFilteredOut;
        }

        public void setOpenNowFilteredOut(int openNowFilteredOut) {
            this.openNowFilteredOut = openNowFilteredOut;
        }

        public boolean isPriceFilterApplied() {
            return priceFilterApplied;
        }

        public void setPriceFilterApplied(boolean priceFilterApplied) {
            this.priceFilterApplied = priceFilterApplied;
        }

        public boolean isMinimumVotesApplied() {
            return minimumVotesApplied;
        }

        public void setMinimumVotesApplied(boolean minimumVotesApplied) {
            this.minimumVotesApplied = minimumVotesApplied;
        }

        public int getPage() {
            return page;
        }

        public void setPage(int page) {
            this.page = page;
        }

        public int getPageSize() {
            return pageSize;
        }

        public void setPageSize(int pageSize) {
            this.pageSize = pageSize;
        }

        public int getPerRestaurantLimit() {
            return perRestaurantLimit;
        }

        public void setPerRestaurantLimit(int perRestaurantLimit) {
            this.perRestaurantLimit = perRestaurantLimit;
        }

        public String getCoverageStatus() {
            return coverageStatus;
        }

        public void setCoverageStatus(String coverageStatus) {
            this.coverageStatus = coverageStatus;
        }

        public int getOnDemandQueued() {
            return onDemandQueued;
        }

        public void setOnDemandQueued(int onDemandQueued) {
            this.onDemandQueued = onDemandQueued;
        }

        public Long getOnDemandEtaMs() {
            return onDemandEtaMs;
        }

        public void setOnDemandEtaMs(Long onDemandEtaMs) {
            this.onDemandEtaMs = onDemandEtaMs;
        }
    }
}
