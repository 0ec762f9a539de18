package com.crave.search.service;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "search")
public class SearchProperties {
    private int defaultPageSize = 25;
    private int maxPageSize = 100;
    private int resultLimit = 100;
    private int perRestaurantLimit = 3;
    private int openNowFetchMultiplier = 4;
    private int topDishesLimit = 3;
    private Integer onDemandMinResults;
    private boolean alwaysIncludeSqlPreview;
    private boolean searchLogEnabled = true;

    public int getDefaultPageSize() {
        return defaultPageSize;
    }

    public void setDefaultPageSize(int defaultPageSize) {
        this.defaultPageSize = defaultPageSize;
    }

    public int getMaxPageSize() {
        return maxPageSize;
    }

    public void setMaxPageSize(int maxPageSize) {
        this.maxPageSize = maxPageSize;
    }

    public int getResultLimit() {
        return resultLimit;
    }

    public void setResultLimit(int resultLimit) {
        this.resultLimit = resultLimit;
    }

    public int getPerRestaurantLimit() {
        return perRestaurantLimit;
    }

    public void setPerRestaurantLimit(int perRestaurantLimit) {
        this.perRestaurantLimit = perRestaurantLimit;
    }

    public int getOpenNowFetchMultiplier() {
        return openNowFetchMultiplier;
    }

    public void setOpenNowFetchMultiplier(int openNowFetchMultiplier) {
        this.openNowFetchMultiplier = openNowFetchMultiplier;
    }

    /** Clamped to 1-10. */
    public int effectiveOpenNowFetchMultiplier() {
        return Math.min(10, Math.max(1, openNowFetchMultiplier));
    }

    public int getTopDishesLimit() {
        return topDishesLimit;
    }

    public void setTopDishesLimit(int topDishesLimit) {
        this.topDishesLimit = topDishesLimit;
    }

    public Integer getOnDemandMinResults() {
        return onDemandMinResults;
    }

    public void setOnDemandMinResults(Integer onDemandMinResults) {
        this.onDemandMinResults = onDemandMinResults;
    }

    public int effectiveOnDemandMinResults() {
        return onDemandMinResults == null ? defaultPageSize : onDemandMinResults;
    }

    public boolean isAlwaysIncludeSqlPreview() {
        return alwaysIncludeSqlPreview;
    }

    public void setAlwaysIncludeSqlPreview(boolean alwaysIncludeSqlPreview) {
        this.alwaysIncludeSqlPreview = alwaysIncludeSqlPreview;
    }

    public boolean isSearchLogEnabled() {
        return searchLogEnabled;
    }

    public void setSearchLogEnabled(boolean searchLogEnabled) {
        this.searchLogEnabled = searchLogEnabled;
    }
}
