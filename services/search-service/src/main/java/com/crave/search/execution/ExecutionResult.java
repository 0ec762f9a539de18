package com.crave.search.execution;

import com.crave.search.api.dto.DishResult;
import com.crave.search.api.dto.RestaurantResult;
import java.util.List;

public class ExecutionResult {
    private List<RestaurantResult> restaurants = List.of();
    private List<DishResult> dishes = List.of();
    private long totalRestaurantCount;
    private long totalDishCount;
    private boolean boundsApplied;
    private boolean openNowApplied;
    private int openNowSupportedRestaurants;
    private int openNowUnsupportedRestaurants;
    private List<String> openNowUnsupportedRestaurantIds = List.of();
    private int openNowFilteredOut;
    private boolean priceFilterApplied;
    private boolean minimumVotesApplied;
    private String sqlPreview;

    public List<RestaurantResult> getRestaurants() {
        return restaurants;
    }

    public void setRestaurants(List<RestaurantResult> restaurants) {
        this.restaurants = restaurants;
    }

    public List<DishResult> getDishes() {
        return dishes;
    }

    public void setDishes(List<DishResult> dishes) {
        this.dishes = dishes;
    }

    public long getTotalRestaurantCount() {
        return totalRestaurantCount;
    }

    public void setTotalRestaurantCount(long totalRestaurantCount) {
        this.totalRestaurantCount = totalRestaurantCount;
    }

    public long getTotalDishCount() {
        return totalDishCount;
    }

    public void setTotalDishCount(long totalDishCount) {
        this.totalDishCount = totalDishCount;
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

    public String getSqlPreview() {
        return sqlPreview;
    }

    public void setSqlPreview(String sqlPreview) {
        this.sqlPreview = sqlPreview;
    }
}
