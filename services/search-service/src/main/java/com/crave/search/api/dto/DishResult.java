package com.crave.search.api.dto;

import com.crave.search.hours.OperatingStatus;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;

public class DishResult {
    @JsonProperty("connection_id")
    private String connectionId;

    @JsonProperty("food_id")
    private String foodId;

    @JsonProperty("food_name")
    private String foodName;

    @JsonProperty("food_aliases")
    private List<String> foodAliases = new ArrayList<>();

    @JsonProperty("restaurant_id")
    private String restaurantId;

    @JsonProperty("restaurant_name")
    private String restaurantName;

    @JsonProperty("restaurant_aliases")
    private List<String> restaurantAliases = new ArrayList<>();

    @JsonProperty("restaurant_location_id")
    private String restaurantLocationId;

    @JsonProperty("quality_score")
    private double qualityScore;

    @JsonProperty("display_score")
    private Double displayScore;

    @JsonProperty("display_percentile")
    private Double displayPercentile;

    @JsonProperty("coverage_key")
    private String coverageKey;

    @JsonProperty("activity_level")
    private String activityLevel;

    @JsonProperty("mention_count")
    private long mentionCount;

    @JsonProperty("total_upvotes")
    private long totalUpvotes;

    @JsonProperty("recent_mention_count")
    private long recentMentionCount;

    @JsonProperty("last_mentioned_at")
    private String lastMentionedAt;

    @JsonProperty("categories")
    private List<String> categories = new ArrayList<>();

    @JsonProperty("food_attributes")
    private List<String> foodAttributes = new ArrayList<>();

    @JsonProperty("restaurant_price_level")
    private Integer restaurantPriceLevel;

    @JsonProperty("restaurant_price_symbol")
    private String restaurantPriceSymbol;

    @JsonProperty("restaurant_distance_miles")
    private Double restaurantDistanceMiles;

    @JsonProperty("restaurant_operating_status")
    private OperatingStatus restaurantOperatingStatus;

    @JsonProperty("restaurant_display_score")
    private Double restaurantDisplayScore;

    @JsonProperty("restaurant_display_percentile")
    private Double restaurantDisplayPercentile;

    @JsonProperty("restaurant_latitude")
    private Double restaurantLatitude;

    @JsonProperty("restaurant_longitude")
    private Double restaurantLongitude;

    public String getConnectionId() {
        return connectionId;
    }

    public void setConnectionId(String connectionId) {
        this.connectionId = connectionId;
    }

    public String getFoodId() {
        return foodId;
    }

    public void setFoodId(String foodId) {
        this.foodId = foodId;
    }

    public String getFoodName() {
        return foodName;
    }

    public void setFoodName(String foodName) {
        this.foodName = foodName;
    }

    public List<String> getFoodAliases() {
        return foodAliases;
    }

    public void setFoodAliases(List<String> foodAliases) {
        this.foodAliases = foodAliases;
    }

    public String getRestaurantId() {
        return restaurantId;
    }

    public void setRestaurantId(String restaurantId) {
        this.restaurantId = restaurantId;
    }

    public String getRestaurantName() {
        return restaurantName;
    }

    public void setRestaurantName(String restaurantName) {
        this.restaurantName = restaurantName;
    }

    public List<String> getRestaurantAliases() {
        return restaurantAliases;
    }

    public void setRestaurantAliases(List<String> restaurantAliases) {
        this.restaurantAliases = restaurantAliases;
    }

    public String getRestaurantLocationId() {
        return restaurantLocationId;
    }

    public void setRestaurantLocationId(String restaurantLocationId) {
        this.restaurantLocationId = restaurantLocationId;
    }

    public double getQualityScore() {
        return qualityScore;
    }

    public void setQualityScore(double qualityScore) {
        this.qualityScore = qualityScore;
    }

    public Double getDisplayScore() {
        return displayScore;
    }

    public void setDisplayScore(Double displayScore) {
        this.displayScore = displayScore;
    }

    public Double getDisplayPercentile() {
        return displayPercentile;
    }

    public void setDisplayPercentile(Double displayPercentile) {
        this.displayPercentile = displayPercentile;
    }

    public String getCoverageKey() {
        return coverageKey;
    }

    public void setCoverageKey(String coverageKey) {
        this.coverageKey = coverageKey;
    }

    public String getActivityLevel() {
        return activityLevel;
    }

    public void setActivityLevel(String activityLevel) {
        this.activityLevel = activityLevel;
    }

    public long getMentionCount() {
        return mentionCount;
    }

    public void setMentionCount(long mentionCount) {
        this.mentionCount = mentionCount;
    }

    public long getTotalUpvotes() {
        return totalUpvotes;
    }

    public void setTotalUpvotes(long totalUpvotes) {
        this.totalUpvotes = totalUpvotes;
    }

    public long getRecentMentionCount() {
        return recentMentionCount;
    }

    public void setRecentMentionCount(long recentMentionCount) {
        this.recentMentionCount = recentMentionCount;
    }

    public String getLastMentionedAt() {
        return lastMentionedAt;
    }

    public void setLastMentionedAt(String lastMentionedAt) {
        this.lastMentionedAt = lastMentionedAt;
    }

    public List<String> getCategories() {
        return categories;
    }

    public void setCategories(List<String> categories) {
        this.categories = categories;
    }

    public List<String> getFoodAttributes() {
        return foodAttributes;
    }

    public void setFoodAttributes(List<String> foodAttributes) {
        this.foodAttributes = foodAttributes;
    }

    public Integer getRestaurantPriceLevel() {
        return restaurantPriceLevel;
    }

    public void setRestaurantPriceLevel(Integer restaurantPriceLevel) {
        this.restaurantPriceLevel = restaurantPriceLevel;
    }

    public String getRestaurantPriceSymbol() {
        return restaurantPriceSymbol;
    }

    public void setRestaurantPriceSymbol(String restaurantPriceSymbol) {
        this.restaurantPriceSymbol = restaurantPriceSymbol;
    }

    public Double getRestaurantDistanceMiles() {
        return restaurantDistanceMiles;
    }

    public void setRestaurantDistanceMiles(Double restaurantDistanceMiles) {
        this.restaurantDistanceMiles = restaurantDistanceMiles;
    }

    public OperatingStatus getRestaurantOperatingStatus() {
        return restaurantOperatingStatus;
    }

    public void setRestaurantOperatingStatus(OperatingStatus restaurantOperatingStatus) {
        this.restaurantOperatingStatus = restaurantOperatingStatus;
    }

    public Double getRestaurantDisplayScore() {
        return restaurantDisplayScore;
    }

    public void setRestaurantDisplayScore(Double restaurantDisplayScore) {
        this.restaurantDisplayScore = restaurantDisplayScore;
    }

    public Double getRestaurantDisplayPercentile() {
        return restaurantDisplayPercentile;
    }

    public void setRestaurantDisplayPercentile(Double restaurantDisplayPercentile) {
        this.restaurantDisplayPercentile = restaurantDisplayPercentile;
    }

    public Double getRestaurantLatitude() {
        return restaurantLatitude;
    }

    public void setRestaurantLatitude(Double restaurantLatitude) {
        this.restaurantLatitude = restaurantLatitude;
    }

    public Double getRestaurantLongitude() {
        return restaurantLongitude;
    }

    public void setRestaurantLongitude(Double restaurantLongitude) {
        this.restaurantLongitude = restaurantLongitude;
    }
}
