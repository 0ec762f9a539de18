package com.crave.search.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public class DishSnippet {
    @JsonProperty("connection_id")
    private String connectionId;

    @JsonProperty("food_id")
    private String foodId;

    @JsonProperty("food_name")
    private String foodName;

    @JsonProperty("quality_score")
    private Double qualityScore;

    @JsonProperty("display_score")
    private Double displayScore;

    @JsonProperty("display_percentile")
    private Double displayPercentile;

    @JsonProperty("activity_level")
    private String activityLevel;

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

    public Double getQualityScore() {
        return qualityScore;
    }

    public void setQualityScore(Double qualityScore) {
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

    public String getActivityLevel() {
        return activityLevel;
    }

    public void setActivityLevel(String activityLevel) {
        this.activityLevel = activityLevel;
    }
}
