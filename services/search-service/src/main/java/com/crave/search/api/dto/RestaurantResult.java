package com.crave.search.api.dto;

import com.crave.search.hours.OperatingStatus;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;

public class RestaurantResult {
    @JsonProperty("restaurant_id")
    private String restaurantId;

    @JsonProperty("restaurant_name")
    private String restaurantName;

    @JsonProperty("restaurant_aliases")
    private List<String> restaurantAliases = new ArrayList<>();

    @JsonProperty("restaurant_quality_score")
    private Double restaurantQualityScore;

    @JsonProperty("display_score")
    private Double displayScore;

    @JsonProperty("display_percentile")
    private Double displayPercentile;

    @JsonProperty("coverage_key")
    private String coverageKey;

    @JsonProperty("mention_count")
    private long mentionCount;

    @JsonProperty("total_upvotes")
    private long totalUpvotes;

    @JsonProperty("latitude")
    private Double latitude;

    @JsonProperty("longitude")
    private Double longitude;

    @JsonProperty("address")
    private String address;

    @JsonProperty("restaurant_location_id")
    private String restaurantLocationId;

    @JsonProperty("price_level")
    private Integer priceLevel;

    @JsonProperty("price_symbol")
    private String priceSymbol;

    @JsonProperty("price_text")
    private String priceText;

    @JsonProperty("price_range")
    private String priceRange;

    @JsonProperty("price_level_updated_at")
    private String priceLevelUpdatedAt;

    @JsonProperty("operating_status")
    private OperatingStatus operatingStatus;

    @JsonProperty("distance_miles")
    private Double distanceMiles;

    @JsonProperty("display_location")
    private LocationSummary displayLocation;

    @JsonProperty("locations")
    private List<LocationSummary> locations = new ArrayList<>();

    @JsonProperty("location_count")
    private int locationCount;

    @JsonProperty("top_food")
    private List<DishSnippet> topFood = new ArrayList<>();

    @JsonProperty("total_dish_count")
    private int totalDishCount;

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

    public Double getRestaurantQualityScore() {
        return restaurantQualityScore;
    }

    public void setRestaurantQualityScore(Double restaurantQualityScore) {
        this.restaurantQualityScore = restaurantQualityScore;
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

    public Double getLatitude() {
        return latitude;
    }

    public void setLatitude(Double latitude) {
        this.latitude = latitude;
    }

    public Double getLongitude() {
        return longitude;
    }

    public void setLongitude(Double longitude) {
        this.longitude = longitude;
    }

    public String getAddress() {
        return address;
    }

    public void setAddress(String address) {
        this.address = address;
    }

    public String getRestaurantLocationId() {
        return restaurantLocationId;
    }

    public void setRestaurantLocationId(String restaurantLocationId) {
        this.restaurantLocationId = restaurantLocationId;
    }

    public Integer getPriceLevel() {
        return priceLevel;
    }

    public void setPriceLevel(Integer priceLevel) {
        this.priceLevel = priceLevel;
    }

    public String getPriceSymbol() {
        return priceSymbol;
    }

    public void setPriceSymbol(String priceSymbol) {
        this.priceSymbol = priceSymbol;
    }

    public String getPriceText() {
        return priceText;
    }

    public void setPriceText(String priceText) {
        this.priceText = priceText;
    }

    public String getPriceRange() {
        return priceRange;
    }

    public void setPriceRange(String priceRange) {
        this.priceRange = priceRange;
    }

    public String getPriceLevelUpdatedAt() {
        return priceLevelUpdatedAt;
    }

    public void setPriceLevelUpdatedAt(String priceLevelUpdatedAt) {
        this.priceLevelUpdatedAt = priceLevelUpdatedAt;
    }

    public OperatingStatus getOperatingStatus() {
        return operatingStatus;
    }

    public void setOperatingStatus(OperatingStatus operatingStatus) {
        this.operatingStatus = operatingStatus;
    }

    public Double getDistanceMiles() {
        return distanceMiles;
    }

    public void setDistanceMiles(Double distanceMiles) {
        this.distanceMiles = distanceMiles;
    }

    public LocationSummary getDisplayLocation() {
        return displayLocation;
    }

    public void setDisplayLocation(LocationSummary displayLocation) {
        this.displayLocation = displayLocation;
    }

    public List<LocationSummary> getLocations() {
        return locations;
    }

    public void setLocations(List<LocationSummary> locations) {
        this.locations = locations;
    }

    public int getLocationCount() {
        return locationCount;
    }

    public void setLocationCount(int locationCount) {
        this.locationCount = locationCount;
    }

    public List<DishSnippet> getTopFood() {
        return topFood;
    }

    public void setTopFood(List<DishSnippet> topFood) {
        this.topFood = topFood;
    }

    public int getTotalDishCount() {
        return totalDishCount;
    }

    public void setTotalDishCount(int totalDishCount) {
        this.totalDishCount = totalDishCount;
    }
}
