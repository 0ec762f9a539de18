package com.crave.search.api.dto;

import com.crave.search.hours.OperatingStatus;
import com.fasterxml.jackson.annotation.JsonProperty;

public class RestaurantStatusPreview {
    @JsonProperty("restaurant_id")
    private String restaurantId;

    @JsonProperty("name")
    private String name;

    @JsonProperty("location_id")
    private String locationId;

    @JsonProperty("operating_status")
    private OperatingStatus operatingStatus;

    @JsonProperty("distance_miles")
    private Double distanceMiles;

    @JsonProperty("locality")
    private String locality;

    public String getRestaurantId() {
        return restaurantId;
    }

    public void setRestaurantId(String restaurantId) {
        this.restaurantId = restaurantId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getLocationId() {
        return locationId;
    }

    public void setLocationId(String locationId) {
        this.locationId = locationId;
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

    public String getLocality() {
        return locality;
    }

    public void setLocality(String locality) {
        this.locality = locality;
    }
}
