package com.crave.search.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;

public class RestaurantStatusRequest {
    @JsonProperty("restaurant_ids")
    private List<String> restaurantIds = new ArrayList<>();

    @JsonProperty("user_location")
    private Coordinate userLocation;

    public List<String> getRestaurantIds() {
        return restaurantIds;
    }

    public void setRestaurantIds(List<String> restaurantIds) {
        this.restaurantIds = restaurantIds;
    }

    public Coordinate getUserLocation() {
        return userLocation;
    }

    public void setUserLocation(Coordinate userLocation) {
        this.userLocation = userLocation;
    }
}
