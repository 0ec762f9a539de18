package com.crave.search.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;

public class EntityGroups {
    @JsonProperty("restaurants")
    private List<QueryEntity> restaurants = new ArrayList<>();

    @JsonProperty("food")
    private List<QueryEntity> food = new ArrayList<>();

    @JsonProperty("food_attributes")
    private List<QueryEntity> foodAttributes = new ArrayList<>();

    @JsonProperty("restaurant_attributes")
    private List<QueryEntity> restaurantAttributes = new ArrayList<>();

    public List<QueryEntity> getRestaurants() {
        return restaurants;
    }

    public void setRestaurants(List<QueryEntity> restaurants) {
        this.restaurants = restaurants;
    }

    public List<QueryEntity> getFood() {
        return food;
    }

    public void setFood(List<QueryEntity> food) {
        this.food = food;
    }

    public List<QueryEntity> getFoodAttributes() {
        return foodAttributes;
    }

    public void setFoodAttributes(List<QueryEntity> foodAttributes) {
        this.foodAttributes = foodAttributes;
    }

    public List<QueryEntity> getRestaurantAttributes() {
        return restaurantAttributes;
    }

    public void setRestaurantAttributes(List<QueryEntity> restaurantAttributes) {
        this.restaurantAttributes = restaurantAttributes;
    }

    @JsonIgnore
    public boolean hasAny() {
        return !isEmpty(restaurants) || !isEmpty(food) || !isEmpty(foodAttributes) || !isEmpty(restaurantAttributes);
    }

    public static boolean isEmpty(List<QueryEntity> entities) {
        return entities == null || entities.isEmpty();
    }
}
