package com.crave.search.execution;

import com.crave.search.hours.OperatingStatus;

/**
 * Per-restaurant facts derived once per execution and shared by every row of that restaurant.
 */
public final class RestaurantContext {
    private final String locationId;
    private final OperatingStatus operatingStatus;
    private final Integer priceLevel;
    private final String priceSymbol;
    private final Double distanceMiles;

    public RestaurantContext(
        String locationId,
        OperatingStatus operatingStatus,
        Integer priceLevel,
        String priceSymbol,
        Double distanceMiles
    ) {
        this.locationId = locationId;
        this.operatingStatus = operatingStatus;
        this.priceLevel = priceLevel;
        this.priceSymbol = priceSymbol;
        this.distanceMiles = distanceMiles;
    }

    public String getLocationId() {
        return locationId;
    }

    public OperatingStatus getOperatingStatus() {
        return operatingStatus;
    }

    public Integer getPriceLevel() {
        return priceLevel;
    }

    public String getPriceSymbol() {
        return priceSymbol;
    }

    public Double getDistanceMiles() {
        return distanceMiles;
    }
}
