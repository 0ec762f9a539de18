package com.crave.search.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

public class MapBounds {
    @JsonProperty("north_east")
    private Coordinate northEast;

    @JsonProperty("south_west")
    private Coordinate southWest;

    public MapBounds() {
    }

    public MapBounds(Coordinate northEast, Coordinate southWest) {
        this.northEast = northEast;
        this.southWest = southWest;
    }

    public Coordinate getNorthEast() {
        return northEast;
    }

    public void setNorthEast(Coordinate northEast) {
        this.northEast = northEast;
    }

    public Coordinate getSouthWest() {
        return southWest;
    }

    public void setSouthWest(Coordinate southWest) {
        this.southWest = southWest;
    }

    @JsonIgnore
    public boolean isComplete() {
        return northEast != null && southWest != null && northEast.isFinite() && southWest.isFinite();
    }

    @JsonIgnore
    public Coordinate center() {
        if (!isComplete()) {
            return null;
        }
        return new Coordinate(
            (northEast.getLat() + southWest.getLat()) / 2,
            (northEast.getLng() + southWest.getLng()) / 2
        );
    }
}
