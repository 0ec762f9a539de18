package com.crave.search.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public class SearchRequest {
    @JsonProperty("entities")
    private EntityGroups entities;

    @JsonProperty("bounds")
    private MapBounds bounds;

    @JsonProperty("open_now")
    private Boolean openNow;

    @JsonProperty("price_levels")
    private List<Integer> priceLevels;

    @JsonProperty("minimum_votes")
    private Double minimumVotes;

    @JsonProperty("user_location")
    private Coordinate userLocation;

    @JsonProperty("pagination")
    private Pagination pagination;

    @JsonProperty("include_sql_preview")
    private Boolean includeSqlPreview;

    @JsonProperty("source_query")
    private String sourceQuery;

    public EntityGroups getEntities() {
        return entities;
    }

    public void setEntities(EntityGroups entities) {
        this.entities = entities;
    }

    public MapBounds getBounds() {
        return bounds;
    }

    public void setBounds(MapBounds bounds) {
        this.bounds = bounds;
    }

    public Boolean getOpenNow() {
        return openNow;
    }

    public void setOpenNow(Boolean openNow) {
        this.openNow = openNow;
    }

    public boolean isOpenNowRequested() {
        return Boolean.TRUE.equals(openNow);
    }

    public List<Integer> getPriceLevels() {
        return priceLevels;
    }

    public void setPriceLevels(List<Integer> priceLevels) {
        this.priceLevels = priceLevels;
    }

    public Double getMinimumVotes() {
        return minimumVotes;
    }

    public void setMinimumVotes(Double minimumVotes) {
        this.minimumVotes = minimumVotes;
    }

    public Coordinate getUserLocation() {
        return userLocation;
    }

    public void setUserLocation(Coordinate userLocation) {
        this.userLocation = userLocation;
    }

    public Pagination getPagination() {
        return pagination;
    }

    public void setPagination(Pagination pagination) {
        this.pagination = pagination;
    }

    public Boolean getIncludeSqlPreview() {
        return includeSqlPreview;
    }

    public void setIncludeSqlPreview(Boolean includeSqlPreview) {
        this.includeSqlPreview = includeSqlPreview;
    }

    public String getSourceQuery() {
        return sourceQuery;
    }

    public void setSourceQuery(String sourceQuery) {
        this.sourceQuery = sourceQuery;
    }
}
