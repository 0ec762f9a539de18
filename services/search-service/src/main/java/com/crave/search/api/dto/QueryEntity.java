package com.crave.search.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;

/**
 * One resolved term from the interpretation step: its normalized name and the entity ids backing it.
 */
public class QueryEntity {
    @JsonProperty("normalized_name")
    private String normalizedName;

    @JsonProperty("entity_ids")
    private List<String> entityIds = new ArrayList<>();

    @JsonProperty("original_text")
    private String originalText;

    public QueryEntity() {
    }

    public QueryEntity(String normalizedName, List<String> entityIds) {
        this.normalizedName = normalizedName;
        this.entityIds = entityIds;
    }

    public String getNormalizedName() {
        return normalizedName;
    }

    public void setNormalizedName(String normalizedName) {
        this.normalizedName = normalizedName;
    }

    public List<String> getEntityIds() {
        return entityIds;
    }

    public void setEntityIds(List<String> entityIds) {
        this.entityIds = entityIds;
    }

    public String getOriginalText() {
        return originalText;
    }

    public void setOriginalText(String originalText) {
        this.originalText = originalText;
    }
}
