package com.crave.search.collection;

import com.fasterxml.jackson.annotation.JsonProperty;

public class PriorityTarget {
    @JsonProperty("entity_id")
    private String entityId;

    @JsonProperty("entity_name")
    private String entityName;

    @JsonProperty("entity_type")
    private String entityType;

    @JsonProperty("score")
    private int score;

    @JsonProperty("factors")
    private Factors factors;

    @JsonProperty("is_new_entity")
    private boolean newEntity;

    public String getEntityId() {
        return entityId;
    }

    public void setEntityId(String entityId) {
        this.entityId = entityId;
    }

    public String getEntityName() {
        return entityName;
    }

    public void setEntityName(String entityName) {
        this.entityName = entityName;
    }

    public String getEntityType() {
        return entityType;
    }

    public void setEntityType(String entityType) {
        this.entityType = entityType;
    }

    public int getScore() {
        return score;
    }

    public void setScore(int score) {
        this.score = score;
    }

    public Factors getFactors() {
        return factors;
    }

    public void setFactors(Factors factors) {
        this.factors = factors;
    }

    public boolean isNewEntity() {
        return newEntity;
    }

    public void setNewEntity(boolean newEntity) {
        this.newEntity = newEntity;
    }

    public static class Factors {
        @JsonProperty("data_recency")
        private int dataRecency;

        @JsonProperty("data_quality")
        private int dataQuality;

        @JsonProperty("user_demand")
        private int userDemand;

        public Factors() {
        }

        public Factors(int dataRecency, int dataQuality, int userDemand) {
            this.dataRecency = dataRecency;
            this.dataQuality = dataQuality;
            this.userDemand = userDemand;
        }

        public int getDataRecency() {
            return dataRecency;
        }

        public void setDataRecency(int dataRecency) {
            this.dataRecency = dataRecency;
        }

        public int getDataQuality() {
            return dataQuality;
        }

        public void setDataQuality(int dataQuality) {
            this.dataQuality = dataQuality;
        }

        public int getUserDemand() {
            return userDemand;
        }

        public void setUserDemand(int userDemand) {
            this.userDemand = userDemand;
        }
    }
}
