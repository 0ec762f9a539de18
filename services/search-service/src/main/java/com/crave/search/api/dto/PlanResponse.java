package com.crave.search.api.dto;

import com.crave.search.plan.QueryPlan;
import com.fasterxml.jackson.annotation.JsonProperty;

public class PlanResponse {
    @JsonProperty("plan")
    private QueryPlan plan;

    @JsonProperty("sql_preview")
    private String sqlPreview;

    public PlanResponse() {
    }

    public PlanResponse(QueryPlan plan, String sqlPreview) {
        this.plan = plan;
        this.sqlPreview = sqlPreview;
    }

    public QueryPlan getPlan() {
        return plan;
    }

    public void setPlan(QueryPlan plan) {
        this.plan = plan;
    }

    public String getSqlPreview() {
        return sqlPreview;
    }

    public void setSqlPreview(String sqlPreview) {
        this.sqlPreview = sqlPreview;
    }
}
