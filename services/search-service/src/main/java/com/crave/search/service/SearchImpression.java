package com.crave.search.service;

import com.crave.search.plan.EntityScope;

public record SearchImpression(String entityId, EntityScope entityType, String locationKey, String queryText) {
}
