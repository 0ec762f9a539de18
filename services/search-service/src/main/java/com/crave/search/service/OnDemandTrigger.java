package com.crave.search.service;

import com.crave.search.api.dto.Coordinate;
import com.crave.search.api.dto.EntityGroups;
import com.crave.search.api.dto.MapBounds;
import com.crave.search.api.dto.QueryEntity;
import com.crave.search.api.dto.SearchRequest;
import com.crave.search.ondemand.EnqueueResult;
import com.crave.search.ondemand.OnDemandAdmissionController;
import com.crave.search.ondemand.OnDemandProperties;
import com.crave.search.ondemand.OnDemandReason;
import com.crave.search.ondemand.OnDemandRequestInput;
import com.crave.search.ondemand.OnDemandRequestService;
import com.crave.search.plan.EntityScope;
import com.crave.search.plan.QueryPlan;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Records low-result searches as on-demand requests and asks the admission controller to dispatch them.
 * Never fails the search that triggered it.
 */
@Component
public class OnDemandTrigger {
    private static final Logger logger = LoggerFactory.getLogger(OnDemandTrigger.class);

    private final OnDemandRequestService requestService;
    private final OnDemandAdmissionController admissionController;
    private final OnDemandProperties properties;

    public OnDemandTrigger(
        OnDemandRequestService requestService,
        OnDemandAdmissionController admissionController,
        OnDemandProperties properties
    ) {
        this.requestService = requestService;
        this.admissionController = admissionController;
        this.properties = properties;
    }

    public Outcome trigger(
        SearchRequest request,
        QueryPlan plan,
        long restaurantCount,
        long foodCount,
        String locationKey
    ) {
        if (!properties.isEnabled()) {
            return Outcome.NOT_TRIGGERED;
        }
        List<OnDemandRequestInput> inputs = buildLowResultInputs(request.getEntities(), locationKey);
        if (inputs.isEmpty()) {
            return Outcome.NOT_TRIGGERED;
        }
        try {
            List<OnDemandRequestInput> recorded = requestService.recordRequests(
                inputs,
                buildContext(request, plan, restaurantCount, foodCount)
            );
            List<EnqueueResult> results = admissionController.enqueueRequests(recorded);
            int queued = 0;
            Long etaMs = null;
            for (EnqueueResult result : results) {
                if (result.isQueued()) {
                    queued++;
                    if (result.getEtaMs() != null) {
                        etaMs = etaMs == null ? result.getEtaMs() : Math.max(etaMs, result.getEtaMs());
                    }
                }
            }
            logger.debug(
                "on_demand_triggered inputs={} queued={} location_key={}",
                recorded.size(),
                queued,
                locationKey
            );
            return new Outcome(true, queued, etaMs);
        } catch (RuntimeException e) {
            logger.warn("on_demand_trigger_failed location_key={} error={}", locationKey, e.getMessage());
            return new Outcome(true, 0, null);
        }
    }

    /**
     * One input per requested entity, food first. The term prefers the normalized name, then the raw text,
     * then the entity ID.
     */
    static List<OnDemandRequestInput> buildLowResultInputs(EntityGroups entities, String locationKey) {
        List<OnDemandRequestInput> inputs = new ArrayList<>();
        if (entities == null) {
            return inputs;
        }
        Set<String> seen = new HashSet<>();
        addInputs(inputs, seen, entities.getFood(), EntityScope.FOOD, locationKey);
        addInputs(inputs, seen, entities.getFoodAttributes(), EntityScope.FOOD_ATTRIBUTE, locationKey);
        addInputs(inputs, seen, entities.getRestaurants(), EntityScope.RESTAURANT, locationKey);
        addInputs(inputs, seen, entities.getRestaurantAttributes(), EntityScope.RESTAURANT_ATTRIBUTE, locationKey);
        return inputs;
    }

    private static void addInputs(
        List<OnDemandRequestInput> inputs,
        Set<String> seen,
        List<QueryEntity> group,
        EntityScope type,
        String locationKey
    ) {
        if (group == null) {
            return;
        }
        for (QueryEntity entity : group) {
            if (entity == null) {
                continue;
            }
            String entityId = firstId(entity.getEntityIds());
            String term = firstNonBlank(entity.getNormalizedName(), entity.getOriginalText(), entityId);
            if (term == null) {
                continue;
            }
            String dedupeKey = type.value() + ":" + (entityId != null ? entityId : term).toLowerCase(Locale.ROOT);
            if (!seen.add(dedupeKey)) {
                continue;
            }
            Map<String, Object> metadata = new LinkedHashMap<>();
            if (entity.getOriginalText() != null && !entity.getOriginalText().isBlank()) {
                metadata.put("originalText", entity.getOriginalText());
            }
            inputs.add(new OnDemandRequestInput(term, type, OnDemandReason.LOW_RESULT, entityId, locationKey, metadata));
        }
    }

    static Map<String, Object> buildContext(SearchRequest request, QueryPlan plan, long restaurantCount, long foodCount) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("source", OnDemandReason.LOW_RESULT.value());
        context.put("restaurantCount", restaurantCount);
        context.put("foodCount", foodCount);
        context.put("planFormat", plan.getFormat().value());
        MapBounds bounds = request.getBounds();
        if (bounds != null && bounds.isComplete()) {
            Map<String, Object> boundsContext = new LinkedHashMap<>();
            boundsContext.put("northEast", point(bounds.getNorthEast()));
            boundsContext.put("southWest", point(bounds.getSouthWest()));
            context.put("bounds", boundsContext);
        }
        context.put("openNow", request.isOpenNowRequested());
        Coordinate location = request.getUserLocation() != null && request.getUserLocation().isFinite()
            ? request.getUserLocation()
            : bounds != null && bounds.isComplete() ? bounds.center() : null;
        if (location != null) {
            context.put("location", point(location));
        }
        return context;
    }

    private static Map<String, Object> point(Coordinate coordinate) {
        Map<String, Object> point = new LinkedHashMap<>();
        point.put("lat", coordinate.getLat());
        point.put("lng", coordinate.getLng());
        return point;
    }

    private static String firstId(List<String> ids) {
        if (ids == null) {
            return null;
        }
        for (String id : ids) {
            if (id != null && !id.isBlank()) {
                return id.trim();
            }
        }
        return null;
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }

    public record Outcome(boolean triggered, int queued, Long etaMs) {
        static final Outcome NOT_TRIGGERED = new Outcome(false, 0, null);
    }
}
