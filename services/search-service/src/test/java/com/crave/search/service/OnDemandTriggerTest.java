package com.crave.search.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

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
import com.crave.search.plan.QueryPlanner;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class OnDemandTriggerTest {

    @Mock
    private OnDemandRequestService requestService;

    @Mock
    private OnDemandAdmissionController admissionController;

    @Test
    void buildsOneLowResultInputPerEntityFoodFirst() {
        EntityGroups entities = new EntityGroups();
        QueryEntity birria = new QueryEntity("birria tacos", List.of("food-1"));
        birria.setOriginalText("Birria Tacos");
        entities.setFood(List.of(birria, new QueryEntity("birria", List.of("food-1"))));
        entities.setRestaurants(List.of(new QueryEntity(null, List.of("rest-1"))));
        entities.setRestaurantAttributes(List.of(new QueryEntity("  ", List.of())));

        List<OnDemandRequestInput> inputs = OnDemandTrigger.buildLowResultInputs(entities, "austin");

        assertThat(inputs).extracting(OnDemandRequestInput::toString).containsExactly(
            "low_result:food:birria tacos@austin",
            "low_result:restaurant:rest-1@austin"
        );
        assertThat(inputs.get(0).getEntityId()).isEqualTo("food-1");
        assertThat(inputs.get(0).getReason()).isEqualTo(OnDemandReason.LOW_RESULT);
        assertThat(inputs.get(0).getMetadata()).containsEntry("originalText", "Birria Tacos");
        assertThat(inputs.get(1).getEntityType()).isEqualTo(EntityScope.RESTAURANT);
    }

    @Test
    void contextCarriesCountsBoundsAndLocation() {
        SearchRequest request = request();
        request.setBounds(new MapBounds(new Coordinate(30.4, -97.6), new Coordinate(30.2, -97.8)));
        request.setOpenNow(true);
        QueryPlan plan = new QueryPlanner().buildQueryPlan(request, Instant.now());

        Map<String, Object> context = OnDemandTrigger.buildContext(request, plan, 2, 5);

        assertThat(context)
            .containsEntry("source", "low_result")
            .containsEntry("restaurantCount", 2L)
            .containsEntry("foodCount", 5L)
            .containsEntry("planFormat", "dual_list")
            .containsEntry("openNow", true)
            .containsKeys("bounds", "location");
    }

    @Test
    void reportsQueuedCountAndLongestEta() {
        OnDemandProperties properties = new OnDemandProperties();
        OnDemandTrigger trigger = new OnDemandTrigger(requestService, admissionController, properties);
        SearchRequest request = request();
        QueryPlan plan = new QueryPlanner().buildQueryPlan(request, Instant.now());
        List<OnDemandRequestInput> recorded = OnDemandTrigger.buildLowResultInputs(request.getEntities(), "austin");
        when(requestService.recordRequests(anyList(), anyMap())).thenReturn(recorded);
        EnqueueResult first = new EnqueueResult("r1", "birria tacos", EntityScope.FOOD, OnDemandReason.LOW_RESULT, "austin", true);
        first.setEtaMs(3_000L);
        EnqueueResult second = new EnqueueResult("r2", "pho", EntityScope.FOOD, OnDemandReason.LOW_RESULT, "austin", true);
        second.setEtaMs(9_000L);
        EnqueueResult deferred = new EnqueueResult("r3", "ramen", EntityScope.FOOD, OnDemandReason.LOW_RESULT, "austin", false);
        when(admissionController.enqueueRequests(recorded)).thenReturn(List.of(first, second, deferred));

        OnDemandTrigger.Outcome outcome = trigger.trigger(request, plan, 0, 1, "austin");

        assertThat(outcome.triggered()).isTrue();
        assertThat(outcome.queued()).isEqualTo(2);
        assertThat(outcome.etaMs()).isEqualTo(9_000L);
    }

    @Test
    void failuresStillCountAsTriggered() {
        OnDemandTrigger trigger = new OnDemandTrigger(requestService, admissionController, new OnDemandProperties());
        SearchRequest request = request();
        QueryPlan plan = new QueryPlanner().buildQueryPlan(request, Instant.now());
        when(requestService.recordRequests(anyList(), anyMap())).thenThrow(new IllegalStateException("db down"));

        OnDemandTrigger.Outcome outcome = trigger.trigger(request, plan, 0, 0, "austin");

        assertThat(outcome.triggered()).isTrue();
        assertThat(outcome.queued()).isZero();
        verifyNoInteractions(admissionController);
    }

    @Test
    void disabledOnDemandIsNotTriggered() {
        OnDemandProperties properties = new OnDemandProperties();
        properties.setEnabled(false);
        OnDemandTrigger trigger = new OnDemandTrigger(requestService, admissionController, properties);
        SearchRequest request = request();

        OnDemandTrigger.Outcome outcome = trigger.trigger(
            request,
            new QueryPlanner().buildQueryPlan(request, Instant.now()),
            0,
            0,
            "austin"
        );

        assertThat(outcome.triggered()).isFalse();
        verifyNoInteractions(requestService, admissionController);
    }

    private static SearchRequest request() {
        SearchRequest request = new SearchRequest();
        EntityGroups entities = new EntityGroups();
        entities.setFood(List.of(new QueryEntity("birria tacos", List.of("food-1"))));
        request.setEntities(entities);
        return request;
    }
}
