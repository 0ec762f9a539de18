package com.crave.search.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.crave.search.api.dto.Coordinate;
import com.crave.search.api.dto.DishResult;
import com.crave.search.api.dto.EntityGroups;
import com.crave.search.api.dto.MapBounds;
import com.crave.search.api.dto.Pagination;
import com.crave.search.api.dto.PlanResponse;
import com.crave.search.api.dto.QueryEntity;
import com.crave.search.api.dto.RestaurantResult;
import com.crave.search.api.dto.SearchRequest;
import com.crave.search.api.dto.SearchResponse;
import com.crave.search.collection.CollectionAreaResolver;
import com.crave.search.execution.ExecutionRequest;
import com.crave.search.execution.ExecutionResult;
import com.crave.search.execution.SearchQueryExecutor;
import com.crave.search.execution.SearchStoreException;
import com.crave.search.plan.EntityScope;
import com.crave.search.plan.QueryFormat;
import com.crave.search.plan.QueryPlan;
import com.crave.search.plan.QueryPlanner;
import com.crave.search.query.PageWindow;
import com.crave.search.query.SearchQueryBuilder;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SearchServiceTest {
    private static final String BIRRIA_ID = "11111111-1111-4111-8111-111111111111";
    private static final String TAQUERIA_ID = "22222222-2222-4222-8222-222222222222";

    @Mock
    private SearchQueryExecutor queryExecutor;

    @Mock
    private OnDemandTrigger onDemandTrigger;

    @Mock
    private CollectionAreaResolver areaResolver;

    @Mock
    private SearchImpressionRepository impressionRepository;

    @Mock
    private SearchMetrics searchMetrics;

    private SearchProperties properties;
    private SearchService service;

    @BeforeEach
    void setUp() {
        properties = new SearchProperties();
        service = new SearchService(
            new QueryPlanner(),
            new SearchQueryBuilder(),
            queryExecutor,
            onDemandTrigger,
            areaResolver,
            impressionRepository,
            searchMetrics,
            properties
        );
    }

    @Test
    void fullCoverageWhenEnoughResults() {
        properties.setOnDemandMinResults(2);
        SearchRequest request = foodRequest();
        when(queryExecutor.execute(any(ExecutionRequest.class))).thenReturn(result(3, 12, 3));
        when(areaResolver.resolveLocationKey(any())).thenReturn("austin");

        SearchResponse response = service.search(request, "trace-1", "req-1");

        assertThat(response.getTraceId()).isEqualTo("trace-1");
        assertThat(response.getRequestId()).isEqualTo("req-1");
        assertThat(response.getFormat()).isEqualTo(QueryFormat.DUAL_LIST);
        assertThat(response.getRestaurants()).hasSize(3);
        assertThat(response.getMetadata().getCoverageStatus()).isEqualTo("full");
        assertThat(response.getMetadata().getTotalFoodResults()).isEqualTo(12);
        assertThat(response.getMetadata().getPage()).isEqualTo(1);
        assertThat(response.getMetadata().getPageSize()).isEqualTo(25);
        assertThat(response.getMetadata().getPerRestaurantLimit()).isEqualTo(3);
        verifyNoInteractions(onDemandTrigger);
        verify(searchMetrics).recordSuccess(eq(QueryFormat.DUAL_LIST), eq(false), anyLong(), eq(3), eq(0));
    }

    @Test
    void lowResultsTriggerOnDemandAndReportPartial() {
        SearchRequest request = foodRequest();
        ExecutionResult result = result(2, 2, 2);
        when(queryExecutor.execute(any(ExecutionRequest.class))).thenReturn(result);
        when(areaResolver.resolveLocationKey(any())).thenReturn("austin");
        when(onDemandTrigger.trigger(eq(request), any(QueryPlan.class), eq(2L), eq(2L), eq("austin")))
            .thenReturn(new OnDemandTrigger.Outcome(true, 1, 7_200_000L));

        SearchResponse response = service.search(request, "trace-1", "req-1");

        assertThat(response.getMetadata().getCoverageStatus()).isEqualTo("partial");
        assertThat(response.getMetadata().getOnDemandQueued()).isEqualTo(1);
        assertThat(response.getMetadata().getOnDemandEtaMs()).isEqualTo(7_200_000L);
    }

    @Test
    void zeroResultsWithTargetsIsUnresolved() {
        SearchRequest request = foodRequest();
        when(queryExecutor.execute(any(ExecutionRequest.class))).thenReturn(result(0, 0, 0));
        when(areaResolver.resolveLocationKey(any())).thenReturn("austin");
        when(onDemandTrigger.trigger(eq(request), any(QueryPlan.class), eq(0L), eq(0L), eq("austin")))
            .thenReturn(new OnDemandTrigger.Outcome(true, 0, null));

        SearchResponse response = service.search(request, "trace-1", "req-1");

        assertThat(response.getMetadata().getCoverageStatus()).isEqualTo("unresolved");
    }

    @Test
    void noTargetsIsAlwaysFull() {
        SearchRequest request = new SearchRequest();
        request.setEntities(new EntityGroups());
        properties.setSearchLogEnabled(false);
        when(queryExecutor.execute(any(ExecutionRequest.class))).thenReturn(result(0, 0, 0));

        SearchResponse response = service.search(request, "trace-1", "req-1");

        assertThat(response.getMetadata().getCoverageStatus()).isEqualTo("full");
        verifyNoInteractions(onDemandTrigger, areaResolver, impressionRepository);
    }

    @Test
    void singleListCountsDishTotalAndOmitsRestaurants() {
        properties.setOnDemandMinResults(5);
        SearchRequest request = new SearchRequest();
        EntityGroups entities = new EntityGroups();
        entities.setRestaurants(List.of(new QueryEntity("taqueria del sol", List.of(TAQUERIA_ID))));
        request.setEntities(entities);
        when(queryExecutor.execute(any(ExecutionRequest.class))).thenReturn(result(1, 6, 6));
        when(areaResolver.resolveLocationKey(any())).thenReturn("global");

        SearchResponse response = service.search(request, "trace-1", "req-1");

        assertThat(response.getFormat()).isEqualTo(QueryFormat.SINGLE_LIST);
        assertThat(response.getRestaurants()).isNull();
        assertThat(response.getMetadata().getPerRestaurantLimit()).isZero();
        assertThat(response.getMetadata().getCoverageStatus()).isEqualTo("full");
        verifyNoInteractions(onDemandTrigger);
    }

    @Test
    void singleListWithRestaurantButNoDishesIsUnresolved() {
        SearchRequest request = new SearchRequest();
        EntityGroups entities = new EntityGroups();
        entities.setRestaurants(List.of(new QueryEntity("taqueria del sol", List.of(TAQUERIA_ID))));
        request.setEntities(entities);
        when(queryExecutor.execute(any(ExecutionRequest.class))).thenReturn(result(1, 0, 0));
        when(areaResolver.resolveLocationKey(any())).thenReturn("austin");
        when(onDemandTrigger.trigger(eq(request), any(QueryPlan.class), eq(1L), eq(0L), eq("austin")))
            .thenReturn(new OnDemandTrigger.Outcome(true, 1, null));

        SearchResponse response = service.search(request, "trace-1", "req-1");

        assertThat(response.getFormat()).isEqualTo(QueryFormat.SINGLE_LIST);
        assertThat(response.getMetadata().getCoverageStatus()).isEqualTo("unresolved");
    }

    @Test
    void impressionFailureDoesNotFailSearch() {
        properties.setOnDemandMinResults(0);
        when(queryExecutor.execute(any(ExecutionRequest.class))).thenReturn(result(1, 1, 1));
        when(areaResolver.resolveLocationKey(any())).thenReturn("austin");
        doThrow(new IllegalStateException("search_log unavailable"))
            .when(impressionRepository).insertImpressions(any(), any(Instant.class));

        SearchResponse response = service.search(foodRequest(), "trace-1", "req-1");

        assertThat(response.getMetadata().getCoverageStatus()).isEqualTo("full");
    }

    @Test
    void areaLookupFailureFallsBackToGlobalKey() {
        SearchRequest request = foodRequest();
        when(queryExecutor.execute(any(ExecutionRequest.class))).thenReturn(result(0, 1, 1));
        when(areaResolver.resolveLocationKey(any())).thenThrow(new IllegalStateException("db down"));
        when(onDemandTrigger.trigger(eq(request), any(QueryPlan.class), anyLong(), anyLong(), eq("global")))
            .thenReturn(new OnDemandTrigger.Outcome(true, 0, null));

        service.search(request, "trace-1", "req-1");

        verify(onDemandTrigger).trigger(eq(request), any(QueryPlan.class), eq(0L), eq(1L), eq("global"));
    }

    @Test
    void storeFailureIsRecordedAndPropagated() {
        when(queryExecutor.execute(any(ExecutionRequest.class)))
            .thenThrow(new SearchStoreException("Search store query failed", new RuntimeException("boom")));

        assertThatThrownBy(() -> service.search(foodRequest(), "trace-1", "req-1"))
            .isInstanceOf(SearchStoreException.class);
        verify(searchMetrics).recordFailure(eq(QueryFormat.DUAL_LIST), eq("store_unavailable"), anyLong());
        verify(searchMetrics, never()).recordSuccess(any(), anyBoolean(), anyLong(), anyInt(), anyInt());
    }

    @Test
    void rejectsInvalidRequests() {
        assertThatThrownBy(() -> SearchService.validate(null))
            .isInstanceOf(InvalidSearchRequestException.class)
            .hasMessage("request body is required");
        assertThatThrownBy(() -> SearchService.validate(new SearchRequest()))
            .hasMessage("entities is required");

        SearchRequest partialBounds = foodRequest();
        partialBounds.setBounds(new MapBounds(new Coordinate(30.3, -97.7), null));
        assertThatThrownBy(() -> SearchService.validate(partialBounds))
            .isInstanceOf(InvalidSearchRequestException.class);

        SearchRequest outOfRange = foodRequest();
        outOfRange.setBounds(new MapBounds(new Coordinate(91.0, -97.7), new Coordinate(30.2, -97.8)));
        assertThatThrownBy(() -> SearchService.validate(outOfRange))
            .hasMessage("bounds.north_east.lat must be within [-90, 90]");

        SearchRequest inverted = foodRequest();
        inverted.setBounds(new MapBounds(new Coordinate(30.2, -97.7), new Coordinate(30.3, -97.8)));
        assertThatThrownBy(() -> SearchService.validate(inverted))
            .hasMessage("bounds.south_west.lat must not exceed bounds.north_east.lat");
    }

    @Test
    void invalidRequestCountsAsBadRequest() {
        assertThatThrownBy(() -> service.search(new SearchRequest(), "trace-1", "req-1"))
            .isInstanceOf(InvalidSearchRequestException.class);

        verify(searchMetrics).recordFailure(isNull(), eq("bad_request"), anyLong());
        verifyNoInteractions(queryExecutor);
    }

    @Test
    void pageSizeIsClampedToResultLimit() {
        properties.setMaxPageSize(100);
        properties.setResultLimit(50);

        assertThat(service.resolvePageSize(new Pagination(1, 500))).isEqualTo(50);
        assertThat(service.resolvePageSize(new Pagination(1, 0))).isEqualTo(25);
        assertThat(service.resolvePageSize(null)).isEqualTo(25);
        assertThat(service.resolvePage(new Pagination(-3, 10))).isEqualTo(1);
        assertThat(service.resolvePage(new Pagination(4, 10))).isEqualTo(4);
    }

    @Test
    void openNowOverFetchesFromFirstRow() {
        SearchRequest request = foodRequest();
        request.setOpenNow(true);
        QueryPlan openNowPlan = new QueryPlanner().buildQueryPlan(request, Instant.now());
        QueryPlan plainPlan = new QueryPlanner().buildQueryPlan(foodRequest(), Instant.now());

        PageWindow overFetch = service.resolveDbWindow(openNowPlan, 2, 10);
        PageWindow capped = service.resolveDbWindow(openNowPlan, 5, 25);
        PageWindow plain = service.resolveDbWindow(plainPlan, 2, 10);

        assertThat(overFetch.getSkip()).isZero();
        assertThat(overFetch.getTake()).isEqualTo(80);
        assertThat(capped.getTake()).isEqualTo(100);
        assertThat(plain.getSkip()).isEqualTo(10);
        assertThat(plain.getTake()).isEqualTo(10);
    }

    @Test
    void executionRequestCarriesCenterAndPreviewFlag() {
        SearchRequest request = foodRequest();
        request.setBounds(new MapBounds(new Coordinate(30.4, -97.6), new Coordinate(30.2, -97.8)));
        request.setUserLocation(new Coordinate(40.7, -74.0));
        request.setIncludeSqlPreview(true);
        Instant now = Instant.parse("2024-06-01T12:00:00Z");
        QueryPlan plan = new QueryPlanner().buildQueryPlan(request, now);

        ExecutionRequest executionRequest = service.buildExecutionRequest(request, plan, now);

        assertThat(executionRequest.searchCenter().getLat()).isCloseTo(30.3, offset(1e-9));
        assertThat(executionRequest.userLocation().getLat()).isEqualTo(40.7);
        assertThat(executionRequest.includeSqlPreview()).isTrue();
        assertThat(executionRequest.referenceTime()).isEqualTo(now);
    }

    @Test
    void impressionsAreDedupedAcrossGroups() {
        SearchRequest request = foodRequest();
        request.setSourceQuery("birria near me");
        request.getEntities().setFoodAttributes(List.of(new QueryEntity("spicy", List.of(BIRRIA_ID, "attr-1"))));

        List<SearchImpression> impressions = SearchService.buildImpressions(request, null);

        assertThat(impressions).containsExactly(
            new SearchImpression(BIRRIA_ID, EntityScope.FOOD, "global", "birria near me"),
            new SearchImpression("attr-1", EntityScope.FOOD_ATTRIBUTE, "global", "birria near me")
        );
    }

    @Test
    void planResponseIncludesBothStatements() {
        PlanResponse plan = service.buildPlanResponse(foodRequest());

        assertThat(plan.getPlan().getFormat()).isEqualTo(QueryFormat.DUAL_LIST);
        assertThat(plan.getSqlPreview()).startsWith("-- Restaurant Query:").contains("-- Dish Query:");
        verifyNoInteractions(queryExecutor);
    }

    private static SearchRequest foodRequest() {
        SearchRequest request = new SearchRequest();
        EntityGroups entities = new EntityGroups();
        entities.setFood(List.of(new QueryEntity("birria tacos", List.of(BIRRIA_ID))));
        request.setEntities(entities);
        return request;
    }

    private static ExecutionResult result(int restaurants, long dishTotal, int dishes) {
        ExecutionResult result = new ExecutionResult();
        result.setRestaurants(Collections.nCopies(restaurants, new RestaurantResult()));
        result.setDishes(Collections.nCopies(dishes, new DishResult()));
        result.setTotalRestaurantCount(restaurants);
        result.setTotalDishCount(dishTotal);
        return result;
    }
}
