package com.crave.search.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import com.crave.search.api.dto.DishResult;
import com.crave.search.api.dto.EntityGroups;
import com.crave.search.api.dto.QueryEntity;
import com.crave.search.api.dto.RestaurantResult;
import com.crave.search.api.dto.SearchRequest;
import com.crave.search.hours.OperatingHoursEvaluator;
import com.crave.search.plan.QueryPlan;
import com.crave.search.plan.QueryPlanner;
import com.crave.search.query.PageWindow;
import com.crave.search.query.SearchQueryBuilder;
import com.crave.search.query.SqlFragment;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class SearchQueryExecutorTest {

    // Monday 12:00 in New York
    private static final Instant NOW = Instant.parse("2024-01-15T17:00:00Z");
    private static final String LUNCH_HOURS = "{\"monday\":\"9:00 AM - 5:00 PM\"}";
    private static final String DINNER_HOURS = "{\"monday\":\"5:00 PM - 11:00 PM\"}";

    @Mock
    private SearchRowRepository rowRepository;

    private ExecutorService executorService;
    private SearchQueryExecutor executor;
    private final QueryPlanner planner = new QueryPlanner();

    @BeforeEach
    void setUp() {
        executorService = Executors.newFixedThreadPool(4);
        executor = new SearchQueryExecutor(
            new SearchQueryBuilder(),
            rowRepository,
            new ResultMapper(new OperatingHoursEvaluator(), new ObjectMapper()),
            executorService,
            5000
        );
    }

    @AfterEach
    void tearDown() {
        executorService.shutdownNow();
    }

    @Test
    void mapsRowsTotalsAndCapsDishesPerRestaurant() {
        List<Map<String, Object>> restaurants = List.of(restaurantRow("r-1", LUNCH_HOURS, 2));
        List<Map<String, Object>> dishes = List.of(
            dishRow("c-1", "r-1", LUNCH_HOURS),
            dishRow("c-2", "r-1", LUNCH_HOURS),
            dishRow("c-3", "r-1", LUNCH_HOURS)
        );
        stubStore(restaurants, dishes, 7L, 11L);

        ExecutionResult result = executor.execute(request(plan(false), PageWindow.forPage(1, 10), 2, false));

        assertThat(result.getTotalRestaurantCount()).isEqualTo(7L);
        assertThat(result.getTotalDishCount()).isEqualTo(11L);
        assertThat(result.getRestaurants()).hasSize(1);
        assertThat(result.getRestaurants().get(0).getRestaurantId()).isEqualTo("r-1");
        assertThat(result.getRestaurants().get(0).getPriceSymbol()).isEqualTo("$$");
        assertThat(result.getRestaurants().get(0).getOperatingStatus().isOpen()).isTrue();
        assertThat(result.getDishes()).extracting(DishResult::getConnectionId).containsExactly("c-1", "c-2");
        assertThat(result.isOpenNowApplied()).isFalse();
        assertThat(result.getSqlPreview()).isNull();
    }

    @Test
    void openNowDropsClosedAndUnknownRestaurantsAndReportsThem() {
        List<Map<String, Object>> restaurants = List.of(
            restaurantRow("r-open", LUNCH_HOURS, 1),
            restaurantRow("r-closed", DINNER_HOURS, 1),
            restaurantRow("r-unknown", null, 1)
        );
        List<Map<String, Object>> dishes = List.of(
            dishRow("c-1", "r-open", LUNCH_HOURS),
            dishRow("c-2", "r-closed", DINNER_HOURS),
            dishRow("c-3", "r-unknown", null)
        );
        stubStore(restaurants, dishes, 3L, 3L);

        ExecutionResult result = executor.execute(request(plan(true), new PageWindow(0, 40), 3, true));

        assertThat(result.isOpenNowApplied()).isTrue();
        assertThat(result.getRestaurants()).extracting(RestaurantResult::getRestaurantId).containsExactly("r-open");
        assertThat(result.getDishes()).extracting(DishResult::getConnectionId).containsExactly("c-1");
        assertThat(result.getOpenNowSupportedRestaurants()).isEqualTo(4);
        assertThat(result.getOpenNowUnsupportedRestaurants()).isEqualTo(2);
        assertThat(result.getOpenNowUnsupportedRestaurantIds()).containsExactly("r-unknown");
        assertThat(result.getOpenNowFilteredOut()).isEqualTo(4);
        // short over-fetch, so totals are the filtered counts
        assertThat(result.getTotalRestaurantCount()).isEqualTo(1L);
        assertThat(result.getTotalDishCount()).isEqualTo(1L);
        assertThat(result.getSqlPreview()).startsWith("-- Restaurant Query:").contains("-- Dish Query:");
    }

    @Test
    void openNowLeavesRowsAloneWhenNoRestaurantHasHours() {
        List<Map<String, Object>> restaurants = List.of(restaurantRow("r-1", null, 1));
        List<Map<String, Object>> dishes = List.of(dishRow("c-1", "r-1", null));
        stubStore(restaurants, dishes, 1L, 1L);

        ExecutionResult result = executor.execute(request(plan(true), new PageWindow(0, 40), 3, false));

        assertThat(result.isOpenNowApplied()).isFalse();
        assertThat(result.getRestaurants()).hasSize(1);
        assertThat(result.getDishes()).hasSize(1);
        assertThat(result.getOpenNowUnsupportedRestaurantIds()).containsExactly("r-1");
    }

    @Test
    void openNowPagesAfterFiltering() {
        List<Map<String, Object>> dishes = new ArrayList<>();
        for (int i = 1; i <= 5; i++) {
            dishes.add(dishRow("c-" + i, "r-" + i, LUNCH_HOURS));
        }
        stubStore(List.of(), dishes, 0L, 5L);

        ExecutionRequest request = new ExecutionRequest(
            plan(true), 2, 2, new PageWindow(0, 16), 0, 3, false, null, null, NOW
        );
        ExecutionResult result = executor.execute(request);

        assertThat(result.getDishes()).extracting(DishResult::getConnectionId).containsExactly("c-3", "c-4");
        assertThat(result.getTotalDishCount()).isEqualTo(5L);
    }

    @Test
    void storeFailureSurfacesAsSearchStoreException() {
        when(rowRepository.fetchRows(any(SqlFragment.class)))
            .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(() -> executor.execute(request(plan(false), PageWindow.forPage(1, 10), 3, false)))
            .isInstanceOf(SearchStoreException.class)
            .hasCauseInstanceOf(DataAccessResourceFailureException.class);
    }

    @Test
    void truncatedOverFetchSubtractsRemovedRowsFromStoreTotal() {
        List<Map<String, Object>> rows = new ArrayList<>();
        rows.add(new HashMap<>());
        OpenNowFilter.Outcome outcome = new OpenNowFilter.Outcome(rows, true, 4, 0, Set.of());

        // four fetched, one kept, window full: 100 - 3 removed
        assertThat(SearchQueryExecutor.reconcileTotal(outcome, 4, 100L, new PageWindow(0, 4))).isEqualTo(97L);
        assertThat(SearchQueryExecutor.reconcileTotal(outcome, 3, 100L, new PageWindow(0, 4))).isEqualTo(1L);
    }

    @Test
    void sliceAndCapHandleEdges() {
        List<Map<String, Object>> rows = List.of(dishRow("c-1", "r-1", null), dishRow("c-2", null, null));

        assertThat(SearchQueryExecutor.slice(rows, new PageWindow(5, 5))).isEmpty();
        assertThat(SearchQueryExecutor.capPerRestaurant(rows, 1)).hasSize(1);
        assertThat(SearchQueryExecutor.capPerRestaurant(rows, 0)).hasSize(2);
    }

    private void stubStore(
        List<Map<String, Object>> restaurantRows,
        List<Map<String, Object>> dishRows,
        long restaurantTotal,
        long dishTotal
    ) {
        when(rowRepository.fetchRows(any(SqlFragment.class))).thenAnswer(invocation -> {
            SqlFragment statement = invocation.getArgument(0);
            return statement.getSql().contains("ranked_restaurants") ? restaurantRows : dishRows;
        });
        when(rowRepository.fetchCounts(any(SqlFragment.class))).thenAnswer(invocation -> {
            SqlFragment statement = invocation.getArgument(0);
            if (statement.getSql().contains("total_connections")) {
                return Map.of("total_connections", dishTotal, "total_restaurants", restaurantTotal);
            }
            return Map.of("total_restaurants", restaurantTotal);
        });
    }

    private QueryPlan plan(boolean openNow) {
        EntityGroups entities = new EntityGroups();
        entities.setFood(List.of(new QueryEntity("brisket", List.of("f-1"))));
        SearchRequest request = new SearchRequest();
        request.setEntities(entities);
        request.setOpenNow(openNow);
        return planner.buildQueryPlan(request, NOW);
    }

    private static ExecutionRequest request(QueryPlan plan, PageWindow dbWindow, int perRestaurantLimit, boolean preview) {
        return new ExecutionRequest(plan, 1, 10, dbWindow, perRestaurantLimit, 3, preview, null, null, NOW);
    }

    private static Map<String, Object> restaurantRow(String restaurantId, String hours, int priceLevel) {
        Map<String, Object> row = new HashMap<>();
        row.put("restaurant_id", restaurantId);
        row.put("restaurant_name", "Restaurant " + restaurantId);
        row.put("location_id", "loc-" + restaurantId);
        row.put("latitude", 30.27);
        row.put("longitude", -97.74);
        row.put("price_level", priceLevel);
        row.put("hours", hours);
        row.put("time_zone", hours == null ? null : "America/New_York");
        row.put("total_upvotes", 12L);
        return row;
    }

    private static Map<String, Object> dishRow(String connectionId, String restaurantId, String hours) {
        Map<String, Object> row = new HashMap<>();
        row.put("connection_id", connectionId);
        row.put("restaurant_id", restaurantId);
        row.put("food_id", "f-1");
        row.put("food_name", "brisket");
        row.put("food_quality_score", 81.5);
        row.put("hours", hours);
        row.put("time_zone", hours == null ? null : "America/New_York");
        return row;
    }
}
