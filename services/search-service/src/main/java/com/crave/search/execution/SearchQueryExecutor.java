package com.crave.search.execution;

import com.crave.search.api.dto.DishResult;
import com.crave.search.api.dto.RestaurantResult;
import com.crave.search.plan.QueryPlan;
import com.crave.search.query.CompiledQuery;
import com.crave.search.query.PageWindow;
import com.crave.search.query.SearchQueryBuilder;
import com.crave.search.query.SqlFragment;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Runs the restaurant and dish statements (data and count for each) concurrently, then applies the
 * open-now filter, page reconciliation and the per-restaurant dish cap before mapping.
 */
@Component
public class SearchQueryExecutor {
    private static final Logger logger = LoggerFactory.getLogger(SearchQueryExecutor.class);

    private final SearchQueryBuilder queryBuilder;
    private final SearchRowRepository rowRepository;
    private final ResultMapper resultMapper;
    private final ExecutorService searchExecutor;
    private final long queryTimeoutMs;

    public SearchQueryExecutor(
        SearchQueryBuilder queryBuilder,
        SearchRowRepository rowRepository,
        ResultMapper resultMapper,
        @Qualifier("searchExecutor") ExecutorService searchExecutor,
        @Value("${search.query-timeout-ms:5000}") long queryTimeoutMs
    ) {
        this.queryBuilder = queryBuilder;
        this.rowRepository = rowRepository;
        this.resultMapper = resultMapper;
        this.searchExecutor = searchExecutor;
        this.queryTimeoutMs = queryTimeoutMs;
    }

    public ExecutionResult execute(ExecutionRequest request) {
        QueryPlan plan = request.plan();
        PageWindow dbWindow = request.dbWindow();
        CompiledQuery restaurantQuery = queryBuilder.buildRestaurantQuery(
            plan,
            dbWindow,
            request.searchCenter(),
            request.topDishesLimit()
        );
        CompiledQuery dishQuery = queryBuilder.buildDishQuery(plan, dbWindow, request.searchCenter());

        CompletableFuture<List<Map<String, Object>>> restaurantRowsFuture = rows(restaurantQuery.getData());
        CompletableFuture<Map<String, Object>> restaurantCountFuture = counts(restaurantQuery.getCount());
        CompletableFuture<List<Map<String, Object>>> dishRowsFuture = rows(dishQuery.getData());
        CompletableFuture<Map<String, Object>> dishCountFuture = counts(dishQuery.getCount());
        awaitAll(restaurantRowsFuture, restaurantCountFuture, dishRowsFuture, dishCountFuture);

        List<Map<String, Object>> restaurantRows = restaurantRowsFuture.join();
        List<Map<String, Object>> dishRows = dishRowsFuture.join();
        long restaurantTotal = RowValues.longOrZero(restaurantCountFuture.join(), "total_restaurants");
        long dishTotal = RowValues.longOrZero(dishCountFuture.join(), "total_connections");

        Map<String, RestaurantContext> contexts = resultMapper.buildContexts(
            restaurantRows,
            dishRows,
            request.referenceTime(),
            request.userLocation()
        );

        ExecutionResult result = new ExecutionResult();
        if (plan.requestsOpenNow()) {
            OpenNowFilter.Outcome restaurantOutcome = OpenNowFilter.apply(restaurantRows, contexts);
            OpenNowFilter.Outcome dishOutcome = OpenNowFilter.apply(dishRows, contexts);
            int restaurantsRemoved = restaurantRows.size() - restaurantOutcome.getRows().size();
            int dishesRemoved = dishRows.size() - dishOutcome.getRows().size();

            Set<String> unsupportedIds = new LinkedHashSet<>(restaurantOutcome.getUnsupportedIds());
            unsupportedIds.addAll(dishOutcome.getUnsupportedIds());
            result.setOpenNowApplied(restaurantOutcome.isApplied() || dishOutcome.isApplied());
            result.setOpenNowSupportedRestaurants(restaurantOutcome.getSupportedCount() + dishOutcome.getSupportedCount());
            result.setOpenNowUnsupportedRestaurants(
                restaurantOutcome.getUnsupportedCount() + dishOutcome.getUnsupportedCount()
            );
            result.setOpenNowUnsupportedRestaurantIds(new ArrayList<>(unsupportedIds));
            result.setOpenNowFilteredOut(restaurantsRemoved + dishesRemoved);

            restaurantTotal = reconcileTotal(restaurantOutcome, restaurantRows.size(), restaurantTotal, dbWindow);
            dishTotal = reconcileTotal(dishOutcome, dishRows.size(), dishTotal, dbWindow);

            PageWindow pageWindow = request.pageWindow();
            restaurantRows = slice(restaurantOutcome.getRows(), pageWindow);
            dishRows = slice(dishOutcome.getRows(), pageWindow);
        }
        dishRows = capPerRestaurant(dishRows, request.perRestaurantLimit());

        List<RestaurantResult> restaurants = new ArrayList<>(restaurantRows.size());
        for (Map<String, Object> row : restaurantRows) {
            restaurants.add(resultMapper.toRestaurantResult(
                row,
                contexts.get(RowValues.string(row, "restaurant_id")),
                request.referenceTime(),
                request.userLocation()
            ));
        }
        List<DishResult> dishes = new ArrayList<>(dishRows.size());
        for (Map<String, Object> row : dishRows) {
            dishes.add(resultMapper.toDishResult(
                row,
                contexts.get(RowValues.string(row, "restaurant_id")),
                request.referenceTime()
            ));
        }

        result.setRestaurants(restaurants);
        result.setDishes(dishes);
        result.setTotalRestaurantCount(restaurantTotal);
        result.setTotalDishCount(dishTotal);
        result.setBoundsApplied(
            restaurantQuery.getAppliedFilters().isBoundsApplied() || dishQuery.getAppliedFilters().isBoundsApplied()
        );
        result.setPriceFilterApplied(
            restaurantQuery.getAppliedFilters().isPriceFilterApplied()
                || dishQuery.getAppliedFilters().isPriceFilterApplied()
        );
        result.setMinimumVotesApplied(
            restaurantQuery.getAppliedFilters().isMinimumVotesApplied()
                || dishQuery.getAppliedFilters().isMinimumVotesApplied()
        );
        if (request.includeSqlPreview()) {
            result.setSqlPreview(combinePreview(restaurantQuery, dishQuery));
        }

        if (logger.isDebugEnabled()) {
            logger.debug(
                "search executed format={} restaurants={} dishes={} openNowApplied={} filteredOut={} unsupported={}",
                plan.getFormat().value(),
                restaurants.size(),
                dishes.size(),
                result.isOpenNowApplied(),
                result.getOpenNowFilteredOut(),
                result.getOpenNowUnsupportedRestaurants()
            );
        }
        return result;
    }

    public static String combinePreview(CompiledQuery restaurantQuery, CompiledQuery dishQuery) {
        return "-- Restaurant Query:\n" + restaurantQuery.getPreview() + "\n\n-- Dish Query:\n" + dishQuery.getPreview();
    }

    /**
     * When the over-fetch came back short the filtered rows are the whole result, so their count is exact.
     * Otherwise the store count minus the rows known to be closed is the tightest bound available.
     */
    static long reconcileTotal(OpenNowFilter.Outcome outcome, int fetched, long storeTotal, PageWindow dbWindow) {
        if (!outcome.isApplied()) {
            return storeTotal;
        }
        if (fetched < dbWindow.getTake()) {
            return outcome.getRows().size();
        }
        return Math.max(outcome.getRows().size(), storeTotal - (fetched - outcome.getRows().size()));
    }

    static List<Map<String, Object>> slice(List<Map<String, Object>> rows, PageWindow window) {
        if (window.getTake() <= 0 || window.getSkip() >= rows.size()) {
            return new ArrayList<>();
        }
        int end = Math.min(rows.size(), window.getSkip() + window.getTake());
        return new ArrayList<>(rows.subList(window.getSkip(), end));
    }

    static List<Map<String, Object>> capPerRestaurant(List<Map<String, Object>> rows, int perRestaurantLimit) {
        if (perRestaurantLimit <= 0) {
            return rows;
        }
        Map<String, Integer> counts = new HashMap<>();
        List<Map<String, Object>> limited = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            String restaurantId = RowValues.string(row, "restaurant_id");
            if (restaurantId == null) {
                continue;
            }
            int seen = counts.getOrDefault(restaurantId, 0);
            if (seen >= perRestaurantLimit) {
                continue;
            }
            counts.put(restaurantId, seen + 1);
            limited.add(row);
        }
        return limited;
    }

    private CompletableFuture<List<Map<String, Object>>> rows(SqlFragment statement) {
        return CompletableFuture.supplyAsync(() -> rowRepository.fetchRows(statement), searchExecutor);
    }

    private CompletableFuture<Map<String, Object>> counts(SqlFragment statement) {
        return CompletableFuture.supplyAsync(() -> rowRepository.fetchCounts(statement), searchExecutor);
    }

    private void awaitAll(CompletableFuture<?>... futures) {
        CompletableFuture<Void> all = CompletableFuture.allOf(futures);
        try {
            all.get(queryTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            cancel(futures);
            Throwable cause = e.getCause() == null ? e : e.getCause();
            logger.error("search store query failed error={}", cause.getMessage());
            throw new SearchStoreException("Search store query failed", cause);
        } catch (TimeoutException e) {
            cancel(futures);
            logger.error("search store query timed out timeoutMs={}", queryTimeoutMs);
            throw new SearchStoreException("Search store query timed out after " + queryTimeoutMs + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel(futures);
            throw new SearchStoreException("Interrupted while waiting for search store", e);
        }
    }

    private static void cancel(CompletableFuture<?>... futures) {
        for (CompletableFuture<?> future : futures) {
            future.cancel(true);
        }
    }
}
