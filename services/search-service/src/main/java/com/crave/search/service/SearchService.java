package com.crave.search.service;

import com.crave.search.api.dto.Coordinate;
import com.crave.search.api.dto.EntityGroups;
import com.crave.search.api.dto.MapBounds;
import com.crave.search.api.dto.Pagination;
import com.crave.search.api.dto.PlanResponse;
import com.crave.search.api.dto.QueryEntity;
import com.crave.search.api.dto.SearchRequest;
import com.crave.search.api.dto.SearchResponse;
import com.crave.search.collection.CollectionArea;
import com.crave.search.collection.CollectionAreaResolver;
import com.crave.search.execution.ExecutionRequest;
import com.crave.search.execution.ExecutionResult;
import com.crave.search.execution.SearchQueryExecutor;
import com.crave.search.execution.SearchStoreException;
import com.crave.search.plan.EntityScope;
import com.crave.search.plan.QueryFormat;
import com.crave.search.plan.QueryPlan;
import com.crave.search.plan.QueryPlanner;
import com.crave.search.query.CompiledQuery;
import com.crave.search.query.PageWindow;
import com.crave.search.query.SearchQueryBuilder;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class SearchService {
    private static final Logger logger = LoggerFactory.getLogger(SearchService.class);

    private final QueryPlanner queryPlanner;
    private final SearchQueryBuilder queryBuilder;
    private final SearchQueryExecutor queryExecutor;
    private final OnDemandTrigger onDemandTrigger;
    private final CollectionAreaResolver areaResolver;
    private final SearchImpressionRepository impressionRepository;
    private final SearchMetrics searchMetrics;
    private final SearchProperties properties;

    public SearchService(
        QueryPlanner queryPlanner,
        SearchQueryBuilder queryBuilder,
        SearchQueryExecutor queryExecutor,
        OnDemandTrigger onDemandTrigger,
        CollectionAreaResolver areaResolver,
        SearchImpressionRepository impressionRepository,
        SearchMetrics searchMetrics,
        SearchProperties properties
    ) {
        this.queryPlanner = queryPlanner;
        this.queryBuilder = queryBuilder;
        this.queryExecutor = queryExecutor;
        this.onDemandTrigger = onDemandTrigger;
        this.areaResolver = areaResolver;
        this.impressionRepository = impressionRepository;
        this.searchMetrics = searchMetrics;
        this.properties = properties;
    }

    public SearchResponse search(SearchRequest request, String traceId, String requestId) {
        long started = System.nanoTime();
        QueryFormat format = null;
        try {
            validate(request);
            Instant now = Instant.now();
            QueryPlan plan = queryPlanner.buildQueryPlan(request, now);
            format = plan.getFormat();

            ExecutionRequest executionRequest = buildExecutionRequest(request, plan, now);
            ExecutionResult result = queryExecutor.execute(executionRequest);

            boolean hasTargets = request.getEntities().hasAny();
            long primaryCount = plan.isSingleList() ? result.getTotalDishCount() : result.getRestaurants().size();
            boolean shouldTrigger = hasTargets && primaryCount < properties.effectiveOnDemandMinResults();

            String locationKey = null;
            if (shouldTrigger || properties.isSearchLogEnabled()) {
                locationKey = resolveLocationKey(request);
            }
            OnDemandTrigger.Outcome onDemand = shouldTrigger
                ? onDemandTrigger.trigger(
                    request,
                    plan,
                    result.getTotalRestaurantCount(),
                    result.getTotalDishCount(),
                    locationKey
                )
                : OnDemandTrigger.Outcome.NOT_TRIGGERED;

            // single_list restaurants are the match itself, not coverage of the requested dishes
            long coveredRestaurants = plan.isSingleList() ? 0 : result.getRestaurants().size();
            long totalResults = result.getTotalDishCount() + coveredRestaurants;
            CoverageStatus coverage = CoverageStatus.resolve(hasTargets, totalResults, onDemand.triggered());

            if (properties.isSearchLogEnabled()) {
                recordImpressions(request, locationKey, now);
            }

            long tookMs = (System.nanoTime() - started) / 1_000_000L;
            SearchResponse response = buildResponse(plan, executionRequest, result, coverage, onDemand, tookMs);
            response.setTraceId(traceId);
            response.setRequestId(requestId);

            searchMetrics.recordSuccess(
                format,
                plan.requestsOpenNow(),
                tookMs,
                result.getDishes().size(),
                result.getOpenNowFilteredOut()
            );
            logger.info(
                "search_completed request_id={} format={} restaurants={} food={} coverage={} took_ms={}",
                requestId,
                format.value(),
                result.getTotalRestaurantCount(),
                result.getTotalDishCount(),
                coverage.value(),
                tookMs
            );
            return response;
        } catch (InvalidSearchRequestException e) {
            searchMetrics.recordFailure(format, "bad_request", (System.nanoTime() - started) / 1_000_000L);
            throw e;
        } catch (SearchStoreException e) {
            searchMetrics.recordFailure(format, "store_unavailable", (System.nanoTime() - started) / 1_000_000L);
            throw e;
        } catch (RuntimeException e) {
            searchMetrics.recordFailure(format, "internal", (System.nanoTime() - started) / 1_000_000L);
            throw e;
        }
    }

    /**
     * Plans and compiles the request without touching the store.
     */
    public PlanResponse buildPlanResponse(SearchRequest request) {
        validate(request);
        QueryPlan plan = queryPlanner.buildQueryPlan(request, Instant.now());
        int page = resolvePage(request.getPagination());
        int pageSize = resolvePageSize(request.getPagination());
        PageWindow window = resolveDbWindow(plan, page, pageSize);
        Coordinate searchCenter = resolveSearchCenter(request);
        CompiledQuery restaurantQuery = queryBuilder.buildRestaurantQuery(
            plan,
            window,
            searchCenter,
            properties.getTopDishesLimit()
        );
        CompiledQuery dishQuery = queryBuilder.buildDishQuery(plan, window, searchCenter);
        return new PlanResponse(plan, SearchQueryExecutor.combinePreview(restaurantQuery, dishQuery));
    }

    ExecutionRequest buildExecutionRequest(SearchRequest request, QueryPlan plan, Instant now) {
        int page = resolvePage(request.getPagination());
        int pageSize = resolvePageSize(request.getPagination());
        boolean includePreview = properties.isAlwaysIncludeSqlPreview() || Boolean.TRUE.equals(request.getIncludeSqlPreview());
        return new ExecutionRequest(
            plan,
            page,
            pageSize,
            resolveDbWindow(plan, page, pageSize),
            plan.isSingleList() ? 0 : Math.max(0, properties.getPerRestaurantLimit()),
            properties.getTopDishesLimit(),
            includePreview,
            validUserLocation(request),
            resolveSearchCenter(request),
            now
        );
    }

    int resolvePage(Pagination pagination) {
        if (pagination == null || pagination.getPage() == null || pagination.getPage() <= 0) {
            return 1;
        }
        return pagination.getPage();
    }

    int resolvePageSize(Pagination pagination) {
        int requested = pagination == null || pagination.getPageSize() == null || pagination.getPageSize() <= 0
            ? properties.getDefaultPageSize()
            : pagination.getPageSize();
        int ceiling = Math.max(1, Math.min(properties.getMaxPageSize(), properties.getResultLimit()));
        return Math.max(1, Math.min(requested, ceiling));
    }

    /**
     * Open-now filtering happens after the store paginates, so those searches over-fetch from the first row
     * and the executor re-applies the page.
     */
    PageWindow resolveDbWindow(QueryPlan plan, int page, int pageSize) {
        if (!plan.requestsOpenNow()) {
            return PageWindow.forPage(page, pageSize);
        }
        long wanted = (long) page * pageSize * properties.effectiveOpenNowFetchMultiplier();
        long take = Math.min(Math.max(wanted, pageSize), Math.max(pageSize, properties.getResultLimit()));
        return new PageWindow(0, (int) take);
    }

    private static Coordinate resolveSearchCenter(SearchRequest request) {
        MapBounds bounds = request.getBounds();
        if (bounds != null && bounds.isComplete()) {
            return bounds.center();
        }
        return validUserLocation(request);
    }

    private static Coordinate validUserLocation(SearchRequest request) {
        Coordinate userLocation = request.getUserLocation();
        return userLocation != null && userLocation.isFinite() ? userLocation : null;
    }

    private String resolveLocationKey(SearchRequest request) {
        try {
            return areaResolver.resolveLocationKey(resolveSearchCenter(request));
        } catch (RuntimeException e) {
            logger.warn("collection_area_lookup_failed error={}", e.getMessage());
            return CollectionArea.GLOBAL;
        }
    }

    private void recordImpressions(SearchRequest request, String locationKey, Instant now) {
        List<SearchImpression> impressions = buildImpressions(request, locationKey);
        if (impressions.isEmpty()) {
            return;
        }
        try {
            impressionRepository.insertImpressions(impressions, now);
        } catch (RuntimeException e) {
            logger.warn("search_impressions_failed count={} error={}", impressions.size(), e.getMessage());
        }
    }

    static List<SearchImpression> buildImpressions(SearchRequest request, String locationKey) {
        List<SearchImpression> impressions = new ArrayList<>();
        EntityGroups entities = request.getEntities();
        if (entities == null) {
            return impressions;
        }
        Set<String> seen = new LinkedHashSet<>();
        String key = locationKey == null ? CollectionArea.GLOBAL : locationKey;
        addImpressions(impressions, seen, entities.getFood(), EntityScope.FOOD, key, request.getSourceQuery());
        addImpressions(impressions, seen, entities.getFoodAttributes(), EntityScope.FOOD_ATTRIBUTE, key, request.getSourceQuery());
        addImpressions(impressions, seen, entities.getRestaurants(), EntityScope.RESTAURANT, key, request.getSourceQuery());
        addImpressions(
            impressions,
            seen,
            entities.getRestaurantAttributes(),
            EntityScope.RESTAURANT_ATTRIBUTE,
            key,
            request.getSourceQuery()
        );
        return impressions;
    }

    private static void addImpressions(
        List<SearchImpression> impressions,
        Set<String> seen,
        List<QueryEntity> group,
        EntityScope type,
        String locationKey,
        String queryText
    ) {
        for (String entityId : QueryPlanner.collectEntityIds(group)) {
            if (seen.add(entityId)) {
                impressions.add(new SearchImpression(entityId, type, locationKey, queryText));
            }
        }
    }

    private static SearchResponse buildResponse(
        QueryPlan plan,
        ExecutionRequest executionRequest,
        ExecutionResult result,
        CoverageStatus coverage,
        OnDemandTrigger.Outcome onDemand,
        long tookMs
    ) {
        SearchResponse response = new SearchResponse();
        response.setFormat(plan.getFormat());
        response.setPlan(plan);
        response.setFood(result.getDishes());
        response.setRestaurants(plan.isSingleList() ? null : result.getRestaurants());
        response.setSqlPreview(result.getSqlPreview());

        SearchResponse.Metadata metadata = new SearchResponse.Metadata();
        metadata.setTotalFoodResults(result.getTotalDishCount());
        metadata.setTotalRestaurantResults(result.getTotalRestaurantCount());
        metadata.setQueryExecutionTimeMs(tookMs);
        metadata.setBoundsApplied(result.isBoundsApplied());
        metadata.setOpenNowApplied(result.isOpenNowApplied());
        metadata.setOpenNowSupportedRestaurants(result.getOpenNowSupportedRestaurants());
        metadata.setOpenNowUnsupportedRestaurants(result.getOpenNowUnsupportedRestaurants());
        metadata.setOpenNowUnsupportedRestaurantIds(result.getOpenNowUnsupportedRestaurantIds());
        metadata.setOpenNowFilteredOut(result.getOpenNowFilteredOut());
        metadata.setPriceFilterApplied(result.isPriceFilterApplied());
        metadata.setMinimumVotesApplied(result.isMinimumVotesApplied());
        metadata.setPage(executionRequest.page());
        metadata.setPageSize(executionRequest.pageSize());
        metadata.setPerRestaurantLimit(executionRequest.perRestaurantLimit());
        metadata.setCoverageStatus(coverage.value());
        metadata.setOnDemandQueued(onDemand.queued());
        metadata.setOnDemandEtaMs(onDemand.etaMs());
        response.setMetadata(metadata);
        return response;
    }

    static void validate(SearchRequest request) {
        if (request == null) {
            throw new InvalidSearchRequestException("request body is required");
        }
        if (request.getEntities() == null) {
            throw new InvalidSearchRequestException("entities is required");
        }
        MapBounds bounds = request.getBounds();
        if (bounds == null) {
            return;
        }
        if (!bounds.isComplete()) {
            throw new InvalidSearchRequestException("bounds requires finite north_east and south_west coordinates");
        }
        validateCoordinate("bounds.north_east", bounds.getNorthEast());
        validateCoordinate("bounds.south_west", bounds.getSouthWest());
        if (bounds.getSouthWest().getLat() > bounds.getNorthEast().getLat()) {
            throw new InvalidSearchRequestException("bounds.south_west.lat must not exceed bounds.north_east.lat");
        }
    }

    private static void validateCoordinate(String field, Coordinate coordinate) {
        double lat = coordinate.getLat();
        double lng = coordinate.getLng();
        if (lat < -90 || lat > 90) {
            throw new InvalidSearchRequestException(field + ".lat must be within [-90, 90]");
        }
        if (lng < -180 || lng > 180) {
            throw new InvalidSearchRequestException(field + ".lng must be within [-180, 180]");
        }
    }
}
