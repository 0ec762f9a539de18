package com.crave.search.api;

import com.crave.search.api.dto.ErrorResponse;
import com.crave.search.api.dto.PlanResponse;
import com.crave.search.api.dto.RestaurantStatusPreview;
import com.crave.search.api.dto.RestaurantStatusRequest;
import com.crave.search.api.dto.SearchRequest;
import com.crave.search.api.dto.SearchResponse;
import com.crave.search.execution.SearchStoreException;
import com.crave.search.service.InvalidSearchRequestException;
import com.crave.search.service.SearchService;
import com.crave.search.status.RestaurantStatusService;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class SearchController {
    private static final Logger logger = LoggerFactory.getLogger(SearchController.class);

    private final SearchService searchService;
    private final RestaurantStatusService statusService;

    public SearchController(SearchService searchService, RestaurantStatusService statusService) {
        this.searchService = searchService;
        this.statusService = statusService;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }

    @PostMapping("/search")
    public ResponseEntity<?> search(
        @RequestBody(required = false) SearchRequest request,
        @RequestHeader(value = "x-trace-id", required = false) String traceIdHeader,
        @RequestHeader(value = "x-request-id", required = false) String requestIdHeader,
        @RequestHeader(value = "traceparent", required = false) String traceparent
    ) {
        String traceId = resolveTraceId(traceIdHeader, traceparent);
        String requestId = normalizeOrGenerate(requestIdHeader);

        if (request == null) {
            return ResponseEntity.badRequest().body(
                new ErrorResponse("bad_request", "request body is required", traceId, requestId)
            );
        }

        try {
            SearchResponse response = searchService.search(request, traceId, requestId);
            return ResponseEntity.ok(response);
        } catch (InvalidSearchRequestException e) {
            return ResponseEntity.badRequest().body(
                new ErrorResponse("bad_request", e.getMessage(), traceId, requestId)
            );
        } catch (SearchStoreException e) {
            return storeUnavailable(traceId, requestId);
        } catch (Exception e) {
            logger.error("search_failed request_id={} trace_id={}", requestId, traceId, e);
            return internalError(traceId, requestId);
        }
    }

    @PostMapping("/search/plan")
    public ResponseEntity<?> plan(
        @RequestBody(required = false) SearchRequest request,
        @RequestHeader(value = "x-trace-id", required = false) String traceIdHeader,
        @RequestHeader(value = "x-request-id", required = false) String requestIdHeader,
        @RequestHeader(value = "traceparent", required = false) String traceparent
    ) {
        String traceId = resolveTraceId(traceIdHeader, traceparent);
        String requestId = normalizeOrGenerate(requestIdHeader);

        if (request == null) {
            return ResponseEntity.badRequest().body(
                new ErrorResponse("bad_request", "request body is required", traceId, requestId)
            );
        }

        try {
            PlanResponse response = searchService.buildPlanResponse(request);
            return ResponseEntity.ok(response);
        } catch (InvalidSearchRequestException e) {
            return ResponseEntity.badRequest().body(
                new ErrorResponse("bad_request", e.getMessage(), traceId, requestId)
            );
        } catch (Exception e) {
            logger.error("plan_failed request_id={} trace_id={}", requestId, traceId, e);
            return internalError(traceId, requestId);
        }
    }

    @PostMapping("/restaurants/status")
    public ResponseEntity<?> restaurantStatus(
        @RequestBody(required = false) RestaurantStatusRequest request,
        @RequestHeader(value = "x-trace-id", required = false) String traceIdHeader,
        @RequestHeader(value = "x-request-id", required = false) String requestIdHeader,
        @RequestHeader(value = "traceparent", required = false) String traceparent
    ) {
        String traceId = resolveTraceId(traceIdHeader, traceparent);
        String requestId = normalizeOrGenerate(requestIdHeader);

        if (request == null) {
            return ResponseEntity.badRequest().body(
                new ErrorResponse("bad_request", "request body is required", traceId, requestId)
            );
        }

        try {
            List<RestaurantStatusPreview> previews = statusService.preview(request, Instant.now());
            return ResponseEntity.ok(previews);
        } catch (InvalidSearchRequestException e) {
            return ResponseEntity.badRequest().body(
                new ErrorResponse("bad_request", e.getMessage(), traceId, requestId)
            );
        } catch (DataAccessException e) {
            logger.error("restaurant_status_store_failed request_id={} error={}", requestId, e.getMessage());
            return storeUnavailable(traceId, requestId);
        } catch (Exception e) {
            logger.error("restaurant_status_failed request_id={} trace_id={}", requestId, traceId, e);
            return internalError(traceId, requestId);
        }
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleInvalidJson(HttpMessageNotReadableException e, HttpServletRequest request) {
        String traceId = normalizeOrGenerate(request.getHeader("x-trace-id"));
        String requestId = normalizeOrGenerate(request.getHeader("x-request-id"));
        return ResponseEntity.badRequest().body(
            new ErrorResponse("bad_request", "invalid JSON", traceId, requestId)
        );
    }

    private static ResponseEntity<ErrorResponse> storeUnavailable(String traceId, String requestId) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(
            new ErrorResponse("store_unavailable", "Search store is unavailable", true, traceId, requestId)
        );
    }

    private static ResponseEntity<ErrorResponse> internalError(String traceId, String requestId) {
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(
            new ErrorResponse("internal_error", "Unexpected error", traceId, requestId)
        );
    }

    private String resolveTraceId(String headerValue, String traceparent) {
        String normalized = normalize(headerValue);
        if (normalized != null) {
            return normalized;
        }
        String fromTraceparent = extractTraceId(traceparent);
        if (fromTraceparent != null) {
            return fromTraceparent;
        }
        return UUID.randomUUID().toString();
    }

    private String normalizeOrGenerate(String value) {
        String normalized = normalize(value);
        return normalized != null ? normalized : UUID.randomUUID().toString();
    }

    private String normalize(String value) {
        if (value != null && !value.trim().isEmpty()) {
            return value.trim();
        }
        return null;
    }

    private String extractTraceId(String traceparent) {
        if (traceparent == null || traceparent.isBlank()) {
            return null;
        }
        String[] parts = traceparent.trim().split("-");
        if (parts.length != 4) {
            return null;
        }
        return parts[1];
    }
}
