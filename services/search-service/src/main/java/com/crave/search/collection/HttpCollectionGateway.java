package com.crave.search.collection;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

@Component
public class HttpCollectionGateway implements CollectionGateway {
    private static final Logger logger = LoggerFactory.getLogger(HttpCollectionGateway.class);

    private final RestTemplate restTemplate;
    private final RestTemplate introspectionRestTemplate;
    private final CollectionServiceProperties properties;
    private final CircuitBreaker circuitBreaker;

    public HttpCollectionGateway(
        @Qualifier("collectionRestTemplate") RestTemplate restTemplate,
        @Qualifier("collectionIntrospectionRestTemplate") RestTemplate introspectionRestTemplate,
        CollectionServiceProperties properties,
        CircuitBreaker collectionCircuitBreaker
    ) {
        this.restTemplate = restTemplate;
        this.introspectionRestTemplate = introspectionRestTemplate;
        this.properties = properties;
        this.circuitBreaker = collectionCircuitBreaker;
    }

    @Override
    public CollectionCycleResult executeKeywordSearchCycle(
        String area,
        List<PriorityTarget> targets,
        List<SortPlanEntry> sortPlan
    ) {
        CollectionCycleRequest request = new CollectionCycleRequest();
        request.setArea(area);
        request.setTargets(targets);
        request.setSortPlan(sortPlan);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<CollectionCycleRequest> entity = new HttpEntity<>(request, headers);

        CollectionCycleResult result = call(
            "keyword cycle",
            () -> restTemplate.exchange(
                buildUrl("/keyword-search/cycles"),
                HttpMethod.POST,
                entity,
                CollectionCycleResult.class
            )
        );
        return result == null ? new CollectionCycleResult() : result;
    }

    @Override
    public QueueDepth getQueueDepth() {
        QueueDepth depth = call(
            "queue depth",
            () -> introspectionRestTemplate.exchange(
                buildUrl("/keyword-search/queue-depth"),
                HttpMethod.GET,
                null,
                QueueDepth.class
            )
        );
        if (depth == null) {
            throw new CollectionUnavailableException("Collection service returned an empty queue depth");
        }
        return depth;
    }

    @Override
    public List<String> configuredSorts() {
        List<String> sorts = properties.getSorts();
        return sorts == null ? List.of() : List.copyOf(sorts);
    }

    private <T> T call(String operation, Exchange<T> exchange) {
        if (!circuitBreaker.tryAcquire()) {
            throw new CollectionUnavailableException("Collection service circuit open");
        }
        try {
            ResponseEntity<T> response = exchange.run();
            circuitBreaker.onSuccess();
            return response.getBody();
        } catch (ResourceAccessException e) {
            circuitBreaker.onFailure();
            logger.warn("collection service unreachable operation={} error={}", operation, e.getMessage());
            throw new CollectionUnavailableException("Collection service unavailable", e);
        } catch (HttpStatusCodeException e) {
            circuitBreaker.onFailure();
            logger.warn("collection service error operation={} status={}", operation, e.getStatusCode());
            throw new CollectionUnavailableException("Collection service error: " + e.getStatusCode(), e);
        }
    }

    private String buildUrl(String path) {
        String base = properties.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + path;
    }

    @FunctionalInterface
    private interface Exchange<T> {
        ResponseEntity<T> run();
    }
}
