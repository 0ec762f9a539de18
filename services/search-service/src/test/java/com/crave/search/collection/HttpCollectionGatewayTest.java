package com.crave.search.collection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.net.SocketTimeoutException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

class HttpCollectionGatewayTest {
    private RestTemplate restTemplate;
    private MockRestServiceServer server;
    private RestTemplate introspectionRestTemplate;
    private MockRestServiceServer introspectionServer;
    private CollectionServiceProperties properties;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        introspectionRestTemplate = new RestTemplate();
        introspectionServer = MockRestServiceServer.bindTo(introspectionRestTemplate).build();
        properties = new CollectionServiceProperties();
        properties.setBaseUrl("http://collector:8091/");
    }

    @Test
    void postsKeywordCycleAndParsesPerTermResults() {
        HttpCollectionGateway gateway = gateway(new CircuitBreaker(3, 30000));
        server.expect(requestTo("http://collector:8091/keyword-search/cycles"))
            .andExpect(method(HttpMethod.POST))
            .andExpect(jsonPath("$.area").value("austin"))
            .andExpect(jsonPath("$.targets[0].entity_name").value("birria tacos"))
            .andExpect(jsonPath("$.targets[0].is_new_entity").value(true))
            .andExpect(jsonPath("$.sort_plan[1].time_filter").value("month"))
            .andExpect(jsonPath("$.sort_plan[0].time_filter").doesNotExist())
            .andRespond(withSuccess(
                "{\"search_results\":{\"birria tacos\":{\"posts\":0,\"comments\":0}},"
                    + "\"processing_results\":{\"birria tacos\":{\"success\":true,\"connections_created\":2}}}",
                MediaType.APPLICATION_JSON
            ));

        PriorityTarget target = new PriorityTarget();
        target.setEntityName("birria tacos");
        target.setNewEntity(true);
        CollectionCycleResult result = gateway.executeKeywordSearchCycle(
            "austin",
            List.of(target),
            List.of(SortPlanEntry.of("new"), new SortPlanEntry("top", "month", "year", 20))
        );

        assertThat(result.succeededFor("birria tacos")).isTrue();
        assertThat(result.succeededFor("pho")).isFalse();
        server.verify();
    }

    @Test
    void readsQueueDepth() {
        HttpCollectionGateway gateway = gateway(new CircuitBreaker(3, 30000));
        introspectionServer.expect(requestTo("http://collector:8091/keyword-search/queue-depth"))
            .andExpect(method(HttpMethod.GET))
            .andRespond(withSuccess(
                "{\"execution\":{\"waiting\":2,\"active\":1,\"delayed\":4},\"processing\":{\"waiting\":3}}",
                MediaType.APPLICATION_JSON
            ));

        QueueDepth depth = gateway.getQueueDepth();

        assertThat(depth.getExecution().getWaiting()).isEqualTo(2);
        assertThat(depth.getExecution().getDelayed()).isEqualTo(4);
        assertThat(depth.getProcessing().getActive()).isZero();
        assertThat(depth.getBacklog()).isEqualTo(6);
    }

    @Test
    void opensCircuitAfterConsecutiveFailures() {
        HttpCollectionGateway gateway = gateway(new CircuitBreaker(2, 60000));
        introspectionServer.expect(ExpectedCount.twice(), requestTo("http://collector:8091/keyword-search/queue-depth"))
            .andRespond(withServerError());

        assertThatThrownBy(gateway::getQueueDepth)
            .isInstanceOf(CollectionUnavailableException.class)
            .hasMessageContaining("500");
        assertThatThrownBy(gateway::getQueueDepth).isInstanceOf(CollectionUnavailableException.class);
        assertThatThrownBy(gateway::getQueueDepth)
            .isInstanceOf(CollectionUnavailableException.class)
            .hasMessage("Collection service circuit open");
        introspectionServer.verify();
    }

    @Test
    void queueDepthTimeoutSurfacesAsUnavailableWithoutTouchingCycleClient() {
        HttpCollectionGateway gateway = gateway(new CircuitBreaker(3, 30000));
        introspectionServer.expect(requestTo("http://collector:8091/keyword-search/queue-depth"))
            .andRespond(withException(new SocketTimeoutException("Read timed out")));

        assertThatThrownBy(gateway::getQueueDepth)
            .isInstanceOf(CollectionUnavailableException.class)
            .hasMessage("Collection service unavailable");
        introspectionServer.verify();
        server.verify();
    }

    @Test
    void configuredSortsComeFromProperties() {
        properties.setSorts(List.of("new", "top"));
        HttpCollectionGateway gateway = gateway(new CircuitBreaker(3, 30000));

        assertThat(gateway.configuredSorts()).containsExactly("new", "top");
    }

    private HttpCollectionGateway gateway(CircuitBreaker circuitBreaker) {
        return new HttpCollectionGateway(restTemplate, introspectionRestTemplate, properties, circuitBreaker);
    }
}
