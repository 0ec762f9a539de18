package com.crave.search.collection;

import java.time.Duration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
@EnableConfigurationProperties(CollectionServiceProperties.class)
public class CollectionConfig {

    /**
     * Keyword cycles run for minutes, so the read timeout is the cycle timeout rather than the
     * introspection timeout.
     */
    @Bean
    public RestTemplate collectionRestTemplate(RestTemplateBuilder builder, CollectionServiceProperties properties) {
        return builder
            .setConnectTimeout(Duration.ofMillis(properties.getTimeoutMs()))
            .setReadTimeout(Duration.ofMillis(Math.max(properties.getTimeoutMs(), properties.getCycleTimeoutMs())))
            .build();
    }

    /**
     * Queue-depth reads happen on the search path and must give up quickly.
     */
    @Bean
    public RestTemplate collectionIntrospectionRestTemplate(
        RestTemplateBuilder builder,
        CollectionServiceProperties properties
    ) {
        return builder
            .setConnectTimeout(Duration.ofMillis(properties.getTimeoutMs()))
            .setReadTimeout(Duration.ofMillis(properties.getTimeoutMs()))
            .build();
    }

    @Bean
    public CircuitBreaker collectionCircuitBreaker(CollectionServiceProperties properties) {
        return new CircuitBreaker(properties.getFailureThreshold(), properties.getOpenMs());
    }
}
