package com.crave.search.execution;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SearchExecutionConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService searchExecutor(@Value("${search.execution.pool-size:8}") int poolSize) {
        // four statements per search run side by side
        return Executors.newFixedThreadPool(Math.max(4, poolSize));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService onDemandExecutor(@Value("${on-demand.worker-pool-size:2}") int poolSize) {
        return Executors.newFixedThreadPool(Math.max(1, poolSize));
    }
}
