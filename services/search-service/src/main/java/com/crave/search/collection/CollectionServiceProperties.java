package com.crave.search.collection;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "collection-service")
public class CollectionServiceProperties {
    private String baseUrl = "http://localhost:8091";
    private int timeoutMs = 2000;
    private int cycleTimeoutMs = 600000;
    private int failureThreshold = 3;
    private long openMs = 30000;
    private List<String> sorts = new ArrayList<>(List.of("new", "top", "relevance"));

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public int getTimeoutMs() {
        return timeoutMs;
    }

    public void setTimeoutMs(int timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    public int getCycleTimeoutMs() {
        return cycleTimeoutMs;
    }

    public void setCycleTimeoutMs(int cycleTimeoutMs) {
        this.cycleTimeoutMs = cycleTimeoutMs;
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public void setFailureThreshold(int failureThreshold) {
        this.failureThreshold = failureThreshold;
    }

    public long getOpenMs() {
        return openMs;
    }

    public void setOpenMs(long openMs) {
        this.openMs = openMs;
    }

    public List<String> getSorts() {
        return sorts;
    }

    public void setSorts(List<String> sorts) {
        this.sorts = sorts;
    }
}
