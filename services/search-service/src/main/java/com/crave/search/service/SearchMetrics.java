package com.crave.search.service;

import com.crave.search.plan.QueryFormat;
import io.micrometer.core.instrument.Metrics;
import java.util.concurrent.TimeUnit;
import org.springframework.stereotype.Component;

@Component
public class SearchMetrics {

    public void recordSuccess(QueryFormat format, boolean openNow, long durationMs, int foodResults, int openNowFilteredOut) {
        String formatTag = format.value();
        Metrics.counter("crave.search.requests.total", "format", formatTag, "open_now", String.valueOf(openNow))
            .increment();
        Metrics.timer("crave.search.duration", "format", formatTag, "outcome", "success")
            .record(durationMs, TimeUnit.MILLISECONDS);
        Metrics.summary("crave.search.food.results", "format", formatTag).record(foodResults);
        if (openNowFilteredOut > 0) {
            Metrics.counter("crave.search.open_now.filtered.total").increment(openNowFilteredOut);
        }
    }

    public void recordFailure(QueryFormat format, String error, long durationMs) {
        String formatTag = format == null ? "unknown" : format.value();
        Metrics.counter("crave.search.errors.total", "format", formatTag, "error", error).increment();
        Metrics.timer("crave.search.duration", "format", formatTag, "outcome", "error")
            .record(durationMs, TimeUnit.MILLISECONDS);
    }
}
