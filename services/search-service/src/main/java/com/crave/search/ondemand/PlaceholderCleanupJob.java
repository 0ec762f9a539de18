package com.crave.search.ondemand;

import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class PlaceholderCleanupJob {
    private static final Logger logger = LoggerFactory.getLogger(PlaceholderCleanupJob.class);

    private final PlaceholderEntityRepository placeholderRepository;
    private final OnDemandProperties properties;

    public PlaceholderCleanupJob(PlaceholderEntityRepository placeholderRepository, OnDemandProperties properties) {
        this.placeholderRepository = placeholderRepository;
        this.properties = properties;
    }

    @Scheduled(cron = "${on-demand.placeholder-cleanup-cron:0 30 3 * * *}")
    public void scheduledCleanup() {
        try {
            runCleanup(Instant.now());
        } catch (RuntimeException e) {
            logger.error("on-demand placeholder cleanup failed error={}", e.getMessage(), e);
        }
    }

    public int runCleanup(Instant now) {
        Instant cutoff = now.minus(Duration.ofDays(Math.max(1, properties.getPlaceholderRetentionDays())));
        int deleted = placeholderRepository.deleteStalePlaceholders(cutoff);
        if (deleted > 0) {
            logger.info("pruned on-demand placeholder restaurants deleted={} cutoff={}", deleted, cutoff);
        }
        return deleted;
    }
}
