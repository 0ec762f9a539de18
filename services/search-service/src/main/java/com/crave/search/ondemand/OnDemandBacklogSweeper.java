package com.crave.search.ondemand;

import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class OnDemandBacklogSweeper {
    private static final Logger logger = LoggerFactory.getLogger(OnDemandBacklogSweeper.class);

    private final OnDemandAdmissionController admissionController;
    private final OnDemandProperties properties;

    public OnDemandBacklogSweeper(OnDemandAdmissionController admissionController, OnDemandProperties properties) {
        this.admissionController = admissionController;
        this.properties = properties;
    }

    @Scheduled(
        fixedDelayString = "${on-demand.backlog-sweep-interval-ms:600000}",
        initialDelayString = "${on-demand.backlog-sweep-initial-delay-ms:60000}"
    )
    public void sweep() {
        if (!properties.isEnabled()) {
            return;
        }
        Instant now = Instant.now();
        try {
            admissionController.releaseStaleLeases(now);
        } catch (RuntimeException e) {
            logger.warn("on_demand_stale_lease_release_failed error={}", e.getMessage());
        }
        try {
            int queued = admissionController.sweepBacklog(now);
            if (queued > 0) {
                logger.info("on_demand_backlog_sweep queued={}", queued);
            }
        } catch (RuntimeException e) {
            logger.warn("on_demand_backlog_sweep_failed error={}", e.getMessage());
        }
    }
}
