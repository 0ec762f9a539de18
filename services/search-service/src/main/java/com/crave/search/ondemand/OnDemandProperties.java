package com.crave.search.ondemand;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "on-demand")
public class OnDemandProperties {
    private boolean enabled = true;
    private int maxPerBatch = 5;
    private int maxImmediateWaiting = 3;
    private int maxImmediateActive = 1;
    private int maxProcessingBacklog = 10;
    private long instantCooldownMs = 5 * 60 * 1000L;
    private int estimatedJobMinutes = 120;
    private int staleLeaseMinutes = 360;
    private long backlogSweepIntervalMs = 10 * 60 * 1000L;
    private int placeholderRetentionDays = 30;
    private String placeholderCleanupCron = "0 30 3 * * *";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getMaxPerBatch() {
        return maxPerBatch;
    }

    public void setMaxPerBatch(int maxPerBatch) {
        this.maxPerBatch = maxPerBatch;
    }

    public int getMaxImmediateWaiting() {
        return maxImmediateWaiting;
    }

    public void setMaxImmediateWaiting(int maxImmediateWaiting) {
        this.maxImmediateWaiting = maxImmediateWaiting;
    }

    public int getMaxImmediateActive() {
        return maxImmediateActive;
    }

    public void setMaxImmediateActive(int maxImmediateActive) {
        this.maxImmediateActive = maxImmediateActive;
    }

    public int getMaxProcessingBacklog() {
        return maxProcessingBacklog;
    }

    public void setMaxProcessingBacklog(int maxProcessingBacklog) {
        this.maxProcessingBacklog = maxProcessingBacklog;
    }

    public long getInstantCooldownMs() {
        return instantCooldownMs;
    }

    public void setInstantCooldownMs(long instantCooldownMs) {
        this.instantCooldownMs = instantCooldownMs;
    }

    public int getEstimatedJobMinutes() {
        return estimatedJobMinutes;
    }

    public void setEstimatedJobMinutes(int estimatedJobMinutes) {
        this.estimatedJobMinutes = estimatedJobMinutes;
    }

    public long getEstimatedJobMs() {
        return Math.max(1, estimatedJobMinutes) * 60_000L;
    }

    public int getStaleLeaseMinutes() {
        return staleLeaseMinutes;
    }

    public void setStaleLeaseMinutes(int staleLeaseMinutes) {
        this.staleLeaseMinutes = staleLeaseMinutes;
    }

    public long getStaleLeaseMs() {
        return Math.max(1, staleLeaseMinutes) * 60_000L;
    }

    public long getBacklogSweepIntervalMs() {
        return backlogSweepIntervalMs;
    }

    public void setBacklogSweepIntervalMs(long backlogSweepIntervalMs) {
        this.backlogSweepIntervalMs = backlogSweepIntervalMs;
    }

    public int getPlaceholderRetentionDays() {
        return placeholderRetentionDays;
    }

    public void setPlaceholderRetentionDays(int placeholderRetentionDays) {
        this.placeholderRetentionDays = placeholderRetentionDays;
    }

    public String getPlaceholderCleanupCron() {
        return placeholderCleanupCron;
    }

    public void setPlaceholderCleanupCron(String placeholderCleanupCron) {
        this.placeholderCleanupCron = placeholderCleanupCron;
    }
}
