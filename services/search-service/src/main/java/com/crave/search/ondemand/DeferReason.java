package com.crave.search.ondemand;

public enum DeferReason {
    COOLDOWN_ACTIVE("cooldown_active", false),
    REFRESH_COOLDOWN("refresh_cooldown", false),
    EXECUTION_QUEUE_WAITING("execution_queue_waiting", true),
    EXECUTION_QUEUE_ACTIVE("execution_queue_active", true),
    PROCESSING_QUEUE_BACKLOG("processing_queue_backlog", true),
    SORTS_NOT_DUE("sorts_not_due", false);

    private final String value;
    private final boolean stampsCooldown;

    DeferReason(String value, boolean stampsCooldown) {
        this.value = value;
        this.stampsCooldown = stampsCooldown;
    }

    public String value() {
        return value;
    }

    /** Backpressure deferrals push the next attempt out by the instant cooldown; time-based ones already wait. */
    public boolean stampsCooldown() {
        return stampsCooldown;
    }
}
