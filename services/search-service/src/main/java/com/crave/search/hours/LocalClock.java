package com.crave.search.hours;

import java.time.DayOfWeek;

/**
 * Venue-local weekday and minute of day at the evaluation instant.
 */
final class LocalClock {
    private final DayOfWeek day;
    private final int minuteOfDay;
    private final boolean zoneApplied;

    LocalClock(DayOfWeek day, int minuteOfDay, boolean zoneApplied) {
        this.day = day;
        this.minuteOfDay = minuteOfDay;
        this.zoneApplied = zoneApplied;
    }

    DayOfWeek getDay() {
        return day;
    }

    int getMinuteOfDay() {
        return minuteOfDay;
    }

    boolean isZoneApplied() {
        return zoneApplied;
    }
}
