package com.crave.search.hours;

/**
 * One opening interval within a day, in minutes since local midnight.
 */
public final class TimeSegment {
    static final TimeSegment EMPTY = new TimeSegment(0, 0, false);

    private final int start;
    private final int end;
    private final boolean crossesMidnight;

    public TimeSegment(int start, int end, boolean crossesMidnight) {
        this.start = start;
        this.end = end;
        this.crossesMidnight = crossesMidnight;
    }

    public static TimeSegment between(int openMinutes, int closeMinutes) {
        return new TimeSegment(openMinutes, closeMinutes, closeMinutes <= openMinutes);
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public boolean isCrossesMidnight() {
        return crossesMidnight;
    }

    boolean coversToday(int minuteOfDay) {
        if (crossesMidnight) {
            return minuteOfDay >= start;
        }
        return minuteOfDay >= start && minuteOfDay < end;
    }

    boolean coversSpillover(int minuteOfDay) {
        return crossesMidnight && minuteOfDay < end;
    }

    int minutesUntilClose(int minuteOfDay, boolean fromPreviousDay) {
        if (crossesMidnight && !fromPreviousDay) {
            return Math.max(OperatingHoursEvaluator.MINUTES_PER_DAY - minuteOfDay + end, 0);
        }
        return Math.max(end - minuteOfDay, 0);
    }

    @Override
    public String toString() {
        return start + "-" + end + (crossesMidnight ? "+1" : "");
    }
}
