package com.crave.search.hours;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decides whether a venue is open at a given instant and, if not, when it opens next.
 *
 * <p>A {@code null} result means the status could not be determined (no usable schedule or no way to
 * resolve local time). Callers must keep that distinct from "closed".
 */
@Component
public class OperatingHoursEvaluator {
    static final int MINUTES_PER_DAY = 24 * 60;
    private static final Logger logger = LoggerFactory.getLogger(OperatingHoursEvaluator.class);

    public OperatingStatus evaluate(HoursSource source, Instant reference) {
        if (source == null || reference == null) {
            return null;
        }
        WeeklySchedule schedule = ScheduleParser.parse(source.getHours());
        if (schedule == null) {
            return null;
        }
        LocalClock clock = resolveLocalClock(source, reference);
        if (clock == null) {
            return null;
        }

        int minute = clock.getMinuteOfDay();
        for (TimeSegment segment : schedule.segmentsFor(clock.getDay())) {
            if (segment.coversToday(minute)) {
                return OperatingStatus.openUntil(formatMinutes(segment.getEnd()), segment.minutesUntilClose(minute, false));
            }
        }
        for (TimeSegment segment : schedule.segmentsFor(clock.getDay().minus(1))) {
            if (segment.coversSpillover(minute)) {
                return OperatingStatus.openUntil(formatMinutes(segment.getEnd()), segment.minutesUntilClose(minute, true));
            }
        }
        return OperatingStatus.closed(findNextOpen(schedule, clock));
    }

    LocalClock resolveLocalClock(HoursSource source, Instant reference) {
        String zone = source.resolveTimeZone();
        if (zone != null) {
            try {
                ZonedDateTime local = reference.atZone(ZoneId.of(zone));
                return new LocalClock(local.getDayOfWeek(), local.getHour() * 60 + local.getMinute(), true);
            } catch (DateTimeException e) {
                logger.debug("Unrecognized time zone, falling back to utc offset timezone={} error={}", zone, e.getMessage());
            }
        }
        Double offsetMinutes = source.resolveUtcOffsetMinutes();
        if (offsetMinutes != null) {
            ZonedDateTime shifted = reference.plusSeconds(Math.round(offsetMinutes * 60)).atZone(ZoneOffset.UTC);
            return new LocalClock(shifted.getDayOfWeek(), shifted.getHour() * 60 + shifted.getMinute(), false);
        }
        return null;
    }

    /**
     * Earliest opening after now, up to the same weekday next week.
     */
    private String findNextOpen(WeeklySchedule schedule, LocalClock clock) {
        for (int offset = 0; offset <= 7; offset++) {
            DayOfWeek day = clock.getDay().plus(offset);
            List<TimeSegment> segments = new ArrayList<>(schedule.segmentsFor(day));
            segments.sort(Comparator.comparingInt(TimeSegment::getStart));
            for (TimeSegment segment : segments) {
                if (offset == 0 && segment.getStart() <= clock.getMinuteOfDay()) {
                    continue;
                }
                String time = formatMinutes(segment.getStart());
                String label = dayLabel(day, offset);
                return label.isEmpty() ? time : time + " " + label;
            }
        }
        return null;
    }

    private static String dayLabel(DayOfWeek day, int offset) {
        if (offset == 0) {
            return "";
        }
        if (offset == 1) {
            return "tomorrow";
        }
        return day.getDisplayName(TextStyle.SHORT, Locale.US);
    }

    /**
     * Minute of day to 12-hour clock text, e.g. {@code 1020 -> "5:00 PM"}.
     */
    public static String formatMinutes(int minutes) {
        int normalized = ((minutes % MINUTES_PER_DAY) + MINUTES_PER_DAY) % MINUTES_PER_DAY;
        int hour = normalized / 60;
        int minute = normalized % 60;
        String period = hour >= 12 ? "PM" : "AM";
        hour = hour % 12;
        if (hour == 0) {
            hour = 12;
        }
        return String.format(Locale.ROOT, "%d:%02d %s", hour, minute, period);
    }
}
