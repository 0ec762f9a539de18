package com.crave.search.hours;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public final class WeeklySchedule {
    private final Map<DayOfWeek, List<TimeSegment>> days = new EnumMap<>(DayOfWeek.class);

    void put(DayOfWeek day, List<TimeSegment> segments) {
        if (segments == null) {
            return;
        }
        List<TimeSegment> usable = new ArrayList<>(segments.size());
        for (TimeSegment segment : segments) {
            if (segment != TimeSegment.EMPTY) {
                usable.add(segment);
            }
        }
        if (!usable.isEmpty()) {
            days.put(day, List.copyOf(usable));
        }
    }

    public List<TimeSegment> segmentsFor(DayOfWeek day) {
        List<TimeSegment> segments = days.get(day);
        return segments == null ? Collections.emptyList() : segments;
    }

    public boolean isEmpty() {
        return days.isEmpty();
    }
}
