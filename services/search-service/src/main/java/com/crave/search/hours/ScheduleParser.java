package com.crave.search.hours;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a loosely structured hours document into a {@link WeeklySchedule}. Each accepted shape has its own
 * parser; all of them share the value-level parsing of a single day.
 */
public final class ScheduleParser {
    private static final Pattern RANGE_PATTERN =
        Pattern.compile("(\\d{1,2}:?\\d{0,2}\\s?(am|pm)?)[^\\d]+(\\d{1,2}:?\\d{0,2}\\s?(am|pm)?)", Pattern.CASE_INSENSITIVE);
    private static final Pattern TIME_PATTERN = Pattern.compile("(\\d{1,2})(?::(\\d{2}))?\\s*(am|pm)?");
    private static final Set<String> METADATA_KEYS = Set.of("timezone", "time_zone", "tz", "utc_offset_minutes", "status");
    private static final String[] OPEN_KEYS = {"open", "start", "opens"};
    private static final String[] CLOSE_KEYS = {"close", "end", "closes"};
    private static final String[] ENTRY_DAY_KEYS = {"day", "weekday"};
    private static final String[] ENTRY_VALUE_KEYS = {"value", "hours", "range"};

    private ScheduleParser() {
    }

    /**
     * @return the parsed schedule, or null when no day carries a usable segment
     */
    public static WeeklySchedule parse(JsonNode hours) {
        WeeklySchedule schedule;
        switch (ScheduleShape.of(hours)) {
            case DAY_MAP:
                schedule = parseDayMap(hours);
                break;
            case ENTRY_LIST:
                schedule = parseEntryList(hours);
                break;
            case UNIFORM_TEXT:
                schedule = parseUniformText(hours.asText());
                break;
            default:
                return null;
        }
        return schedule.isEmpty() ? null : schedule;
    }

    static WeeklySchedule parseDayMap(JsonNode hours) {
        WeeklySchedule schedule = new WeeklySchedule();
        Iterator<Map.Entry<String, JsonNode>> fields = hours.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (METADATA_KEYS.contains(field.getKey().toLowerCase(Locale.ROOT))) {
                continue;
            }
            DayOfWeek day = dayFromName(field.getKey());
            if (day != null) {
                schedule.put(day, parseValue(field.getValue()));
            }
        }
        return schedule;
    }

    static WeeklySchedule parseEntryList(JsonNode hours) {
        WeeklySchedule schedule = new WeeklySchedule();
        for (JsonNode entry : hours) {
            if (entry == null || !entry.isObject()) {
                continue;
            }
            JsonNode dayNode = firstPresent(entry, ENTRY_DAY_KEYS);
            DayOfWeek day = dayNode != null && dayNode.isTextual() ? dayFromName(dayNode.asText()) : null;
            if (day == null) {
                continue;
            }
            JsonNode value = firstPresent(entry, ENTRY_VALUE_KEYS);
            schedule.put(day, parseValue(value == null ? entry : value));
        }
        return schedule;
    }

    static WeeklySchedule parseUniformText(String text) {
        WeeklySchedule schedule = new WeeklySchedule();
        List<TimeSegment> segments = parseRange(text);
        for (DayOfWeek day : DayOfWeek.values()) {
            schedule.put(day, segments);
        }
        return schedule;
    }

    static List<TimeSegment> parseValue(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return Collections.emptyList();
        }
        if (value.isTextual()) {
            return parseRange(value.asText());
        }
        if (value.isArray()) {
            List<TimeSegment> segments = new ArrayList<>();
            for (JsonNode item : value) {
                segments.addAll(parseValue(item));
            }
            return segments;
        }
        if (value.isObject()) {
            JsonNode open = firstPresent(value, OPEN_KEYS);
            JsonNode close = firstPresent(value, CLOSE_KEYS);
            if (open != null && open.isTextual() && close != null && close.isTextual()) {
                return List.of(segment(open.asText(), close.asText()));
            }
        }
        return Collections.emptyList();
    }

    static List<TimeSegment> parseRange(String text) {
        if (text == null || text.isEmpty()) {
            return Collections.emptyList();
        }
        Matcher matcher = RANGE_PATTERN.matcher(text);
        if (!matcher.find()) {
            return Collections.emptyList();
        }
        return List.of(segment(matcher.group(1), matcher.group(3)));
    }

    static TimeSegment segment(String openRaw, String closeRaw) {
        Integer open = parseTime(openRaw);
        Integer close = parseTime(closeRaw);
        if (open == null || close == null) {
            return TimeSegment.EMPTY;
        }
        return TimeSegment.between(open, close);
    }

    static Integer parseTime(String raw) {
        if (raw == null) {
            return null;
        }
        Matcher matcher = TIME_PATTERN.matcher(raw.trim().toLowerCase(Locale.ROOT));
        if (!matcher.find()) {
            return null;
        }
        int hour = Integer.parseInt(matcher.group(1));
        int minutes = matcher.group(2) == null ? 0 : Integer.parseInt(matcher.group(2));
        String period = matcher.group(3);
        if ("pm".equals(period) && hour < 12) {
            hour += 12;
        } else if ("am".equals(period) && hour == 12) {
            hour = 0;
        }
        return hour * 60 + minutes;
    }

    static DayOfWeek dayFromName(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (DayOfWeek day : DayOfWeek.values()) {
            if (normalized.startsWith(day.name().toLowerCase(Locale.ROOT))) {
                return day;
            }
        }
        return null;
    }

    private static JsonNode firstPresent(JsonNode node, String[] keys) {
        for (String key : keys) {
            JsonNode value = node.get(key);
            if (value != null && !value.isNull()) {
                return value;
            }
        }
        return null;
    }
}
