package com.crave.search.execution;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.Array;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Typed reads over the column maps returned by {@code JdbcTemplate.queryForList}.
 */
public final class RowValues {
    private static final Logger logger = LoggerFactory.getLogger(RowValues.class);

    private RowValues() {
    }

    public static String string(Map<String, Object> row, String column) {
        Object value = row.get(column);
        return value == null ? null : value.toString();
    }

    public static Double optionalDouble(Map<String, Object> row, String column) {
        return toOptionalDouble(row.get(column));
    }

    public static double doubleOrZero(Map<String, Object> row, String column) {
        Double value = toOptionalDouble(row.get(column));
        return value == null ? 0d : value;
    }

    public static long longOrZero(Map<String, Object> row, String column) {
        Object value = row.get(column);
        if (value instanceof Number number) {
            return number.longValue();
        }
        Double parsed = toOptionalDouble(value);
        return parsed == null ? 0L : parsed.longValue();
    }

    public static Integer optionalInt(Map<String, Object> row, String column) {
        Double value = toOptionalDouble(row.get(column));
        return value == null ? null : (int) Math.round(value);
    }

    public static boolean bool(Map<String, Object> row, String column) {
        Object value = row.get(column);
        if (value instanceof Boolean flag) {
            return flag;
        }
        return value != null && Boolean.parseBoolean(value.toString());
    }

    public static String isoInstant(Map<String, Object> row, String column) {
        Instant instant = toInstant(row.get(column));
        return instant == null ? null : instant.toString();
    }

    public static Instant toInstant(Object value) {
        if (value instanceof Timestamp timestamp) {
            return timestamp.toInstant();
        }
        if (value instanceof OffsetDateTime dateTime) {
            return dateTime.toInstant();
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        return null;
    }

    public static Double toOptionalDouble(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            double parsed = number.doubleValue();
            return Double.isFinite(parsed) ? parsed : null;
        }
        try {
            double parsed = Double.parseDouble(value.toString().trim());
            return Double.isFinite(parsed) ? parsed : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Postgres arrays arrive as {@link java.sql.Array}; uuid elements are rendered with {@code toString}.
     */
    public static List<String> stringList(Map<String, Object> row, String column) {
        Object value = row.get(column);
        List<String> values = new ArrayList<>();
        if (value == null) {
            return values;
        }
        Object elements = value;
        if (value instanceof Array sqlArray) {
            try {
                elements = sqlArray.getArray();
            } catch (SQLException e) {
                throw new SearchStoreException("Failed to read array column " + column, e);
            }
        }
        if (elements instanceof Object[] array) {
            for (Object element : array) {
                if (element != null) {
                    values.add(element.toString());
                }
            }
        } else if (elements instanceof Collection<?> collection) {
            for (Object element : collection) {
                if (element != null) {
                    values.add(element.toString());
                }
            }
        }
        return values;
    }

    /**
     * json/jsonb columns arrive as driver objects whose {@code toString} is the document text.
     */
    public static JsonNode json(ObjectMapper objectMapper, Map<String, Object> row, String column) {
        Object value = row.get(column);
        if (value == null) {
            return null;
        }
        if (value instanceof JsonNode node) {
            return node;
        }
        if (value instanceof Map<?, ?> || value instanceof Collection<?>) {
            return objectMapper.valueToTree(value);
        }
        String text = value.toString();
        if (text.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            logger.debug("Ignoring unreadable json column column={} error={}", column, e.getOriginalMessage());
            return null;
        }
    }
}
