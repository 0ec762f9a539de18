package com.crave.search.collection;

import com.crave.search.execution.RowValues;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class CollectionAreaRepository {
    private final JdbcTemplate jdbcTemplate;

    public CollectionAreaRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public CollectionArea findActiveByName(String name) {
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(
            "SELECT name, safe_interval_days, center_latitude, center_longitude FROM collection_areas "
                + "WHERE LOWER(name) = LOWER(?) AND is_active = true LIMIT 1",
            name
        );
        return rows.isEmpty() ? null : toArea(rows.get(0));
    }

    public List<CollectionArea> findActiveWithCenters() {
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(
            "SELECT name, safe_interval_days, center_latitude, center_longitude FROM collection_areas "
                + "WHERE is_active = true AND center_latitude IS NOT NULL AND center_longitude IS NOT NULL"
        );
        List<CollectionArea> areas = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            areas.add(toArea(row));
        }
        return areas;
    }

    private static CollectionArea toArea(Map<String, Object> row) {
        return new CollectionArea(
            RowValues.string(row, "name"),
            RowValues.doubleOrZero(row, "safe_interval_days"),
            RowValues.optionalDouble(row, "center_latitude"),
            RowValues.optionalDouble(row, "center_longitude")
        );
    }
}
