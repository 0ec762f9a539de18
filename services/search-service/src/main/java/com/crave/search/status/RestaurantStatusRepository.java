package com.crave.search.status;

import com.crave.search.query.SearchQueryBuilder;
import com.crave.search.query.SqlFragment;
import java.util.List;
import java.util.Map;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class RestaurantStatusRepository {
    private final JdbcTemplate jdbcTemplate;

    public RestaurantStatusRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * One row per restaurant: its primary location, else the most recently updated one.
     */
    public List<Map<String, Object>> findDisplayLocations(List<String> restaurantIds) {
        SqlFragment membership = SearchQueryBuilder.uuidMembership("r.entity_id", restaurantIds);
        SqlFragment statement = SqlFragment.builder()
            .append("SELECT DISTINCT ON (r.entity_id) r.entity_id AS restaurant_id, r.name AS restaurant_name, ")
            .append("r.restaurant_metadata, rl.location_id, rl.latitude, rl.longitude, rl.city, rl.region, ")
            .append("rl.hours, rl.utc_offset_minutes, rl.time_zone ")
            .append("FROM core_entities r ")
            .append("LEFT JOIN core_restaurant_locations rl ON rl.restaurant_id = r.entity_id ")
            .append("WHERE r.type = 'restaurant' AND ")
            .append(membership)
            .append(" ORDER BY r.entity_id, rl.is_primary DESC NULLS LAST, rl.updated_at DESC NULLS LAST, rl.location_id ASC")
            .build();
        return jdbcTemplate.queryForList(statement.getSql(), statement.paramArray());
    }
}
