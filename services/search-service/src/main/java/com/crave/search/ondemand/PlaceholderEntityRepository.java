package com.crave.search.ondemand;

import com.crave.search.collection.CollectionArea;
import com.crave.search.execution.RowValues;
import com.crave.search.plan.EntityScope;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Entity lookups and placeholder creation for requests that collected data for a term with no entity yet.
 */
@Repository
public class PlaceholderEntityRepository {
    static final String ORIGIN_ON_DEMAND = "on_demand";

    private final JdbcTemplate jdbcTemplate;

    public PlaceholderEntityRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public boolean exists(String entityId) {
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(
            "SELECT entity_id FROM core_entities WHERE entity_id = ?::uuid",
            entityId
        );
        return !rows.isEmpty();
    }

    /** Restaurant names are scoped to a location key; other entity types are global. */
    public String findIdByName(String name, EntityScope type, String locationKey) {
        List<Map<String, Object>> rows;
        if (type == EntityScope.RESTAURANT) {
            rows = jdbcTemplate.queryForList(
                "SELECT entity_id FROM core_entities WHERE type = ? AND LOWER(name) = LOWER(?) AND location_key = ? "
                    + "LIMIT 1",
                type.value(),
                name,
                locationKey
            );
        } else {
            rows = jdbcTemplate.queryForList(
                "SELECT entity_id FROM core_entities WHERE type = ? AND LOWER(name) = LOWER(?) LIMIT 1",
                type.value(),
                name
            );
        }
        return rows.isEmpty() ? null : RowValues.string(rows.get(0), "entity_id");
    }

    public String createPlaceholder(String name, EntityScope type, String locationKey, String alias, Instant createdAt) {
        boolean restaurant = type == EntityScope.RESTAURANT;
        Timestamp timestamp = Timestamp.from(createdAt);
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(
            "INSERT INTO core_entities (name, type, location_key, aliases, restaurant_attributes, "
                + "restaurant_quality_score, general_praise_upvotes, restaurant_metadata, created_at, updated_at) "
                + "VALUES (?, ?, ?, ARRAY[?]::text[], ARRAY[]::uuid[], ?, ?, ?::jsonb, ?, ?) RETURNING entity_id",
            name,
            type.value(),
            restaurant ? locationKey : CollectionArea.GLOBAL,
            alias,
            restaurant ? 0 : null,
            restaurant ? 0 : null,
            restaurant ? "{\"origin\":\"" + ORIGIN_ON_DEMAND + "\"}" : null,
            timestamp,
            timestamp
        );
        return rows.isEmpty() ? null : RowValues.string(rows.get(0), "entity_id");
    }

    /** Deletes on-demand restaurant placeholders created before the cutoff that never gained a connection. */
    public int deleteStalePlaceholders(Instant cutoff) {
        return jdbcTemplate.update(
            "DELETE FROM core_entities e WHERE e.type = 'restaurant' "
                + "AND e.restaurant_metadata->>'origin' = ? "
                + "AND e.created_at < ? "
                + "AND NOT EXISTS (SELECT 1 FROM core_connections c WHERE c.restaurant_id = e.entity_id)",
            ORIGIN_ON_DEMAND,
            Timestamp.from(cutoff)
        );
    }
}
