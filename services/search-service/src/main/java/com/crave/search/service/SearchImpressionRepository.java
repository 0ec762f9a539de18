package com.crave.search.service;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class SearchImpressionRepository {
    static final String INSERT_SQL = "INSERT INTO search_log (entity_id, entity_type, location_key, query_text, source, "
        + "logged_at) VALUES (?::uuid, ?, ?, ?, ?, ?)";

    private final JdbcTemplate jdbcTemplate;

    public SearchImpressionRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void insertImpressions(List<SearchImpression> impressions, Instant loggedAt) {
        if (impressions.isEmpty()) {
            return;
        }
        Timestamp timestamp = Timestamp.from(loggedAt);
        List<Object[]> batch = new ArrayList<>(impressions.size());
        for (SearchImpression impression : impressions) {
            batch.add(new Object[] {
                impression.entityId(),
                impression.entityType().value(),
                impression.locationKey(),
                impression.queryText(),
                "search",
                timestamp
            });
        }
        jdbcTemplate.batchUpdate(INSERT_SQL, batch);
    }
}
