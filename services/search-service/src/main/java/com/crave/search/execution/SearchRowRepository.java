package com.crave.search.execution;

import com.crave.search.query.SqlFragment;
import java.util.List;
import java.util.Map;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class SearchRowRepository {
    private final JdbcTemplate jdbcTemplate;

    public SearchRowRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public List<Map<String, Object>> fetchRows(SqlFragment statement) {
        return jdbcTemplate.queryForList(statement.getSql(), statement.paramArray());
    }

    public Map<String, Object> fetchCounts(SqlFragment statement) {
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(statement.getSql(), statement.paramArray());
        return rows.isEmpty() ? Map.of() : rows.get(0);
    }
}
