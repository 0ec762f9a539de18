package com.crave.search.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A piece of SQL using positional {@code ?} placeholders together with its bind values in order.
 */
public final class SqlFragment {
    public static final SqlFragment TRUE = raw("TRUE");
    public static final SqlFragment FALSE = raw("FALSE");
    public static final SqlFragment EMPTY = raw("");

    private final String sql;
    private final List<Object> params;

    private SqlFragment(String sql, List<Object> params) {
        this.sql = sql;
        this.params = params;
    }

    public static SqlFragment raw(String sql) {
        return new SqlFragment(sql, List.of());
    }

    public static SqlFragment of(String sql, Object... params) {
        List<Object> values = new ArrayList<>(params.length);
        Collections.addAll(values, params);
        return new SqlFragment(sql, Collections.unmodifiableList(values));
    }

    public static SqlFragment join(List<SqlFragment> fragments, String separator) {
        StringBuilder sql = new StringBuilder();
        List<Object> params = new ArrayList<>();
        for (int i = 0; i < fragments.size(); i++) {
            if (i > 0) {
                sql.append(separator);
            }
            sql.append(fragments.get(i).sql);
            params.addAll(fragments.get(i).params);
        }
        return new SqlFragment(sql.toString(), Collections.unmodifiableList(params));
    }

    /**
     * Clauses wrapped in parentheses and joined with AND; no clauses means {@code TRUE}.
     */
    public static SqlFragment and(List<SqlFragment> clauses) {
        if (clauses.isEmpty()) {
            return TRUE;
        }
        if (clauses.size() == 1) {
            return clauses.get(0);
        }
        List<SqlFragment> wrapped = new ArrayList<>(clauses.size());
        for (SqlFragment clause : clauses) {
            wrapped.add(clause.parenthesized());
        }
        return join(wrapped, " AND ");
    }

    public static Builder builder() {
        return new Builder();
    }

    public SqlFragment parenthesized() {
        return new SqlFragment("(" + sql + ")", params);
    }

    public String getSql() {
        return sql;
    }

    public List<Object> getParams() {
        return params;
    }

    public Object[] paramArray() {
        return params.toArray();
    }

    public boolean isEmpty() {
        return sql.isEmpty();
    }

    @Override
    public String toString() {
        return sql;
    }

    public static final class Builder {
        private final StringBuilder sql = new StringBuilder();
        private final List<Object> params = new ArrayList<>();

        public Builder append(String text) {
            sql.append(text);
            return this;
        }

        public Builder append(SqlFragment fragment) {
            sql.append(fragment.sql);
            params.addAll(fragment.params);
            return this;
        }

        public Builder param(Object value) {
            sql.append('?');
            params.add(value);
            return this;
        }

        public SqlFragment build() {
            return new SqlFragment(sql.toString(), Collections.unmodifiableList(new ArrayList<>(params)));
        }
    }
}
