package com.crave.search.query;

/**
 * Data statement, count statement and a display preview for one side of a search.
 */
public final class CompiledQuery {
    private final SqlFragment data;
    private final SqlFragment count;
    private final String preview;
    private final AppliedFilters appliedFilters;

    public CompiledQuery(SqlFragment data, SqlFragment count, String preview, AppliedFilters appliedFilters) {
        this.data = data;
        this.count = count;
        this.preview = preview;
        this.appliedFilters = appliedFilters;
    }

    public SqlFragment getData() {
        return data;
    }

    public SqlFragment getCount() {
        return count;
    }

    public String getPreview() {
        return preview;
    }

    public AppliedFilters getAppliedFilters() {
        return appliedFilters;
    }
}
