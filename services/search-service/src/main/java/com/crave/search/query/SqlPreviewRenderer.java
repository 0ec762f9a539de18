package com.crave.search.query;

import java.util.List;

/**
 * Inlines bind values into a parameterized statement for display. The output is never executed.
 */
public final class SqlPreviewRenderer {
    private SqlPreviewRenderer() {
    }

    public static String render(SqlFragment fragment) {
        return render(fragment.getSql(), fragment.getParams());
    }

    public static String render(String sql, List<Object> params) {
        StringBuilder out = new StringBuilder(sql.length() + params.size() * 8);
        int index = 0;
        boolean inLiteral = false;
        for (int i = 0; i < sql.length(); i++) {
            char c = sql.charAt(i);
            if (c == '\'') {
                inLiteral = !inLiteral;
            }
            if (c == '?' && !inLiteral && index < params.size()) {
                out.append(literal(params.get(index++)));
            } else {
                out.append(c);
            }
        }
        return out.toString().trim();
    }

    static String literal(Object value) {
        if (value == null) {
            return "NULL";
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        return "'" + value.toString().replace("'", "''") + "'";
    }
}
