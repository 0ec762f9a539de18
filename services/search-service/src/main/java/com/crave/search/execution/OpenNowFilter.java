package com.crave.search.execution;

import com.crave.search.hours.OperatingStatus;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Drops rows whose restaurant is known to be closed. Rows without a determinable status are excluded and
 * reported as unsupported; if no row had a status the input is returned untouched.
 */
public final class OpenNowFilter {
    private OpenNowFilter() {
    }

    public static Outcome apply(List<Map<String, Object>> rows, Map<String, RestaurantContext> contexts) {
        List<Map<String, Object>> kept = new ArrayList<>();
        Set<String> unsupportedIds = new LinkedHashSet<>();
        int supported = 0;
        int unsupported = 0;
        for (Map<String, Object> row : rows) {
            String restaurantId = RowValues.string(row, "restaurant_id");
            RestaurantContext context = restaurantId == null ? null : contexts.get(restaurantId);
            OperatingStatus status = context == null ? null : context.getOperatingStatus();
            if (status == null) {
                unsupported++;
                if (restaurantId != null) {
                    unsupportedIds.add(restaurantId);
                }
                continue;
            }
            supported++;
            if (status.isOpen()) {
                kept.add(row);
            }
        }
        if (supported == 0) {
            return new Outcome(rows, false, 0, unsupported, unsupportedIds);
        }
        return new Outcome(kept, true, supported, unsupported, unsupportedIds);
    }

    public static final class Outcome {
        private final List<Map<String, Object>> rows;
        private final boolean applied;
        private final int supportedCount;
        private final int unsupportedCount;
        private final Set<String> unsupportedIds;

        Outcome(
            List<Map<String, Object>> rows,
            boolean applied,
            int supportedCount,
            int unsupportedCount,
            Set<String> unsupportedIds
        ) {
            this.rows = rows;
            this.applied = applied;
            this.supportedCount = supportedCount;
            this.unsupportedCount = unsupportedCount;
            this.unsupportedIds = unsupportedIds;
        }

        public List<Map<String, Object>> getRows() {
            return rows;
        }

        public boolean isApplied() {
            return applied;
        }

        public int getSupportedCount() {
            return supportedCount;
        }

        public int getUnsupportedCount() {
            return unsupportedCount;
        }

        public Set<String> getUnsupportedIds() {
            return unsupportedIds;
        }
    }
}
