package com.crave.search.status;

import com.crave.search.api.dto.Coordinate;
import com.crave.search.api.dto.RestaurantStatusPreview;
import com.crave.search.api.dto.RestaurantStatusRequest;
import com.crave.search.execution.RowValues;
import com.crave.search.hours.GeoDistance;
import com.crave.search.hours.HoursSource;
import com.crave.search.hours.OperatingHoursEvaluator;
import com.crave.search.service.InvalidSearchRequestException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.springframework.stereotype.Service;

/**
 * Operating status of a handful of restaurants, evaluated the same way search results are.
 */
@Service
public class RestaurantStatusService {
    public static final int MAX_RESTAURANT_IDS = 50;

    private final RestaurantStatusRepository statusRepository;
    private final OperatingHoursEvaluator evaluator;
    private final ObjectMapper objectMapper;

    public RestaurantStatusService(
        RestaurantStatusRepository statusRepository,
        OperatingHoursEvaluator evaluator,
        ObjectMapper objectMapper
    ) {
        this.statusRepository = statusRepository;
        this.evaluator = evaluator;
        this.objectMapper = objectMapper;
    }

    public List<RestaurantStatusPreview> preview(RestaurantStatusRequest request, Instant now) {
        List<String> ids = normalizeIds(request == null ? null : request.getRestaurantIds());
        if (ids.isEmpty()) {
            return new ArrayList<>();
        }
        Coordinate userLocation = request.getUserLocation();
        if (userLocation != null && !userLocation.isFinite()) {
            userLocation = null;
        }

        Map<String, RestaurantStatusPreview> byId = new LinkedHashMap<>();
        for (Map<String, Object> row : statusRepository.findDisplayLocations(ids)) {
            RestaurantStatusPreview preview = new RestaurantStatusPreview();
            preview.setRestaurantId(RowValues.string(row, "restaurant_id"));
            preview.setName(RowValues.string(row, "restaurant_name"));
            preview.setLocationId(RowValues.string(row, "location_id"));
            preview.setOperatingStatus(evaluator.evaluate(
                HoursSource.resolve(
                    RowValues.json(objectMapper, row, "hours"),
                    row.get("utc_offset_minutes"),
                    RowValues.string(row, "time_zone"),
                    RowValues.json(objectMapper, row, "restaurant_metadata")
                ),
                now
            ));
            Double latitude = RowValues.optionalDouble(row, "latitude");
            Double longitude = RowValues.optionalDouble(row, "longitude");
            if (userLocation != null && latitude != null && longitude != null) {
                preview.setDistanceMiles(GeoDistance.miles(userLocation.getLat(), userLocation.getLng(), latitude, longitude));
            }
            String city = RowValues.string(row, "city");
            preview.setLocality(city != null ? city : RowValues.string(row, "region"));
            byId.put(preview.getRestaurantId(), preview);
        }

        // Keep the caller's order; unknown IDs are dropped.
        List<RestaurantStatusPreview> previews = new ArrayList<>(byId.size());
        for (String id : ids) {
            RestaurantStatusPreview preview = byId.get(id);
            if (preview != null) {
                previews.add(preview);
            }
        }
        return previews;
    }

    static List<String> normalizeIds(List<String> raw) {
        Set<String> ids = new LinkedHashSet<>();
        if (raw == null) {
            return new ArrayList<>(ids);
        }
        for (String value : raw) {
            if (value == null || value.isBlank()) {
                continue;
            }
            String trimmed = value.trim().toLowerCase();
            try {
                UUID.fromString(trimmed);
            } catch (IllegalArgumentException e) {
                throw new InvalidSearchRequestException("restaurant_ids must be UUIDs: " + value);
            }
            ids.add(trimmed);
        }
        if (ids.size() > MAX_RESTAURANT_IDS) {
            throw new InvalidSearchRequestException("restaurant_ids accepts at most " + MAX_RESTAURANT_IDS + " ids");
        }
        return new ArrayList<>(ids);
    }
}
