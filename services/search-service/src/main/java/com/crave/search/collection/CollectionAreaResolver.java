package com.crave.search.collection;

import com.crave.search.api.dto.Coordinate;
import com.crave.search.hours.GeoDistance;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Maps a coordinate to the location key of the nearest active collection area.
 */
@Component
public class CollectionAreaResolver {
    private static final Logger logger = LoggerFactory.getLogger(CollectionAreaResolver.class);

    private final CollectionAreaRepository areaRepository;

    public CollectionAreaResolver(CollectionAreaRepository areaRepository) {
        this.areaRepository = areaRepository;
    }

    public String resolveLocationKey(Coordinate point) {
        if (point == null || !point.isFinite()) {
            return CollectionArea.GLOBAL;
        }
        List<CollectionArea> areas = areaRepository.findActiveWithCenters();
        CollectionArea nearest = null;
        double nearestKm = Double.MAX_VALUE;
        for (CollectionArea area : areas) {
            if (!area.hasCenter() || area.name() == null) {
                continue;
            }
            Double km = GeoDistance.kilometers(point.getLat(), point.getLng(), area.centerLatitude(), area.centerLongitude());
            if (km != null && km < nearestKm) {
                nearestKm = km;
                nearest = area;
            }
        }
        if (nearest == null) {
            logger.debug("no active collection area for lat={} lng={}", point.getLat(), point.getLng());
            return CollectionArea.GLOBAL;
        }
        return CollectionArea.normalizeKey(nearest.name());
    }

}
