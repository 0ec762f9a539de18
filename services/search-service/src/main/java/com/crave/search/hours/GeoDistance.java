package com.crave.search.hours;

/**
 * Great-circle distance helpers.
 */
public final class GeoDistance {
    private static final double EARTH_RADIUS_MILES = 3958.8;
    private static final double EARTH_RADIUS_KM = 6371.0;

    private GeoDistance() {
    }

    public static Double miles(double fromLat, double fromLng, double toLat, double toLng) {
        return haversine(fromLat, fromLng, toLat, toLng, EARTH_RADIUS_MILES);
    }

    public static Double kilometers(double fromLat, double fromLng, double toLat, double toLng) {
        return haversine(fromLat, fromLng, toLat, toLng, EARTH_RADIUS_KM);
    }

    private static Double haversine(double fromLat, double fromLng, double toLat, double toLng, double radius) {
        if (!Double.isFinite(toLat) || !Double.isFinite(toLng) || !Double.isFinite(fromLat) || !Double.isFinite(fromLng)) {
            return null;
        }
        double lat1 = Math.toRadians(fromLat);
        double lat2 = Math.toRadians(toLat);
        double dLat = lat2 - lat1;
        double dLng = Math.toRadians(toLng) - Math.toRadians(fromLng);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
            + Math.cos(lat1) * Math.cos(lat2) * Math.sin(dLng / 2) * Math.sin(dLng / 2);
        double distance = radius * 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return Double.isFinite(distance) ? distance : null;
    }
}
