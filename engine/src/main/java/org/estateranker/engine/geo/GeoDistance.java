package org.estateranker.engine.geo;

import org.estateranker.engine.domain.model.GeoPoint;

import java.util.Objects;

/**
 * Great-circle distance on a spherical earth.
 */
public final class GeoDistance {

    static final double EARTH_RADIUS_METERS = 6371000; // mean radius

    private GeoDistance() {
    }

    /**
     * Distance between two points using the Haversine formula.
     *
     * @return distance in METERS
     */
    public static double meters(double lat1, double lon1, double lat2, double lon2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLon = Math.toRadians(lon2 - lon1);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_METERS * c;
    }

    public static double meters(GeoPoint from, GeoPoint to) {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        return meters(from.getLatitude(), from.getLongitude(), to.getLatitude(), to.getLongitude());
    }
}
