package org.estateranker.engine.domain.model;

import java.util.Locale;

/**
 * Shape of the mapping from a verified POI distance to a [0, 1] proximity factor.
 */
public enum ProximityCurve {

    /** factor = 1 - d/r */
    LINEAR,

    /** factor = (1 - d/r)^2, rewards being very close more steeply. */
    EXPONENTIAL;

    /**
     * Compute the proximity factor for a distance within the given radius.
     * Distances beyond the radius yield 0, negative distances are treated as 0 m.
     *
     * @param distanceMeters verified distance to the POI
     * @param radiusMeters catalog radius, must be positive
     * @return factor in [0, 1], non-increasing in distance
     */
    public double factor(double distanceMeters, double radiusMeters) {
        if (radiusMeters <= 0 || distanceMeters > radiusMeters) {
            return 0.0;
        }
        double remaining = 1.0 - (Math.max(0.0, distanceMeters) / radiusMeters);
        if (this == EXPONENTIAL) {
            return remaining * remaining;
        }
        return remaining;
    }

    /**
     * Parse a curve name leniently. Unknown or missing names fall back to LINEAR.
     */
    public static ProximityCurve fromName(String name) {
        if (name == null) {
            return LINEAR;
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (ProximityCurve curve : values()) {
            if (curve.name().equals(normalized)) {
                return curve;
            }
        }
        return LINEAR;
    }
}
