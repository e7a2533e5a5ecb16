package org.estateranker.engine.domain.model;

import java.util.Objects;

/**
 * Distance tiers, in meters, for proximity to a geocoded target or avoid location.
 * <p>
 * For a target: within {@code inner} is very close, within {@code outer} is close,
 * beyond {@code limit} is too far, anything between is neutral.
 * For an avoid location only {@code inner} (hard hit) and {@code outer} (soft hit) apply.
 */
public final class LocationTiers {

    private final double inner;
    private final double outer;
    private final double limit;

    private LocationTiers(double inner, double outer, double limit) {
        if (inner <= 0 || outer < inner || limit < outer) {
            throw new IllegalArgumentException(String.format(
                    "location tiers must satisfy 0 < inner <= outer <= limit (got %.0f, %.0f, %.0f)",
                    inner, outer, limit));
        }
        this.inner = inner;
        this.outer = outer;
        this.limit = limit;
    }

    public static LocationTiers of(double inner, double outer, double limit) {
        return new LocationTiers(inner, outer, limit);
    }

    /**
     * Default target tiers: 2 km very close, 5 km close, 10 km far limit.
     */
    public static LocationTiers targetDefaults() {
        return new LocationTiers(2000, 5000, 10000);
    }

    /**
     * Default avoid tiers: 2 km hard hit, 5 km soft hit.
     */
    public static LocationTiers avoidDefaults() {
        return new LocationTiers(2000, 5000, 5000);
    }

    public double getInner() {
        return inner;
    }

    public double getOuter() {
        return outer;
    }

    public double getLimit() {
        return limit;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LocationTiers)) {
            return false;
        }
        LocationTiers that = (LocationTiers) o;
        return Double.compare(that.inner, inner) == 0
                && Double.compare(that.outer, outer) == 0
                && Double.compare(that.limit, limit) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(inner, outer, limit);
    }

    @Override
    public String toString() {
        return String.format("LocationTiers{%.0f/%.0f/%.0f}", inner, outer, limit);
    }
}
