package org.estateranker.engine.domain.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Distance and data-quality thresholds used by the assessor and the scorer.
 */
public final class ScoringThresholds {

    public static final double DEFAULT_LEGACY_RAIL_THRESHOLD_M = 2500;
    public static final double DEFAULT_AVOID_RADIUS_FACTOR = 0.6;
    public static final double DEFAULT_PROXIMITY_FLOOR = 0.1;
    public static final double DEFAULT_MISSING_VALUE_THRESHOLD = 90000;
    public static final double DEFAULT_POI_RADIUS_M = 3000;

    private final double legacyRailThresholdMeters;
    private final double avoidRadiusFactor;
    private final double proximityFloor;
    private final double missingValueThreshold;
    private final Set<Double> missingValueSentinels;
    private final double defaultPoiRadiusMeters;

    private ScoringThresholds(Builder builder) {
        if (builder.legacyRailThresholdMeters <= 0) {
            throw new IllegalArgumentException("legacyRailThresholdMeters must be positive");
        }
        if (builder.avoidRadiusFactor <= 0) {
            throw new IllegalArgumentException("avoidRadiusFactor must be positive");
        }
        if (builder.proximityFloor < 0 || builder.proximityFloor > 1) {
            throw new IllegalArgumentException("proximityFloor must be within [0, 1]");
        }
        if (builder.defaultPoiRadiusMeters <= 0) {
            throw new IllegalArgumentException("defaultPoiRadiusMeters must be positive");
        }
        this.legacyRailThresholdMeters = builder.legacyRailThresholdMeters;
        this.avoidRadiusFactor = builder.avoidRadiusFactor;
        this.proximityFloor = builder.proximityFloor;
        this.missingValueThreshold = builder.missingValueThreshold;
        this.missingValueSentinels = Collections.unmodifiableSet(new LinkedHashSet<>(builder.missingValueSentinels));
        this.defaultPoiRadiusMeters = builder.defaultPoiRadiusMeters;
    }

    public static ScoringThresholds defaults() {
        return new Builder().build();
    }

    public double getLegacyRailThresholdMeters() {
        return legacyRailThresholdMeters;
    }

    public double getAvoidRadiusFactor() {
        return avoidRadiusFactor;
    }

    public double getProximityFloor() {
        return proximityFloor;
    }

    public double getMissingValueThreshold() {
        return missingValueThreshold;
    }

    public Set<Double> getMissingValueSentinels() {
        return missingValueSentinels;
    }

    public double getDefaultPoiRadiusMeters() {
        return defaultPoiRadiusMeters;
    }

    /**
     * True when a numeric value is a legacy "far away" sentinel rather than a distance.
     */
    public boolean isMissingSentinel(double value) {
        return value >= missingValueThreshold || missingValueSentinels.contains(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ScoringThresholds)) {
            return false;
        }
        ScoringThresholds that = (ScoringThresholds) o;
        return Double.compare(that.legacyRailThresholdMeters, legacyRailThresholdMeters) == 0
                && Double.compare(that.avoidRadiusFactor, avoidRadiusFactor) == 0
                && Double.compare(that.proximityFloor, proximityFloor) == 0
                && Double.compare(that.missingValueThreshold, missingValueThreshold) == 0
                && Double.compare(that.defaultPoiRadiusMeters, defaultPoiRadiusMeters) == 0
                && missingValueSentinels.equals(that.missingValueSentinels);
    }

    @Override
    public int hashCode() {
        return Objects.hash(legacyRailThresholdMeters, avoidRadiusFactor, proximityFloor,
                missingValueThreshold, missingValueSentinels, defaultPoiRadiusMeters);
    }

    @Override
    public String toString() {
        return "ScoringThresholds{" +
                "legacyRail=" + legacyRailThresholdMeters +
                ", avoidFactor=" + avoidRadiusFactor +
                ", floor=" + proximityFloor +
                ", missingThreshold=" + missingValueThreshold +
                ", sentinels=" + missingValueSentinels +
                '}';
    }

    /**
     * Builder for ScoringThresholds.
     */
    public static final class Builder {
        private double legacyRailThresholdMeters = DEFAULT_LEGACY_RAIL_THRESHOLD_M;
        private double avoidRadiusFactor = DEFAULT_AVOID_RADIUS_FACTOR;
        private double proximityFloor = DEFAULT_PROXIMITY_FLOOR;
        private double missingValueThreshold = DEFAULT_MISSING_VALUE_THRESHOLD;
        private Set<Double> missingValueSentinels = Collections.singleton(99999.0);
        private double defaultPoiRadiusMeters = DEFAULT_POI_RADIUS_M;

        public Builder legacyRailThresholdMeters(double legacyRailThresholdMeters) {
            this.legacyRailThresholdMeters = legacyRailThresholdMeters;
            return this;
        }

        public Builder avoidRadiusFactor(double avoidRadiusFactor) {
            this.avoidRadiusFactor = avoidRadiusFactor;
            return this;
        }

        public Builder proximityFloor(double proximityFloor) {
            this.proximityFloor = proximityFloor;
            return this;
        }

        public Builder missingValueThreshold(double missingValueThreshold) {
            this.missingValueThreshold = missingValueThreshold;
            return this;
        }

        public Builder missingValueSentinels(Set<Double> missingValueSentinels) {
            this.missingValueSentinels = Objects.requireNonNull(missingValueSentinels,
                    "missingValueSentinels must not be null");
            return this;
        }

        public Builder defaultPoiRadiusMeters(double defaultPoiRadiusMeters) {
            this.defaultPoiRadiusMeters = defaultPoiRadiusMeters;
            return this;
        }

        public ScoringThresholds build() {
            return new ScoringThresholds(this);
        }
    }
}
