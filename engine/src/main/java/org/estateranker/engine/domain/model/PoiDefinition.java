package org.estateranker.engine.domain.model;

import java.util.Objects;

/**
 * Immutable catalog entry for one point-of-interest key.
 */
public final class PoiDefinition {

    public static final String POI_TYPE_RAPID_TRANSIT = "rapid_transit";

    private final String key;
    private final double radiusMeters;
    private final double weight;
    private final ProximityCurve curve;
    private final String category;
    private final String displayName;
    private final String poiType;

    private PoiDefinition(Builder builder) {
        this.key = Objects.requireNonNull(builder.key, "key must not be null");
        if (builder.radiusMeters <= 0) {
            throw new IllegalArgumentException("radius must be positive for POI " + builder.key);
        }
        if (builder.weight < 0) {
            throw new IllegalArgumentException("weight must not be negative for POI " + builder.key);
        }
        this.radiusMeters = builder.radiusMeters;
        this.weight = builder.weight;
        this.curve = builder.curve != null ? builder.curve : ProximityCurve.LINEAR;
        this.category = builder.category;
        this.displayName = builder.displayName != null && !builder.displayName.isEmpty()
                ? builder.displayName
                : builder.key;
        this.poiType = builder.poiType;
    }

    public String getKey() {
        return key;
    }

    public double getRadiusMeters() {
        return radiusMeters;
    }

    public double getWeight() {
        return weight;
    }

    public ProximityCurve getCurve() {
        return curve;
    }

    public String getCategory() {
        return category;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getPoiType() {
        return poiType;
    }

    /**
     * True only for subway/elevated-rail class transit. Conventional rail is never rapid transit.
     */
    public boolean isRapidTransit() {
        return POI_TYPE_RAPID_TRANSIT.equals(poiType);
    }

    /**
     * Proximity factor for a verified distance using this entry's radius and curve.
     */
    public double proximityFactor(double distanceMeters) {
        return curve.factor(distanceMeters, radiusMeters);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PoiDefinition)) {
            return false;
        }
        PoiDefinition that = (PoiDefinition) o;
        return Double.compare(that.radiusMeters, radiusMeters) == 0
                && Double.compare(that.weight, weight) == 0
                && key.equals(that.key)
                && curve == that.curve
                && Objects.equals(category, that.category)
                && displayName.equals(that.displayName)
                && Objects.equals(poiType, that.poiType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, radiusMeters, weight, curve, category, displayName, poiType);
    }

    @Override
    public String toString() {
        return String.format("PoiDefinition{key='%s', radius=%.0fm, weight=%.2f, curve=%s, type=%s}",
                key, radiusMeters, weight, curve, poiType);
    }

    /**
     * Builder for PoiDefinition.
     */
    public static final class Builder {
        private String key;
        private double radiusMeters;
        private double weight;
        private ProximityCurve curve = ProximityCurve.LINEAR;
        private String category;
        private String displayName;
        private String poiType;

        public Builder key(String key) {
            this.key = key;
            return this;
        }

        public Builder radiusMeters(double radiusMeters) {
            this.radiusMeters = radiusMeters;
            return this;
        }

        public Builder weight(double weight) {
            this.weight = weight;
            return this;
        }

        public Builder curve(ProximityCurve curve) {
            this.curve = curve;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder displayName(String displayName) {
            this.displayName = displayName;
            return this;
        }

        public Builder poiType(String poiType) {
            this.poiType = poiType;
            return this;
        }

        public PoiDefinition build() {
            return new PoiDefinition(this);
        }
    }
}
