package org.estateranker.engine.domain.model;

import java.util.Objects;

/**
 * Immutable scoring configuration: POI catalog, weights, hard-constraint toggles,
 * thresholds, location tiers, asset-type mapping and ranking settings.
 * Loaded once and shared read-only; a reload produces a new instance.
 */
public final class ScoringConfig {

    public static final String DEFAULT_LEGACY_RAIL_KEY = "train_station";
    public static final String DEFAULT_VETERINARY_KEY = "veterinary";

    private final PoiCatalog catalog;
    private final ScoringWeights weights;
    private final HardConstraints hardConstraints;
    private final ScoringThresholds thresholds;
    private final LocationTiers targetTiers;
    private final LocationTiers avoidTiers;
    private final AssetTypeMapping assetTypes;
    private final RankingSettings ranking;
    private final String legacyRailKey;
    private final String veterinaryKey;

    private ScoringConfig(Builder builder) {
        this.catalog = Objects.requireNonNull(builder.catalog, "catalog must not be null");
        this.weights = Objects.requireNonNull(builder.weights, "weights must not be null");
        this.hardConstraints = Objects.requireNonNull(builder.hardConstraints, "hardConstraints must not be null");
        this.thresholds = Objects.requireNonNull(builder.thresholds, "thresholds must not be null");
        this.targetTiers = Objects.requireNonNull(builder.targetTiers, "targetTiers must not be null");
        this.avoidTiers = Objects.requireNonNull(builder.avoidTiers, "avoidTiers must not be null");
        this.assetTypes = Objects.requireNonNull(builder.assetTypes, "assetTypes must not be null");
        this.ranking = Objects.requireNonNull(builder.ranking, "ranking must not be null");
        this.legacyRailKey = Objects.requireNonNull(builder.legacyRailKey, "legacyRailKey must not be null");
        this.veterinaryKey = Objects.requireNonNull(builder.veterinaryKey, "veterinaryKey must not be null");
    }

    public PoiCatalog getCatalog() {
        return catalog;
    }

    public ScoringWeights getWeights() {
        return weights;
    }

    public HardConstraints getHardConstraints() {
        return hardConstraints;
    }

    public ScoringThresholds getThresholds() {
        return thresholds;
    }

    public LocationTiers getTargetTiers() {
        return targetTiers;
    }

    public LocationTiers getAvoidTiers() {
        return avoidTiers;
    }

    public AssetTypeMapping getAssetTypes() {
        return assetTypes;
    }

    public RankingSettings getRanking() {
        return ranking;
    }

    /**
     * Catalog key of conventional (non rapid-transit) rail.
     */
    public String getLegacyRailKey() {
        return legacyRailKey;
    }

    public String getVeterinaryKey() {
        return veterinaryKey;
    }

    /**
     * Catalog radius of a key, or the configured default radius for unknown keys.
     */
    public double radiusOf(String poiKey) {
        return catalog.find(poiKey)
                .map(PoiDefinition::getRadiusMeters)
                .orElse(thresholds.getDefaultPoiRadiusMeters());
    }

    /**
     * A builder pre-filled with this configuration, for deriving variants.
     */
    public Builder toBuilder() {
        return new Builder()
                .catalog(catalog)
                .weights(weights)
                .hardConstraints(hardConstraints)
                .thresholds(thresholds)
                .targetTiers(targetTiers)
                .avoidTiers(avoidTiers)
                .assetTypes(assetTypes)
                .ranking(ranking)
                .legacyRailKey(legacyRailKey)
                .veterinaryKey(veterinaryKey);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ScoringConfig)) {
            return false;
        }
        ScoringConfig that = (ScoringConfig) o;
        return catalog.equals(that.catalog)
                && weights.equals(that.weights)
                && hardConstraints.equals(that.hardConstraints)
                && thresholds.equals(that.thresholds)
                && targetTiers.equals(that.targetTiers)
                && avoidTiers.equals(that.avoidTiers)
                && assetTypes.equals(that.assetTypes)
                && ranking.equals(that.ranking)
                && legacyRailKey.equals(that.legacyRailKey)
                && veterinaryKey.equals(that.veterinaryKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(catalog, weights, hardConstraints, thresholds, targetTiers, avoidTiers,
                assetTypes, ranking, legacyRailKey, veterinaryKey);
    }

    @Override
    public String toString() {
        return "ScoringConfig{" +
                "pois=" + catalog.size() +
                ", rapidTransit=" + catalog.getRapidTransitKeys() +
                ", hardConstraints=" + hardConstraints +
                ", targetTiers=" + targetTiers +
                ", ranking=" + ranking +
                '}';
    }

    /**
     * Builder for ScoringConfig. Everything except the catalog has a default.
     */
    public static final class Builder {
        private PoiCatalog catalog = PoiCatalog.empty();
        private ScoringWeights weights = ScoringWeights.defaults();
        private HardConstraints hardConstraints = HardConstraints.defaults();
        private ScoringThresholds thresholds = ScoringThresholds.defaults();
        private LocationTiers targetTiers = LocationTiers.targetDefaults();
        private LocationTiers avoidTiers = LocationTiers.avoidDefaults();
        private AssetTypeMapping assetTypes = AssetTypeMapping.empty();
        private RankingSettings ranking = RankingSettings.defaults();
        private String legacyRailKey = DEFAULT_LEGACY_RAIL_KEY;
        private String veterinaryKey = DEFAULT_VETERINARY_KEY;

        public Builder catalog(PoiCatalog catalog) {
            this.catalog = catalog;
            return this;
        }

        public Builder weights(ScoringWeights weights) {
            this.weights = weights;
            return this;
        }

        public Builder hardConstraints(HardConstraints hardConstraints) {
            this.hardConstraints = hardConstraints;
            return this;
        }

        public Builder thresholds(ScoringThresholds thresholds) {
            this.thresholds = thresholds;
            return this;
        }

        public Builder targetTiers(LocationTiers targetTiers) {
            this.targetTiers = targetTiers;
            return this;
        }

        public Builder avoidTiers(LocationTiers avoidTiers) {
            this.avoidTiers = avoidTiers;
            return this;
        }

        public Builder assetTypes(AssetTypeMapping assetTypes) {
            this.assetTypes = assetTypes;
            return this;
        }

        public Builder ranking(RankingSettings ranking) {
            this.ranking = ranking;
            return this;
        }

        public Builder legacyRailKey(String legacyRailKey) {
            this.legacyRailKey = legacyRailKey;
            return this;
        }

        public Builder veterinaryKey(String veterinaryKey) {
            this.veterinaryKey = veterinaryKey;
            return this;
        }

        public ScoringConfig build() {
            return new ScoringConfig(this);
        }
    }
}
