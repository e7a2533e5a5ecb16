package org.estateranker.engine.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * DTO for the scoring configuration document (scoring-config.json).
 * Every section is optional; absent sections fall back to built-in defaults.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ScoringConfigDocument {

    @JsonProperty("poi_catalog")
    private Map<String, PoiDto> poiCatalog;

    @JsonProperty("weights")
    private Map<String, Double> weights;

    @JsonProperty("hard_constraints")
    private Map<String, Boolean> hardConstraints;

    @JsonProperty("thresholds")
    private ThresholdsDto thresholds;

    @JsonProperty("target_location")
    private TargetLocationDto targetLocation;

    @JsonProperty("avoid_location")
    private AvoidLocationDto avoidLocation;

    @JsonProperty("asset_types")
    private Map<String, List<Integer>> assetTypes;

    @JsonProperty("pet_friendly_asset_ids")
    private List<Integer> petFriendlyAssetIds;

    @JsonProperty("condo_asset_ids")
    private List<Integer> condoAssetIds;

    @JsonProperty("poi_keys")
    private PoiKeysDto poiKeys;

    @JsonProperty("ranking")
    private RankingDto ranking;

    public Map<String, PoiDto> getPoiCatalog() {
        return poiCatalog;
    }

    public Map<String, Double> getWeights() {
        return weights;
    }

    public Map<String, Boolean> getHardConstraints() {
        return hardConstraints;
    }

    public ThresholdsDto getThresholds() {
        return thresholds;
    }

    public TargetLocationDto getTargetLocation() {
        return targetLocation;
    }

    public AvoidLocationDto getAvoidLocation() {
        return avoidLocation;
    }

    public Map<String, List<Integer>> getAssetTypes() {
        return assetTypes;
    }

    public List<Integer> getPetFriendlyAssetIds() {
        return petFriendlyAssetIds;
    }

    public List<Integer> getCondoAssetIds() {
        return condoAssetIds;
    }

    public PoiKeysDto getPoiKeys() {
        return poiKeys;
    }

    public RankingDto getRanking() {
        return ranking;
    }

    /**
     * One POI catalog entry.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class PoiDto {
        @JsonProperty("radius")
        private Double radius;

        @JsonProperty("weight")
        private Double weight;

        @JsonProperty("curve")
        private String curve;

        @JsonProperty("display_name")
        private String displayName;

        @JsonProperty("category")
        private String category;

        @JsonProperty("poi_type")
        private String poiType;

        public Double getRadius() {
            return radius;
        }

        public Double getWeight() {
            return weight;
        }

        public String getCurve() {
            return curve;
        }

        public String getDisplayName() {
            return displayName;
        }

        public String getCategory() {
            return category;
        }

        public String getPoiType() {
            return poiType;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ThresholdsDto {
        @JsonProperty("legacy_rail_threshold_m")
        private Double legacyRailThresholdMeters;

        @JsonProperty("avoid_radius_factor")
        private Double avoidRadiusFactor;

        @JsonProperty("proximity_floor")
        private Double proximityFloor;

        @JsonProperty("missing_value_threshold")
        private Double missingValueThreshold;

        @JsonProperty("missing_value_sentinels")
        private List<Double> missingValueSentinels;

        @JsonProperty("default_poi_radius_m")
        private Double defaultPoiRadiusMeters;

        public Double getLegacyRailThresholdMeters() {
            return legacyRailThresholdMeters;
        }

        public Double getAvoidRadiusFactor() {
            return avoidRadiusFactor;
        }

        public Double getProximityFloor() {
            return proximityFloor;
        }

        public Double getMissingValueThreshold() {
            return missingValueThreshold;
        }

        public List<Double> getMissingValueSentinels() {
            return missingValueSentinels;
        }

        public Double getDefaultPoiRadiusMeters() {
            return defaultPoiRadiusMeters;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class TargetLocationDto {
        @JsonProperty("radius_very_close")
        private Double radiusVeryClose;

        @JsonProperty("radius_close")
        private Double radiusClose;

        @JsonProperty("radius_far_limit")
        private Double radiusFarLimit;

        public Double getRadiusVeryClose() {
            return radiusVeryClose;
        }

        public Double getRadiusClose() {
            return radiusClose;
        }

        public Double getRadiusFarLimit() {
            return radiusFarLimit;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class AvoidLocationDto {
        @JsonProperty("radius_hit_hard")
        private Double radiusHitHard;

        @JsonProperty("radius_hit_soft")
        private Double radiusHitSoft;

        public Double getRadiusHitHard() {
            return radiusHitHard;
        }

        public Double getRadiusHitSoft() {
            return radiusHitSoft;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class PoiKeysDto {
        @JsonProperty("legacy_rail")
        private String legacyRail;

        @JsonProperty("veterinary")
        private String veterinary;

        public String getLegacyRail() {
            return legacyRail;
        }

        public String getVeterinary() {
            return veterinary;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class RankingDto {
        @JsonProperty("weight_structured")
        private Double weightStructured;

        @JsonProperty("weight_semantic")
        private Double weightSemantic;

        @JsonProperty("weight_lifestyle")
        private Double weightLifestyle;

        @JsonProperty("min_final_score")
        private Double minFinalScore;

        @JsonProperty("default_top_n")
        private Integer defaultTopN;

        @JsonProperty("max_pool_size")
        private Integer maxPoolSize;

        @JsonProperty("min_quality_for_inclusion")
        private Double minQualityForInclusion;

        public Double getWeightStructured() {
            return weightStructured;
        }

        public Double getWeightSemantic() {
            return weightSemantic;
        }

        public Double getWeightLifestyle() {
            return weightLifestyle;
        }

        public Double getMinFinalScore() {
            return minFinalScore;
        }

        public Integer getDefaultTopN() {
            return defaultTopN;
        }

        public Integer getMaxPoolSize() {
            return maxPoolSize;
        }

        public Double getMinQualityForInclusion() {
            return minQualityForInclusion;
        }
    }
}
