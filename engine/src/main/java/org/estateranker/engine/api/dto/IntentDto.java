package org.estateranker.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.estateranker.engine.domain.model.Intent;
import org.estateranker.engine.domain.model.PetPreference;
import org.estateranker.engine.domain.model.PriceRange;

import java.util.List;

/**
 * DTO for a parsed search intent as produced by the intent-extraction step.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class IntentDto {

    @JsonProperty("asset_types")
    private List<String> assetTypes;

    @JsonProperty("must_have")
    private List<String> mustHave;

    @JsonProperty("nice_to_have")
    private List<String> niceToHave;

    @JsonProperty("avoid_poi")
    private List<String> avoidPoi;

    @JsonProperty("pet_friendly")
    private Boolean petFriendly;

    @JsonProperty("price_range")
    private PriceRangeDto priceRange;

    @JsonProperty("target_location")
    private String targetLocation;

    @JsonProperty("avoid_location")
    private String avoidLocation;

    // Getters and Setters
    public List<String> getAssetTypes() {
        return assetTypes;
    }

    public void setAssetTypes(List<String> assetTypes) {
        this.assetTypes = assetTypes;
    }

    public List<String> getMustHave() {
        return mustHave;
    }

    public void setMustHave(List<String> mustHave) {
        this.mustHave = mustHave;
    }

    public List<String> getNiceToHave() {
        return niceToHave;
    }

    public void setNiceToHave(List<String> niceToHave) {
        this.niceToHave = niceToHave;
    }

    public List<String> getAvoidPoi() {
        return avoidPoi;
    }

    public void setAvoidPoi(List<String> avoidPoi) {
        this.avoidPoi = avoidPoi;
    }

    public Boolean getPetFriendly() {
        return petFriendly;
    }

    public void setPetFriendly(Boolean petFriendly) {
        this.petFriendly = petFriendly;
    }

    public PriceRangeDto getPriceRange() {
        return priceRange;
    }

    public void setPriceRange(PriceRangeDto priceRange) {
        this.priceRange = priceRange;
    }

    public String getTargetLocation() {
        return targetLocation;
    }

    public void setTargetLocation(String targetLocation) {
        this.targetLocation = targetLocation;
    }

    public String getAvoidLocation() {
        return avoidLocation;
    }

    public void setAvoidLocation(String avoidLocation) {
        this.avoidLocation = avoidLocation;
    }

    /**
     * Convert to the domain intent. Absent lists read as empty.
     */
    public Intent toIntent() {
        return new Intent.Builder()
                .assetTypes(assetTypes)
                .mustHave(mustHave)
                .niceToHave(niceToHave)
                .avoidPoi(avoidPoi)
                .petPreference(PetPreference.fromBoolean(petFriendly))
                .priceRange(priceRange != null ? priceRange.toPriceRange() : PriceRange.unbounded())
                .targetLocation(targetLocation)
                .avoidLocation(avoidLocation)
                .build();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class PriceRangeDto {
        @JsonProperty("min")
        private Double min;

        @JsonProperty("max")
        private Double max;

        public Double getMin() {
            return min;
        }

        public void setMin(Double min) {
            this.min = min;
        }

        public Double getMax() {
            return max;
        }

        public void setMax(Double max) {
            this.max = max;
        }

        public PriceRange toPriceRange() {
            return PriceRange.of(min, max);
        }
    }
}
