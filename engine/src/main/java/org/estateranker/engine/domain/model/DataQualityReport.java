package org.estateranker.engine.domain.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * What is verifiably known about one candidate for a given set of POI keys.
 * Available and missing keys are disjoint and together cover every checked key.
 */
public final class DataQualityReport {

    private final String candidateId;
    private final Set<String> availablePoiKeys;
    private final Set<String> missingPoiKeys;
    private final boolean validPrice;
    private final boolean validAssetType;
    private final boolean validLocation;
    private final double qualityScore;
    private final List<String> warnings;

    private DataQualityReport(Builder builder) {
        this.candidateId = Objects.requireNonNull(builder.candidateId, "candidateId must not be null");
        Set<String> missing = new LinkedHashSet<>(builder.missingPoiKeys);
        Set<String> available = new LinkedHashSet<>(builder.availablePoiKeys);
        available.removeAll(missing);
        this.availablePoiKeys = Collections.unmodifiableSet(available);
        this.missingPoiKeys = Collections.unmodifiableSet(missing);
        this.validPrice = builder.validPrice;
        this.validAssetType = builder.validAssetType;
        this.validLocation = builder.validLocation;
        if (builder.qualityScore < 0 || builder.qualityScore > 1) {
            throw new IllegalArgumentException("qualityScore must be within [0, 1]");
        }
        this.qualityScore = builder.qualityScore;
        this.warnings = Collections.unmodifiableList(new ArrayList<>(builder.warnings));
    }

    public String getCandidateId() {
        return candidateId;
    }

    public Set<String> getAvailablePoiKeys() {
        return availablePoiKeys;
    }

    public Set<String> getMissingPoiKeys() {
        return missingPoiKeys;
    }

    public boolean hasValidPrice() {
        return validPrice;
    }

    public boolean hasValidAssetType() {
        return validAssetType;
    }

    public boolean hasValidLocation() {
        return validLocation;
    }

    public double getQualityScore() {
        return qualityScore;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public boolean isPoiAvailable(String poiKey) {
        return availablePoiKeys.contains(poiKey);
    }

    /**
     * True when the key was checked and has no usable value. Missing is not the same as far.
     */
    public boolean isPoiMissing(String poiKey) {
        return missingPoiKeys.contains(poiKey);
    }

    /**
     * Must-have keys with no usable data, in the order given.
     */
    public List<String> missingMustHaves(Collection<String> mustHaveKeys) {
        return mustHaveKeys.stream()
                .filter(missingPoiKeys::contains)
                .collect(Collectors.toList());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DataQualityReport)) {
            return false;
        }
        DataQualityReport that = (DataQualityReport) o;
        return validPrice == that.validPrice
                && validAssetType == that.validAssetType
                && validLocation == that.validLocation
                && Double.compare(that.qualityScore, qualityScore) == 0
                && candidateId.equals(that.candidateId)
                && availablePoiKeys.equals(that.availablePoiKeys)
                && missingPoiKeys.equals(that.missingPoiKeys)
                && warnings.equals(that.warnings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(candidateId, availablePoiKeys, missingPoiKeys, validPrice, validAssetType,
                validLocation, qualityScore, warnings);
    }

    @Override
    public String toString() {
        return String.format("DataQualityReport{id='%s', quality=%.2f, available=%s, missing=%s}",
                candidateId, qualityScore, availablePoiKeys, missingPoiKeys);
    }

    /**
     * Builder for DataQualityReport.
     */
    public static final class Builder {
        private String candidateId;
        private Collection<String> availablePoiKeys = Collections.emptySet();
        private Collection<String> missingPoiKeys = Collections.emptySet();
        private boolean validPrice;
        private boolean validAssetType;
        private boolean validLocation;
        private double qualityScore;
        private List<String> warnings = Collections.emptyList();

        public Builder candidateId(String candidateId) {
            this.candidateId = candidateId;
            return this;
        }

        public Builder availablePoiKeys(Collection<String> availablePoiKeys) {
            this.availablePoiKeys = availablePoiKeys;
            return this;
        }

        public Builder missingPoiKeys(Collection<String> missingPoiKeys) {
            this.missingPoiKeys = missingPoiKeys;
            return this;
        }

        public Builder validPrice(boolean validPrice) {
            this.validPrice = validPrice;
            return this;
        }

        public Builder validAssetType(boolean validAssetType) {
            this.validAssetType = validAssetType;
            return this;
        }

        public Builder validLocation(boolean validLocation) {
            this.validLocation = validLocation;
            return this;
        }

        public Builder qualityScore(double qualityScore) {
            this.qualityScore = qualityScore;
            return this;
        }

        public Builder warnings(List<String> warnings) {
            this.warnings = warnings;
            return this;
        }

        public DataQualityReport build() {
            return new DataQualityReport(this);
        }
    }
}
