package org.estateranker.engine.domain.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Structured search preferences extracted from a free-form query.
 * POI keys that are not in the catalog are tolerated and ignored at scoring time.
 */
public final class Intent {

    private static final Intent EMPTY = new Builder().build();

    private final Set<String> assetTypes;
    private final Set<String> mustHave;
    private final Set<String> niceToHave;
    private final Set<String> avoidPoi;
    private final PetPreference petPreference;
    private final PriceRange priceRange;
    private final String targetLocation;
    private final String avoidLocation;

    private Intent(Builder builder) {
        this.assetTypes = copyOf(builder.assetTypes);
        this.mustHave = copyOf(builder.mustHave);
        this.niceToHave = copyOf(builder.niceToHave);
        this.avoidPoi = copyOf(builder.avoidPoi);
        this.petPreference = builder.petPreference != null ? builder.petPreference : PetPreference.UNSPECIFIED;
        this.priceRange = builder.priceRange != null ? builder.priceRange : PriceRange.unbounded();
        this.targetLocation = blankToNull(builder.targetLocation);
        this.avoidLocation = blankToNull(builder.avoidLocation);
    }

    /**
     * Intent with no constraints at all.
     */
    public static Intent empty() {
        return EMPTY;
    }

    public Set<String> getAssetTypes() {
        return assetTypes;
    }

    public Set<String> getMustHave() {
        return mustHave;
    }

    public Set<String> getNiceToHave() {
        return niceToHave;
    }

    public Set<String> getAvoidPoi() {
        return avoidPoi;
    }

    public PetPreference getPetPreference() {
        return petPreference;
    }

    public PriceRange getPriceRange() {
        return priceRange;
    }

    /**
     * Free-text place the user wants to be near, resolved by an external geocoder. May be null.
     */
    public String getTargetLocation() {
        return targetLocation;
    }

    /**
     * Free-text place the user wants to stay away from. May be null.
     */
    public String getAvoidLocation() {
        return avoidLocation;
    }

    private static Set<String> copyOf(Collection<String> values) {
        Set<String> copy = new LinkedHashSet<>();
        for (String value : values) {
            if (value != null && !value.trim().isEmpty()) {
                copy.add(value.trim());
            }
        }
        return Collections.unmodifiableSet(copy);
    }

    private static String blankToNull(String value) {
        return value == null || value.trim().isEmpty() ? null : value.trim();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Intent)) {
            return false;
        }
        Intent that = (Intent) o;
        return assetTypes.equals(that.assetTypes)
                && mustHave.equals(that.mustHave)
                && niceToHave.equals(that.niceToHave)
                && avoidPoi.equals(that.avoidPoi)
                && petPreference == that.petPreference
                && priceRange.equals(that.priceRange)
                && Objects.equals(targetLocation, that.targetLocation)
                && Objects.equals(avoidLocation, that.avoidLocation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(assetTypes, mustHave, niceToHave, avoidPoi, petPreference, priceRange,
                targetLocation, avoidLocation);
    }

    @Override
    public String toString() {
        return "Intent{" +
                "assetTypes=" + assetTypes +
                ", mustHave=" + mustHave +
                ", niceToHave=" + niceToHave +
                ", avoidPoi=" + avoidPoi +
                ", pet=" + petPreference +
                ", price=" + priceRange +
                (targetLocation != null ? ", target='" + targetLocation + '\'' : "") +
                (avoidLocation != null ? ", avoid='" + avoidLocation + '\'' : "") +
                '}';
    }

    /**
     * Builder for Intent.
     */
    public static final class Builder {
        private Collection<String> assetTypes = Collections.emptySet();
        private Collection<String> mustHave = Collections.emptySet();
        private Collection<String> niceToHave = Collections.emptySet();
        private Collection<String> avoidPoi = Collections.emptySet();
        private PetPreference petPreference = PetPreference.UNSPECIFIED;
        private PriceRange priceRange = PriceRange.unbounded();
        private String targetLocation;
        private String avoidLocation;

        public Builder assetTypes(Collection<String> assetTypes) {
            this.assetTypes = assetTypes != null ? assetTypes : Collections.emptySet();
            return this;
        }

        public Builder mustHave(Collection<String> mustHave) {
            this.mustHave = mustHave != null ? mustHave : Collections.emptySet();
            return this;
        }

        public Builder niceToHave(Collection<String> niceToHave) {
            this.niceToHave = niceToHave != null ? niceToHave : Collections.emptySet();
            return this;
        }

        public Builder avoidPoi(Collection<String> avoidPoi) {
            this.avoidPoi = avoidPoi != null ? avoidPoi : Collections.emptySet();
            return this;
        }

        public Builder petPreference(PetPreference petPreference) {
            this.petPreference = petPreference;
            return this;
        }

        public Builder priceRange(PriceRange priceRange) {
            this.priceRange = priceRange;
            return this;
        }

        public Builder targetLocation(String targetLocation) {
            this.targetLocation = targetLocation;
            return this;
        }

        public Builder avoidLocation(String avoidLocation) {
            this.avoidLocation = avoidLocation;
            return this;
        }

        public Intent build() {
            return new Intent(this);
        }
    }
}
