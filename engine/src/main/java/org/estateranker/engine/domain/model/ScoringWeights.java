package org.estateranker.engine.domain.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable table of named scoring weights.
 * Positive weights are bonuses, negative weights are penalties.
 */
public final class ScoringWeights {

    private final Map<String, Double> values;

    // Positive signals
    public static final String ASSET_TYPE_MATCH = "asset_type_match";
    public static final String MUST_HAVE_POI_BASE = "must_have_poi_base";
    public static final String NICE_TO_HAVE_POI = "nice_to_have_poi";
    public static final String PET_FRIENDLY_EXPLICIT = "pet_friendly_explicit";
    public static final String PET_FRIENDLY_INFERRED = "pet_friendly_inferred";
    public static final String PRICE_IN_RANGE = "price_in_range";
    public static final String AVOID_POI_SUCCESS = "avoid_poi_success";
    public static final String NEAR_VET_BONUS = "near_vet_bonus";

    // Negative signals
    public static final String PRICE_OUT_OF_RANGE = "price_out_of_range";
    public static final String AVOID_POI_FAILURE = "avoid_poi_failure";
    public static final String PET_NOT_ALLOWED_CONDO = "pet_not_allowed_condo";
    public static final String PET_STATUS_UNKNOWN = "pet_status_unknown";
    public static final String PET_NOISE_PENALTY = "pet_noise_penalty";

    // Target location
    public static final String LOCATION_VERY_CLOSE = "location_very_close";
    public static final String LOCATION_CLOSE = "location_close";
    public static final String LOCATION_FAR = "location_far";

    // Avoid location
    public static final String AVOID_LOCATION_HIT_HARD = "avoid_location_hit_hard";
    public static final String AVOID_LOCATION_HIT_SOFT = "avoid_location_hit_soft";
    public static final String AVOID_LOCATION_SUCCESS = "avoid_location_success";

    // Applied instead of disqualification when the matching hard constraint is off
    public static final String ASSET_TYPE_MISMATCH = "asset_type_mismatch";
    public static final String TRANSPORT_MISMATCH = "transport_mismatch";
    public static final String MUST_HAVE_POI_TOO_FAR = "must_have_poi_too_far";

    private static final Map<String, Double> DEFAULTS;

    static {
        Map<String, Double> defaults = new HashMap<>();
        defaults.put(ASSET_TYPE_MATCH, 2.0);
        defaults.put(MUST_HAVE_POI_BASE, 1.5);
        defaults.put(NICE_TO_HAVE_POI, 0.25);
        defaults.put(PET_FRIENDLY_EXPLICIT, 1.5);
        defaults.put(PET_FRIENDLY_INFERRED, 0.5);
        defaults.put(PRICE_IN_RANGE, 0.5);
        defaults.put(AVOID_POI_SUCCESS, 0.3);
        defaults.put(NEAR_VET_BONUS, 0.25);
        defaults.put(PRICE_OUT_OF_RANGE, -3.0);
        defaults.put(AVOID_POI_FAILURE, -5.0);
        defaults.put(PET_NOT_ALLOWED_CONDO, -8.0);
        defaults.put(PET_STATUS_UNKNOWN, -2.0);
        defaults.put(PET_NOISE_PENALTY, -2.0);
        defaults.put(LOCATION_VERY_CLOSE, 3.0);
        defaults.put(LOCATION_CLOSE, 1.5);
        defaults.put(LOCATION_FAR, -2.0);
        defaults.put(AVOID_LOCATION_HIT_HARD, -5.0);
        defaults.put(AVOID_LOCATION_HIT_SOFT, -2.0);
        defaults.put(AVOID_LOCATION_SUCCESS, 0.5);
        defaults.put(ASSET_TYPE_MISMATCH, -10.0);
        defaults.put(TRANSPORT_MISMATCH, -20.0);
        defaults.put(MUST_HAVE_POI_TOO_FAR, -15.0);
        DEFAULTS = Collections.unmodifiableMap(defaults);
    }

    private ScoringWeights(Map<String, Double> values) {
        this.values = Collections.unmodifiableMap(new HashMap<>(values));
    }

    /**
     * Creates weights from a map of overrides. Keys not present keep their default value.
     */
    public static ScoringWeights fromMap(Map<String, Double> overrides) {
        Objects.requireNonNull(overrides, "overrides must not be null");
        Map<String, Double> merged = new HashMap<>(DEFAULTS);
        overrides.forEach((key, value) -> {
            if (key != null && value != null) {
                merged.put(key, value);
            }
        });
        return new ScoringWeights(merged);
    }

    /**
     * Creates the default weight table.
     */
    public static ScoringWeights defaults() {
        return new ScoringWeights(DEFAULTS);
    }

    /**
     * Gets a weight by key.
     */
    public double get(String key) {
        Double value = values.get(key);
        if (value == null) {
            throw new IllegalArgumentException("Unknown weight key: " + key);
        }
        return value;
    }

    /**
     * Gets a weight by key, with a default.
     */
    public double getOrDefault(String key, double defaultValue) {
        return values.getOrDefault(key, defaultValue);
    }

    /**
     * Returns a copy with one weight replaced.
     */
    public ScoringWeights with(String key, double value) {
        Map<String, Double> copy = new HashMap<>(values);
        copy.put(key, value);
        return new ScoringWeights(copy);
    }

    public Map<String, Double> asMap() {
        return values;
    }

    public double getAssetTypeMatch() {
        return get(ASSET_TYPE_MATCH);
    }

    public double getMustHavePoiBase() {
        return get(MUST_HAVE_POI_BASE);
    }

    public double getNiceToHavePoi() {
        return get(NICE_TO_HAVE_POI);
    }

    public double getPetFriendlyExplicit() {
        return get(PET_FRIENDLY_EXPLICIT);
    }

    public double getPetFriendlyInferred() {
        return get(PET_FRIENDLY_INFERRED);
    }

    public double getPriceInRange() {
        return get(PRICE_IN_RANGE);
    }

    public double getAvoidPoiSuccess() {
        return get(AVOID_POI_SUCCESS);
    }

    public double getNearVetBonus() {
        return get(NEAR_VET_BONUS);
    }

    public double getPriceOutOfRange() {
        return get(PRICE_OUT_OF_RANGE);
    }

    public double getAvoidPoiFailure() {
        return get(AVOID_POI_FAILURE);
    }

    public double getPetNotAllowedCondo() {
        return get(PET_NOT_ALLOWED_CONDO);
    }

    public double getPetStatusUnknown() {
        return get(PET_STATUS_UNKNOWN);
    }

    public double getPetNoisePenalty() {
        return get(PET_NOISE_PENALTY);
    }

    public double getLocationVeryClose() {
        return get(LOCATION_VERY_CLOSE);
    }

    public double getLocationClose() {
        return get(LOCATION_CLOSE);
    }

    public double getLocationFar() {
        return get(LOCATION_FAR);
    }

    public double getAvoidLocationHitHard() {
        return get(AVOID_LOCATION_HIT_HARD);
    }

    public double getAvoidLocationHitSoft() {
        return get(AVOID_LOCATION_HIT_SOFT);
    }

    public double getAvoidLocationSuccess() {
        return get(AVOID_LOCATION_SUCCESS);
    }

    public double getAssetTypeMismatch() {
        return get(ASSET_TYPE_MISMATCH);
    }

    public double getTransportMismatch() {
        return get(TRANSPORT_MISMATCH);
    }

    public double getMustHavePoiTooFar() {
        return get(MUST_HAVE_POI_TOO_FAR);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof ScoringWeights && values.equals(((ScoringWeights) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "ScoringWeights" + values;
    }
}
