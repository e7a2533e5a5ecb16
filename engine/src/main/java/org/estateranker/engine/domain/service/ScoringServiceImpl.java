package org.estateranker.engine.domain.service;

import org.estateranker.engine.domain.model.AssetTypeMapping;
import org.estateranker.engine.domain.model.AttributeReading;
import org.estateranker.engine.domain.model.CandidateAttributes;
import org.estateranker.engine.domain.model.DataQualityReport;
import org.estateranker.engine.domain.model.DataStatus;
import org.estateranker.engine.domain.model.GeoPoint;
import org.estateranker.engine.domain.model.HardConstraints;
import org.estateranker.engine.domain.model.Intent;
import org.estateranker.engine.domain.model.LocationTiers;
import org.estateranker.engine.domain.model.PetPreference;
import org.estateranker.engine.domain.model.PoiCatalog;
import org.estateranker.engine.domain.model.PoiDefinition;
import org.estateranker.engine.domain.model.PriceRange;
import org.estateranker.engine.domain.model.ScoringConfig;
import org.estateranker.engine.domain.model.ScoringResult;
import org.estateranker.engine.domain.model.ScoringThresholds;
import org.estateranker.engine.domain.model.ScoringWeights;
import org.estateranker.engine.domain.model.Signal;
import org.estateranker.engine.geo.GeoDistance;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Implementation of ScoringService using ordered hard gates and additive soft signals.
 *
 * Step order (later steps assume earlier ones passed):
 *   1. asset type gate
 *   2. transport mode gate (rapid transit vs conventional rail)
 *   3. rapid transit proximity
 *   4. must-have POI gate
 *   5. pet friendliness
 *   6. nice-to-have POIs
 *   7. avoid-POI gate
 *   8. price range
 *   9. target location proximity (only with target coordinates)
 *  10. avoid location proximity (only with avoid coordinates)
 *
 * A disqualification stops the pipeline and freezes the score at 0.
 */
public final class ScoringServiceImpl implements ScoringService {

    private static final Logger LOG = Logger.getLogger(ScoringServiceImpl.class.getName());

    static final String LABEL_ASSET_TYPE = "asset_type";
    static final String LABEL_TRANSPORT_MODE = "transport_mode";
    static final String LABEL_RAPID_TRANSIT = "rapid_transit:";
    static final String LABEL_MUST_HAVE = "must_have:";
    static final String LABEL_PET_FRIENDLY = "pet_friendly";
    static final String LABEL_NEAR_VET = "near_vet";
    static final String LABEL_NICE_TO_HAVE = "nice_to_have:";
    static final String LABEL_AVOID_POI = "avoid_poi:";
    static final String LABEL_PRICE_RANGE = "price_range";
    static final String LABEL_TARGET_LOCATION = "target_location";
    static final String LABEL_AVOID_LOCATION = "avoid_location";

    private final ScoringConfig config;
    private final PoiCatalog catalog;
    private final ScoringWeights weights;
    private final HardConstraints hardConstraints;
    private final ScoringThresholds thresholds;
    private final DataQualityAssessor assessor;

    public ScoringServiceImpl(ScoringConfig config) {
        this(config, new DataQualityAssessorImpl(config));
    }

    public ScoringServiceImpl(ScoringConfig config, DataQualityAssessor assessor) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.assessor = Objects.requireNonNull(assessor, "assessor must not be null");
        this.catalog = config.getCatalog();
        this.weights = config.getWeights();
        this.hardConstraints = config.getHardConstraints();
        this.thresholds = config.getThresholds();
    }

    @Override
    public ScoringResult score(CandidateAttributes attributes, Intent intent, DataQualityReport quality,
                               GeoPoint targetLocation, GeoPoint avoidLocation) {
        Objects.requireNonNull(attributes, "attributes must not be null");
        Objects.requireNonNull(intent, "intent must not be null");

        ScoringResult.Builder result = new ScoringResult.Builder(attributes.getId()).dataQuality(quality);

        List<Supplier<GateOutcome>> steps = new ArrayList<>(Arrays.asList(
                () -> checkAssetType(attributes, intent),
                () -> checkTransportMode(attributes, intent),
                () -> scoreRapidTransit(attributes, intent),
                () -> checkMustHavePois(attributes, intent),
                () -> scorePetFriendly(attributes, intent),
                () -> scoreNiceToHave(attributes, intent),
                () -> checkAvoidPois(attributes, intent),
                () -> scorePriceRange(attributes, intent)));
        if (targetLocation != null) {
            steps.add(() -> scoreTargetLocation(attributes, targetLocation));
        }
        if (avoidLocation != null) {
            steps.add(() -> scoreAvoidLocation(attributes, avoidLocation));
        }

        for (Supplier<GateOutcome> step : steps) {
            GateOutcome outcome = step.get();
            result.addAll(outcome.getSignals());
            if (outcome.isDisqualified()) {
                LOG.fine(() -> String.format("Disqualified %s: %s",
                        attributes.getId(), outcome.getDisqualificationReason()));
                return result.disqualify(outcome.getDisqualificationReason());
            }
        }

        ScoringResult scored = result.build();
        LOG.fine(() -> String.format("Scored %s: total=%.2f, signals=%d",
                attributes.getId(), scored.getScore(), scored.getSignals().size()));
        return scored;
    }

    /**
     * Step 1: the candidate's asset type must be one of the types mapped from the requested labels.
     */
    private GateOutcome checkAssetType(CandidateAttributes attributes, Intent intent) {
        if (intent.getAssetTypes().isEmpty()) {
            return GateOutcome.nothing();
        }
        AssetTypeMapping mapping = config.getAssetTypes();
        Integer assetTypeId = attributes.getAssetTypeId();
        String actual = attributes.getAssetTypeName();
        String wanted = String.join(", ", intent.getAssetTypes());

        if (assetTypeId != null && mapping.acceptedIds(intent.getAssetTypes()).contains(assetTypeId)) {
            return GateOutcome.of(Signal.positive(LABEL_ASSET_TYPE,
                    "Asset type matches (" + actual + ")", weights.getAssetTypeMatch()));
        }
        if (hardConstraints.isWrongAssetTypeEnabled()) {
            return GateOutcome.disqualify("Asset type mismatch: wanted " + wanted + " but found " + actual);
        }
        return GateOutcome.of(Signal.negative(LABEL_ASSET_TYPE,
                "Asset type mismatch (wanted " + wanted + ", found " + actual + ")",
                weights.getAssetTypeMismatch()));
    }

    /**
     * Step 2: wanting rapid transit is not satisfied by a conventional rail station.
     */
    private GateOutcome checkTransportMode(CandidateAttributes attributes, Intent intent) {
        boolean wantsRapidTransit = intent.getMustHave().stream().anyMatch(catalog::isRapidTransit);
        if (!wantsRapidTransit) {
            return GateOutcome.nothing();
        }

        boolean hasRapidTransit = false;
        StringBuilder detail = new StringBuilder();
        for (String key : catalog.getRapidTransitKeys()) {
            OptionalDouble distance = assessor.verifiedDistance(attributes, key);
            if (distance.isPresent() && distance.getAsDouble() < config.radiusOf(key)) {
                hasRapidTransit = true;
            }
            detail.append(catalog.displayNameOf(key)).append(": ")
                    .append(distance.isPresent() ? meters(distance.getAsDouble()) : "no data")
                    .append(", ");
        }

        String railKey = config.getLegacyRailKey();
        OptionalDouble railDistance = assessor.verifiedDistance(attributes, railKey);
        boolean hasLegacyRail = railDistance.isPresent()
                && railDistance.getAsDouble() < thresholds.getLegacyRailThresholdMeters();

        if (hasRapidTransit || !hasLegacyRail) {
            return GateOutcome.nothing();
        }
        detail.append(catalog.displayNameOf(railKey)).append(": ").append(meters(railDistance.getAsDouble()));

        if (hardConstraints.isWrongTransportTypeEnabled()) {
            return GateOutcome.disqualify("Wanted rapid transit but only conventional rail is nearby ("
                    + detail + ")");
        }
        return GateOutcome.of(Signal.negative(LABEL_TRANSPORT_MODE,
                "Wanted rapid transit but only conventional rail is nearby", weights.getTransportMismatch()));
    }

    /**
     * Step 3: proximity bonus for each requested rapid transit key. Missing data only warns.
     */
    private GateOutcome scoreRapidTransit(CandidateAttributes attributes, Intent intent) {
        List<Signal> signals = new ArrayList<>();
        for (String key : intent.getMustHave()) {
            Optional<PoiDefinition> definition = catalog.find(key);
            if (!definition.isPresent() || !definition.get().isRapidTransit()) {
                continue;
            }
            PoiDefinition poi = definition.get();
            OptionalDouble distance = assessor.verifiedDistance(attributes, key);
            if (!distance.isPresent()) {
                signals.add(Signal.warning(LABEL_RAPID_TRANSIT + key, "No data for " + poi.getDisplayName()));
                continue;
            }
            double d = distance.getAsDouble();
            if (d <= poi.getRadiusMeters()) {
                signals.add(Signal.positive(LABEL_RAPID_TRANSIT + key,
                        "Near " + describe(attributes, poi) + " (" + meters(d) + ")", proximityScore(poi, d)));
            }
        }
        return GateOutcome.of(signals);
    }

    /**
     * Step 4: every other must-have POI must be within its radius. Verified far is terminal,
     * unverifiable absence is not.
     */
    private GateOutcome checkMustHavePois(CandidateAttributes attributes, Intent intent) {
        List<Signal> signals = new ArrayList<>();
        for (String key : intent.getMustHave()) {
            Optional<PoiDefinition> definition = catalog.find(key);
            if (!definition.isPresent() || definition.get().isRapidTransit()) {
                continue;
            }
            PoiDefinition poi = definition.get();
            OptionalDouble distance = assessor.verifiedDistance(attributes, key);
            if (!distance.isPresent()) {
                signals.add(Signal.warning(LABEL_MUST_HAVE + key,
                        "No data for " + poi.getDisplayName() + " (cannot verify)"));
                continue;
            }
            double d = distance.getAsDouble();
            double radius = poi.getRadiusMeters();
            if (d <= radius) {
                signals.add(Signal.positive(LABEL_MUST_HAVE + key,
                        "Near " + describe(attributes, poi) + " (" + meters(d) + ")", proximityScore(poi, d)));
            } else if (hardConstraints.isMustHavePoiTooFarEnabled()) {
                return GateOutcome.disqualify(String.format("Wanted %s but it is %s away (limit %s)",
                        poi.getDisplayName(), meters(d), meters(radius)), signals);
            } else {
                signals.add(Signal.negative(LABEL_MUST_HAVE + key,
                        String.format("Wanted %s but it is %s away (beyond limit)", poi.getDisplayName(), meters(d)),
                        weights.getMustHavePoiTooFar()));
            }
        }
        return GateOutcome.of(signals);
    }

    /**
     * Step 5: explicit pet policy first, then inference from the asset type class.
     */
    private GateOutcome scorePetFriendly(CandidateAttributes attributes, Intent intent) {
        PetPreference preference = intent.getPetPreference();
        if (preference == PetPreference.UNSPECIFIED) {
            return GateOutcome.nothing();
        }
        Boolean explicit = attributes.getPetFriendly();

        if (preference == PetPreference.NO_PETS) {
            if (Boolean.TRUE.equals(explicit)) {
                return GateOutcome.of(Signal.negative(LABEL_PET_FRIENDLY,
                        "Pet-friendly building (possible noise)", weights.getPetNoisePenalty()));
            }
            return GateOutcome.nothing();
        }

        List<Signal> signals = new ArrayList<>();
        if (Boolean.TRUE.equals(explicit)) {
            signals.add(Signal.positive(LABEL_PET_FRIENDLY, "Pets allowed (stated)", weights.getPetFriendlyExplicit()));
        } else if (Boolean.FALSE.equals(explicit)) {
            signals.add(Signal.negative(LABEL_PET_FRIENDLY, "Pets not allowed (stated)",
                    weights.getPetNotAllowedCondo()));
        } else {
            if (attributes.getPetFriendlyStatus() == DataStatus.UNUSABLE) {
                signals.add(Signal.warning(LABEL_PET_FRIENDLY,
                        "Pet policy value unreadable: '" + attributes.get(CandidateAttributes.PET_FRIENDLY) + "'"));
            }
            signals.add(inferPetPolicy(attributes.getAssetTypeId()));
        }

        Optional<PoiDefinition> vet = catalog.find(config.getVeterinaryKey());
        if (vet.isPresent()) {
            OptionalDouble vetDistance = assessor.verifiedDistance(attributes, vet.get().getKey());
            if (vetDistance.isPresent() && vetDistance.getAsDouble() <= vet.get().getRadiusMeters()) {
                signals.add(Signal.positive(LABEL_NEAR_VET,
                        "Near " + vet.get().getDisplayName() + " (" + meters(vetDistance.getAsDouble()) + ")",
                        weights.getNearVetBonus()));
            }
        }
        return GateOutcome.of(signals);
    }

    private Signal inferPetPolicy(Integer assetTypeId) {
        AssetTypeMapping mapping = config.getAssetTypes();
        if (assetTypeId != null && mapping.isCondoClass(assetTypeId)) {
            return Signal.negative(LABEL_PET_FRIENDLY, "Pets likely not allowed (most condominiums forbid pets)",
                    weights.getPetNotAllowedCondo());
        }
        if (assetTypeId != null && mapping.isPetFriendlyClass(assetTypeId)) {
            return Signal.positive(LABEL_PET_FRIENDLY, "Pets likely allowed (low-rise house)",
                    weights.getPetFriendlyInferred());
        }
        return Signal.negative(LABEL_PET_FRIENDLY, "Pet policy not stated (must confirm)",
                weights.getPetStatusUnknown());
    }

    /**
     * Step 6: bonus only. Missing or out of range never penalizes.
     */
    private GateOutcome scoreNiceToHave(CandidateAttributes attributes, Intent intent) {
        List<Signal> signals = new ArrayList<>();
        for (String key : intent.getNiceToHave()) {
            Optional<PoiDefinition> definition = catalog.find(key);
            if (!definition.isPresent()) {
                continue;
            }
            AttributeReading reading = assessor.read(attributes, key);
            if (reading.getStatus() == DataStatus.UNUSABLE) {
                signals.add(unreadableDistance(LABEL_NICE_TO_HAVE + key, attributes, definition.get()));
                continue;
            }
            OptionalDouble distance = reading.value();
            if (distance.isPresent() && distance.getAsDouble() <= definition.get().getRadiusMeters()) {
                signals.add(Signal.positive(LABEL_NICE_TO_HAVE + key,
                        "Has " + describe(attributes, definition.get()) + " (" + meters(distance.getAsDouble()) + ")",
                        weights.getNiceToHavePoi()));
            }
        }
        return GateOutcome.of(signals);
    }

    /**
     * Step 7: a verified avoid-POI inside the tighter avoid threshold is terminal.
     */
    private GateOutcome checkAvoidPois(CandidateAttributes attributes, Intent intent) {
        List<Signal> signals = new ArrayList<>();
        for (String key : intent.getAvoidPoi()) {
            Optional<PoiDefinition> definition = catalog.find(key);
            if (!definition.isPresent()) {
                continue;
            }
            PoiDefinition poi = definition.get();
            AttributeReading reading = assessor.read(attributes, key);
            if (reading.getStatus() == DataStatus.UNUSABLE) {
                signals.add(unreadableDistance(LABEL_AVOID_POI + key, attributes, poi));
                continue;
            }
            OptionalDouble distance = reading.value();
            if (!distance.isPresent()) {
                continue;
            }
            double d = distance.getAsDouble();
            double avoidRadius = poi.getRadiusMeters() * thresholds.getAvoidRadiusFactor();
            if (d > avoidRadius) {
                signals.add(Signal.positive(LABEL_AVOID_POI + key,
                        "Away from " + poi.getDisplayName() + " (" + meters(d) + ")", weights.getAvoidPoiSuccess()));
            } else if (hardConstraints.isAvoidPoiTooCloseEnabled()) {
                return GateOutcome.disqualify(String.format("Must avoid %s but it is only %s away (needs at least %s)",
                        poi.getDisplayName(), meters(d), meters(avoidRadius)), signals);
            } else {
                signals.add(Signal.negative(LABEL_AVOID_POI + key,
                        "Close to " + poi.getDisplayName() + " (to avoid) at " + meters(d),
                        weights.getAvoidPoiFailure()));
            }
        }
        return GateOutcome.of(signals);
    }

    /**
     * Step 8: inclusive bounds. An unset price only warns.
     */
    private GateOutcome scorePriceRange(CandidateAttributes attributes, Intent intent) {
        PriceRange range = intent.getPriceRange();
        if (range.isUnbounded()) {
            return GateOutcome.nothing();
        }
        double price = attributes.getSellingPrice();
        if (price == 0.0) {
            return GateOutcome.of(Signal.warning(LABEL_PRICE_RANGE, "No price data"));
        }
        if (range.isBelowMin(price)) {
            return GateOutcome.of(Signal.negative(LABEL_PRICE_RANGE,
                    "Price below range (" + baht(price) + " < " + baht(range.getMin()) + ")",
                    weights.getPriceOutOfRange()));
        }
        if (range.isAboveMax(price)) {
            return GateOutcome.of(Signal.negative(LABEL_PRICE_RANGE,
                    "Price above range (" + baht(price) + " > " + baht(range.getMax()) + ")",
                    weights.getPriceOutOfRange()));
        }
        return GateOutcome.of(Signal.positive(LABEL_PRICE_RANGE,
                "Price within range (" + baht(price) + ")", weights.getPriceInRange()));
    }

    /**
     * Step 9: tiered proximity to a geocoded target. Beyond the far limit is terminal unless relaxed.
     */
    private GateOutcome scoreTargetLocation(CandidateAttributes attributes, GeoPoint target) {
        Optional<GeoPoint> position = attributes.getCoordinates();
        if (!position.isPresent()) {
            return GateOutcome.of(coordinateWarning(attributes, LABEL_TARGET_LOCATION));
        }
        double d = GeoDistance.meters(position.get(), target);
        LocationTiers tiers = config.getTargetTiers();

        if (d <= tiers.getInner()) {
            return GateOutcome.of(Signal.positive(LABEL_TARGET_LOCATION,
                    "Very close to the searched location (" + kilometers(d) + ")", weights.getLocationVeryClose()));
        }
        if (d <= tiers.getOuter()) {
            return GateOutcome.of(Signal.positive(LABEL_TARGET_LOCATION,
                    "Within easy reach of the searched location (" + kilometers(d) + ")", weights.getLocationClose()));
        }
        if (d > tiers.getLimit()) {
            if (hardConstraints.isTargetLocationTooFarEnabled()) {
                return GateOutcome.disqualify(String.format("Too far: %s from the searched location (limit %s)",
                        kilometers(d), kilometers(tiers.getLimit())));
            }
            return GateOutcome.of(Signal.negative(LABEL_TARGET_LOCATION,
                    "Far from the searched location (" + kilometers(d) + ")", weights.getLocationFar()));
        }
        return GateOutcome.of(Signal.warning(LABEL_TARGET_LOCATION,
                "Moderate distance from the searched location (" + kilometers(d) + ")"));
    }

    /**
     * Step 10: closer is worse. Never disqualifies.
     */
    private GateOutcome scoreAvoidLocation(CandidateAttributes attributes, GeoPoint avoid) {
        Optional<GeoPoint> position = attributes.getCoordinates();
        if (!position.isPresent()) {
            return GateOutcome.of(coordinateWarning(attributes, LABEL_AVOID_LOCATION));
        }
        double d = GeoDistance.meters(position.get(), avoid);
        LocationTiers tiers = config.getAvoidTiers();

        if (d <= tiers.getInner()) {
            return GateOutcome.of(Signal.negative(LABEL_AVOID_LOCATION,
                    "Very close to the location to avoid (" + kilometers(d) + ")", weights.getAvoidLocationHitHard()));
        }
        if (d <= tiers.getOuter()) {
            return GateOutcome.of(Signal.negative(LABEL_AVOID_LOCATION,
                    "Within the radius to avoid (" + kilometers(d) + ")", weights.getAvoidLocationHitSoft()));
        }
        return GateOutcome.of(Signal.positive(LABEL_AVOID_LOCATION,
                "Away from the location to avoid (" + kilometers(d) + ")", weights.getAvoidLocationSuccess()));
    }

    private Signal coordinateWarning(CandidateAttributes attributes, String label) {
        if (attributes.getCoordinateStatus() == DataStatus.UNUSABLE) {
            return Signal.warning(label, "Listing coordinates invalid (distance not computed)");
        }
        return Signal.warning(label, "Listing coordinates missing (distance not computed)");
    }

    private static Signal unreadableDistance(String label, CandidateAttributes attributes, PoiDefinition poi) {
        return Signal.warning(label, poi.getDisplayName() + " distance unreadable: '"
                + attributes.get(poi.getKey()) + "' (cannot verify)");
    }

    private double proximityScore(PoiDefinition poi, double distance) {
        return weights.getMustHavePoiBase() * Math.max(thresholds.getProximityFloor(), poi.proximityFactor(distance));
    }

    private static String describe(CandidateAttributes attributes, PoiDefinition poi) {
        String specific = attributes.getPoiName(poi.getKey());
        return specific != null ? poi.getDisplayName() + " '" + specific + "'" : poi.getDisplayName();
    }

    private static String meters(double distance) {
        return String.format(Locale.US, "%,.0f m", distance);
    }

    private static String kilometers(double distance) {
        return String.format(Locale.US, "%.1f km", distance / 1000);
    }

    private static String baht(double amount) {
        return String.format(Locale.US, "%,.0f THB", amount);
    }
}
