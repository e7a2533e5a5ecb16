package org.estateranker.engine.domain.service;

import org.estateranker.engine.domain.model.AttributeReading;
import org.estateranker.engine.domain.model.CandidateAttributes;
import org.estateranker.engine.domain.model.DataQualityReport;
import org.estateranker.engine.domain.model.DataStatus;
import org.estateranker.engine.domain.model.PoiCatalog;
import org.estateranker.engine.domain.model.ScoringConfig;
import org.estateranker.engine.domain.model.ScoringThresholds;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Implementation of DataQualityAssessor.
 *
 * Quality score:
 *   0.4 * (available / checked)
 * + 0.3 * [valid price]
 * + 0.2 * [valid asset type]
 * + 0.1 * [valid location]
 */
public final class DataQualityAssessorImpl implements DataQualityAssessor {

    private static final Logger LOG = Logger.getLogger(DataQualityAssessorImpl.class.getName());

    private static final double POI_COMPLETENESS_WEIGHT = 0.4;
    private static final double PRICE_WEIGHT = 0.3;
    private static final double ASSET_TYPE_WEIGHT = 0.2;
    private static final double LOCATION_WEIGHT = 0.1;

    private final PoiCatalog catalog;
    private final ScoringThresholds thresholds;

    public DataQualityAssessorImpl(ScoringConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        this.catalog = config.getCatalog();
        this.thresholds = config.getThresholds();
    }

    @Override
    public DataQualityReport assess(CandidateAttributes attributes, Collection<String> requiredKeys,
                                    Collection<String> optionalKeys) {
        Objects.requireNonNull(attributes, "attributes must not be null");
        Set<String> required = nullSafe(requiredKeys);
        Set<String> checked = new LinkedHashSet<>(required);
        checked.addAll(nullSafe(optionalKeys));

        Set<String> available = new LinkedHashSet<>();
        Set<String> missing = new LinkedHashSet<>();
        List<String> warnings = new ArrayList<>();

        for (String key : checked) {
            AttributeReading reading = read(attributes, key);
            if (reading.isPresent()) {
                available.add(key);
                continue;
            }
            missing.add(key);
            if (required.contains(key)) {
                warnings.add(String.format("%s cannot be verified (no usable distance data)",
                        catalog.displayNameOf(key)));
            }
            if (reading.getStatus() == DataStatus.UNUSABLE) {
                LOG.fine(() -> String.format("Candidate %s: unusable value for %s: %s",
                        attributes.getId(), key, attributes.get(key)));
            }
        }

        boolean validPrice = hasValidPrice(attributes);
        boolean validAssetType = attributes.getAssetTypeId() != null;
        boolean validLocation = hasValidLocation(attributes);

        int denominator = checked.isEmpty() ? 1 : checked.size();
        double quality = POI_COMPLETENESS_WEIGHT * ((double) available.size() / denominator)
                + (validPrice ? PRICE_WEIGHT : 0.0)
                + (validAssetType ? ASSET_TYPE_WEIGHT : 0.0)
                + (validLocation ? LOCATION_WEIGHT : 0.0);

        return new DataQualityReport.Builder()
                .candidateId(attributes.getId())
                .availablePoiKeys(available)
                .missingPoiKeys(missing)
                .validPrice(validPrice)
                .validAssetType(validAssetType)
                .validLocation(validLocation)
                .qualityScore(Math.min(1.0, quality))
                .warnings(warnings)
                .build();
    }

    @Override
    public Map<String, DataQualityReport> assessAll(List<CandidateAttributes> candidates,
                                                    Collection<String> requiredKeys,
                                                    Collection<String> optionalKeys) {
        Objects.requireNonNull(candidates, "candidates must not be null");
        Map<String, DataQualityReport> reports = new LinkedHashMap<>();
        for (CandidateAttributes candidate : candidates) {
            reports.put(candidate.getId(), assess(candidate, requiredKeys, optionalKeys));
        }
        LOG.fine(() -> "Assessed data quality for " + reports.size() + " candidates");
        return reports;
    }

    @Override
    public AttributeReading read(CandidateAttributes attributes, String key) {
        Object raw = attributes.get(key);
        if (raw == null) {
            return AttributeReading.missing();
        }
        if (raw instanceof String) {
            if (((String) raw).trim().isEmpty()) {
                return AttributeReading.missing();
            }
            Double parsed = CandidateAttributes.toNumber(raw);
            return parsed == null ? AttributeReading.unusable() : classify(parsed);
        }
        if (raw instanceof Number) {
            return classify(((Number) raw).doubleValue());
        }
        return AttributeReading.unusable();
    }

    @Override
    public OptionalDouble verifiedDistance(CandidateAttributes attributes, String poiKey) {
        return read(attributes, poiKey).value();
    }

    private AttributeReading classify(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return AttributeReading.unusable();
        }
        if (thresholds.isMissingSentinel(value)) {
            return AttributeReading.missing();
        }
        if (value < 0) {
            return AttributeReading.unusable();
        }
        return AttributeReading.present(value);
    }

    private boolean hasValidPrice(CandidateAttributes attributes) {
        // prices run into the millions, so the distance sentinel rule does not apply
        return attributes.getSellingPrice() > 0;
    }

    private boolean hasValidLocation(CandidateAttributes attributes) {
        return attributes.getText(CandidateAttributes.LOCATION_VILLAGE) != null
                || attributes.getText(CandidateAttributes.LOCATION_ROAD) != null
                || attributes.getCoordinateStatus() == DataStatus.PRESENT;
    }

    private static Set<String> nullSafe(Collection<String> keys) {
        return keys == null ? new LinkedHashSet<>() : new LinkedHashSet<>(keys);
    }
}
