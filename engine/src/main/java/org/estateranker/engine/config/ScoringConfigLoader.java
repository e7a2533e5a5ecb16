package org.estateranker.engine.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.estateranker.engine.domain.model.AssetTypeMapping;
import org.estateranker.engine.domain.model.HardConstraints;
import org.estateranker.engine.domain.model.LocationTiers;
import org.estateranker.engine.domain.model.PoiCatalog;
import org.estateranker.engine.domain.model.PoiDefinition;
import org.estateranker.engine.domain.model.ProximityCurve;
import org.estateranker.engine.domain.model.RankingSettings;
import org.estateranker.engine.domain.model.ScoringConfig;
import org.estateranker.engine.domain.model.ScoringThresholds;
import org.estateranker.engine.domain.model.ScoringWeights;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Loads the scoring configuration document from the classpath or an override file.
 * Missing sections fall back to defaults; anything unreadable or invalid is a ConfigurationException.
 */
public final class ScoringConfigLoader {

    private static final Logger LOG = Logger.getLogger(ScoringConfigLoader.class.getName());

    public static final String DEFAULT_RESOURCE = "scoring-config.json";

    private final ObjectMapper mapper;
    private final Path overrideFile;

    public ScoringConfigLoader() {
        this(null);
    }

    /**
     * @param overrideFile file to load instead of the bundled document, or null
     */
    public ScoringConfigLoader(Path overrideFile) {
        this.overrideFile = overrideFile;
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Load from the override file when one is configured, otherwise from the classpath.
     */
    public ScoringConfig load() {
        return overrideFile != null ? load(overrideFile) : loadDefault();
    }

    public ScoringConfig load(Path file) {
        if (!Files.isReadable(file)) {
            throw new ConfigurationException("Scoring configuration file not readable: " + file);
        }
        try (InputStream in = Files.newInputStream(file)) {
            ScoringConfig config = parse(in);
            LOG.info(() -> "Loaded scoring configuration from " + file.toAbsolutePath());
            return config;
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read scoring configuration " + file, e);
        }
    }

    public ScoringConfig loadDefault() {
        try (InputStream in = ScoringConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new ConfigurationException("Classpath resource not found: " + DEFAULT_RESOURCE);
            }
            ScoringConfig config = parse(in);
            LOG.info(() -> "Loaded bundled scoring configuration (" + config.getCatalog().size() + " POI keys)");
            return config;
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read " + DEFAULT_RESOURCE, e);
        }
    }

    public ScoringConfig parse(InputStream in) {
        ScoringConfigDocument document;
        try {
            document = mapper.readValue(in, ScoringConfigDocument.class);
        } catch (IOException e) {
            throw new ConfigurationException("Malformed scoring configuration: " + e.getMessage(), e);
        }
        if (document == null) {
            throw new ConfigurationException("Scoring configuration document is empty");
        }
        try {
            return toConfig(document);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid scoring configuration: " + e.getMessage(), e);
        }
    }

    ScoringConfig toConfig(ScoringConfigDocument document) {
        ScoringThresholds thresholds = toThresholds(document.getThresholds());
        ScoringConfig.Builder builder = new ScoringConfig.Builder()
                .catalog(toCatalog(document.getPoiCatalog(), thresholds.getDefaultPoiRadiusMeters()))
                .thresholds(thresholds);

        if (document.getWeights() != null) {
            builder.weights(ScoringWeights.fromMap(document.getWeights()));
        }
        if (document.getHardConstraints() != null) {
            builder.hardConstraints(HardConstraints.fromMap(document.getHardConstraints()));
        }
        if (document.getTargetLocation() != null) {
            ScoringConfigDocument.TargetLocationDto target = document.getTargetLocation();
            LocationTiers defaults = LocationTiers.targetDefaults();
            builder.targetTiers(LocationTiers.of(
                    orDefault(target.getRadiusVeryClose(), defaults.getInner()),
                    orDefault(target.getRadiusClose(), defaults.getOuter()),
                    orDefault(target.getRadiusFarLimit(), defaults.getLimit())));
        }
        if (document.getAvoidLocation() != null) {
            ScoringConfigDocument.AvoidLocationDto avoid = document.getAvoidLocation();
            LocationTiers defaults = LocationTiers.avoidDefaults();
            double soft = orDefault(avoid.getRadiusHitSoft(), defaults.getOuter());
            builder.avoidTiers(LocationTiers.of(orDefault(avoid.getRadiusHitHard(), defaults.getInner()), soft, soft));
        }
        builder.assetTypes(toAssetTypes(document));
        if (document.getPoiKeys() != null) {
            ScoringConfigDocument.PoiKeysDto keys = document.getPoiKeys();
            if (keys.getLegacyRail() != null) {
                builder.legacyRailKey(keys.getLegacyRail());
            }
            if (keys.getVeterinary() != null) {
                builder.veterinaryKey(keys.getVeterinary());
            }
        }
        if (document.getRanking() != null) {
            builder.ranking(toRanking(document.getRanking()));
        }
        return builder.build();
    }

    private PoiCatalog toCatalog(Map<String, ScoringConfigDocument.PoiDto> entries, double defaultRadius) {
        if (entries == null || entries.isEmpty()) {
            LOG.warning("Scoring configuration has no poi_catalog, every POI key will be ignored");
            return PoiCatalog.empty();
        }
        List<PoiDefinition> definitions = new ArrayList<>();
        entries.forEach((key, dto) -> {
            if (dto == null) {
                return;
            }
            definitions.add(new PoiDefinition.Builder()
                    .key(key)
                    .radiusMeters(orDefault(dto.getRadius(), defaultRadius))
                    .weight(orDefault(dto.getWeight(), 0.0))
                    .curve(ProximityCurve.fromName(dto.getCurve()))
                    .category(dto.getCategory())
                    .displayName(dto.getDisplayName())
                    .poiType(dto.getPoiType())
                    .build());
        });
        return PoiCatalog.of(definitions);
    }

    private static ScoringThresholds toThresholds(ScoringConfigDocument.ThresholdsDto dto) {
        ScoringThresholds.Builder builder = new ScoringThresholds.Builder();
        if (dto == null) {
            return builder.build();
        }
        if (dto.getLegacyRailThresholdMeters() != null) {
            builder.legacyRailThresholdMeters(dto.getLegacyRailThresholdMeters());
        }
        if (dto.getAvoidRadiusFactor() != null) {
            builder.avoidRadiusFactor(dto.getAvoidRadiusFactor());
        }
        if (dto.getProximityFloor() != null) {
            builder.proximityFloor(dto.getProximityFloor());
        }
        if (dto.getMissingValueThreshold() != null) {
            builder.missingValueThreshold(dto.getMissingValueThreshold());
        }
        if (dto.getMissingValueSentinels() != null) {
            builder.missingValueSentinels(new LinkedHashSet<>(dto.getMissingValueSentinels()));
        }
        if (dto.getDefaultPoiRadiusMeters() != null) {
            builder.defaultPoiRadiusMeters(dto.getDefaultPoiRadiusMeters());
        }
        return builder.build();
    }

    private static AssetTypeMapping toAssetTypes(ScoringConfigDocument document) {
        AssetTypeMapping defaults = AssetTypeMapping.empty();
        if (document.getAssetTypes() == null && document.getPetFriendlyAssetIds() == null
                && document.getCondoAssetIds() == null) {
            return defaults;
        }
        Map<String, ? extends Collection<Integer>> idsByLabel = defaults.getIdsByLabel();
        if (document.getAssetTypes() != null) {
            idsByLabel = document.getAssetTypes();
        }
        Collection<Integer> petFriendlyIds = defaults.getPetFriendlyIds();
        if (document.getPetFriendlyAssetIds() != null) {
            petFriendlyIds = document.getPetFriendlyAssetIds();
        }
        Collection<Integer> condoIds = defaults.getCondoIds();
        if (document.getCondoAssetIds() != null) {
            condoIds = document.getCondoAssetIds();
        }
        return AssetTypeMapping.of(idsByLabel, petFriendlyIds, condoIds);
    }

    private static RankingSettings toRanking(ScoringConfigDocument.RankingDto dto) {
        RankingSettings defaults = RankingSettings.defaults();
        return new RankingSettings.Builder()
                .structuredWeight(orDefault(dto.getWeightStructured(), defaults.getStructuredWeight()))
                .semanticWeight(orDefault(dto.getWeightSemantic(), defaults.getSemanticWeight()))
                .lifestyleWeight(orDefault(dto.getWeightLifestyle(), defaults.getLifestyleWeight()))
                .minFinalScore(orDefault(dto.getMinFinalScore(), defaults.getMinFinalScore()))
                .defaultTopN(dto.getDefaultTopN() != null ? dto.getDefaultTopN() : defaults.getDefaultTopN())
                .maxPoolSize(dto.getMaxPoolSize() != null ? dto.getMaxPoolSize() : defaults.getMaxPoolSize())
                .minQualityForInclusion(orDefault(dto.getMinQualityForInclusion(), defaults.getMinQualityForInclusion()))
                .build();
    }

    private static double orDefault(Double value, double defaultValue) {
        return value != null ? value : defaultValue;
    }
}
