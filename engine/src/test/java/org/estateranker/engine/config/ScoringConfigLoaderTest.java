package org.estateranker.engine.config;

import org.estateranker.engine.domain.model.HardConstraints;
import org.estateranker.engine.domain.model.LocationTiers;
import org.estateranker.engine.domain.model.PoiDefinition;
import org.estateranker.engine.domain.model.ProximityCurve;
import org.estateranker.engine.domain.model.RankingSettings;
import org.estateranker.engine.domain.model.ScoringConfig;
import org.estateranker.engine.domain.model.ScoringWeights;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScoringConfigLoaderTest {

    private final ScoringConfigLoader loader = new ScoringConfigLoader();

    private static InputStream json(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void bundledConfigurationCoversTheFullCatalog() {
        ScoringConfig config = loader.loadDefault();

        assertThat(config.getCatalog().size()).isEqualTo(26);
        assertThat(config.getCatalog().getRapidTransitKeys()).containsExactly("bts_station", "mrt");
        assertThat(config.getCatalog().find("bts_station"))
                .map(PoiDefinition::getCurve)
                .contains(ProximityCurve.EXPONENTIAL);
        assertThat(config.getWeights()).isEqualTo(ScoringWeights.defaults());
        assertThat(config.getHardConstraints().isEnabled(HardConstraints.MUST_HAVE_POI_TOO_FAR)).isTrue();
        assertThat(config.getHardConstraints().isTargetLocationTooFarEnabled()).isTrue();
        assertThat(config.getTargetTiers()).isEqualTo(LocationTiers.targetDefaults());
        assertThat(config.getAvoidTiers()).isEqualTo(LocationTiers.avoidDefaults());
        assertThat(config.getAssetTypes().acceptedIds(Collections.singletonList("Condo"))).containsExactly(3, 12);
        assertThat(config.getLegacyRailKey()).isEqualTo("train_station");
        assertThat(config.getRanking()).isEqualTo(RankingSettings.defaults());
    }

    @Test
    void missingSectionsFallBackToDefaults() throws IOException {
        ScoringConfig config;
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("scoring-config-minimal.json")) {
            config = loader.parse(in);
        }

        assertThat(config.getCatalog().size()).isEqualTo(2);
        assertThat(config.radiusOf("bts_station")).isEqualTo(1500);
        assertThat(config.radiusOf("park")).isEqualTo(2500);
        assertThat(config.getCatalog().isRapidTransit("bts_station")).isTrue();
        assertThat(config.getWeights().getAssetTypeMatch()).isEqualTo(4.0);
        assertThat(config.getWeights().getPriceOutOfRange()).isEqualTo(-3.0);
        assertThat(config.getHardConstraints().isMustHavePoiTooFarEnabled()).isFalse();
        assertThat(config.getHardConstraints().isWrongAssetTypeEnabled()).isTrue();
        assertThat(config.getThresholds().getLegacyRailThresholdMeters()).isEqualTo(2500);
        assertThat(config.getTargetTiers()).isEqualTo(LocationTiers.targetDefaults());
        assertThat(config.getRanking().getDefaultTopN()).isEqualTo(3);
        assertThat(config.getRanking().getMaxPoolSize()).isEqualTo(RankingSettings.defaults().getMaxPoolSize());
    }

    @Test
    void malformedJsonIsAConfigurationError() {
        assertThatThrownBy(() -> loader.parse(json("{ \"poi_catalog\": [")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageStartingWith("Malformed scoring configuration");
    }

    @Test
    void inconsistentTiersAreAConfigurationError() {
        String text = "{\"target_location\": {\"radius_very_close\": 8000, \"radius_close\": 5000}}";

        assertThatThrownBy(() -> loader.parse(json(text)))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageStartingWith("Invalid scoring configuration");
    }

    @Test
    void overrideFileTakesPrecedence(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("custom.json");
        Files.write(file, ("{\"poi_catalog\": {\"temple\": {\"radius\": 800, \"display_name\": \"Wat\"}},"
                + " \"ranking\": {\"min_final_score\": 0.5}}").getBytes(StandardCharsets.UTF_8));

        ScoringConfig config = new ScoringConfigLoader(file).load();

        assertThat(config.getCatalog().displayNameOf("temple")).isEqualTo("Wat");
        assertThat(config.getRanking().getMinFinalScore()).isEqualTo(0.5);
    }

    @Test
    void unreadableOverrideFileFails(@TempDir Path dir) {
        ScoringConfigLoader missing = new ScoringConfigLoader(dir.resolve("absent.json"));

        assertThatThrownBy(missing::load)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("absent.json");
    }
}
