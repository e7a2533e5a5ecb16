package org.estateranker.engine.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EngineConfigTest {

    private static EngineConfig from(Map<String, String> values) {
        return EngineConfig.fromLookup(values::get);
    }

    @Test
    void defaultsApplyWhenNothingIsSet() {
        EngineConfig config = from(new HashMap<>());

        assertThat(config.getHttpPort()).isEqualTo(EngineConfig.DEFAULT_HTTP_PORT);
        assertThat(config.getScoringConfigFile()).isNull();
        assertThat(config.getScoringThreads()).isPositive();
        assertThat(config.isGeocodingEnabled()).isFalse();
        assertThat(config.getGeocodingBaseUrl()).isEqualTo(EngineConfig.DEFAULT_GEOCODING_BASE_URL);
        assertThat(config.getGeocodingRegion()).isEqualTo("th");
        assertThat(config.getLogFilePath()).isEqualTo(EngineConfig.DEFAULT_LOG_FILE);
        assertThat(config.isFileLoggingEnabled()).isTrue();
    }

    @Test
    void explicitValuesWin() {
        Map<String, String> values = new HashMap<>();
        values.put("RANKER_HTTP_PORT", "9100");
        values.put("SCORING_CONFIG_FILE", "/etc/ranker/scoring.json");
        values.put("SCORING_THREADS", "3");
        values.put("GOOGLE_MAPS_API_KEY", " abc123 ");
        values.put("GEOCODING_LANGUAGE", "en");
        values.put("RANKER_FILE_LOGGING_ENABLED", "false");

        EngineConfig config = from(values);

        assertThat(config.getHttpPort()).isEqualTo(9100);
        assertThat(config.getScoringConfigFile()).isEqualTo(Paths.get("/etc/ranker/scoring.json"));
        assertThat(config.getScoringThreads()).isEqualTo(3);
        assertThat(config.getGoogleMapsApiKey()).isEqualTo("abc123");
        assertThat(config.isGeocodingEnabled()).isTrue();
        assertThat(config.getGeocodingLanguage()).isEqualTo("en");
        assertThat(config.isFileLoggingEnabled()).isFalse();
    }

    @Test
    void invalidIntegerFallsBackToDefault() {
        Map<String, String> values = new HashMap<>();
        values.put("RANKER_HTTP_PORT", "eighty");

        assertThat(from(values).getHttpPort()).isEqualTo(EngineConfig.DEFAULT_HTTP_PORT);
    }

    @Test
    void outOfRangePortIsRejected() {
        Map<String, String> values = new HashMap<>();
        values.put("RANKER_HTTP_PORT", "70000");

        assertThatThrownBy(() -> from(values)).isInstanceOf(IllegalArgumentException.class);
    }
}
