package org.estateranker.engine.config;

import io.github.cdimascio.dotenv.Dotenv;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;

/**
 * Immutable process configuration for the ranking engine.
 * Values are resolved from environment variables, then .env files (current directory, then parent),
 * then defaults.
 */
public final class EngineConfig {

    private static final Logger LOG = Logger.getLogger(EngineConfig.class.getName());

    public static final int DEFAULT_HTTP_PORT = 8090;
    public static final String DEFAULT_GEOCODING_BASE_URL = "https://maps.googleapis.com/";
    public static final String DEFAULT_GEOCODING_REGION = "th";
    public static final String DEFAULT_GEOCODING_LANGUAGE = "th";
    public static final String DEFAULT_LOG_FILE = "logs/estate-ranker.log";

    // HTTP Server Configuration
    private final int httpPort;

    // Scoring Configuration
    private final Path scoringConfigFile;
    private final int scoringThreads;

    // Geocoding Configuration
    private final String googleMapsApiKey;
    private final String geocodingBaseUrl;
    private final String geocodingRegion;
    private final String geocodingLanguage;

    // Logging Configuration
    private final String logFilePath;
    private final boolean fileLoggingEnabled;

    private EngineConfig(Builder builder) {
        this.httpPort = builder.httpPort;
        this.scoringConfigFile = builder.scoringConfigFile;
        this.scoringThreads = builder.scoringThreads;
        this.googleMapsApiKey = builder.googleMapsApiKey;
        this.geocodingBaseUrl = builder.geocodingBaseUrl;
        this.geocodingRegion = builder.geocodingRegion;
        this.geocodingLanguage = builder.geocodingLanguage;
        this.logFilePath = builder.logFilePath;
        this.fileLoggingEnabled = builder.fileLoggingEnabled;
    }

    /**
     * Creates configuration from environment variables and .env files.
     */
    public static EngineConfig fromEnvironment() {
        Dotenv local = Dotenv.configure().ignoreIfMissing().load();
        Dotenv parent = Dotenv.configure().directory("../").ignoreIfMissing().load();
        return fromLookup(key -> firstNonBlank(System.getenv(key), local.get(key), parent.get(key)));
    }

    /**
     * Creates configuration from an arbitrary key lookup. Blank values count as unset.
     */
    static EngineConfig fromLookup(UnaryOperator<String> lookup) {
        Resolver resolver = new Resolver(lookup);
        String configFile = resolver.get("SCORING_CONFIG_FILE", "");
        return new Builder()
                .httpPort(resolver.getInt("RANKER_HTTP_PORT", DEFAULT_HTTP_PORT))
                .scoringConfigFile(configFile.isEmpty() ? null : Paths.get(configFile))
                .scoringThreads(resolver.getInt("SCORING_THREADS", Runtime.getRuntime().availableProcessors()))
                .googleMapsApiKey(resolver.get("GOOGLE_MAPS_API_KEY", ""))
                .geocodingBaseUrl(resolver.get("GEOCODING_BASE_URL", DEFAULT_GEOCODING_BASE_URL))
                .geocodingRegion(resolver.get("GEOCODING_REGION", DEFAULT_GEOCODING_REGION))
                .geocodingLanguage(resolver.get("GEOCODING_LANGUAGE", DEFAULT_GEOCODING_LANGUAGE))
                .logFilePath(resolver.get("RANKER_LOG_FILE", DEFAULT_LOG_FILE))
                .fileLoggingEnabled(resolver.getBoolean("RANKER_FILE_LOGGING_ENABLED", true))
                .build();
    }

    // Getters
    public int getHttpPort() {
        return httpPort;
    }

    /**
     * Scoring configuration override, or null to use the bundled document.
     */
    public Path getScoringConfigFile() {
        return scoringConfigFile;
    }

    public int getScoringThreads() {
        return scoringThreads;
    }

    public String getGoogleMapsApiKey() {
        return googleMapsApiKey;
    }

    public boolean isGeocodingEnabled() {
        return !googleMapsApiKey.isEmpty();
    }

    public String getGeocodingBaseUrl() {
        return geocodingBaseUrl;
    }

    public String getGeocodingRegion() {
        return geocodingRegion;
    }

    public String getGeocodingLanguage() {
        return geocodingLanguage;
    }

    public String getLogFilePath() {
        return logFilePath;
    }

    public boolean isFileLoggingEnabled() {
        return fileLoggingEnabled;
    }

    private static String firstNonBlank(String... candidates) {
        for (String candidate : candidates) {
            if (candidate != null && !candidate.trim().isEmpty()) {
                return candidate.trim();
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "httpPort=" + httpPort +
                ", scoringConfigFile=" + (scoringConfigFile != null ? scoringConfigFile : "classpath") +
                ", scoringThreads=" + scoringThreads +
                ", geocodingEnabled=" + isGeocodingEnabled() +
                ", geocodingBaseUrl='" + geocodingBaseUrl + '\'' +
                ", fileLoggingEnabled=" + fileLoggingEnabled +
                '}';
    }

    /**
     * Typed reads over a key lookup, falling back to defaults.
     */
    private static final class Resolver {
        private final UnaryOperator<String> lookup;

        Resolver(UnaryOperator<String> lookup) {
            this.lookup = Objects.requireNonNull(lookup, "lookup must not be null");
        }

        String get(String key, String defaultValue) {
            String value = lookup.apply(key);
            if (value == null || value.trim().isEmpty()) {
                LOG.fine(() -> String.format("Using default for %s: %s", key, defaultValue));
                return defaultValue;
            }
            return value.trim();
        }

        int getInt(String key, int defaultValue) {
            String value = lookup.apply(key);
            if (value == null || value.trim().isEmpty()) {
                return defaultValue;
            }
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                LOG.warning(() -> String.format("Invalid integer for %s: %s, using default: %d", key, value, defaultValue));
                return defaultValue;
            }
        }

        boolean getBoolean(String key, boolean defaultValue) {
            String value = lookup.apply(key);
            if (value == null || value.trim().isEmpty()) {
                return defaultValue;
            }
            return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
        }
    }

    /**
     * Builder for EngineConfig.
     */
    public static final class Builder {
        private int httpPort = DEFAULT_HTTP_PORT;
        private Path scoringConfigFile;
        private int scoringThreads = Runtime.getRuntime().availableProcessors();
        private String googleMapsApiKey = "";
        private String geocodingBaseUrl = DEFAULT_GEOCODING_BASE_URL;
        private String geocodingRegion = DEFAULT_GEOCODING_REGION;
        private String geocodingLanguage = DEFAULT_GEOCODING_LANGUAGE;
        private String logFilePath = DEFAULT_LOG_FILE;
        private boolean fileLoggingEnabled = true;

        public Builder httpPort(int httpPort) {
            if (httpPort <= 0 || httpPort > 65535) {
                throw new IllegalArgumentException("httpPort must be between 1 and 65535");
            }
            this.httpPort = httpPort;
            return this;
        }

        public Builder scoringConfigFile(Path scoringConfigFile) {
            this.scoringConfigFile = scoringConfigFile;
            return this;
        }

        public Builder scoringThreads(int scoringThreads) {
            if (scoringThreads < 1) {
                throw new IllegalArgumentException("scoringThreads must be at least 1");
            }
            this.scoringThreads = scoringThreads;
            return this;
        }

        public Builder googleMapsApiKey(String googleMapsApiKey) {
            this.googleMapsApiKey = googleMapsApiKey != null ? googleMapsApiKey : "";
            return this;
        }

        public Builder geocodingBaseUrl(String geocodingBaseUrl) {
            this.geocodingBaseUrl = Objects.requireNonNull(geocodingBaseUrl, "geocodingBaseUrl must not be null");
            return this;
        }

        public Builder geocodingRegion(String geocodingRegion) {
            this.geocodingRegion = geocodingRegion;
            return this;
        }

        public Builder geocodingLanguage(String geocodingLanguage) {
            this.geocodingLanguage = geocodingLanguage;
            return this;
        }

        public Builder logFilePath(String logFilePath) {
            this.logFilePath = Objects.requireNonNull(logFilePath, "logFilePath must not be null");
            return this;
        }

        public Builder fileLoggingEnabled(boolean fileLoggingEnabled) {
            this.fileLoggingEnabled = fileLoggingEnabled;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }
}
