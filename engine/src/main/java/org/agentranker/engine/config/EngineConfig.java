package org.agentranker.engine.config;

import io.github.cdimascio.dotenv.Dotenv;

import java.util.Objects;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Immutable configuration for the ranking engine process.
 * Values come from environment variables, then a .env file in the working or parent
 * directory, then built-in defaults.
 */
public final class EngineConfig {

    private static final Logger LOG = Logger.getLogger(EngineConfig.class.getName());

    public static final String DEFAULT_METRIC_STORE_URL = "http://localhost:8081";
    public static final int DEFAULT_SERVER_PORT = 8083;
    public static final int DEFAULT_REFRESH_INTERVAL = 60;
    public static final String DEFAULT_LOG_FILE = "/app/logs/ranking/ranking.log";

    // Metric store
    private final String metricStoreUrl;
    private final String metricStoreFile;

    // Keycloak
    private final String keycloakUrl;
    private final String keycloakRealm;
    private final String clientId;
    private final String clientSecret;

    // Ranking server
    private final int serverPort;

    // Snapshot refresh
    private final int refreshIntervalSeconds;
    private final boolean refreshEnabled;

    // Logging
    private final String logFilePath;
    private final boolean fileLoggingEnabled;

    private EngineConfig(Builder builder) {
        this.metricStoreUrl = builder.metricStoreUrl;
        this.metricStoreFile = builder.metricStoreFile;
        this.keycloakUrl = builder.keycloakUrl;
        this.keycloakRealm = builder.keycloakRealm;
        this.clientId = builder.clientId;
        this.clientSecret = builder.clientSecret;
        this.serverPort = builder.serverPort;
        this.refreshIntervalSeconds = builder.refreshIntervalSeconds;
        this.refreshEnabled = builder.refreshEnabled;
        this.logFilePath = builder.logFilePath;
        this.fileLoggingEnabled = builder.fileLoggingEnabled;
    }

    /**
     * Creates configuration from environment variables with .env fallback.
     */
    public static EngineConfig fromEnvironment() {
        Dotenv dotenv = Dotenv.configure().ignoreIfMissing().load();
        Dotenv parentDotenv = Dotenv.configure().directory("../").ignoreIfMissing().load();
        return fromLookup(key -> firstNonBlank(System.getenv(key), dotenv.get(key), parentDotenv.get(key)));
    }

    /**
     * Creates configuration from an arbitrary key lookup. Blank values count as unset.
     */
    public static EngineConfig fromLookup(Function<String, String> lookup) {
        Objects.requireNonNull(lookup, "lookup must not be null");
        return new Builder()
                .metricStoreUrl(get(lookup, "METRIC_STORE_URL", DEFAULT_METRIC_STORE_URL))
                .metricStoreFile(get(lookup, "METRIC_STORE_FILE", ""))
                .keycloakUrl(get(lookup, "KEYCLOAK_URL", ""))
                .keycloakRealm(get(lookup, "KEYCLOAK_REALM", ""))
                .clientId(get(lookup, "KEYCLOAK_CLIENT_ID", ""))
                .clientSecret(get(lookup, "KEYCLOAK_CLIENT_SECRET", ""))
                .serverPort(getInt(lookup, "RANKING_PORT", DEFAULT_SERVER_PORT))
                .refreshIntervalSeconds(getInt(lookup, "SNAPSHOT_REFRESH_SECONDS", DEFAULT_REFRESH_INTERVAL))
                .refreshEnabled(getBoolean(lookup, "SNAPSHOT_REFRESH_ENABLED", true))
                .logFilePath(get(lookup, "RANKING_LOG_FILE", DEFAULT_LOG_FILE))
                .fileLoggingEnabled(getBoolean(lookup, "RANKING_FILE_LOGGING_ENABLED", true))
                .build();
    }

    // Getters
    public String getMetricStoreUrl() {
        return metricStoreUrl;
    }

    /**
     * Path of a JSON snapshot file to use instead of the HTTP metric store; empty if unset.
     */
    public String getMetricStoreFile() {
        return metricStoreFile;
    }

    public boolean isFileMetricStore() {
        return !metricStoreFile.isEmpty();
    }

    public String getKeycloakUrl() {
        return keycloakUrl;
    }

    public String getKeycloakRealm() {
        return keycloakRealm;
    }

    public String getClientId() {
        return clientId;
    }

    public String getClientSecret() {
        return clientSecret;
    }

    /**
     * Whether enough Keycloak settings are present to authenticate metric store calls.
     */
    public boolean isAuthEnabled() {
        return !keycloakUrl.isEmpty() && !keycloakRealm.isEmpty() && !clientId.isEmpty();
    }

    public int getServerPort() {
        return serverPort;
    }

    public int getRefreshIntervalSeconds() {
        return refreshIntervalSeconds;
    }

    public boolean isRefreshEnabled() {
        return refreshEnabled;
    }

    public String getLogFilePath() {
        return logFilePath;
    }

    public boolean isFileLoggingEnabled() {
        return fileLoggingEnabled;
    }

    // Lookup helpers
    private static String firstNonBlank(String... candidates) {
        for (String candidate : candidates) {
            if (candidate != null && !candidate.trim().isEmpty()) {
                return candidate;
            }
        }
        return null;
    }

    private static String get(Function<String, String> lookup, String key, String defaultValue) {
        String value = lookup.apply(key);
        if (value == null || value.trim().isEmpty()) {
            LOG.fine(() -> String.format("Using default for %s: %s", key, defaultValue));
            return defaultValue;
        }
        return value.trim();
    }

    private static int getInt(Function<String, String> lookup, String key, int defaultValue) {
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

    private static boolean getBoolean(Function<String, String> lookup, String key, boolean defaultValue) {
        String value = lookup.apply(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "metricStoreUrl='" + metricStoreUrl + '\'' +
                ", metricStoreFile='" + metricStoreFile + '\'' +
                ", keycloakUrl='" + keycloakUrl + '\'' +
                ", serverPort=" + serverPort +
                ", refreshIntervalSeconds=" + refreshIntervalSeconds +
                ", refreshEnabled=" + refreshEnabled +
                ", fileLoggingEnabled=" + fileLoggingEnabled +
                '}';
    }

    /**
     * Builder for EngineConfig.
     */
    public static final class Builder {
        private String metricStoreUrl = DEFAULT_METRIC_STORE_URL;
        private String metricStoreFile = "";
        private String keycloakUrl = "";
        private String keycloakRealm = "";
        private String clientId = "";
        private String clientSecret = "";
        private int serverPort = DEFAULT_SERVER_PORT;
        private int refreshIntervalSeconds = DEFAULT_REFRESH_INTERVAL;
        private boolean refreshEnabled = true;
        private String logFilePath = DEFAULT_LOG_FILE;
        private boolean fileLoggingEnabled = true;

        public Builder metricStoreUrl(String metricStoreUrl) {
            this.metricStoreUrl = Objects.requireNonNull(metricStoreUrl, "metricStoreUrl must not be null");
            return this;
        }

        public Builder metricStoreFile(String metricStoreFile) {
            this.metricStoreFile = Objects.requireNonNull(metricStoreFile, "metricStoreFile must not be null");
            return this;
        }

        public Builder keycloakUrl(String keycloakUrl) {
            this.keycloakUrl = keycloakUrl;
            return this;
        }

        public Builder keycloakRealm(String keycloakRealm) {
            this.keycloakRealm = keycloakRealm;
            return this;
        }

        public Builder clientId(String clientId) {
            this.clientId = clientId;
            return this;
        }

        public Builder clientSecret(String clientSecret) {
            this.clientSecret = clientSecret;
            return this;
        }

        public Builder serverPort(int serverPort) {
            if (serverPort < 0 || serverPort > 65535) {
                throw new IllegalArgumentException("serverPort must be between 0 and 65535");
            }
            this.serverPort = serverPort;
            return this;
        }

        public Builder refreshIntervalSeconds(int refreshIntervalSeconds) {
            if (refreshIntervalSeconds < 1) {
                throw new IllegalArgumentException("refreshIntervalSeconds must be at least 1");
            }
            this.refreshIntervalSeconds = refreshIntervalSeconds;
            return this;
        }

        public Builder refreshEnabled(boolean refreshEnabled) {
            this.refreshEnabled = refreshEnabled;
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
