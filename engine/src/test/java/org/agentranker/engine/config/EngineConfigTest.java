package org.agentranker.engine.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

public class EngineConfigTest {

    @Test
    public void shouldUseDefaultsWhenNothingSet() {
        EngineConfig config = EngineConfig.fromLookup(key -> null);

        Assertions.assertEquals(EngineConfig.DEFAULT_METRIC_STORE_URL, config.getMetricStoreUrl());
        Assertions.assertEquals(8083, config.getServerPort());
        Assertions.assertEquals(60, config.getRefreshIntervalSeconds());
        Assertions.assertTrue(config.isRefreshEnabled());
        Assertions.assertFalse(config.isFileMetricStore());
        Assertions.assertFalse(config.isAuthEnabled());
    }

    @Test
    public void shouldReadValuesFromLookup() {
        Map<String, String> env = new HashMap<>();
        env.put("METRIC_STORE_FILE", " data/snapshot.json ");
        env.put("RANKING_PORT", "9090");
        env.put("SNAPSHOT_REFRESH_SECONDS", "15");
        env.put("SNAPSHOT_REFRESH_ENABLED", "false");
        env.put("RANKING_FILE_LOGGING_ENABLED", "0");

        EngineConfig config = EngineConfig.fromLookup(env::get);

        Assertions.assertTrue(config.isFileMetricStore());
        Assertions.assertEquals("data/snapshot.json", config.getMetricStoreFile());
        Assertions.assertEquals(9090, config.getServerPort());
        Assertions.assertEquals(15, config.getRefreshIntervalSeconds());
        Assertions.assertFalse(config.isRefreshEnabled());
        Assertions.assertFalse(config.isFileLoggingEnabled());
    }

    @Test
    public void shouldFallBackToDefaultForInvalidInteger() {
        EngineConfig config = EngineConfig.fromLookup(key -> "RANKING_PORT".equals(key) ? "eighty" : null);

        Assertions.assertEquals(EngineConfig.DEFAULT_SERVER_PORT, config.getServerPort());
    }

    @Test
    public void shouldEnableAuthWhenRealmAndClientConfigured() {
        Map<String, String> env = new HashMap<>();
        env.put("KEYCLOAK_URL", "http://keycloak:8080");
        env.put("KEYCLOAK_REALM", "travel");
        env.put("KEYCLOAK_CLIENT_ID", "ranking-engine");

        Assertions.assertTrue(EngineConfig.fromLookup(env::get).isAuthEnabled());

        env.remove("KEYCLOAK_REALM");
        Assertions.assertFalse(EngineConfig.fromLookup(env::get).isAuthEnabled());
    }

    @Test
    public void shouldRejectOutOfRangePort() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> EngineConfig.fromLookup(key -> "RANKING_PORT".equals(key) ? "70000" : null));
    }
}
