package com.sitewatch.service.config;

import com.sitewatch.core.model.SiteRequest;
import com.sitewatch.polling.config.WatcherSettings;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigLoaderTest {
    @Test
    void loadsSettingsAndDefaultSites() throws Exception {
        Path dir = Files.createTempDirectory("config-loader-");
        Files.writeString(dir.resolve("watcher.json"), """
                {
                  "update_cache_size": 3,
                  "default_interval_secs": 30,
                  "interval_jitter_max_ms": 0,
                  "fetch_timeout": "PT4S",
                  "backoff_cap": "PT2H",
                  "port": 9090,
                  "state_file": "data/state.json",
                  "default_sites": [
                    {"url": "https://example.com/feed", "interval_secs": 1100, "style": "random"},
                    {"url": "https://example.org"}
                  ]
                }
                """);

        ServiceConfig config = ConfigLoader.load(dir);
        WatcherSettings settings = config.toSettings();

        assertEquals(3, settings.updateCacheSize());
        assertEquals(30, settings.defaultIntervalSecs());
        assertEquals(0, settings.intervalJitterMaxMs());
        assertEquals(Duration.ofSeconds(4), settings.fetchTimeout());
        assertEquals(Duration.ofHours(2), settings.backoffCap());
        assertEquals(WatcherSettings.DEFAULT_PREVIEW_LENGTH, settings.previewLength());
        assertEquals(9090, config.resolvedPort());
        assertEquals(Path.of("data/state.json"), config.resolvedStateFile());
        assertEquals(List.of(
                new SiteRequest("https://example.com/feed", 1100, "random"),
                new SiteRequest("https://example.org", null, null)
        ), config.resolvedDefaultSites());
    }

    @Test
    void missingFileYieldsDefaults() throws Exception {
        Path dir = Files.createTempDirectory("config-loader-empty-");

        ServiceConfig config = ConfigLoader.load(dir);

        assertEquals(WatcherSettings.defaults(), config.toSettings());
        assertEquals(ServiceConfig.DEFAULT_PORT, config.resolvedPort());
        assertEquals(Path.of(ServiceConfig.DEFAULT_STATE_FILE), config.resolvedStateFile());
        assertTrue(config.resolvedDefaultSites().isEmpty());
    }

    @Test
    void malformedOrOutOfRangeConfigFailsFastWithPathInMessage() throws Exception {
        Path dir = Files.createTempDirectory("config-loader-invalid-");
        Files.writeString(dir.resolve("watcher.json"), "{not-json");

        IllegalStateException malformed = assertThrows(IllegalStateException.class, () -> ConfigLoader.load(dir));
        assertTrue(malformed.getMessage().contains("watcher.json"));

        Files.writeString(dir.resolve("watcher.json"), "{\"update_cache_size\": 0}");
        IllegalStateException outOfRange = assertThrows(IllegalStateException.class, () -> ConfigLoader.load(dir));
        assertTrue(outOfRange.getMessage().contains("watcher.json"));
        assertTrue(outOfRange.getMessage().contains("update_cache_size"));

        Files.writeString(dir.resolve("watcher.json"), "{\"backoff_cap\": \"PT10M\"}");
        assertThrows(IllegalStateException.class, () -> ConfigLoader.load(dir));

        Files.writeString(dir.resolve("watcher.json"), "{\"default_sites\": [{\"url\": \"https://example.com\"}, null]}");
        IllegalStateException nullSite = assertThrows(IllegalStateException.class, () -> ConfigLoader.load(dir));
        assertTrue(nullSite.getMessage().contains("watcher.json"));
        assertTrue(nullSite.getMessage().contains("default_sites"));
    }

    @Test
    void configDirCanBeOverriddenFromEnvironment() {
        assertEquals(Path.of("config"), ConfigLoader.configDir(Map.of()));
        assertEquals(Path.of("/etc/watcher"), ConfigLoader.configDir(Map.of(ConfigLoader.CONFIG_DIR_ENV, "/etc/watcher")));
    }
}
