package com.sitewatch.service.config;

import com.sitewatch.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.logging.Logger;

public final class ConfigLoader {
    private static final Logger LOGGER = Logger.getLogger(ConfigLoader.class.getName());

    public static final String CONFIG_FILE = "watcher.json";
    public static final String CONFIG_DIR_ENV = "WATCHER_CONFIG_DIR";

    private ConfigLoader() {
    }

    public static Path configDir(Map<String, String> environment) {
        String override = environment.get(CONFIG_DIR_ENV);
        return Path.of(override == null || override.isBlank() ? "config" : override);
    }

    /**
     * Reads {@code watcher.json} from {@code configDir}. A missing file yields the defaults; an
     * unreadable file or out-of-range values fail with an {@link IllegalStateException} naming it.
     */
    public static ServiceConfig load(Path configDir) {
        Path path = configDir.resolve(CONFIG_FILE);
        if (!Files.exists(path)) {
            LOGGER.info("No " + path + " found; using default settings");
            return ServiceConfig.defaults();
        }
        ServiceConfig config;
        try (InputStream in = Files.newInputStream(path)) {
            config = JsonUtils.objectMapper().readValue(in, ServiceConfig.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
        if (config == null) {
            return ServiceConfig.defaults();
        }
        try {
            config.toSettings();
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid config in " + path + ": " + e.getMessage(), e);
        }
        if (config.defaultSites() != null && config.defaultSites().contains(null)) {
            throw new IllegalStateException("Invalid config in " + path + ": default_sites must not contain null entries");
        }
        return config;
    }
}
