package org.dissync.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the sync configuration, layered by precedence:
 * <ol>
 *   <li>Environment variables</li>
 *   <li>System properties ({@code -Dkey=value})</li>
 *   <li>{@code dissync.conf} in the working directory</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    public static final String CONFIG_FILE_NAME = "dissync.conf";

    private ConfigLoader() {
        // Utility class
    }

    public static Config load() {
        return load(CONFIG_FILE_NAME);
    }

    /**
     * Loads the configuration with {@code fileName} as the file layer.
     *
     * @param fileName Path of the configuration file; a missing file is skipped.
     * @return The resolved configuration.
     */
    public static Config load(final String fileName) {
        final Config envConfig = ConfigFactory.systemEnvironment();
        final Config propertyConfig = ConfigFactory.systemProperties();

        final File configFile = new File(fileName);
        final Config fileConfig;
        if (configFile.isFile()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            LOG.debug("Configuration file '{}' not found, using defaults", configFile.getPath());
            fileConfig = ConfigFactory.empty();
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        return envConfig
            .withFallback(propertyConfig)
            .withFallback(fileConfig)
            .withFallback(defaultConfig)
            .resolve();
    }
}
