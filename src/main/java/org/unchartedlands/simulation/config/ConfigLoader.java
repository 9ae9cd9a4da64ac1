package org.unchartedlands.simulation.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Responsible for loading the application configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    public static final String DEFAULT_CONFIG_FILE_NAME = "simulation.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration using {@value #DEFAULT_CONFIG_FILE_NAME} in the working directory.
     *
     * @return the resolved configuration
     */
    public static Config load() {
        return load(DEFAULT_CONFIG_FILE_NAME);
    }

    /**
     * Loads the application configuration, respecting the precedence order:
     * 1. Environment variable overrides ({@code CONFIG_FORCE_simulation_scheduler_tick__rate=30})
     * 2. Java System Properties (e.g., -Dsimulation.scheduler.tick-rate=30)
     * 3. Configuration file (a file path, or a classpath resource if no such file exists)
     * 4. Default values (from reference.conf on the classpath)
     *
     * @param configPath path of the configuration file
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load(final String configPath) {
        final Config envConfig = ConfigFactory.systemEnvironmentOverrides();
        final Config systemConfig = ConfigFactory.systemProperties();
        final Config fileConfig = loadFileConfig(configPath);
        final Config defaultConfig = ConfigFactory.defaultReference();

        // The one provided first wins.
        final Config combinedConfig = envConfig
            .withFallback(systemConfig)
            .withFallback(fileConfig)
            .withFallback(defaultConfig);

        return combinedConfig.resolve();
    }

    private static Config loadFileConfig(final String configPath) {
        final File configFile = new File(configPath);
        final Config fileConfig;
        if (configFile.isFile()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            fileConfig = ConfigFactory.parseResources(configPath);
        }

        if (fileConfig.isEmpty()) {
            LOG.warn("Configuration file '{}' not found or is empty. Using defaults.", configPath);
        }
        return fileConfig;
    }
}
