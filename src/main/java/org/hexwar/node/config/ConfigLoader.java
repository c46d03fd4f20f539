package org.hexwar.node.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the engine configuration from layered sources.
 * <p>
 * Precedence, highest first:
 * <ol>
 *   <li>Environment variables</li>
 *   <li>Java system properties ({@code -Dhexwar.settings.seed=7})</li>
 *   <li>{@value #CONFIG_FILE_NAME} in the working directory, or a given classpath resource</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    static final String CONFIG_FILE_NAME = "hexwar.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration with {@value #CONFIG_FILE_NAME} from the working directory as the
     * file layer.
     *
     * @return the resolved configuration.
     */
    public static Config load() {
        final File configFile = new File(CONFIG_FILE_NAME);
        final Config fileConfig;
        if (configFile.isFile()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            LOG.debug("Configuration file '{}' not found, using defaults.", configFile.getPath());
            fileConfig = ConfigFactory.empty();
        }
        return layer(fileConfig);
    }

    /**
     * Loads the configuration with a classpath resource as the file layer.
     *
     * @param resource the classpath resource, e.g. {@code "games/skirmish.conf"}.
     * @return the resolved configuration.
     */
    public static Config load(final String resource) {
        final Config fileConfig = ConfigFactory.parseResources(resource);
        if (fileConfig.isEmpty()) {
            LOG.warn("Configuration file '{}' not found or is empty. Using defaults.", resource);
        } else {
            LOG.debug("Loaded configuration resource '{}'", resource);
        }
        return layer(fileConfig);
    }

    private static Config layer(final Config fileConfig) {
        final Config envConfig = ConfigFactory.systemEnvironment();
        final Config propertyConfig = ConfigFactory.systemProperties();
        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // The one provided first wins.
        return envConfig
                .withFallback(propertyConfig)
                .withFallback(fileConfig)
                .withFallback(defaultConfig)
                .resolve();
    }
}
