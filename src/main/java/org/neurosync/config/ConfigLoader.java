package org.neurosync.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the application configuration from its layered sources.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    public static final String CONFIG_FILE_NAME = "neurosync.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration with {@code neurosync.conf} from the working directory.
     *
     * @see #load(File)
     */
    public static Config load() {
        return load(new File(CONFIG_FILE_NAME));
    }

    /**
     * Loads the configuration, highest precedence first:
     * <ol>
     *   <li>environment variables</li>
     *   <li>system properties ({@code -Dneurosync.http.max-gateway-retries=3})</li>
     *   <li>the given configuration file, if it exists</li>
     *   <li>{@code reference.conf} from the classpath</li>
     * </ol>
     *
     * @param configFile the configuration file, may be absent
     * @return the resolved configuration
     */
    public static Config load(final File configFile) {
        final Config envConfig = ConfigFactory.systemEnvironment();
        final Config propertyConfig = ConfigFactory.systemProperties();

        final Config fileConfig;
        if (configFile != null && configFile.isFile()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            LOG.debug("Configuration file '{}' not found, using defaults.", configFile);
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
