package org.minicc.node.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads the application configuration. Sources, highest precedence first:
 * <ol>
 *     <li>environment variables</li>
 *     <li>system properties ({@code -Dkey=value})</li>
 *     <li>a configuration file: the one given explicitly, else {@code minicc.conf} in the working directory</li>
 *     <li>{@code reference.conf} on the classpath</li>
 * </ol>
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    static final String CONFIG_FILE_NAME = "minicc.conf";

    private ConfigLoader() {
    }

    /**
     * Loads the configuration using {@code minicc.conf} in the working directory if it exists.
     *
     * @return The resolved configuration.
     */
    public static Config load() {
        final Path workingDirFile = Path.of(CONFIG_FILE_NAME);
        if (Files.isRegularFile(workingDirFile)) {
            return load(workingDirFile);
        }
        LOG.debug("Configuration file '{}' not found in working directory. Using defaults.", CONFIG_FILE_NAME);
        return merge(ConfigFactory.empty());
    }

    /**
     * Loads the configuration with the given file in the file slot.
     *
     * @param configFile The configuration file.
     * @return The resolved configuration.
     * @throws IllegalArgumentException if the file does not exist.
     * @throws com.typesafe.config.ConfigException if the file cannot be parsed or resolved.
     */
    public static Config load(final Path configFile) {
        if (!Files.isRegularFile(configFile)) {
            throw new IllegalArgumentException("Configuration file not found: " + configFile.toAbsolutePath());
        }
        LOG.debug("Loading configuration from file: {}", configFile.toAbsolutePath());
        return merge(ConfigFactory.parseFile(configFile.toFile()));
    }

    private static Config merge(final Config fileConfig) {
        return ConfigFactory.systemEnvironment()
            .withFallback(ConfigFactory.systemProperties())
            .withFallback(fileConfig)
            .withFallback(ConfigFactory.parseResources("reference.conf"))
            .resolve();
    }
}
