package org.logsim.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the application configuration. Sources in order of precedence:
 * <ol>
 *   <li>environment variables</li>
 *   <li>system properties ({@code -Dlogsim.simulation.default-cycles=20})</li>
 *   <li>the file given with {@code --config}, or {@code logsim.conf} in the working directory</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** Looked up in the working directory when no file is given explicitly. */
    public static final String CONFIG_FILE_NAME = "logsim.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the merged configuration.
     * @param explicitFile The file named on the command line, or {@code null}.
     * @return The resolved configuration.
     * @throws com.typesafe.config.ConfigException if the explicit file is missing or any source is malformed.
     */
    public static Config load(final File explicitFile) {
        final Config fileConfig;
        if (explicitFile != null) {
            LOG.info("Using configuration file specified via --config: {}", explicitFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(explicitFile, ConfigParseOptions.defaults().setAllowMissing(false));
        } else {
            fileConfig = loadWorkingDirectoryFile(new File(CONFIG_FILE_NAME));
        }

        // The one provided first wins.
        return ConfigFactory.systemEnvironment()
                .withFallback(ConfigFactory.systemProperties())
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.parseResources("reference.conf"))
                .resolve();
    }

    /**
     * Loads only the classpath defaults, without any environment or file overrides.
     * @return The resolved defaults.
     */
    public static Config defaults() {
        return ConfigFactory.parseResources("reference.conf").resolve();
    }

    static Config loadWorkingDirectoryFile(final File file) {
        if (file.exists() && !file.isDirectory()) {
            LOG.info("Loading configuration from file: {}", file.getAbsolutePath());
            return ConfigFactory.parseFile(file);
        }
        LOG.debug("Configuration file '{}' not found. Using defaults.", file.getPath());
        return ConfigFactory.empty();
    }
}
