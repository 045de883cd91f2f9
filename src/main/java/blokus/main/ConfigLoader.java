package blokus.main;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads driver configuration. Precedence, highest first:
 * environment variables, JVM system properties ({@code -Dblokus.selfplay.games=10}),
 * {@code blokus.conf} in the working directory, {@code reference.conf} on the classpath.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    static final String CONFIG_FILE_NAME = "blokus.conf";

    private ConfigLoader() {}

    public static Config load() {
        return load(new File(CONFIG_FILE_NAME));
    }

    static Config load(File configFile) {
        final Config envConfig = ConfigFactory.systemEnvironment();
        final Config sysConfig = ConfigFactory.systemProperties();

        final Config fileConfig;
        if (configFile.isFile()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            LOG.debug("No configuration file at '{}', using defaults", configFile.getPath());
            fileConfig = ConfigFactory.empty();
        }

        final Config defaults = ConfigFactory.parseResources("reference.conf");

        return envConfig
                .withFallback(sysConfig)
                .withFallback(fileConfig)
                .withFallback(defaults)
                .resolve();
    }
}
