package de.mirkosertic.sitesearch.config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.Level;

/**
 * Configures logging based on the active profile.
 * <p>
 * In deployed mode, loads logback-deployed.xml which writes to a rolling
 * file under ~/.sitesearch/log. In default mode (development), logback.xml
 * with console output is picked up automatically.
 * <p>
 * Selenium logs through java.util.logging and is turned down to WARNING in both modes.
 */
public final class LoggingConfigurator {

    private static final String LOG_DIR = System.getProperty("user.home") + "/.sitesearch/log";
    private static final String DEPLOYED_CONFIG = "logback-deployed.xml";

    private LoggingConfigurator() {
    }

    /**
     * Configure logging based on the active profile.
     * Must be called early in application startup, before logging is used.
     *
     * @param deployedMode true if running in deployed mode
     */
    public static void configure(final boolean deployedMode) {
        java.util.logging.Logger.getLogger("org.openqa.selenium").setLevel(Level.WARNING);
        if (deployedMode) {
            ensureLogDirectoryExists();
            loadConfiguration(DEPLOYED_CONFIG);
        }
    }

    private static void ensureLogDirectoryExists() {
        try {
            final Path logDir = Paths.get(LOG_DIR);
            if (!Files.exists(logDir)) {
                Files.createDirectories(logDir);
            }
        } catch (final Exception e) {
            System.err.println("Warning: Could not create log directory: " + LOG_DIR);
        }
    }

    private static void loadConfiguration(final String configFile) {
        try {
            final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
            context.reset();

            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);

            try (InputStream configStream = LoggingConfigurator.class.getClassLoader()
                    .getResourceAsStream(configFile)) {
                if (configStream != null) {
                    configurator.doConfigure(configStream);
                } else {
                    System.err.println("Warning: Could not find " + configFile + " on classpath");
                }
            }
        } catch (final JoranException e) {
            System.err.println("Warning: Error loading logback configuration: " + e.getMessage());
        } catch (final Exception e) {
            System.err.println("Warning: Unexpected error configuring logging: " + e.getMessage());
        }
    }
}
