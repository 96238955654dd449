package org.paycron.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.MalformedURLException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Applies the logging section of the configuration (and the --log-path option)
 * to the running Logback context.
 */
public class LoggingConfigurator {
    private static final Logger logger = LoggerFactory.getLogger(LoggingConfigurator.class);

    static final String LOG_FILE_PROPERTY = "LOG_FILE";

    private LoggingConfigurator() {}

    public static void apply(XmlConfiguration.Logging logging, String logPathOverride) {
        String logFile = logPathOverride != null ? logPathOverride
                : (logging != null ? logging.logFile : null);
        String level = logging != null ? logging.level : null;

        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            logger.warn("Logback is not the active SLF4J backend, logging settings ignored");
            return;
        }

        if (logFile != null && !logFile.isBlank()) {
            reload(context, logFile.trim());
        }
        if (level != null && !level.isBlank()) {
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(Level.toLevel(level.trim(), Level.INFO));
        }
        logger.debug("Logging configured: level={}, file={}", level, logFile);
    }

    /** Classpath resource first, then a file on disk. Null when neither exists. */
    static URL locate(String resource) {
        URL url = LoggingConfigurator.class.getClassLoader().getResource(resource);
        if (url != null) {
            return url;
        }
        try {
            Path file = Path.of(resource);
            if (Files.isRegularFile(file)) {
                return file.toUri().toURL();
            }
        } catch (InvalidPathException | MalformedURLException e) {
            logger.warn("Cannot use {} as a logback configuration: {}", resource, e.getMessage());
        }
        return null;
    }

    private static void reload(LoggerContext context, String logFile) {
        String resource = System.getProperty("logback.configurationFile", "logback.xml");
        URL config = locate(resource);
        if (config == null) {
            logger.warn("Logback configuration {} not found, keeping current log file", resource);
            return;
        }
        try {
            JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            context.reset();
            context.putProperty(LOG_FILE_PROPERTY, logFile);
            configurator.doConfigure(config);
            logger.info("Logging to {}", logFile);
        } catch (JoranException e) {
            logger.error("Failed to reconfigure logging for {}: {}", logFile, e.getMessage(), e);
        }
    }
}
