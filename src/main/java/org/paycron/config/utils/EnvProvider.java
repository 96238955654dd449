package org.paycron.config.utils;

import io.github.cdimascio.dotenv.Dotenv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * EnvProvider acts as the universal environment bootstrap.
 *
 * Responsibilities:
 *  1 Loads environment variables (.env or system)
 *  2 Selects the Logback config (dev/prod)
 *  3 Resolves the config file location and the home directory
 */
public class EnvProvider {

    private static final String ENV_ENVIRONMENT = "APP_ENV";
    private static final String ENV_CONFIG_PATH = "PAYCRON_CONFIG";
    private static final String ENV_HOME = "HOME";

    private static boolean initialized = false;
    private static Dotenv dotenv;

    // Logger (may initialize after logback switch)
    private static Logger logger;

    // Cached environment state
    private static String activeEnv = "PROD";

    private EnvProvider() {}

    /** Initialize environment and logger config. Must run before the first logger is created. */
    public static synchronized void init() {
        if (initialized) return;

        // Load .env file first (safe in dev)
        dotenv = Dotenv.configure().ignoreIfMissing().load();

        String env = get(ENV_ENVIRONMENT, "PROD");
        activeEnv = env.toUpperCase();

        System.setProperty(ENV_ENVIRONMENT, activeEnv);

        // Switch logback config before other loggers initialize
        if ("DEV".equals(activeEnv) && System.getProperty("logback.configurationFile") == null) {
            System.setProperty("logback.configurationFile", "logback-dev.xml");
        }

        logger = LoggerFactory.getLogger(EnvProvider.class);
        logger.info("Environment initialized: {}", activeEnv);

        initialized = true;
    }

    /** System environment first, then .env, then the fallback. */
    public static String get(String key, String fallback) {
        String value = System.getenv(key);
        if (value == null || value.isBlank()) {
            if (dotenv == null) {
                dotenv = Dotenv.configure().ignoreIfMissing().load();
            }
            value = dotenv.get(key);
        }
        return (value == null || value.isBlank()) ? fallback : value.trim();
    }

    public static String configPath(String fallback) {
        return get(ENV_CONFIG_PATH, fallback);
    }

    public static String homeDir() {
        return get(ENV_HOME, System.getProperty("user.home"));
    }
}
