package org.paycron.config;

import org.paycron.exceptions.ConfigurationException;

/**
 * {@code [-c|--config-path <file>] [-l|--log-path <file>]}. A single bare
 * argument is taken as the config path.
 */
public record CliOptions(String configPath, String logPath) {

    public static CliOptions parse(String[] args) {
        String configPath = null;
        String logPath = null;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-c", "--config-path" -> configPath = value(args, ++i, arg);
                case "-l", "--log-path" -> logPath = value(args, ++i, arg);
                default -> {
                    if (arg.startsWith("--config-path=")) {
                        configPath = arg.substring("--config-path=".length());
                    } else if (arg.startsWith("--log-path=")) {
                        logPath = arg.substring("--log-path=".length());
                    } else if (!arg.startsWith("-") && configPath == null) {
                        configPath = arg;
                    } else {
                        throw new ConfigurationException("Unknown argument: " + arg
                                + ". Usage: paycron [-c|--config-path <file>] [-l|--log-path <file>]");
                    }
                }
            }
        }
        return new CliOptions(configPath, logPath);
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length || args[index].isBlank()) {
            throw new ConfigurationException("Missing value for " + option);
        }
        return args[index];
    }
}
