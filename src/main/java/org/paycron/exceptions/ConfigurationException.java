package org.paycron.exceptions;

/**
 * Invalid or unusable startup configuration: bad cron expression, missing jobs,
 * unreachable payment node. Fatal, the process stops before scheduling begins.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
