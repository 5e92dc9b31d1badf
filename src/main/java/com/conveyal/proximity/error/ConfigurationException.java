package com.conveyal.proximity.error;

/** Invalid or inconsistent configuration. Affects every scope, so it aborts the run. */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException (String message) {
        super(message);
    }

    public ConfigurationException (String message, Throwable cause) {
        super(message, cause);
    }

}
