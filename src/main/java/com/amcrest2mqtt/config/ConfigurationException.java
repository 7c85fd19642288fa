package com.amcrest2mqtt.config;

/** Missing or invalid configuration value. Always fatal at startup. */
public class ConfigurationException extends Exception {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
