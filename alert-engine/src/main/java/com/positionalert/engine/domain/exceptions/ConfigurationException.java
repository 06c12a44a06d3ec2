package com.positionalert.engine.domain.exceptions;

public class ConfigurationException extends RuntimeException {

    private ConfigurationException(String message) {
        super(message);
    }

    public static ConfigurationException missing(String setting) {
        return new ConfigurationException("Required setting is missing: " + setting);
    }

    public static ConfigurationException invalid(String setting, String reason) {
        return new ConfigurationException("Invalid setting " + setting + ": " + reason);
    }
}
