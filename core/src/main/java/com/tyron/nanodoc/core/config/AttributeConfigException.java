package com.tyron.nanodoc.core.config;

/**
 * Thrown when an attribute configuration file cannot be read or describes an invalid catalog.
 */
public class AttributeConfigException extends RuntimeException {

    public AttributeConfigException(String message) {
        super(message);
    }

    public AttributeConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
