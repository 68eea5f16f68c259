package com.swipesentinel.core;

/**
 * A malformed directive, profile, dataset, baseline or config file, or a
 * mismatch between configuration and the action catalog.
 *
 * Always fatal at startup: nothing that raises this is ever partially applied.
 */
public class ConfigException extends RuntimeException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
