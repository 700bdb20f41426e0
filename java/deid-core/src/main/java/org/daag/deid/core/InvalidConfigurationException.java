package org.daag.deid.core;

/**
 * configuration that can't be used to start a run: a blank or rejected salt, a missing config
 * property, an input path that doesn't exist
 *
 * fatal; nothing should be written to output once this is thrown
 */
public class InvalidConfigurationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
