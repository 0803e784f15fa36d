package com.yagwr.exception;

/**
 * The rules file cannot be read or parsed, or none of its rules is usable.
 * The application refuses to start.
 */
public class ConfigurationException extends YagwrException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
