package com.company.watchdog.exception;

/**
 * A checker config or one of its requirement lines could not be parsed.
 */
public class ConfigParseException extends RuntimeException {
    public ConfigParseException(String message) {
        super(message);
    }

    public ConfigParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
