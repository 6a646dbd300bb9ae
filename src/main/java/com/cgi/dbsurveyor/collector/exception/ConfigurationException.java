package com.cgi.dbsurveyor.collector.exception;

/**
 * Exception for invalid collector configuration.
 */
public class ConfigurationException extends BaseException {
    private static final long serialVersionUID = 1L;

    /**
     * Creates a new ConfigurationException with the specified message.
     *
     * @param message Exception message
     */
    public ConfigurationException(String message) {
        super(message, "CONFIGURATION_ERROR");
    }

    /**
     * Creates a new ConfigurationException with the specified message and cause.
     *
     * @param message Exception message
     * @param cause The cause of the exception
     */
    public ConfigurationException(String message, Throwable cause) {
        super(message, cause, "CONFIGURATION_ERROR");
    }
}
