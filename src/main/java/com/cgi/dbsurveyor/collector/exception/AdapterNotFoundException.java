package com.cgi.dbsurveyor.collector.exception;

/**
 * Raised when no adapter is registered for the requested engine.
 */
public class AdapterNotFoundException extends BaseException {
    private static final long serialVersionUID = 1L;

    /**
     * Creates a new AdapterNotFoundException with the specified message.
     *
     * @param message Exception message
     */
    public AdapterNotFoundException(String message) {
        super(message, "ADAPTER_NOT_FOUND");
    }

    /**
     * Creates a new AdapterNotFoundException with the specified message and cause.
     *
     * @param message Exception message
     * @param cause The cause of the exception
     */
    public AdapterNotFoundException(String message, Throwable cause) {
        super(message, cause, "ADAPTER_NOT_FOUND");
    }
}
