package com.warden.proxy.core.exceptions;

/**
 * Thrown when a complete header block does not arrive within the configured
 * header read window.
 */
public class RequestTimeoutException extends ProtocolException {
    public RequestTimeoutException(String message) {
        super(message);
    }

    public RequestTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
