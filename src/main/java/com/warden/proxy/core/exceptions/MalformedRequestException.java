package com.warden.proxy.core.exceptions;

/**
 * Thrown when the request line or a header line cannot be parsed, or when no
 * target host can be derived from the request.
 */
public class MalformedRequestException extends ProtocolException {
    public MalformedRequestException(String message) {
        super(message);
    }

    public MalformedRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
