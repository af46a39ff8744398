package com.warden.proxy.core.exceptions;

/**
 * Thrown when the client closes its side of the connection before the header
 * block is terminated by an empty line.
 */
public class IncompleteRequestException extends ProtocolException {
    public IncompleteRequestException(String message) {
        super(message);
    }
}
