package com.warden.proxy.core.exceptions;

/**
 * Thrown when the destination server cannot be reached or stops responding.
 * The {@link Failure} kind is kept apart from the client-facing status so that
 * logs and metrics can tell the cases apart even though the client always sees
 * 502.
 */
public class UpstreamException extends ProxyException {

    /**
     * Classifies upstream failures.
     */
    public enum Failure {
        /** Host name did not resolve. */
        DNS_FAILURE,
        /** TCP connect did not complete within the connect timeout. */
        CONNECT_TIMEOUT,
        /** Destination actively refused the connection. */
        CONNECTION_REFUSED,
        /** Any other socket error while connecting (no route, network down). */
        UNREACHABLE,
        /** Destination closed the connection before the response was complete. */
        UPSTREAM_CLOSED,
        /** Destination stopped sending for longer than the read timeout. */
        UPSTREAM_TIMEOUT,
        /** Destination sent a response that cannot be framed. */
        INVALID_RESPONSE
    }

    private final Failure failure;

    /** Status line already relayed to the client, or null if nothing was sent. */
    private final String relayedStatusLine;

    public UpstreamException(Failure failure, String message) {
        this(failure, message, null, null);
    }

    public UpstreamException(Failure failure, String message, Throwable cause) {
        this(failure, message, null, cause);
    }

    /**
     * Constructs a new UpstreamException.
     *
     * @param failure           the failure kind.
     * @param message           the detail message.
     * @param relayedStatusLine the response status line already written to the
     *                          client, or null.
     * @param cause             the underlying cause, may be null.
     */
    public UpstreamException(Failure failure, String message, String relayedStatusLine, Throwable cause) {
        super(message, cause);
        this.failure = failure;
        this.relayedStatusLine = relayedStatusLine;
    }

    public Failure getFailure() {
        return failure;
    }

    public String getRelayedStatusLine() {
        return relayedStatusLine;
    }

    /**
     * Whether part of the upstream response already reached the client, in which
     * case no error status can be sent any more.
     *
     * @return true if a response was committed to the client.
     */
    public boolean isResponseCommitted() {
        return relayedStatusLine != null;
    }
}
