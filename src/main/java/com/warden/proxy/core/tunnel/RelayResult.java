package com.warden.proxy.core.tunnel;

import java.time.Duration;

/**
 * Byte counts and timings of a finished tunnel.
 *
 * @param bytesClientToUpstream Bytes read from the client and written upstream.
 * @param bytesUpstreamToClient Bytes read from upstream and written to the
 *                              client.
 * @param ttfb                  Time from tunnel establishment to the first byte
 *                              in either direction, or null if none was seen.
 * @param duration              Time from tunnel establishment until both
 *                              directions finished.
 * @param termination           How the tunnel ended.
 */
public record RelayResult(long bytesClientToUpstream, long bytesUpstreamToClient, Duration ttfb, Duration duration,
        Termination termination) {

    /**
     * How a tunnel ended.
     */
    public enum Termination {
        /** Both directions reached end of stream. */
        COMPLETED,
        /** No traffic in either direction for the idle timeout. */
        IDLE_TIMEOUT,
        /** A read or write failed. */
        ERROR
    }

    public boolean isCompleted() {
        return termination == Termination.COMPLETED;
    }
}
