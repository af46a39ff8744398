package com.warden.proxy.core.events;

import java.time.Duration;
import java.time.Instant;

import com.warden.proxy.core.proxy.SessionState;

/**
 * Per-session measurements emitted once a session reaches a terminal state.
 *
 * @param timestamp     When the client connection was accepted.
 * @param clientIp      Address of the client.
 * @param targetHost    Destination host, null if the request was not parsed.
 * @param targetPort    Destination port, null if the request was not parsed.
 * @param method        Request method, null if the request was not parsed.
 * @param rawHeaders    Request head as received, null if the request was not
 *                      parsed.
 * @param outcomeLine   Status line sent to the client, null if none was sent.
 * @param state         Terminal session state.
 * @param failureKind   Cause of a failed session, null on success.
 * @param bytesSent     Bytes the proxy sent to the client.
 * @param bytesReceived Bytes the proxy received from the client.
 * @param duration      Time to serve the request.
 * @param ttfb          Time to first byte, null if none was observed.
 */
public record MetricsRecord(Instant timestamp, String clientIp, String targetHost, Integer targetPort, String method,
        String rawHeaders, String outcomeLine, SessionState state, String failureKind, long bytesSent,
        long bytesReceived, Duration duration, Duration ttfb) {

    /**
     * First line of the raw request head, or "-" when unknown.
     */
    public String requestLine() {
        if (rawHeaders == null || rawHeaders.isEmpty()) {
            return "-";
        }
        int end = rawHeaders.indexOf('\n');
        String line = end >= 0 ? rawHeaders.substring(0, end) : rawHeaders;
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

    /**
     * Numeric status of the outcome line, or 0 when no status was sent.
     */
    public int statusCode() {
        if (outcomeLine == null) {
            return 0;
        }
        String[] parts = outcomeLine.split(" ", 3);
        if (parts.length < 2) {
            return 0;
        }
        try {
            return Integer.parseInt(parts[1]);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    public boolean isTunnel() {
        return "CONNECT".equals(method);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Collects the fields of a record while a session progresses.
     */
    public static final class Builder {
        private Instant timestamp;
        private String clientIp;
        private String targetHost;
        private Integer targetPort;
        private String method;
        private String rawHeaders;
        private String outcomeLine;
        private SessionState state;
        private String failureKind;
        private long bytesSent;
        private long bytesReceived;
        private Duration duration = Duration.ZERO;
        private Duration ttfb;

        private Builder() {
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder clientIp(String clientIp) {
            this.clientIp = clientIp;
            return this;
        }

        public Builder target(String host, int port) {
            this.targetHost = host;
            this.targetPort = port;
            return this;
        }

        public Builder method(String method) {
            this.method = method;
            return this;
        }

        public Builder rawHeaders(String rawHeaders) {
            this.rawHeaders = rawHeaders;
            return this;
        }

        public Builder outcomeLine(String outcomeLine) {
            this.outcomeLine = outcomeLine;
            return this;
        }

        public Builder state(SessionState state) {
            this.state = state;
            return this;
        }

        public Builder failureKind(String failureKind) {
            this.failureKind = failureKind;
            return this;
        }

        public Builder bytesSent(long bytesSent) {
            this.bytesSent = bytesSent;
            return this;
        }

        public Builder bytesReceived(long bytesReceived) {
            this.bytesReceived = bytesReceived;
            return this;
        }

        public Builder addBytesSent(long delta) {
            this.bytesSent += delta;
            return this;
        }

        public Builder duration(Duration duration) {
            this.duration = duration;
            return this;
        }

        public Builder ttfb(Duration ttfb) {
            this.ttfb = ttfb;
            return this;
        }

        public MetricsRecord build() {
            return new MetricsRecord(timestamp, clientIp, targetHost, targetPort, method, rawHeaders, outcomeLine,
                    state, failureKind, bytesSent, bytesReceived, duration, ttfb);
        }
    }
}
