package com.warden.proxy.core.proxy;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.warden.proxy.core.constants.HeaderConstants;
import com.warden.proxy.core.events.BlockedEvent;
import com.warden.proxy.core.events.EventSink;
import com.warden.proxy.core.events.MetricsRecord;
import com.warden.proxy.core.exceptions.IncompleteRequestException;
import com.warden.proxy.core.exceptions.MalformedRequestException;
import com.warden.proxy.core.exceptions.RequestTimeoutException;
import com.warden.proxy.core.exceptions.UpstreamException;
import com.warden.proxy.core.http.ForwardResult;
import com.warden.proxy.core.http.HttpForwarder;
import com.warden.proxy.core.http.ParsedRequest;
import com.warden.proxy.core.http.RequestParser;
import com.warden.proxy.core.policy.AccessDecision;
import com.warden.proxy.core.policy.AccessPolicy;
import com.warden.proxy.core.policy.RateLimiter;
import com.warden.proxy.core.tunnel.RelayResult;
import com.warden.proxy.core.tunnel.TunnelRelay;
import com.warden.proxy.core.utils.IoUtils;

/**
 * Drives one client session from parse to outcome: classification, access
 * checks, upstream connect, then forwarding or tunneling. Every session emits
 * exactly one event and leaves no socket open.
 */
public class SessionHandler {

    private static final Logger log = LoggerFactory.getLogger(SessionHandler.class);

    static final String CONNECTION_ESTABLISHED = "HTTP/1.1 200 Connection Established";

    static final String FAILURE_MALFORMED = "MALFORMED_REQUEST";
    static final String FAILURE_INCOMPLETE = "INCOMPLETE_REQUEST";
    static final String FAILURE_REQUEST_TIMEOUT = "REQUEST_TIMEOUT";
    static final String FAILURE_CLIENT_IO = "CLIENT_IO_ERROR";
    static final String FAILURE_RELAY = "RELAY_ERROR";
    static final String FAILURE_INTERNAL = "INTERNAL_ERROR";

    private final RequestParser parser;
    private final AccessPolicy accessPolicy;
    private final RateLimiter rateLimiter;
    private final UpstreamConnector connector;
    private final HttpForwarder forwarder;
    private final TunnelRelay tunnelRelay;
    private final EventSink eventSink;
    private final int headerTimeout;
    private final int readTimeout;

    /**
     * @param parser        Request head parser.
     * @param accessPolicy  Destination block list.
     * @param rateLimiter   Per-client request limiter.
     * @param connector     Opens upstream connections.
     * @param forwarder     Relays plain HTTP exchanges.
     * @param tunnelRelay   Relays CONNECT tunnels.
     * @param eventSink     Receives one event per session.
     * @param headerTimeout Client socket timeout while reading the request
     *                      head, in milliseconds.
     * @param readTimeout   Client socket timeout while reading a request body,
     *                      in milliseconds.
     */
    public SessionHandler(RequestParser parser, AccessPolicy accessPolicy, RateLimiter rateLimiter,
            UpstreamConnector connector, HttpForwarder forwarder, TunnelRelay tunnelRelay, EventSink eventSink,
            int headerTimeout, int readTimeout) {
        this.parser = parser;
        this.accessPolicy = accessPolicy;
        this.rateLimiter = rateLimiter;
        this.connector = connector;
        this.forwarder = forwarder;
        this.tunnelRelay = tunnelRelay;
        this.eventSink = eventSink;
        this.headerTimeout = headerTimeout;
        this.readTimeout = readTimeout;
    }

    /**
     * Serves the session to completion. Closes the client socket and any
     * upstream socket before returning.
     *
     * @param session A session in state ACCEPTED.
     */
    public void handle(ClientSession session) {
        Exchange exchange = new Exchange(session);
        try {
            serve(exchange);
        } catch (IOException e) {
            log.debug("Client {} I/O error in state {}: {}", session.getClientIp(), session.getState(),
                    e.getMessage());
            exchange.fail(FAILURE_CLIENT_IO);
        } catch (RuntimeException e) {
            exchange.fail(FAILURE_INTERNAL);
            throw e;
        } finally {
            IoUtils.closeQuietly(exchange.upstream, "upstream socket");
            session.close();
            emit(exchange);
        }
    }

    private void serve(Exchange ex) throws IOException {
        ClientSession session = ex.session;
        Socket client = session.getSocket();
        client.setSoTimeout(headerTimeout);
        InputStream in = new BufferedInputStream(client.getInputStream(), IoUtils.DEFAULT_BUFFER_SIZE);
        ex.out = client.getOutputStream();

        session.transition(SessionState.PARSING);
        ParsedRequest request = parse(ex, in);
        if (request == null) {
            return;
        }
        session.transition(SessionState.CLASSIFIED);
        ex.record.target(request.getHost(), request.getPort())
                .method(request.getMethod())
                .rawHeaders(request.getRawHeaderText())
                .bytesReceived(request.getRawHeadLength());

        session.transition(SessionState.POLICY_CHECK);
        AccessDecision decision = accessPolicy.evaluate(request.getHost());
        if (decision.getVerdict() == AccessDecision.Verdict.BLOCKED) {
            session.transition(SessionState.BLOCKED);
            ex.blocked = new BlockedEvent(Instant.now(), request.getHost(), session.getClientIp(),
                    decision.getMatchedPattern());
            respond(ex, 403, "Forbidden");
            return;
        }
        decision = rateLimiter.admit(session.getClientIp());
        if (decision.getVerdict() == AccessDecision.Verdict.RATE_LIMITED) {
            session.transition(SessionState.RATE_LIMITED);
            respond(ex, 429, "Too Many Requests",
                    HeaderConstants.RETRY_AFTER.getValue() + ": " + decision.getWindow().toSeconds());
            return;
        }
        session.transition(SessionState.AUTHORIZED);

        session.transition(SessionState.CONNECTING);
        try {
            ex.upstream = connector.connect(request.getHost(), request.getPort());
        } catch (UpstreamException e) {
            session.transition(SessionState.CONNECT_FAILED);
            log.info("Connect to {}:{} for {} failed ({}): {}", request.getHost(), request.getPort(),
                    session.getClientIp(), e.getFailure(), e.getMessage());
            ex.record.failureKind(e.getFailure().name());
            respond(ex, 502, "Bad Gateway");
            return;
        }
        session.transition(SessionState.CONNECTED);

        if (request.isConnect()) {
            tunnel(ex, in);
        } else {
            forward(ex, request, in);
        }
    }

    private ParsedRequest parse(Exchange ex, InputStream in) {
        String failure;
        try {
            return parser.parse(in);
        } catch (MalformedRequestException e) {
            failure = FAILURE_MALFORMED;
            log.debug("Malformed request from {}: {}", ex.session.getClientIp(), e.getMessage());
        } catch (IncompleteRequestException e) {
            failure = FAILURE_INCOMPLETE;
            log.debug("Incomplete request from {}: {}", ex.session.getClientIp(), e.getMessage());
        } catch (RequestTimeoutException e) {
            failure = FAILURE_REQUEST_TIMEOUT;
            log.debug("Request head from {} timed out: {}", ex.session.getClientIp(), e.getMessage());
        } catch (IOException e) {
            failure = FAILURE_CLIENT_IO;
            log.debug("Read error from {}: {}", ex.session.getClientIp(), e.getMessage());
        }
        ex.session.transition(SessionState.MALFORMED);
        ex.record.failureKind(failure);
        respond(ex, 400, "Bad Request");
        return null;
    }

    private void forward(Exchange ex, ParsedRequest request, InputStream in) throws IOException {
        ClientSession session = ex.session;
        session.transition(SessionState.FORWARDING);
        session.getSocket().setSoTimeout(readTimeout);
        try {
            ForwardResult result = forwarder.forward(request, in, ex.out, ex.upstream);
            session.transition(SessionState.COMPLETED);
            ex.record.outcomeLine(result.statusLine())
                    .bytesSent(result.bytesToClient())
                    .bytesReceived(request.getRawHeadLength() + result.requestBodyBytes())
                    .ttfb(result.ttfb());
            ex.duration = result.duration();
        } catch (UpstreamException e) {
            session.transition(SessionState.FAILED);
            ex.record.failureKind(e.getFailure().name());
            log.info("Forwarding {} for {} failed ({}): {}", request.getTarget(), session.getClientIp(),
                    e.getFailure(), e.getMessage());
            if (e.isResponseCommitted()) {
                ex.record.outcomeLine(e.getRelayedStatusLine());
            } else {
                respond(ex, 502, "Bad Gateway");
            }
        }
    }

    private void tunnel(Exchange ex, InputStream in) throws IOException {
        ClientSession session = ex.session;
        session.transition(SessionState.TUNNELING);
        // The confirmation is not part of the relayed byte counts
        ex.out.write((CONNECTION_ESTABLISHED + "\r\n\r\n").getBytes(StandardCharsets.US_ASCII));
        ex.out.flush();
        ex.record.outcomeLine(CONNECTION_ESTABLISHED);

        Socket upstream = ex.upstream;
        RelayResult result = tunnelRelay.relay(session.getSocket(), in, upstream, Instant.now());
        ex.upstream = null;

        ex.record.bytesSent(result.bytesUpstreamToClient())
                .bytesReceived(result.bytesClientToUpstream())
                .ttfb(result.ttfb());
        ex.duration = result.duration();
        if (result.termination() == RelayResult.Termination.ERROR) {
            session.transition(SessionState.FAILED);
            ex.record.failureKind(FAILURE_RELAY);
        } else {
            session.transition(SessionState.COMPLETED);
        }
    }

    private void respond(Exchange ex, int status, String reason, String... extraHeaders) {
        String statusLine = "HTTP/1.1 " + status + " " + reason;
        StringBuilder response = new StringBuilder(statusLine).append("\r\n");
        for (String header : extraHeaders) {
            response.append(header).append("\r\n");
        }
        response.append("Content-Length: 0\r\n")
                .append("Connection: close\r\n\r\n");
        byte[] bytes = response.toString().getBytes(StandardCharsets.US_ASCII);
        ex.record.outcomeLine(statusLine);
        try {
            ex.out.write(bytes);
            ex.out.flush();
            ex.record.addBytesSent(bytes.length);
        } catch (IOException e) {
            log.debug("Failed to send {} to {}: {}", status, ex.session.getClientIp(), e.getMessage());
        }
    }

    private void emit(Exchange ex) {
        try {
            if (ex.blocked != null) {
                eventSink.recordBlocked(ex.blocked);
            } else {
                Duration duration = ex.duration != null ? ex.duration : ex.session.elapsed();
                eventSink.recordRequest(ex.record.state(ex.session.getState()).duration(duration).build());
            }
        } catch (RuntimeException e) {
            log.warn("Event sink rejected session event for {}: {}", ex.session.getClientIp(), e.getMessage(), e);
        }
    }

    /**
     * Mutable per-session bookkeeping.
     */
    private static final class Exchange {
        final ClientSession session;
        final MetricsRecord.Builder record;
        OutputStream out;
        Socket upstream;
        BlockedEvent blocked;
        Duration duration;

        Exchange(ClientSession session) {
            this.session = session;
            this.record = MetricsRecord.builder()
                    .timestamp(session.getAcceptedAt())
                    .clientIp(session.getClientIp());
        }

        void fail(String failureKind) {
            if (session.getState().canTransitionTo(SessionState.FAILED)) {
                session.transition(SessionState.FAILED);
            }
            record.failureKind(failureKind);
        }
    }
}
