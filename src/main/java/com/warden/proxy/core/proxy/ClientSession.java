package com.warden.proxy.core.proxy;

import java.net.InetAddress;
import java.net.Socket;
import java.time.Duration;
import java.time.Instant;

import com.warden.proxy.core.utils.IoUtils;

/**
 * One accepted client connection and its lifecycle state. Owned by a single
 * worker thread from accept until close.
 */
public class ClientSession implements AutoCloseable {

    private final Socket socket;
    private final String clientIp;
    private final int clientPort;
    private final Instant acceptedAt;
    private final long acceptedNanos;
    private volatile SessionState state = SessionState.ACCEPTED;

    public ClientSession(Socket socket, Instant acceptedAt, long acceptedNanos) {
        this.socket = socket;
        InetAddress address = socket.getInetAddress();
        this.clientIp = address != null ? address.getHostAddress() : "unknown";
        this.clientPort = socket.getPort();
        this.acceptedAt = acceptedAt;
        this.acceptedNanos = acceptedNanos;
    }

    /**
     * Starts a session for a socket accepted just now.
     *
     * @param socket The accepted client socket.
     * @return A new session in state ACCEPTED.
     */
    public static ClientSession open(Socket socket) {
        return new ClientSession(socket, Instant.now(), System.nanoTime());
    }

    /**
     * Moves the session to {@code next}.
     *
     * @param next The next state.
     * @throws IllegalStateException If {@code next} is not reachable from the
     *                               current state.
     */
    public void transition(SessionState next) {
        SessionState current = state;
        if (!current.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal session transition " + current + " -> " + next);
        }
        state = next;
    }

    public SessionState getState() {
        return state;
    }

    public Socket getSocket() {
        return socket;
    }

    public String getClientIp() {
        return clientIp;
    }

    public int getClientPort() {
        return clientPort;
    }

    public Instant getAcceptedAt() {
        return acceptedAt;
    }

    /** Time since the connection was accepted. */
    public Duration elapsed() {
        return Duration.ofNanos(System.nanoTime() - acceptedNanos);
    }

    @Override
    public void close() {
        IoUtils.closeQuietly(socket, "client socket");
    }

    @Override
    public String toString() {
        return clientIp + ":" + clientPort + " [" + state + "]";
    }
}
