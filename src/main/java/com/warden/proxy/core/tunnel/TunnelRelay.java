package com.warden.proxy.core.tunnel;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.warden.proxy.core.tunnel.RelayResult.Termination;
import com.warden.proxy.core.utils.IoUtils;

/**
 * Relays raw bytes between a client and an upstream socket after a CONNECT
 * tunnel was established.
 * <p>
 * The client-to-upstream direction runs on the supplied executor and the
 * upstream-to-client direction on the calling thread. End of stream on one
 * side half-closes the other side's output; an error or the idle timeout
 * closes both sockets, which stops the opposite direction as well.
 */
public class TunnelRelay {

    private static final Logger log = LoggerFactory.getLogger(TunnelRelay.class);

    /** Upper bound for a single blocking read before the idle clock is checked. */
    private static final long MAX_POLL_MILLIS = 1000;

    private final Executor executor;
    private final long idleNanos;
    private final int pollMillis;
    private final Clock clock;

    public TunnelRelay(Executor executor, Duration idleTimeout) {
        this(executor, idleTimeout, Clock.systemUTC());
    }

    /**
     * @param executor    Runs the client-to-upstream direction.
     * @param idleTimeout Inactivity limit across both directions.
     * @param clock       Wall clock for TTFB and duration.
     */
    public TunnelRelay(Executor executor, Duration idleTimeout, Clock clock) {
        this.executor = executor;
        this.idleNanos = idleTimeout.toNanos();
        this.pollMillis = (int) Math.max(1, Math.min(idleTimeout.toMillis(), MAX_POLL_MILLIS));
        this.clock = clock;
    }

    /**
     * Relays until both directions are finished.
     *
     * @param client        The client socket.
     * @param upstream      The upstream socket.
     * @param establishedAt When the tunnel was confirmed to the client.
     * @return Byte counts, timings and termination cause.
     */
    public RelayResult relay(Socket client, Socket upstream, Instant establishedAt) {
        try {
            return relay(client, client.getInputStream(), upstream, establishedAt);
        } catch (IOException e) {
            log.debug("Failed to open client stream: {}", e.getMessage());
            IoUtils.closeQuietly(client, "client socket");
            IoUtils.closeQuietly(upstream, "upstream socket");
            return new RelayResult(0, 0, null, Duration.between(establishedAt, clock.instant()), Termination.ERROR);
        }
    }

    /**
     * Relays until both directions are finished, reading client bytes from
     * {@code clientIn}, which may hold bytes buffered while the request head
     * was parsed.
     *
     * @param client        The client socket.
     * @param clientIn      Stream of client bytes.
     * @param upstream      The upstream socket.
     * @param establishedAt When the tunnel was confirmed to the client.
     * @return Byte counts, timings and termination cause.
     */
    public RelayResult relay(Socket client, InputStream clientIn, Socket upstream, Instant establishedAt) {
        Tunnel tunnel = new Tunnel(client, upstream, establishedAt);
        try {
            client.setSoTimeout(pollMillis);
            upstream.setSoTimeout(pollMillis);
            InputStream upstreamIn = upstream.getInputStream();
            OutputStream upstreamOut = upstream.getOutputStream();
            OutputStream clientOut = client.getOutputStream();

            CompletableFuture<Void> forward;
            try {
                forward = CompletableFuture.runAsync(
                        () -> tunnel.pump(clientIn, upstreamOut, upstream, tunnel.clientToUpstream), executor);
            } catch (RejectedExecutionException e) {
                log.debug("Relay executor rejected tunnel task: {}", e.getMessage());
                tunnel.terminate(Termination.ERROR);
                return tunnel.result();
            }

            tunnel.pump(upstreamIn, clientOut, client, tunnel.upstreamToClient);

            try {
                forward.join();
            } catch (Exception e) {
                log.debug("Tunnel forward direction joined with exception: {}", e.getMessage());
            }
        } catch (IOException e) {
            log.debug("Failed to start relay: {}", e.getMessage());
            tunnel.terminate(Termination.ERROR);
        } finally {
            IoUtils.closeQuietly(client, "client socket");
            IoUtils.closeQuietly(upstream, "upstream socket");
        }
        return tunnel.result();
    }

    /**
     * Shared state of both directions of one tunnel.
     */
    private final class Tunnel {
        private final Socket client;
        private final Socket upstream;
        private final Instant establishedAt;
        private final AtomicLong clientToUpstream = new AtomicLong();
        private final AtomicLong upstreamToClient = new AtomicLong();
        private final AtomicLong lastActivity = new AtomicLong(System.nanoTime());
        private final AtomicReference<Instant> firstByteAt = new AtomicReference<>();
        private final AtomicReference<Termination> termination = new AtomicReference<>();
        private final AtomicBoolean closing = new AtomicBoolean();

        Tunnel(Socket client, Socket upstream, Instant establishedAt) {
            this.client = client;
            this.upstream = upstream;
            this.establishedAt = establishedAt;
        }

        void pump(InputStream in, OutputStream out, Socket destination, AtomicLong counter) {
            byte[] buffer = new byte[IoUtils.DEFAULT_BUFFER_SIZE];
            try {
                while (true) {
                    int read;
                    try {
                        read = in.read(buffer);
                    } catch (SocketTimeoutException e) {
                        if (closing.get()) {
                            return;
                        }
                        if (System.nanoTime() - lastActivity.get() >= idleNanos) {
                            log.debug("Tunnel idle for {} ms, closing", Duration.ofNanos(idleNanos).toMillis());
                            terminate(Termination.IDLE_TIMEOUT);
                            return;
                        }
                        continue;
                    }
                    if (read < 0) {
                        IoUtils.shutdownOutputQuietly(destination);
                        return;
                    }
                    lastActivity.set(System.nanoTime());
                    firstByteAt.compareAndSet(null, clock.instant());
                    out.write(buffer, 0, read);
                    counter.addAndGet(read);
                }
            } catch (IOException e) {
                if (!closing.get()) {
                    log.debug("Tunnel relay error: {}", e.getMessage());
                    terminate(Termination.ERROR);
                }
            }
        }

        void terminate(Termination cause) {
            termination.compareAndSet(null, cause);
            if (closing.compareAndSet(false, true)) {
                IoUtils.closeQuietly(client, "client socket");
                IoUtils.closeQuietly(upstream, "upstream socket");
            }
        }

        RelayResult result() {
            Instant first = firstByteAt.get();
            Termination cause = termination.get();
            return new RelayResult(clientToUpstream.get(), upstreamToClient.get(),
                    first == null ? null : Duration.between(establishedAt, first),
                    Duration.between(establishedAt, clock.instant()),
                    cause == null ? Termination.COMPLETED : cause);
        }
    }
}
