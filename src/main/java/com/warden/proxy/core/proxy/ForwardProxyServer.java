package com.warden.proxy.core.proxy;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.time.Duration;
import java.util.Collection;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.warden.proxy.config.ProxyServerConfig;
import com.warden.proxy.config.WardenProperties;
import com.warden.proxy.core.events.EventSink;
import com.warden.proxy.core.http.HttpForwarder;
import com.warden.proxy.core.http.RequestParser;
import com.warden.proxy.core.policy.AccessPolicy;
import com.warden.proxy.core.policy.BlocklistLoader;
import com.warden.proxy.core.policy.RateLimiter;
import com.warden.proxy.core.tunnel.TunnelRelay;
import com.warden.proxy.core.utils.IoUtils;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Forward HTTP/HTTPS proxy listener. Accepts client connections and serves
 * each on its own pooled thread through a {@link SessionHandler}.
 */
public class ForwardProxyServer implements ProxyServer {
    private static final Logger log = LoggerFactory.getLogger(ForwardProxyServer.class);

    /** Configuration for the listener. */
    protected final ProxyServerConfig config;

    /** Micrometer registry for metrics. */
    protected final MeterRegistry registry;

    /** Executor for client sessions and the second direction of tunnels. */
    protected final ExecutorService executor;

    /** Semaphore to enforce the maximum number of concurrent connections. */
    protected final Semaphore connectionSemaphore;

    /** Set of active client sockets for graceful shutdown. */
    protected final Set<Socket> activeSockets = ConcurrentHashMap.newKeySet();

    /** The main server socket listening for incoming connections. */
    protected volatile ServerSocket serverSocket;

    private final AccessPolicy accessPolicy;
    private final RateLimiter rateLimiter;
    private final SessionHandler sessionHandler;

    private final Counter totalConnections;
    private final Counter rejectedConnections;
    private final Counter connectionErrors;
    private final Meter activeGauge;

    /**
     * Latch released once {@code serverSocket.bind()} has completed (successfully
     * or not).
     */
    private final CountDownLatch bindLatch = new CountDownLatch(1);
    /**
     * True if the last call to {@link #start()} successfully bound the server
     * socket.
     */
    private volatile boolean bindSuccess = false;

    /**
     * Creates a server that connects upstream directly.
     *
     * @param props     Validated application properties.
     * @param eventSink Receives one event per session.
     * @param registry  The Micrometer meter registry.
     */
    public ForwardProxyServer(WardenProperties props, EventSink eventSink, MeterRegistry registry) {
        this(props, eventSink, registry, new UpstreamConnector(props.getServer().getConnectTimeout(),
                props.getServer().getReadTimeout()));
    }

    /**
     * Creates a server with a given upstream connector.
     *
     * @param props     Validated application properties.
     * @param eventSink Receives one event per session.
     * @param registry  The Micrometer meter registry.
     * @param connector Opens upstream connections.
     */
    public ForwardProxyServer(WardenProperties props, EventSink eventSink, MeterRegistry registry,
            UpstreamConnector connector) {
        this.config = props.getServer();
        this.registry = registry;
        this.executor = Executors.newCachedThreadPool(new SessionThreadFactory());
        this.connectionSemaphore = new Semaphore(config.getMaxConnections());

        this.accessPolicy = new AccessPolicy(BlocklistLoader.load(props));
        this.rateLimiter = new RateLimiter(props.getRateLimit());
        this.sessionHandler = new SessionHandler(
                new RequestParser(config.getMaxHeaderBytes(), Duration.ofMillis(config.getHeaderTimeout())),
                accessPolicy, rateLimiter, connector, new HttpForwarder(),
                new TunnelRelay(executor, Duration.ofMillis(config.getIdleTimeout())),
                eventSink, config.getHeaderTimeout(), config.getReadTimeout());

        // Instrument metrics
        this.totalConnections = Counter.builder("proxy.connections.total")
                .description("Total number of accepted connections")
                .register(registry);

        this.rejectedConnections = Counter.builder("proxy.connections.rejected")
                .description("Connections closed because the connection limit was reached")
                .register(registry);

        this.connectionErrors = Counter.builder("proxy.connections.errors")
                .description("Total number of connection errors")
                .register(registry);

        this.activeGauge = Gauge.builder("proxy.connections.active", activeSockets, Set::size)
                .description("Current number of active connections")
                .register(registry);
    }

    /**
     * Starts the proxy server. Binds to the configured port and enters the accept
     * loop.
     */
    @Override
    public void start() {
        try {
            ServerSocket socket = new ServerSocket();
            serverSocket = socket;
            socket.setReuseAddress(true);
            InetSocketAddress bindAddr = config.getBindAddress() != null
                    ? new InetSocketAddress(config.getBindAddress(), config.getPort())
                    : new InetSocketAddress(config.getPort());
            socket.bind(bindAddr);
            bindSuccess = true;
            bindLatch.countDown();
            log.info("Proxy started on {}:{} (blocklist: {} patterns, rate limit: {})",
                    config.getBindAddress() != null ? config.getBindAddress() : "0.0.0.0", socket.getLocalPort(),
                    accessPolicy.getPatterns().size(),
                    rateLimiter.isEnabled()
                            ? rateLimiter.getMaxRequests() + "/" + rateLimiter.getWindow().toSeconds() + "s"
                            : "off");

            while (!socket.isClosed()) {
                if (!acceptAndProcessNextClient(socket)) {
                    break;
                }
            }
        } catch (IOException e) {
            IoUtils.closeQuietly(serverSocket, "server socket");
            bindLatch.countDown();
            connectionErrors.increment();
            log.error("Proxy server error on port {}: {}", config.getPort(), e.getMessage(), e);
        }
    }

    /**
     * Accepts and processes the next incoming client connection.
     *
     * @return {@code true} to continue the accept loop, {@code false} if the loop
     *         should terminate.
     */
    private boolean acceptAndProcessNextClient(ServerSocket socket) {
        try {
            Socket client = socket.accept();
            processClient(client);
            return true;
        } catch (SocketException e) {
            if (socket.isClosed()) {
                return false;
            }
            connectionErrors.increment();
            log.error("Accept error on port {}: {}", config.getPort(), e.getMessage());
            return true;
        } catch (IOException e) {
            connectionErrors.increment();
            log.error("I/O error during accept on port {}: {}", config.getPort(), e.getMessage());
            return true;
        }
    }

    /**
     * Waits for the server to finish binding to its port.
     *
     * @param timeout Maximum time to wait.
     * @param unit    Unit for the timeout.
     * @return {@code true} if the bind completed successfully within the timeout.
     */
    public boolean awaitBind(long timeout, TimeUnit unit) {
        try {
            return bindLatch.await(timeout, unit) && bindSuccess;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void processClient(Socket client) {
        if (!connectionSemaphore.tryAcquire()) {
            rejectedConnections.increment();
            log.warn("Connection limit reached ({}), closing connection from {}", config.getMaxConnections(),
                    client.getInetAddress().getHostAddress());
            IoUtils.closeQuietly(client, "limit reached client socket");
            return;
        }

        totalConnections.increment();
        try {
            client.setTcpNoDelay(true);
        } catch (SocketException e) {
            log.debug("Failed to configure client socket: {}", e.getMessage());
        }

        ClientSession session = ClientSession.open(client);
        activeSockets.add(client);
        try {
            executor.execute(() -> {
                try {
                    sessionHandler.handle(session);
                } catch (Exception e) {
                    connectionErrors.increment();
                    log.error("Unexpected error handling client {}: {}", session.getClientIp(), e.getMessage(), e);
                } finally {
                    activeSockets.remove(client);
                    connectionSemaphore.release();
                    IoUtils.closeQuietly(client, "client socket");
                }
            });
        } catch (RejectedExecutionException e) {
            activeSockets.remove(client);
            connectionSemaphore.release();
            IoUtils.closeQuietly(client, "client socket");
            log.debug("Session executor rejected client {}: {}", session.getClientIp(), e.getMessage());
        }
    }

    /**
     * Stops the proxy server. Closes the server socket and all active client
     * connections.
     */
    @Override
    public void stop() {
        log.info("Stopping proxy server on port {}...", getLocalPort());
        try {
            if (serverSocket != null) {
                serverSocket.close();
            }
        } catch (IOException e) {
            log.error("Failed to close server socket: {}", e.getMessage(), e);
        }

        // Close all active client connections to unblock IO
        for (Socket s : activeSockets) {
            IoUtils.closeQuietly(s);
        }
        activeSockets.clear();

        // Unregister metrics so a restarted server can register them again
        registry.remove(totalConnections);
        registry.remove(rejectedConnections);
        registry.remove(connectionErrors);
        registry.remove(activeGauge);

        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Session executor did not terminate cleanly after 5 s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Replaces the blocklist of the running server.
     *
     * @param patterns The new block patterns.
     */
    public void reloadBlocklist(Collection<String> patterns) {
        accessPolicy.update(patterns);
    }

    @Override
    @SuppressFBWarnings("EI_EXPOSE_REP")
    public ProxyServerConfig getConfig() {
        return config;
    }

    @Override
    public int getLocalPort() {
        ServerSocket socket = serverSocket;
        return socket != null ? socket.getLocalPort() : -1;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public AccessPolicy getAccessPolicy() {
        return accessPolicy;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public RateLimiter getRateLimiter() {
        return rateLimiter;
    }

    /**
     * Names pooled threads and marks them as daemons.
     */
    private static final class SessionThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "warden-session-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
