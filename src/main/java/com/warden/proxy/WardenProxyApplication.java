package com.warden.proxy;

import com.warden.proxy.config.AdminConfig;
import com.warden.proxy.config.ProxyServerConfig;
import com.warden.proxy.config.RateLimitConfig;
import com.warden.proxy.config.WardenProperties;
import com.warden.proxy.core.events.CompositeEventSink;
import com.warden.proxy.core.exceptions.ConfigException;
import com.warden.proxy.core.exceptions.ProxyException;
import com.warden.proxy.core.policy.BlocklistLoader;
import com.warden.proxy.core.proxy.ForwardProxyServer;
import com.warden.proxy.core.services.AccessLogService;
import com.warden.proxy.core.services.MeteredEventSink;
import com.warden.proxy.core.services.MetricsService;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Scanner;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point for the Warden Proxy application.
 * Handles command-line arguments, configuration loading, and application
 * lifecycle.
 */
@Command(name = "warden-proxy", mixinStandardHelpOptions = true, version = "1.0.0", description = "Forward HTTP/HTTPS proxy with domain blocking and per-client rate limiting.")
public class WardenProxyApplication implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(WardenProxyApplication.class);

    private static final long BIND_TIMEOUT_SECONDS = 10;

    /**
     * Path to the YAML configuration file.
     */
    @Option(names = { "-c", "--config" }, description = "Path to config file (YAML)", defaultValue = "application.yml")
    private String configPath;

    /**
     * Overrides {@code server.port} from the configuration file.
     */
    @Option(names = { "-p", "--port" }, description = "Listen port, overrides server.port")
    private Integer portOverride;

    private ForwardProxyServer server;
    private AccessLogService accessLogService;
    private MetricsService metricsService;

    /** Snapshot of the settings that only take effect on restart. */
    private String restartSettings;

    /** Latch to block the main thread until shutdown is triggered. */
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    /** Flag to signal background threads to stop. */
    private final AtomicBoolean running = new AtomicBoolean(true);

    /**
     * Service to watch for configuration file changes.
     */
    private volatile WatchService watchService;

    /** Reference to the registered shutdown hook for cleanup. */
    private Thread shutdownHook;

    /**
     * Main method to launch the application.
     *
     * @param args Command-line arguments.
     */
    public static void main(String[] args) {
        System.exit(new CommandLine(new WardenProxyApplication()).execute(args));
    }

    /**
     * Bootstraps the application, starts the proxy server, and sets up
     * configuration watching.
     *
     * @return Exit code (0 for success, 1 for failure).
     */
    @Override
    public Integer call() {
        try {
            log.info("Starting Warden Proxy...");

            WardenProperties props = loadConfig(configPath);
            this.restartSettings = restartSettings(props);
            this.metricsService = new MetricsService(props.getAdmin());
            this.accessLogService = new AccessLogService(props.getLogging());
            CompositeEventSink sinks = new CompositeEventSink(
                    List.of(accessLogService, new MeteredEventSink(metricsService.getRegistry())));

            this.server = new ForwardProxyServer(props, sinks, metricsService.getRegistry());
            Thread acceptor = new Thread(server::start, "warden-acceptor");
            acceptor.setDaemon(true);
            acceptor.start();
            if (!server.awaitBind(BIND_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                throw new ProxyException("Proxy failed to bind to port " + props.getServer().getPort());
            }

            startFileWatcher(props);
            if (System.getProperty("warden.no-command-listener") == null) {
                startCommandListener();
            }

            if (System.getProperty("warden.no-shutdown-hook") == null) {
                this.shutdownHook = new Thread(this::stop, "ShutdownHook");
                Runtime.getRuntime().addShutdownHook(shutdownHook);
            }

            shutdownLatch.await();
            return 0;
        } catch (ConfigException e) {
            log.error("Configuration Error: {}", e.getMessage());
            return 1;
        } catch (ProxyException e) {
            log.error("Fatal proxy error: {}", e.getMessage());
            return 1;
        } catch (InterruptedException e) {
            log.warn("Application interrupted");
            Thread.currentThread().interrupt();
            return 0;
        } catch (Exception e) {
            log.error("Unexpected fatal error", e);
            return 1;
        } finally {
            stop();
        }
    }

    /**
     * Starts an interactive command listener on System.in.
     */
    private void startCommandListener() {
        Thread listener = new Thread(() -> {
            try (Scanner scanner = new Scanner(System.in, StandardCharsets.UTF_8)) {
                log.info("Interactive console ready. Type 'reload' to refresh the blocklist or 'stop' to exit.");
                while (running.get() && readAndProcessCommand(scanner)) {
                    // Loop continues as long as input is available and stop hasn't been signaled
                }
            } catch (Exception e) {
                if (running.get()) {
                    log.warn("Command listener fatal error: {}", e.getMessage(), e);
                }
            }
        }, "CommandListener");
        listener.setDaemon(true);
        listener.start();
    }

    /**
     * Reads and processes the next command from the scanner.
     *
     * @param scanner Input scanner.
     * @return True if a command was processed, false if input was closed.
     */
    private boolean readAndProcessCommand(Scanner scanner) {
        try {
            if (scanner.hasNextLine()) {
                processCommand(scanner.nextLine().trim().toLowerCase(Locale.ROOT));
                return true;
            }
        } catch (NoSuchElementException e) {
            log.debug("Console input closed");
        }
        return false;
    }

    /**
     * Processes a single interactive command from the console.
     *
     * @param command The command string.
     */
    void processCommand(String command) {
        if (command.isEmpty()) {
            return;
        }

        switch (command) {
            case "reload" -> reloadConfiguration();
            case "stop", "exit", "quit" -> stop();
            case "help" -> log.info("Available commands: reload, stop, exit, quit, help");
            default -> log.warn("Unknown command: {}. Type 'help' for available commands.", command);
        }
    }

    /**
     * Gracefully stops the proxy server, configuration watcher, and background
     * listeners.
     * Also unregisters the shutdown hook so repeated runs in one JVM do not leak
     * hooks.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down Warden Proxy...");

            unregisterShutdownHook();

            if (server != null) {
                server.stop();
            }
            if (metricsService != null) {
                metricsService.shutdown();
            }
            closeWatchService();
            shutdownLatch.countDown();
        }
    }

    /**
     * @return The running proxy server, or null before startup.
     */
    ForwardProxyServer getServer() {
        return server;
    }

    /**
     * Unregisters the JVM shutdown hook safely.
     */
    private void unregisterShutdownHook() {
        if (shutdownHook != null) {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException e) {
                log.debug("Shutdown already in progress");
            }
        }
    }

    /**
     * Closes the configuration file watch service.
     */
    private void closeWatchService() {
        WatchService ws = watchService;
        if (ws != null) {
            try {
                ws.close();
            } catch (IOException e) {
                log.debug("Failed to close watch service: {}", e.getMessage());
            }
        }
    }

    /**
     * Reloads the configuration from disk. The blocklist and the access log
     * settings are applied to the running server; other changes are reported as
     * needing a restart.
     */
    void reloadConfiguration() {
        try {
            log.info("Reloading configuration from {}...", configPath);
            WardenProperties newProps = loadConfig(configPath);

            server.reloadBlocklist(BlocklistLoader.load(newProps));
            accessLogService.updateConfig(newProps.getLogging());

            String newRestartSettings = restartSettings(newProps);
            if (!newRestartSettings.equals(restartSettings)) {
                log.warn("Server, rate limit or admin settings changed; restart to apply them");
            }
            log.info("Configuration reloaded successfully.");
        } catch (ProxyException e) {
            log.error("Failed to reload configuration: {}", e.getMessage());
        }
    }

    /**
     * Starts a background thread to watch for changes in the configuration file
     * and the blocklist file. Uses a debounce mechanism to avoid multiple reloads
     * for a single logical change.
     */
    private void startFileWatcher(WardenProperties props) {
        Set<Path> watched = new HashSet<>();
        watched.add(Paths.get(configPath).toAbsolutePath().normalize());
        if (props.getBlocklistFile() != null && !props.getBlocklistFile().isBlank()) {
            watched.add(Paths.get(props.getBlocklistFile()).toAbsolutePath().normalize());
        }

        Thread watcherThread = new Thread(() -> {
            try {
                WatchService ws = FileSystems.getDefault().newWatchService();
                this.watchService = ws;
                Set<Path> dirs = new HashSet<>();
                for (Path file : watched) {
                    Path parent = file.getParent();
                    if (parent != null && parent.toFile().isDirectory() && dirs.add(parent)) {
                        parent.register(ws, StandardWatchEventKinds.ENTRY_MODIFY,
                                StandardWatchEventKinds.ENTRY_CREATE);
                    }
                }
                if (dirs.isEmpty()) {
                    return;
                }

                log.info("Watching for configuration changes: {}", watched);
                runWatcherLoop(ws, watched);
            } catch (ClosedWatchServiceException e) {
                log.debug("Watch service closed");
            } catch (InterruptedException e) {
                log.debug("File watcher interrupted");
                Thread.currentThread().interrupt();
            } catch (Exception e) {
                if (running.get()) {
                    log.warn("File watcher error: {}", e.getMessage(), e);
                }
            }
        }, "ConfigWatcher");
        watcherThread.setDaemon(true);
        watcherThread.start();
    }

    /**
     * Executes the main loop for the configuration file watcher.
     *
     * @param ws      The watch service.
     * @param watched Absolute paths of the files of interest.
     * @throws InterruptedException If the thread is interrupted.
     */
    private void runWatcherLoop(WatchService ws, Set<Path> watched) throws InterruptedException {
        // Debounce: track the last event time and reload only after 1s of silence.
        final long debounceNanos = 1_000_000_000L;
        long lastEventNano = 0;

        while (running.get()) {
            WatchKey key = ws.poll(500, TimeUnit.MILLISECONDS);
            if (key != null) {
                Path dir = (Path) key.watchable();
                for (WatchEvent<?> event : key.pollEvents()) {
                    Object context = event.context();
                    if (context instanceof Path changed && watched.contains(dir.resolve(changed).normalize())) {
                        lastEventNano = System.nanoTime();
                    }
                }
                if (!key.reset()) {
                    break;
                }
            }

            if (shouldReload(lastEventNano, debounceNanos)) {
                lastEventNano = 0;
                reloadConfiguration();
            }
        }
    }

    /**
     * Checks if enough time has passed since the last file event to trigger a
     * reload.
     *
     * @param lastEventNano Timestamp of the last event.
     * @param debounceNanos Debounce threshold.
     * @return True if reload should proceed.
     */
    private boolean shouldReload(long lastEventNano, long debounceNanos) {
        return lastEventNano > 0 && System.nanoTime() - lastEventNano >= debounceNanos;
    }

    private static String restartSettings(WardenProperties props) {
        ProxyServerConfig s = props.getServer();
        RateLimitConfig r = props.getRateLimit();
        AdminConfig a = props.getAdmin();
        return String.join("|",
                String.valueOf(s.getPort()), Objects.toString(s.getBindAddress()),
                String.valueOf(s.getMaxConnections()), String.valueOf(s.getConnectTimeout()),
                String.valueOf(s.getHeaderTimeout()), String.valueOf(s.getReadTimeout()),
                String.valueOf(s.getIdleTimeout()), String.valueOf(s.getMaxHeaderBytes()),
                String.valueOf(r.isEnabled()), String.valueOf(r.getMaxRequests()),
                String.valueOf(r.getWindowSeconds()), String.valueOf(r.getEvictAfterWindows()),
                String.valueOf(a.isEnabled()), String.valueOf(a.getPort()), Objects.toString(a.getBindAddress()),
                Objects.toString(a.getMetricsPath()));
    }

    /**
     * Loads and validates the configuration from the specified path or classpath.
     *
     * @param path Path to the configuration file.
     * @return Loaded WardenProperties.
     * @throws ConfigException if configuration cannot be loaded or is invalid.
     */
    WardenProperties loadConfig(String path) {
        Yaml yaml = new Yaml(new Constructor(WardenProperties.class, new LoaderOptions()));

        // 1. Try absolute/relative path
        WardenProperties props = tryLoadFromFile(yaml, path);

        // 2. Try classpath
        if (props == null) {
            props = tryLoadFromClasspath(yaml, path);
        }
        if (props == null) {
            throw new ConfigException("Configuration file not found: " + path);
        }
        if (portOverride != null) {
            props.getServer().setPort(portOverride);
        }
        props.validate();
        return props;
    }

    /**
     * Attempts to load YAML configuration from a file on disk.
     *
     * @param yaml SnakeYAML instance.
     * @param path File path.
     * @return WardenProperties if successful, null otherwise.
     */
    private WardenProperties tryLoadFromFile(Yaml yaml, String path) {
        File file = new File(path);
        if (file.exists()) {
            try (InputStream is = new FileInputStream(file)) {
                return orDefaults(yaml.load(is));
            } catch (YAMLException | ClassCastException e) {
                throw new ConfigException("Invalid YAML in " + path + ": " + e.getMessage());
            } catch (IOException e) {
                throw new ConfigException("Error reading config file: " + path, e);
            }
        }
        return null;
    }

    /**
     * Attempts to load YAML configuration from a classpath resource.
     *
     * @param yaml SnakeYAML instance.
     * @param path Resource path.
     * @return WardenProperties if successful, null otherwise.
     */
    private WardenProperties tryLoadFromClasspath(Yaml yaml, String path) {
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            if (is != null) {
                return orDefaults(yaml.load(is));
            }
        } catch (YAMLException | ClassCastException e) {
            throw new ConfigException("Invalid YAML in classpath resource " + path + ": " + e.getMessage());
        } catch (IOException e) {
            log.debug("Classpath resource lookup failed for {}", path);
        }
        return null;
    }

    /** An empty document loads as null. */
    private static WardenProperties orDefaults(WardenProperties loaded) {
        return loaded != null ? loaded : new WardenProperties();
    }
}
