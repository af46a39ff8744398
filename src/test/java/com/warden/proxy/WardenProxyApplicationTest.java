package com.warden.proxy;

import com.warden.proxy.config.WardenProperties;
import com.warden.proxy.core.exceptions.ConfigException;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class WardenProxyApplicationTest {

    @TempDir
    Path tempDir;

    @BeforeAll
    static void disableConsole() {
        System.setProperty("warden.no-command-listener", "true");
        System.setProperty("warden.no-shutdown-hook", "true");
    }

    @AfterAll
    static void restoreConsole() {
        System.clearProperty("warden.no-command-listener");
        System.clearProperty("warden.no-shutdown-hook");
    }

    @Test
    void main_withHelpOption_returnsZero() {
        int exitCode = new CommandLine(new WardenProxyApplication()).execute("--help");
        assertThat(exitCode).isZero();
    }

    @Test
    void main_withVersionOption_returnsZero() {
        int exitCode = new CommandLine(new WardenProxyApplication()).execute("--version");
        assertThat(exitCode).isZero();
    }

    @Test
    void call_withValidConfig_startsAndStops() throws Exception {
        int port = freePort();
        Path configFile = tempDir.resolve("warden.yml");
        Files.writeString(configFile, "server:\n" +
                "  port: " + port + "\n" +
                "  bindAddress: 127.0.0.1\n" +
                "blocklist:\n" +
                "  - '*.example.test'\n" +
                "admin:\n" +
                "  enabled: false\n" +
                "logging:\n" +
                "  format: '%h %r'\n");

        WardenProxyApplication app = new WardenProxyApplication();
        CommandLine cmd = new CommandLine(app);
        Thread appThread = new Thread(() -> cmd.execute("-c", configFile.toString()));
        appThread.setDaemon(true);
        appThread.start();

        await().atMost(Duration.ofSeconds(10)).until(() -> canConnect(port));
        assertThat(app.getServer().getAccessPolicy().getPatterns()).hasSize(1);

        app.stop();
        await().atMost(Duration.ofSeconds(10)).until(() -> !appThread.isAlive());
        assertThat(canConnect(port)).isFalse();
    }

    @Test
    void call_withInvalidConfig_returnsError() throws Exception {
        Path configFile = tempDir.resolve("bad.yml");
        Files.writeString(configFile, "invalid yaml content: !!!");

        int exitCode = new CommandLine(new WardenProxyApplication()).execute("-c", configFile.toString());

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void call_withInvalidBlockPattern_returnsError() throws Exception {
        Path configFile = tempDir.resolve("bad-pattern.yml");
        Files.writeString(configFile, "blocklist:\n  - '*'\nadmin:\n  enabled: false\n");

        int exitCode = new CommandLine(new WardenProxyApplication()).execute("-c", configFile.toString());

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void call_withMissingConfig_returnsError() {
        int exitCode = new CommandLine(new WardenProxyApplication())
                .execute("-c", tempDir.resolve("missing.yml").toString());

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void loadConfig_appliesPortOverride() throws Exception {
        Path configFile = tempDir.resolve("port.yml");
        Files.writeString(configFile, "server:\n  port: 8081\n");

        WardenProxyApplication app = new WardenProxyApplication();
        new CommandLine(app).parseArgs("-c", configFile.toString(), "-p", "9999");
        WardenProperties props = app.loadConfig(configFile.toString());

        assertThat(props.getServer().getPort()).isEqualTo(9999);
        assertThat(props.getRateLimit().getMaxRequests()).isEqualTo(100);
    }

    @Test
    void loadConfig_fallsBackToClasspathDefaults() {
        WardenProperties props = new WardenProxyApplication().loadConfig("application.yml");

        assertThat(props.getBlocklist()).contains("*.youtube.com", "*.googlevideo.com");
        assertThat(props.getServer().getPort()).isEqualTo(8080);
    }

    @Test
    void loadConfig_rejectsOutOfRangePort() throws Exception {
        Path configFile = tempDir.resolve("range.yml");
        Files.writeString(configFile, "server:\n  port: 70000\n");

        WardenProxyApplication app = new WardenProxyApplication();
        assertThatThrownBy(() -> app.loadConfig(configFile.toString()))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("server.port");
    }

    @Test
    void reload_swapsBlocklistOfRunningServer() throws Exception {
        int port = freePort();
        Path configFile = tempDir.resolve("reload.yml");
        Files.writeString(configFile, config(port, "a.test"));

        WardenProxyApplication app = new WardenProxyApplication();
        CommandLine cmd = new CommandLine(app);
        Thread appThread = new Thread(() -> cmd.execute("-c", configFile.toString()));
        appThread.setDaemon(true);
        appThread.start();

        try {
            await().atMost(Duration.ofSeconds(10)).until(() -> canConnect(port));

            Files.writeString(configFile, config(port, "b.test"));
            app.processCommand("reload");

            assertThat(app.getServer().getAccessPolicy().evaluate("b.test").isAllowed()).isFalse();
            assertThat(app.getServer().getAccessPolicy().evaluate("a.test").isAllowed()).isTrue();
        } finally {
            app.processCommand("stop");
            await().atMost(Duration.ofSeconds(10)).until(() -> !appThread.isAlive());
        }
    }

    private static String config(int port, String pattern) {
        return "server:\n" +
                "  port: " + port + "\n" +
                "  bindAddress: 127.0.0.1\n" +
                "blocklist:\n" +
                "  - " + pattern + "\n" +
                "admin:\n" +
                "  enabled: false\n";
    }

    private static int freePort() throws IOException {
        try (ServerSocket s = new ServerSocket(0)) {
            return s.getLocalPort();
        }
    }

    private static boolean canConnect(int port) {
        try (Socket s = new Socket("127.0.0.1", port)) {
            return s.isConnected();
        } catch (IOException e) {
            return false;
        }
    }
}
