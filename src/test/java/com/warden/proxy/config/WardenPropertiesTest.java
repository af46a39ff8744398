package com.warden.proxy.config;

import com.warden.proxy.core.exceptions.ConfigException;
import org.junit.jupiter.api.Test;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WardenPropertiesTest {

    private static WardenProperties parse(String yaml) {
        return new Yaml(new Constructor(WardenProperties.class, new LoaderOptions())).load(yaml);
    }

    @Test
    void defaults_matchDocumentedValues() {
        WardenProperties props = new WardenProperties();
        props.validate();

        assertThat(props.getServer().getPort()).isEqualTo(8080);
        assertThat(props.getServer().getMaxHeaderBytes()).isEqualTo(64 * 1024);
        assertThat(props.getRateLimit().isEnabled()).isTrue();
        assertThat(props.getRateLimit().getMaxRequests()).isEqualTo(100);
        assertThat(props.getRateLimit().getWindowSeconds()).isEqualTo(10);
        assertThat(props.getAdmin().getBindAddress()).isEqualTo("127.0.0.1");
        assertThat(props.getLogging().getFormat()).contains("%h", "%r", "%>s");
        assertThat(props.getBlocklist()).isEmpty();
    }

    @Test
    void yaml_bindsAllSections() {
        WardenProperties props = parse("server:\n" +
                "  port: 3128\n" +
                "  maxConnections: 50\n" +
                "  idleTimeout: 1500\n" +
                "blocklist:\n" +
                "  - '*.youtube.com'\n" +
                "  - ads.example.org\n" +
                "blocklistFile: /etc/warden/blocklist.txt\n" +
                "rateLimit:\n" +
                "  maxRequests: 5\n" +
                "  windowSeconds: 2\n" +
                "logging:\n" +
                "  logHeaders: true\n" +
                "admin:\n" +
                "  enabled: false\n");
        props.validate();

        assertThat(props.getServer().getPort()).isEqualTo(3128);
        assertThat(props.getServer().getMaxConnections()).isEqualTo(50);
        assertThat(props.getServer().getIdleTimeout()).isEqualTo(1500);
        assertThat(props.getBlocklist()).containsExactly("*.youtube.com", "ads.example.org");
        assertThat(props.getBlocklistFile()).isEqualTo("/etc/warden/blocklist.txt");
        assertThat(props.getRateLimit().getMaxRequests()).isEqualTo(5);
        assertThat(props.getRateLimit().getWindowSeconds()).isEqualTo(2);
        assertThat(props.getLogging().isLogHeaders()).isTrue();
        assertThat(props.getAdmin().isEnabled()).isFalse();
    }

    @Test
    void validate_fillsMissingSections() {
        WardenProperties props = new WardenProperties();
        props.setServer(null);
        props.setRateLimit(null);
        props.setLogging(null);
        props.setAdmin(null);

        props.validate();

        assertThat(props.getServer()).isNotNull();
        assertThat(props.getRateLimit()).isNotNull();
        assertThat(props.getLogging()).isNotNull();
        assertThat(props.getAdmin()).isNotNull();
    }

    @Test
    void validate_rejectsNonPositiveTimeout() {
        WardenProperties props = new WardenProperties();
        props.getServer().setConnectTimeout(0);

        assertThatThrownBy(props::validate)
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("server.connectTimeout");
    }

    @Test
    void validate_rejectsTinyHeaderLimit() {
        WardenProperties props = new WardenProperties();
        props.getServer().setMaxHeaderBytes(100);

        assertThatThrownBy(props::validate)
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("maxHeaderBytes");
    }

    @Test
    void validate_ignoresRateLimitValuesWhenDisabled() {
        WardenProperties props = new WardenProperties();
        props.getRateLimit().setEnabled(false);
        props.getRateLimit().setMaxRequests(0);

        props.validate();

        assertThat(props.getRateLimit().isEnabled()).isFalse();
    }

    @Test
    void validate_rejectsZeroRateLimitWhenEnabled() {
        WardenProperties props = new WardenProperties();
        props.getRateLimit().setWindowSeconds(0);

        assertThatThrownBy(props::validate)
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("rateLimit.windowSeconds");
    }

    @Test
    void validate_rejectsInvalidBlockPattern() {
        WardenProperties props = new WardenProperties();
        props.setBlocklist(List.of("*.ok.com", "bad pattern.com"));

        assertThatThrownBy(props::validate).isInstanceOf(ConfigException.class);
    }

    @Test
    void blocklist_isDefensivelyCopied() {
        List<String> patterns = new ArrayList<>(List.of("a.com"));
        WardenProperties props = new WardenProperties();
        props.setBlocklist(patterns);
        patterns.add("b.com");

        assertThat(props.getBlocklist()).containsExactly("a.com");
    }
}
