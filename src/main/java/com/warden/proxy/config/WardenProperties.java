package com.warden.proxy.config;

import com.warden.proxy.core.exceptions.ConfigException;
import com.warden.proxy.core.policy.BlockPattern;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Root configuration object for Warden Proxy.
 * Maps to the top-level structure of application.yml.
 */
public class WardenProperties {
    /**
     * Listener and timeout settings.
     */
    private ProxyServerConfig server = new ProxyServerConfig();

    /**
     * Domain patterns to block, e.g. {@code *.youtube.com}.
     */
    private List<String> blocklist = new ArrayList<>();

    /**
     * Optional file with additional block patterns, one per line.
     */
    private String blocklistFile;

    /**
     * Per-client rate limiting.
     */
    private RateLimitConfig rateLimit = new RateLimitConfig();

    /**
     * Access log configuration.
     */
    private LoggingConfig logging = new LoggingConfig();

    /**
     * Administration and metrics configuration.
     */
    private AdminConfig admin = new AdminConfig();

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public ProxyServerConfig getServer() {
        return server;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setServer(ProxyServerConfig server) {
        this.server = server;
    }

    public List<String> getBlocklist() {
        return blocklist == null ? null : Collections.unmodifiableList(blocklist);
    }

    public void setBlocklist(List<String> blocklist) {
        this.blocklist = blocklist == null ? null : new ArrayList<>(blocklist);
    }

    public String getBlocklistFile() {
        return blocklistFile;
    }

    public void setBlocklistFile(String blocklistFile) {
        this.blocklistFile = blocklistFile;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public RateLimitConfig getRateLimit() {
        return rateLimit;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setRateLimit(RateLimitConfig rateLimit) {
        this.rateLimit = rateLimit;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public LoggingConfig getLogging() {
        return logging;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setLogging(LoggingConfig logging) {
        this.logging = logging;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public AdminConfig getAdmin() {
        return admin;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setAdmin(AdminConfig admin) {
        this.admin = admin;
    }

    /**
     * Checks the loaded configuration for values the proxy cannot run with.
     * Sections left out of the YAML file are replaced by their defaults.
     *
     * @throws ConfigException describing the first invalid value found.
     */
    public void validate() {
        if (server == null) {
            server = new ProxyServerConfig();
        }
        if (rateLimit == null) {
            rateLimit = new RateLimitConfig();
        }
        if (logging == null) {
            logging = new LoggingConfig();
        }
        if (admin == null) {
            admin = new AdminConfig();
        }

        server.validate();
        rateLimit.validate();
        if (blocklist != null) {
            blocklist.forEach(BlockPattern::parse);
        }
        if (admin.isEnabled() && (admin.getPort() < 0 || admin.getPort() > 65535)) {
            throw new ConfigException("admin.port out of range: " + admin.getPort());
        }
    }
}
