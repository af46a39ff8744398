package com.warden.proxy.config;

import com.warden.proxy.core.exceptions.ConfigException;

/**
 * Listener, connection limit and timeout settings for the proxy server.
 * All timeouts are in milliseconds.
 */
public class ProxyServerConfig {
    /** Port to listen on. 0 picks an ephemeral port. */
    private int port = 8080;

    /** Local IP address to bind to. Null means all interfaces. */
    private String bindAddress;

    /** Maximum concurrent client connections. Default is 10,000. */
    private int maxConnections = 10000;

    /** Upstream TCP connect timeout. Default is 5s. */
    private int connectTimeout = 5000;

    /** Window for a client to deliver its complete request head. Default is 10s. */
    private int headerTimeout = 10000;

    /** Upstream read timeout while relaying an HTTP response. Default is 30s. */
    private int readTimeout = 30000;

    /** Tunnel inactivity limit in both directions. Default is 60s. */
    private int idleTimeout = 60000;

    /** Maximum size of a request head (request line plus headers). */
    private int maxHeaderBytes = 64 * 1024;

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public String getBindAddress() {
        return bindAddress;
    }

    public void setBindAddress(String bindAddress) {
        this.bindAddress = bindAddress;
    }

    public int getMaxConnections() {
        return maxConnections;
    }

    public void setMaxConnections(int maxConnections) {
        this.maxConnections = maxConnections;
    }

    public int getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(int connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public int getHeaderTimeout() {
        return headerTimeout;
    }

    public void setHeaderTimeout(int headerTimeout) {
        this.headerTimeout = headerTimeout;
    }

    public int getReadTimeout() {
        return readTimeout;
    }

    public void setReadTimeout(int readTimeout) {
        this.readTimeout = readTimeout;
    }

    public int getIdleTimeout() {
        return idleTimeout;
    }

    public void setIdleTimeout(int idleTimeout) {
        this.idleTimeout = idleTimeout;
    }

    public int getMaxHeaderBytes() {
        return maxHeaderBytes;
    }

    public void setMaxHeaderBytes(int maxHeaderBytes) {
        this.maxHeaderBytes = maxHeaderBytes;
    }

    void validate() {
        if (port < 0 || port > 65535) {
            throw new ConfigException("server.port out of range: " + port);
        }
        requirePositive("server.maxConnections", maxConnections);
        requirePositive("server.connectTimeout", connectTimeout);
        requirePositive("server.headerTimeout", headerTimeout);
        requirePositive("server.readTimeout", readTimeout);
        requirePositive("server.idleTimeout", idleTimeout);
        if (maxHeaderBytes < 1024) {
            throw new ConfigException("server.maxHeaderBytes must be at least 1024: " + maxHeaderBytes);
        }
    }

    static void requirePositive(String name, long value) {
        if (value <= 0) {
            throw new ConfigException(name + " must be positive: " + value);
        }
    }
}
