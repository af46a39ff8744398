package com.warden.proxy.config;

/**
 * Settings for the admin HTTP endpoint that serves the health check and the
 * Prometheus scrape.
 */
public class AdminConfig {
    private boolean enabled = true;

    private int port = 9090;

    /** Bind address for the admin server. Loopback unless set otherwise. */
    private String bindAddress = "127.0.0.1";

    /** Path of the Prometheus scrape endpoint. */
    private String metricsPath = "/metrics";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

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

    public String getMetricsPath() {
        return metricsPath;
    }

    public void setMetricsPath(String metricsPath) {
        this.metricsPath = metricsPath;
    }
}
