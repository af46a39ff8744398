package com.warden.proxy.config;

/**
 * Configuration for the access log.
 */
public class LoggingConfig {
    /**
     * Access log format (Apache-style placeholders). Supported: %h client IP,
     * %t time, %r request line, %>s status, %b bytes sent, %B bytes received,
     * %D duration ms, %T time to first byte ms, %v target host, %m method,
     * %x failure kind, %% literal percent.
     */
    private String format = "%h %t \"%r\" %>s %b %D %T %v";

    /** Whether to log each raw request head at DEBUG. */
    private boolean logHeaders = false;

    public String getFormat() {
        return format;
    }

    public void setFormat(String format) {
        this.format = format;
    }

    public boolean isLogHeaders() {
        return logHeaders;
    }

    public void setLogHeaders(boolean logHeaders) {
        this.logHeaders = logHeaders;
    }
}
