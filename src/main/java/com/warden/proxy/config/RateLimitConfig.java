package com.warden.proxy.config;

/**
 * Per-client-IP rate limit: at most {@code maxRequests} requests per
 * {@code windowSeconds}.
 */
public class RateLimitConfig {
    private boolean enabled = true;

    private int maxRequests = 100;

    private int windowSeconds = 10;

    /** Idle windows are dropped after this many window lengths. */
    private int evictAfterWindows = 6;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getMaxRequests() {
        return maxRequests;
    }

    public void setMaxRequests(int maxRequests) {
        this.maxRequests = maxRequests;
    }

    public int getWindowSeconds() {
        return windowSeconds;
    }

    public void setWindowSeconds(int windowSeconds) {
        this.windowSeconds = windowSeconds;
    }

    public int getEvictAfterWindows() {
        return evictAfterWindows;
    }

    public void setEvictAfterWindows(int evictAfterWindows) {
        this.evictAfterWindows = evictAfterWindows;
    }

    void validate() {
        if (!enabled) {
            return;
        }
        ProxyServerConfig.requirePositive("rateLimit.maxRequests", maxRequests);
        ProxyServerConfig.requirePositive("rateLimit.windowSeconds", windowSeconds);
        ProxyServerConfig.requirePositive("rateLimit.evictAfterWindows", evictAfterWindows);
    }
}
