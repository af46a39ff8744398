package com.warden.proxy.core.policy;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

import com.warden.proxy.config.RateLimitConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-client-IP fixed window rate limiter.
 * <p>
 * Each IP gets a window that starts with its first request. Within a window the
 * first {@code maxRequests} requests are admitted and every later one is
 * rejected; a request arriving at or after {@code windowStart + window} opens a
 * new window. Windows are created lazily and mutated under their own monitor,
 * so clients never contend with each other. Windows idle for
 * {@code evictAfterWindows} window lengths are swept out, at most once per
 * window length.
 */
public class RateLimiter {
    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private final boolean enabled;
    private final int maxRequests;
    private final long windowNanos;
    private final long staleNanos;
    private final Duration window;
    private final LongSupplier nanoClock;

    /** Rate limiting state (IP -> window). */
    private final Map<String, Window> windows = new ConcurrentHashMap<>();
    private final AtomicLong lastSweepNano;

    /**
     * Creates a limiter driven by {@link System#nanoTime()}.
     *
     * @param config Rate limit settings.
     */
    public RateLimiter(RateLimitConfig config) {
        this(config, System::nanoTime);
    }

    /**
     * Creates a limiter with an explicit monotonic clock.
     *
     * @param config    Rate limit settings.
     * @param nanoClock Source of monotonic nanoseconds.
     */
    public RateLimiter(RateLimitConfig config, LongSupplier nanoClock) {
        this.enabled = config.isEnabled() && config.getMaxRequests() > 0;
        this.maxRequests = config.getMaxRequests();
        this.window = Duration.ofSeconds(config.getWindowSeconds());
        this.windowNanos = window.toNanos();
        this.staleNanos = windowNanos * Math.max(1, config.getEvictAfterWindows());
        this.nanoClock = nanoClock;
        this.lastSweepNano = new AtomicLong(nanoClock.getAsLong());
    }

    /**
     * Counts a request from the given client and decides whether to admit it.
     *
     * @param clientIp The client's IP address.
     * @return {@link AccessDecision#allowed()} or a RATE_LIMITED decision.
     */
    public AccessDecision admit(String clientIp) {
        if (!enabled) {
            return AccessDecision.allowed();
        }

        long now = nanoClock.getAsLong();
        sweepIfDue(now);

        while (true) {
            Window w = windows.computeIfAbsent(clientIp, k -> new Window(now));
            synchronized (w) {
                if (w.retired) {
                    // Evicted between lookup and lock; pick up the replacement.
                    continue;
                }
                if (w.tryAcquire(now, windowNanos, maxRequests)) {
                    return AccessDecision.allowed();
                }
                return AccessDecision.rateLimited(window, maxRequests);
            }
        }
    }

    /**
     * Removes windows that have seen no request for the stale period.
     *
     * @return Number of windows removed.
     */
    public int evictStale() {
        long now = nanoClock.getAsLong();
        int removed = 0;
        for (Map.Entry<String, Window> entry : windows.entrySet()) {
            Window w = entry.getValue();
            synchronized (w) {
                if (!w.retired && now - w.lastSeenNano >= staleNanos && windows.remove(entry.getKey(), w)) {
                    w.retired = true;
                    removed++;
                }
            }
        }
        if (removed > 0) {
            log.debug("Evicted {} idle rate limit windows, {} remaining", removed, windows.size());
        }
        return removed;
    }

    /**
     * @return Number of client IPs currently tracked.
     */
    public int trackedClients() {
        return windows.size();
    }

    public Duration getWindow() {
        return window;
    }

    public int getMaxRequests() {
        return maxRequests;
    }

    public boolean isEnabled() {
        return enabled;
    }

    private void sweepIfDue(long now) {
        long last = lastSweepNano.get();
        if (now - last >= windowNanos && lastSweepNano.compareAndSet(last, now)) {
            evictStale();
        }
    }

    /**
     * Request counter for one client IP. Guarded by its own monitor.
     */
    private static final class Window {
        private long startNano;
        private int count;
        private long lastSeenNano;
        private boolean retired;

        Window(long now) {
            this.startNano = now;
            this.lastSeenNano = now;
        }

        boolean tryAcquire(long now, long windowNanos, int limit) {
            lastSeenNano = now;
            if (count == 0 || now - startNano >= windowNanos) {
                startNano = now;
                count = 1;
                return true;
            }
            if (count <= limit) {
                count++;
            }
            return count <= limit;
        }
    }
}
