package com.warden.proxy.core.services;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.atomic.AtomicReference;

import com.warden.proxy.config.LoggingConfig;
import com.warden.proxy.core.events.BlockedEvent;
import com.warden.proxy.core.events.EventSink;
import com.warden.proxy.core.events.MetricsRecord;
import com.warden.proxy.core.proxy.SessionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes one access log line per session using a configurable Apache-style
 * format. Declined requests are logged at WARN, everything else at INFO.
 */
public class AccessLogService implements EventSink {

    private static final Logger log = LoggerFactory.getLogger(AccessLogService.class);

    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("dd/MMM/yyyy:HH:mm:ss Z")
            .withZone(ZoneId.systemDefault());

    private final AtomicReference<LoggingConfig> config;

    /**
     * Last formatted timestamp; sessions finishing within the same second share
     * it.
     */
    private volatile CachedTimestamp cachedTimestamp = new CachedTimestamp(Long.MIN_VALUE, "");

    public AccessLogService(LoggingConfig config) {
        this.config = new AtomicReference<>(config);
    }

    /**
     * Internal record to group logging context for formatting.
     */
    record LogRecord(String remoteHost, String time, String requestLine, String status, String bytesSent,
            String bytesReceived, String durationMs, String ttfbMs, String targetHost, String method,
            String failure) {
    }

    private record CachedTimestamp(long epochSecond, String text) {
    }

    /**
     * Replaces the logging configuration.
     *
     * @param config The new configuration.
     */
    public void updateConfig(LoggingConfig config) {
        this.config.set(config);
    }

    @Override
    public void recordRequest(MetricsRecord rec) {
        LoggingConfig cfg = config.get();
        String line = format(cfg.getFormat(), rec);
        if (rec.state() == SessionState.RATE_LIMITED) {
            log.warn(line);
        } else {
            log.info(line);
        }
        if (cfg.isLogHeaders() && rec.rawHeaders() != null) {
            log.debug("Request head from {}:\n{}", rec.clientIp(), rec.rawHeaders().stripTrailing());
        }
    }

    @Override
    public void recordBlocked(BlockedEvent event) {
        log.warn("BLOCKED {} from {} (pattern {})", event.hostname(), event.clientIp(), event.matchedPattern());
    }

    /**
     * Formats a record with the given format string.
     * Supported tokens: %h, %t, %r, %>s, %b, %B, %D, %T, %v, %m, %x, %%.
     *
     * @param format The format string.
     * @param rec    The session record.
     * @return The formatted log line.
     */
    String format(String format, MetricsRecord rec) {
        int status = rec.statusCode();
        LogRecord logRecord = new LogRecord(
                rec.clientIp(),
                "[" + timestamp(rec.timestamp()) + "]",
                rec.requestLine(),
                status > 0 ? String.valueOf(status) : "-",
                rec.bytesSent() > 0 ? String.valueOf(rec.bytesSent()) : "-",
                rec.bytesReceived() > 0 ? String.valueOf(rec.bytesReceived()) : "-",
                String.valueOf(rec.duration().toMillis()),
                rec.ttfb() != null ? String.valueOf(rec.ttfb().toMillis()) : "-",
                orDash(rec.targetHost()),
                orDash(rec.method()),
                orDash(rec.failureKind()));

        StringBuilder sb = new StringBuilder(format.length() + 100);
        int i = 0;
        while (i < format.length()) {
            char c = format.charAt(i);
            if (c == '%' && i + 1 < format.length()) {
                i = appendToken(sb, format, i, logRecord);
            } else {
                sb.append(c);
                i++;
            }
        }
        return sb.toString();
    }

    /**
     * Appends a specific token value to the formatted log line.
     *
     * @param sb         The StringBuilder to append to.
     * @param format     The format string being parsed.
     * @param currentIdx The current position in the format string (at '%').
     * @param logRecord  The logging context.
     * @return The new index position in the format string after the token.
     */
    private int appendToken(StringBuilder sb, String format, int currentIdx, LogRecord logRecord) {
        char next = format.charAt(currentIdx + 1);
        int skip = 1;
        switch (next) {
            case 'h' -> sb.append(logRecord.remoteHost());
            case 't' -> sb.append(logRecord.time());
            case 'r' -> sb.append(logRecord.requestLine());
            case 'b' -> sb.append(logRecord.bytesSent());
            case 'B' -> sb.append(logRecord.bytesReceived());
            case 'D' -> sb.append(logRecord.durationMs());
            case 'T' -> sb.append(logRecord.ttfbMs());
            case 'v' -> sb.append(logRecord.targetHost());
            case 'm' -> sb.append(logRecord.method());
            case 'x' -> sb.append(logRecord.failure());
            case '%' -> sb.append('%');
            case '>' -> {
                if (currentIdx + 2 < format.length() && format.charAt(currentIdx + 2) == 's') {
                    sb.append(logRecord.status());
                    skip = 2;
                } else {
                    sb.append('%');
                    skip = 0;
                }
            }
            default -> {
                sb.append('%');
                skip = 0;
            }
        }
        return currentIdx + skip + 1;
    }

    private String timestamp(Instant instant) {
        long second = instant.getEpochSecond();
        CachedTimestamp cached = cachedTimestamp;
        if (cached.epochSecond() != second) {
            cached = new CachedTimestamp(second, DATE_FORMATTER.format(instant));
            cachedTimestamp = cached;
        }
        return cached.text();
    }

    private static String orDash(String value) {
        return value != null ? value : "-";
    }
}
