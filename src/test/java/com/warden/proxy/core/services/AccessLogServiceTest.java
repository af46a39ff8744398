package com.warden.proxy.core.services;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.warden.proxy.config.LoggingConfig;
import com.warden.proxy.core.events.BlockedEvent;
import com.warden.proxy.core.events.MetricsRecord;
import com.warden.proxy.core.proxy.SessionState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class AccessLogServiceTest {

    private final Logger logger = (Logger) LoggerFactory.getLogger(AccessLogService.class);
    private ListAppender<ILoggingEvent> appender;
    private LoggingConfig config;
    private AccessLogService service;

    @BeforeEach
    void setUp() {
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        logger.setLevel(Level.DEBUG);
        config = new LoggingConfig();
        service = new AccessLogService(config);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(appender);
        logger.setLevel(null);
    }

    private static MetricsRecord.Builder completed() {
        return MetricsRecord.builder()
                .timestamp(Instant.parse("2024-03-01T12:00:00Z"))
                .clientIp("192.168.1.7")
                .target("example.com", 80)
                .method("GET")
                .rawHeaders("GET http://example.com/index.html HTTP/1.1\r\nHost: example.com\r\n\r\n")
                .outcomeLine("HTTP/1.1 200 OK")
                .state(SessionState.COMPLETED)
                .bytesSent(512)
                .bytesReceived(64)
                .duration(Duration.ofMillis(42))
                .ttfb(Duration.ofMillis(7));
    }

    @Test
    void format_expandsAllTokens() {
        String line = service.format("%h \"%r\" %>s %b %B %D %T %v %m %x %%", completed().build());

        assertThat(line).isEqualTo(
                "192.168.1.7 \"GET http://example.com/index.html HTTP/1.1\" 200 512 64 42 7 example.com GET - %");
    }

    @Test
    void format_timeTokenUsesCommonLogLayout() {
        String line = service.format("%t", completed().build());

        assertThat(line).matches("\\[\\d{2}/\\w{3}/\\d{4}:\\d{2}:\\d{2}:\\d{2} [+-]\\d{4}]");
    }

    @Test
    void format_usesDashesForMissingValues() {
        MetricsRecord rec = MetricsRecord.builder()
                .timestamp(Instant.now())
                .clientIp("10.0.0.1")
                .state(SessionState.MALFORMED)
                .failureKind("INCOMPLETE_REQUEST")
                .build();

        assertThat(service.format("%r %>s %b %T %v %m %x", rec)).isEqualTo("- - - - - - INCOMPLETE_REQUEST");
    }

    @Test
    void format_keepsUnknownTokensLiterally() {
        assertThat(service.format("%q %> 100%", completed().build())).isEqualTo("%q %> 100%");
    }

    @Test
    void recordRequest_logsCompletedAtInfoAndRateLimitedAtWarn() {
        service.recordRequest(completed().build());
        service.recordRequest(completed().state(SessionState.RATE_LIMITED)
                .outcomeLine("HTTP/1.1 429 Too Many Requests").build());

        assertThat(appender.list).extracting(ILoggingEvent::getLevel).containsExactly(Level.INFO, Level.WARN);
        assertThat(appender.list.get(1).getFormattedMessage()).contains(" 429 ");
    }

    @Test
    void recordBlocked_logsAtWarn() {
        service.recordBlocked(new BlockedEvent(Instant.now(), "www.youtube.com", "10.0.0.1", "*.youtube.com"));

        ILoggingEvent event = appender.list.get(0);
        assertThat(event.getLevel()).isEqualTo(Level.WARN);
        assertThat(event.getFormattedMessage()).isEqualTo("BLOCKED www.youtube.com from 10.0.0.1 (pattern *.youtube.com)");
    }

    @Test
    void logHeaders_addsDebugLineWithRawHead() {
        LoggingConfig withHeaders = new LoggingConfig();
        withHeaders.setLogHeaders(true);
        service.updateConfig(withHeaders);

        service.recordRequest(completed().build());

        assertThat(appender.list).hasSize(2);
        assertThat(appender.list.get(1).getLevel()).isEqualTo(Level.DEBUG);
        assertThat(appender.list.get(1).getFormattedMessage()).contains("Host: example.com");
    }

    @Test
    void updateConfig_switchesFormat() {
        LoggingConfig custom = new LoggingConfig();
        custom.setFormat("%m %v");
        service.updateConfig(custom);

        service.recordRequest(completed().build());

        assertThat(appender.list.get(0).getFormattedMessage()).isEqualTo("GET example.com");
    }
}
