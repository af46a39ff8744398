package com.warden.proxy.core.services;

import com.warden.proxy.core.events.BlockedEvent;
import com.warden.proxy.core.events.MetricsRecord;
import com.warden.proxy.core.proxy.SessionState;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class MeteredEventSinkTest {

    private MeterRegistry registry;
    private MeteredEventSink sink;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        sink = new MeteredEventSink(registry);
    }

    private static MetricsRecord rec(String method, SessionState state, long sent, long received) {
        return MetricsRecord.builder()
                .timestamp(Instant.now())
                .clientIp("10.0.0.1")
                .method(method)
                .state(state)
                .bytesSent(sent)
                .bytesReceived(received)
                .duration(Duration.ofMillis(20))
                .ttfb(method != null ? Duration.ofMillis(5) : null)
                .build();
    }

    @Test
    void recordRequest_countsByOutcomeAndKind() {
        sink.recordRequest(rec("GET", SessionState.COMPLETED, 100, 50));
        sink.recordRequest(rec("GET", SessionState.COMPLETED, 300, 50));
        sink.recordRequest(rec("CONNECT", SessionState.COMPLETED, 1000, 200));
        sink.recordRequest(rec(null, SessionState.MALFORMED, 0, 0));

        assertThat(registry.get("proxy.requests").tags("outcome", "completed", "kind", "http").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.get("proxy.requests").tags("outcome", "completed", "kind", "tunnel").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("proxy.requests").tags("outcome", "malformed", "kind", "unknown").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void recordRequest_aggregatesTrafficAndLatency() {
        sink.recordRequest(rec("GET", SessionState.COMPLETED, 100, 50));
        sink.recordRequest(rec("GET", SessionState.FAILED, 300, 70));

        assertThat(registry.get("proxy.traffic.bytes.sent").tag("kind", "http").summary().totalAmount())
                .isEqualTo(400.0);
        assertThat(registry.get("proxy.traffic.bytes.received").tag("kind", "http").summary().totalAmount())
                .isEqualTo(120.0);
        assertThat(registry.get("proxy.request.duration").tag("kind", "http").timer().count()).isEqualTo(2);
        assertThat(registry.get("proxy.request.ttfb").tag("kind", "http").timer().count()).isEqualTo(2);
    }

    @Test
    void recordRequest_skipsTtfbWhenAbsent() {
        sink.recordRequest(rec(null, SessionState.MALFORMED, 0, 0));

        assertThat(registry.find("proxy.request.ttfb").timer()).isNull();
    }

    @Test
    void recordBlocked_incrementsCounter() {
        sink.recordBlocked(new BlockedEvent(Instant.now(), "www.youtube.com", "10.0.0.1", "*.youtube.com"));
        sink.recordBlocked(new BlockedEvent(Instant.now(), "i.ytimg.com", "10.0.0.2", "*.ytimg.com"));

        assertThat(registry.get("proxy.blocked").counter().count()).isEqualTo(2.0);
    }
}
