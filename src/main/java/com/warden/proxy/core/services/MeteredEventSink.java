package com.warden.proxy.core.services;

import java.util.Locale;

import com.warden.proxy.core.events.BlockedEvent;
import com.warden.proxy.core.events.EventSink;
import com.warden.proxy.core.events.MetricsRecord;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

/**
 * Aggregates session events into Micrometer meters: request counts by outcome,
 * latency timers and traffic summaries.
 */
public class MeteredEventSink implements EventSink {

    private static final String KIND_TUNNEL = "tunnel";
    private static final String KIND_HTTP = "http";
    private static final String KIND_UNKNOWN = "unknown";

    private final MeterRegistry registry;
    private final Counter blocked;

    public MeteredEventSink(MeterRegistry registry) {
        this.registry = registry;
        this.blocked = Counter.builder("proxy.blocked")
                .description("Requests refused by the blocklist")
                .register(registry);
    }

    @Override
    public void recordRequest(MetricsRecord rec) {
        String kind = kind(rec);
        String outcome = rec.state() != null ? rec.state().name().toLowerCase(Locale.ROOT) : KIND_UNKNOWN;

        Counter.builder("proxy.requests")
                .description("Finished client sessions")
                .tag("outcome", outcome)
                .tag("kind", kind)
                .register(registry)
                .increment();

        Timer.builder("proxy.request.duration")
                .description("Time to serve a request")
                .tag("kind", kind)
                .register(registry)
                .record(rec.duration());

        if (rec.ttfb() != null) {
            Timer.builder("proxy.request.ttfb")
                    .description("Time to first response byte")
                    .tag("kind", kind)
                    .register(registry)
                    .record(rec.ttfb());
        }

        DistributionSummary.builder("proxy.traffic.bytes.sent")
                .description("Bytes sent to clients per request")
                .baseUnit("bytes")
                .tag("kind", kind)
                .register(registry)
                .record(rec.bytesSent());

        DistributionSummary.builder("proxy.traffic.bytes.received")
                .description("Bytes received from clients per request")
                .baseUnit("bytes")
                .tag("kind", kind)
                .register(registry)
                .record(rec.bytesReceived());
    }

    @Override
    public void recordBlocked(BlockedEvent event) {
        blocked.increment();
    }

    private static String kind(MetricsRecord rec) {
        if (rec.method() == null) {
            return KIND_UNKNOWN;
        }
        return rec.isTunnel() ? KIND_TUNNEL : KIND_HTTP;
    }
}
