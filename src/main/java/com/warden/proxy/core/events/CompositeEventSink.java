package com.warden.proxy.core.events;

import java.util.List;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delivers every event to each of its sinks in order. A sink that throws is
 * logged and skipped; the remaining sinks still receive the event.
 */
public class CompositeEventSink implements EventSink {

    private static final Logger log = LoggerFactory.getLogger(CompositeEventSink.class);

    private final List<EventSink> sinks;

    public CompositeEventSink(List<EventSink> sinks) {
        this.sinks = List.copyOf(sinks);
    }

    @Override
    public void recordRequest(MetricsRecord rec) {
        deliver(sink -> sink.recordRequest(rec));
    }

    @Override
    public void recordBlocked(BlockedEvent event) {
        deliver(sink -> sink.recordBlocked(event));
    }

    private void deliver(Consumer<EventSink> action) {
        for (EventSink sink : sinks) {
            try {
                action.accept(sink);
            } catch (RuntimeException e) {
                log.warn("Event sink {} failed: {}", sink.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }
}
