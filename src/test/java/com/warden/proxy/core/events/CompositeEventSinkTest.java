package com.warden.proxy.core.events;

import com.warden.proxy.core.proxy.SessionState;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class CompositeEventSinkTest {

    private static MetricsRecord record() {
        return MetricsRecord.builder()
                .timestamp(Instant.now())
                .clientIp("10.0.0.1")
                .state(SessionState.MALFORMED)
                .build();
    }

    @Test
    void deliversToEverySinkInOrder() {
        EventSink first = mock(EventSink.class);
        EventSink second = mock(EventSink.class);
        MetricsRecord rec = record();

        new CompositeEventSink(List.of(first, second)).recordRequest(rec);

        InOrder order = inOrder(first, second);
        order.verify(first).recordRequest(rec);
        order.verify(second).recordRequest(rec);
    }

    @Test
    void failingSinkDoesNotStopOthers() {
        EventSink failing = mock(EventSink.class);
        EventSink healthy = mock(EventSink.class);
        BlockedEvent event = new BlockedEvent(Instant.now(), "www.youtube.com", "10.0.0.1", "*.youtube.com");
        doThrow(new IllegalStateException("boom")).when(failing).recordBlocked(event);

        CompositeEventSink composite = new CompositeEventSink(List.of(failing, healthy));

        assertThatCode(() -> composite.recordBlocked(event)).doesNotThrowAnyException();
        verify(healthy).recordBlocked(event);
    }
}
