package com.warden.proxy.core.proxy;

import com.warden.proxy.core.events.BlockedEvent;
import com.warden.proxy.core.events.EventSink;
import com.warden.proxy.core.events.MetricsRecord;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Collects session events for assertions.
 */
class RecordingEventSink implements EventSink {

    final List<MetricsRecord> records = new CopyOnWriteArrayList<>();
    final List<BlockedEvent> blocked = new CopyOnWriteArrayList<>();

    @Override
    public void recordRequest(MetricsRecord rec) {
        records.add(rec);
    }

    @Override
    public void recordBlocked(BlockedEvent event) {
        blocked.add(event);
    }

    int total() {
        return records.size() + blocked.size();
    }
}
