package com.warden.proxy.core.events;

/**
 * Receives one event per finished client session. Implementations must be
 * thread-safe; sessions finish concurrently.
 */
public interface EventSink {

    /**
     * Called for every session that did not end in BLOCKED.
     *
     * @param record The session record.
     */
    void recordRequest(MetricsRecord record);

    /**
     * Called for every session that ended in BLOCKED.
     *
     * @param event The blocked request.
     */
    void recordBlocked(BlockedEvent event);
}
