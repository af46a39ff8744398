package com.warden.proxy.core.events;

import java.time.Instant;

/**
 * A request refused because its destination matched a block pattern.
 *
 * @param timestamp      When the request was refused.
 * @param hostname       The requested host.
 * @param clientIp       Address of the client.
 * @param matchedPattern The block pattern that matched.
 */
public record BlockedEvent(Instant timestamp, String hostname, String clientIp, String matchedPattern) {
}
