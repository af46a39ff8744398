package com.warden.proxy.core.http;

import java.time.Duration;

/**
 * Outcome of one forwarded HTTP exchange.
 *
 * @param statusLine       Final upstream status line relayed to the client.
 * @param statusCode       Numeric status of {@code statusLine}.
 * @param bytesToUpstream  Request head and body bytes written upstream.
 * @param requestBodyBytes Request body bytes read from the client, chunk
 *                         framing included.
 * @param bytesToClient    Response bytes relayed to the client, head included.
 * @param ttfb             Request fully sent to first response byte.
 * @param duration         Request fully sent to response fully relayed.
 */
public record ForwardResult(String statusLine, int statusCode, long bytesToUpstream, long requestBodyBytes,
        long bytesToClient, Duration ttfb, Duration duration) {
}
