package com.warden.proxy.core.constants;

/**
 * HTTP header names the proxy inspects or rewrites.
 */
public enum HeaderConstants {
    /** The standard HTTP Host header. */
    HOST("Host"),
    /** Non-standard keep-alive control sent by clients to proxies. */
    PROXY_CONNECTION("Proxy-Connection"),
    /** Credentials from client to proxy; never forwarded. */
    PROXY_AUTHORIZATION("Proxy-Authorization"),
    /** Hop-by-hop Connection header. */
    CONNECTION("Connection"),
    /** Specifies the persistent connection parameters. */
    KEEP_ALIVE("Keep-Alive"),
    /** Transfer codings the client accepts; hop-by-hop. */
    TE("TE"),
    /** Protocol switch request; hop-by-hop. */
    UPGRADE("Upgrade"),
    /** Length of the message body in bytes. */
    CONTENT_LENGTH("Content-Length"),
    /** Transfer coding applied to the message body. */
    TRANSFER_ENCODING("Transfer-Encoding"),
    /** Seconds a rate limited client should wait. */
    RETRY_AFTER("Retry-After");

    private final String value;

    HeaderConstants(String value) {
        this.value = value;
    }

    /**
     * Retrieves the canonical spelling of the header name.
     * 
     * @return The header name.
     */
    public String getValue() {
        return value;
    }
}
