package com.warden.proxy.core.http;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.warden.proxy.core.constants.HeaderConstants;

/**
 * A client request head parsed off the wire. Instances are only produced by
 * {@link RequestParser} and are never partially filled.
 */
public final class ParsedRequest {

    /** Method that opens a tunnel. */
    public static final String CONNECT = "CONNECT";

    private final String method;
    private final String target;
    private final String version;
    private final String scheme;
    private final String host;
    private final int port;
    private final String path;
    private final boolean absoluteForm;
    private final List<HeaderField> headers;
    private final Map<String, String> headerMap;
    private final byte[] rawHead;
    private final long contentLength;
    private final boolean chunked;

    ParsedRequest(String method, String target, String version, String scheme, String host, int port, String path,
            boolean absoluteForm, List<HeaderField> headers, byte[] rawHead, long contentLength, boolean chunked) {
        this.method = method;
        this.target = target;
        this.version = version;
        this.scheme = scheme;
        this.host = host;
        this.port = port;
        this.path = path;
        this.absoluteForm = absoluteForm;
        this.headers = List.copyOf(headers);
        Map<String, String> map = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (HeaderField field : headers) {
            map.putIfAbsent(field.name(), field.value());
        }
        this.headerMap = Collections.unmodifiableMap(map);
        this.rawHead = rawHead.clone();
        this.contentLength = contentLength;
        this.chunked = chunked;
    }

    public String getMethod() {
        return method;
    }

    /** Request target exactly as it appeared in the request line. */
    public String getTarget() {
        return target;
    }

    public String getVersion() {
        return version;
    }

    /** {@code http} or {@code https} for plain requests, null for CONNECT. */
    public String getScheme() {
        return scheme;
    }

    /** Lower-cased destination host, IPv6 literals without brackets. */
    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    /** Origin-form path and query for plain requests, null for CONNECT. */
    public String getPath() {
        return path;
    }

    /** Whether the request line carried an absolute URI. */
    public boolean isAbsoluteForm() {
        return absoluteForm;
    }

    public boolean isConnect() {
        return CONNECT.equals(method);
    }

    /** Header fields in arrival order, duplicates retained. */
    public List<HeaderField> getHeaders() {
        return headers;
    }

    /** Case-insensitive view of the headers; the first occurrence of a name wins. */
    public Map<String, String> getHeaderMap() {
        return headerMap;
    }

    public String getHeader(HeaderConstants header) {
        return headerMap.get(header.getValue());
    }

    /** Declared request body length, or -1 when none was declared. */
    public long getContentLength() {
        return contentLength;
    }

    public boolean isChunked() {
        return chunked;
    }

    public boolean hasBody() {
        return chunked || contentLength > 0;
    }

    /** The request line and header block exactly as received, terminator included. */
    public byte[] getRawHead() {
        return rawHead.clone();
    }

    public int getRawHeadLength() {
        return rawHead.length;
    }

    public String getRawHeaderText() {
        return new String(rawHead, StandardCharsets.ISO_8859_1);
    }

    public String getRequestLine() {
        return method + " " + target + " " + version;
    }

    /**
     * Authority for a Host header: the host, bracketed when it is an IPv6
     * literal, followed by the port unless it is the scheme default.
     *
     * @return The authority string.
     */
    public String getAuthority() {
        String h = host.indexOf(':') >= 0 ? "[" + host + "]" : host;
        int defaultPort = "https".equals(scheme) ? 443 : 80;
        return port == defaultPort ? h : h + ":" + port;
    }

    @Override
    public String toString() {
        return getRequestLine() + " -> " + host + ":" + port;
    }
}
