package com.warden.proxy.core.http;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.LongSupplier;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.warden.proxy.core.constants.HeaderConstants;
import com.warden.proxy.core.exceptions.IncompleteRequestException;
import com.warden.proxy.core.exceptions.MalformedRequestException;
import com.warden.proxy.core.exceptions.RequestTimeoutException;

/**
 * Reads and classifies one request head from a client stream.
 * <p>
 * The parser consumes bytes up to and including the empty line that ends the
 * header block and nothing beyond it, so the caller can hand the same stream
 * to the body forwarder. Callers should pass a buffered stream; the parser
 * reads one byte at a time. The header window is enforced per read by the
 * socket timeout the caller sets and overall by a deadline checked here.
 */
public class RequestParser {

    private static final Logger log = LoggerFactory.getLogger(RequestParser.class);

    /** Maximum number of header lines accepted in one request. */
    public static final int MAX_HTTP_HEADERS = 100;

    private static final Pattern TOKEN = Pattern.compile("[!#$%&'*+.^_`|~0-9A-Za-z-]+");
    private static final Pattern VERSION = Pattern.compile("HTTP/\\d\\.\\d");
    private static final Pattern DIGITS = Pattern.compile("\\d{1,5}");

    private final int maxHeaderBytes;
    private final long headerTimeoutNanos;
    private final LongSupplier nanoClock;

    public RequestParser(int maxHeaderBytes, Duration headerTimeout) {
        this(maxHeaderBytes, headerTimeout, System::nanoTime);
    }

    /**
     * @param maxHeaderBytes Upper bound for request line plus headers.
     * @param headerTimeout  Overall window for the head to arrive.
     * @param nanoClock      Monotonic clock.
     */
    public RequestParser(int maxHeaderBytes, Duration headerTimeout, LongSupplier nanoClock) {
        this.maxHeaderBytes = maxHeaderBytes;
        this.headerTimeoutNanos = headerTimeout.toNanos();
        this.nanoClock = nanoClock;
    }

    /**
     * Parses one request head.
     *
     * @param in The client stream.
     * @return The parsed request.
     * @throws MalformedRequestException  If the head is not a valid proxy
     *                                    request.
     * @throws IncompleteRequestException If the stream ends inside the head.
     * @throws RequestTimeoutException    If the head does not arrive in time.
     * @throws IOException                On any other read error.
     */
    public ParsedRequest parse(InputStream in) throws IOException {
        ByteArrayOutputStream head = new ByteArrayOutputStream(512);
        List<String> lines = readHead(in, head);

        String[] requestLine = splitRequestLine(lines.get(0));
        String method = requestLine[0];
        String target = requestLine[1];
        String version = requestLine[2];

        List<HeaderField> headers = new ArrayList<>(lines.size() - 1);
        for (int i = 1; i < lines.size(); i++) {
            headers.add(parseHeader(lines.get(i)));
        }

        long contentLength = contentLength(headers);
        boolean chunked = isChunked(headers);
        byte[] raw = head.toByteArray();

        if (ParsedRequest.CONNECT.equals(method)) {
            Authority authority = parseAuthority(target, 443);
            return new ParsedRequest(method, target, version, null, authority.host, authority.port, null, false,
                    headers, raw, contentLength, chunked);
        }

        String lower = target.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            return fromAbsoluteUri(method, target, version, headers, raw, contentLength, chunked);
        }
        if (!target.startsWith("/") && !("*".equals(target) && "OPTIONS".equals(method))) {
            throw new MalformedRequestException("Unsupported request target: " + target);
        }

        String hostHeader = first(headers, HeaderConstants.HOST.getValue());
        if (hostHeader == null || hostHeader.isEmpty()) {
            throw new MalformedRequestException("No target host in request line or Host header");
        }
        Authority authority = parseAuthority(hostHeader, 80);
        return new ParsedRequest(method, target, version, "http", authority.host, authority.port, target, false,
                headers, raw, contentLength, chunked);
    }

    private List<String> readHead(InputStream in, ByteArrayOutputStream head) throws IOException {
        long deadline = nanoClock.getAsLong() + headerTimeoutNanos;
        List<String> lines = new ArrayList<>();
        ByteArrayOutputStream line = new ByteArrayOutputStream(128);
        while (true) {
            if (nanoClock.getAsLong() - deadline > 0) {
                throw new RequestTimeoutException("Request head not received within "
                        + Duration.ofNanos(headerTimeoutNanos).toMillis() + " ms");
            }
            int b = read(in);
            if (b == -1) {
                throw new IncompleteRequestException(head.size() == 0 && lines.isEmpty()
                        ? "Connection closed before any request data"
                        : "Connection closed before end of request head");
            }
            if (head.size() >= maxHeaderBytes) {
                throw new MalformedRequestException("Request head exceeds " + maxHeaderBytes + " bytes");
            }
            head.write(b);
            if (b != '\n') {
                line.write(b);
                continue;
            }
            String text = stripCr(line.toString(StandardCharsets.ISO_8859_1));
            line.reset();
            if (text.isEmpty()) {
                if (lines.isEmpty()) {
                    // Tolerate blank lines before the request line
                    head.reset();
                    continue;
                }
                return lines;
            }
            lines.add(text);
            if (lines.size() > MAX_HTTP_HEADERS + 1) {
                throw new MalformedRequestException(
                        "Too many HTTP headers (exceeds limit of " + MAX_HTTP_HEADERS + ")");
            }
        }
    }

    private static int read(InputStream in) throws IOException {
        try {
            return in.read();
        } catch (SocketTimeoutException e) {
            throw new RequestTimeoutException("Timed out waiting for request head", e);
        }
    }

    private static String stripCr(String text) {
        return text.endsWith("\r") ? text.substring(0, text.length() - 1) : text;
    }

    private static String[] splitRequestLine(String line) {
        String[] parts = line.split(" ", -1);
        if (parts.length != 3) {
            throw new MalformedRequestException("Malformed request line: " + abbreviate(line));
        }
        if (!TOKEN.matcher(parts[0]).matches()) {
            throw new MalformedRequestException("Invalid method: " + abbreviate(parts[0]));
        }
        if (parts[1].isEmpty()) {
            throw new MalformedRequestException("Empty request target");
        }
        if (!VERSION.matcher(parts[2]).matches()) {
            throw new MalformedRequestException("Invalid HTTP version: " + abbreviate(parts[2]));
        }
        return parts;
    }

    private static HeaderField parseHeader(String line) {
        if (line.charAt(0) == ' ' || line.charAt(0) == '\t') {
            throw new MalformedRequestException("Folded header lines are not supported");
        }
        int idx = line.indexOf(':');
        if (idx <= 0) {
            throw new MalformedRequestException("Header line without name or colon: " + abbreviate(line));
        }
        String name = line.substring(0, idx);
        if (!TOKEN.matcher(name).matches()) {
            throw new MalformedRequestException("Invalid header name: " + abbreviate(name));
        }
        return new HeaderField(name, line.substring(idx + 1).trim());
    }

    private static long contentLength(List<HeaderField> headers) {
        String found = null;
        for (HeaderField field : headers) {
            if (!field.hasName(HeaderConstants.CONTENT_LENGTH.getValue())) {
                continue;
            }
            if (!field.value().matches("\\d{1,18}")) {
                throw new MalformedRequestException("Invalid Content-Length: " + abbreviate(field.value()));
            }
            if (found != null && !found.equals(field.value())) {
                throw new MalformedRequestException("Conflicting Content-Length headers");
            }
            found = field.value();
        }
        return found == null ? -1 : Long.parseLong(found);
    }

    private static boolean isChunked(List<HeaderField> headers) {
        String encoding = null;
        for (HeaderField field : headers) {
            if (field.hasName(HeaderConstants.TRANSFER_ENCODING.getValue())) {
                encoding = encoding == null ? field.value() : encoding + "," + field.value();
            }
        }
        if (encoding == null) {
            return false;
        }
        String[] codings = encoding.split(",");
        if (!"chunked".equalsIgnoreCase(codings[codings.length - 1].trim())) {
            throw new MalformedRequestException("Request body length cannot be determined: " + abbreviate(encoding));
        }
        return true;
    }

    private static ParsedRequest fromAbsoluteUri(String method, String target, String version,
            List<HeaderField> headers, byte[] raw, long contentLength, boolean chunked) {
        URI uri;
        try {
            uri = new URI(target);
        } catch (URISyntaxException e) {
            throw new MalformedRequestException("Invalid absolute URI: " + abbreviate(target), e);
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        String rawAuthority = uri.getRawAuthority();
        if (rawAuthority == null || rawAuthority.isEmpty()) {
            throw new MalformedRequestException("Absolute URI without host: " + abbreviate(target));
        }
        int at = rawAuthority.lastIndexOf('@');
        if (at >= 0) {
            rawAuthority = rawAuthority.substring(at + 1);
        }
        Authority authority = parseAuthority(rawAuthority, "https".equals(scheme) ? 443 : 80);

        String path = uri.getRawPath();
        if (path == null || path.isEmpty()) {
            path = "/";
        }
        if (uri.getRawQuery() != null) {
            path = path + "?" + uri.getRawQuery();
        }
        log.trace("Absolute-form target {} -> {}:{}{}", target, authority.host, authority.port, path);
        return new ParsedRequest(method, target, version, scheme, authority.host, authority.port, path, true,
                headers, raw, contentLength, chunked);
    }

    /**
     * Splits {@code host[:port]} or {@code [v6addr][:port]}.
     */
    static Authority parseAuthority(String value, int defaultPort) {
        String host;
        String port = null;
        if (value.startsWith("[")) {
            int close = value.indexOf(']');
            if (close < 0) {
                throw new MalformedRequestException("Unterminated IPv6 literal: " + abbreviate(value));
            }
            host = value.substring(1, close);
            String rest = value.substring(close + 1);
            if (!rest.isEmpty()) {
                if (rest.charAt(0) != ':') {
                    throw new MalformedRequestException("Invalid authority: " + abbreviate(value));
                }
                port = rest.substring(1);
            }
        } else {
            int colon = value.indexOf(':');
            if (colon >= 0 && value.indexOf(':', colon + 1) >= 0) {
                throw new MalformedRequestException("IPv6 literal must be bracketed: " + abbreviate(value));
            }
            host = colon >= 0 ? value.substring(0, colon) : value;
            port = colon >= 0 ? value.substring(colon + 1) : null;
        }
        if (host.isEmpty() || host.chars().anyMatch(c -> c <= ' ' || c == '/' || c == '@')) {
            throw new MalformedRequestException("Invalid host: " + abbreviate(value));
        }
        return new Authority(host.toLowerCase(Locale.ROOT), parsePort(port, defaultPort));
    }

    private static int parsePort(String port, int defaultPort) {
        if (port == null) {
            return defaultPort;
        }
        if (!DIGITS.matcher(port).matches()) {
            throw new MalformedRequestException("Invalid port: " + abbreviate(port));
        }
        int value = Integer.parseInt(port);
        if (value < 1 || value > 65535) {
            throw new MalformedRequestException("Invalid port: " + abbreviate(port));
        }
        return value;
    }

    private static String first(List<HeaderField> headers, String name) {
        for (HeaderField field : headers) {
            if (field.hasName(name)) {
                return field.value();
            }
        }
        return null;
    }

    private static String abbreviate(String value) {
        return value.length() <= 64 ? value : value.substring(0, 64) + "...";
    }

    record Authority(String host, int port) {
    }
}
