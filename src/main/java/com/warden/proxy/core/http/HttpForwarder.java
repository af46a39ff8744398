package com.warden.proxy.core.http;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.FilterInputStream;
import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.function.LongSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.warden.proxy.core.constants.HeaderConstants;
import com.warden.proxy.core.exceptions.UpstreamException;
import com.warden.proxy.core.exceptions.UpstreamException.Failure;
import com.warden.proxy.core.utils.CountingOutputStream;
import com.warden.proxy.core.utils.IoUtils;

/**
 * Forwards one plain HTTP request to an already connected upstream socket and
 * relays the response back to the client byte for byte.
 * <p>
 * Failures on the upstream side surface as {@link UpstreamException}; failures
 * writing to or reading from the client propagate as {@link IOException}.
 */
public class HttpForwarder {

    private static final Logger log = LoggerFactory.getLogger(HttpForwarder.class);

    private static final int MAX_RESPONSE_HEAD_BYTES = 64 * 1024;
    private static final int MAX_RESPONSE_HEADERS = 100;
    private static final int MAX_CHUNK_LINE = 8192;

    private final LongSupplier nanoClock;

    public HttpForwarder() {
        this(System::nanoTime);
    }

    public HttpForwarder(LongSupplier nanoClock) {
        this.nanoClock = nanoClock;
    }

    /**
     * Sends the request upstream and relays the response.
     *
     * @param request   The parsed request; its head has already been consumed
     *                  from {@code clientIn}.
     * @param clientIn  Client stream positioned at the request body.
     * @param clientOut Client output stream.
     * @param upstream  Connected upstream socket with its read timeout set.
     * @return Status line, byte counts and timings of the exchange.
     * @throws UpstreamException If the upstream closes, stalls or answers with
     *                           something that is not an HTTP response.
     * @throws IOException       If the client connection fails.
     */
    public ForwardResult forward(ParsedRequest request, InputStream clientIn, OutputStream clientOut, Socket upstream)
            throws IOException {
        CountingOutputStream upOut = new CountingOutputStream(new BufferedOutputStream(
                new UpstreamOutputStream(upstream.getOutputStream()), IoUtils.DEFAULT_BUFFER_SIZE));
        InputStream upIn = new BufferedInputStream(new UpstreamInputStream(upstream.getInputStream()),
                IoUtils.DEFAULT_BUFFER_SIZE);

        long bodyBytes = sendRequest(request, clientIn, upOut);
        long sentAt = nanoClock.getAsLong();

        ClientOutputStream guardedClient = new ClientOutputStream(clientOut);
        CountingOutputStream toClient = new CountingOutputStream(guardedClient);
        String relayedStatus = null;
        try {
            int first = upIn.read();
            long ttfb = nanoClock.getAsLong() - sentAt;
            if (first == -1) {
                throw new UpstreamException(Failure.UPSTREAM_CLOSED, "Upstream closed before responding");
            }
            ResponseHead head = readResponseHead(upIn, first);
            while (head.isInterim()) {
                toClient.write(head.raw);
                relayedStatus = head.statusLine;
                head = readResponseHead(upIn, -1);
            }
            toClient.write(head.raw);
            relayedStatus = head.statusLine;

            relayBody(request, head, upIn, toClient);
            toClient.flush();
            long duration = nanoClock.getAsLong() - sentAt;
            log.debug("{} {} -> {} ({} bytes)", request.getMethod(), request.getTarget(), head.statusLine,
                    toClient.getCount());
            return new ForwardResult(head.statusLine, head.status, upOut.getCount(), bodyBytes, toClient.getCount(),
                    Duration.ofNanos(ttfb), Duration.ofNanos(duration));
        } catch (ClientAbortException e) {
            throw e.getCause();
        } catch (UpstreamException e) {
            if (relayedStatus != null && !e.isResponseCommitted()) {
                throw new UpstreamException(e.getFailure(), e.getMessage(), relayedStatus, e);
            }
            throw e;
        } catch (EOFException e) {
            throw new UpstreamException(Failure.UPSTREAM_CLOSED, e.getMessage(), relayedStatus, e);
        } catch (IOException e) {
            throw new UpstreamException(Failure.INVALID_RESPONSE, e.getMessage(), relayedStatus, e);
        }
    }

    private long sendRequest(ParsedRequest request, InputStream clientIn, CountingOutputStream upOut)
            throws IOException {
        IoUtils.writeLine(upOut, request.getMethod() + " " + request.getPath() + " " + request.getVersion());
        List<HeaderField> headers = HeaderRewriter.forUpstream(request);
        for (HeaderField field : headers) {
            IoUtils.writeLine(upOut, field.toString());
        }
        upOut.write(IoUtils.CRLF);

        long bodyBytes = 0;
        if (request.isChunked()) {
            bodyBytes = copyChunked(clientIn, upOut);
        } else if (request.getContentLength() > 0) {
            bodyBytes = IoUtils.copyExactly(clientIn, upOut, request.getContentLength());
        }
        upOut.flush();
        return bodyBytes;
    }

    private static void relayBody(ParsedRequest request, ResponseHead head, InputStream upIn, OutputStream out)
            throws IOException {
        if ("HEAD".equals(request.getMethod()) || head.status == 204 || head.status == 304 || head.status < 200) {
            return;
        }
        if (head.chunked) {
            copyChunked(upIn, out);
        } else if (head.contentLength >= 0) {
            IoUtils.copyExactly(upIn, out, head.contentLength);
        } else {
            // No framing: the body ends when the upstream closes
            upIn.transferTo(out);
        }
    }

    /**
     * Copies a chunked body verbatim, including its framing, the terminating
     * chunk and the trailer section. Line endings are relayed as received.
     *
     * @return Number of bytes copied, framing included.
     */
    static long copyChunked(InputStream in, OutputStream out) throws IOException {
        long total = 0;
        while (true) {
            byte[] sizeLine = copyLine(in, out);
            total += sizeLine.length;
            long size = parseChunkSize(lineText(sizeLine));
            if (size == 0) {
                byte[] trailer;
                do {
                    trailer = copyLine(in, out);
                    total += trailer.length;
                } while (!lineText(trailer).isEmpty());
                return total;
            }
            total += IoUtils.copyExactly(in, out, size);
            byte[] terminator = copyLine(in, out);
            total += terminator.length;
            if (!lineText(terminator).isEmpty()) {
                throw new IOException("Missing line break after chunk data");
            }
        }
    }

    /**
     * Reads one line up to and including its LF and writes the raw bytes on.
     */
    private static byte[] copyLine(InputStream in, OutputStream out) throws IOException {
        ByteArrayOutputStream raw = new ByteArrayOutputStream(32);
        int c;
        while ((c = in.read()) != -1) {
            raw.write(c);
            if (c == '\n') {
                break;
            }
            if (raw.size() > MAX_CHUNK_LINE) {
                throw new IOException("Chunk line exceeds " + MAX_CHUNK_LINE + " bytes");
            }
        }
        if (c == -1) {
            throw new EOFException("Stream ended inside chunked body");
        }
        raw.writeTo(out);
        return raw.toByteArray();
    }

    private static String lineText(byte[] raw) {
        int end = raw.length - 1;
        if (end > 0 && raw[end - 1] == '\r') {
            end--;
        }
        return new String(raw, 0, end, StandardCharsets.ISO_8859_1);
    }

    private static long parseChunkSize(String line) throws IOException {
        int ext = line.indexOf(';');
        String hex = (ext >= 0 ? line.substring(0, ext) : line).trim();
        try {
            long size = Long.parseLong(hex, 16);
            if (size < 0) {
                throw new IOException("Negative chunk size: " + hex);
            }
            return size;
        } catch (NumberFormatException e) {
            throw new IOException("Invalid chunk size: " + hex, e);
        }
    }

    private static ResponseHead readResponseHead(InputStream in, int firstByte) throws IOException {
        ByteArrayOutputStream raw = new ByteArrayOutputStream(512);
        ByteArrayOutputStream line = new ByteArrayOutputStream(128);
        String statusLine = null;
        long contentLength = -1;
        boolean chunked = false;
        int headerCount = 0;
        int b = firstByte >= 0 ? firstByte : in.read();
        while (true) {
            if (b == -1) {
                throw new EOFException("Upstream closed inside response head");
            }
            if (raw.size() >= MAX_RESPONSE_HEAD_BYTES) {
                throw new IOException("Response head exceeds " + MAX_RESPONSE_HEAD_BYTES + " bytes");
            }
            raw.write(b);
            if (b == '\n') {
                String text = line.toString(StandardCharsets.ISO_8859_1);
                if (text.endsWith("\r")) {
                    text = text.substring(0, text.length() - 1);
                }
                line.reset();
                if (statusLine == null) {
                    statusLine = text;
                } else if (text.isEmpty()) {
                    break;
                } else {
                    if (++headerCount > MAX_RESPONSE_HEADERS) {
                        throw new IOException("Too many response headers");
                    }
                    int idx = text.indexOf(':');
                    if (idx > 0) {
                        String name = text.substring(0, idx).trim();
                        String value = text.substring(idx + 1).trim();
                        if (name.equalsIgnoreCase(HeaderConstants.CONTENT_LENGTH.getValue())) {
                            contentLength = parseContentLength(value);
                        } else if (name.equalsIgnoreCase(HeaderConstants.TRANSFER_ENCODING.getValue())) {
                            chunked = value.toLowerCase(Locale.ROOT).trim().endsWith("chunked");
                        }
                    }
                }
            } else {
                line.write(b);
            }
            b = in.read();
        }
        return new ResponseHead(raw.toByteArray(), statusLine, parseStatus(statusLine), contentLength, chunked);
    }

    private static int parseStatus(String statusLine) throws IOException {
        String[] parts = statusLine.split(" ", 3);
        if (parts.length < 2 || !parts[0].startsWith("HTTP/") || !parts[1].matches("\\d{3}")) {
            throw new IOException("Invalid status line: " + statusLine);
        }
        return Integer.parseInt(parts[1]);
    }

    private static long parseContentLength(String value) throws IOException {
        try {
            long length = Long.parseLong(value);
            if (length < 0) {
                throw new IOException("Negative Content-Length: " + value);
            }
            return length;
        } catch (NumberFormatException e) {
            throw new IOException("Invalid Content-Length: " + value, e);
        }
    }

    private static final class ResponseHead {
        final byte[] raw;
        final String statusLine;
        final int status;
        final long contentLength;
        final boolean chunked;

        ResponseHead(byte[] raw, String statusLine, int status, long contentLength, boolean chunked) {
            this.raw = raw;
            this.statusLine = statusLine;
            this.status = status;
            this.contentLength = contentLength;
            this.chunked = chunked;
        }

        /** 1xx responses other than 101 are followed by the final response. */
        boolean isInterim() {
            return status >= 100 && status < 200 && status != 101;
        }
    }

    /**
     * Maps socket errors on the upstream read side to {@link UpstreamException}.
     */
    private static final class UpstreamInputStream extends FilterInputStream {
        UpstreamInputStream(InputStream in) {
            super(in);
        }

        @Override
        public int read() throws IOException {
            try {
                return super.read();
            } catch (SocketTimeoutException e) {
                throw new UpstreamException(Failure.UPSTREAM_TIMEOUT, "Upstream read timed out", e);
            } catch (IOException e) {
                throw new UpstreamException(Failure.UPSTREAM_CLOSED, "Upstream read failed: " + e.getMessage(), e);
            }
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            try {
                return super.read(b, off, len);
            } catch (SocketTimeoutException e) {
                throw new UpstreamException(Failure.UPSTREAM_TIMEOUT, "Upstream read timed out", e);
            } catch (IOException e) {
                throw new UpstreamException(Failure.UPSTREAM_CLOSED, "Upstream read failed: " + e.getMessage(), e);
            }
        }
    }

    /**
     * Maps socket errors on the upstream write side to {@link UpstreamException}.
     */
    private static final class UpstreamOutputStream extends FilterOutputStream {
        UpstreamOutputStream(OutputStream out) {
            super(out);
        }

        @Override
        public void write(int b) {
            try {
                out.write(b);
            } catch (IOException e) {
                throw closed(e);
            }
        }

        @Override
        public void write(byte[] b, int off, int len) {
            try {
                out.write(b, off, len);
            } catch (IOException e) {
                throw closed(e);
            }
        }

        @Override
        public void flush() {
            try {
                out.flush();
            } catch (IOException e) {
                throw closed(e);
            }
        }

        private static UpstreamException closed(IOException e) {
            return new UpstreamException(Failure.UPSTREAM_CLOSED, "Upstream write failed: " + e.getMessage(), e);
        }
    }

    /**
     * Marks write failures towards the client so they are not mistaken for
     * upstream errors.
     */
    private static final class ClientOutputStream extends FilterOutputStream {
        ClientOutputStream(OutputStream out) {
            super(out);
        }

        @Override
        public void write(int b) throws IOException {
            try {
                out.write(b);
            } catch (IOException e) {
                throw new ClientAbortException(e);
            }
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            try {
                out.write(b, off, len);
            } catch (IOException e) {
                throw new ClientAbortException(e);
            }
        }

        @Override
        public void flush() throws IOException {
            try {
                out.flush();
            } catch (IOException e) {
                throw new ClientAbortException(e);
            }
        }
    }

    private static final class ClientAbortException extends IOException {
        private static final long serialVersionUID = 1L;

        ClientAbortException(IOException cause) {
            super(cause);
        }

        @Override
        public synchronized IOException getCause() {
            return (IOException) super.getCause();
        }
    }
}
