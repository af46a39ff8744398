package com.warden.proxy.core.utils;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Common I/O utility methods for stream copying and socket cleanup.
 */
public class IoUtils {

    private IoUtils() {
        // Utility class
    }

    private static final Logger log = LoggerFactory.getLogger(IoUtils.class);

    /** Buffer size used for relay and body transfers. */
    public static final int DEFAULT_BUFFER_SIZE = 8192;

    /** Line terminator used on the HTTP wire. */
    public static final byte[] CRLF = { '\r', '\n' };

    /**
     * Copies exactly {@code length} bytes from {@code in} to {@code out}.
     *
     * @param in     Source stream.
     * @param out    Destination stream.
     * @param length Number of bytes to copy.
     * @return The number of bytes copied, always {@code length}.
     * @throws EOFException If the source ends early.
     * @throws IOException  If an I/O error occurs.
     */
    public static long copyExactly(InputStream in, OutputStream out, long length) throws IOException {
        byte[] buffer = new byte[DEFAULT_BUFFER_SIZE];
        long remaining = length;
        while (remaining > 0) {
            int read = in.read(buffer, 0, (int) Math.min(buffer.length, remaining));
            if (read < 0) {
                throw new EOFException("Stream ended with " + remaining + " of " + length + " bytes outstanding");
            }
            out.write(buffer, 0, read);
            remaining -= read;
        }
        return length;
    }

    /**
     * Reads a single line of text from an input stream.
     * The line is considered terminated by CRLF (\r\n) or LF (\n).
     *
     * @param in The input stream to read from.
     * @return The line read, or null if the end of the stream is reached.
     * @throws IOException If an I/O error occurs.
     */
    public static String readLine(InputStream in) throws IOException {
        return readLine(in, 8192); // Default max 8KB
    }

    /**
     * Reads a single line of text from an input stream with a maximum length limit.
     * The line is considered terminated by CRLF (\r\n) or LF (\n) and decoded as
     * ISO-8859-1, matching HTTP/1.1 wire encoding.
     *
     * @param in        The input stream to read from.
     * @param maxLength The maximum allowed length of the line.
     * @return The line read, or null if the end of the stream is reached.
     * @throws IOException If an I/O error occurs or the line exceeds maxLength.
     */
    public static String readLine(InputStream in, int maxLength) throws IOException {
        ByteArrayOutputStream buf = new ByteArrayOutputStream(128);
        int len = 0;
        int c;
        while ((c = in.read()) != -1) {
            if (c == '\n') {
                break;
            }
            if (c != '\r') {
                if (++len > maxLength) {
                    throw new IOException("Line length exceeds maximum allowed length of " + maxLength);
                }
                buf.write(c);
            }
        }
        if (c == -1 && len == 0) {
            return null;
        }
        return buf.toString(StandardCharsets.ISO_8859_1);
    }

    /**
     * Writes a line followed by CRLF.
     *
     * @param out  Destination stream.
     * @param line Line content without terminator.
     * @return Number of bytes written.
     * @throws IOException If an I/O error occurs.
     */
    public static int writeLine(OutputStream out, String line) throws IOException {
        byte[] bytes = line.getBytes(StandardCharsets.ISO_8859_1);
        out.write(bytes);
        out.write(CRLF);
        return bytes.length + CRLF.length;
    }

    /**
     * Half-closes a socket by shutting down its output, signalling EOF to the
     * peer while still allowing reads.
     *
     * @param socket The socket, may be null.
     */
    public static void shutdownOutputQuietly(Socket socket) {
        if (socket != null && !socket.isClosed() && !socket.isOutputShutdown()) {
            try {
                socket.shutdownOutput();
            } catch (IOException e) {
                log.debug("Error shutting down socket output: {}", e.getMessage());
            }
        }
    }

    /**
     * Safely closes a resource without throwing exceptions.
     *
     * @param closeable The resource to close.
     */
    public static void closeQuietly(AutoCloseable closeable) {
        closeQuietly(closeable, "resource");
    }

    /**
     * Safely closes a resource, logging any exceptions.
     *
     * @param closeable The resource to close.
     * @param name      Name of the resource for logging.
     */
    public static void closeQuietly(AutoCloseable closeable, String name) {
        if (closeable != null) {
            try {
                closeable.close();
            } catch (Exception e) {
                log.debug("Error closing {}: {}", name, e.getMessage());
            }
        }
    }
}
