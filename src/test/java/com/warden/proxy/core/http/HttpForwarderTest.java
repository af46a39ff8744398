package com.warden.proxy.core.http;

import com.warden.proxy.core.exceptions.UpstreamException;
import com.warden.proxy.core.exceptions.UpstreamException.Failure;
import com.warden.proxy.core.utils.IoUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class HttpForwarderTest {

    private final HttpForwarder forwarder = new HttpForwarder();
    private final RequestParser parser = new RequestParser(64 * 1024, Duration.ofSeconds(5));
    private final CompletableFuture<String> received = new CompletableFuture<>();

    private ExecutorService executor;
    private ServerSocket upstreamServer;
    private Socket upstream;

    /** Writes the fake upstream's answer once the request has been read. */
    interface Responder {
        void respond(OutputStream out) throws Exception;
    }

    @BeforeEach
    void setUp() throws IOException {
        executor = Executors.newCachedThreadPool();
        upstreamServer = new ServerSocket(0, 50, InetAddress.getLoopbackAddress());
    }

    @AfterEach
    void tearDown() throws IOException {
        if (upstream != null) upstream.close();
        upstreamServer.close();
        executor.shutdownNow();
    }

    private void startUpstream(Responder responder) throws IOException {
        executor.submit(() -> {
            try (Socket s = upstreamServer.accept()) {
                InputStream in = new BufferedInputStream(s.getInputStream());
                StringBuilder request = new StringBuilder();
                long contentLength = 0;
                boolean chunked = false;
                String line;
                while ((line = IoUtils.readLine(in)) != null && !line.isEmpty()) {
                    request.append(line).append("\r\n");
                    if (line.toLowerCase().startsWith("content-length:")) {
                        contentLength = Long.parseLong(line.substring(15).trim());
                    } else if (line.equalsIgnoreCase("transfer-encoding: chunked")) {
                        chunked = true;
                    }
                }
                request.append("\r\n");
                ByteArrayOutputStream body = new ByteArrayOutputStream();
                if (chunked) {
                    HttpForwarder.copyChunked(in, body);
                } else {
                    body.write(in.readNBytes((int) contentLength));
                }
                request.append(body.toString(StandardCharsets.ISO_8859_1));
                received.complete(request.toString());

                OutputStream out = s.getOutputStream();
                responder.respond(out);
                out.flush();
            } catch (Exception e) {
                received.completeExceptionally(e);
            }
            return null;
        });
        upstream = new Socket(InetAddress.getLoopbackAddress(), upstreamServer.getLocalPort());
        upstream.setSoTimeout(2000);
    }

    private static Responder reply(String response) {
        return out -> out.write(response.getBytes(StandardCharsets.ISO_8859_1));
    }

    private ForwardResult forward(String rawRequest, ByteArrayOutputStream clientOut) throws IOException {
        InputStream clientIn = new ByteArrayInputStream(rawRequest.getBytes(StandardCharsets.ISO_8859_1));
        ParsedRequest request = parser.parse(clientIn);
        return forwarder.forward(request, clientIn, clientOut, upstream);
    }

    @Test
    void forward_rewritesRequestAndRelaysResponse() throws Exception {
        String response = "HTTP/1.1 200 OK\r\nContent-Length: 5\r\nX-Up: 1\r\n\r\nhello";
        startUpstream(reply(response));
        ByteArrayOutputStream clientOut = new ByteArrayOutputStream();

        ForwardResult result = forward("GET http://example.com/path?x=1 HTTP/1.1\r\n"
                + "Host: example.com\r\nProxy-Connection: keep-alive\r\nAccept: */*\r\n\r\n", clientOut);

        String upstreamSaw = received.get(5, TimeUnit.SECONDS);
        assertThat(upstreamSaw).startsWith("GET /path?x=1 HTTP/1.1\r\nHost: example.com\r\n");
        assertThat(upstreamSaw).contains("Accept: */*\r\n", "Connection: close\r\n");
        assertThat(upstreamSaw).doesNotContain("Proxy-Connection");

        assertThat(clientOut.toString(StandardCharsets.ISO_8859_1)).isEqualTo(response);
        assertThat(result.statusLine()).isEqualTo("HTTP/1.1 200 OK");
        assertThat(result.statusCode()).isEqualTo(200);
        assertThat(result.bytesToClient()).isEqualTo(response.length());
        assertThat(result.bytesToUpstream()).isEqualTo(upstreamSaw.length());
        assertThat(result.requestBodyBytes()).isZero();
        assertThat(result.ttfb()).isNotNull();
        assertThat(result.duration()).isGreaterThanOrEqualTo(result.ttfb());
    }

    @Test
    void forward_sendsRequestBody() throws Exception {
        startUpstream(reply("HTTP/1.1 201 Created\r\nContent-Length: 0\r\n\r\n"));
        ByteArrayOutputStream clientOut = new ByteArrayOutputStream();

        ForwardResult result = forward("POST http://example.com/items HTTP/1.1\r\n"
                + "Content-Length: 11\r\n\r\n{\"a\":\"b12\"}", clientOut);

        assertThat(received.get(5, TimeUnit.SECONDS)).endsWith("\r\n\r\n{\"a\":\"b12\"}");
        assertThat(result.requestBodyBytes()).isEqualTo(11);
        assertThat(result.statusCode()).isEqualTo(201);
    }

    @Test
    void forward_relaysChunkedResponseVerbatim() throws Exception {
        String response = "HTTP/1.1 200 OK\r\nTransfer-Encoding: chunked\r\n\r\n"
                + "5\r\nhello\r\n6;ext=1\r\n world\r\n0\r\nX-Trailer: t\r\n\r\n";
        startUpstream(reply(response));
        ByteArrayOutputStream clientOut = new ByteArrayOutputStream();

        ForwardResult result = forward("GET http://example.com/ HTTP/1.1\r\n\r\n", clientOut);

        assertThat(clientOut.toString(StandardCharsets.ISO_8859_1)).isEqualTo(response);
        assertThat(result.bytesToClient()).isEqualTo(response.length());
    }

    @Test
    void forward_relaysBareLfChunkFramingVerbatim() throws Exception {
        String response = "HTTP/1.1 200 OK\r\nTransfer-Encoding: chunked\r\n\r\n5\nhello\n0\n\n";
        startUpstream(reply(response));
        ByteArrayOutputStream clientOut = new ByteArrayOutputStream();

        ForwardResult result = forward("GET http://example.com/ HTTP/1.1\r\n\r\n", clientOut);

        assertThat(clientOut.toString(StandardCharsets.ISO_8859_1)).isEqualTo(response);
        assertThat(result.bytesToClient()).isEqualTo(response.length());
    }

    @Test
    void forward_countsChunkedRequestBodyAsSentOnTheWire() throws Exception {
        startUpstream(reply("HTTP/1.1 200 OK\r\nContent-Length: 0\r\n\r\n"));
        String body = "5\r\nhello\r\n0\r\n\r\n";
        ByteArrayOutputStream clientOut = new ByteArrayOutputStream();

        ForwardResult result = forward("POST http://example.com/upload HTTP/1.1\r\n"
                + "Transfer-Encoding: chunked\r\n\r\n" + body, clientOut);

        assertThat(received.get(5, TimeUnit.SECONDS)).endsWith("\r\n\r\n" + body);
        assertThat(result.requestBodyBytes()).isEqualTo(body.length());
        assertThat(result.statusCode()).isEqualTo(200);
    }

    @Test
    void forward_readsUnframedBodyUntilClose() throws Exception {
        String response = "HTTP/1.0 200 OK\r\n\r\nstreamed until close";
        startUpstream(reply(response));
        ByteArrayOutputStream clientOut = new ByteArrayOutputStream();

        forward("GET http://example.com/ HTTP/1.0\r\n\r\n", clientOut);

        assertThat(clientOut.toString(StandardCharsets.ISO_8859_1)).isEqualTo(response);
    }

    @Test
    void forward_relaysInterimResponsesBeforeFinal() throws Exception {
        String response = "HTTP/1.1 100 Continue\r\n\r\nHTTP/1.1 200 OK\r\nContent-Length: 2\r\n\r\nok";
        startUpstream(reply(response));
        ByteArrayOutputStream clientOut = new ByteArrayOutputStream();

        ForwardResult result = forward("GET http://example.com/ HTTP/1.1\r\n\r\n", clientOut);

        assertThat(result.statusCode()).isEqualTo(200);
        assertThat(clientOut.toString(StandardCharsets.ISO_8859_1)).isEqualTo(response);
    }

    @Test
    void forward_headResponseHasNoBody() throws Exception {
        startUpstream(out -> {
            out.write("HTTP/1.1 200 OK\r\nContent-Length: 1000\r\n\r\n".getBytes(StandardCharsets.US_ASCII));
            out.flush();
            // keep the connection open; a body read would time out
            Thread.sleep(3000);
        });
        ByteArrayOutputStream clientOut = new ByteArrayOutputStream();

        ForwardResult result = forward("HEAD http://example.com/ HTTP/1.1\r\n\r\n", clientOut);

        assertThat(result.statusCode()).isEqualTo(200);
        assertThat(result.bytesToClient()).isEqualTo(clientOut.size());
    }

    @Test
    void forward_upstreamClosesWithoutResponse() throws Exception {
        startUpstream(out -> {
        });

        UpstreamException e = catchThrowableOfType(
                () -> forward("GET http://example.com/ HTTP/1.1\r\n\r\n", new ByteArrayOutputStream()),
                UpstreamException.class);

        assertThat(e.getFailure()).isEqualTo(Failure.UPSTREAM_CLOSED);
        assertThat(e.isResponseCommitted()).isFalse();
    }

    @Test
    void forward_invalidStatusLineIsInvalidResponse() throws Exception {
        startUpstream(reply("SSH-2.0-OpenSSH_9.0\r\n\r\n"));

        UpstreamException e = catchThrowableOfType(
                () -> forward("GET http://example.com/ HTTP/1.1\r\n\r\n", new ByteArrayOutputStream()),
                UpstreamException.class);

        assertThat(e.getFailure()).isEqualTo(Failure.INVALID_RESPONSE);
        assertThat(e.isResponseCommitted()).isFalse();
    }

    @Test
    void forward_silentUpstreamTimesOut() throws Exception {
        startUpstream(out -> Thread.sleep(3000));
        upstream.setSoTimeout(200);

        UpstreamException e = catchThrowableOfType(
                () -> forward("GET http://example.com/ HTTP/1.1\r\n\r\n", new ByteArrayOutputStream()),
                UpstreamException.class);

        assertThat(e.getFailure()).isEqualTo(Failure.UPSTREAM_TIMEOUT);
    }

    @Test
    void forward_truncatedBodyReportsRelayedStatus() throws Exception {
        startUpstream(reply("HTTP/1.1 200 OK\r\nContent-Length: 100\r\n\r\nonly part"));
        ByteArrayOutputStream clientOut = new ByteArrayOutputStream();

        UpstreamException e = catchThrowableOfType(
                () -> forward("GET http://example.com/ HTTP/1.1\r\n\r\n", clientOut),
                UpstreamException.class);

        assertThat(e.getFailure()).isEqualTo(Failure.UPSTREAM_CLOSED);
        assertThat(e.isResponseCommitted()).isTrue();
        assertThat(e.getRelayedStatusLine()).isEqualTo("HTTP/1.1 200 OK");
        assertThat(clientOut.toString(StandardCharsets.ISO_8859_1)).startsWith("HTTP/1.1 200 OK\r\n");
    }

    @Test
    void copyChunked_countsWireBytes() throws Exception {
        String body = "4\r\nWiki\r\n5\r\npedia\r\n0\r\n\r\n";
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        long copied = HttpForwarder.copyChunked(
                new ByteArrayInputStream(body.getBytes(StandardCharsets.US_ASCII)), out);

        assertThat(copied).isEqualTo(body.length());
        assertThat(out.toString(StandardCharsets.US_ASCII)).isEqualTo(body);
    }

    @Test
    void copyChunked_rejectsBadSize() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        assertThat(catchThrowableOfType(() -> HttpForwarder.copyChunked(
                new ByteArrayInputStream("zz\r\n".getBytes(StandardCharsets.US_ASCII)), out), IOException.class))
                .hasMessageContaining("Invalid chunk size");
    }
}
