package com.warden.proxy.core.proxy;

import java.io.IOException;
import java.net.ConnectException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.warden.proxy.core.exceptions.UpstreamException;
import com.warden.proxy.core.exceptions.UpstreamException.Failure;
import com.warden.proxy.core.utils.IoUtils;

/**
 * Opens TCP connections to destination servers.
 */
public class UpstreamConnector {

    private static final Logger log = LoggerFactory.getLogger(UpstreamConnector.class);

    /**
     * Resolves a host name to its addresses.
     */
    @FunctionalInterface
    public interface HostResolver {
        InetAddress[] resolve(String host) throws UnknownHostException;
    }

    private final int connectTimeout;
    private final int readTimeout;
    private final HostResolver resolver;

    public UpstreamConnector(int connectTimeout, int readTimeout) {
        this(connectTimeout, readTimeout, InetAddress::getAllByName);
    }

    /**
     * @param connectTimeout Connect timeout per address in milliseconds.
     * @param readTimeout    Read timeout set on the returned socket in
     *                       milliseconds.
     * @param resolver       Name resolver.
     */
    public UpstreamConnector(int connectTimeout, int readTimeout, HostResolver resolver) {
        this.connectTimeout = connectTimeout;
        this.readTimeout = readTimeout;
        this.resolver = resolver;
    }

    /**
     * Connects to a destination, trying each resolved address in order.
     *
     * @param host Target host name or IP literal.
     * @param port Target port.
     * @return Connected socket with TCP_NODELAY and the read timeout set.
     * @throws UpstreamException If the name does not resolve or no address
     *                           accepts the connection.
     */
    public Socket connect(String host, int port) {
        InetAddress[] addresses;
        try {
            addresses = resolver.resolve(host);
        } catch (UnknownHostException e) {
            throw new UpstreamException(Failure.DNS_FAILURE, "Cannot resolve " + host, e);
        }
        if (addresses == null || addresses.length == 0) {
            throw new UpstreamException(Failure.DNS_FAILURE, "No addresses for " + host);
        }

        IOException last = null;
        for (InetAddress address : addresses) {
            Socket socket = new Socket();
            try {
                socket.connect(new InetSocketAddress(address, port), connectTimeout);
                socket.setTcpNoDelay(true);
                socket.setSoTimeout(readTimeout);
                log.debug("Connected to {}:{} via {}", host, port, address.getHostAddress());
                return socket;
            } catch (IOException e) {
                IoUtils.closeQuietly(socket, "upstream socket");
                log.debug("Connect to {} ({}) port {} failed: {}", host, address.getHostAddress(), port,
                        e.getMessage());
                last = e;
            }
        }
        throw classify(host, port, last);
    }

    private static UpstreamException classify(String host, int port, IOException e) {
        String target = host + ":" + port;
        if (e instanceof SocketTimeoutException) {
            return new UpstreamException(Failure.CONNECT_TIMEOUT, "Connect to " + target + " timed out", e);
        }
        if (e instanceof ConnectException) {
            return new UpstreamException(Failure.CONNECTION_REFUSED, "Connection refused by " + target, e);
        }
        return new UpstreamException(Failure.UNREACHABLE, target + " unreachable: " + e.getMessage(), e);
    }

    public int getConnectTimeout() {
        return connectTimeout;
    }

    public int getReadTimeout() {
        return readTimeout;
    }
}
