package com.warden.proxy.core.proxy;

import com.warden.proxy.config.ProxyServerConfig;

/**
 * Interface representing a proxy server instance.
 */
public interface ProxyServer {
    /**
     * Binds the listener and runs the accept loop on the calling thread until
     * {@link #stop()} is called.
     */
    void start();

    /**
     * Stops the proxy server and releases all associated resources.
     */
    void stop();

    /**
     * Retrieves the proxy server configuration.
     * @return The configuration used by this proxy server.
     */
    ProxyServerConfig getConfig();

    /**
     * @return The port the listener is bound to, or -1 before binding.
     */
    int getLocalPort();
}
