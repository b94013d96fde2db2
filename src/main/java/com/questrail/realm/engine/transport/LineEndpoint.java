package com.questrail.realm.engine.transport;

/**
 * LineEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for a connection-oriented, newline-delimited text transport.
 *
 * <p>Implementations may be backed by Netty, java.nio, or a test harness.</p>
 */
public interface LineEndpoint
{
    /**
     * Start accepting connections.
     *
     * <p>On successful activation the endpoint MUST notify its listener via
     * {@link LineEndpointListener#onTransportUp()}.</p>
     */
    void start();

    /**
     * Close every connection and release all transport resources.
     */
    void stop();

    /**
     * Send one line to a connection. The endpoint appends the line terminator.
     * Unknown or closed connections are ignored.
     */
    void send(String connectionId, String line);

    /**
     * Close one connection. The listener is told through
     * {@link LineEndpointListener#onConnectionClosed(String)}.
     */
    void close(String connectionId);

    /**
     * Register the listener that receives lines and lifecycle events.
     *
     * <p>This must be called before {@link #start()}.</p>
     */
    void setListener(LineEndpointListener listener);
}
