package com.questrail.realm.engine.transport;

import java.net.SocketAddress;

/**
 * LineEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link LineEndpoint}.
 *
 * <p>Callbacks for one connection are delivered in order. Callbacks for
 * different connections may arrive concurrently.</p>
 */
public interface LineEndpointListener
{
    /**
     * The endpoint is bound and accepting connections.
     */
    void onTransportUp();

    /**
     * The endpoint stopped accepting connections.
     *
     * @param cause failure cause; {@code null} for orderly shutdown
     */
    void onTransportDown(Throwable cause);

    void onConnectionOpened(String connectionId, SocketAddress remote);

    /**
     * One complete line, without its terminator.
     */
    void onLine(String connectionId, String line);

    void onConnectionClosed(String connectionId);
}
