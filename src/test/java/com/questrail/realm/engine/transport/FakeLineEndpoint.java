package com.questrail.realm.engine.transport;

import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * FakeLineEndpoint
 * -----------------------------------------------------------------------------
 * Test-only {@link LineEndpoint} implementation.
 *
 * <p>Stores outbound lines per connection and lets tests open connections and
 * inject inbound lines.</p>
 */
public final class FakeLineEndpoint implements LineEndpoint {

    public record Sent(String connectionId, String line) {}

    private LineEndpointListener listener;
    private final List<Sent> sent = new ArrayList<>();
    private final Set<String> open = new LinkedHashSet<>();

    @Override
    public void setListener(LineEndpointListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start() {
        if (listener != null) {
            listener.onTransportUp();
        }
    }

    @Override
    public void stop() {
        if (listener != null) {
            listener.onTransportDown(null);
        }
    }

    @Override
    public synchronized void send(String connectionId, String line) {
        Objects.requireNonNull(connectionId, "connectionId");
        Objects.requireNonNull(line, "line");
        if (open.contains(connectionId)) {
            sent.add(new Sent(connectionId, line));
        }
    }

    @Override
    public void close(String connectionId) {
        boolean wasOpen;
        synchronized (this) {
            wasOpen = open.remove(connectionId);
        }
        if (wasOpen) {
            listener.onConnectionClosed(connectionId);
        }
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public void open(String connectionId) {
        synchronized (this) {
            open.add(connectionId);
        }
        requireListener().onConnectionOpened(connectionId, new InetSocketAddress("127.0.0.1", 40000));
    }

    public void injectLine(String connectionId, String line) {
        requireListener().onLine(connectionId, line);
    }

    public synchronized boolean isOpen(String connectionId) {
        return open.contains(connectionId);
    }

    public synchronized List<String> linesFor(String connectionId) {
        return sent.stream()
            .filter(s -> s.connectionId().equals(connectionId))
            .map(Sent::line)
            .collect(Collectors.toList());
    }

    public synchronized List<Sent> sent() {
        return Collections.unmodifiableList(new ArrayList<>(sent));
    }

    public synchronized void clear() {
        sent.clear();
    }

    private LineEndpointListener requireListener() {
        if (listener == null) {
            throw new IllegalStateException("No listener installed");
        }
        return listener;
    }
}
