package com.questrail.realm.engine.transport;

import com.questrail.realm.api.EntityId;
import com.questrail.realm.api.RealmEngine;
import com.questrail.realm.engine.internal.dispatch.DeliveryListener;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketAddress;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * LineTransportAdapter
 * =============================================================================
 * Translates between text connections and the {@link RealmEngine} boundary.
 *
 * <h2>Inbound path</h2>
 * <pre>
 *   LineEndpoint
 *        → first line names the participant     → RealmEngine.connect(...)
 *        → every later line                     → RealmEngine.enqueueCommand(...)
 *        → connection closed                    → RealmEngine.disconnect(...)
 * </pre>
 * A login the engine refuses (unknown name, or a name that is not a
 * participant) comes back through {@link #onConnectRefused}; the connection is
 * told why and asked again.
 *
 * <h2>Outbound path</h2>
 * <pre>
 *   engine flush → {@link #onDeliverable(EntityId)}
 *        → RealmEngine.drain(...)
 *            → LineEndpoint.send(...)
 * </pre>
 * {@code onDeliverable} runs on the engine loop and only hands lines to the
 * endpoint, whose sends are asynchronous.
 *
 * <h2>Explicit non-responsibilities</h2>
 * This class never reads or changes world state and never interprets command
 * text.
 */
public final class LineTransportAdapter implements LineEndpointListener, DeliveryListener
{
    private static final Logger log = LoggerFactory.getLogger(LineTransportAdapter.class);

    static final String GREETING = "Welcome to the realm. Who are you?";
    static final String ALREADY_CONNECTED = "That character is already connected.";
    static final String SHUTTING_DOWN = "The realm is shutting down.";

    private final RealmEngine engine;
    private final LineEndpoint endpoint;

    private final Map<String, EntityId> participantsByConnection = new ConcurrentHashMap<>();
    private final Map<EntityId, String> connectionsByParticipant = new ConcurrentHashMap<>();

    public LineTransportAdapter(RealmEngine engine, LineEndpoint endpoint) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.endpoint.setListener(this);
    }

    public void start() {
        endpoint.start();
    }

    public void stop() {
        endpoint.stop();
    }

    // -------------------------------------------------------------------------
    // LineEndpointListener
    // -------------------------------------------------------------------------

    @Override
    public void onTransportUp() {
        log.info("Line transport up");
    }

    @Override
    public void onTransportDown(Throwable cause) {
        if (cause != null) {
            log.warn("Line transport down", cause);
        }
        else {
            log.info("Line transport down");
        }
    }

    @Override
    public void onConnectionOpened(String connectionId, SocketAddress remote) {
        log.debug("Connection {} opened from {}", connectionId, remote);
        endpoint.send(connectionId, GREETING);
    }

    @Override
    public void onLine(String connectionId, String line) {
        Objects.requireNonNull(connectionId, "connectionId");
        if (line == null) {
            return;
        }
        EntityId participant = participantsByConnection.get(connectionId);
        if (participant == null) {
            login(connectionId, line.trim());
            return;
        }
        if (!engine.enqueueCommand(participant, line)) {
            endpoint.send(connectionId, SHUTTING_DOWN);
        }
    }

    @Override
    public void onConnectionClosed(String connectionId) {
        EntityId participant = participantsByConnection.remove(connectionId);
        if (participant == null) {
            return;
        }
        connectionsByParticipant.remove(participant, connectionId);
        engine.disconnect(participant);
        log.debug("Connection {} for {} closed", connectionId, participant);
    }

    // -------------------------------------------------------------------------
    // DeliveryListener
    // -------------------------------------------------------------------------

    @Override
    public void onDeliverable(EntityId participantId) {
        String connectionId = connectionsByParticipant.get(participantId);
        if (connectionId == null) {
            return;
        }
        for (RealmEngine.Delivery delivery : engine.drain(participantId)) {
            endpoint.send(connectionId, render(delivery));
        }
    }

    @Override
    public void onConnectRefused(EntityId participantId, String reason) {
        String connectionId = connectionsByParticipant.remove(participantId);
        if (connectionId == null) {
            return;
        }
        participantsByConnection.remove(connectionId, participantId);
        log.debug("Login as {} on connection {} refused", participantId, connectionId);
        endpoint.send(connectionId, reason);
        endpoint.send(connectionId, GREETING);
    }

    private void login(String connectionId, String name) {
        if (name.isEmpty()) {
            endpoint.send(connectionId, GREETING);
            return;
        }
        EntityId participant = EntityId.of(name);
        if (connectionsByParticipant.putIfAbsent(participant, connectionId) != null) {
            endpoint.send(connectionId, ALREADY_CONNECTED);
            endpoint.close(connectionId);
            return;
        }
        participantsByConnection.put(connectionId, participant);
        if (!engine.connect(participant)) {
            endpoint.send(connectionId, SHUTTING_DOWN);
        }
    }

    /**
     * Text kinds are sent as-is. Data-only kinds become a tagged key=value line.
     */
    static String render(RealmEngine.Delivery delivery) {
        if (!delivery.text().isEmpty()) {
            return delivery.text();
        }
        String fields = delivery.payload().entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(" "));
        return "[" + delivery.kind() + "] " + fields;
    }
}
