package com.tablecast.hub.connection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Every live connection, independent of topic membership.
 * <p>
 * Backs untargeted broadcasts and shutdown. Mutated only by the membership
 * lifecycle manager.
 * </p>
 */
public class ConnectionRegistry {
    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    // connectionId -> connection
    private final Map<String, HubConnection> connections = new ConcurrentHashMap<>();

    public void admit(HubConnection connection) {
        HubConnection previous = connections.putIfAbsent(connection.getId(), connection);
        if (previous != null && previous != connection) {
            log.warn("Connection id {} already registered, keeping the existing connection", connection.getId());
        }
    }

    /**
     * Removes a connection. Safe to call repeatedly and for connections never admitted.
     */
    public void remove(HubConnection connection) {
        connections.remove(connection.getId(), connection);
    }

    public boolean contains(HubConnection connection) {
        return connections.get(connection.getId()) == connection;
    }

    public int size() {
        return connections.size();
    }

    /**
     * Copy of the live connections at call time.
     */
    public List<HubConnection> snapshot() {
        return List.copyOf(connections.values());
    }
}
