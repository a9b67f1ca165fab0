package com.tablecast.hub.connection;

import com.tablecast.core.topic.Namespace;
import lombok.Getter;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One client WebSocket as the hub sees it.
 * <p>
 * Owns the outbound frame sink and the membership record (namespace → current key)
 * that lets close-time cleanup leave every group without scanning the index.
 * Sends are serialized per connection, so frames arrive in the order they were sent.
 * </p>
 */
public class HubConnection {

    /**
     * Result of handing a frame to the connection.
     */
    public enum SendResult {
        SENT,
        /**
         * Connection already closed; expected while the close handler catches up.
         */
        STALE,
        /**
         * Outbound buffer full; the frame is dropped.
         */
        OVERFLOW
    }

    @Getter
    private final String id;
    private final Sinks.Many<String> sink;
    private final AtomicBoolean open = new AtomicBoolean(true);
    private final Map<Namespace, String> memberships = new EnumMap<>(Namespace.class);

    public HubConnection(String id, Sinks.Many<String> sink) {
        this.id = id;
        this.sink = sink;
    }

    public boolean isOpen() {
        return open.get();
    }

    /**
     * Frames to write to the socket, in send order. Single subscriber.
     */
    public Flux<String> outbound() {
        return sink.asFlux();
    }

    public SendResult send(String frame) {
        synchronized (sink) {
            if (!open.get()) {
                return SendResult.STALE;
            }
            Sinks.EmitResult result = sink.tryEmitNext(frame);
            if (result.isSuccess()) {
                return SendResult.SENT;
            }
            return result == Sinks.EmitResult.FAIL_OVERFLOW ? SendResult.OVERFLOW : SendResult.STALE;
        }
    }

    /**
     * Marks the connection closed and completes its outbound stream.
     *
     * @return true for the first caller only
     */
    public boolean markClosed() {
        if (!open.compareAndSet(true, false)) {
            return false;
        }
        synchronized (sink) {
            sink.tryEmitComplete();
        }
        return true;
    }

    /**
     * Records the key now held in a namespace.
     *
     * @return the key previously held in that namespace, or null
     */
    public String recordMembership(Namespace namespace, String key) {
        synchronized (memberships) {
            return memberships.put(namespace, key);
        }
    }

    public String currentKey(Namespace namespace) {
        synchronized (memberships) {
            return memberships.get(namespace);
        }
    }

    /**
     * Returns and clears the membership record in one step.
     */
    public Map<Namespace, String> drainMemberships() {
        synchronized (memberships) {
            Map<Namespace, String> copy = new EnumMap<>(Namespace.class);
            copy.putAll(memberships);
            memberships.clear();
            return copy;
        }
    }

    public Map<Namespace, String> memberships() {
        synchronized (memberships) {
            return memberships.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(memberships));
        }
    }

    @Override
    public String toString() {
        return "HubConnection[" + id + (isOpen() ? "" : ", closed") + "]";
    }
}
