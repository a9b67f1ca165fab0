package com.tablecast.hub.membership;

import com.tablecast.core.topic.TopicKey;
import com.tablecast.hub.connection.HubConnection;
import reactor.core.publisher.Mono;

/**
 * Interface for connection membership lifecycle (Dependency Inversion Principle).
 * <p>
 * The only writer of the connection registry and the topic group index.
 * </p>
 */
public interface IMembershipManager {
    /**
     * Admits a freshly accepted connection.
     *
     * @param connection new connection
     */
    void onOpen(HubConnection connection);

    /**
     * Moves a connection to a key within the key's namespace, leaving the key it held there before.
     * <p>
     * The index is updated before this method returns; the returned Mono covers
     * follow-up work such as the tracking snapshot.
     * </p>
     *
     * @param connection joining connection
     * @param key        topic to join
     * @return Mono completing when follow-up work is done; never errors
     */
    Mono<Void> onJoin(HubConnection connection, TopicKey key);

    /**
     * Removes a connection from every group it joined and from the registry.
     * Effective once per connection; later calls are no-ops.
     *
     * @param connection closing connection
     */
    void onClose(HubConnection connection);

    /**
     * Closes every live connection (graceful shutdown).
     *
     * @return number of connections closed
     */
    int closeAll();
}
