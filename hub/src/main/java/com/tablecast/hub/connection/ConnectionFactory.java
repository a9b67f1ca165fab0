package com.tablecast.hub.connection;

import com.tablecast.hub.config.HubConfig;
import reactor.core.publisher.Sinks;
import reactor.util.concurrent.Queues;

/**
 * Factory for creating HubConnection objects.
 * <p>
 * Separated from the lifecycle manager to isolate buffer sizing.
 * </p>
 */
public class ConnectionFactory {
    private final int perConnBufferSize;

    public ConnectionFactory(HubConfig config) {
        this(config.getPerConnBufferSize());
    }

    public ConnectionFactory(int perConnBufferSize) {
        this.perConnBufferSize = perConnBufferSize;
    }

    /**
     * Creates a connection with a bounded outbound buffer.
     *
     * @param connectionId connection identifier
     * @return HubConnection instance
     */
    public HubConnection create(String connectionId) {
        Sinks.Many<String> sink = Sinks.many().unicast().onBackpressureBuffer(
            Queues.<String>get(perConnBufferSize).get()
        );
        return new HubConnection(connectionId, sink);
    }

}
