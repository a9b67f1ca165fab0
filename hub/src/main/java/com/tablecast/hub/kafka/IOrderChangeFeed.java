package com.tablecast.hub.kafka;

import com.tablecast.core.model.OrderChange;
import reactor.core.publisher.Flux;

/**
 * Live subscription over active orders (Dependency Inversion Principle).
 */
public interface IOrderChangeFeed {
    /**
     * Streams added/modified/removed notifications for orders in an active status.
     * <p>
     * Infinite; terminates only with an error, after which the caller may resubscribe.
     * </p>
     *
     * @return Flux of changes
     */
    Flux<OrderChange> changes();

    /**
     * Stops the underlying consumer.
     */
    void close();
}
