package com.tablecast.hub.redis;

import com.tablecast.core.model.OrderRecord;
import reactor.core.publisher.Mono;

/**
 * Point lookups against the order store (Dependency Inversion Principle).
 * <p>
 * Enables testing with stub implementations.
 * </p>
 */
public interface IOrderStore {
    /**
     * Finds the order a tracking id refers to.
     *
     * @param trackingId public tracking identifier
     * @return Mono of the order, empty when unknown
     */
    Mono<OrderRecord> findByTrackingId(String trackingId);

    /**
     * Releases the underlying connection.
     */
    void close();
}
