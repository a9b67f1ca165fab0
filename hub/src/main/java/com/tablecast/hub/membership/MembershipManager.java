package com.tablecast.hub.membership;

import com.tablecast.core.msg.OutboundMessages;
import com.tablecast.core.topic.Namespace;
import com.tablecast.core.topic.TopicKey;
import com.tablecast.hub.connection.ConnectionRegistry;
import com.tablecast.hub.connection.HubConnection;
import com.tablecast.hub.dispatch.FanoutDispatcher;
import com.tablecast.hub.metrics.MetricsService;
import com.tablecast.hub.redis.IOrderStore;
import com.tablecast.hub.topic.TopicGroupIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;

/**
 * Keeps the connection registry and topic group index consistent with connection lifecycles.
 * <p>
 * Each connection carries its own namespace → key record, so closing a connection
 * leaves exactly the groups it is in. A join that races with close is undone by the
 * join itself once it sees the connection closed.
 * </p>
 */
public class MembershipManager implements IMembershipManager {
    private static final Logger log = LoggerFactory.getLogger(MembershipManager.class);

    private static final Duration LOOKUP_TIMEOUT = Duration.ofSeconds(5);

    private final TopicGroupIndex index;
    private final ConnectionRegistry registry;
    private final FanoutDispatcher dispatcher;
    private final IOrderStore orderStore;
    private final MetricsService metricsService;

    public MembershipManager(TopicGroupIndex index,
                             ConnectionRegistry registry,
                             FanoutDispatcher dispatcher,
                             IOrderStore orderStore,
                             MetricsService metricsService) {
        this.index = index;
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.orderStore = orderStore;
        this.metricsService = metricsService;
    }

    @Override
    public void onOpen(HubConnection connection) {
        registry.admit(connection);
        log.debug("Connection {} admitted ({} live)", connection.getId(), registry.size());
    }

    @Override
    public Mono<Void> onJoin(HubConnection connection, TopicKey key) {
        boolean changed = applyJoin(connection, key);
        if (!changed || key.namespace() != Namespace.TRACKING) {
            return Mono.empty();
        }
        return sendTrackingSnapshot(connection, key.key());
    }

    /**
     * Mutates the index synchronously.
     *
     * @return true if the connection moved to a new key
     */
    private boolean applyJoin(HubConnection connection, TopicKey key) {
        if (!connection.isOpen()) {
            log.debug("Ignoring join {} from closed connection {}", key, connection.getId());
            return false;
        }

        String previous = connection.recordMembership(key.namespace(), key.key());
        if (previous != null && !previous.equals(key.key())) {
            index.leave(key.namespace(), previous, connection);
            log.debug("Connection {} left {}:{}", connection.getId(), key.namespace().wireName(), previous);
        }
        index.join(key, connection);

        // close may have drained the membership record before we wrote to the index
        if (!connection.isOpen()) {
            index.leave(key, connection);
            return false;
        }

        if (key.key().equals(previous)) {
            return false;
        }
        log.debug("Connection {} joined {}", connection.getId(), key);
        return true;
    }

    private Mono<Void> sendTrackingSnapshot(HubConnection connection, String trackingId) {
        return orderStore.findByTrackingId(trackingId)
            .timeout(LOOKUP_TIMEOUT)
            .doOnNext(order -> {
                boolean sent = dispatcher.unicast(connection, OutboundMessages.status(order.getStatusOrDefault()));
                log.debug("Snapshot for tracking {} to connection {}: status={}, sent={}",
                    trackingId, connection.getId(), order.getStatusOrDefault(), sent);
            })
            .switchIfEmpty(Mono.fromRunnable(() ->
                log.debug("No order found for tracking {}, no snapshot sent", trackingId)))
            .onErrorResume(err -> {
                metricsService.recordLookupFailure();
                log.warn("Order lookup failed for tracking {} (connection {}): {}",
                    trackingId, connection.getId(), err.toString());
                return Mono.empty();
            })
            .then();
    }

    @Override
    public void onClose(HubConnection connection) {
        if (!connection.markClosed()) {
            return;
        }
        Map<Namespace, String> memberships = connection.drainMemberships();
        memberships.forEach((namespace, key) -> index.leave(namespace, key, connection));
        registry.remove(connection);
        log.debug("Connection {} closed, left {} group(s), {} live", connection.getId(),
            memberships.size(), registry.size());
    }

    @Override
    public int closeAll() {
        int closed = 0;
        for (HubConnection connection : registry.snapshot()) {
            onClose(connection);
            closed++;
        }
        log.info("Closed {} connection(s)", closed);
        return closed;
    }
}
