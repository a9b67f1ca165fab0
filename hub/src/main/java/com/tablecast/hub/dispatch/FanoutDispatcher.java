package com.tablecast.hub.dispatch;

import com.tablecast.core.topic.TopicKey;
import com.tablecast.core.util.JsonUtils;
import com.tablecast.hub.connection.ConnectionRegistry;
import com.tablecast.hub.connection.HubConnection;
import com.tablecast.hub.metrics.MetricsService;
import com.tablecast.hub.topic.TopicGroupIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Set;

/**
 * Delivers one event to every open member of a topic group, or to every live connection.
 * <p>
 * The member set is snapshotted when the call starts: a connection joining
 * mid-broadcast may miss it. Delivery is at-most-once; closed members are skipped
 * silently because the close handler reaps them on its own.
 * </p>
 */
public class FanoutDispatcher {
    private static final Logger log = LoggerFactory.getLogger(FanoutDispatcher.class);

    private final TopicGroupIndex index;
    private final ConnectionRegistry registry;
    private final MetricsService metricsService;

    public FanoutDispatcher(TopicGroupIndex index, ConnectionRegistry registry, MetricsService metricsService) {
        this.index = index;
        this.registry = registry;
        this.metricsService = metricsService;
    }

    /**
     * Sends a payload to a topic group.
     *
     * @param key     topic to deliver to
     * @param payload message object, encoded once as JSON
     * @return number of members the frame was handed to
     */
    public int broadcast(TopicKey key, Object payload) {
        metricsService.recordBroadcast(key.namespace());
        Set<HubConnection> members = index.membersOf(key);
        if (members.isEmpty()) {
            log.debug("No members in {}, nothing to deliver", key);
            return 0;
        }
        int delivered = deliver(members, JsonUtils.writeValueAsString(payload));
        log.debug("Broadcast to {} delivered to {}/{} members", key, delivered, members.size());
        return delivered;
    }

    /**
     * Sends a payload to every live connection regardless of membership.
     *
     * @return number of connections the frame was handed to
     */
    public int broadcastAll(Object payload) {
        metricsService.recordBroadcastAll();
        Collection<HubConnection> connections = registry.snapshot();
        if (connections.isEmpty()) {
            return 0;
        }
        int delivered = deliver(connections, JsonUtils.writeValueAsString(payload));
        log.debug("Broadcast to all delivered to {}/{} connections", delivered, connections.size());
        return delivered;
    }

    /**
     * Sends a payload to one connection, outside any group.
     *
     * @return true if the frame was handed to the connection
     */
    public boolean unicast(HubConnection connection, Object payload) {
        return deliver(Set.of(connection), JsonUtils.writeValueAsString(payload)) == 1;
    }

    private int deliver(Collection<HubConnection> targets, String frame) {
        int delivered = 0;
        for (HubConnection connection : targets) {
            switch (connection.send(frame)) {
                case SENT -> delivered++;
                case STALE -> metricsService.recordSkippedStale();
                case OVERFLOW -> {
                    metricsService.recordSkippedOverflow();
                    log.debug("Outbound buffer full for connection {}, frame dropped", connection.getId());
                }
            }
        }
        metricsService.recordDeliveries(delivered);
        return delivered;
    }
}
