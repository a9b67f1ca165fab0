package com.tablecast.core.metrics;

/**
 * Micrometer metric names used by the hub.
 * <p>
 * <b>Naming convention:</b> {@code hub.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Gauge: live WebSocket connections in the registry.
     */
    public static final String CONNECTIONS_ACTIVE = "hub.connections.active";

    /**
     * Gauge: non-empty topic groups.
     * <p>
     * Tags: namespace
     * </p>
     */
    public static final String GROUPS_ACTIVE = "hub.groups.active";

    /**
     * Counter: broadcast calls.
     * <p>
     * Tags: namespace ("all" for untargeted broadcasts)
     * </p>
     */
    public static final String BROADCASTS_TOTAL = "hub.dispatch.broadcasts.total";

    /**
     * Counter: messages handed to an open connection.
     */
    public static final String DELIVERIES_TOTAL = "hub.dispatch.deliveries.total";

    /**
     * Counter: messages not handed to a member.
     * <p>
     * Tags: reason (stale/overflow)
     * </p>
     */
    public static final String SKIPPED_TOTAL = "hub.dispatch.skipped.total";

    /**
     * Counter: inbound client messages dropped as malformed.
     */
    public static final String MALFORMED_TOTAL = "hub.ws.malformed.total";

    /**
     * Counter: HTTP trigger calls.
     * <p>
     * Tags: type (whatsapp/kds/broadcast), outcome (ok/invalid)
     * </p>
     */
    public static final String TRIGGERS_TOTAL = "hub.http.triggers.total";

    /**
     * Counter: order change notifications fanned out to a branch.
     */
    public static final String ORDER_CHANGES_TOTAL = "hub.feed.order.changes.total";

    /**
     * Counter: POS revision changes detected.
     */
    public static final String POLL_CHANGES_TOTAL = "hub.poll.changes.total";

    /**
     * Counter: POS fetches that failed or timed out.
     */
    public static final String POLL_FAILURES_TOTAL = "hub.poll.failures.total";

    /**
     * Counter: snapshot lookups against the order store that failed.
     */
    public static final String LOOKUP_FAILURES_TOTAL = "hub.membership.lookup.failures.total";

    /**
     * Counter: bytes received from WebSocket clients.
     */
    public static final String NETWORK_INBOUND_WS_BYTES = "hub.ws.network.inbound.bytes";

    /**
     * Counter: bytes sent to WebSocket clients.
     */
    public static final String NETWORK_OUTBOUND_WS_BYTES = "hub.ws.network.outbound.bytes";
}
