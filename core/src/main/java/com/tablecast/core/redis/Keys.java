package com.tablecast.core.redis;

/**
 * Redis keyspace the ordering platform maintains and the hub reads.
 * <p>
 * The hub never writes these keys; they are projections kept current by the
 * ordering back end.
 * </p>
 */
public final class Keys {
    private Keys() {
    }

    /**
     * Order document by tracking id: {@code order:tracking:{trackingId}}
     * <p>
     * <b>Type:</b> String (JSON order document)
     * <br>
     * <b>Usage:</b> status snapshot sent to a client that starts tracking an order.
     * </p>
     *
     * @param trackingId public tracking identifier of the order
     * @return Redis key
     */
    public static String orderByTracking(String trackingId) {
        return "order:tracking:" + trackingId;
    }

}
