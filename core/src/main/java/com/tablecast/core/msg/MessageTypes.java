package com.tablecast.core.msg;

/**
 * Values of the {@code type} discriminator used on the WebSocket protocol.
 */
public final class MessageTypes {
    private MessageTypes() {
    }

    // client -> hub

    /**
     * Follow an order: {@code {type, trackingId}}.
     */
    public static final String JOIN = "join";

    /**
     * Kitchen display joins its branch: {@code {type, branch}}.
     */
    public static final String JOIN_BRANCH = "join-branch";

    /**
     * Table screen joins its mesa: {@code {type, slug, mesaId}}.
     */
    public static final String JOIN_MESA = "join-mesa";

    /**
     * Rider position relayed to everyone following the order: {@code {type, trackingId, lat, lng}}.
     */
    public static final String LOCATION = "location";

    public static final String PING = "ping";

    // hub -> client

    public static final String STATUS = "status";
    public static final String UPDATE = "update";
    public static final String ORDER_UPDATED = "order-updated";
    public static final String RELOAD_ORDERS = "reload-orders";
    public static final String VENTA_ACTUALIZADA = "venta-actualizada";
    public static final String WHATSAPP_NEW_MESSAGE = "whatsapp-new-message";
}
