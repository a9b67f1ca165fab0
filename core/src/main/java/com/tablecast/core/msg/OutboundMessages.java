package com.tablecast.core.msg;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tablecast.core.model.OrderRecord;
import lombok.Value;

/**
 * Messages the hub pushes to clients.
 * <p>
 * Every message carries a {@code type} discriminator first; the payload fields
 * depend on the type.
 * </p>
 */
public final class OutboundMessages {
    private OutboundMessages() {
    }

    public static Status status(String status) {
        return new Status(MessageTypes.STATUS, status);
    }

    public static LocationUpdate location(double lat, double lng) {
        return new LocationUpdate(MessageTypes.UPDATE, lat, lng);
    }

    public static OrderUpdated orderUpdated(OrderRecord order) {
        return new OrderUpdated(MessageTypes.ORDER_UPDATED, order);
    }

    /**
     * Fixed-payload notification such as {@code reload-orders}; the client reacts by re-fetching.
     */
    public static Signal signal(String type) {
        return new Signal(type);
    }

    /**
     * Point-in-time order status, sent once to a connection that starts tracking an order.
     */
    @Value
    public static class Status {
        @JsonProperty("type")
        String type;

        @JsonProperty("status")
        String status;
    }

    /**
     * Rider position relay.
     */
    @Value
    public static class LocationUpdate {
        @JsonProperty("type")
        String type;

        @JsonProperty("lat")
        double lat;

        @JsonProperty("lng")
        double lng;
    }

    /**
     * Full order record, fanned out to the order's branch on every change.
     */
    @Value
    public static class OrderUpdated {
        @JsonProperty("type")
        String type;

        @JsonProperty("order")
        OrderRecord order;
    }

    @Value
    public static class Signal {
        @JsonProperty("type")
        String type;
    }
}
