package com.tablecast.core.msg;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.tablecast.core.util.JsonUtils;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Message sent by a client over the WebSocket.
 * <p>
 * Only {@code type} is always required; the remaining fields are required
 * depending on the type (see {@link MessageTypes}). Unknown fields are ignored.
 * </p>
 */
@Getter
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class InboundMessage {
    /**
     * Message discriminator.
     */
    private String type;

    private String trackingId;

    private String branch;

    /**
     * Venue slug, first half of a mesa key.
     */
    private String slug;

    private String mesaId;

    private Double lat;

    private Double lng;

    /**
     * Parses a raw WebSocket frame.
     *
     * @param json frame text
     * @return parsed message with a non-blank type
     * @throws MalformedMessageException if the frame is not a JSON object or has no type
     */
    public static InboundMessage parse(String json) {
        InboundMessage message;
        try {
            message = JsonUtils.mapper().readValue(json, InboundMessage.class);
        } catch (Exception e) {
            throw new MalformedMessageException("Unparseable message: " + e.getMessage(), e);
        }
        if (message == null || isBlank(message.type)) {
            throw new MalformedMessageException("Message has no type");
        }
        return message;
    }

    public String requireTrackingId() {
        return require("trackingId", trackingId);
    }

    public String requireBranch() {
        return require("branch", branch);
    }

    public String requireSlug() {
        return require("slug", slug);
    }

    public String requireMesaId() {
        return require("mesaId", mesaId);
    }

    public double requireLat() {
        return require("lat", lat);
    }

    public double requireLng() {
        return require("lng", lng);
    }

    private String require(String field, String value) {
        if (isBlank(value)) {
            throw new MalformedMessageException("'" + type + "' message requires " + field);
        }
        return value;
    }

    private double require(String field, Double value) {
        if (value == null || value.isNaN()) {
            throw new MalformedMessageException("'" + type + "' message requires numeric " + field);
        }
        return value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
