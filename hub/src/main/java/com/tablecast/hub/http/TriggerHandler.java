package com.tablecast.hub.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.tablecast.core.msg.MessageTypes;
import com.tablecast.core.msg.OutboundMessages;
import com.tablecast.core.topic.Namespace;
import com.tablecast.core.topic.TopicKey;
import com.tablecast.core.util.JsonUtils;
import com.tablecast.hub.bridge.ChangeEventBridge;
import com.tablecast.hub.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates HTTP push triggers and hands them to the change event bridge.
 * <p>
 * A trigger either passes validation and broadcasts, or is rejected with 400 and
 * broadcasts nothing. Triggers to topics without members still succeed.
 * </p>
 */
public class TriggerHandler {
    private static final Logger log = LoggerFactory.getLogger(TriggerHandler.class);

    private final ChangeEventBridge bridge;
    private final MetricsService metricsService;

    public TriggerHandler(ChangeEventBridge bridge, MetricsService metricsService) {
        this.bridge = bridge;
        this.metricsService = metricsService;
    }

    /**
     * {@code POST /notify-whatsapp}: a new WhatsApp message arrived; every connection reloads its inbox.
     */
    public TriggerResponse notifyWhatsapp() {
        int delivered = bridge.onPushTriggerAll(OutboundMessages.signal(MessageTypes.WHATSAPP_NEW_MESSAGE));
        metricsService.recordTrigger("whatsapp", "ok");
        return TriggerResponse.ok(delivered);
    }

    /**
     * {@code POST /notify-kds {branch}}: kitchen screens of the branch reload their orders.
     */
    public TriggerResponse notifyKds(String body) {
        JsonNode json = parseBody(body);
        if (json == null) {
            return reject("kds", "Invalid JSON body");
        }
        String branch = JsonUtils.textField(json, "branch");
        if (branch == null) {
            return reject("kds", "branch is required");
        }
        int delivered = bridge.onPushTrigger(TopicKey.branch(branch),
            OutboundMessages.signal(MessageTypes.RELOAD_ORDERS));
        metricsService.recordTrigger("kds", "ok");
        return TriggerResponse.ok(delivered);
    }

    /**
     * {@code POST /broadcast {mesaKey, type}}: sends {@code {type}} to a mesa group.
     */
    public TriggerResponse broadcast(String body) {
        JsonNode json = parseBody(body);
        if (json == null) {
            return reject("broadcast", "Invalid JSON body");
        }
        String mesaKey = JsonUtils.textField(json, "mesaKey");
        String type = JsonUtils.textField(json, "type");
        if (mesaKey == null || type == null) {
            return reject("broadcast", "mesaKey and type are required");
        }
        int delivered = bridge.onPushTrigger(TopicKey.of(Namespace.MESA, mesaKey), OutboundMessages.signal(type));
        metricsService.recordTrigger("broadcast", "ok");
        return TriggerResponse.ok(delivered);
    }

    private TriggerResponse reject(String trigger, String error) {
        metricsService.recordTrigger(trigger, "invalid");
        log.warn("Rejected {} trigger: {}", trigger, error);
        return TriggerResponse.badRequest(error);
    }

    /**
     * @return the parsed body; an empty node for an empty body; null if the body is not JSON
     */
    private static JsonNode parseBody(String body) {
        if (body == null || body.isBlank()) {
            return JsonUtils.mapper().createObjectNode();
        }
        try {
            return JsonUtils.readTree(body);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
