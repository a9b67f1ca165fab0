package com.tablecast.hub.http;

import java.util.Map;

/**
 * Status code and JSON body for an HTTP trigger call.
 *
 * @param status HTTP status code
 * @param body   object serialized as the JSON response body
 */
public record TriggerResponse(int status, Map<String, Object> body) {

    public static TriggerResponse ok(int delivered) {
        return new TriggerResponse(200, Map.of("ok", true, "delivered", delivered));
    }

    public static TriggerResponse badRequest(String error) {
        return new TriggerResponse(400, Map.of("error", error));
    }

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }
}
