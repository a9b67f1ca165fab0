package com.tablecast.hub.ws;

import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;

import java.util.Collection;
import java.util.UUID;
import java.util.function.BooleanSupplier;
import java.util.stream.Stream;

/**
 * Handles WebSocket upgrade requests.
 * <p>
 * Connections carry no identity of their own; an optional {@code connectionId} query
 * parameter is used for log correlation only, otherwise a random id is assigned.
 * </p>
 */
public class WebSocketUpgradeHandler {
    private static final Logger log = LoggerFactory.getLogger(WebSocketUpgradeHandler.class);

    private final WebSocketHandler wsHandler;
    private final BooleanSupplier accepting;

    public WebSocketUpgradeHandler(WebSocketHandler wsHandler, BooleanSupplier accepting) {
        this.wsHandler = wsHandler;
        this.accepting = accepting;
    }

    /**
     * Handles WebSocket upgrade request.
     *
     * @param req HTTP request
     * @param res HTTP response
     * @return Mono for upgrade
     */
    public Mono<Void> handle(HttpServerRequest req, HttpServerResponse res) {
        // Reject new connections once shutdown has begun
        if (!accepting.getAsBoolean()) {
            log.warn("Rejecting new WebSocket connection - hub is shutting down");
            return res.status(HttpResponseStatus.SERVICE_UNAVAILABLE)
                .sendString(Mono.just("Service unavailable - shutting down"))
                .then();
        }

        QueryStringDecoder decoder = new QueryStringDecoder(req.uri());
        String connectionId = Stream.ofNullable(decoder.parameters().get("connectionId"))
            .flatMap(Collection::stream).findFirst()
            .map(id -> id + "-" + UUID.randomUUID().toString().substring(0, 8))
            .orElseGet(() -> UUID.randomUUID().toString());

        return res.sendWebsocket((inbound, outbound) -> wsHandler.handle(inbound, outbound, connectionId));
    }
}
