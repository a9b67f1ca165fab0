package com.tablecast.hub.http;

import com.tablecast.core.topic.Namespace;
import com.tablecast.core.util.JsonUtils;
import com.tablecast.hub.config.HubConfig;
import com.tablecast.hub.connection.ConnectionRegistry;
import com.tablecast.hub.topic.TopicGroupIndex;
import com.tablecast.hub.ws.WebSocketHandler;
import com.tablecast.hub.ws.WebSocketUpgradeHandler;
import io.netty.channel.ChannelOption;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServerResponse;
import reactor.netty.http.server.HttpServerRoutes;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * HTTP server for health checks, metrics, push triggers and WebSocket upgrades.
 */
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final HubConfig config;
    private final WebSocketHandler wsHandler;
    private final TriggerHandler triggerHandler;
    private final ConnectionRegistry registry;
    private final TopicGroupIndex index;
    private final Supplier<String> metricsScrape;
    private final AtomicBoolean accepting = new AtomicBoolean(true);
    private DisposableServer server;

    public HttpServer(
        HubConfig config,
        WebSocketHandler wsHandler,
        TriggerHandler triggerHandler,
        ConnectionRegistry registry,
        TopicGroupIndex index,
        Supplier<String> metricsScrape
    ) {
        this.config = config;
        this.wsHandler = wsHandler;
        this.triggerHandler = triggerHandler;
        this.registry = registry;
        this.index = index;
        this.metricsScrape = metricsScrape;
    }

    /**
     * Starts the HTTP server.
     *
     * @return the bound server
     */
    public DisposableServer start() {
        server = reactor.netty.http.server.HttpServer.create()
            .port(config.getHttpPort())
            .option(ChannelOption.SO_REUSEADDR, true)
            .metrics(true, Function.identity())
            .route(this::configureRoutes)
            .bind()
            .doOnNext(s -> log.info("HTTP server started on port {}", s.port()))
            .doOnError(err -> log.error("Failed to start HTTP server", err))
            .block(Duration.ofSeconds(45));

        return server;
    }

    /**
     * Stops accepting WebSocket upgrades and reports not-ready.
     */
    public void stopAccepting() {
        accepting.set(false);
    }

    public void stop() {
        accepting.set(false);
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(20));
        }
    }

    private void configureRoutes(HttpServerRoutes routes) {
        WebSocketUpgradeHandler upgradeHandler = new WebSocketUpgradeHandler(wsHandler, accepting::get);

        routes
            // Liveness
            .get("/healthz", (req, res) -> res.status(200).sendString(Mono.just("OK")))
            // Readiness - fails once shutdown begins
            .get("/readyz", (req, res) -> {
                if (!accepting.get()) {
                    return res.status(503).sendString(Mono.just("Not Ready - Shutting down"));
                }
                return res.status(200).sendString(Mono.just("Ready"));
            })
            // Metrics endpoint with Prometheus scraping
            .get("/metrics", (req, res) ->
                res.header(HttpHeaderNames.CONTENT_TYPE, "text/plain; version=0.0.4; charset=utf-8")
                    .sendString(Mono.fromSupplier(metricsScrape))
            )
            .get("/stats", (req, res) -> sendJson(res, 200, stats()))
            // Push triggers
            .post("/notify-whatsapp", (req, res) ->
                req.receive().then(Mono.defer(() -> respond(res, triggerHandler.notifyWhatsapp())))
            )
            .post("/notify-kds", (req, res) ->
                req.receive().aggregate().asString().defaultIfEmpty("")
                    .flatMap(body -> respond(res, triggerHandler.notifyKds(body)))
            )
            .post("/broadcast", (req, res) ->
                req.receive().aggregate().asString().defaultIfEmpty("")
                    .flatMap(body -> respond(res, triggerHandler.broadcast(body)))
            )
            // WebSocket upgrade, at the root for existing clients and at /ws
            .get("/ws", upgradeHandler::handle)
            .get("/", upgradeHandler::handle);
    }

    private Map<String, Object> stats() {
        Map<String, Object> groups = new LinkedHashMap<>();
        for (Namespace namespace : Namespace.values()) {
            groups.put(namespace.wireName(), index.groupCount(namespace));
        }
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("nodeId", config.getNodeId());
        stats.put("connections", registry.size());
        stats.put("groups", groups);
        return stats;
    }

    private Mono<Void> respond(HttpServerResponse res, TriggerResponse response) {
        return sendJson(res, response.status(), response.body());
    }

    private Mono<Void> sendJson(HttpServerResponse res, int status, Object body) {
        return Mono.fromCallable(() -> JsonUtils.writeValueAsString(body))
            .flatMap(json -> res.status(status)
                .header(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_JSON)
                .sendString(Mono.just(json))
                .then())
            .onErrorResume(err -> {
                log.error("Failed to write HTTP response", err);
                return res.status(500).sendString(Mono.just("{\"error\":\"Internal error\"}")).then();
            });
    }
}
