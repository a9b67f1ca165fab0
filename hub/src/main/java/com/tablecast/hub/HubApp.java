package com.tablecast.hub;

import com.tablecast.core.model.MesaRef;
import com.tablecast.hub.bridge.ChangeEventBridge;
import com.tablecast.hub.config.HubConfig;
import com.tablecast.hub.connection.ConnectionRegistry;
import com.tablecast.hub.dispatch.FanoutDispatcher;
import com.tablecast.hub.http.HttpServer;
import com.tablecast.hub.http.TriggerHandler;
import com.tablecast.hub.kafka.KafkaOrderChangeFeed;
import com.tablecast.hub.membership.MembershipManager;
import com.tablecast.hub.metrics.MetricsService;
import com.tablecast.hub.metrics.PrometheusMetricsExporter;
import com.tablecast.hub.poll.RevisionTracker;
import com.tablecast.hub.poll.VentaPoller;
import com.tablecast.hub.pos.PosClient;
import com.tablecast.hub.redis.RedisOrderStore;
import com.tablecast.hub.topic.TopicGroupIndex;
import com.tablecast.hub.ws.WebSocketHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.Disposable;

import java.util.function.Consumer;

/**
 * Main entry point for the hub.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Serve WebSockets at / and /ws; clients join tracking, branch and mesa topics</li>
 *   <li>Fan order changes from Kafka out to kitchen screens by branch</li>
 *   <li>Poll the POS for open sales and notify mesa screens on change (when configured)</li>
 *   <li>Accept push triggers: /notify-whatsapp, /notify-kds, /broadcast</li>
 *   <li>Expose /healthz, /readyz, /metrics and /stats</li>
 * </ul>
 * </p>
 */
public class HubApp {
    private static final Logger log = LoggerFactory.getLogger(HubApp.class);

    public static void main(String[] args) {
        HubConfig config;
        try {
            config = HubConfig.fromEnv();
        } catch (IllegalArgumentException | IllegalStateException e) {
            log.error("Invalid configuration, refusing to start: {}", e.getMessage());
            System.exit(1);
            return;
        }
        MDC.put("nodeId", config.getNodeId());

        log.info("Starting hub: {}", config.getNodeId());
        log.info("  Kafka: {} (topic {})", config.getKafkaBootstrap(), config.getOrderChangesTopic());
        log.info("  Redis: {}", config.getRedisUrl());
        log.info("  POS polling: {}", config.isPosEnabled() ? config.getPosBaseUrl() : "disabled");

        // Setup metrics registry with Prometheus support
        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter(config.getNodeId());
        MetricsService metricsService = new MetricsService(metricsExporter.getRegistry());

        // External adapters
        RedisOrderStore orderStore = new RedisOrderStore(config);
        KafkaOrderChangeFeed changeFeed = new KafkaOrderChangeFeed(config);

        // Hub state and services
        ConnectionRegistry registry = new ConnectionRegistry();
        TopicGroupIndex index = new TopicGroupIndex();
        metricsService.registerGauges(registry::size, index::groupCount);
        FanoutDispatcher dispatcher = new FanoutDispatcher(index, registry, metricsService);
        MembershipManager membershipManager = new MembershipManager(
            index, registry, dispatcher, orderStore, metricsService
        );
        ChangeEventBridge bridge = new ChangeEventBridge(dispatcher, metricsService);

        VentaPoller poller = null;
        Consumer<MesaRef> mesaWatcher = mesa -> {
        };
        if (config.isPosEnabled()) {
            poller = new VentaPoller(
                new PosClient(config),
                dispatcher,
                new RevisionTracker(config.getRevisionCacheMax()),
                metricsService,
                config.getPollInterval(),
                config.getPosTimeout()
            );
            poller.trackAll(config.getPollMesas());
            mesaWatcher = poller::track;
        }

        Disposable feedSubscription = bridge.subscribe(changeFeed);
        if (poller != null) {
            poller.start();
        }

        // Start HTTP + WebSocket server
        WebSocketHandler wsHandler = new WebSocketHandler(
            config, membershipManager, dispatcher, mesaWatcher, metricsService
        );
        HttpServer httpServer = new HttpServer(
            config,
            wsHandler,
            new TriggerHandler(bridge, metricsService),
            registry,
            index,
            metricsExporter::scrape
        );
        httpServer.start();

        log.info("Hub {} is ready", config.getNodeId());

        handleShutdown(config, httpServer, membershipManager, feedSubscription, changeFeed, poller, orderStore);

        // Keep the application running until shutdown signal
        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Main thread interrupted");
        }
    }

    private static void handleShutdown(HubConfig config,
                                       HttpServer httpServer,
                                       MembershipManager membershipManager,
                                       Disposable feedSubscription,
                                       KafkaOrderChangeFeed changeFeed,
                                       VentaPoller poller,
                                       RedisOrderStore orderStore) {
        // Graceful shutdown hook
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown signal received, initiating graceful shutdown...");
            MDC.put("nodeId", config.getNodeId());

            httpServer.stopAccepting();

            if (poller != null) {
                poller.stop();
            }
            feedSubscription.dispose();
            changeFeed.close();

            httpServer.stop();
            membershipManager.closeAll();

            orderStore.close();

            log.info("Shutdown complete");
        }));
    }
}
