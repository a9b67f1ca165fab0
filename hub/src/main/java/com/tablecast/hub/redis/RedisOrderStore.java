package com.tablecast.hub.redis;

import com.tablecast.core.model.OrderRecord;
import com.tablecast.core.redis.Keys;
import com.tablecast.core.util.JsonUtils;
import com.tablecast.hub.config.HubConfig;
import io.lettuce.core.RedisClient;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.reactive.RedisReactiveCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Reactive Redis lookup of order documents.
 * <p>
 * All operations are non-blocking using Lettuce reactive API.
 * The ordering back end keeps {@code order:tracking:{trackingId}} current; the hub only reads.
 * </p>
 */
public class RedisOrderStore implements IOrderStore {
    private static final Logger log = LoggerFactory.getLogger(RedisOrderStore.class);

    private final RedisClient client;
    private final StatefulRedisConnection<String, String> connection;
    private final RedisReactiveCommands<String, String> commands;

    public RedisOrderStore(HubConfig config) {
        this.client = RedisClient.create(config.getRedisUrl());
        this.connection = client.connect();
        this.commands = connection.reactive();
        log.info("Connected to Redis: {}", config.getRedisUrl());
    }

    @Override
    public Mono<OrderRecord> findByTrackingId(String trackingId) {
        return commands.get(Keys.orderByTracking(trackingId))
            .map(json -> JsonUtils.readValue(json, OrderRecord.class))
            .doOnError(err -> log.error("Failed to read order for tracking {}", trackingId, err));
    }

    @Override
    public void close() {
        connection.close();
        client.shutdown();
        log.info("Redis connection closed");
    }
}
