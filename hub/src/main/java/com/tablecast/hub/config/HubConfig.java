package com.tablecast.hub.config;

import com.tablecast.core.model.MesaRef;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Configuration for the hub, loaded from environment variables.
 * <p>
 * POS polling is optional: it is enabled by {@code POS_BASE_URL}, which then makes
 * {@code POS_CLIENT_ID} and {@code POS_CLIENT_SECRET} mandatory.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class HubConfig {

    String nodeId;
    int httpPort;
    String redisUrl;
    String kafkaBootstrap;
    String orderChangesTopic;
    Set<String> activeStatuses;
    int perConnBufferSize;
    int pingInterval;
    int idleTimeout;
    String posBaseUrl;
    String posClientId;
    String posClientSecret;
    Duration pollInterval;
    Duration posTimeout;
    List<MesaRef> pollMesas;
    int revisionCacheMax;

    public static HubConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    /**
     * Builds and validates the config from an environment map.
     *
     * @throws IllegalArgumentException on an unparseable value
     * @throws IllegalStateException    when a mandatory value is missing
     */
    public static HubConfig fromEnv(Map<String, String> env) {
        HubConfig config = HubConfig.builder()
                .nodeId(get(env, "NODE_ID", "hub-1"))
                .httpPort(getInt(env, "HTTP_PORT", 3001))
                .redisUrl(get(env, "REDIS_URL", "redis://localhost:6379"))
                .kafkaBootstrap(get(env, "KAFKA_BOOTSTRAP", "localhost:9092"))
                .orderChangesTopic(get(env, "ORDER_CHANGES_TOPIC", "orders.changes"))
                .activeStatuses(Set.copyOf(splitList(get(env, "ACTIVE_STATUSES", "pending,preparing,ready_to_send"))))
                .perConnBufferSize(getInt(env, "PER_CONN_BUFFER_SIZE", 256))
                .pingInterval(getInt(env, "PING_INTERVAL", 10))
                .idleTimeout(getInt(env, "IDLE_TIMEOUT", 60))
                .posBaseUrl(get(env, "POS_BASE_URL", null))
                .posClientId(get(env, "POS_CLIENT_ID", null))
                .posClientSecret(get(env, "POS_CLIENT_SECRET", null))
                .pollInterval(Duration.ofMillis(getInt(env, "POLL_INTERVAL_MS", 5000)))
                .posTimeout(Duration.ofMillis(getInt(env, "POS_TIMEOUT_MS", 4000)))
                .pollMesas(splitList(get(env, "POLL_MESAS", "")).stream()
                        .map(MesaRef::parse)
                        .collect(Collectors.toList()))
                .revisionCacheMax(getInt(env, "REVISION_CACHE_MAX", 10_000))
                .build();
        config.validate();
        return config;
    }

    public boolean isPosEnabled() {
        return posBaseUrl != null;
    }

    /**
     * Checks values that would leave the hub running degraded.
     *
     * @throws IllegalStateException describing the first problem found
     */
    public void validate() {
        if (httpPort < 0 || httpPort > 65_535) {
            throw new IllegalStateException("HTTP_PORT out of range: " + httpPort);
        }
        if (perConnBufferSize <= 0) {
            throw new IllegalStateException("PER_CONN_BUFFER_SIZE must be positive");
        }
        if (activeStatuses == null || activeStatuses.isEmpty()) {
            throw new IllegalStateException("ACTIVE_STATUSES must name at least one status");
        }
        if (isPosEnabled()) {
            if (posClientId == null || posClientSecret == null) {
                throw new IllegalStateException("POS_CLIENT_ID and POS_CLIENT_SECRET are required when POS_BASE_URL is set");
            }
            if (pollInterval == null || pollInterval.isZero() || pollInterval.isNegative()) {
                throw new IllegalStateException("POLL_INTERVAL_MS must be positive");
            }
            if (revisionCacheMax <= 0) {
                throw new IllegalStateException("REVISION_CACHE_MAX must be positive");
            }
        }
    }

    private static String get(Map<String, String> env, String key, String defaultValue) {
        String value = env.get(key);
        return value != null && !value.isBlank() ? value.trim() : defaultValue;
    }

    private static int getInt(Map<String, String> env, String key, int defaultValue) {
        String value = get(env, key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not a number: '" + value + "'", e);
        }
    }

    private static List<String> splitList(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }
}
