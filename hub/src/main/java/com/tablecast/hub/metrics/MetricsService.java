package com.tablecast.hub.metrics;

import com.tablecast.core.metrics.MetricsNames;
import com.tablecast.core.metrics.MetricsTags;
import com.tablecast.core.topic.Namespace;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.IntSupplier;
import java.util.function.ToIntFunction;

/**
 * Centralized metrics service for the hub.
 */
public class MetricsService {

    private final MeterRegistry registry;

    // Counters
    private final Map<Namespace, Counter> broadcasts = new EnumMap<>(Namespace.class);
    private final Counter broadcastsAll;
    private final Counter deliveries;
    private final Counter skippedStale;
    private final Counter skippedOverflow;
    private final Counter malformed;
    private final Counter orderChanges;
    private final Counter pollChanges;
    private final Counter pollFailures;
    private final Counter lookupFailures;

    // Network traffic counters (bytes)
    private final Counter networkInboundWs;
    private final Counter networkOutboundWs;
    private final DistributionSummary messageSizeOutbound;

    public MetricsService(MeterRegistry registry) {
        this.registry = registry;

        new ProcessorMetrics().bindTo(registry);
        new JvmMemoryMetrics().bindTo(registry);

        for (Namespace namespace : Namespace.values()) {
            broadcasts.put(namespace, Counter.builder(MetricsNames.BROADCASTS_TOTAL)
                .tag(MetricsTags.NAMESPACE, namespace.wireName())
                .description("Broadcast calls per namespace")
                .register(registry));
        }

        broadcastsAll = Counter.builder(MetricsNames.BROADCASTS_TOTAL)
            .tag(MetricsTags.NAMESPACE, "all")
            .description("Untargeted broadcast calls")
            .register(registry);

        deliveries = Counter.builder(MetricsNames.DELIVERIES_TOTAL)
            .description("Messages handed to an open connection")
            .register(registry);

        skippedStale = Counter.builder(MetricsNames.SKIPPED_TOTAL)
            .tag(MetricsTags.REASON, "stale")
            .description("Messages skipped because the member was already closed")
            .register(registry);

        skippedOverflow = Counter.builder(MetricsNames.SKIPPED_TOTAL)
            .tag(MetricsTags.REASON, "overflow")
            .description("Messages dropped because the member's outbound buffer was full")
            .register(registry);

        malformed = Counter.builder(MetricsNames.MALFORMED_TOTAL)
            .description("Inbound client messages dropped as malformed")
            .register(registry);

        orderChanges = Counter.builder(MetricsNames.ORDER_CHANGES_TOTAL)
            .description("Order changes fanned out to a branch")
            .register(registry);

        pollChanges = Counter.builder(MetricsNames.POLL_CHANGES_TOTAL)
            .description("POS sale revisions that triggered a broadcast")
            .register(registry);

        pollFailures = Counter.builder(MetricsNames.POLL_FAILURES_TOTAL)
            .description("POS fetches that failed or timed out")
            .register(registry);

        lookupFailures = Counter.builder(MetricsNames.LOOKUP_FAILURES_TOTAL)
            .description("Order store lookups for join snapshots that failed")
            .register(registry);

        networkInboundWs = Counter.builder(MetricsNames.NETWORK_INBOUND_WS_BYTES)
            .description("Total bytes received from WebSocket clients")
            .baseUnit("bytes")
            .register(registry);

        networkOutboundWs = Counter.builder(MetricsNames.NETWORK_OUTBOUND_WS_BYTES)
            .description("Total bytes sent to WebSocket clients")
            .baseUnit("bytes")
            .register(registry);

        messageSizeOutbound = DistributionSummary.builder(MetricsNames.NETWORK_OUTBOUND_WS_BYTES + ".size")
            .description("Outbound frame size distribution")
            .baseUnit("bytes")
            .register(registry);
    }

    /**
     * Registers gauges that read live state on scrape.
     *
     * @param connections  live connection count
     * @param groupsPerNamespace non-empty group count for a namespace
     */
    public void registerGauges(IntSupplier connections, ToIntFunction<Namespace> groupsPerNamespace) {
        Gauge.builder(MetricsNames.CONNECTIONS_ACTIVE, connections::getAsInt)
            .description("Live WebSocket connections")
            .register(registry);

        for (Namespace namespace : Namespace.values()) {
            Gauge.builder(MetricsNames.GROUPS_ACTIVE, () -> groupsPerNamespace.applyAsInt(namespace))
                .tag(MetricsTags.NAMESPACE, namespace.wireName())
                .description("Non-empty topic groups")
                .register(registry);
        }
    }

    public void recordBroadcast(Namespace namespace) {
        broadcasts.get(namespace).increment();
    }

    public void recordBroadcastAll() {
        broadcastsAll.increment();
    }

    public void recordDeliveries(int count) {
        deliveries.increment(count);
    }

    public void recordSkippedStale() {
        skippedStale.increment();
    }

    public void recordSkippedOverflow() {
        skippedOverflow.increment();
    }

    public void recordMalformed() {
        malformed.increment();
    }

    /**
     * Records an HTTP trigger call.
     *
     * @param type    trigger name (whatsapp, kds, broadcast)
     * @param outcome ok or invalid
     */
    public void recordTrigger(String type, String outcome) {
        Counter.builder(MetricsNames.TRIGGERS_TOTAL)
            .tag(MetricsTags.TYPE, type)
            .tag(MetricsTags.OUTCOME, outcome)
            .register(registry)
            .increment();
    }

    public void recordOrderChange() {
        orderChanges.increment();
    }

    public void recordPollChange() {
        pollChanges.increment();
    }

    public void recordPollFailure() {
        pollFailures.increment();
    }

    public void recordLookupFailure() {
        lookupFailures.increment();
    }

    /**
     * Records bytes received from WebSocket client.
     *
     * @param bytes number of bytes received
     */
    public void recordNetworkInboundWs(long bytes) {
        networkInboundWs.increment(bytes);
    }

    /**
     * Records bytes sent to WebSocket client.
     *
     * @param bytes number of bytes sent
     */
    public void recordNetworkOutboundWs(long bytes) {
        networkOutboundWs.increment(bytes);
        messageSizeOutbound.record(bytes);
    }
}
