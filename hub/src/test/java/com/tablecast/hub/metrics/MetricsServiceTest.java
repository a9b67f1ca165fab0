package com.tablecast.hub.metrics;

import com.tablecast.core.metrics.MetricsNames;
import com.tablecast.core.metrics.MetricsTags;
import com.tablecast.core.topic.TopicKey;
import com.tablecast.hub.connection.ConnectionFactory;
import com.tablecast.hub.connection.ConnectionRegistry;
import com.tablecast.hub.connection.HubConnection;
import com.tablecast.hub.topic.TopicGroupIndex;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MetricsServiceTest {

    private SimpleMeterRegistry meterRegistry;
    private ConnectionRegistry registry;
    private TopicGroupIndex index;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        registry = new ConnectionRegistry();
        index = new TopicGroupIndex();
        new MetricsService(meterRegistry).registerGauges(registry::size, index::groupCount);
    }

    private double connectionsGauge() {
        return meterRegistry.get(MetricsNames.CONNECTIONS_ACTIVE).gauge().value();
    }

    @Test
    @DisplayName("Connection gauge follows the registry and survives garbage collection")
    void testConnectionGaugeAfterGc() throws InterruptedException {
        ConnectionFactory factory = new ConnectionFactory(4);
        registry.admit(factory.create("c1"));
        assertEquals(1.0, connectionsGauge());

        for (int i = 0; i < 5; i++) {
            System.gc();
            Thread.sleep(20);
        }

        assertEquals(1.0, connectionsGauge());
        registry.admit(factory.create("c2"));
        assertEquals(2.0, connectionsGauge());
    }

    @Test
    @DisplayName("Group gauges are reported per namespace")
    void testGroupGauges() {
        HubConnection kitchen = new ConnectionFactory(4).create("kitchen");
        index.join(TopicKey.branch("north"), kitchen);
        index.join(TopicKey.branch("south"), kitchen);

        assertEquals(2.0, meterRegistry.get(MetricsNames.GROUPS_ACTIVE)
            .tag(MetricsTags.NAMESPACE, "branch").gauge().value());
        assertEquals(0.0, meterRegistry.get(MetricsNames.GROUPS_ACTIVE)
            .tag(MetricsTags.NAMESPACE, "tracking").gauge().value());
    }
}
