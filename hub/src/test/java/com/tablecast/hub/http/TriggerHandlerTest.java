package com.tablecast.hub.http;

import com.tablecast.core.topic.TopicKey;
import com.tablecast.hub.bridge.ChangeEventBridge;
import com.tablecast.hub.connection.ConnectionFactory;
import com.tablecast.hub.connection.ConnectionRegistry;
import com.tablecast.hub.connection.HubConnection;
import com.tablecast.hub.dispatch.FanoutDispatcher;
import com.tablecast.hub.metrics.MetricsService;
import com.tablecast.hub.support.Frames;
import com.tablecast.hub.topic.TopicGroupIndex;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TriggerHandlerTest {

    private TopicGroupIndex index;
    private ConnectionRegistry registry;
    private TriggerHandler handler;
    private ConnectionFactory factory;

    @BeforeEach
    void setUp() {
        index = new TopicGroupIndex();
        registry = new ConnectionRegistry();
        MetricsService metricsService = new MetricsService(new SimpleMeterRegistry());
        ChangeEventBridge bridge = new ChangeEventBridge(
            new FanoutDispatcher(index, registry, metricsService), metricsService);
        handler = new TriggerHandler(bridge, metricsService);
        factory = new ConnectionFactory(16);
    }

    private List<String> connect(String id, TopicKey key) {
        HubConnection connection = factory.create(id);
        registry.admit(connection);
        if (key != null) {
            index.join(key, connection);
        }
        return Frames.collect(connection);
    }

    @Test
    @DisplayName("notify-kds reloads the kitchen screens of one branch only")
    void testNotifyKds() {
        List<String> north1 = connect("k1", TopicKey.branch("north"));
        List<String> north2 = connect("k2", TopicKey.branch("north"));
        List<String> south = connect("k3", TopicKey.branch("south"));

        TriggerResponse response = handler.notifyKds("{\"branch\":\"north\"}");

        assertEquals(200, response.status());
        assertEquals(true, response.body().get("ok"));
        assertEquals(2, response.body().get("delivered"));
        assertEquals("reload-orders", Frames.single(north1).get("type").asText());
        assertEquals("reload-orders", Frames.single(north2).get("type").asText());
        assertTrue(south.isEmpty());
    }

    @Test
    @DisplayName("notify-kds without a branch is rejected and broadcasts nothing")
    void testNotifyKdsRejected() {
        List<String> north = connect("k1", TopicKey.branch("north"));

        TriggerResponse missing = handler.notifyKds("{}");
        TriggerResponse blank = handler.notifyKds("{\"branch\":\"  \"}");
        TriggerResponse empty = handler.notifyKds("");
        TriggerResponse invalid = handler.notifyKds("{branch:");

        assertEquals(400, missing.status());
        assertEquals("branch is required", missing.body().get("error"));
        assertEquals(400, blank.status());
        assertEquals(400, empty.status());
        assertEquals(400, invalid.status());
        assertEquals("Invalid JSON body", invalid.body().get("error"));
        assertFalse(invalid.isSuccess());
        assertTrue(north.isEmpty());
    }

    @Test
    @DisplayName("notify-kds to a branch nobody watches still succeeds")
    void testNotifyKdsNoMembers() {
        TriggerResponse response = handler.notifyKds("{\"branch\":\"east\"}");

        assertTrue(response.isSuccess());
        assertEquals(0, response.body().get("delivered"));
    }

    @Test
    @DisplayName("notify-whatsapp reaches every connection")
    void testNotifyWhatsapp() {
        List<String> kitchen = connect("k1", TopicKey.branch("north"));
        List<String> idle = connect("idle", null);

        TriggerResponse response = handler.notifyWhatsapp();

        assertEquals(2, response.body().get("delivered"));
        assertEquals("whatsapp-new-message", Frames.single(kitchen).get("type").asText());
        assertEquals("whatsapp-new-message", Frames.single(idle).get("type").asText());
    }

    @Test
    @DisplayName("broadcast sends the given type to one mesa group")
    void testBroadcastToMesa() {
        List<String> table = connect("t1", TopicKey.mesa("bar", "4"));
        List<String> otherTable = connect("t2", TopicKey.mesa("bar", "5"));

        TriggerResponse response = handler.broadcast("{\"mesaKey\":\"bar:4\",\"type\":\"pedido-listo\"}");

        assertEquals(200, response.status());
        assertEquals("pedido-listo", Frames.single(table).get("type").asText());
        assertTrue(otherTable.isEmpty());
    }

    @Test
    @DisplayName("broadcast needs both mesaKey and type")
    void testBroadcastRejected() {
        assertEquals("mesaKey and type are required", handler.broadcast("{\"mesaKey\":\"bar:4\"}").body().get("error"));
        assertEquals(400, handler.broadcast("{\"type\":\"x\"}").status());
        assertEquals(400, handler.broadcast("[]").status());
    }
}
