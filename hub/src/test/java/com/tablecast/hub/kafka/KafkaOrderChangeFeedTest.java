package com.tablecast.hub.kafka;

import com.tablecast.core.model.ChangeKind;
import com.tablecast.core.model.OrderChange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class KafkaOrderChangeFeedTest {

    private static final Set<String> ACTIVE = Set.of("pending", "preparing", "ready_to_send");

    @Test
    @DisplayName("Records of active orders pass with their kind and full order")
    void testActiveOrderPasses() {
        Optional<OrderChange> change = KafkaOrderChangeFeed.parse(
            "{\"kind\":\"added\",\"order\":{\"id\":\"o1\",\"branch\":\"north\",\"status\":\"pending\",\"items\":[]}}",
            ACTIVE);

        assertTrue(change.isPresent());
        assertEquals(ChangeKind.ADDED, change.get().getKind());
        assertEquals("north", change.get().getOrder().getBranch());
        assertTrue(change.get().getOrder().getAttributes().containsKey("items"));
    }

    @Test
    @DisplayName("Orders outside the active statuses are filtered out")
    void testInactiveFiltered() {
        assertTrue(KafkaOrderChangeFeed.parse(
            "{\"kind\":\"modified\",\"order\":{\"id\":\"o1\",\"status\":\"delivered\"}}", ACTIVE).isEmpty());
        assertTrue(KafkaOrderChangeFeed.parse(
            "{\"kind\":\"modified\",\"order\":{\"id\":\"o1\"}}", ACTIVE).isEmpty());
    }

    @Test
    @DisplayName("Unreadable or incomplete records are skipped")
    void testBadRecordsSkipped() {
        assertTrue(KafkaOrderChangeFeed.parse("not json", ACTIVE).isEmpty());
        assertTrue(KafkaOrderChangeFeed.parse("{\"order\":{\"status\":\"pending\"}}", ACTIVE).isEmpty());
        assertTrue(KafkaOrderChangeFeed.parse("{\"kind\":\"added\"}", ACTIVE).isEmpty());
        assertTrue(KafkaOrderChangeFeed.parse(
            "{\"kind\":\"renamed\",\"order\":{\"status\":\"pending\"}}", ACTIVE).isEmpty());
    }
}
