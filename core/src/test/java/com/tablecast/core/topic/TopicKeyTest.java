package com.tablecast.core.topic;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TopicKeyTest {

    @Test
    @DisplayName("Renders as namespace:key")
    void testToString() {
        assertEquals("tracking:T1", TopicKey.tracking("T1").toString());
        assertEquals("branch:north", TopicKey.branch("north").toString());
        assertEquals("mesa:la-esquina:12", TopicKey.mesa("la-esquina", "12").toString());
    }

    @Test
    @DisplayName("Same key in different namespaces is a different topic")
    void testNamespaceIsPartOfIdentity() {
        assertNotEquals(TopicKey.tracking("A"), TopicKey.branch("A"));
        assertEquals(TopicKey.branch("A"), TopicKey.of(Namespace.BRANCH, "A"));
    }

    @Test
    @DisplayName("Blank or missing keys are rejected")
    void testBlankKeyRejected() {
        assertThrows(IllegalArgumentException.class, () -> TopicKey.tracking(""));
        assertThrows(IllegalArgumentException.class, () -> TopicKey.branch("   "));
        assertThrows(IllegalArgumentException.class, () -> TopicKey.of(Namespace.MESA, null));
        assertThrows(NullPointerException.class, () -> new TopicKey(null, "x"));
    }

    @Test
    @DisplayName("Namespaces resolve from their wire names")
    void testNamespaceWireNames() {
        assertEquals(Namespace.TRACKING, Namespace.fromWireName("tracking").orElseThrow());
        assertEquals(Namespace.MESA, Namespace.fromWireName("mesa").orElseThrow());
        assertTrue(Namespace.fromWireName("room").isEmpty());
    }
}
