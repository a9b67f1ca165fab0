package com.tablecast.hub.topic;

import com.tablecast.core.topic.Namespace;
import com.tablecast.core.topic.TopicKey;
import com.tablecast.hub.connection.ConnectionFactory;
import com.tablecast.hub.connection.HubConnection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TopicGroupIndexTest {

    private TopicGroupIndex index;
    private ConnectionFactory factory;

    @BeforeEach
    void setUp() {
        index = new TopicGroupIndex();
        factory = new ConnectionFactory(16);
    }

    @Test
    @DisplayName("First join creates the group, last leave removes it")
    void testGroupLifecycle() {
        HubConnection a = factory.create("a");
        HubConnection b = factory.create("b");
        TopicKey key = TopicKey.branch("north");

        index.join(key, a);
        index.join(key, b);
        assertEquals(Set.of(a, b), index.membersOf(key));

        index.leave(key, a);
        assertTrue(index.contains(key));
        index.leave(key, b);

        assertFalse(index.contains(key));
        assertEquals(0, index.groupCount());
        assertTrue(index.membersOf(key).isEmpty());
    }

    @Test
    @DisplayName("Join is idempotent and leave of a non-member is a no-op")
    void testIdempotence() {
        HubConnection a = factory.create("a");
        HubConnection stranger = factory.create("x");
        TopicKey key = TopicKey.tracking("T1");

        index.join(key, a);
        index.join(key, a);
        index.leave(key, stranger);
        index.leave(TopicKey.tracking("unknown"), a);

        assertEquals(1, index.membersOf(key).size());
        assertEquals(1, index.groupCount());
    }

    @Test
    @DisplayName("Equal keys in different namespaces are separate groups")
    void testNamespacesAreIndependent() {
        HubConnection customer = factory.create("customer");
        HubConnection kitchen = factory.create("kitchen");

        index.join(Namespace.TRACKING, "A", customer);
        index.join(Namespace.BRANCH, "A", kitchen);

        assertEquals(Set.of(customer), index.membersOf(Namespace.TRACKING, "A"));
        assertEquals(Set.of(kitchen), index.membersOf(Namespace.BRANCH, "A"));
        assertEquals(1, index.groupCount(Namespace.TRACKING));
        assertEquals(1, index.groupCount(Namespace.BRANCH));
        assertEquals(0, index.groupCount(Namespace.MESA));
    }

    @Test
    @DisplayName("Member snapshots do not change with later joins")
    void testSnapshotIsolation() {
        HubConnection a = factory.create("a");
        TopicKey key = TopicKey.mesa("bar", "1");
        index.join(key, a);

        Set<HubConnection> snapshot = index.membersOf(key);
        index.join(key, factory.create("b"));

        assertEquals(1, snapshot.size());
        assertEquals(2, index.membersOf(key).size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add(a));
    }

    @Test
    @DisplayName("Concurrent join/leave on one key never leaves an empty group behind")
    void testConcurrentJoinLeave() throws InterruptedException {
        TopicKey key = TopicKey.branch("busy");
        int threads = 8;
        int rounds = 500;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);

        List<HubConnection> connections = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            connections.add(factory.create("c" + i));
        }
        for (HubConnection connection : connections) {
            executor.submit(() -> {
                try {
                    start.await();
                    for (int r = 0; r < rounds; r++) {
                        index.join(key, connection);
                        index.leave(key, connection);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }

        start.countDown();
        assertTrue(done.await(10, TimeUnit.SECONDS));
        executor.shutdown();

        assertFalse(index.contains(key));
        assertEquals(0, index.groupCount());
    }
}
