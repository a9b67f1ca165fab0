package com.tablecast.hub.poll;

import com.tablecast.core.metrics.MetricsNames;
import com.tablecast.core.model.MesaRef;
import com.tablecast.hub.connection.ConnectionFactory;
import com.tablecast.hub.connection.ConnectionRegistry;
import com.tablecast.hub.connection.HubConnection;
import com.tablecast.hub.dispatch.FanoutDispatcher;
import com.tablecast.hub.metrics.MetricsService;
import com.tablecast.hub.pos.PosApiException;
import com.tablecast.hub.support.Frames;
import com.tablecast.hub.support.StubPosClient;
import com.tablecast.hub.topic.TopicGroupIndex;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class VentaPollerTest {

    private static final MesaRef MESA_1 = new MesaRef("la-esquina", "1");
    private static final MesaRef MESA_2 = new MesaRef("la-esquina", "2");

    private TopicGroupIndex index;
    private ConnectionRegistry registry;
    private StubPosClient posClient;
    private RevisionTracker tracker;
    private SimpleMeterRegistry meterRegistry;
    private VentaPoller poller;

    @BeforeEach
    void setUp() {
        index = new TopicGroupIndex();
        registry = new ConnectionRegistry();
        posClient = new StubPosClient();
        meterRegistry = new SimpleMeterRegistry();
        tracker = new RevisionTracker(100);
        MetricsService metricsService = new MetricsService(meterRegistry);
        poller = new VentaPoller(
            posClient,
            new FanoutDispatcher(index, registry, metricsService),
            tracker,
            metricsService,
            Duration.ofMillis(50),
            Duration.ofMillis(200)
        );
    }

    @AfterEach
    void tearDown() {
        poller.stop();
    }

    private List<String> tableScreen(String id, MesaRef mesa) {
        HubConnection connection = new ConnectionFactory(16).create(id);
        registry.admit(connection);
        index.join(mesa.topic(), connection);
        return Frames.collect(connection);
    }

    @Test
    @DisplayName("Baseline is silent, same revision is silent, new revision notifies the mesa once")
    void testRevisionChangeNotifies() {
        List<String> screen = tableScreen("t1", MESA_1);
        poller.track(MESA_1);

        posClient.respond(MESA_1, "2024-05-01T12:00:00Z");
        StepVerifier.create(poller.pollOnce()).expectNext(0).verifyComplete();
        StepVerifier.create(poller.pollOnce()).expectNext(0).verifyComplete();
        assertTrue(screen.isEmpty());

        posClient.respond(MESA_1, "2024-05-01T12:03:00Z");
        StepVerifier.create(poller.pollOnce()).expectNext(1).verifyComplete();
        StepVerifier.create(poller.pollOnce()).expectNext(0).verifyComplete();

        assertEquals("venta-actualizada", Frames.single(screen).get("type").asText());
    }

    @Test
    @DisplayName("Revisions r0, r1, r1, r2 notify exactly twice")
    void testChangeAfterUnchangedTick() {
        List<String> screen = tableScreen("t1", MESA_1);
        poller.track(MESA_1);

        for (String marker : List.of("r0", "r1", "r1", "r2")) {
            posClient.respond(MESA_1, marker);
            poller.pollOnce().block();
        }

        assertEquals(2, screen.size());
        Frames.parsed(screen).forEach(frame -> assertEquals("venta-actualizada", frame.get("type").asText()));
        assertEquals("r2", tracker.lastMarker(MESA_1.key()));
    }

    @Test
    @DisplayName("A failing mesa does not hold back the others")
    void testFailureIsolation() {
        List<String> screen2 = tableScreen("t2", MESA_2);
        poller.trackAll(List.of(MESA_1, MESA_2));

        posClient.respond(MESA_2, "r1");
        poller.pollOnce().block();

        posClient.respond(MESA_1, Mono.error(new PosApiException("POS answered 500", 500)));
        posClient.respond(MESA_2, "r2");
        StepVerifier.create(poller.pollOnce()).expectNext(1).verifyComplete();

        assertEquals(1, screen2.size());
        assertEquals(1.0, meterRegistry.get(MetricsNames.POLL_FAILURES_TOTAL).counter().count());
    }

    @Test
    @DisplayName("A fetch that outlives its timeout counts as a failure")
    void testTimeout() {
        poller.track(MESA_1);
        posClient.respond(MESA_1, Mono.never());

        StepVerifier.create(poller.check(MESA_1))
            .expectNext(false)
            .verifyComplete();

        assertEquals(1.0, meterRegistry.get(MetricsNames.POLL_FAILURES_TOTAL).counter().count());
    }

    @Test
    @DisplayName("No open sale is not a change and not a failure")
    void testNoOpenSale() {
        poller.track(MESA_1);

        StepVerifier.create(poller.check(MESA_1)).expectNext(false).verifyComplete();

        assertEquals(0.0, meterRegistry.get(MetricsNames.POLL_FAILURES_TOTAL).counter().count());
    }

    @Test
    @DisplayName("Tracking is idempotent")
    void testTrack() {
        assertTrue(poller.track(MESA_1));
        assertFalse(poller.track(MESA_1));
        assertEquals(Set.of(MESA_1), poller.getTracked());
    }

    @Test
    @DisplayName("Started poller notifies on its own schedule")
    void testScheduledPolling() {
        List<String> screen = tableScreen("t1", MESA_1);
        poller.track(MESA_1);
        posClient.respond(MESA_1, "r1");
        poller.start();

        Frames.awaitUntil(() -> "r1".equals(tracker.lastMarker(MESA_1.key())), Duration.ofSeconds(5));
        posClient.respond(MESA_1, "r2");

        Frames.awaitUntil(() -> screen.size() == 1, Duration.ofSeconds(5));
        assertEquals("venta-actualizada", Frames.single(screen).get("type").asText());
    }
}
