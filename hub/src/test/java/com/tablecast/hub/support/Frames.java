package com.tablecast.hub.support;

import com.fasterxml.jackson.databind.JsonNode;
import com.tablecast.core.util.JsonUtils;
import com.tablecast.hub.connection.HubConnection;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.fail;

/**
 * Test helpers for reading what a connection was sent.
 */
public final class Frames {
    private Frames() {
    }

    /**
     * Subscribes to a connection's outbound stream; the returned list fills as frames are sent.
     */
    public static List<String> collect(HubConnection connection) {
        List<String> frames = new CopyOnWriteArrayList<>();
        connection.outbound().subscribe(frames::add);
        return frames;
    }

    public static List<JsonNode> parsed(List<String> frames) {
        return frames.stream().map(JsonUtils::readTree).collect(Collectors.toList());
    }

    public static JsonNode single(List<String> frames) {
        if (frames.size() != 1) {
            fail("Expected exactly one frame but got " + frames);
        }
        return JsonUtils.readTree(frames.get(0));
    }

    public static void awaitUntil(BooleanSupplier condition, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Condition not met within " + timeout);
            }
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail("Interrupted while waiting");
            }
        }
    }
}
