package com.tablecast.hub.support;

import com.tablecast.core.model.OrderChange;
import com.tablecast.hub.kafka.IOrderChangeFeed;
import reactor.core.publisher.Flux;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Change feed that plays one scripted stream per subscription, then stays silent.
 */
public class StubOrderChangeFeed implements IOrderChangeFeed {
    private final Queue<Flux<OrderChange>> script = new ConcurrentLinkedQueue<>();
    private final AtomicInteger subscriptions = new AtomicInteger();

    public StubOrderChangeFeed enqueue(Flux<OrderChange> stream) {
        script.add(stream);
        return this;
    }

    public int getSubscriptions() {
        return subscriptions.get();
    }

    @Override
    public Flux<OrderChange> changes() {
        return Flux.defer(() -> {
            subscriptions.incrementAndGet();
            Flux<OrderChange> next = script.poll();
            return next != null ? next : Flux.never();
        });
    }

    @Override
    public void close() {
    }
}
