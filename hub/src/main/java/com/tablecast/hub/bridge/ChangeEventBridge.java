package com.tablecast.hub.bridge;

import com.tablecast.core.model.OrderChange;
import com.tablecast.core.model.OrderRecord;
import com.tablecast.core.msg.OutboundMessages;
import com.tablecast.core.topic.TopicKey;
import com.tablecast.core.util.JitterBackoff;
import com.tablecast.hub.dispatch.FanoutDispatcher;
import com.tablecast.hub.kafka.IOrderChangeFeed;
import com.tablecast.hub.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * Turns push triggers and order change notifications into fan-out calls.
 * <p>
 * Push triggers always fire. Change-feed notifications fire on every added or
 * modified record; the feed is trusted not to report unchanged records.
 * </p>
 */
public class ChangeEventBridge {
    private static final Logger log = LoggerFactory.getLogger(ChangeEventBridge.class);

    private final FanoutDispatcher dispatcher;
    private final MetricsService metricsService;

    public ChangeEventBridge(FanoutDispatcher dispatcher, MetricsService metricsService) {
        this.dispatcher = dispatcher;
        this.metricsService = metricsService;
    }

    /**
     * Unconditional broadcast of a fixed payload to one topic.
     *
     * @return number of deliveries
     */
    public int onPushTrigger(TopicKey key, Object payload) {
        int delivered = dispatcher.broadcast(key, payload);
        log.info("Push trigger to {} delivered to {} connection(s)", key, delivered);
        return delivered;
    }

    /**
     * Unconditional broadcast of a fixed payload to every connection.
     *
     * @return number of deliveries
     */
    public int onPushTriggerAll(Object payload) {
        int delivered = dispatcher.broadcastAll(payload);
        log.info("Push trigger to all delivered to {} connection(s)", delivered);
        return delivered;
    }

    /**
     * Fans an order change out to the order's branch.
     *
     * @return number of deliveries; 0 for removals and records without a branch
     */
    public int onOrderChange(OrderChange change) {
        if (change == null || !change.isUpsert() || change.getOrder() == null) {
            return 0;
        }
        OrderRecord order = change.getOrder();
        String branch = order.getBranch();
        if (branch == null || branch.isBlank()) {
            log.warn("Order {} changed ({}) without a branch, not fanned out", order.getId(), change.getKind());
            return 0;
        }

        metricsService.recordOrderChange();
        int delivered = dispatcher.broadcast(TopicKey.branch(branch), OutboundMessages.orderUpdated(order));
        log.debug("Order {} {} (status={}) sent to branch {} ({} deliveries)",
            order.getId(), change.getKind(), order.getStatus(), branch, delivered);
        return delivered;
    }

    /**
     * Subscribes to the change feed, re-subscribing with jittered backoff whenever it fails.
     *
     * @param feed order change feed
     * @return handle that stops the subscription
     */
    public Disposable subscribe(IOrderChangeFeed feed) {
        return feed.changes()
            .doOnNext(change -> {
                try {
                    onOrderChange(change);
                } catch (Exception e) {
                    log.error("Failed to fan out order change {}", change, e);
                }
            })
            .doOnError(err -> log.warn("Order change feed failed, re-subscribing: {}", err.toString()))
            .retryWhen(Retry.from(signals -> signals.concatMap(signal ->
                Mono.delay(JitterBackoff.next(signal.totalRetriesInARow())))))
            .subscribe(
                change -> {
                },
                err -> log.error("Order change feed terminated", err)
            );
    }
}
