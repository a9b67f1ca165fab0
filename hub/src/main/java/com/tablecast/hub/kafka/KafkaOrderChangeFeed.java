package com.tablecast.hub.kafka;

import com.tablecast.core.model.OrderChange;
import com.tablecast.core.util.JsonUtils;
import com.tablecast.hub.config.HubConfig;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.kafka.receiver.KafkaReceiver;
import reactor.kafka.receiver.ReceiverOptions;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Order change feed read from the {@code orders.changes} Kafka topic.
 * <p>
 * Each record value is {@code {"kind": "added|modified|removed", "order": {...}}}.
 * Only orders whose status is in the active set pass; bad records are logged and skipped.
 * Every hub instance consumes the whole topic (its own consumer group), starting at the
 * latest offset: clients only care about changes from now on.
 * </p>
 */
public class KafkaOrderChangeFeed implements IOrderChangeFeed {
    private static final Logger log = LoggerFactory.getLogger(KafkaOrderChangeFeed.class);

    private final Set<String> activeStatuses;
    private final KafkaReceiver<String, String> receiver;

    public KafkaOrderChangeFeed(HubConfig config) {
        this.activeStatuses = config.getActiveStatuses();

        Map<String, Object> consumerProps = new HashMap<>();
        consumerProps.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
        consumerProps.put(ConsumerConfig.GROUP_ID_CONFIG, "hub-order-changes-" + config.getNodeId());
        consumerProps.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        consumerProps.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        consumerProps.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");

        ReceiverOptions<String, String> receiverOptions = ReceiverOptions.<String, String>create(consumerProps)
            .subscription(Collections.singleton(config.getOrderChangesTopic()));

        this.receiver = KafkaReceiver.create(receiverOptions);
        log.info("Order change feed configured on topic {} (active statuses {})",
            config.getOrderChangesTopic(), activeStatuses);
    }

    @Override
    public Flux<OrderChange> changes() {
        return receiver.receive()
            .concatMap(record -> {
                Optional<OrderChange> change = parse(record.value(), activeStatuses);
                record.receiverOffset().acknowledge();
                return Mono.justOrEmpty(change);
            });
    }

    /**
     * Parses a record value and applies the active-status filter.
     *
     * @return the change, or empty if the value is unusable or the order is not active
     */
    static Optional<OrderChange> parse(String value, Set<String> activeStatuses) {
        OrderChange change;
        try {
            change = JsonUtils.readValue(value, OrderChange.class);
        } catch (Exception e) {
            log.warn("Skipping unreadable order change record: {}", e.getMessage());
            return Optional.empty();
        }
        if (change == null || change.getKind() == null || change.getOrder() == null) {
            log.warn("Skipping order change record without kind or order: {}", value);
            return Optional.empty();
        }
        String status = change.getOrder().getStatus();
        if (status == null || !activeStatuses.contains(status)) {
            log.debug("Order {} status {} not active, skipped", change.getOrder().getId(), status);
            return Optional.empty();
        }
        return Optional.of(change);
    }

    @Override
    public void close() {
        // the receiver's consumer closes when the changes() subscription is disposed
        log.info("Order change feed closed");
    }
}
