package com.tablecast.core.topic;

import java.util.Objects;

/**
 * A namespace-scoped topic identifier, rendered as {@code <namespace>:<key>}.
 * <p>
 * Examples: {@code tracking:T1}, {@code branch:north}, {@code mesa:la-esquina:12}.
 * </p>
 *
 * @param namespace group space
 * @param key       identifier within the namespace, never blank
 */
public record TopicKey(Namespace namespace, String key) {

    public TopicKey {
        Objects.requireNonNull(namespace, "namespace");
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Topic key must not be blank for namespace " + namespace.wireName());
        }
    }

    public static TopicKey of(Namespace namespace, String key) {
        return new TopicKey(namespace, key);
    }

    public static TopicKey tracking(String trackingId) {
        return new TopicKey(Namespace.TRACKING, trackingId);
    }

    public static TopicKey branch(String branch) {
        return new TopicKey(Namespace.BRANCH, branch);
    }

    public static TopicKey mesa(String slug, String mesaId) {
        return new TopicKey(Namespace.MESA, mesaKey(slug, mesaId));
    }

    /**
     * Builds the mesa key shared by the {@code join-mesa} message, the
     * {@code /broadcast} trigger and the POS poller.
     */
    public static String mesaKey(String slug, String mesaId) {
        return slug + ":" + mesaId;
    }

    @Override
    public String toString() {
        return namespace.wireName() + ":" + key;
    }
}
