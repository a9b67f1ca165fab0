package com.tablecast.core.topic;

import java.util.Arrays;
import java.util.Optional;

/**
 * Independent group spaces a connection can subscribe in.
 * <p>
 * A connection holds at most one key per namespace, but may hold keys in
 * several namespaces at once.
 * </p>
 */
public enum Namespace {
    /**
     * Customer order tracking, keyed by tracking id.
     */
    TRACKING("tracking"),

    /**
     * Kitchen display screens, keyed by branch name.
     */
    BRANCH("branch"),

    /**
     * Table screens, keyed by {@code slug:mesaId}.
     */
    MESA("mesa");

    private final String wireName;

    Namespace(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<Namespace> fromWireName(String name) {
        return Arrays.stream(values())
            .filter(ns -> ns.wireName.equals(name))
            .findFirst();
    }
}
