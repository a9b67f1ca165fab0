package com.tablecast.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of change reported by the order change feed.
 */
public enum ChangeKind {
    ADDED,
    MODIFIED,
    REMOVED;

    @JsonCreator
    public static ChangeKind fromWire(String value) {
        if (value == null) {
            return null;
        }
        return ChangeKind.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    @JsonValue
    public String toWire() {
        return name().toLowerCase(Locale.ROOT);
    }
}
