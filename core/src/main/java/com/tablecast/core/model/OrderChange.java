package com.tablecast.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * One notification from the order change feed: the full record plus what happened to it.
 */
@Value
public class OrderChange {
    @JsonProperty("kind")
    ChangeKind kind;

    @JsonProperty("order")
    OrderRecord order;

    @Builder(toBuilder = true)
    @JsonCreator
    public OrderChange(
        @JsonProperty("kind") ChangeKind kind,
        @JsonProperty("order") OrderRecord order
    ) {
        this.kind = kind;
        this.order = order;
    }

    /**
     * Added and modified records are fanned out; removals are not.
     */
    @JsonIgnore
    public boolean isUpsert() {
        return kind == ChangeKind.ADDED || kind == ChangeKind.MODIFIED;
    }
}
