package com.tablecast.core.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An order document as stored by the ordering platform.
 * <p>
 * The hub does not own the order schema: every attribute is kept and re-serialized
 * as received, so kitchen screens get the full record. Only the handful of fields the
 * hub routes on have typed accessors.
 * </p>
 */
@EqualsAndHashCode
@ToString
public class OrderRecord {

    /**
     * Status reported in the snapshot when the stored order has none.
     */
    public static final String DEFAULT_STATUS = "preparing";

    private final Map<String, Object> attributes = new LinkedHashMap<>();

    public OrderRecord() {
    }

    public OrderRecord(Map<String, ?> attributes) {
        this.attributes.putAll(attributes);
    }

    @JsonAnySetter
    public void set(String name, Object value) {
        attributes.put(name, value);
    }

    @JsonAnyGetter
    public Map<String, Object> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    @JsonIgnore
    public String getId() {
        return text("id");
    }

    @JsonIgnore
    public String getTrackingId() {
        return text("trackingId");
    }

    @JsonIgnore
    public String getBranch() {
        return text("branch");
    }

    @JsonIgnore
    public String getStatus() {
        return text("status");
    }

    @JsonIgnore
    public String getStatusOrDefault() {
        String status = getStatus();
        return status == null || status.isEmpty() ? DEFAULT_STATUS : status;
    }

    private String text(String name) {
        Object value = attributes.get(name);
        return value == null ? null : value.toString();
    }
}
