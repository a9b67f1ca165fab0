package com.tablecast.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    /**
     * Tag key for hub instance identifier.
     */
    public static final String NODE_ID = "node_id";

    /**
     * Tag key for topic namespace (tracking/branch/mesa/all).
     */
    public static final String NAMESPACE = "namespace";

    /**
     * Tag key for trigger type.
     */
    public static final String TYPE = "type";

    /**
     * Tag key for skip/failure reason.
     */
    public static final String REASON = "reason";

    public static final String OUTCOME = "outcome";

}
