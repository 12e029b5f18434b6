package com.qqsuccubus.fleet.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    public static final String NODE_ID = "node_id";

    public static final String STATUS = "status";

    public static final String REASON = "reason";

    public static final String OUTCOME = "outcome";

    public static final String TYPE = "type";

    public static final String ACTION = "action";

    public static final String TASK = "task";
}
