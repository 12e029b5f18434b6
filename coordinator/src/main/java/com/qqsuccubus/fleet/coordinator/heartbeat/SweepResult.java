package com.qqsuccubus.fleet.coordinator.heartbeat;

import lombok.Value;

import java.util.Map;

/**
 * Outcome of one liveness sweep.
 */
@Value
public class SweepResult {
    /**
     * Number of records inspected.
     */
    int checked;

    /**
     * Evicted node id to eviction reason, in eviction order.
     */
    Map<String, String> evictions;

    /**
     * Records whose check failed and was skipped.
     */
    int failures;

    public boolean evicted(String nodeId) {
        return evictions.containsKey(nodeId);
    }
}
