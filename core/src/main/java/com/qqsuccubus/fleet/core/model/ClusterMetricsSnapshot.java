package com.qqsuccubus.fleet.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Point-in-time health view exposed to dashboards and metrics collectors.
 */
@Value
@Builder
public class ClusterMetricsSnapshot {
    @JsonProperty("takenAt")
    Instant takenAt;

    @JsonProperty("nodeCount")
    int nodeCount;

    @JsonProperty("nodesByStatus")
    Map<NodeStatus, Integer> nodesByStatus;

    @JsonProperty("averageLoad")
    double averageLoad;

    @JsonProperty("p50Load")
    double p50Load;

    @JsonProperty("p95Load")
    double p95Load;

    @JsonProperty("p99Load")
    double p99Load;

    /**
     * Active nodes divided by the configured maximum.
     */
    @JsonProperty("poolUtilization")
    double poolUtilization;

    @JsonProperty("stateEntries")
    int stateEntries;

    public int countOf(NodeStatus status) {
        return nodesByStatus.getOrDefault(status, 0);
    }

    @Override
    public String toString() {
        return String.format(
            "ClusterMetricsSnapshot{nodes=%d, active=%d, draining=%d, avgLoad=%.2f, p95Load=%.2f, utilization=%.1f%%, states=%d}",
            nodeCount, countOf(NodeStatus.ACTIVE), countOf(NodeStatus.DRAINING),
            averageLoad, p95Load, poolUtilization * 100, stateEntries
        );
    }
}
