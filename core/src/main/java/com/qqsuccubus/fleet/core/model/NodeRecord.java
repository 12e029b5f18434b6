package com.qqsuccubus.fleet.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;
import java.util.Set;

/**
 * Immutable view of one cluster member.
 * <p>
 * The registry never hands out live references: every mutation replaces the
 * stored record with a new instance, so a record obtained from a snapshot can be
 * read from any thread without further synchronization.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
public class NodeRecord {
    /**
     * Opaque unique identifier, assigned at registration.
     */
    String nodeId;

    /**
     * Where the node is reachable. Immutable once registered.
     */
    NodeAddress address;

    /**
     * Capability tags declared by the node.
     */
    Set<String> capabilities;

    /**
     * Current utilization, 0 or more. Interpreted as a percentage by the optimizer.
     */
    double load;

    /**
     * Memory utilization percentage in [0, 100].
     */
    double memoryUsage;

    NodeStatus status;

    /**
     * Monotonic timestamp (nanoseconds) of the last status report.
     */
    long lastHeartbeatNanos;

    /**
     * Wall-clock registration time.
     */
    Instant registeredAt;

    /**
     * Registry-wide sequence number of the registration that created this record.
     * A re-registration under the same id yields a higher value.
     */
    long incarnation;

    /**
     * Monotonic timestamp at which the node entered {@link NodeStatus#DRAINING}, or null.
     */
    Long drainingSinceNanos;

    public boolean isActive() {
        return status == NodeStatus.ACTIVE;
    }

    public boolean isDraining() {
        return status == NodeStatus.DRAINING;
    }

    /**
     * @return true if this node declares every tag in {@code required}
     */
    public boolean hasCapabilities(Set<String> required) {
        return capabilities.containsAll(required);
    }

    public long heartbeatAgeNanos(long nowNanos) {
        return nowNanos - lastHeartbeatNanos;
    }
}
