package com.qqsuccubus.fleet.core.model;

/**
 * Lifecycle status of a cluster member.
 */
public enum NodeStatus {
    /**
     * Accepting new work.
     */
    ACTIVE,

    /**
     * Finishing existing work; never selected for new placements.
     */
    DRAINING,

    /**
     * Lost (heartbeat timeout, drain completion or explicit unregistration).
     * Only ever seen on records carried by lifecycle events, never in the registry.
     */
    DEAD
}
