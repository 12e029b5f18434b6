package com.qqsuccubus.fleet.core.metrics;

/**
 * Micrometer metric names used across the coordinator.
 * <p>
 * <b>Naming convention:</b> {@code fleet.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Gauge: Nodes currently held by the registry.
     * <p>
     * Tags: status (active/draining)
     * </p>
     */
    public static final String REGISTRY_NODES = "fleet.registry.nodes";

    /**
     * Counter: Nodes removed from the registry.
     * <p>
     * Tags: reason (heartbeat-timeout/drained/drain-timeout/unregistered)
     * </p>
     */
    public static final String NODES_LOST_TOTAL = "fleet.nodes.lost.total";

    /**
     * Counter: Per-node failures isolated inside a heartbeat sweep.
     */
    public static final String HEARTBEAT_SWEEP_FAILURES_TOTAL = "fleet.heartbeat.sweep.failures.total";

    /**
     * Counter: Placement decisions.
     * <p>
     * Tags: outcome (selected/no_eligible_node)
     * </p>
     */
    public static final String PLACEMENTS_TOTAL = "fleet.balancer.placements.total";

    /**
     * Counter: Tracked placements invalidated because their node was lost.
     */
    public static final String PLACEMENTS_INVALIDATED_TOTAL = "fleet.balancer.placements.invalidated.total";

    /**
     * Gauge: Stored state entries, orphans included.
     */
    public static final String STATE_ENTRIES = "fleet.state.entries";

    /**
     * Counter: State writes rejected as stale.
     */
    public static final String STATE_STALE_WRITES_TOTAL = "fleet.state.stale.writes.total";

    /**
     * Counter: Divergences found by consistency checks.
     * <p>
     * Tags: type (orphaned/conflict)
     * </p>
     */
    public static final String STATE_DIVERGENCES_TOTAL = "fleet.state.divergences.total";

    /**
     * Counter: Optimizer recommendations.
     * <p>
     * Tags: action (scale_up/scale_down/none)
     * </p>
     */
    public static final String OPTIMIZER_RECOMMENDATIONS_TOTAL = "fleet.optimizer.recommendations.total";

    /**
     * Counter: Failed iterations of a background loop.
     * <p>
     * Tags: task (heartbeat/optimizer)
     * </p>
     */
    public static final String LOOP_FAILURES_TOTAL = "fleet.loop.failures.total";
}
