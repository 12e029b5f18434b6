package com.qqsuccubus.fleet.coordinator.metrics;

import com.qqsuccubus.fleet.coordinator.registry.INodeRegistry;
import com.qqsuccubus.fleet.coordinator.state.StateManager;
import com.qqsuccubus.fleet.core.metrics.MetricsNames;
import com.qqsuccubus.fleet.core.metrics.MetricsTags;
import com.qqsuccubus.fleet.core.model.ClusterMetricsSnapshot;
import com.qqsuccubus.fleet.core.model.NodeRecord;
import com.qqsuccubus.fleet.core.model.NodeStatus;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

import java.time.Clock;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregates registry and state views into health snapshots, and exposes the
 * node counts as gauges.
 */
public class ClusterMetricsService {
    private final INodeRegistry registry;
    private final StateManager stateManager;
    private final Clock clock;

    public ClusterMetricsService(INodeRegistry registry,
                                 StateManager stateManager,
                                 MeterRegistry meterRegistry,
                                 Clock clock) {
        this.registry = registry;
        this.stateManager = stateManager;
        this.clock = clock;

        registerNodeGauge(meterRegistry, NodeStatus.ACTIVE);
        registerNodeGauge(meterRegistry, NodeStatus.DRAINING);
    }

    /**
     * Computes a snapshot from one consistent registry copy.
     * Load percentiles use the nearest-rank method over every registered node.
     */
    public ClusterMetricsSnapshot snapshot() {
        List<NodeRecord> nodes = registry.snapshotAll();

        Map<NodeStatus, Integer> byStatus = new EnumMap<>(NodeStatus.class);
        for (NodeStatus status : NodeStatus.values()) {
            byStatus.put(status, 0);
        }
        nodes.forEach(node -> byStatus.merge(node.getStatus(), 1, Integer::sum));

        double[] loads = nodes.stream()
            .mapToDouble(NodeRecord::getLoad)
            .sorted()
            .toArray();
        double average = Arrays.stream(loads).average().orElse(0.0);

        return ClusterMetricsSnapshot.builder()
            .takenAt(clock.instant())
            .nodeCount(nodes.size())
            .nodesByStatus(Map.copyOf(byStatus))
            .averageLoad(average)
            .p50Load(percentile(loads, 50))
            .p95Load(percentile(loads, 95))
            .p99Load(percentile(loads, 99))
            .poolUtilization((double) byStatus.get(NodeStatus.ACTIVE) / registry.getMaxNodes())
            .stateEntries(stateManager.size())
            .build();
    }

    /**
     * Nearest-rank percentile of an ascending array; 0 when empty.
     */
    static double percentile(double[] sorted, int p) {
        if (sorted.length == 0) {
            return 0.0;
        }
        int rank = (int) Math.ceil(p / 100.0 * sorted.length);
        int index = Math.min(Math.max(rank - 1, 0), sorted.length - 1);
        return sorted[index];
    }

    private void registerNodeGauge(MeterRegistry meterRegistry, NodeStatus status) {
        Gauge.builder(MetricsNames.REGISTRY_NODES, registry, r -> countByStatus(r, status))
            .tag(MetricsTags.STATUS, status.name().toLowerCase())
            .description("Nodes held by the registry")
            .register(meterRegistry);
    }

    private static double countByStatus(INodeRegistry registry, NodeStatus status) {
        return registry.snapshotAll().stream()
            .filter(node -> node.getStatus() == status)
            .count();
    }
}
