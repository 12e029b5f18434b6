package com.qqsuccubus.fleet.coordinator.balance;

import com.qqsuccubus.fleet.coordinator.registry.INodeRegistry;
import com.qqsuccubus.fleet.coordinator.registry.NodeLossListener;
import com.qqsuccubus.fleet.core.error.NoEligibleNodeException;
import com.qqsuccubus.fleet.core.metrics.MetricsNames;
import com.qqsuccubus.fleet.core.metrics.MetricsTags;
import com.qqsuccubus.fleet.core.model.NodeRecord;
import com.qqsuccubus.fleet.core.model.PlacementRequest;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Greedy least-loaded placement.
 * <p>
 * Every decision reads exactly one registry snapshot: candidates are the
 * {@code ACTIVE} nodes whose capabilities are a superset of the request, the
 * lowest load wins and ties go to the smallest node id.
 * </p>
 */
public class LoadBalancer implements ILoadBalancer, NodeLossListener {
    private static final Logger log = LoggerFactory.getLogger(LoadBalancer.class);

    private static final Comparator<NodeRecord> LEAST_LOADED = Comparator
        .comparingDouble(NodeRecord::getLoad)
        .thenComparing(NodeRecord::getNodeId);

    private final INodeRegistry registry;

    // taskId -> placement
    private final Map<String, Placement> placements = new ConcurrentHashMap<>();

    private final Counter selected;
    private final Counter noEligibleNode;
    private final Counter invalidated;

    public LoadBalancer(INodeRegistry registry, MeterRegistry meterRegistry) {
        this.registry = registry;

        selected = Counter.builder(MetricsNames.PLACEMENTS_TOTAL)
            .tag(MetricsTags.OUTCOME, "selected")
            .register(meterRegistry);
        noEligibleNode = Counter.builder(MetricsNames.PLACEMENTS_TOTAL)
            .tag(MetricsTags.OUTCOME, "no_eligible_node")
            .register(meterRegistry);
        invalidated = Counter.builder(MetricsNames.PLACEMENTS_INVALIDATED_TOTAL)
            .register(meterRegistry);
    }

    @Override
    public String selectNode(Set<String> requiredCapabilities) {
        return selectNode(PlacementRequest.of(requiredCapabilities));
    }

    @Override
    public String selectNode(PlacementRequest request) {
        Set<String> required = request.getRequiredCapabilities() == null
            ? Set.of()
            : request.getRequiredCapabilities();

        Optional<NodeRecord> best = choose(registry.snapshotAll(), required);
        if (best.isEmpty()) {
            noEligibleNode.increment();
            log.warn("No eligible node for capabilities {}", required);
            throw new NoEligibleNodeException(required);
        }

        NodeRecord node = best.get();
        selected.increment();
        log.debug("Selected node {} (load={}) for capabilities {}", node.getNodeId(), node.getLoad(), required);

        if (request.getTaskId() != null) {
            Placement placement = new Placement(node.getNodeId(), node.getIncarnation());
            placements.put(request.getTaskId(), placement);
            // The node may have been evicted or re-registered after our snapshot
            boolean sameIncarnation = registry.get(node.getNodeId())
                .map(current -> current.getIncarnation() == node.getIncarnation())
                .orElse(false);
            if (!sameIncarnation) {
                placements.remove(request.getTaskId(), placement);
            }
        }
        return node.getNodeId();
    }

    @Override
    public Optional<String> placementOf(String taskId) {
        return Optional.ofNullable(placements.get(taskId)).map(Placement::getNodeId);
    }

    /**
     * Forgets a tracked placement once its task is done.
     *
     * @return true if the task was tracked
     */
    public boolean releasePlacement(String taskId) {
        return placements.remove(taskId) != null;
    }

    public int placementCount() {
        return placements.size();
    }

    @Override
    public void onNodeLost(NodeRecord record, String reason) {
        List<String> tasks = invalidatePlacements(record.getNodeId(), record.getIncarnation());
        if (!tasks.isEmpty()) {
            log.info("Invalidated {} placements on lost node {} ({}): {}",
                tasks.size(), record.getNodeId(), reason, tasks);
        }
    }

    /**
     * Drops every placement on {@code nodeId}, whatever incarnation it was made on.
     *
     * @return the task ids whose placement was invalidated
     */
    public List<String> invalidatePlacements(String nodeId) {
        return invalidatePlacements(nodeId, Long.MAX_VALUE);
    }

    /**
     * Drops the placements made on {@code nodeId} up to and including {@code incarnation}.
     * Placements on a later incarnation of the same id survive.
     *
     * @return the task ids whose placement was invalidated
     */
    public List<String> invalidatePlacements(String nodeId, long incarnation) {
        List<String> tasks = new ArrayList<>();
        placements.forEach((taskId, placement) -> {
            if (placement.getNodeId().equals(nodeId)
                && placement.getIncarnation() <= incarnation
                && placements.remove(taskId, placement)) {
                tasks.add(taskId);
            }
        });
        invalidated.increment(tasks.size());
        return tasks;
    }

    /**
     * Applies the selection policy to a snapshot.
     */
    static Optional<NodeRecord> choose(Collection<NodeRecord> snapshot, Set<String> required) {
        return snapshot.stream()
            .filter(NodeRecord::isActive)
            .filter(node -> node.hasCapabilities(required))
            .min(LEAST_LOADED);
    }

    @Value
    private static class Placement {
        String nodeId;
        long incarnation;
    }
}
