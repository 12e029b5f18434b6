package com.qqsuccubus.fleet.coordinator.state;

import com.qqsuccubus.fleet.coordinator.registry.INodeRegistry;
import com.qqsuccubus.fleet.coordinator.registry.NodeLossListener;
import com.qqsuccubus.fleet.core.error.NodeNotFoundException;
import com.qqsuccubus.fleet.core.error.StaleVersionException;
import com.qqsuccubus.fleet.core.metrics.MetricsNames;
import com.qqsuccubus.fleet.core.metrics.MetricsTags;
import com.qqsuccubus.fleet.core.model.DivergenceReport;
import com.qqsuccubus.fleet.core.model.NodeRecord;
import com.qqsuccubus.fleet.core.model.NodeStatus;
import com.qqsuccubus.fleet.core.model.StateEntry;
import com.qqsuccubus.fleet.core.util.Hashers;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Best-effort store of one versioned state blob per node.
 * <p>
 * Writes are last-writer-wins by version. There is no consensus: divergence is
 * tolerated and reported by {@link #consistencyCheck()}, which also collects state
 * left behind by lost nodes.
 * </p>
 */
public class StateManager implements NodeLossListener {
    private static final Logger log = LoggerFactory.getLogger(StateManager.class);

    /**
     * Highest version first; equal versions resolved by latest write.
     */
    private static final Comparator<StateEntry> PRECEDENCE = Comparator
        .comparingLong(StateEntry::getVersion)
        .thenComparing(StateEntry::getWrittenAt);

    private final INodeRegistry registry;
    private final Clock clock;

    // nodeId -> entry
    private final Map<String, StateEntry> states = new ConcurrentHashMap<>();

    private final Counter staleWrites;
    private final Counter orphansFound;
    private final Counter conflictsFound;

    public StateManager(INodeRegistry registry, Clock clock, MeterRegistry meterRegistry) {
        this.registry = registry;
        this.clock = clock;

        Gauge.builder(MetricsNames.STATE_ENTRIES, states, Map::size)
            .register(meterRegistry);
        staleWrites = Counter.builder(MetricsNames.STATE_STALE_WRITES_TOTAL)
            .register(meterRegistry);
        orphansFound = Counter.builder(MetricsNames.STATE_DIVERGENCES_TOTAL)
            .tag(MetricsTags.TYPE, "orphaned")
            .register(meterRegistry);
        conflictsFound = Counter.builder(MetricsNames.STATE_DIVERGENCES_TOTAL)
            .tag(MetricsTags.TYPE, "conflict")
            .register(meterRegistry);
    }

    /**
     * Stores state for a node that claims no logical resource.
     *
     * @see #pushState(String, String, byte[], long)
     */
    public StateEntry pushState(String nodeId, byte[] payload, long version) {
        return pushState(nodeId, null, payload, version);
    }

    /**
     * Stores a new state blob for {@code nodeId}.
     *
     * @param nodeId      Owning node, must be registered
     * @param resourceKey Logical resource the blob claims, or null
     * @param payload     Opaque bytes, copied
     * @param version     Must exceed the stored version
     * @return the stored entry
     * @throws NodeNotFoundException  if the registry holds no live record for the node
     * @throws StaleVersionException  if {@code version} is not newer than the stored one
     */
    public StateEntry pushState(String nodeId, String resourceKey, byte[] payload, long version) {
        Objects.requireNonNull(payload, "payload");
        NodeRecord owner = registry.get(nodeId)
            .filter(record -> record.getStatus() != NodeStatus.DEAD)
            .orElseThrow(() -> new NodeNotFoundException(nodeId));
        long incarnation = owner.getIncarnation();

        byte[] copy = payload.clone();
        StateEntry stored = states.compute(nodeId, (id, existing) -> {
            if (existing != null && existing.getIncarnation() > incarnation) {
                // The node re-registered while this write was in flight
                throw new NodeNotFoundException(id);
            }
            // Orphans and entries of a previous incarnation never block a write
            if (existing != null && !existing.isOrphaned()
                && existing.getIncarnation() == incarnation && version <= existing.getVersion()) {
                staleWrites.increment();
                throw new StaleVersionException(id, version, existing.getVersion());
            }
            return StateEntry.builder()
                .nodeId(id)
                .incarnation(incarnation)
                .resourceKey(resourceKey)
                .payload(copy)
                .version(version)
                .digest(Hashers.sha256Hex(copy))
                .writtenAt(clock.instant())
                .orphaned(false)
                .build();
        });

        log.debug("Stored state for node {} (version {}, {} bytes)", nodeId, version, copy.length);
        return stored;
    }

    /**
     * @return current state of the node, or empty if none or orphaned
     */
    public Optional<StateEntry> pullState(String nodeId) {
        return Optional.ofNullable(states.get(nodeId))
            .filter(entry -> !entry.isOrphaned());
    }

    /**
     * Compares {@code payload} against the stored digest.
     *
     * @return true if the node has state and its digest matches
     */
    public boolean verifyConsistency(String nodeId, byte[] payload) {
        String digest = Hashers.sha256Hex(payload);
        return pullState(nodeId)
            .map(entry -> entry.getDigest().equals(digest))
            .orElse(false);
    }

    /**
     * Winning entry among live claims on {@code resourceKey}.
     */
    public Optional<StateEntry> resolve(String resourceKey) {
        Objects.requireNonNull(resourceKey, "resourceKey");
        return states.values().stream()
            .filter(entry -> !entry.isOrphaned())
            .filter(entry -> resourceKey.equals(entry.getResourceKey()))
            .max(PRECEDENCE);
    }

    /**
     * Orphans the state written by {@code record}'s incarnation or an earlier one.
     * State already written by a newer incarnation of the same id is left alone.
     */
    @Override
    public void onNodeLost(NodeRecord record, String reason) {
        StateEntry entry = states.computeIfPresent(record.getNodeId(),
            (id, current) -> current.getIncarnation() <= record.getIncarnation() ? current.withOrphaned(true) : current);
        if (entry != null && entry.isOrphaned()) {
            log.info("State of node {} orphaned ({}), collected at next consistency check",
                record.getNodeId(), reason);
        }
    }

    /**
     * Cross-checks stored state against the live registry.
     * <p>
     * Orphans (owner absent, dead, lost or re-registered since the write) are
     * reported and removed. Live entries
     * of different nodes claiming the same resource with differing versions or
     * contents are reported as conflicts naming the winner; they are left in place.
     * </p>
     *
     * @return divergence reports, orphans first, each group ordered by node id / resource key
     */
    public List<DivergenceReport> consistencyCheck() {
        // Entries first, so none of them is newer than the registry snapshot
        List<StateEntry> entries = new ArrayList<>(states.values());
        entries.sort(Comparator.comparing(StateEntry::getNodeId));

        // nodeId -> incarnation of every live record
        Map<String, Long> liveNodes = registry.snapshotAll().stream()
            .filter(record -> record.getStatus() != NodeStatus.DEAD)
            .collect(Collectors.toMap(NodeRecord::getNodeId, NodeRecord::getIncarnation));

        List<DivergenceReport> reports = new ArrayList<>();
        Map<String, List<StateEntry>> claims = new TreeMap<>();

        for (StateEntry entry : entries) {
            Long liveIncarnation = liveNodes.get(entry.getNodeId());
            if (entry.isOrphaned() || liveIncarnation == null || liveIncarnation > entry.getIncarnation()) {
                // Only collect the exact entry we inspected; a fresh push wins
                if (states.remove(entry.getNodeId(), entry)) {
                    orphansFound.increment();
                    reports.add(DivergenceReport.builder()
                        .kind(DivergenceReport.Kind.ORPHANED)
                        .nodeId(entry.getNodeId())
                        .resourceKey(entry.getResourceKey())
                        .version(entry.getVersion())
                        .detail("owning node incarnation gone; state collected")
                        .build());
                }
                continue;
            }
            if (entry.getResourceKey() != null) {
                claims.computeIfAbsent(entry.getResourceKey(), key -> new ArrayList<>()).add(entry);
            }
        }

        claims.forEach((resourceKey, claimants) -> findConflict(resourceKey, claimants).ifPresent(report -> {
            conflictsFound.increment();
            reports.add(report);
        }));

        if (!reports.isEmpty()) {
            log.warn("Consistency check found {} divergences: {}", reports.size(), reports);
        }
        return reports;
    }

    public int size() {
        return states.size();
    }

    private Optional<DivergenceReport> findConflict(String resourceKey, List<StateEntry> claimants) {
        if (claimants.size() < 2) {
            return Optional.empty();
        }
        long distinct = claimants.stream()
            .map(entry -> entry.getVersion() + "/" + entry.getDigest())
            .distinct()
            .count();
        if (distinct < 2) {
            return Optional.empty();
        }

        StateEntry winner = claimants.stream().max(PRECEDENCE).orElseThrow();
        List<String> losers = claimants.stream()
            .filter(entry -> entry != winner)
            .map(StateEntry::getNodeId)
            .sorted()
            .collect(Collectors.toList());

        return Optional.of(DivergenceReport.builder()
            .kind(DivergenceReport.Kind.CONFLICT)
            .nodeId(winner.getNodeId())
            .resourceKey(resourceKey)
            .losingNodeIds(losers)
            .version(winner.getVersion())
            .detail(String.format("%d nodes claim %s; highest version %d wins",
                claimants.size(), resourceKey, winner.getVersion()))
            .build());
    }
}
