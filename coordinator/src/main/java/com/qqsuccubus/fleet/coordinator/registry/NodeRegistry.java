package com.qqsuccubus.fleet.coordinator.registry;

import com.google.common.base.Ticker;
import com.qqsuccubus.fleet.core.error.CapacityExceededException;
import com.qqsuccubus.fleet.core.error.NodeNotFoundException;
import com.qqsuccubus.fleet.core.model.NodeAddress;
import com.qqsuccubus.fleet.core.model.NodeRecord;
import com.qqsuccubus.fleet.core.model.NodeStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Authoritative in-memory mapping of node id to node record.
 * <p>
 * All mutations are serialized under one registry-wide write lock; reads share the
 * read lock. Records are immutable and replaced on every change, so snapshots are
 * plain copies of the current values.
 * </p>
 */
public class NodeRegistry implements INodeRegistry {
    private static final Logger log = LoggerFactory.getLogger(NodeRegistry.class);

    private final int maxNodes;
    private final Ticker ticker;
    private final Clock clock;

    private final Map<String, NodeRecord> nodes = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    // guarded by lock
    private long lastIncarnation;

    public NodeRegistry(int maxNodes, Ticker ticker, Clock clock) {
        if (maxNodes <= 0) {
            throw new IllegalArgumentException("maxNodes must be positive");
        }
        this.maxNodes = maxNodes;
        this.ticker = ticker;
        this.clock = clock;
    }

    /**
     * Registers a node under a freshly allocated id.
     *
     * @param address      Where the node is reachable
     * @param capabilities Declared capability tags
     * @return the new node id
     * @throws CapacityExceededException if the registry already holds {@code maxNodes} records
     */
    public String register(NodeAddress address, Set<String> capabilities) {
        String nodeId = UUID.randomUUID().toString();
        return register(nodeId, address, capabilities).getRecord().getNodeId();
    }

    /**
     * Registers a node under a caller-chosen id.
     * <p>
     * An existing record with the same id is replaced by a brand-new {@code ACTIVE}
     * record with a higher incarnation; nothing is carried over.
     * </p>
     *
     * @return the stored record together with the one it replaced, if any
     * @throws CapacityExceededException if the id is new and the registry is full
     */
    public Registration register(String nodeId, NodeAddress address, Set<String> capabilities) {
        Objects.requireNonNull(nodeId, "nodeId");
        Objects.requireNonNull(address, "address");

        lock.writeLock().lock();
        try {
            NodeRecord previous = nodes.get(nodeId);
            boolean replacing = previous != null;
            if (!replacing && nodes.size() >= maxNodes) {
                throw new CapacityExceededException(maxNodes);
            }

            NodeRecord record = NodeRecord.builder()
                .nodeId(nodeId)
                .address(address)
                .capabilities(copyCapabilities(capabilities))
                .load(0.0)
                .memoryUsage(0.0)
                .status(NodeStatus.ACTIVE)
                .lastHeartbeatNanos(ticker.read())
                .registeredAt(clock.instant())
                .incarnation(++lastIncarnation)
                .build();
            nodes.put(nodeId, record);

            log.info("{} node {} at {} with capabilities {}",
                replacing ? "Re-registered" : "Registered", nodeId, address, record.getCapabilities());
            return new Registration(record, previous);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes a node. Idempotent.
     *
     * @return the removed record, or empty if it was already absent
     */
    public Optional<NodeRecord> unregister(String nodeId) {
        lock.writeLock().lock();
        try {
            NodeRecord removed = nodes.remove(nodeId);
            if (removed != null) {
                log.info("Unregistered node {}", nodeId);
            }
            return Optional.ofNullable(removed);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes a node only if it still satisfies {@code condition}, evaluated under the
     * write lock. Used by eviction so a heartbeat that lands after a sweep's snapshot
     * keeps the node alive.
     *
     * @return the removed record, or empty if absent or the condition no longer holds
     */
    public Optional<NodeRecord> removeIf(String nodeId, Predicate<NodeRecord> condition) {
        lock.writeLock().lock();
        try {
            NodeRecord current = nodes.get(nodeId);
            if (current == null || !condition.test(current)) {
                return Optional.empty();
            }
            nodes.remove(nodeId);
            return Optional.of(current);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<NodeRecord> get(String nodeId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(nodes.get(nodeId));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Records a status report: updates load and status and stamps the heartbeat.
     * Memory usage is left unchanged.
     *
     * @throws NodeNotFoundException if the id is absent
     */
    public NodeRecord updateStatus(String nodeId, double load, NodeStatus status) {
        return applyStatusReport(nodeId, load, null, status);
    }

    /**
     * Records a status report including memory usage.
     *
     * @throws NodeNotFoundException if the id is absent
     */
    public NodeRecord updateStatus(String nodeId, double load, double memoryUsage, NodeStatus status) {
        if (!(memoryUsage >= 0 && memoryUsage <= 100)) {
            throw new IllegalArgumentException("memoryUsage must be in [0, 100], was " + memoryUsage);
        }
        return applyStatusReport(nodeId, load, memoryUsage, status);
    }

    /**
     * Replaces the capability set of a node. Does not count as a heartbeat.
     *
     * @throws NodeNotFoundException if the id is absent
     */
    public NodeRecord updateCapabilities(String nodeId, Set<String> capabilities) {
        Set<String> copy = copyCapabilities(capabilities);
        return mutate(nodeId, current -> current.withCapabilities(copy));
    }

    /**
     * Moves a node to {@code DRAINING} without touching its heartbeat. Idempotent.
     *
     * @throws NodeNotFoundException if the id is absent
     */
    public NodeRecord markDraining(String nodeId) {
        return mutate(nodeId, current -> current.isDraining()
            ? current
            : current.toBuilder()
                .status(NodeStatus.DRAINING)
                .drainingSinceNanos(ticker.read())
                .build());
    }

    @Override
    public List<NodeRecord> snapshotAll() {
        lock.readLock().lock();
        try {
            List<NodeRecord> snapshot = new ArrayList<>(nodes.values());
            snapshot.sort(Comparator.comparing(NodeRecord::getNodeId));
            return List.copyOf(snapshot);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            return nodes.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int getMaxNodes() {
        return maxNodes;
    }

    private NodeRecord applyStatusReport(String nodeId, double load, Double memoryUsage, NodeStatus status) {
        Objects.requireNonNull(status, "status");
        if (status == NodeStatus.DEAD) {
            throw new IllegalArgumentException("DEAD is assigned by eviction or unregistration, not reported");
        }
        if (!(load >= 0) || Double.isInfinite(load)) {
            throw new IllegalArgumentException("load must be a finite value >= 0, was " + load);
        }

        return mutate(nodeId, current -> {
            long now = ticker.read();
            NodeRecord.NodeRecordBuilder next = current.toBuilder()
                .load(load)
                .status(status)
                .lastHeartbeatNanos(Math.max(current.getLastHeartbeatNanos(), now));
            if (memoryUsage != null) {
                next.memoryUsage(memoryUsage);
            }
            if (status == NodeStatus.DRAINING && current.getDrainingSinceNanos() == null) {
                next.drainingSinceNanos(now);
            } else if (status == NodeStatus.ACTIVE) {
                next.drainingSinceNanos(null);
            }
            return next.build();
        });
    }

    private NodeRecord mutate(String nodeId, UnaryOperator<NodeRecord> change) {
        lock.writeLock().lock();
        try {
            NodeRecord current = nodes.get(nodeId);
            if (current == null) {
                throw new NodeNotFoundException(nodeId);
            }
            NodeRecord updated = change.apply(current);
            nodes.put(nodeId, updated);
            return updated;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private static Set<String> copyCapabilities(Set<String> capabilities) {
        return capabilities == null ? Set.of() : Set.copyOf(capabilities);
    }
}
