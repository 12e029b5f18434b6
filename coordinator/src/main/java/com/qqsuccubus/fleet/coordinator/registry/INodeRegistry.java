package com.qqsuccubus.fleet.coordinator.registry;

import com.qqsuccubus.fleet.core.model.NodeRecord;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the node registry (Dependency Inversion Principle).
 * <p>
 * Components other than the coordinator only ever see immutable copies.
 * </p>
 */
public interface INodeRegistry {

    /**
     * Point-in-time copy of one record.
     */
    Optional<NodeRecord> get(String nodeId);

    /**
     * Consistent point-in-time copy of every record, sorted by node id.
     */
    List<NodeRecord> snapshotAll();

    int size();

    int getMaxNodes();
}
