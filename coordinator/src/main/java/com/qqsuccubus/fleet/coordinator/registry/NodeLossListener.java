package com.qqsuccubus.fleet.coordinator.registry;

import com.qqsuccubus.fleet.core.model.NodeRecord;

/**
 * Notified after a node has been removed from the registry.
 */
@FunctionalInterface
public interface NodeLossListener {

    /**
     * @param record Last known record, with status {@code DEAD}
     * @param reason Why the node was removed, e.g. "heartbeat-timeout"
     */
    void onNodeLost(NodeRecord record, String reason);
}
