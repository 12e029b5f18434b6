package com.qqsuccubus.fleet.coordinator.registry;

import com.qqsuccubus.fleet.core.model.NodeRecord;
import lombok.Value;

import java.util.Optional;

/**
 * Outcome of registering a node under a caller-chosen id.
 */
@Value
public class Registration {
    NodeRecord record;

    /**
     * Record that was replaced, or null for a first registration.
     */
    NodeRecord replaced;

    public Optional<NodeRecord> replacedRecord() {
        return Optional.ofNullable(replaced);
    }
}
