package com.qqsuccubus.fleet.core.error;

import lombok.Getter;

/**
 * Thrown when the registry already holds the configured maximum number of nodes.
 * The caller should wait for capacity.
 */
@Getter
public class CapacityExceededException extends CoordinationException {

    private final int maxNodes;

    public CapacityExceededException(int maxNodes) {
        super("Registry is at capacity (" + maxNodes + " nodes)");
        this.maxNodes = maxNodes;
    }
}
