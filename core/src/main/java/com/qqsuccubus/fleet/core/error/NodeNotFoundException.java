package com.qqsuccubus.fleet.core.error;

import lombok.Getter;

/**
 * Thrown when an operation references a node id the registry does not hold.
 * The caller should retry or re-register.
 */
@Getter
public class NodeNotFoundException extends CoordinationException {

    private final String nodeId;

    public NodeNotFoundException(String nodeId) {
        super("Node not found: " + nodeId);
        this.nodeId = nodeId;
    }
}
