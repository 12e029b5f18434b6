package com.qqsuccubus.fleet.core.error;

import lombok.Getter;

/**
 * Thrown when a state write carries a version that is not newer than the stored one.
 * The caller should re-pull and retry with a fresh version.
 */
@Getter
public class StaleVersionException extends CoordinationException {

    private final String nodeId;
    private final long attemptedVersion;
    private final long storedVersion;

    public StaleVersionException(String nodeId, long attemptedVersion, long storedVersion) {
        super(String.format("Stale state version for node %s: attempted %d, stored %d",
            nodeId, attemptedVersion, storedVersion));
        this.nodeId = nodeId;
        this.attemptedVersion = attemptedVersion;
        this.storedVersion = storedVersion;
    }
}
