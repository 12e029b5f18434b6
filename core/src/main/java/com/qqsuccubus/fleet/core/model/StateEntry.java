package com.qqsuccubus.fleet.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;
import java.util.Arrays;

/**
 * Versioned state blob associated with a node.
 * <p>
 * The payload is application-defined and treated as bytes. It is copied on the
 * way in and on the way out, so callers can never mutate stored state.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
public class StateEntry {
    /**
     * Owning node. Weak reference: the entry may outlive the node record until the
     * next consistency check collects it.
     */
    String nodeId;

    /**
     * Incarnation of the owning node at the time of the write.
     */
    long incarnation;

    /**
     * Logical resource this blob claims, or null.
     */
    String resourceKey;

    byte[] payload;

    /**
     * Strictly increasing per node.
     */
    long version;

    /**
     * SHA-256 hex digest of the payload.
     */
    String digest;

    /**
     * Wall-clock time of the write; breaks ties between equal versions.
     */
    Instant writtenAt;

    /**
     * Set once the owning node is lost.
     */
    boolean orphaned;

    public byte[] getPayload() {
        return payload == null ? null : payload.clone();
    }

    public int payloadSize() {
        return payload == null ? 0 : payload.length;
    }

    @Override
    public String toString() {
        return String.format("StateEntry{nodeId='%s', resourceKey=%s, version=%d, bytes=%d, digest=%s, orphaned=%s}",
            nodeId, resourceKey, version, payloadSize(), digest, orphaned);
    }

    /**
     * Byte-wise payload comparison without copying.
     */
    public boolean samePayload(byte[] other) {
        return Arrays.equals(payload, other);
    }
}
