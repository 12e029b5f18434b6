package com.qqsuccubus.fleet.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Advisory reallocation decision computed by the resource optimizer.
 * <p>
 * Consumed by an external provisioning collaborator; the coordinator itself only
 * marks the scale-down target as draining.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
public class ResourceRecommendation {
    @JsonProperty("action")
    Action action;

    /**
     * Node to drain for {@link Action#SCALE_DOWN}, otherwise null.
     */
    @JsonProperty("targetNodeId")
    String targetNodeId;

    @JsonProperty("reason")
    String reason;

    /**
     * Average load of the considered nodes, in percent.
     */
    @JsonProperty("averageLoad")
    double averageLoad;

    /**
     * Average memory usage of the considered nodes, in percent.
     */
    @JsonProperty("averageMemory")
    double averageMemory;

    /**
     * Number of active nodes the decision was based on.
     */
    @JsonProperty("nodeCount")
    int nodeCount;

    @JsonProperty("timestampMs")
    long timestampMs;

    @JsonCreator
    public ResourceRecommendation(
        @JsonProperty("action") Action action,
        @JsonProperty("targetNodeId") String targetNodeId,
        @JsonProperty("reason") String reason,
        @JsonProperty("averageLoad") double averageLoad,
        @JsonProperty("averageMemory") double averageMemory,
        @JsonProperty("nodeCount") int nodeCount,
        @JsonProperty("timestampMs") long timestampMs
    ) {
        this.action = action;
        this.targetNodeId = targetNodeId;
        this.reason = reason;
        this.averageLoad = averageLoad;
        this.averageMemory = averageMemory;
        this.nodeCount = nodeCount;
        this.timestampMs = timestampMs;
    }

    @JsonIgnore
    public boolean isActionable() {
        return action != Action.NONE;
    }

    public enum Action {
        /**
         * Nothing to do.
         */
        NONE,

        /**
         * Provision one additional node.
         */
        SCALE_UP,

        /**
         * Drain {@code targetNodeId} and remove it once idle.
         */
        SCALE_DOWN
    }
}
