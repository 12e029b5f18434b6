package com.qqsuccubus.fleet.core.msg;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.qqsuccubus.fleet.core.model.NodeAddress;
import com.qqsuccubus.fleet.core.model.NodeStatus;
import com.qqsuccubus.fleet.core.model.ResourceRecommendation;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.Set;

/**
 * Lifecycle events emitted by the coordinator to its collaborators
 * (admin dashboard, metrics collector, provisioning tooling).
 */
public final class ClusterEvents {
    private ClusterEvents() {
    }

    /**
     * Common supertype so subscribers can consume a single stream.
     */
    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
    @JsonSubTypes({
        @JsonSubTypes.Type(value = NodeRegistered.class, name = "node-registered"),
        @JsonSubTypes.Type(value = NodeLost.class, name = "node-lost"),
        @JsonSubTypes.Type(value = NodeStatusChanged.class, name = "node-status-changed"),
        @JsonSubTypes.Type(value = RecommendationIssued.class, name = "recommendation-issued")
    })
    public interface ClusterEvent {
        /**
         * @return epoch millis at which the event was issued
         */
        long getTs();
    }

    /**
     * A node joined (or re-joined under the same id) the cluster.
     */
    @Value
    @Builder(toBuilder = true)
    @With
    @JsonTypeName("node-registered")
    public static class NodeRegistered implements ClusterEvent {
        @JsonProperty("nodeId")
        String nodeId;

        @JsonProperty("address")
        NodeAddress address;

        @JsonProperty("capabilities")
        Set<String> capabilities;

        @JsonProperty("ts")
        long ts;

        @JsonCreator
        public NodeRegistered(
            @JsonProperty("nodeId") String nodeId,
            @JsonProperty("address") NodeAddress address,
            @JsonProperty("capabilities") Set<String> capabilities,
            @JsonProperty("ts") long ts
        ) {
            this.nodeId = nodeId;
            this.address = address;
            this.capabilities = capabilities;
            this.ts = ts;
        }
    }

    /**
     * A node left the cluster: evicted by the heartbeat monitor, finished draining,
     * or was unregistered.
     */
    @Value
    @Builder(toBuilder = true)
    @With
    @JsonTypeName("node-lost")
    public static class NodeLost implements ClusterEvent {
        @JsonProperty("nodeId")
        String nodeId;

        /**
         * Why the node was lost, e.g. "heartbeat-timeout", "drained", "unregistered".
         */
        @JsonProperty("reason")
        String reason;

        @JsonProperty("ts")
        long ts;

        @JsonCreator
        public NodeLost(
            @JsonProperty("nodeId") String nodeId,
            @JsonProperty("reason") String reason,
            @JsonProperty("ts") long ts
        ) {
            this.nodeId = nodeId;
            this.reason = reason;
            this.ts = ts;
        }
    }

    /**
     * A node reported new load/status, or was marked draining.
     */
    @Value
    @Builder(toBuilder = true)
    @With
    @JsonTypeName("node-status-changed")
    public static class NodeStatusChanged implements ClusterEvent {
        @JsonProperty("nodeId")
        String nodeId;

        @JsonProperty("load")
        double load;

        @JsonProperty("status")
        NodeStatus status;

        @JsonProperty("ts")
        long ts;

        @JsonCreator
        public NodeStatusChanged(
            @JsonProperty("nodeId") String nodeId,
            @JsonProperty("load") double load,
            @JsonProperty("status") NodeStatus status,
            @JsonProperty("ts") long ts
        ) {
            this.nodeId = nodeId;
            this.load = load;
            this.status = status;
            this.ts = ts;
        }
    }

    /**
     * Output of an optimization cycle.
     */
    @Value
    @Builder(toBuilder = true)
    @With
    @JsonTypeName("recommendation-issued")
    public static class RecommendationIssued implements ClusterEvent {
        @JsonProperty("recommendation")
        ResourceRecommendation recommendation;

        @JsonProperty("ts")
        long ts;

        @JsonCreator
        public RecommendationIssued(
            @JsonProperty("recommendation") ResourceRecommendation recommendation,
            @JsonProperty("ts") long ts
        ) {
            this.recommendation = recommendation;
            this.ts = ts;
        }
    }
}
