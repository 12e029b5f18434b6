package com.qqsuccubus.fleet.core.msg;

import com.qqsuccubus.fleet.core.model.NodeAddress;
import com.qqsuccubus.fleet.core.model.ResourceRecommendation;
import com.qqsuccubus.fleet.core.util.JsonUtils;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ClusterEventsTest {

    @Test
    void events_carryTypeDiscriminator() {
        ClusterEvents.NodeRegistered registered = ClusterEvents.NodeRegistered.builder()
            .nodeId("a")
            .address(NodeAddress.of("10.0.0.1", 7000))
            .capabilities(Set.of("gpu"))
            .ts(42L)
            .build();

        String json = JsonUtils.writeValueAsString(registered);
        ClusterEvents.ClusterEvent parsed = JsonUtils.readValue(json, ClusterEvents.ClusterEvent.class);

        assertTrue(json.contains("\"type\":\"node-registered\""), json);
        assertEquals(registered, assertInstanceOf(ClusterEvents.NodeRegistered.class, parsed));
    }

    @Test
    void recommendation_isReadableByConsumers() {
        ResourceRecommendation recommendation = ResourceRecommendation.builder()
            .action(ResourceRecommendation.Action.SCALE_DOWN)
            .targetNodeId("n2")
            .reason("Low utilization")
            .averageLoad(6.5)
            .averageMemory(12.0)
            .nodeCount(3)
            .timestampMs(1_000L)
            .build();
        ClusterEvents.RecommendationIssued issued = ClusterEvents.RecommendationIssued.builder()
            .recommendation(recommendation)
            .ts(1_000L)
            .build();

        String json = JsonUtils.writeValueAsString(issued);
        ClusterEvents.RecommendationIssued parsed = assertInstanceOf(ClusterEvents.RecommendationIssued.class,
            JsonUtils.readValue(json, ClusterEvents.ClusterEvent.class));

        assertFalse(json.contains("actionable"), json);
        assertEquals(recommendation, parsed.getRecommendation());
        assertTrue(parsed.getRecommendation().isActionable());
    }
}
